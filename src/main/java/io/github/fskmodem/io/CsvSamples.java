/*
 * This file is licensed under the GNU General Public License v3.0.
 *
 * You may obtain a copy of the License at
 * https://www.gnu.org/licenses/gpl-3.0.html
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.
 * See the GNU General Public License for more details.
 */
package io.github.fskmodem.io;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;

import io.github.fskmodem.InputFormatException;

/**
 * Raw amplitude values as CSV: one sample per line when writing, one column when reading.
 */
public final class CsvSamples {

  private CsvSamples() {}

  public static void write(Path path, float[] samples) throws IOException {
    Objects.requireNonNull(samples, "samples");
    try (BufferedWriter w = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
      for (float s : samples) {
        w.write(Float.toString(s));
        w.newLine();
      }
    }
  }

  /**
   * Read column {@code column} (0-based) of a CSV file.
   * A non-numeric first line is treated as a header; blank lines are skipped.
   *
   * @throws InputFormatException on a missing column, a non-numeric or a non-finite value
   */
  public static float[] read(Path path, int column) throws IOException {
    if (column < 0) {
      throw new IllegalArgumentException("column must not be negative: " + column);
    }
    float[] out = new float[1024];
    int n = 0;
    int lineNo = 0;
    boolean firstRow = true;
    try (BufferedReader r = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      String line;
      while ((line = r.readLine()) != null) {
        lineNo++;
        if (line.isBlank()) {
          continue;
        }
        String[] cells = line.split(",", -1);
        if (column >= cells.length) {
          throw new InputFormatException(String.format("%s:%d has no column %d", path, lineNo, column));
        }
        String cell = cells[column].trim();
        boolean header = firstRow;
        firstRow = false;
        float v;
        try {
          v = Float.parseFloat(cell);
        } catch (NumberFormatException e) {
          if (header) {
            continue;
          }
          throw new InputFormatException(String.format("%s:%d: '%s' is not a number", path, lineNo, cell), e);
        }
        if (!Float.isFinite(v)) {
          throw new InputFormatException(String.format(Locale.ROOT, "%s:%d: sample %s is not finite", path, lineNo, cell));
        }
        if (n == out.length) {
          out = Arrays.copyOf(out, n * 2);
        }
        out[n++] = v;
      }
    }
    return Arrays.copyOf(out, n);
  }
}
