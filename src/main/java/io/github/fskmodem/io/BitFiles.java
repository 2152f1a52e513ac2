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

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import io.github.fskmodem.util.BitSequence;

/**
 * Bit sequences stored as text: {@code '0'} and {@code '1'} characters, whitespace and
 * line breaks ignored.
 */
public final class BitFiles {

  private BitFiles() {}

  /**
   * @throws io.github.fskmodem.InputFormatException on any character other than 0, 1 or whitespace
   */
  public static BitSequence read(Path path) throws IOException {
    String text = Files.readString(path, StandardCharsets.UTF_8);
    StringBuilder bits = new StringBuilder(text.length());
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (!Character.isWhitespace(c)) {
        bits.append(c);
      }
    }
    return BitSequence.parse(bits);
  }

  public static void write(Path path, BitSequence bits) throws IOException {
    Files.writeString(path, bits.toString() + System.lineSeparator(), StandardCharsets.UTF_8);
  }
}
