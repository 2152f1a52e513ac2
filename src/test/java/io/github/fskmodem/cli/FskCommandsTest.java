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
package io.github.fskmodem.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import io.github.fskmodem.FskModulator;
import io.github.fskmodem.ModulationParameters;
import io.github.fskmodem.io.CsvSamples;
import io.github.fskmodem.util.BitSequence;

class FskCommandsTest {

  @TempDir
  Path dir;

  private ByteArrayOutputStream buffer;
  private FskCommands commands;

  @BeforeEach
  void setUp() {
    buffer = new ByteArrayOutputStream();
    commands = new FskCommands(new PrintStream(buffer, true, StandardCharsets.UTF_8));
  }

  private int run(String... args) {
    return commands.run(args);
  }

  private String output() {
    return buffer.toString(StandardCharsets.UTF_8).trim();
  }

  @Test
  @DisplayName("encode then decode through WAV and CSV")
  void testEncodeDecode() {
    Path wav = dir.resolve("out.wav");
    Path csv = dir.resolve("out.csv");
    assertEquals(FskCommands.EXIT_OK, run("encode", "1011", "--output", wav.toString(), "--csv", csv.toString()));
    assertTrue(Files.exists(wav));
    assertTrue(Files.exists(csv));

    assertEquals(FskCommands.EXIT_OK, run("decode", wav.toString()));
    assertEquals("1011", output());

    buffer.reset();
    assertEquals(FskCommands.EXIT_OK, run("decode", csv.toString(), "--aggregation", "mean", "--no-filter"));
    assertEquals("1011", output());
  }

  @Test
  @DisplayName("Custom tones and baud rate must be repeated when decoding")
  void testCustomParameters() throws IOException {
    Path bits = dir.resolve("bits.txt");
    Files.writeString(bits, "0110 1001\n");
    Path wav = dir.resolve("custom.wav");
    assertEquals(FskCommands.EXIT_OK, run("encode", "--bits-file", bits.toString(), "--frequency", "2000",
      "--deviation", "500", "--baud-rate", "300", "--sample-rate", "48000", "--output", wav.toString()));
    assertEquals(FskCommands.EXIT_OK, run("decode", wav.toString(), "--frequency=2000", "--deviation=500",
      "--baud-rate=300"));
    assertEquals("01101001", output());
  }

  @Test
  @DisplayName("Missing bit positions give the incomplete exit code")
  void testIncomplete() throws IOException {
    ModulationParameters params = ModulationParameters.DEFAULT;
    float[] signal = new FskModulator(params).modulate(BitSequence.parse("101"));
    Arrays.fill(signal, params.getSamplesPerBit(), 2 * params.getSamplesPerBit(), 0f);
    Path csv = dir.resolve("gap.csv");
    CsvSamples.write(csv, signal);
    assertEquals(FskCommands.EXIT_INCOMPLETE, run("decode", csv.toString()));
    assertEquals("1?1", output());
  }

  @Test
  void testEstimate() {
    Path wav = dir.resolve("alt.wav");
    assertEquals(FskCommands.EXIT_OK, run("encode", "01010101010101010101", "--output", wav.toString()));
    assertEquals(FskCommands.EXIT_OK, run("estimate", wav.toString(), "--min-spacing", "500"));
    assertTrue(output().startsWith("center="), output());
  }

  @Test
  void testUsageErrors() {
    assertEquals(FskCommands.EXIT_USAGE, run());
    assertEquals(FskCommands.EXIT_USAGE, run("transmit", "1011"));
    assertEquals(FskCommands.EXIT_USAGE, run("encode", "1011", "--volume", "3"));
    assertEquals(FskCommands.EXIT_USAGE, run("decode"));
    assertEquals(FskCommands.EXIT_USAGE, run("decode", "x.csv", "--aggregation", "mode"));
    assertEquals(FskCommands.EXIT_USAGE, run("decode", "x.csv", "--column", "-1"));
    assertTrue(output().contains("usage:"));
  }

  @Test
  void testInputAndConfigurationErrors() {
    Path wav = dir.resolve("never.wav");
    assertEquals(FskCommands.EXIT_ERROR, run("encode", "10a1", "--output", wav.toString()));
    assertEquals(FskCommands.EXIT_ERROR, run("encode", "1011", "--sample-rate", "8000", "--output", wav.toString()));
    assertEquals(FskCommands.EXIT_ERROR, run("decode", dir.resolve("missing.wav").toString()));
  }

  @Test
  void testFormatting() {
    assertEquals("10.00 kHz", FskCommands.formatFrequency(10_000));
    assertEquals("950.00 Hz", FskCommands.formatFrequency(950));
    assertEquals("1.50 MHz", FskCommands.formatFrequency(1_500_000));
    assertEquals("2.5000 K", FskCommands.formatMagnitude(2500));
    assertEquals("0.5000", FskCommands.formatMagnitude(0.5));
  }
}
