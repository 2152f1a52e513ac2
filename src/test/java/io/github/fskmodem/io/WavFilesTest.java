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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import io.github.fskmodem.FskDemodulator;
import io.github.fskmodem.FskModulator;
import io.github.fskmodem.InputFormatException;
import io.github.fskmodem.ModulationParameters;
import io.github.fskmodem.util.BitSequence;

class WavFilesTest {

  @TempDir
  Path dir;

  @Test
  @DisplayName("16-bit mono file keeps rate, length and samples")
  void testWriteRead() throws IOException {
    float[] samples = {0f, 0.5f, -0.5f, 1f, -1f, 2f, 0.25f};
    Path file = dir.resolve("test.wav");
    WavFiles.write(file, samples, 22_050);
    WavAudio audio = WavFiles.read(file);
    assertEquals(22_050, audio.getSampleRate());
    assertEquals(samples.length, audio.getSamples().length);
    for (int i = 0; i < samples.length; i++) {
      float expected = Math.max(-1f, Math.min(1f, samples[i]));
      assertEquals(expected, audio.getSamples()[i], 1e-3f);
    }
    assertEquals(samples.length / 22_050.0, audio.getDurationSeconds(), 1e-12);
  }

  @Test
  @DisplayName("Modulated file decodes after 16-bit quantisation")
  void testModulatedFile() throws IOException {
    ModulationParameters params = ModulationParameters.DEFAULT;
    BitSequence bits = BitSequence.parse("1011001110");
    Path file = dir.resolve("fsk.wav");
    WavFiles.write(file, new FskModulator(params).modulate(bits), params.getSampleRate());
    WavAudio audio = WavFiles.read(file);
    assertEquals(bits, new FskDemodulator(params.withSampleRate(audio.getSampleRate())).decode(audio.getSamples()));
  }

  @Test
  void testNotAWav() throws IOException {
    Path file = dir.resolve("bogus.wav");
    Files.writeString(file, "definitely not RIFF data");
    assertThrows(InputFormatException.class, () -> WavFiles.read(file));
  }
}
