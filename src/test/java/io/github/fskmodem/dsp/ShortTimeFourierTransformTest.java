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
package io.github.fskmodem.dsp;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class ShortTimeFourierTransformTest {

  @ParameterizedTest(name = "len={0} window={1} hop={2} -> {3} frames")
  @CsvSource({
    "1000, 100, 50, 19",
    "99, 100, 50, 0",
    "100, 100, 50, 1",
    "1764, 220, 55, 29",
    "0, 2, 1, 0"
  })
  void testFrameCount(int length, int window, int hop, int frames) {
    ShortTimeFourierTransform stft = new ShortTimeFourierTransform(window, hop, window);
    assertEquals(frames, stft.frameCount(length));
    assertEquals(frames, stft.transform(new float[length]).size());
  }

  @Test
  @DisplayName("Frames start at multiples of the hop size")
  void testFrameOffsets() {
    ShortTimeFourierTransform stft = new ShortTimeFourierTransform(64, 16, 128);
    List<SpectrumFrame> frames = stft.transform(new float[200]);
    for (int i = 0; i < frames.size(); i++) {
      assertEquals(i, frames.get(i).getIndex());
      assertEquals(i * 16, frames.get(i).getStartSample());
      assertEquals(stft.binCount(), frames.get(i).getMagnitudes().length);
    }
    assertEquals(65, stft.binCount());
    assertEquals(62.5, stft.binWidth(8000), 1e-12);
  }

  @Test
  @DisplayName("A bin-centred tone peaks in its own bin")
  void testTonePeak() {
    int sampleRate = 8000;
    ShortTimeFourierTransform stft = new ShortTimeFourierTransform(256, 128, 256);
    float[] signal = new float[1024];
    for (int i = 0; i < signal.length; i++) {
      signal[i] = (float) Math.sin(2 * Math.PI * 1000 * i / sampleRate);
    }
    int expectedBin = (int) Math.round(1000 / stft.binWidth(sampleRate));
    assertEquals(32, expectedBin);
    for (SpectrumFrame frame : stft.transform(signal)) {
      double[] m = frame.getMagnitudes();
      int best = 0;
      for (int k = 1; k < m.length; k++) {
        if (m[k] > m[best]) {
          best = k;
        }
      }
      assertEquals(expectedBin, best);
      // coherent gain of a Hann window is N/4 for a unit sine
      assertEquals(64.0, m[best], 1.0);
    }
  }

  @Test
  void testMagnitudesAtOffset() {
    ShortTimeFourierTransform stft = new ShortTimeFourierTransform(4, 1, 8);
    float[] signal = {0, 0, 0, 0, 1, 1, 1, 1};
    double[] silent = stft.magnitudes(signal, 0);
    for (double v : silent) {
      assertEquals(0.0, v);
    }
    double[] dc = stft.magnitudes(signal, 4);
    // periodic Hann of length 4 sums to 2
    assertEquals(2.0, dc[0], 1e-9);
    assertTrue(dc[0] >= dc[dc.length - 1]);
  }

  @Test
  void testInvalid() {
    assertThrows(IllegalArgumentException.class, () -> new ShortTimeFourierTransform(1, 1, 4));
    assertThrows(IllegalArgumentException.class, () -> new ShortTimeFourierTransform(8, 0, 8));
    assertThrows(IllegalArgumentException.class, () -> new ShortTimeFourierTransform(8, 2, 4));
  }
}
