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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class FastFIRTest {

  @Test
  @DisplayName("Streaming output is the convolution with the taps")
  void testImpulseResponse() {
    float[] taps = {0.25f, 0.5f, 0.25f};
    FastFIR fir = new FastFIR(taps);
    float[] out = new float[5];
    for (int i = 0; i < out.length; i++) {
      out[i] = fir.filter(i == 0 ? 1f : 0f);
    }
    assertArrayEquals(new float[] {0.25f, 0.5f, 0.25f, 0f, 0f}, out, 1e-7f);
    assertEquals(1, fir.groupDelay());
    assertEquals(3, fir.length());
  }

  @Test
  void testReset() {
    FastFIR fir = new FastFIR(new float[] {0f, 1f});
    fir.filter(5f);
    fir.reset();
    assertEquals(0f, fir.filter(0f));
  }

  @Test
  @DisplayName("Aligned filtering removes the group delay")
  void testAligned() {
    float[] taps = {0.25f, 0.5f, 0.25f};
    float[] in = {0, 0, 4, 0, 0};
    float[] out = new FastFIR(taps).filterAligned(in);
    assertArrayEquals(new float[] {0, 1, 2, 1, 0}, out, 1e-6f);
  }

  @Test
  @DisplayName("In-band tone passes through the band-pass unchanged")
  void testAlignedBandPassTone() {
    double fs = 44_100;
    float[] taps = FilterDesignUtils.designBandPassKaiser(101, 9000, 11000, fs, 60);
    float[] in = new float[2000];
    for (int i = 0; i < in.length; i++) {
      in[i] = (float) Math.sin(2 * Math.PI * 10_000 * i / fs);
    }
    FastFIR fir = new FastFIR(taps);
    float[] out = fir.filterAligned(in);
    assertEquals(in.length, out.length);
    for (int i = 200; i < 1800; i++) {
      assertEquals(in[i], out[i], 2e-3);
    }
    // the instance itself keeps no state from aligned filtering
    assertEquals(taps[0], fir.filter(1f), 1e-9);
  }

  @Test
  void testEmptyTaps() {
    assertThrows(IllegalArgumentException.class, () -> new FastFIR(new float[0]));
  }
}
