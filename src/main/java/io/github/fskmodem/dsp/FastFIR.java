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

import java.util.Arrays;

/**
 * Transposed direct-form FIR.
 * - O(M) per sample, no modulo
 * - b[] are taps, z[] is state (length = M-1)
 *
 * y[n] = b0*x[n] + z0
 * z0'  = z1 + b1*x[n]
 * ...
 * zM-2'= b(M-1)*x[n]
 *
 * Not thread-safe because of the delay line; {@link #filterAligned(float[])} works on a private copy.
 */
public final class FastFIR {
  private final float[] b; // taps
  private final float[] z; // state (M-1)

  public FastFIR(float[] taps) {
    if (taps == null || taps.length == 0) {
      throw new IllegalArgumentException("taps must be non-empty");
    }
    this.b = taps.clone();
    this.z = new float[Math.max(0, b.length - 1)];
  }

  /** Filter one sample. */
  public float filter(float x) {
    float y = b[0] * x + (z.length > 0 ? z[0] : 0f);
    for (int k = 1; k < b.length - 1; k++) {
      z[k - 1] = z[k] + b[k] * x;
    }
    if (b.length > 1) {
      z[b.length - 2] = b[b.length - 1] * x;
    }
    return y;
  }

  /** Delay in samples of a symmetric (linear-phase) design. */
  public int groupDelay() {
    return (b.length - 1) / 2;
  }

  /**
   * Filter a complete buffer and shift the output back by the group delay, so that
   * {@code out[i]} lines up with {@code in[i]}. The input is zero extended at both ends.
   */
  public float[] filterAligned(float[] in) {
    FastFIR fir = new FastFIR(b);
    int delay = groupDelay();
    float[] out = new float[in.length];
    for (int n = 0; n < in.length + delay; n++) {
      float y = fir.filter(n < in.length ? in[n] : 0f);
      if (n >= delay) {
        out[n - delay] = y;
      }
    }
    return out;
  }

  /** Clear internal state. */
  public void reset() {
    Arrays.fill(z, 0f);
  }

  public int length() {
    return b.length;
  }
}
