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

/**
 * Analysis windows. All return {@code n} coefficients.
 */
public final class WindowFunctions {
  private WindowFunctions() {}

  /** Periodic Hann window, the usual choice for overlapping STFT frames. */
  public static double[] hann(int n) {
    double[] w = new double[n];
    for (int i = 0; i < n; i++) {
      w[i] = 0.5 - 0.5 * Math.cos(2.0 * Math.PI * i / n);
    }
    return w;
  }

  /** Symmetric Hamming window. */
  public static double[] hamming(int n) {
    double[] w = new double[n];
    if (n == 1) {
      w[0] = 1.0;
      return w;
    }
    for (int i = 0; i < n; i++) {
      w[i] = 0.54 - 0.46 * Math.cos(2.0 * Math.PI * i / (n - 1));
    }
    return w;
  }

  /** Smallest power of two that is {@code >= n}. */
  public static int nextPowerOfTwo(int n) {
    if (n <= 1) {
      return 1;
    }
    int p = Integer.highestOneBit(n - 1) << 1;
    if (p <= 0) {
      throw new IllegalArgumentException("n too large: " + n);
    }
    return p;
  }
}
