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
 * FIR tap designers used by the demodulator front end.
 */
public final class FilterDesignUtils {
  private FilterDesignUtils() {}

  /**
   * Band-pass via difference of two windowed sincs (Kaiser window). Pass (lowHz..highHz).
   * Taps are normalised to unity gain at the band centre; an even tap count is bumped to odd.
   */
  public static float[] designBandPassKaiser(int numTaps, double lowHz, double highHz, double sampleRate, double attenuationDb) {
    if (lowHz <= 0 || highHz <= lowHz || highHz >= sampleRate / 2) {
      throw new IllegalArgumentException(String.format(
        "invalid band %.1f..%.1f Hz for sample rate %.1f Hz", lowHz, highHz, sampleRate));
    }
    if ((numTaps & 1) == 0) {
      numTaps++;
    }
    float[] h = new float[numTaps];
    double fl = lowHz / sampleRate;
    double fh = highHz / sampleRate;
    int mid = numTaps / 2;
    double beta = kaiserBeta(attenuationDb);
    double denom = besselI0(beta);

    for (int i = 0; i < numTaps; i++) {
      int n = i - mid;
      double sincH = (n == 0)
        ? 2.0 * fh
        : Math.sin(2.0 * Math.PI * fh * n) / (Math.PI * n);
      double sincL = (n == 0)
        ? 2.0 * fl
        : Math.sin(2.0 * Math.PI * fl * n) / (Math.PI * n);
      double r = (numTaps == 1) ? 0.0 : (2.0 * i) / (numTaps - 1) - 1.0;
      double w = besselI0(beta * Math.sqrt(1.0 - r * r)) / denom;
      h[i] = (float) ((sincH - sincL) * w);
    }
    normalizeGainAt(h, (lowHz + highHz) / 2.0, sampleRate);
    return h;
  }

  // ---------- helpers ----------

  /** Magnitude of the frequency response at {@code freqHz}. */
  public static double gainAt(float[] taps, double freqHz, double sampleRate) {
    double omega = 2.0 * Math.PI * freqHz / sampleRate;
    double re = 0.0;
    double im = 0.0;
    for (int n = 0; n < taps.length; n++) {
      re += taps[n] * Math.cos(omega * n);
      im -= taps[n] * Math.sin(omega * n);
    }
    return Math.hypot(re, im);
  }

  /** Scale taps so the gain at {@code freqHz} is 1. */
  public static void normalizeGainAt(float[] taps, double freqHz, double sampleRate) {
    double g = gainAt(taps, freqHz, sampleRate);
    if (g == 0.0) {
      return;
    }
    float inv = (float) (1.0 / g);
    for (int i = 0; i < taps.length; i++) {
      taps[i] *= inv;
    }
  }

  /** Kaiser window beta from desired stopband attenuation (dB). */
  public static double kaiserBeta(double attenuationDb) {
    if (attenuationDb > 50.0) {
      return 0.1102 * (attenuationDb - 8.7);
    } else if (attenuationDb >= 21.0) {
      return 0.5842 * Math.pow(attenuationDb - 21.0, 0.4)
        + 0.07886 * (attenuationDb - 21.0);
    } else {
      return 0.0;
    }
  }

  /** Zeroth-order modified Bessel function of the first kind (I0), series approx. */
  public static double besselI0(double x) {
    double sum = 1.0;
    double y = (x * x) / 4.0;
    double term = y;
    for (int k = 1; k < 30; k++) { // converged long before k = 30 for beta < 15
      sum += term;
      term *= y / ((k + 1.0) * (k + 1.0));
    }
    return sum;
  }
}
