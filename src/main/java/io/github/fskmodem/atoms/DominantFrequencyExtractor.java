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
package io.github.fskmodem.atoms;

import io.github.fskmodem.dsp.SpectrumFrame;
import lombok.Getter;

/**
 * Picks the strongest bin of a magnitude spectrum inside a search band and refines it
 * by parabolic interpolation over the log magnitudes of the peak and its neighbours.
 * <p>
 * The band keeps out-of-band noise and harmonics from being picked. Stateless.
 */
public class DominantFrequencyExtractor {

  private static final double LOG_FLOOR = 1e-30;

  private final double sampleRate;
  private final int fftSize;
  @Getter private final int lowBin;
  @Getter private final int highBin;
  private final double minMagnitude;

  /**
   * @param sampleRate   sample rate in Hz
   * @param fftSize      transform length the spectra were computed with
   * @param lowHz        lower edge of the search band
   * @param highHz       upper edge of the search band
   * @param minMagnitude peaks at or below this magnitude count as "no signal"
   */
  public DominantFrequencyExtractor(double sampleRate, int fftSize, double lowHz, double highHz, double minMagnitude) {
    this.sampleRate = sampleRate;
    this.fftSize = fftSize;
    int nyquistBin = fftSize / 2;
    double binWidth = sampleRate / fftSize;
    this.lowBin = Math.max(0, (int) Math.ceil(Math.max(0.0, lowHz) / binWidth));
    this.highBin = Math.min(nyquistBin, (int) Math.floor(highHz / binWidth));
    if (lowBin > highBin) {
      throw new IllegalArgumentException(String.format(
        "search band %.1f..%.1f Hz contains no bin (bin width %.2f Hz)", lowHz, highHz, binWidth));
    }
    this.minMagnitude = minMagnitude;
  }

  /**
   * @return dominant frequency in Hz, or {@code NaN} when the band holds no signal
   */
  public double extractFrequency(double[] magnitudes) {
    return frequencyAt(magnitudes, peakBin(magnitudes));
  }

  /**
   * Turns one STFT frame into a {@link FrequencyFrame}.
   */
  public FrequencyFrame extract(SpectrumFrame frame, int windowSize) {
    double[] mags = frame.getMagnitudes();
    int peak = peakBin(mags);
    double frequency = frequencyAt(mags, peak);
    double magnitude = peak < 0 ? 0.0 : mags[peak];
    return new FrequencyFrame(frame.getIndex(), frame.getStartSample(), windowSize, frequency, magnitude);
  }

  private int peakBin(double[] mags) {
    int best = -1;
    double bestMag = minMagnitude;
    for (int k = lowBin; k <= highBin; k++) {
      if (mags[k] > bestMag) {
        bestMag = mags[k];
        best = k;
      }
    }
    return best;
  }

  /** Interpolated frequency of bin {@code peak}, NaN for no peak. */
  private double frequencyAt(double[] mags, int peak) {
    if (peak < 0) {
      return Double.NaN;
    }
    return (peak + interpolate(mags, peak)) * sampleRate / fftSize;
  }

  /** Sub-bin offset in [-0.5, 0.5]. */
  private static double interpolate(double[] mags, int k) {
    if (k <= 0 || k >= mags.length - 1) {
      return 0.0;
    }
    double a = Math.log(Math.max(mags[k - 1], LOG_FLOOR));
    double b = Math.log(Math.max(mags[k], LOG_FLOOR));
    double c = Math.log(Math.max(mags[k + 1], LOG_FLOOR));
    double denom = a - 2.0 * b + c;
    if (denom >= 0.0) {
      return 0.0; // not a local maximum (band edge)
    }
    double p = 0.5 * (a - c) / denom;
    return Math.max(-0.5, Math.min(0.5, p));
  }
}
