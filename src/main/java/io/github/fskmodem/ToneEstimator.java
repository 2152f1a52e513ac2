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
package io.github.fskmodem;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.jtransforms.fft.DoubleFFT_1D;

import io.github.fskmodem.dsp.SpectralPeak;
import io.github.fskmodem.dsp.WindowFunctions;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Estimates the two FSK tones of a recording without knowing the modulation parameters.
 * <p>
 * One transform over the whole buffer (DC removed, Hamming window); the strongest spectral
 * peaks are taken as the mark and space tones.
 */
@Slf4j
public final class ToneEstimator {

  private ToneEstimator() {}

  /**
   * Centre and deviation derived from the two strongest tones.
   */
  @Getter
  public static final class ToneEstimate {
    private final double centerFrequency;
    private final double deviation;
    private final List<SpectralPeak> peaks;

    ToneEstimate(double centerFrequency, double deviation, List<SpectralPeak> peaks) {
      this.centerFrequency = centerFrequency;
      this.deviation = deviation;
      this.peaks = List.copyOf(peaks);
    }

    public double getSpaceFrequency() {
      return centerFrequency - deviation;
    }

    public double getMarkFrequency() {
      return centerFrequency + deviation;
    }

    @Override
    public String toString() {
      return String.format("center %.2f Hz, deviation %.2f Hz (%.2f..%.2f Hz)",
        centerFrequency, deviation, getSpaceFrequency(), getMarkFrequency());
    }
  }

  /**
   * Estimate centre and deviation from the two strongest peaks, at least two bins apart.
   *
   * @return empty when fewer than two peaks are found
   */
  public static Optional<ToneEstimate> estimate(float[] samples, int sampleRate) {
    return estimate(samples, sampleRate, 0.0);
  }

  /**
   * @param minSpacingHz peaks closer than this to a stronger one are discarded;
   *                     values below two bins are raised to two bins
   */
  public static Optional<ToneEstimate> estimate(float[] samples, int sampleRate, double minSpacingHz) {
    List<SpectralPeak> peaks = dominantFrequencies(samples, sampleRate, 2, minSpacingHz);
    if (peaks.size() < 2) {
      log.debug("Found {} spectral peak(s), need 2 for an estimate", peaks.size());
      return Optional.empty();
    }
    double f1 = peaks.get(0).getFrequency();
    double f2 = peaks.get(1).getFrequency();
    return Optional.of(new ToneEstimate((f1 + f2) / 2.0, Math.abs(f1 - f2) / 2.0, peaks));
  }

  /**
   * The {@code n} strongest local maxima of the buffer's spectrum, strongest first.
   *
   * @param samples      whole recording
   * @param sampleRate   sample rate in Hz
   * @param n            maximum number of peaks
   * @param minSpacingHz minimum distance to any stronger peak already taken
   */
  public static List<SpectralPeak> dominantFrequencies(float[] samples, int sampleRate, int n, double minSpacingHz) {
    Objects.requireNonNull(samples, "samples");
    if (sampleRate <= 0) {
      throw new ConfigurationException("sampleRate must be positive, got " + sampleRate);
    }
    if (n < 1) {
      throw new ConfigurationException("n must be positive, got " + n);
    }
    if (samples.length < 4) {
      return List.of();
    }
    double[] mags = spectrum(samples);
    double binWidth = (double) sampleRate / samples.length;
    double spacing = Math.max(minSpacingHz, 2.0 * binWidth);

    List<Integer> candidates = new ArrayList<>();
    for (int k = 1; k < mags.length - 1; k++) {
      if (mags[k] > 0.0 && mags[k] >= mags[k - 1] && mags[k] > mags[k + 1]) {
        candidates.add(k);
      }
    }
    candidates.sort(Comparator.comparingDouble((Integer k) -> mags[k]).reversed());

    List<SpectralPeak> peaks = new ArrayList<>();
    for (int k : candidates) {
      double freq = k * binWidth;
      boolean tooClose = false;
      for (SpectralPeak p : peaks) {
        if (Math.abs(p.getFrequency() - freq) < spacing) {
          tooClose = true;
          break;
        }
      }
      if (!tooClose) {
        peaks.add(new SpectralPeak(freq, mags[k]));
        if (peaks.size() == n) {
          break;
        }
      }
    }
    return peaks;
  }

  /** Magnitudes from DC to Nyquist of the DC-free, Hamming-weighted buffer. */
  private static double[] spectrum(float[] samples) {
    int len = samples.length;
    double mean = 0.0;
    for (float s : samples) {
      mean += s;
    }
    mean /= len;
    double[] window = WindowFunctions.hamming(len);
    double[] work = new double[2 * len];
    for (int i = 0; i < len; i++) {
      work[i] = (samples[i] - mean) * window[i];
    }
    new DoubleFFT_1D(len).realForwardFull(work);
    double[] mags = new double[len / 2 + 1];
    for (int k = 0; k < mags.length; k++) {
      mags[k] = Math.hypot(work[2 * k], work[2 * k + 1]);
    }
    return mags;
  }
}
