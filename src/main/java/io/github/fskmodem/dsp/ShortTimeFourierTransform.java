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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Consumer;

import org.jtransforms.fft.DoubleFFT_1D;

import lombok.Getter;

/**
 * Short-time Fourier transform over a complete sample buffer.
 * <p>
 * Frames start at sample 0 and advance by {@code hopSize} while a full window still fits.
 * Each window is Hann-weighted and zero padded to {@code fftSize} before the transform.
 * Instances hold only immutable tables and may be shared; every call works on its own buffers.
 */
public class ShortTimeFourierTransform {

  @Getter private final int windowSize;
  @Getter private final int hopSize;
  @Getter private final int fftSize;
  private final double[] window;
  private final DoubleFFT_1D fft;

  /**
   * @param windowSize samples per analysis window
   * @param hopSize    samples between consecutive window starts
   * @param fftSize    transform length, {@code >= windowSize}; the window is zero padded
   */
  public ShortTimeFourierTransform(int windowSize, int hopSize, int fftSize) {
    if (windowSize < 2) {
      throw new IllegalArgumentException("windowSize must be at least 2, got " + windowSize);
    }
    if (hopSize < 1) {
      throw new IllegalArgumentException("hopSize must be positive, got " + hopSize);
    }
    if (fftSize < windowSize) {
      throw new IllegalArgumentException("fftSize " + fftSize + " is smaller than windowSize " + windowSize);
    }
    this.windowSize = windowSize;
    this.hopSize = hopSize;
    this.fftSize = fftSize;
    this.window = WindowFunctions.hann(windowSize);
    this.fft = new DoubleFFT_1D(fftSize);
  }

  /** Number of frames produced for a buffer of {@code length} samples. */
  public int frameCount(int length) {
    return length < windowSize ? 0 : (length - windowSize) / hopSize + 1;
  }

  /** Number of magnitude bins per frame. */
  public int binCount() {
    return fftSize / 2 + 1;
  }

  /** Width of one bin in Hz. */
  public double binWidth(double sampleRate) {
    return sampleRate / fftSize;
  }

  /**
   * Transform the whole buffer and collect every frame.
   */
  public List<SpectrumFrame> transform(float[] signal) {
    List<SpectrumFrame> frames = new ArrayList<>(frameCount(signal.length));
    forEachFrame(signal, frames::add);
    return frames;
  }

  /**
   * Transform the whole buffer, handing frames to {@code consumer} in time order.
   * Each frame gets a fresh magnitude array.
   */
  public void forEachFrame(float[] signal, Consumer<SpectrumFrame> consumer) {
    int frames = frameCount(signal.length);
    double[] work = new double[2 * fftSize];
    for (int f = 0; f < frames; f++) {
      int start = f * hopSize;
      consumer.accept(new SpectrumFrame(f, start, magnitudes(signal, start, work)));
    }
  }

  /**
   * Magnitude spectrum of one window starting at {@code start}.
   */
  public double[] magnitudes(float[] signal, int start) {
    return magnitudes(signal, start, new double[2 * fftSize]);
  }

  private double[] magnitudes(float[] signal, int start, double[] work) {
    for (int i = 0; i < windowSize; i++) {
      work[i] = signal[start + i] * window[i];
    }
    Arrays.fill(work, windowSize, work.length, 0.0);
    // interleaved re/im over the full length
    fft.realForwardFull(work);
    double[] mags = new double[binCount()];
    for (int k = 0; k < mags.length; k++) {
      double re = work[2 * k];
      double im = work[2 * k + 1];
      mags[k] = Math.sqrt(re * re + im * im);
    }
    return mags;
  }
}
