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
import java.util.List;
import java.util.Objects;

import io.github.fskmodem.atoms.BitBoundarySynchronizer;
import io.github.fskmodem.atoms.BitDecision;
import io.github.fskmodem.atoms.DominantFrequencyExtractor;
import io.github.fskmodem.atoms.FrequencyFrame;
import io.github.fskmodem.atoms.ToneClassifier;
import io.github.fskmodem.dsp.FastFIR;
import io.github.fskmodem.dsp.FilterDesignUtils;
import io.github.fskmodem.dsp.ShortTimeFourierTransform;
import io.github.fskmodem.dsp.WindowFunctions;
import io.github.fskmodem.util.BitSequence;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Binary FSK demodulator working on a complete sample buffer.
 * <p>
 * Pipeline: optional band-pass pre-filter, short-time Fourier transform, per-frame dominant
 * frequency, bit windows anchored at sample 0, midpoint classification.
 * The buffer must start on the first bit boundary and be demodulated with the same
 * {@link ModulationParameters} it was modulated with.
 * <p>
 * All configuration is resolved and checked in the constructor. Instances hold no mutable
 * state and may be shared across threads; the listener must then be thread-safe too.
 */
@Slf4j
public class FskDemodulator {

  @Getter private final ModulationParameters parameters;
  @Getter private final int windowSize;
  @Getter private final int hopSize;
  @Getter private final int fftSize;
  @Getter private final double searchMargin;
  private final DemodulationListener listener;
  private final ShortTimeFourierTransform stft;
  private final DominantFrequencyExtractor extractor;
  private final BitBoundarySynchronizer synchronizer;
  private final ToneClassifier classifier;
  private final float[] prefilterTaps;

  static final int MAX_AUTO_PREFILTER_TAPS = 101;

  public FskDemodulator(ModulationParameters parameters) {
    this(parameters, DemodulatorConfig.DEFAULT, DemodulationListener.NONE);
  }

  public FskDemodulator(ModulationParameters parameters, DemodulatorConfig config) {
    this(parameters, config, DemodulationListener.NONE);
  }

  /**
   * @param parameters tones, baud rate and sample rate, as used when modulating
   * @param config     analysis settings
   * @param listener   receives frames and bit decisions
   * @throws ConfigurationException if the analysis settings cannot resolve every bit
   */
  public FskDemodulator(ModulationParameters parameters, DemodulatorConfig config, DemodulationListener listener) {
    this.parameters = Objects.requireNonNull(parameters, "parameters");
    Objects.requireNonNull(config, "config");
    this.listener = Objects.requireNonNull(listener, "listener");
    int spb = parameters.getSamplesPerBit();
    int minWindow = minimumWindow(parameters);
    if (minWindow > spb) {
      throw new ConfigurationException(String.format(
        "%d samples per bit cannot separate %.1f Hz from %.1f Hz at %d Hz: a window needs at least %d samples",
        spb, parameters.getSpaceFrequency(), parameters.getMarkFrequency(), parameters.getSampleRate(), minWindow));
    }
    this.windowSize = config.getWindowSize() > 0 ? config.getWindowSize() : autoWindow(spb, minWindow);
    this.hopSize = config.getHopSize() > 0 ? config.getHopSize()
      : Math.max(1, Math.min(windowSize / 4, (spb - windowSize) / 4));
    this.fftSize = config.getFftSize() > 0 ? config.getFftSize() : 4 * WindowFunctions.nextPowerOfTwo(windowSize);
    this.searchMargin = config.getSearchMargin() > 0 ? config.getSearchMargin() : parameters.getDeviation();
    validate(config, spb, minWindow);

    double sampleRate = parameters.getSampleRate();
    double space = parameters.getSpaceFrequency();
    double mark = parameters.getMarkFrequency();
    try {
      this.stft = new ShortTimeFourierTransform(windowSize, hopSize, fftSize);
      this.extractor = new DominantFrequencyExtractor(sampleRate, fftSize,
        Math.max(0.0, space - searchMargin), Math.min(sampleRate / 2.0, mark + searchMargin), config.getMinMagnitude());
      this.synchronizer = new BitBoundarySynchronizer(spb, config.getAggregation(), config.getRelativeThreshold());
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("Invalid analysis configuration: " + e.getMessage(), e);
    }
    this.classifier = new ToneClassifier(space, mark);
    if (config.isPrefilter()) {
      // band edges kept strictly inside (0, nyquist)
      double low = Math.max(space - searchMargin, space / 2.0);
      double high = Math.min(mark + searchMargin, (mark + sampleRate / 2.0) / 2.0);
      int taps = config.getPrefilterTaps() > 0 ? config.getPrefilterTaps()
        : Math.min(MAX_AUTO_PREFILTER_TAPS, Math.max(3, spb / 4) | 1);
      this.prefilterTaps = FilterDesignUtils.designBandPassKaiser(
        taps, low, high, sampleRate, config.getPrefilterAttenuation());
    } else {
      this.prefilterTaps = null;
    }
  }

  /**
   * Shortest analysis window that still tells the two tones apart: half a period of the space
   * tone, and long enough for the tones to drift half a cycle apart ({@code 2 * deviation * window
   * / sampleRate >= 0.5}).
   */
  static int minimumWindow(ModulationParameters parameters) {
    double sampleRate = parameters.getSampleRate();
    int halfPeriod = (int) Math.ceil(sampleRate / (2.0 * parameters.getSpaceFrequency()));
    int separation = (int) Math.ceil(sampleRate / (4.0 * parameters.getDeviation()));
    return Math.max(2, Math.max(halfPeriod, separation));
  }

  // half a bit gives several frames per bit; short bits get one window spanning the whole bit
  private static int autoWindow(int spb, int minWindow) {
    return spb / 2 >= 2 * minWindow ? spb / 2 : spb;
  }

  private void validate(DemodulatorConfig config, int spb, int minWindow) {
    if (windowSize < minWindow) {
      throw new ConfigurationException(String.format(
        "windowSize %d is too short to separate %.1f Hz from %.1f Hz at %d Hz (min %d)",
        windowSize, parameters.getSpaceFrequency(), parameters.getMarkFrequency(), parameters.getSampleRate(),
        minWindow));
    }
    if (windowSize > spb) {
      throw new ConfigurationException(String.format(
        "windowSize %d exceeds %d samples per bit: no frame fits inside a bit", windowSize, spb));
    }
    if (hopSize > spb - windowSize + 1) {
      throw new ConfigurationException(String.format(
        "hopSize %d too large for windowSize %d and %d samples per bit: some bits would get no frame (max %d)",
        hopSize, windowSize, spb, spb - windowSize + 1));
    }
    if (fftSize < windowSize) {
      throw new ConfigurationException("fftSize " + fftSize + " is smaller than windowSize " + windowSize);
    }
    if (config.isPrefilter() && config.getPrefilterTaps() != 0 && config.getPrefilterTaps() < 3) {
      throw new ConfigurationException("prefilterTaps must be at least 3, got " + config.getPrefilterTaps());
    }
    if (config.getRelativeThreshold() < 0.0 || config.getRelativeThreshold() >= 1.0) {
      throw new ConfigurationException("relativeThreshold must be in [0, 1), got " + config.getRelativeThreshold());
    }
    if (config.getAggregation() == null) {
      throw new ConfigurationException("aggregation must be set");
    }
  }

  /**
   * Decode the buffer, failing when any bit cannot be recovered.
   *
   * @throws InputFormatException       on non-finite samples
   * @throws IncompleteDecodeException  when a bit window holds no usable frame
   */
  public BitSequence decode(float[] samples) {
    return demodulate(samples).bits();
  }

  /**
   * Decode the buffer, reporting missing positions in the result instead of failing.
   *
   * @throws InputFormatException on non-finite samples
   */
  public DecodeResult demodulate(float[] samples) {
    Objects.requireNonNull(samples, "samples");
    checkFinite(samples);
    if (samples.length == 0) {
      return DecodeResult.empty();
    }
    List<FrequencyFrame> frames = frequencyFrames(samples);
    List<BitDecision> decisions = synchronizer.decode(frames, samples.length, classifier);
    for (BitDecision d : decisions) {
      if (d.isMissing()) {
        listener.onMissingBit(d.getIndex(), d.getStartSample());
      } else {
        listener.onBitDecision(d);
      }
    }
    DecodeResult result = new DecodeResult(decisions);
    if (log.isTraceEnabled()) {
      log.trace("Demodulated {} samples into {} frames and {} bits ({} missing)",
        samples.length, frames.size(), result.size(), result.getMissingPositions().size());
    }
    return result;
  }

  /**
   * Dominant frequency of every analysis frame, after the optional pre-filter.
   */
  public List<FrequencyFrame> frequencyFrames(float[] samples) {
    float[] signal = prefilterTaps != null ? new FastFIR(prefilterTaps).filterAligned(samples) : samples;
    List<FrequencyFrame> frames = new ArrayList<>(stft.frameCount(signal.length));
    stft.forEachFrame(signal, spectrum -> {
      FrequencyFrame frame = extractor.extract(spectrum, windowSize);
      listener.onFrame(frame);
      frames.add(frame);
    });
    return frames;
  }

  private static void checkFinite(float[] samples) {
    for (int i = 0; i < samples.length; i++) {
      if (!Float.isFinite(samples[i])) {
        throw new InputFormatException("Sample " + i + " is not finite: " + samples[i]);
      }
    }
  }
}
