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

import io.github.fskmodem.atoms.FrequencyAggregation;
import lombok.Builder;
import lombok.Getter;

/**
 * Analysis settings of {@link FskDemodulator}. Zero means "derive from the modulation parameters":
 * <ul>
 *   <li>{@code windowSize}: half a bit, or the whole bit when half a bit is too short for the tones</li>
 *   <li>{@code hopSize}: a quarter window, shrinking to 1 as the window approaches the bit length</li>
 *   <li>{@code fftSize}: four times the next power of two of the window (zero padding)</li>
 *   <li>{@code searchMargin}: the deviation</li>
 * </ul>
 */
@Getter
@Builder(toBuilder = true)
public final class DemodulatorConfig {

  public static final DemodulatorConfig DEFAULT = DemodulatorConfig.builder().build();

  /** Samples per analysis window, at most one bit. */
  @Builder.Default private final int windowSize = 0;

  /** Samples between window starts. */
  @Builder.Default private final int hopSize = 0;

  /** Transform length, at least the window size. */
  @Builder.Default private final int fftSize = 0;

  /** Hz added below the space tone and above the mark tone for peak search and pre-filter. */
  @Builder.Default private final double searchMargin = 0.0;

  @Builder.Default private final FrequencyAggregation aggregation = FrequencyAggregation.MEDIAN;

  /** Band-pass the input before the transform. */
  @Builder.Default private final boolean prefilter = true;

  /** Pre-filter length; 0 picks {@code min(101, samplesPerBit / 4)}, rounded up to odd. */
  @Builder.Default private final int prefilterTaps = 0;

  /** Stopband attenuation of the pre-filter in dB. */
  @Builder.Default private final double prefilterAttenuation = 60.0;

  /** Absolute magnitude below which a frame has no frequency. */
  @Builder.Default private final double minMagnitude = 1e-6;

  /** Frames weaker than this fraction of the strongest frame are ignored. */
  @Builder.Default private final double relativeThreshold = 0.1;
}
