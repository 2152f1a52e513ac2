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

import lombok.Getter;

/**
 * Outcome for one bit window: the decided bit, or missing when no usable frame fell inside it.
 */
@Getter
public final class BitDecision {

  public static final int MISSING = -1;

  private final int index;
  private final int startSample;
  private final int frameCount;
  private final double frequency;
  private final int bit;

  public BitDecision(int index, int startSample, int frameCount, double frequency, int bit) {
    this.index = index;
    this.startSample = startSample;
    this.frameCount = frameCount;
    this.frequency = frequency;
    this.bit = bit;
  }

  static BitDecision missing(int index, int startSample) {
    return new BitDecision(index, startSample, 0, Double.NaN, MISSING);
  }

  public boolean isMissing() {
    return bit == MISSING;
  }

  @Override
  public String toString() {
    return isMissing()
      ? String.format("bit %d @%d: missing", index, startSample)
      : String.format("bit %d @%d: %d (%.1f Hz from %d frames)", index, startSample, bit, frequency, frameCount);
  }
}
