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
 * Maps a frequency to a bit by comparing it with the midpoint of the two tones.
 * Above the midpoint is the mark tone (1), at or below it the space tone (0).
 */
@Getter
public class ToneClassifier {

  private final double spaceFrequency;
  private final double markFrequency;
  private final double midpoint;

  /**
   * @param spaceFrequency tone for bit 0 in Hz
   * @param markFrequency  tone for bit 1 in Hz, above the space tone
   */
  public ToneClassifier(double spaceFrequency, double markFrequency) {
    if (!(markFrequency > spaceFrequency)) {
      throw new IllegalArgumentException("mark tone " + markFrequency + " Hz must be above space tone "
        + spaceFrequency + " Hz");
    }
    this.spaceFrequency = spaceFrequency;
    this.markFrequency = markFrequency;
    this.midpoint = (spaceFrequency + markFrequency) / 2.0;
  }

  /**
   * @return 1 when {@code frequency} is closer to the mark tone, otherwise 0 (ties give 0)
   */
  public int classify(double frequency) {
    if (Double.isNaN(frequency)) {
      throw new IllegalArgumentException("cannot classify NaN frequency");
    }
    return frequency > midpoint ? 1 : 0;
  }

  /** Tone used to send {@code bit}. */
  public double toneFor(int bit) {
    return bit != 0 ? markFrequency : spaceFrequency;
  }
}
