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
 * Dominant frequency estimate of one analysis window.
 * A frame without energy in the search band carries {@code NaN} as its frequency.
 */
@Getter
public final class FrequencyFrame {

  private final int index;
  private final int startSample;
  private final int windowSize;
  private final double frequency;
  private final double magnitude;

  public FrequencyFrame(int index, int startSample, int windowSize, double frequency, double magnitude) {
    this.index = index;
    this.startSample = startSample;
    this.windowSize = windowSize;
    this.frequency = frequency;
    this.magnitude = magnitude;
  }

  /** One past the last sample covered by the window. */
  public int getEndSample() {
    return startSample + windowSize;
  }

  /** Window centre in samples. */
  public double getCenterSample() {
    return startSample + windowSize / 2.0;
  }

  public boolean isValid() {
    return !Double.isNaN(frequency);
  }

  @Override
  public String toString() {
    return String.format("frame %d @%d: %.1f Hz (mag %.4f)", index, startSample, frequency, magnitude);
  }
}
