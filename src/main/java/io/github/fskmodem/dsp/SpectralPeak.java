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

import lombok.Getter;

/**
 * A local maximum of a magnitude spectrum.
 */
@Getter
public final class SpectralPeak {

  private final double frequency;
  private final double magnitude;

  public SpectralPeak(double frequency, double magnitude) {
    this.frequency = frequency;
    this.magnitude = magnitude;
  }

  @Override
  public String toString() {
    return String.format("%.2f Hz (magnitude %.4f)", frequency, magnitude);
  }
}
