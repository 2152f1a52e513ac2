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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import lombok.Getter;

/**
 * One STFT frame: where the analysis window starts and the magnitude of each
 * bin from DC to Nyquist ({@code fftSize / 2 + 1} values).
 */
@Getter
public final class SpectrumFrame {

  private final int index;
  private final int startSample;
  private final double[] magnitudes;

  @SuppressFBWarnings("EI_EXPOSE_REP2")
  public SpectrumFrame(int index, int startSample, double[] magnitudes) {
    this.index = index;
    this.startSample = startSample;
    this.magnitudes = magnitudes;
  }

  @SuppressFBWarnings("EI_EXPOSE_REP")
  public double[] getMagnitudes() {
    return magnitudes;
  }
}
