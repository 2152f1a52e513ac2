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

/**
 * Phase-accumulating oscillator with retunable frequency.
 * <p>
 * Changing the frequency only changes the per-sample phase step; the accumulated phase
 * is kept, so consecutive tones join without a discontinuity.
 */
public class DdsOscillator {

  private static final double TWO_PI = 2.0 * Math.PI;

  private final double sampleRate;
  private double phaseStep;
  private double phase = 0.0;

  public DdsOscillator(double sampleRate, double frequency) {
    this.sampleRate = sampleRate;
    setFrequency(frequency);
  }

  /** Retune without touching the phase. */
  public void setFrequency(double frequency) {
    this.phaseStep = TWO_PI * frequency / sampleRate;
  }

  public void reset() {
    phase = 0.0;
  }

  /**
   * Advance by one sample.
   */
  public void next() {
    phase += phaseStep;
    if (phase >= TWO_PI) {
      phase -= TWO_PI;
    }
  }

  /** Current phase in [0, 2pi). */
  public double phase() {
    return phase;
  }

  public float sin() {
    return (float) Math.sin(phase);
  }

  public float cos() {
    return (float) Math.cos(phase);
  }
}
