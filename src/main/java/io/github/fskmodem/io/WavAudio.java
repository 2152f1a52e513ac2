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
package io.github.fskmodem.io;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import lombok.Getter;

/**
 * Mono samples in [-1, 1) read from a WAV file, with the file's sample rate.
 */
@Getter
public final class WavAudio {

  private final float[] samples;
  private final int sampleRate;

  @SuppressFBWarnings("EI_EXPOSE_REP2")
  public WavAudio(float[] samples, int sampleRate) {
    this.samples = samples;
    this.sampleRate = sampleRate;
  }

  @SuppressFBWarnings("EI_EXPOSE_REP")
  public float[] getSamples() {
    return samples;
  }

  public double getDurationSeconds() {
    return (double) samples.length / sampleRate;
  }
}
