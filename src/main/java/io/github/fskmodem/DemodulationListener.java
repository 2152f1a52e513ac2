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

import io.github.fskmodem.atoms.BitDecision;
import io.github.fskmodem.atoms.FrequencyFrame;

/**
 * Optional observer of the demodulator's intermediate results, for traces and plots.
 * The demodulator works the same without one.
 */
public interface DemodulationListener {

  DemodulationListener NONE = new DemodulationListener() {};

  /** Called for every analysis frame, in time order. */
  default void onFrame(FrequencyFrame frame) {
  }

  /** Called for every bit window that produced a bit. */
  default void onBitDecision(BitDecision decision) {
  }

  /** Called for every bit window without a usable frame. */
  default void onMissingBit(int bitIndex, int startSample) {
  }
}
