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

/**
 * Base type of all errors raised by the modulator, the demodulator and their adapters.
 */
public class FskException extends RuntimeException {

  public FskException(String message) {
    super(message);
  }

  public FskException(String message, Throwable cause) {
    super(message, cause);
  }
}
