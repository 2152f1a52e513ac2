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

import java.util.List;

import lombok.Getter;

/**
 * One or more bit windows produced no usable frequency estimate.
 * The partial result is attached so the caller can decide what to do with it.
 */
public class IncompleteDecodeException extends FskException {

  @Getter
  private final transient DecodeResult result;

  public IncompleteDecodeException(DecodeResult result) {
    super("Decoding incomplete: no usable frames for bit position(s) " + result.getMissingPositions()
      + " of " + result.size());
    this.result = result;
  }

  public List<Integer> getMissingPositions() {
    return result.getMissingPositions();
  }
}
