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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalInt;

import io.github.fskmodem.atoms.BitDecision;
import io.github.fskmodem.util.BitSequence;
import lombok.Getter;

/**
 * Per-position outcome of a decode. Missing positions are kept in place rather than
 * filled in, so the caller can tell a complete decode from a partial one.
 */
public final class DecodeResult {

  public static final char MISSING_SYMBOL = '?';

  private static final DecodeResult EMPTY = new DecodeResult(List.of());

  @Getter private final List<BitDecision> decisions;
  @Getter private final List<Integer> missingPositions;

  public DecodeResult(List<BitDecision> decisions) {
    this.decisions = List.copyOf(decisions);
    List<Integer> missing = new ArrayList<>();
    for (BitDecision d : this.decisions) {
      if (d.isMissing()) {
        missing.add(d.getIndex());
      }
    }
    this.missingPositions = Collections.unmodifiableList(missing);
  }

  public static DecodeResult empty() {
    return EMPTY;
  }

  /** Number of bit positions, missing ones included. */
  public int size() {
    return decisions.size();
  }

  public boolean isComplete() {
    return missingPositions.isEmpty();
  }

  /** The bit at {@code position}, empty when it is missing. */
  public OptionalInt bitAt(int position) {
    BitDecision d = decisions.get(position);
    return d.isMissing() ? OptionalInt.empty() : OptionalInt.of(d.getBit());
  }

  /**
   * @return the decoded bits
   * @throws IncompleteDecodeException if any position is missing
   */
  public BitSequence bits() {
    if (!isComplete()) {
      throw new IncompleteDecodeException(this);
    }
    BitSequence.Builder b = BitSequence.builder(decisions.size());
    for (BitDecision d : decisions) {
      b.add(d.getBit());
    }
    return b.build();
  }

  /** Representative frequency per position, {@code NaN} where missing. */
  public double[] representativeFrequencies() {
    double[] out = new double[decisions.size()];
    for (int i = 0; i < out.length; i++) {
      out[i] = decisions.get(i).getFrequency();
    }
    return out;
  }

  /** Bits as {@code '0'/'1'} with {@link #MISSING_SYMBOL} at missing positions. */
  public String toPatternString() {
    StringBuilder sb = new StringBuilder(decisions.size());
    for (BitDecision d : decisions) {
      sb.append(d.isMissing() ? MISSING_SYMBOL : (char) ('0' + d.getBit()));
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    return toPatternString();
  }
}
