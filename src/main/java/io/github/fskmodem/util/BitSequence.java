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
package io.github.fskmodem.util;

import java.util.Arrays;
import java.util.Objects;
import java.util.PrimitiveIterator;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.IntConsumer;
import java.util.stream.IntStream;
import java.util.stream.StreamSupport;

import javax.annotation.Nonnull;

import io.github.fskmodem.InputFormatException;

/**
 * Immutable packed bit sequence (bit 0 is the first symbol sent) backed by {@code long[]} words.
 *
 * <p>Key properties:</p>
 * <ul>
 *   <li>Insertion order is the message order.</li>
 *   <li>No boxing on primitive iteration.</li>
 *   <li>{@link #toString()} renders the {@code '0'/'1'} form accepted by {@link #parse(CharSequence)}.</li>
 * </ul>
 *
 * <p>Instances are created through {@link Builder}, {@link #parse(CharSequence)} or {@link #of(int...)}.</p>
 */
public final class BitSequence implements Iterable<Integer> {

  private static final BitSequence EMPTY = new BitSequence(new long[0], 0);

  private final long[] words;
  private final int bitCount;

  private BitSequence(long[] words, int bitCount) {
    this.words = words;
    this.bitCount = bitCount;
  }

  public static BitSequence empty() {
    return EMPTY;
  }

  /**
   * Parse a string of {@code '0'} and {@code '1'} characters.
   *
   * @throws InputFormatException on any other character
   */
  public static BitSequence parse(CharSequence bits) {
    Objects.requireNonNull(bits, "bits");
    Builder b = builder(bits.length());
    for (int i = 0; i < bits.length(); i++) {
      char c = bits.charAt(i);
      if (c == '0') {
        b.add(0);
      } else if (c == '1') {
        b.add(1);
      } else {
        throw new InputFormatException(String.format(
          "Invalid bit character '%s' at index %d: only '0' and '1' are allowed", printable(c), i));
      }
    }
    return b.build();
  }

  /** Sequence from explicit 0/1 values. */
  public static BitSequence of(int... bits) {
    Builder b = builder(bits.length);
    for (int i = 0; i < bits.length; i++) {
      if (bits[i] != 0 && bits[i] != 1) {
        throw new InputFormatException("Bit value at index " + i + " must be 0 or 1, got " + bits[i]);
      }
      b.add(bits[i]);
    }
    return b.build();
  }

  public static Builder builder() {
    return new Builder(512);
  }

  public static Builder builder(int initialBits) {
    return new Builder(initialBits);
  }

  /** Number of bits. */
  public int size() { return bitCount; }

  public boolean isEmpty() { return bitCount == 0; }

  /** Read the bit at index (0/1). */
  public int get(int i) {
    if (i < 0 || i >= bitCount) {
      throw new IndexOutOfBoundsException("bit index " + i + " out of range [0, " + bitCount + ")");
    }
    return (int) ((words[i >>> 6] >>> (i & 63)) & 1L);
  }

  /** Emit bits to a sink without allocating. */
  public void forEachBit(IntConsumer sink) {
    for (int i = 0; i < bitCount; i++) {
      sink.accept((int) ((words[i >>> 6] >>> (i & 63)) & 1L));
    }
  }

  /** Copy out as {@code int[]} of 0/1. */
  public int[] toIntArray() {
    int[] out = new int[bitCount];
    forEachBit(new IntConsumer() {
      int k = 0;
      @Override public void accept(int bit) { out[k++] = bit; }
    });
    return out;
  }

  // ---------- Iteration & Streams ----------

  public PrimitiveIterator.OfInt bitIterator() {
    return new PrimitiveIterator.OfInt() {
      int i = 0;
      @Override public boolean hasNext() { return i < bitCount; }
      @Override public int nextInt() { return get(i++); }
    };
  }

  public IntStream bitStream() {
    Spliterator.OfInt spliterator = Spliterators.spliterator(bitIterator(), bitCount,
      Spliterator.ORDERED | Spliterator.SIZED | Spliterator.IMMUTABLE | Spliterator.NONNULL);
    return StreamSupport.intStream(spliterator, false);
  }

  /** Enable for-each: {@code for (int b : bits) { ... }}. */
  @Override
  public @Nonnull PrimitiveIterator.OfInt iterator() {
    return bitIterator();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof BitSequence other)) {
      return false;
    }
    if (bitCount != other.bitCount) {
      return false;
    }
    // trailing bits of the last word are always zero
    int used = (bitCount + 63) >>> 6;
    for (int w = 0; w < used; w++) {
      if (words[w] != other.words[w]) {
        return false;
      }
    }
    return true;
  }

  @Override
  public int hashCode() {
    int result = 1;
    for (int i = 0; i < bitCount; i++) {
      result = 31 * result + get(i);
    }
    return result;
  }

  /** The bits as a {@code '0'/'1'} string. */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(bitCount);
    forEachBit(bit -> sb.append(bit != 0 ? '1' : '0'));
    return sb.toString();
  }

  private static String printable(char c) {
    return Character.isISOControl(c) ? String.format("\\u%04x", (int) c) : String.valueOf(c);
  }

  /**
   * Growable append-only builder. Not thread-safe; {@link #build()} takes a snapshot.
   */
  public static final class Builder {

    private long[] words;
    private int bitCount;

    private Builder(int initialBits) {
      this.words = new long[Math.max(1, (initialBits + 63) >>> 6)];
    }

    /** Append a single bit (lowest bit of {@code bit}). */
    public Builder add(int bit) {
      ensureWordCapacity((bitCount >>> 6) + 1);
      if ((bit & 1) != 0) {
        words[bitCount >>> 6] |= 1L << (bitCount & 63);
      }
      bitCount++;
      return this;
    }

    public Builder addAll(BitSequence other) {
      other.forEachBit(this::add);
      return this;
    }

    public int size() {
      return bitCount;
    }

    public BitSequence build() {
      if (bitCount == 0) {
        return EMPTY;
      }
      return new BitSequence(Arrays.copyOf(words, (bitCount + 63) >>> 6), bitCount);
    }

    private void ensureWordCapacity(int needWords) {
      if (needWords > words.length) {
        int newLen = Math.max(needWords, words.length + (words.length >> 1) + 1);
        words = Arrays.copyOf(words, newLen);
      }
    }
  }
}
