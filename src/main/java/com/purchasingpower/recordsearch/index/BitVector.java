package com.purchasingpower.recordsearch.index;

import com.google.common.base.Preconditions;

import java.util.Arrays;
import java.util.stream.IntStream;

/**
 * An immutable, unbounded-width set of bit positions.
 *
 * <p>Bits are packed into an array of 64-bit words, with position {@code n} stored in
 * word {@code n / 64} at bit {@code n % 64}. The word array is always trimmed so the
 * last word is non-zero, which keeps {@link #equals(Object)} value based and means
 * callers never see word boundaries. Performing bitwise operations on vectors is a
 * cheap way of doing set operations (union, intersection, difference).
 *
 * <p>Instances are built through the static algebra ({@link #or}, {@link #and},
 * {@link #andNot}, {@link #not}) or incrementally with a {@link Builder}.
 *
 * @since 1.0.0
 */
public final class BitVector {

    /**
     * The vector with no bits set.
     */
    public static final BitVector EMPTY = new BitVector(new long[0]);

    private static final int WORD_BITS = 64;
    private static final int WORD_SHIFT = 6;

    private final long[] words;

    private BitVector(long[] words) {
        this.words = words;
    }

    /**
     * Gets a vector containing a single enabled bit at the given position.
     *
     * @param position The position of the bit
     * @return The vector
     */
    public static BitVector fromPosition(int position) {
        Preconditions.checkArgument(position >= 0, "Bit position cannot be negative: %s", position);
        long[] words = new long[wordIndex(position) + 1];
        words[words.length - 1] = 1L << position;
        return new BitVector(words);
    }

    /**
     * Gets a vector with all bits enabled up to and including the given position.
     * A position of {@code -1} yields {@link #EMPTY}.
     *
     * @param position The position of the highest bit
     * @return The vector
     */
    public static BitVector fromPositionWithTrailing(int position) {
        Preconditions.checkArgument(position >= -1, "Bit position cannot be less than -1: %s", position);
        if (position == -1) {
            return EMPTY;
        }

        long[] words = new long[wordIndex(position) + 1];
        Arrays.fill(words, -1L);
        words[words.length - 1] = -1L >>> (WORD_BITS - 1 - (position & (WORD_BITS - 1)));
        return new BitVector(words);
    }

    /**
     * Scans for the most significant set bit.
     *
     * <p>Whole words are skipped from the top until a non-zero word is found, then a
     * leading-zero count on that word gives the offset. Because vectors are trimmed
     * this is always the last word.
     *
     * @param vector The vector to scan
     * @return The position of the most significant bit, or {@code -1} if the vector is empty
     */
    public static int scanMostSignificant(BitVector vector) {
        long[] words = vector.words;
        int top = words.length - 1;
        while (top >= 0 && words[top] == 0L) {
            top--;
        }

        if (top < 0) {
            return -1;
        }

        return (top << WORD_SHIFT) + (WORD_BITS - 1 - Long.numberOfLeadingZeros(words[top]));
    }

    /**
     * Set union ({@code a | b}).
     */
    public static BitVector or(BitVector a, BitVector b) {
        long[] longer = a.words.length >= b.words.length ? a.words : b.words;
        long[] shorter = longer == a.words ? b.words : a.words;

        long[] result = longer.clone();
        for (int i = 0; i < shorter.length; i++) {
            result[i] |= shorter[i];
        }

        return of(result);
    }

    /**
     * Set intersection ({@code a & b}).
     */
    public static BitVector and(BitVector a, BitVector b) {
        int length = Math.min(a.words.length, b.words.length);
        long[] result = new long[length];
        for (int i = 0; i < length; i++) {
            result[i] = a.words[i] & b.words[i];
        }

        return of(result);
    }

    /**
     * Set difference ({@code a & ~b}).
     */
    public static BitVector andNot(BitVector a, BitVector b) {
        long[] result = a.words.clone();
        int length = Math.min(a.words.length, b.words.length);
        for (int i = 0; i < length; i++) {
            result[i] &= ~b.words[i];
        }

        return of(result);
    }

    /**
     * Symmetric difference ({@code a ^ b}).
     */
    public static BitVector xor(BitVector a, BitVector b) {
        long[] longer = a.words.length >= b.words.length ? a.words : b.words;
        long[] shorter = longer == a.words ? b.words : a.words;

        long[] result = longer.clone();
        for (int i = 0; i < shorter.length; i++) {
            result[i] ^= shorter[i];
        }

        return of(result);
    }

    /**
     * Bounded complement.
     *
     * <p>The vector is conceptually infinite with trailing zeros, so the complement is
     * only meaningful within a width: this flips bits {@code 0..width-1}.
     *
     * @param a The vector
     * @param width The number of low bits to flip
     * @return The complemented vector
     */
    public static BitVector not(BitVector a, int width) {
        Preconditions.checkArgument(width >= 0, "Width cannot be negative: %s", width);
        return xor(fromPositionWithTrailing(width - 1), a);
    }

    /**
     * Whether the bit at the given position is set.
     */
    public boolean get(int position) {
        if (position < 0) {
            return false;
        }

        int word = wordIndex(position);
        return word < words.length && (words[word] & (1L << position)) != 0L;
    }

    /**
     * Whether no bits are set.
     */
    public boolean isEmpty() {
        return words.length == 0;
    }

    /**
     * Whether this vector and the other have at least one set bit in common.
     */
    public boolean intersects(BitVector other) {
        int length = Math.min(words.length, other.words.length);
        for (int i = 0; i < length; i++) {
            if ((words[i] & other.words[i]) != 0L) {
                return true;
            }
        }

        return false;
    }

    /**
     * The number of set bits.
     */
    public int cardinality() {
        int count = 0;
        for (long word : words) {
            count += Long.bitCount(word);
        }

        return count;
    }

    /**
     * The positions of the set bits, in ascending order.
     */
    public IntStream stream() {
        IntStream.Builder positions = IntStream.builder();
        for (int i = 0; i < words.length; i++) {
            long word = words[i];
            while (word != 0L) {
                positions.add((i << WORD_SHIFT) + Long.numberOfTrailingZeros(word));
                word &= word - 1;
            }
        }

        return positions.build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BitVector)) return false;
        return Arrays.equals(words, ((BitVector) o).words);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(words);
    }

    @Override
    public String toString() {
        if (isEmpty()) {
            return "0b0";
        }

        StringBuilder sb = new StringBuilder("0b");
        for (int i = scanMostSignificant(this); i >= 0; i--) {
            sb.append(get(i) ? '1' : '0');
        }

        return sb.toString();
    }

    private static int wordIndex(int position) {
        return position >>> WORD_SHIFT;
    }

    private static BitVector of(long[] words) {
        int length = words.length;
        while (length > 0 && words[length - 1] == 0L) {
            length--;
        }

        if (length == 0) {
            return EMPTY;
        }

        return new BitVector(length == words.length ? words : Arrays.copyOf(words, length));
    }

    /**
     * Creates a builder for accumulating bits without allocating a vector per bit.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Mutable accumulator of set bits. Not thread safe.
     */
    public static final class Builder {

        private long[] words = new long[1];

        private Builder() {
        }

        public Builder set(int position) {
            Preconditions.checkArgument(position >= 0, "Bit position cannot be negative: %s", position);
            int word = wordIndex(position);
            if (word >= words.length) {
                words = Arrays.copyOf(words, Math.max(word + 1, words.length * 2));
            }

            words[word] |= 1L << position;
            return this;
        }

        public Builder or(BitVector vector) {
            if (vector.words.length > words.length) {
                words = Arrays.copyOf(words, vector.words.length);
            }

            for (int i = 0; i < vector.words.length; i++) {
                words[i] |= vector.words[i];
            }

            return this;
        }

        public BitVector build() {
            return of(words.clone());
        }
    }
}
