package com.raditha.fuzzy.model;

/**
 * A run of symbols common to two sequences: {@code a[a, a+size) == b[b, b+size)}.
 * <p>
 * Block lists produced by the aligner end with a zero-length terminal block
 * at {@code (len(a), len(b))}; it is the only block with {@code size == 0}.
 *
 * @param a    Offset in the first sequence
 * @param b    Offset in the second sequence
 * @param size Number of matching symbols
 */
public record MatchingBlock(int a, int b, int size) {

    public MatchingBlock {
        if (a < 0 || b < 0 || size < 0) {
            throw new IllegalArgumentException(
                    String.format("Offsets and size must be >= 0, got (%d, %d, %d)", a, b, size));
        }
    }

    /**
     * The zero-length block that terminates every block list.
     */
    public static MatchingBlock terminal(int lengthA, int lengthB) {
        return new MatchingBlock(lengthA, lengthB, 0);
    }

    public boolean isTerminal() {
        return size == 0;
    }

    /**
     * Offset into the second sequence at which the first sequence would start if
     * this block were aligned, clamped to zero.
     */
    public int alignedStart() {
        return Math.max(b - a, 0);
    }

    /**
     * Check whether {@code next} continues this block on both sequences.
     */
    public boolean isAdjacentTo(MatchingBlock next) {
        return a + size == next.a && b + size == next.b;
    }

    @Override
    public String toString() {
        return "(" + a + ", " + b + ", " + size + ")";
    }
}
