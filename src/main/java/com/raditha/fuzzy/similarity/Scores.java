package com.raditha.fuzzy.similarity;

/**
 * Conversions from fractional similarity to integer scores.
 * <p>
 * Rounding is half-to-even: 12.5 becomes 12, 37.5 becomes 38.
 */
public final class Scores {

    public static final int MIN = 0;
    public static final int MAX = 100;

    private Scores() {
    }

    /**
     * Convert a ratio in [0.0, 1.0] to a score in [0, 100].
     */
    public static int fromRatio(double ratio) {
        return round(100 * ratio);
    }

    /**
     * Round a score already on the 0-100 scale.
     */
    public static int round(double score) {
        return (int) Math.rint(score);
    }
}
