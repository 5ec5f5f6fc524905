package com.raditha.fuzzy.config;

/**
 * Tuning for the longest-matching-block search.
 * <p>
 * When {@code autoJunk} is on and the second sequence has at least
 * {@code autoJunkMinLength} symbols, any symbol occurring more than
 * {@code length / popularityDivisor + 1} times in it is treated as noise: it can
 * never seed a matching block, although a block found elsewhere may still be
 * extended across it. This changes scores on long, repetitive input.
 *
 * @param autoJunk          Enable the popular-symbol heuristic
 * @param autoJunkMinLength Minimum length of the second sequence before the heuristic applies
 * @param popularityDivisor Divisor in the popularity threshold formula
 */
public record AlignerConfig(
        boolean autoJunk,
        int autoJunkMinLength,
        int popularityDivisor) {

    public static final int DEFAULT_AUTO_JUNK_MIN_LENGTH = 200;
    public static final int DEFAULT_POPULARITY_DIVISOR = 100;

    public AlignerConfig {
        if (autoJunkMinLength < 1) {
            throw new IllegalArgumentException("autoJunkMinLength must be >= 1");
        }
        if (popularityDivisor < 1) {
            throw new IllegalArgumentException("popularityDivisor must be >= 1");
        }
    }

    /**
     * Reference behaviour: heuristic on for sequences of 200 or more symbols.
     */
    public static AlignerConfig defaults() {
        return new AlignerConfig(true, DEFAULT_AUTO_JUNK_MIN_LENGTH, DEFAULT_POPULARITY_DIVISOR);
    }

    /**
     * Every symbol may seed a block. Exact, but quadratic on repetitive input.
     */
    public static AlignerConfig exhaustive() {
        return new AlignerConfig(false, DEFAULT_AUTO_JUNK_MIN_LENGTH, DEFAULT_POPULARITY_DIVISOR);
    }

    /**
     * Check whether the heuristic applies to a second sequence of this length.
     */
    public boolean appliesTo(int length) {
        return autoJunk && length >= autoJunkMinLength;
    }

    /**
     * Occurrence count above which a symbol counts as popular.
     */
    public int popularityThreshold(int length) {
        return length / popularityDivisor + 1;
    }
}
