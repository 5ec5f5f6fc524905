package com.raditha.fuzzy;

import com.raditha.fuzzy.backend.ScoringBackends;
import org.jspecify.annotations.Nullable;

/**
 * Static entry points for fuzzy string scores, backed by the process-wide
 * backend from {@link ScoringBackends#active()}.
 * <p>
 * All methods return an integer between 0 and 100 and return 0 when either
 * argument is null. Arguments that are not strings are compared by their
 * text form; non-char arrays are rejected with {@link IllegalArgumentException}.
 * <p>
 * The {@code forceAscii} flag (default {@code true}) drops non-ASCII characters
 * during processing. The {@code fullProcess} flag (default {@code true}) can be
 * turned off for inputs already passed through
 * {@link com.raditha.fuzzy.normalization.Preprocessor#fullProcess(Object, boolean)}.
 */
public final class Fuzz {

    private Fuzz() {
    }

    private static FuzzyScorer scorer() {
        return Holder.SCORER;
    }

    /**
     * Similarity of the two strings as given.
     */
    public static int ratio(@Nullable Object s1, @Nullable Object s2) {
        return scorer().ratio(s1, s2);
    }

    /**
     * Similarity of the shorter string to its best-matching window of the longer one.
     */
    public static int partialRatio(@Nullable Object s1, @Nullable Object s2) {
        return scorer().partialRatio(s1, s2);
    }

    public static int tokenSortRatio(@Nullable Object s1, @Nullable Object s2) {
        return tokenSortRatio(s1, s2, true, true);
    }

    /**
     * Ratio after sorting each string's tokens.
     */
    public static int tokenSortRatio(@Nullable Object s1, @Nullable Object s2, boolean forceAscii,
            boolean fullProcess) {
        return scorer().tokenSortRatio(s1, s2, forceAscii, fullProcess);
    }

    public static int partialTokenSortRatio(@Nullable Object s1, @Nullable Object s2) {
        return partialTokenSortRatio(s1, s2, true, true);
    }

    /**
     * Partial ratio after sorting each string's tokens.
     */
    public static int partialTokenSortRatio(@Nullable Object s1, @Nullable Object s2, boolean forceAscii,
            boolean fullProcess) {
        return scorer().partialTokenSortRatio(s1, s2, forceAscii, fullProcess);
    }

    public static int tokenSetRatio(@Nullable Object s1, @Nullable Object s2) {
        return tokenSetRatio(s1, s2, true, true);
    }

    /**
     * Ratio of shared tokens against each side's shared-plus-extra tokens.
     */
    public static int tokenSetRatio(@Nullable Object s1, @Nullable Object s2, boolean forceAscii,
            boolean fullProcess) {
        return scorer().tokenSetRatio(s1, s2, forceAscii, fullProcess);
    }

    public static int partialTokenSetRatio(@Nullable Object s1, @Nullable Object s2) {
        return partialTokenSetRatio(s1, s2, true, true);
    }

    public static int partialTokenSetRatio(@Nullable Object s1, @Nullable Object s2, boolean forceAscii,
            boolean fullProcess) {
        return scorer().partialTokenSetRatio(s1, s2, forceAscii, fullProcess);
    }

    public static int qRatio(@Nullable Object s1, @Nullable Object s2) {
        return qRatio(s1, s2, true, true);
    }

    /**
     * Quick ratio: full processing, 0 for inputs that process to nothing.
     */
    public static int qRatio(@Nullable Object s1, @Nullable Object s2, boolean forceAscii, boolean fullProcess) {
        return scorer().qRatio(s1, s2, forceAscii, fullProcess);
    }

    public static int uqRatio(@Nullable Object s1, @Nullable Object s2) {
        return uqRatio(s1, s2, true);
    }

    /**
     * {@link #qRatio(Object, Object, boolean, boolean)} keeping non-ASCII characters.
     */
    public static int uqRatio(@Nullable Object s1, @Nullable Object s2, boolean fullProcess) {
        return qRatio(s1, s2, false, fullProcess);
    }

    public static int wRatio(@Nullable Object s1, @Nullable Object s2) {
        return wRatio(s1, s2, true, true);
    }

    /**
     * Weighted ratio: the best of the full, partial and token heuristics for the
     * strings' relative lengths.
     */
    public static int wRatio(@Nullable Object s1, @Nullable Object s2, boolean forceAscii, boolean fullProcess) {
        return scorer().wRatio(s1, s2, forceAscii, fullProcess);
    }

    public static int uwRatio(@Nullable Object s1, @Nullable Object s2) {
        return uwRatio(s1, s2, true);
    }

    /**
     * {@link #wRatio(Object, Object, boolean, boolean)} keeping non-ASCII characters.
     */
    public static int uwRatio(@Nullable Object s1, @Nullable Object s2, boolean fullProcess) {
        return wRatio(s1, s2, false, fullProcess);
    }

    private static final class Holder {
        private static final FuzzyScorer SCORER = new FuzzyScorer(ScoringBackends.active());
    }
}
