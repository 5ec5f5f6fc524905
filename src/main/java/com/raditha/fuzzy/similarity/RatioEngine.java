package com.raditha.fuzzy.similarity;

import com.raditha.fuzzy.model.MatchingBlock;

import java.util.Arrays;
import java.util.List;

/**
 * Full-string and best-substring ratios over raw strings.
 * <p>
 * Inputs are compared as given; callers normalise beforehand. Both operations
 * return 100 for equal strings (including two empty ones) and 0 when exactly
 * one string is empty, without running the aligner.
 * <p>
 * The block search is order-sensitive, so {@link #ratio(String, String)} always
 * aligns the pair in canonical order (shorter first, then lower code points
 * first). This keeps the full ratio symmetric.
 */
public class RatioEngine {

    /** Candidate windows scoring above this count as exact substring matches. */
    static final double PARTIAL_MATCH_CUTOFF = 0.995;

    private final SequenceAligner aligner;

    public RatioEngine() {
        this(new SequenceAligner());
    }

    public RatioEngine(SequenceAligner aligner) {
        this.aligner = aligner;
    }

    public SequenceAligner getAligner() {
        return aligner;
    }

    /**
     * Similarity of the two full strings.
     *
     * @return score between 0 and 100
     */
    public int ratio(String s1, String s2) {
        if (s1.equals(s2)) {
            return Scores.MAX;
        }
        if (s1.isEmpty() || s2.isEmpty()) {
            return Scores.MIN;
        }
        int[] first = SequenceAligner.codePoints(s1);
        int[] second = SequenceAligner.codePoints(s2);
        if (!inCanonicalOrder(first, second)) {
            int[] swap = first;
            first = second;
            second = swap;
        }
        return Scores.fromRatio(aligner.ratio(first, second));
    }

    /**
     * Ratio of the shorter string against its best-aligned window of the longer one.
     * <p>
     * Every matching block proposes a window of the longer string where the
     * shorter one would start if that block lined up. Not symmetric when both
     * strings have the same length.
     *
     * @return score between 0 and 100
     */
    public int partialRatio(String s1, String s2) {
        if (s1.equals(s2)) {
            return Scores.MAX;
        }
        if (s1.isEmpty() || s2.isEmpty()) {
            return Scores.MIN;
        }

        int[] first = SequenceAligner.codePoints(s1);
        int[] second = SequenceAligner.codePoints(s2);
        int[] shorter = first.length <= second.length ? first : second;
        int[] longer = first.length <= second.length ? second : first;

        List<MatchingBlock> blocks = aligner.matchingBlocks(shorter, longer);

        double best = 0.0;
        for (MatchingBlock block : blocks) {
            int start = block.alignedStart();
            int end = Math.min(start + shorter.length, longer.length);
            int[] window = Arrays.copyOfRange(longer, start, end);

            double candidate = aligner.ratio(shorter, window);
            if (candidate > PARTIAL_MATCH_CUTOFF) {
                return Scores.MAX;
            }
            best = Math.max(best, candidate);
        }
        return Scores.fromRatio(best);
    }

    static boolean inCanonicalOrder(int[] first, int[] second) {
        if (first.length != second.length) {
            return first.length < second.length;
        }
        return Arrays.compare(first, second) <= 0;
    }
}
