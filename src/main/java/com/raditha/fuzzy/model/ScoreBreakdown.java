package com.raditha.fuzzy.model;

/**
 * How a weighted ratio was reached. All contributions are already scaled and on
 * the 0-100 scale; contributions that were not computed are {@code 0}.
 *
 * @param baseRatio        Full-string ratio
 * @param partialRatio     Scaled partial ratio (partial strategy only)
 * @param tokenSortRatio   Scaled token sort ratio (partial variant under the partial strategy)
 * @param tokenSetRatio    Scaled token set ratio (partial variant under the partial strategy)
 * @param lengthRatio      Longer length over shorter length
 * @param partialStrategy  True if partial heuristics were used
 * @param score            Final rounded score (0-100)
 */
public record ScoreBreakdown(
        int baseRatio,
        double partialRatio,
        double tokenSortRatio,
        double tokenSetRatio,
        double lengthRatio,
        boolean partialStrategy,
        int score) {

    /**
     * Breakdown for inputs that failed validation.
     */
    public static ScoreBreakdown invalid() {
        return new ScoreBreakdown(0, 0.0, 0.0, 0.0, 0.0, false, 0);
    }

    /**
     * Name of the contribution that produced the final score. Ties go to the
     * earlier of base, partial, token sort, token set.
     */
    public String winningHeuristic() {
        double best = Math.max(Math.max(baseRatio, partialRatio), Math.max(tokenSortRatio, tokenSetRatio));
        if (baseRatio == best) {
            return "base";
        }
        if (partialRatio == best) {
            return "partial";
        }
        return tokenSortRatio == best ? "token_sort" : "token_set";
    }

    /**
     * Check if the score is at least {@code threshold} (0-100).
     */
    public boolean exceedsThreshold(int threshold) {
        return score >= threshold;
    }
}
