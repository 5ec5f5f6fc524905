package com.raditha.fuzzy.scoring;

import com.raditha.fuzzy.config.WeightedRatioScales;
import com.raditha.fuzzy.model.ScoreBreakdown;
import com.raditha.fuzzy.normalization.Preprocessor;
import com.raditha.fuzzy.normalization.TokenNormalizer;
import com.raditha.fuzzy.similarity.RatioEngine;
import com.raditha.fuzzy.similarity.Scores;

/**
 * Combines the full, partial and token ratios into a single score.
 * <p>
 * Strings of comparable length (length ratio below 1.5) are scored with the
 * full ratio and the token ratios. Otherwise partial variants are used as well,
 * discounted so that only a true full match reaches 100. Token scores are
 * always discounted so that reordering never beats an exact-order match.
 */
public class CompositeScorer {

    private final RatioEngine ratios;
    private final TokenNormalizer tokens;
    private final WeightedRatioScales scales;

    public CompositeScorer(RatioEngine ratios, TokenNormalizer tokens, WeightedRatioScales scales) {
        this.ratios = ratios;
        this.tokens = tokens;
        this.scales = scales;
    }

    /**
     * Weighted ratio of two already processed strings.
     *
     * @return score between 0 and 100; 0 if either string is empty
     */
    public int weightedRatio(String p1, String p2) {
        return explain(p1, p2).score();
    }

    /**
     * Full ratio of two already processed strings, 0 if either is empty.
     */
    public int quickRatio(String p1, String p2) {
        if (!Preprocessor.isValid(p1) || !Preprocessor.isValid(p2)) {
            return Scores.MIN;
        }
        return ratios.ratio(p1, p2);
    }

    /**
     * Weighted ratio with every contribution that went into it.
     */
    public ScoreBreakdown explain(String p1, String p2) {
        if (!Preprocessor.isValid(p1) || !Preprocessor.isValid(p2)) {
            return ScoreBreakdown.invalid();
        }

        int base = ratios.ratio(p1, p2);
        int length1 = p1.codePointCount(0, p1.length());
        int length2 = p2.codePointCount(0, p2.length());
        double lengthRatio = (double) Math.max(length1, length2) / Math.min(length1, length2);

        if (!scales.usesPartials(lengthRatio)) {
            double tokenSort = tokens.tokenSort(p1, p2, false) * scales.tokenScale();
            double tokenSet = tokens.tokenSet(p1, p2, false) * scales.tokenScale();
            int score = Scores.round(Math.max(base, Math.max(tokenSort, tokenSet)));
            return new ScoreBreakdown(base, 0.0, tokenSort, tokenSet, lengthRatio, false, score);
        }

        double partialScale = scales.partialScaleFor(lengthRatio);
        double partial = ratios.partialRatio(p1, p2) * partialScale;
        double tokenSort = tokens.tokenSort(p1, p2, true) * scales.tokenScale() * partialScale;
        double tokenSet = tokens.tokenSet(p1, p2, true) * scales.tokenScale() * partialScale;

        int score = Scores.round(Math.max(Math.max(base, partial), Math.max(tokenSort, tokenSet)));
        return new ScoreBreakdown(base, partial, tokenSort, tokenSet, lengthRatio, true, score);
    }
}
