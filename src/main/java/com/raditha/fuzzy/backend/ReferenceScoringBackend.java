package com.raditha.fuzzy.backend;

import com.raditha.fuzzy.config.ScoringConfig;
import com.raditha.fuzzy.normalization.TokenNormalizer;
import com.raditha.fuzzy.scoring.CompositeScorer;
import com.raditha.fuzzy.similarity.RatioEngine;
import com.raditha.fuzzy.similarity.SequenceAligner;

/**
 * Backend built on {@link SequenceAligner}, {@link RatioEngine},
 * {@link TokenNormalizer} and {@link CompositeScorer}.
 */
public class ReferenceScoringBackend implements ScoringBackend {

    private final RatioEngine ratios;
    private final TokenNormalizer tokens;
    private final CompositeScorer composite;

    public ReferenceScoringBackend() {
        this(ScoringConfig.defaults());
    }

    public ReferenceScoringBackend(ScoringConfig config) {
        this.ratios = new RatioEngine(new SequenceAligner(config.aligner()));
        this.tokens = new TokenNormalizer(ratios);
        this.composite = new CompositeScorer(ratios, tokens, config.scales());
    }

    @Override
    public String name() {
        return ScoringConfig.REFERENCE_BACKEND;
    }

    public CompositeScorer getCompositeScorer() {
        return composite;
    }

    @Override
    public int ratio(String s1, String s2) {
        return ratios.ratio(s1, s2);
    }

    @Override
    public int partialRatio(String s1, String s2) {
        return ratios.partialRatio(s1, s2);
    }

    @Override
    public int tokenSortRatio(String s1, String s2) {
        return tokens.tokenSort(s1, s2, false);
    }

    @Override
    public int partialTokenSortRatio(String s1, String s2) {
        return tokens.tokenSort(s1, s2, true);
    }

    @Override
    public int tokenSetRatio(String s1, String s2) {
        return tokens.tokenSet(s1, s2, false);
    }

    @Override
    public int partialTokenSetRatio(String s1, String s2) {
        return tokens.tokenSet(s1, s2, true);
    }

    @Override
    public int weightedRatio(String s1, String s2) {
        return composite.weightedRatio(s1, s2);
    }
}
