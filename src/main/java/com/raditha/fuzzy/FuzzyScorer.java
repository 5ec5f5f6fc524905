package com.raditha.fuzzy;

import com.raditha.fuzzy.backend.ScoringBackend;
import com.raditha.fuzzy.normalization.Preprocessor;
import com.raditha.fuzzy.similarity.Scores;
import org.jspecify.annotations.Nullable;

/**
 * Public scoring operations over a fixed {@link ScoringBackend}.
 * <p>
 * Each operation runs the same guards in the same order: a null argument scores
 * 0, then the inputs are coerced and, where the operation takes a
 * {@code fullProcess} flag, normalised; the backend does the rest. With
 * {@code fullProcess=false} the caller is responsible for normalisation.
 */
public class FuzzyScorer {

    private final ScoringBackend backend;

    public FuzzyScorer(ScoringBackend backend) {
        if (backend == null) {
            throw new IllegalArgumentException("backend cannot be null");
        }
        this.backend = backend;
    }

    public int ratio(@Nullable Object s1, @Nullable Object s2) {
        if (s1 == null || s2 == null) {
            return Scores.MIN;
        }
        return backend.ratio(Preprocessor.coerce(s1), Preprocessor.coerce(s2));
    }

    public int partialRatio(@Nullable Object s1, @Nullable Object s2) {
        if (s1 == null || s2 == null) {
            return Scores.MIN;
        }
        return backend.partialRatio(Preprocessor.coerce(s1), Preprocessor.coerce(s2));
    }

    public int tokenSortRatio(@Nullable Object s1, @Nullable Object s2, boolean forceAscii, boolean fullProcess) {
        if (s1 == null || s2 == null) {
            return Scores.MIN;
        }
        return backend.tokenSortRatio(
                Preprocessor.process(s1, forceAscii, fullProcess),
                Preprocessor.process(s2, forceAscii, fullProcess));
    }

    public int partialTokenSortRatio(@Nullable Object s1, @Nullable Object s2, boolean forceAscii,
            boolean fullProcess) {
        if (s1 == null || s2 == null) {
            return Scores.MIN;
        }
        return backend.partialTokenSortRatio(
                Preprocessor.process(s1, forceAscii, fullProcess),
                Preprocessor.process(s2, forceAscii, fullProcess));
    }

    public int tokenSetRatio(@Nullable Object s1, @Nullable Object s2, boolean forceAscii, boolean fullProcess) {
        if (s1 == null || s2 == null) {
            return Scores.MIN;
        }
        return backend.tokenSetRatio(
                Preprocessor.process(s1, forceAscii, fullProcess),
                Preprocessor.process(s2, forceAscii, fullProcess));
    }

    public int partialTokenSetRatio(@Nullable Object s1, @Nullable Object s2, boolean forceAscii,
            boolean fullProcess) {
        if (s1 == null || s2 == null) {
            return Scores.MIN;
        }
        return backend.partialTokenSetRatio(
                Preprocessor.process(s1, forceAscii, fullProcess),
                Preprocessor.process(s2, forceAscii, fullProcess));
    }

    /**
     * Quick ratio: process both inputs, score 0 if either ends up empty,
     * otherwise the full ratio.
     */
    public int qRatio(@Nullable Object s1, @Nullable Object s2, boolean forceAscii, boolean fullProcess) {
        if (s1 == null || s2 == null) {
            return Scores.MIN;
        }
        String p1 = Preprocessor.process(s1, forceAscii, fullProcess);
        String p2 = Preprocessor.process(s2, forceAscii, fullProcess);
        if (!Preprocessor.isValid(p1) || !Preprocessor.isValid(p2)) {
            return Scores.MIN;
        }
        return backend.ratio(p1, p2);
    }

    /**
     * Weighted ratio: process both inputs, score 0 if either ends up empty,
     * otherwise the best of the length-appropriate heuristics.
     */
    public int wRatio(@Nullable Object s1, @Nullable Object s2, boolean forceAscii, boolean fullProcess) {
        if (s1 == null || s2 == null) {
            return Scores.MIN;
        }
        String p1 = Preprocessor.process(s1, forceAscii, fullProcess);
        String p2 = Preprocessor.process(s2, forceAscii, fullProcess);
        if (!Preprocessor.isValid(p1) || !Preprocessor.isValid(p2)) {
            return Scores.MIN;
        }
        return backend.weightedRatio(p1, p2);
    }
}
