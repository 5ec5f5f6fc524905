package com.raditha.fuzzy.config;

/**
 * Process-wide scoring configuration.
 *
 * @param backend Backend to bind: {@link #REFERENCE_BACKEND} or the fully qualified
 *                name of a {@code ScoringBackend} implementation
 * @param aligner Matching block search tuning
 * @param scales  Weighted ratio scales
 */
public record ScoringConfig(
        String backend,
        AlignerConfig aligner,
        WeightedRatioScales scales) {

    public static final String REFERENCE_BACKEND = "reference";

    public ScoringConfig {
        if (backend == null || backend.isBlank()) {
            backend = REFERENCE_BACKEND;
        }
        if (aligner == null) {
            throw new IllegalArgumentException("aligner cannot be null");
        }
        if (scales == null) {
            throw new IllegalArgumentException("scales cannot be null");
        }
        backend = backend.strip();
    }

    /**
     * Reference backend with reference aligner tuning.
     */
    public static ScoringConfig defaults() {
        return new ScoringConfig(REFERENCE_BACKEND, AlignerConfig.defaults(), WeightedRatioScales.defaults());
    }

    /**
     * Reference backend with the popular-symbol heuristic disabled.
     */
    public static ScoringConfig exhaustive() {
        return new ScoringConfig(REFERENCE_BACKEND, AlignerConfig.exhaustive(), WeightedRatioScales.defaults());
    }

    public boolean usesReferenceBackend() {
        return REFERENCE_BACKEND.equalsIgnoreCase(backend);
    }
}
