package com.raditha.fuzzy.backend;

/**
 * The scoring primitives that a backend provides.
 * <p>
 * Every method receives strings that are already processed (or deliberately
 * unprocessed) and non-null, and returns a score between 0 and 100.
 * Implementations must be thread-safe and produce the same scores as
 * {@link ReferenceScoringBackend}; only their speed may differ. Alternative
 * implementations are bound through {@link ScoringBackends} and need a public
 * no-arg constructor.
 */
public interface ScoringBackend {

    /**
     * Short name for logs.
     */
    default String name() {
        return getClass().getSimpleName();
    }

    int ratio(String s1, String s2);

    int partialRatio(String s1, String s2);

    int tokenSortRatio(String s1, String s2);

    int partialTokenSortRatio(String s1, String s2);

    int tokenSetRatio(String s1, String s2);

    int partialTokenSetRatio(String s1, String s2);

    int weightedRatio(String s1, String s2);
}
