package com.raditha.fuzzy.config;

/**
 * Scales and length thresholds used by the weighted ratio.
 *
 * @param tokenScale         Discount for token sort/set scores (0.0-1.0)
 * @param partialScale       Discount for partial scores when the strings differ in length
 * @param longPartialScale   Discount for partial scores when one string is much longer
 * @param partialLengthRatio Length ratio from which partial heuristics are used
 * @param longLengthRatio    Length ratio above which {@code longPartialScale} replaces {@code partialScale}
 */
public record WeightedRatioScales(
        double tokenScale,
        double partialScale,
        double longPartialScale,
        double partialLengthRatio,
        double longLengthRatio) {

    public WeightedRatioScales {
        requireScale("tokenScale", tokenScale);
        requireScale("partialScale", partialScale);
        requireScale("longPartialScale", longPartialScale);
        if (partialLengthRatio < 1.0) {
            throw new IllegalArgumentException(
                    String.format("partialLengthRatio must be >= 1.0, got %.3f", partialLengthRatio));
        }
        if (longLengthRatio < partialLengthRatio) {
            throw new IllegalArgumentException(
                    String.format("longLengthRatio must be >= partialLengthRatio, got %.3f < %.3f",
                            longLengthRatio, partialLengthRatio));
        }
    }

    /**
     * 0.95 token discount, 0.9 partial discount, 0.6 beyond a length ratio of 8,
     * partials from a length ratio of 1.5.
     */
    public static WeightedRatioScales defaults() {
        return new WeightedRatioScales(0.95, 0.90, 0.60, 1.5, 8.0);
    }

    /**
     * Whether two strings with this length ratio should be compared with partial heuristics.
     */
    public boolean usesPartials(double lengthRatio) {
        return lengthRatio >= partialLengthRatio;
    }

    /**
     * The partial discount for this length ratio.
     */
    public double partialScaleFor(double lengthRatio) {
        return lengthRatio > longLengthRatio ? longPartialScale : partialScale;
    }

    private static void requireScale(String name, double value) {
        if (!(value > 0.0 && value <= 1.0)) {
            throw new IllegalArgumentException(
                    String.format("%s must be in (0.0, 1.0], got %.3f", name, value));
        }
    }
}
