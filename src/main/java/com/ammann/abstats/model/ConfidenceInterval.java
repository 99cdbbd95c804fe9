/* (C)2026 */
package com.ammann.abstats.model;

/**
 * Closed interval {@code [lower, upper]} around a point estimate.
 */
public record ConfidenceInterval(double lower, double upper) {

    public ConfidenceInterval {
        if (lower > upper) {
            throw new IllegalArgumentException(
                    String.format("Interval lower bound %f exceeds upper bound %f", lower, upper));
        }
    }

    /**
     * Symmetric interval {@code center +/- halfWidth}.
     */
    public static ConfidenceInterval around(double center, double halfWidth) {
        return new ConfidenceInterval(center - halfWidth, center + halfWidth);
    }

    public boolean contains(double value) {
        return lower <= value && value <= upper;
    }

    public double width() {
        return upper - lower;
    }

    /** Multiplies both bounds by a positive factor, e.g. 100 to express a fraction in percent. */
    public ConfidenceInterval scaled(double factor) {
        return new ConfidenceInterval(lower * factor, upper * factor);
    }
}
