/* (C)2026 */
package com.ammann.abstats.model;

/**
 * Post-hoc minimum sample size for the treatment arm and how much of it the experiment reached.
 *
 * @param requiredN smallest treatment-arm size that detects the observed effect at the target power
 * @param actualRatio observed treatment count divided by {@code requiredN} (1.0 means exactly enough)
 */
public record MssOutcome(long requiredN, double actualRatio) {

    public MssOutcome {
        if (requiredN < 1) {
            throw new IllegalArgumentException("Required sample size must be positive, got " + requiredN);
        }
    }

    public double actualPercent() {
        return actualRatio * 100.0;
    }

    public boolean sufficient() {
        return actualRatio >= 1.0;
    }
}
