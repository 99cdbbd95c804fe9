/* (C)2026 */
package com.ammann.abstats.model;

/**
 * Difference between treatment and control estimates.
 *
 * @param absolute {@code treatment - control}
 * @param relative {@code (treatment - control) / control} as a fraction (0.05 means +5 %)
 */
public record UpliftEstimate(double absolute, double relative) {

    public double relativePercent() {
        return relative * 100.0;
    }
}
