/* (C)2026 */
package com.ammann.abstats.enumeration;

/**
 * Two-sample test performed for an A/B comparison.
 *
 * <ul>
 *   <li>PROPORTION_Z: two-sample z-test on conversion proportions
 *   <li>WELCH_T: Welch's unequal-variance t-test on observation means
 * </ul>
 */
public enum TestType {
    /** Two-sample proportion z-test. */
    PROPORTION_Z("proportion-z"),

    /** Welch's t-test for two independent means. */
    WELCH_T("welch-t");

    private final String metricTag;

    TestType(String metricTag) {
        this.metricTag = metricTag;
    }

    /** Value used as the {@code test} tag on Micrometer meters. */
    public String metricTag() {
        return metricTag;
    }
}
