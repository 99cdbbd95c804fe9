/* (C)2026 */
package com.ammann.abstats.enumeration;

/**
 * Variance model used in the denominator of the proportion z-statistic.
 *
 * <p>Confidence intervals and post-hoc sample sizes always use the per-arm (unpooled) variances;
 * this setting only affects the test statistic and its p-value.
 */
public enum ProportionVarianceMode {
    /** Each arm contributes p(1-p)/n with its own observed proportion. */
    UNPOOLED,

    /** Both arms share the pooled proportion (s_c + s_t) / (n_c + n_t) under the null hypothesis. */
    POOLED
}
