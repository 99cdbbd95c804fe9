/* (C)2026 */
package com.ammann.abstats.dto;

import com.ammann.abstats.model.AbTestResult;
import com.ammann.abstats.model.ConfidenceInterval;
import com.ammann.abstats.model.MssOutcome;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Locale;
import org.apache.commons.math3.util.Precision;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Single-row tabular result of an A/B comparison.
 *
 * <p>Fields that are undefined for the observed data (relative uplift when the control estimate is
 * zero, post-hoc sample size when the observed effect is zero) are {@code null} and omitted from
 * the JSON body. {@code df} is only present for Welch's t-test.
 */
@Schema(description = "A/B test result row")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AbTestResultDTO(
        @Schema(description = "Treatment numerator/denominator, e.g. 122/1001")
        @JsonProperty("metric_formula")
        String metricFormula,

        @Schema(description = "Treatment estimate (proportion or mean)")
        @JsonProperty("metric_value")
        Double metricValue,

        @Schema(description = "Relative change of treatment over control in percent")
        @JsonProperty("delta_relative")
        Double deltaRelative,

        @Schema(description = "Treatment minus control")
        @JsonProperty("delta_absolute")
        Double deltaAbsolute,

        @Schema(description = "Two-sided p-value rounded to 5 decimals")
        @JsonProperty("p_value")
        Double pValue,

        @Schema(description = "Confidence interval of the relative change, e.g. [-9.52%, 50.38%]")
        @JsonProperty("CI_relative")
        String ciRelative,

        @Schema(description = "Confidence interval of the absolute difference, e.g. [-0.0069, 0.0483]")
        @JsonProperty("CI_absolute")
        String ciAbsolute,

        @Schema(description = "Share of the required treatment size reached, with the required size, e.g. 27.49% (3,641)")
        @JsonProperty("MSS_posthoc")
        String mssPosthoc,

        @Schema(description = "Test statistic rounded to 2 decimals")
        @JsonProperty("statistic")
        Double statistic,

        @Schema(description = "Welch-Satterthwaite degrees of freedom rounded to 2 decimals (mean test only)")
        @JsonProperty("df")
        Double df
) {
    static final int P_VALUE_SCALE = 5;
    static final int STATISTIC_SCALE = 2;

    /**
     * Converts a service-layer result to its tabular representation.
     *
     * @param result computed comparison
     * @return DTO ready for JSON serialization
     */
    public static AbTestResultDTO from(AbTestResult result) {
        Double df = result.test().hasDegreesOfFreedom()
                ? Precision.round(result.test().degreesOfFreedom(), STATISTIC_SCALE)
                : null;
        return new AbTestResultDTO(
                result.metricFormula(),
                result.metricValue(),
                result.uplift() != null ? result.uplift().relativePercent() : null,
                result.absoluteDifference(),
                Precision.round(result.test().pValue(), P_VALUE_SCALE),
                formatRelative(result.relativeInterval()),
                formatAbsolute(result.absoluteInterval()),
                formatMss(result.mss()),
                Precision.round(result.test().statistic(), STATISTIC_SCALE),
                df);
    }

    static String formatAbsolute(ConfidenceInterval interval) {
        return String.format(Locale.ROOT, "[%.4f, %.4f]", interval.lower(), interval.upper());
    }

    static String formatRelative(ConfidenceInterval fraction) {
        if (fraction == null) {
            return null;
        }
        ConfidenceInterval percent = fraction.scaled(100.0);
        return String.format(Locale.ROOT, "[%.2f%%, %.2f%%]", percent.lower(), percent.upper());
    }

    static String formatMss(MssOutcome mss) {
        if (mss == null) {
            return null;
        }
        return String.format(Locale.US, "%.2f%% (%,d)", mss.actualPercent(), mss.requiredN());
    }
}
