/* (C)2026 */
package com.ammann.abstats.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Request body of the mean test endpoint. Optional fields fall back to configuration.
 *
 * @param controlValues control arm observations, at least two
 * @param treatmentValues treatment arm observations, at least two
 * @param alpha significance level, {@code null} for the configured default
 * @param power target power, {@code null} for the configured default
 * @param allocationRatio control per treatment observation for the sample size solver
 */
@Schema(description = "Raw observations of both arms for Welch's t-test")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MeanTestRequestDTO(
        @Schema(description = "Control arm observations", required = true) List<Double> controlValues,
        @Schema(description = "Treatment arm observations", required = true) List<Double> treatmentValues,
        @Schema(description = "Two-sided significance level in (0, 1)", example = "0.05")
                Double alpha,
        @Schema(description = "Target power in (0, 1)", example = "0.8") Double power,
        @Schema(description = "Control observations per treatment observation for the post-hoc sample size")
                Double allocationRatio) {}
