/* (C)2026 */
package com.ammann.abstats.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Request body of the proportion test endpoint. Optional fields fall back to configuration.
 *
 * @param controlN control arm observations
 * @param controlSuccess control arm successes
 * @param treatmentN treatment arm observations
 * @param treatmentSuccess treatment arm successes
 * @param alpha significance level, {@code null} for the configured default
 * @param power target power, {@code null} for the configured default
 * @param allocationRatio control per treatment observation for the sample size solver
 */
@Schema(description = "Success counts of both arms for a two-sample proportion z-test")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProportionTestRequestDTO(
        @Schema(description = "Control arm observations", required = true, example = "998")
                Long controlN,
        @Schema(description = "Control arm successes", required = true, example = "101")
                Long controlSuccess,
        @Schema(description = "Treatment arm observations", required = true, example = "1001")
                Long treatmentN,
        @Schema(description = "Treatment arm successes", required = true, example = "122")
                Long treatmentSuccess,
        @Schema(description = "Two-sided significance level in (0, 1)", example = "0.05")
                Double alpha,
        @Schema(description = "Target power in (0, 1)", example = "0.8") Double power,
        @Schema(description = "Control observations per treatment observation for the post-hoc sample size")
                Double allocationRatio) {}
