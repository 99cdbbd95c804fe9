/* (C)2026 */
package com.ammann.abstats.resource;

import com.ammann.abstats.dto.AbTestResultDTO;
import com.ammann.abstats.dto.MeanTestRequestDTO;
import com.ammann.abstats.dto.ProportionTestRequestDTO;
import com.ammann.abstats.exception.ValidationException;
import com.ammann.abstats.model.AbTestResult;
import com.ammann.abstats.model.AnalysisOptions;
import com.ammann.abstats.properties.ApiProperties;
import com.ammann.abstats.service.AbTestService;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

/**
 * REST resource exposing the two A/B comparison tests.
 *
 * <p>Both endpoints return a single {@link AbTestResultDTO} row. Undefined relative or sample
 * size fields are omitted rather than failing the request.
 */
@Path(ApiProperties.BASE_URL_V1 + ApiProperties.AbTests.BASE)
@Tag(name = "A/B Test API", description = "Two-sample significance tests with uplift intervals and post-hoc sample sizes")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class AbTestResource {

    private static final Logger LOG = Logger.getLogger(AbTestResource.class);

    @Inject AbTestService abTestService;

    @POST
    @Path(ApiProperties.AbTests.PROPORTIONS)
    @Operation(
            summary = "Two-sample proportion z-test",
            description = "Compares treatment and control conversion proportions and reports uplift, intervals and the post-hoc minimum sample size")
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Test computed",
                    content = @Content(schema = @Schema(implementation = AbTestResultDTO.class))),
            @APIResponse(responseCode = "400", description = "Invalid counts, alpha or power"),
            @APIResponse(responseCode = "422", description = "Statistic undefined for the observed data")
    })
    public Response compareProportions(ProportionTestRequestDTO request) {
        if (request == null) {
            throw ValidationException.invalidParameter("body", null, "a proportion test request");
        }
        LOG.debugf("Proportion test request: control=%s/%s treatment=%s/%s",
                request.controlSuccess(), request.controlN(), request.treatmentSuccess(), request.treatmentN());

        AnalysisOptions options =
                abTestService.resolveOptions(request.alpha(), request.power(), request.allocationRatio());
        AbTestResult result = abTestService.proportionsZTest(
                require("controlN", request.controlN()),
                require("controlSuccess", request.controlSuccess()),
                require("treatmentN", request.treatmentN()),
                require("treatmentSuccess", request.treatmentSuccess()),
                options);

        return Response.ok(AbTestResultDTO.from(result)).build();
    }

    @POST
    @Path(ApiProperties.AbTests.MEANS)
    @Operation(
            summary = "Welch two-sample t-test",
            description = "Compares treatment and control means from raw observations and reports uplift, intervals and the post-hoc minimum sample size")
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Test computed",
                    content = @Content(schema = @Schema(implementation = AbTestResultDTO.class))),
            @APIResponse(responseCode = "400", description = "Too few observations, invalid alpha or power"),
            @APIResponse(responseCode = "422", description = "Zero-variance sample")
    })
    public Response compareMeans(MeanTestRequestDTO request) {
        if (request == null) {
            throw ValidationException.invalidParameter("body", null, "a mean test request");
        }
        LOG.debugf("Mean test request: %d control and %d treatment observations",
                request.controlValues() != null ? request.controlValues().size() : 0,
                request.treatmentValues() != null ? request.treatmentValues().size() : 0);

        AnalysisOptions options =
                abTestService.resolveOptions(request.alpha(), request.power(), request.allocationRatio());
        AbTestResult result =
                abTestService.ttestIndWelch(request.controlValues(), request.treatmentValues(), options);

        return Response.ok(AbTestResultDTO.from(result)).build();
    }

    private static long require(String name, Long value) {
        if (value == null) {
            throw ValidationException.invalidParameter(name, null, "a non-negative count");
        }
        return value;
    }
}
