/* (C)2026 */
package com.ammann.abstats.health;

import com.ammann.abstats.service.DistributionService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;
import org.jboss.logging.Logger;

/**
 * Readiness check that evaluates fixed probes of the distribution kernel.
 *
 * <p>Reports DOWN when the normal or Student-t quantile deviates from its reference value or the
 * evaluation throws, which would make every p-value and interval served by the API wrong.
 */
@Readiness
@ApplicationScoped
public class StatisticsEngineHealthCheck implements HealthCheck {

    private static final Logger LOG = Logger.getLogger(StatisticsEngineHealthCheck.class);

    static final String NAME = "statistics-engine";
    static final double NORMAL_PROBE = 1.959963984540054;
    static final double STUDENT_T_PROBE = 2.2281388519649385; // t_{0.975, 10}
    static final double TOLERANCE = 1e-6;

    private final DistributionService distributions;

    @Inject
    public StatisticsEngineHealthCheck(DistributionService distributions) {
        this.distributions = distributions;
    }

    @Override
    public HealthCheckResponse call() {
        HealthCheckResponseBuilder builder = HealthCheckResponse.named(NAME);
        try {
            double z = distributions.standardNormalQuantile(0.975);
            double t = distributions.studentTQuantile(0.975, 10);
            builder.withData("z_0.975", String.valueOf(z))
                    .withData("t_0.975_10", String.valueOf(t));

            boolean healthy = Math.abs(z - NORMAL_PROBE) < TOLERANCE
                    && Math.abs(t - STUDENT_T_PROBE) < TOLERANCE;
            if (!healthy) {
                LOG.warnf("Distribution kernel probe mismatch: z=%.10f t=%.10f", z, t);
            }
            return builder.status(healthy).build();
        } catch (RuntimeException e) {
            LOG.warnf(e, "Distribution kernel probe failed");
            return builder.down().withData("error", String.valueOf(e.getMessage())).build();
        }
    }
}
