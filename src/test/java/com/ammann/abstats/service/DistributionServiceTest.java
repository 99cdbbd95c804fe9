/* (C)2026 */
package com.ammann.abstats.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.ammann.abstats.exception.ConvergenceException;
import com.ammann.abstats.exception.DomainException;
import com.ammann.abstats.exception.ValidationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

/**
 * Unit tests for {@link DistributionService}.
 *
 * <p>Reference values are standard table values of the normal and Student-t distributions.
 */
class DistributionServiceTest {

    private final DistributionService service = new DistributionService();

    @Test
    void normalCdfAtZeroIsOneHalf() {
        assertThat(service.standardNormalCdf(0.0)).isEqualTo(0.5);
    }

    @Test
    void normalCdfMatchesTableValue() {
        assertThat(service.standardNormalCdf(1.96)).isCloseTo(0.9750021048517796, within(1e-9));
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.1, 0.5, 1.0, 1.47, 2.5, 4.0, 8.0})
    void normalCdfIsSymmetric(double x) {
        assertThat(service.standardNormalCdf(-x))
                .isCloseTo(1.0 - service.standardNormalCdf(x), within(1e-12));
    }

    @Test
    void normalCdfIsMonotonic() {
        double previous = 0.0;
        for (double x = -6.0; x <= 6.0; x += 0.25) {
            double current = service.standardNormalCdf(x);
            assertThat(current).isGreaterThanOrEqualTo(previous);
            previous = current;
        }
    }

    @ParameterizedTest
    @CsvSource({
            "0.975, 1.959963984540054",
            "0.8, 0.8416212335729143",
            "0.5, 0.0",
            "0.025, -1.959963984540054"
    })
    void normalQuantileMatchesTableValues(double p, double expected) {
        assertThat(service.standardNormalQuantile(p)).isCloseTo(expected, within(1e-9));
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.0, 1.0, -0.1, 1.5, Double.NaN})
    void normalQuantileRejectsProbabilitiesOutsideOpenUnitInterval(double p) {
        assertThatThrownBy(() -> service.standardNormalQuantile(p))
                .isInstanceOf(DomainException.class)
                .hasMessageContaining("(0, 1)");
    }

    @Test
    void twoSidedNormalPValueIsOneAtZero() {
        assertThat(service.twoSidedNormalPValue(0.0)).isEqualTo(1.0);
    }

    @Test
    void twoSidedNormalPValueStaysPositiveForLargeStatistics() {
        assertThat(service.twoSidedNormalPValue(9.0)).isGreaterThan(0.0).isLessThan(1e-15);
    }

    @Test
    void studentTCdfAtZeroIsOneHalf() {
        assertThat(service.studentTCdf(0.0, 7.3)).isCloseTo(0.5, within(1e-15));
    }

    @Test
    void studentTCdfMatchesTableValue() {
        assertThat(service.studentTCdf(2.0, 5)).isCloseTo(0.9490302605850709, within(1e-9));
        assertThat(service.studentTCdf(-2.0, 5)).isCloseTo(1.0 - 0.9490302605850709, within(1e-9));
    }

    @Test
    void twoSidedStudentTPValueSupportsFractionalDegreesOfFreedom() {
        double p = service.twoSidedStudentTPValue(2.2834402936836864, 19.405181921715464);

        assertThat(p).isCloseTo(0.03383216, within(1e-6));
    }

    @ParameterizedTest
    @CsvSource({
            "0.975, 10, 2.2281388519649385",
            "0.975, 1, 12.706204736174707",
            "0.975, 1000, 1.9623390808264074",
            "0.9, 5, 1.4758840488244813",
            "0.025, 10, -2.2281388519649385"
    })
    void studentTQuantileMatchesTableValues(double p, double df, double expected) {
        assertThat(service.studentTQuantile(p, df)).isCloseTo(expected, within(1e-7));
    }

    @Test
    void studentTQuantileInvertsCdf() {
        double df = 19.405181921715464;
        double q = service.studentTQuantile(0.975, df);

        assertThat(q).isCloseTo(2.0900700705855684, within(1e-7));
        assertThat(service.studentTCdf(q, df)).isCloseTo(0.975, within(1e-10));
    }

    @Test
    void studentTQuantileAtMedianIsZero() {
        assertThat(service.studentTQuantile(0.5, 3)).isEqualTo(0.0);
    }

    @Test
    void studentTRejectsInvalidDegreesOfFreedom() {
        assertThatThrownBy(() -> service.studentTCdf(1.0, 0.0)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.studentTCdf(1.0, Double.POSITIVE_INFINITY))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.studentTQuantile(0.9, -2)).isInstanceOf(ValidationException.class);
    }

    @Test
    void studentTQuantileRejectsProbabilitiesOutsideOpenUnitInterval() {
        assertThatThrownBy(() -> service.studentTQuantile(1.0, 10)).isInstanceOf(DomainException.class);
    }

    @Test
    void exhaustedIncompleteBetaBudgetRaisesConvergenceException() {
        DistributionService bounded = new DistributionService(1, DistributionService.DEFAULT_MAX_SOLVER_EVALUATIONS);

        assertThatThrownBy(() -> bounded.twoSidedStudentTPValue(2.0, 10))
                .isInstanceOf(ConvergenceException.class)
                .hasMessageContaining("1 iterations");
    }

    @Test
    void exhaustedRootFindingBudgetRaisesConvergenceException() {
        DistributionService bounded = new DistributionService(DistributionService.DEFAULT_MAX_BETA_ITERATIONS, 1);

        assertThatThrownBy(() -> bounded.studentTQuantile(0.975, 10))
                .isInstanceOf(ConvergenceException.class)
                .hasMessageContaining("1 evaluations");
    }

    @Test
    void repeatedEvaluationIsBitIdentical() {
        double first = service.studentTQuantile(0.975, 19.405181921715464);
        double second = service.studentTQuantile(0.975, 19.405181921715464);

        assertThat(Double.doubleToRawLongBits(first)).isEqualTo(Double.doubleToRawLongBits(second));
    }
}
