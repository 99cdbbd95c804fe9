/* (C)2026 */
package com.ammann.abstats.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.ammann.abstats.enumeration.AllocationMode;
import com.ammann.abstats.exception.UndefinedMssException;
import com.ammann.abstats.exception.ValidationException;
import com.ammann.abstats.model.GroupSummary;
import com.ammann.abstats.model.MssOutcome;
import com.ammann.abstats.model.TestResult;
import com.ammann.abstats.model.TwoSampleComparison;
import com.ammann.abstats.support.TestDataFactory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class MinimumSampleSizeServiceTest {

    private final MinimumSampleSizeService service = new MinimumSampleSizeService(new DistributionService());

    private static TwoSampleComparison proportionExample() {
        return new TwoSampleComparison(
                TestDataFactory.proportion(998, 101),
                TestDataFactory.proportion(1001, 122),
                TestResult.normal(1.47, 0.14));
    }

    @Test
    void solvesProportionExampleWithObservedAllocation() {
        TwoSampleComparison comparison = proportionExample();
        double ratio = MinimumSampleSizeService.allocationRatio(comparison, AllocationMode.OBSERVED);

        MssOutcome outcome = service.solve(comparison, 0.05, 0.8, ratio);

        assertThat(ratio).isCloseTo(998.0 / 1001.0, within(1e-15));
        assertThat(outcome.requiredN()).isEqualTo(3641);
        assertThat(outcome.actualPercent()).isCloseTo(27.4924, within(1e-4));
        assertThat(outcome.sufficient()).isFalse();
    }

    @Test
    void equalAllocationIgnoresObservedCounts() {
        TwoSampleComparison comparison = proportionExample();

        MssOutcome outcome = service.solve(
                comparison, 0.05, 0.8, MinimumSampleSizeService.allocationRatio(comparison, AllocationMode.EQUAL));

        assertThat(outcome.requiredN()).isEqualTo(3636);
    }

    @Test
    void solvesMeanExample() {
        // per-observation variances 0.24545... and 0.23733..., 12 control and 10 treatment observations
        MssOutcome outcome = service.solve(0.48, 0.24545454545454537, 0.23733333333333342, 10, 0.05, 0.8, 1.2);

        assertThat(outcome.requiredN()).isEqualTo(16);
        assertThat(outcome.actualRatio()).isEqualTo(0.625);
    }

    @Test
    void largeExperimentReportsSufficientSize() {
        MssOutcome outcome = service.solve(0.5, 1.0, 1.0, 1_000, 0.05, 0.8, 1.0);

        assertThat(outcome.requiredN()).isEqualTo(63);
        assertThat(outcome.sufficient()).isTrue();
    }

    @Test
    void requiredSizeNeverDecreasesWithPower() {
        long previous = 0;
        for (double power = 0.05; power < 0.99; power += 0.05) {
            long required = service.solve(0.02, 0.09, 0.1, 1000, 0.05, power, 1.0).requiredN();
            assertThat(required).isGreaterThanOrEqualTo(previous);
            previous = required;
        }
    }

    @Test
    void requiredSizeNeverDecreasesAsAlphaShrinks() {
        long previous = 0;
        for (double alpha = 0.5; alpha > 0.001; alpha /= 2) {
            long required = service.solve(0.02, 0.09, 0.1, 1000, alpha, 0.8, 1.0).requiredN();
            assertThat(required).isGreaterThanOrEqualTo(previous);
            previous = required;
        }
    }

    @Test
    void signOfEffectDoesNotMatter() {
        MssOutcome up = service.solve(0.03, 0.2, 0.25, 500, 0.05, 0.9, 1.0);
        MssOutcome down = service.solve(-0.03, 0.2, 0.25, 500, 0.05, 0.9, 1.0);

        assertThat(down).isEqualTo(up);
    }

    @Test
    void zeroEffectIsUndefined() {
        assertThatThrownBy(() -> service.solve(0.0, 0.1, 0.1, 100, 0.05, 0.8, 1.0))
                .isInstanceOf(UndefinedMssException.class)
                .hasMessageContaining("observed effect is zero");
    }

    @Test
    void zeroRateArmContributesNoVariance() {
        TwoSampleComparison comparison = new TwoSampleComparison(
                TestDataFactory.proportion(1000, 0),
                TestDataFactory.proportion(1000, 10),
                TestResult.normal(3.18, 0.0015));

        MssOutcome outcome = service.solve(comparison, 0.05, 0.8, 1.0);

        assertThat(outcome.requiredN()).isEqualTo(778);
        assertThat(outcome.sufficient()).isTrue();
    }

    @Test
    void zeroVariancesAreUndefined() {
        assertThatThrownBy(() -> service.solve(0.1, 0.0, 0.0, 100, 0.05, 0.8, 1.0))
                .isInstanceOf(UndefinedMssException.class);
    }

    @ParameterizedTest
    @CsvSource({
            "0.0, 0.8, 1.0",
            "1.0, 0.8, 1.0",
            "0.05, 0.0, 1.0",
            "0.05, 1.0, 1.0",
            "0.05, 0.8, 0.0",
            "0.05, 0.8, -2.0"
    })
    void rejectsInvalidParameters(double alpha, double power, double ratio) {
        assertThatThrownBy(() -> service.solve(0.1, 0.1, 0.1, 100, alpha, power, ratio))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void observedAllocationRatioIsControlOverTreatment() {
        TwoSampleComparison comparison = new TwoSampleComparison(
                new GroupSummary(300, 1.0, 0.1), new GroupSummary(100, 1.1, 0.1), TestResult.normal(0.2, 0.8));

        assertThat(MinimumSampleSizeService.allocationRatio(comparison, AllocationMode.OBSERVED)).isEqualTo(3.0);
    }
}
