/* (C)2026 */
package com.ammann.abstats.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.ammann.abstats.exception.DomainException;
import com.ammann.abstats.exception.ValidationException;
import com.ammann.abstats.model.ConfidenceInterval;
import com.ammann.abstats.model.GroupSummary;
import com.ammann.abstats.model.UpliftEstimate;
import com.ammann.abstats.support.TestDataFactory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/**
 * Unit tests for {@link DeltaMethodService}.
 *
 * <p>Expected values use the documented proportion example with {@code z = 1.959963984540054}.
 */
class DeltaMethodServiceTest {

    private static final double Z_975 = 1.959963984540054;

    private final DeltaMethodService service = new DeltaMethodService();

    private final GroupSummary control = TestDataFactory.proportion(998, 101);
    private final GroupSummary treatment = TestDataFactory.proportion(1001, 122);

    @Test
    void upliftIsAbsoluteAndRelativeChange() {
        UpliftEstimate uplift = service.uplift(control, treatment);

        assertThat(uplift.absolute()).isCloseTo(0.0206757, within(1e-7));
        assertThat(uplift.relative()).isCloseTo(0.2043006, within(1e-7));
        assertThat(uplift.relativePercent()).isCloseTo(20.43006, within(1e-5));
    }

    @Test
    void absoluteIntervalMatchesReference() {
        ConfidenceInterval interval = service.absoluteInterval(control, treatment, Z_975);

        assertThat(interval.lower()).isCloseTo(-0.0069076, within(1e-7));
        assertThat(interval.upper()).isCloseTo(0.0482590, within(1e-7));
    }

    @Test
    void relativeIntervalMatchesFirstOrderExpansion() {
        ConfidenceInterval interval = service.relativeInterval(control, treatment, Z_975);

        assertThat(interval.lower()).isCloseTo(-0.0951681, within(1e-6));
        assertThat(interval.upper()).isCloseTo(0.5037694, within(1e-6));
    }

    @Test
    void intervalsAreCenteredOnTheirEstimates() {
        UpliftEstimate uplift = service.uplift(control, treatment);
        ConfidenceInterval absolute = service.absoluteInterval(control, treatment, Z_975);
        ConfidenceInterval relative = service.relativeInterval(control, treatment, Z_975);

        assertThat(absolute.contains(uplift.absolute())).isTrue();
        assertThat(relative.contains(uplift.relative())).isTrue();
        assertThat((absolute.lower() + absolute.upper()) / 2).isCloseTo(uplift.absolute(), within(1e-15));
    }

    @Test
    void controlVarianceEntersThroughTreatmentOverControlSquared() {
        GroupSummary c = new GroupSummary(100, 2.0, 0.04);
        GroupSummary t = new GroupSummary(100, 3.0, 0.0);

        ConfidenceInterval interval = service.relativeInterval(c, t, 1.0);

        // Var(r) = 0 / 4 + 9 * 0.04 / 16
        assertThat(interval.width() / 2).isCloseTo(Math.sqrt(9 * 0.04 / 16), within(1e-15));
    }

    @Test
    void zeroCriticalValueCollapsesIntervals() {
        ConfidenceInterval interval = service.absoluteInterval(control, treatment, 0.0);

        assertThat(interval.width()).isZero();
    }

    @Test
    void zeroControlEstimateFailsOnlyForRelativeFields() {
        GroupSummary zeroControl = TestDataFactory.proportion(1000, 0);

        assertThat(service.absoluteInterval(zeroControl, treatment, Z_975).contains(treatment.estimate()))
                .isTrue();
        assertThatThrownBy(() -> service.uplift(zeroControl, treatment)).isInstanceOf(DomainException.class);
        assertThatThrownBy(() -> service.relativeInterval(zeroControl, treatment, Z_975))
                .isInstanceOf(DomainException.class)
                .hasMessageContaining("control estimate is zero");
    }

    @ParameterizedTest
    @ValueSource(doubles = {-1.0, Double.NaN, Double.POSITIVE_INFINITY})
    void rejectsInvalidCriticalValues(double criticalValue) {
        assertThatThrownBy(() -> service.absoluteInterval(control, treatment, criticalValue))
                .isInstanceOf(ValidationException.class);
    }
}
