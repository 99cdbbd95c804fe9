/* (C)2026 */
package com.ammann.abstats.enumeration;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class TestTypeTest {

    @Test
    void enumHasTwoValues() {
        assertThat(TestType.values()).containsExactly(TestType.PROPORTION_Z, TestType.WELCH_T);
    }

    @Test
    void exposesMetricTags() {
        assertThat(TestType.PROPORTION_Z.metricTag()).isEqualTo("proportion-z");
        assertThat(TestType.WELCH_T.metricTag()).isEqualTo("welch-t");
    }

    @Test
    void configurationEnumsResolveByName() {
        assertThat(ProportionVarianceMode.valueOf("POOLED")).isEqualTo(ProportionVarianceMode.POOLED);
        assertThat(AllocationMode.valueOf("EQUAL")).isEqualTo(AllocationMode.EQUAL);
    }
}
