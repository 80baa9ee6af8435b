package com.edsim.metrics;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class DistributionSummaryTest {

    @Test
    void describesSample() {
        DistributionSummary summary = DistributionSummary.of(List.of(4.0, 1.0, 3.0, 2.0));

        assertThat(summary.count).isEqualTo(4);
        assertThat(summary.mean).isEqualTo(2.5);
        assertThat(summary.median).isEqualTo(2.5);
        assertThat(summary.std).isCloseTo(Math.sqrt(5.0 / 3.0), within(1e-9));
        assertThat(summary.min).isEqualTo(1.0);
        assertThat(summary.max).isEqualTo(4.0);
        assertThat(summary.p90).isCloseTo(3.7, within(1e-9));
    }

    @Test
    void singleValue() {
        DistributionSummary summary = DistributionSummary.of(List.of(12.0));

        assertThat(summary.median).isEqualTo(12.0);
        assertThat(summary.p90).isEqualTo(12.0);
        assertThat(summary.std).isZero();
    }

    @Test
    void emptySample() {
        assertThat(DistributionSummary.of(List.of())).isSameAs(DistributionSummary.EMPTY);
        assertThat(DistributionSummary.EMPTY).hasToString("n=0");
    }
}
