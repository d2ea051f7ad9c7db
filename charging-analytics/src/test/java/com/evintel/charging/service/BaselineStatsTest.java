package com.evintel.charging.service;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class BaselineStatsTest {

    @Test
    void sampleStandardDeviation() {
        BaselineStats stats = BaselineStats.of(List.of(2.0, 4.0, 4.0, 4.0, 5.0, 5.0, 7.0, 9.0));

        assertThat(stats.n()).isEqualTo(8);
        assertThat(stats.mean()).isEqualTo(5.0);
        assertThat(stats.stddev()).isCloseTo(Math.sqrt(32.0 / 7), within(1e-12));
    }

    @Test
    void zeroStddevIsFlooredByEpsilon() {
        BaselineStats flat = BaselineStats.of(List.of(10.0, 10.0, 10.0));

        assertThat(flat.severity(10.5, 1.0)).isEqualTo(0.5);
        assertThat(flat.severity(9.0, 1.0)).isZero();
        assertThat(flat.severity(50.0, 1.0)).isEqualTo(1.0);
    }

    @Test
    void pearsonIsNullWithoutVariance() {
        assertThat(BaselineStats.pearson(new double[]{1, 2, 3}, new double[]{4, 4, 4})).isNull();
        assertThat(BaselineStats.pearson(new double[]{1, 2, 3}, new double[]{6, 4, 2})).isCloseTo(-1.0, within(1e-12));
    }
}
