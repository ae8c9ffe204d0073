package io.commtrace.analysis.responses;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class LatencyDistributionTest {

    private static final double TOLERANCE = 1e-9;

    @Test
    void percentilesInterpolateBetweenRanks() {
        LatencyDistribution d = LatencyDistribution.of(new double[]{5400, 180, 3600});

        assertThat(d.count()).isEqualTo(3);
        assertThat(d.min()).isEqualTo(180.0);
        assertThat(d.max()).isEqualTo(5400.0);
        assertThat(d.mean()).isCloseTo(3060.0, within(TOLERANCE));
        assertThat(d.p25()).isCloseTo(1890.0, within(TOLERANCE));
        assertThat(d.p50()).isCloseTo(3600.0, within(TOLERANCE));
        assertThat(d.p75()).isCloseTo(4500.0, within(TOLERANCE));
    }

    @Test
    void sampleStandardDeviation() {
        LatencyDistribution d = LatencyDistribution.of(new double[]{2, 4, 4, 4, 5, 5, 7, 9});

        // population std is 2; sample std divides by n - 1
        assertThat(d.stdDev()).isCloseTo(Math.sqrt(32.0 / 7.0), within(TOLERANCE));
    }

    @Test
    void singleValueHasNoSpread() {
        LatencyDistribution d = LatencyDistribution.of(new double[]{42});

        assertThat(d.stdDev()).isZero();
        assertThat(d.skewness()).isZero();
        assertThat(d.kurtosis()).isEqualTo(3.0);
        assertThat(d.p95()).isEqualTo(42.0);
        assertThat(d.isOutlier(42)).isFalse();
    }

    @Test
    void symmetricSampleHasZeroSkew() {
        LatencyDistribution d = LatencyDistribution.of(new double[]{1, 2, 3, 4, 5});

        assertThat(d.skewness()).isCloseTo(0.0, within(TOLERANCE));
    }

    @Test
    void outliersFallOutsideIqrFences() {
        LatencyDistribution d = LatencyDistribution.of(new double[]{10, 11, 12, 13, 14, 1000});

        assertThat(d.p25()).isCloseTo(11.25, within(TOLERANCE));
        assertThat(d.p75()).isCloseTo(13.75, within(TOLERANCE));
        assertThat(d.upperFence()).isCloseTo(17.5, within(TOLERANCE));
        assertThat(d.lowerFence()).isCloseTo(7.5, within(TOLERANCE));
        assertThat(d.isOutlier(1000)).isTrue();
        assertThat(d.isOutlier(17.5)).isFalse();
        assertThat(d.isOutlier(7)).isTrue();
    }

    @Test
    void sameInputGivesSameOutliers() {
        double[] sample = {30, 45, 50, 55, 60, 65, 70, 4000, 9000};

        LatencyDistribution a = LatencyDistribution.of(sample);
        LatencyDistribution b = LatencyDistribution.of(sample.clone());

        assertThat(a).isEqualTo(b);
        for (double v : sample) {
            assertThat(a.isOutlier(v)).isEqualTo(b.isOutlier(v));
        }
    }

    @Test
    void histogramBandsHaveExclusiveUpperBounds() {
        LatencyDistribution d = LatencyDistribution.of(new double[]{59, 60, 299, 300, 3600, 86400, 100000});

        assertThat(d.histogram()).containsExactly(
            entry("0-1m", 1),
            entry("1-5m", 2),
            entry("5-15m", 1),
            entry("15-30m", 0),
            entry("30m-1h", 0),
            entry("1-2h", 1),
            entry("2-24h", 0),
            entry("24h+", 2));
    }

    @Test
    void emptySampleIsRejected() {
        assertThatThrownBy(() -> LatencyDistribution.of(new double[0]))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
