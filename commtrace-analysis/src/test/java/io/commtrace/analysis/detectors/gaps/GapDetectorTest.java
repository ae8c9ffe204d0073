package io.commtrace.analysis.detectors.gaps;

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

import io.commtrace.analysis.RecordFixtures;
import io.commtrace.analysis.harness.DetectorOutput;
import io.commtrace.analysis.patterns.Pattern;
import io.commtrace.records.RecordTable;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class GapDetectorTest {

    static RecordTable quietWeekend() {
        return RecordFixtures.table(
            "2023-01-02T09:00 alice received",
            "2023-01-02T09:05 alice sent",
            "2023-01-02T10:00 bob received",
            "2023-01-02T10:10 bob sent",
            "2023-01-05T10:00 alice received",
            "2023-01-05T10:02 alice sent");
    }

    private final GapDetector detector = new GapDetector();

    @Test
    void findsGapsOfAtLeastTheMinimum() {
        DetectorOutput output = detector.analyze(quietWeekend(), Map.of());

        assertThat(output.hasError()).isFalse();
        assertThat(output.patterns()).hasSize(1);
        Pattern pattern = output.patterns().get(0);
        assertThat(pattern.patternType()).isEqualTo("time");
        assertThat(pattern.subtype()).isEqualTo("communication_gap");
        assertThat(pattern.description())
            .isEqualTo("Gap of 71.8 hours from 2023-01-02 10:10:00 to 2023-01-05 10:00:00");
        assertThat(pattern.confidence()).isEqualTo(1.0);
        assertThat(pattern.occurrences()).isEqualTo(1);
        assertThat(pattern.metadata())
            .containsEntry("last_contact", "bob")
            .containsEntry("next_contact", "alice");
    }

    @Test
    void significanceIsRelativeToMedianInterval() {
        List<GapDetector.Gap> gaps = detector.findGaps(quietWeekend().sortedByTime(), 24);

        assertThat(gaps).hasSize(1);
        GapDetector.Gap gap = gaps.get(0);
        // median interval is ten minutes
        assertThat(gap.durationHours()).isCloseTo(71 + 50 / 60.0, within(1e-9));
        assertThat(gap.significance()).isCloseTo((71 + 50 / 60.0) * 6, within(1e-6));
        assertThat(gap.startTime()).isEqualTo(LocalDateTime.of(2023, 1, 2, 10, 10));
        assertThat(gap.endTime()).isEqualTo(LocalDateTime.of(2023, 1, 5, 10, 0));
    }

    @Test
    void minimumComesFromParametersAndGapsAreLongestFirst() {
        DetectorOutput output = detector.analyze(quietWeekend(), Map.of("min_gap_hours", 0.5));

        assertThat(output.patterns()).hasSize(2);
        assertThat(output.patterns().get(0).significance())
            .isGreaterThan(output.patterns().get(1).significance());
        assertThat(output.values()).containsEntry("gap_count", 2).containsEntry("min_gap_hours", 0.5);
    }

    @Test
    void shortGapsYieldLowConfidence() {
        DetectorOutput output = detector.analyze(RecordFixtures.table(
            "2023-01-02T00:00 alice sent",
            "2023-01-03T00:00 alice received",
            "2023-01-04T00:00 alice sent",
            "2023-01-06T00:00 alice received"), Map.of());

        // intervals 24, 24, 48 hours: median 24
        assertThat(output.patterns()).extracting(Pattern::significance).containsExactly(2.0, 1.0, 1.0);
        assertThat(output.patterns()).extracting(Pattern::confidence).containsExactly(0.2, 0.1, 0.1);
    }

    @Test
    void fewerThanTwoRecordsHaveNoGaps() {
        DetectorOutput output = detector.analyze(RecordFixtures.table("2023-01-02T09:00 alice sent"), Map.of());

        assertThat(output.patterns()).isEmpty();
        assertThat(output.hasError()).isFalse();
    }

    @Test
    void invalidMinimumIsReportedNotThrown() {
        assertThat(detector.analyze(quietWeekend(), Map.of("min_gap_hours", "abc")).error())
            .isEqualTo("invalid min_gap_hours: abc");
        assertThat(detector.analyze(quietWeekend(), Map.of("min_gap_hours", -1)).error())
            .contains("must be positive");
    }

    @Test
    void typicalIntervalFallsBackToMeanWhenMedianIsZero() {
        assertThat(GapDetector.typicalInterval(new double[]{0, 0, 0, 5})).isEqualTo(1.25);
        assertThat(GapDetector.typicalInterval(new double[]{3, 1, 2})).isEqualTo(2.0);
    }

    @Test
    void nameMatchesAnnotation() {
        assertThat(detector.name()).isEqualTo(GapDetector.NAME);
    }
}
