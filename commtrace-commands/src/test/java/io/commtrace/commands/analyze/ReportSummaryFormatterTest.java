package io.commtrace.commands.analyze;

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

import io.commtrace.analysis.anomaly.Anomaly;
import io.commtrace.analysis.harness.PatternReport;
import io.commtrace.analysis.patterns.Pattern;
import io.commtrace.analysis.result.ResponseAnalysisReport;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ReportSummaryFormatterTest {

    @Test
    void hardStopShowsOnlyTheError() {
        String summary = ReportSummaryFormatter.summarize(ResponseAnalysisReport.failed("cannot analyze empty data"));

        assertThat(summary).isEqualTo("Error: cannot analyze empty data");
    }

    @Test
    void patternSummaryListsScoresAnomaliesAndErrors() {
        Pattern gap = Pattern.of("time", "communication_gap", "Gap of 30.0 hours", 3.0, 1.0, 1, Map.of())
            .withPatternSignificance(0.875);
        Anomaly slow = new Anomaly(Anomaly.RESPONSE_TIME_OUTLIER, "bob", null, 0.5, "slow reply", Map.of());
        PatternReport report = new PatternReport(List.of(gap), List.of(slow), List.of("trend: window too short"),
            Map.of(), 12);

        String summary = ReportSummaryFormatter.summarize(report);

        assertThat(summary.split("\n")).containsExactly(
            "Records analyzed: 12",
            "Patterns: 1",
            "  [0.88] time/communication_gap: Gap of 30.0 hours",
            "Anomalies: 1",
            "  [0.50] response_time_outlier bob: slow reply",
            "Errors:",
            "  trend: window too short");
    }

    @Test
    void modelAnomaliesWithoutCounterpartyOrDescription() {
        Anomaly fromModel = Anomaly.fromMap(Map.of("type", "ml_outlier", "severity", 0.3));
        PatternReport report = new PatternReport(List.of(), List.of(fromModel), List.of(), Map.of(), 4);

        String summary = ReportSummaryFormatter.summarize(report);

        assertThat(summary.split("\n")).contains("  [0.30] ml_outlier: -");
    }

    @Test
    void longListsAreTruncated() {
        Pattern p = Pattern.of("time", "communication_gap", "gap", 1.0, 0.1, 1, Map.of()).withPatternSignificance(0.1);
        PatternReport report = new PatternReport(Collections.nCopies(25, p), List.of(), List.of(),
            Map.of(), 100);

        String summary = ReportSummaryFormatter.summarize(report);

        assertThat(summary).contains("Patterns: 25");
        assertThat(summary.split("\n")).filteredOn(line -> line.startsWith("  ["))
            .hasSize(ReportSummaryFormatter.MAX_LISTED);
    }
}
