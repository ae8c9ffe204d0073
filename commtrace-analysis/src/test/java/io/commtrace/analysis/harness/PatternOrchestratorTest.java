package io.commtrace.analysis.harness;

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
import io.commtrace.analysis.ResponseAnalyzer;
import io.commtrace.analysis.anomaly.Anomaly;
import io.commtrace.analysis.cache.CacheKey;
import io.commtrace.analysis.cache.ResultCache;
import io.commtrace.analysis.detectors.gaps.GapDetector;
import io.commtrace.analysis.ml.Augmentation;
import io.commtrace.analysis.ml.ModelNotTrainedException;
import io.commtrace.analysis.patterns.Pattern;
import io.commtrace.records.RecordTable;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

class PatternOrchestratorTest {

    private static RecordTable quietWeekend() {
        return RecordFixtures.table(
            "2023-01-02T09:00 alice received",
            "2023-01-02T09:05 alice sent",
            "2023-01-02T10:00 bob received",
            "2023-01-02T10:10 bob sent",
            "2023-01-05T10:00 alice received",
            "2023-01-05T10:02 alice sent");
    }

    private static SiblingDetector named(String name, java.util.function.Function<RecordTable, DetectorOutput> body) {
        return new SiblingDetector() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public DetectorOutput analyze(RecordTable table, Map<String, Object> params) {
                return body.apply(table);
            }
        };
    }

    @Test
    void mergesResponseAndGapPatternsRankedBySignificance() {
        PatternOrchestrator orchestrator = new PatternOrchestrator().register(new GapDetector());

        PatternReport report = orchestrator.detectAllPatterns(quietWeekend(), null, Map.of());

        assertThat(report.errors()).isEmpty();
        assertThat(report.recordCount()).isEqualTo(6);
        assertThat(report.detectedPatterns()).extracting(Pattern::key)
            .contains("time/communication_gap", "response_time/average");
        assertThat(report.detectedPatterns()).allSatisfy(p ->
            assertThat(p.patternSignificance()).isNotNull().isBetween(0.0, 1.0));
        assertThat(report.detectedPatterns())
            .isSortedAccordingTo((a, b) -> Double.compare(b.patternSignificance(), a.patternSignificance()));
        assertThat(report.advancedAnalysis()).containsOnlyKeys(PatternReport.RESPONSES, GapDetector.NAME);
        assertThat(report.responses()).isPresent();
    }

    @Test
    void failingDetectorIsIsolated() {
        PatternOrchestrator orchestrator = new PatternOrchestrator()
            .register(named("boom", table -> {
                throw new IllegalStateException("kaboom");
            }))
            .register(new GapDetector());

        PatternReport report = orchestrator.detectAllPatterns(quietWeekend(), null, Map.of());

        assertThat(report.errors()).containsExactly("boom: kaboom");
        assertThat(report.detectedPatterns()).extracting(Pattern::key).contains("time/communication_gap");
        assertThat(report.advancedAnalysis().get("boom")).isInstanceOf(DetectorOutput.class);
    }

    @Test
    void detectorErrorOutputIsRecordedAlongsideItsPatterns() {
        Pattern partial = Pattern.of("trend", "rising", "volume rising", 1.0, 0.4, 3, Map.of());
        Anomaly spike = new Anomaly("volume_spike", "alice", null, 0.3, "spike", Map.of());
        PatternOrchestrator orchestrator = new PatternOrchestrator()
            .register(named("trend", table ->
                new DetectorOutput(List.of(partial), List.of(spike), Map.of(), "window too short")));

        PatternReport report = orchestrator.detectAllPatterns(quietWeekend(), null, Map.of());

        assertThat(report.errors()).containsExactly("trend: window too short");
        assertThat(report.detectedPatterns()).extracting(Pattern::key).contains("trend/rising");
        assertThat(report.anomalies()).contains(spike);
    }

    @Test
    void emptyInputBecomesResponseAnalyzerError() {
        PatternReport report = new PatternOrchestrator().register(new GapDetector())
            .detectAllPatterns(RecordTable.empty(), null, Map.of());

        assertThat(report.errors()).containsExactly("ResponseAnalyzer: cannot analyze empty data");
        assertThat(report.detectedPatterns()).isEmpty();
        assertThat(report.recordCount()).isZero();
    }

    @Test
    void invalidRowsBecomeResponseAnalyzerError() {
        List<Map<String, Object>> rows = List.of(Map.of("timestamp", "2023-01-01 10:00:00"));

        PatternReport report = new PatternOrchestrator().detectAllPatterns(rows, null, Map.of());

        assertThat(report.errors()).hasSize(1);
        assertThat(report.errors().get(0)).startsWith("ResponseAnalyzer: missing required fields");
        assertThat(report.advancedAnalysis()).isEmpty();
    }

    @Test
    void nullRowBecomesResponseAnalyzerError() {
        Map<String, Object> valid = Map.of(
            "timestamp", "2023-01-01 10:00:00",
            "counterparty_id", "alice",
            "direction", "sent");

        PatternReport report = new PatternOrchestrator().detectAllPatterns(Arrays.asList(valid, null), null, Map.of());

        assertThat(report.errors()).containsExactly("ResponseAnalyzer: missing required fields: row 1 is null");
        assertThat(report.recordCount()).isZero();
    }

    @Test
    void modelAnomaliesReachTheCompositeReport() {
        ResponseAnalyzer analyzer = ResponseAnalyzer.builder()
            .augmentationService((model, table, aliases) -> Optional.of(new Augmentation(model, Map.of(),
                List.of(Map.of("type", "ml_outlier", "severity", 0.4)))))
            .build();

        PatternReport report = new PatternOrchestrator(analyzer).detectAllPatterns(quietWeekend(), null, Map.of());

        assertThat(report.anomalies()).extracting(Anomaly::type).contains("ml_outlier");
    }

    @Test
    void collaboratorProblemsAreListedWithoutAbortingDetection() {
        ResultCache broken = new ResultCache() {
            @Override
            public Optional<Object> get(CacheKey key) {
                throw new IllegalStateException("offline");
            }

            @Override
            public void put(CacheKey key, Object value) {
                // accepted
            }
        };
        ResponseAnalyzer analyzer = ResponseAnalyzer.builder()
            .cache(broken)
            .augmentationService((model, table, aliases) -> {
                throw new ModelNotTrainedException(model);
            })
            .build();

        PatternReport report = new PatternOrchestrator(analyzer).detectAllPatterns(quietWeekend(), null, Map.of());

        assertThat(report.errors()).containsExactly("cache: offline", "ml: model responsepatternmodel is not trained");
        assertThat(report.detectedPatterns()).isNotEmpty();
    }

    @Test
    void parametersOverrideConfiguredMinimumGap() {
        PatternOrchestrator orchestrator = new PatternOrchestrator().register(new GapDetector());

        PatternReport report = orchestrator.detectAllPatterns(quietWeekend(), null, Map.of("min_gap_hours", 0.5));

        assertThat(report.detectedPatterns()).filteredOn(p -> p.subtype().equals("communication_gap")).hasSize(2);
    }

    @Test
    void discoversGapDetectorThroughServiceLoader() {
        assertThat(SiblingDetectorIO.getAvailableNames()).contains(GapDetector.NAME);
        assertThat(SiblingDetectorIO.isAvailable(GapDetector.NAME)).isTrue();
        assertThat(SiblingDetectorIO.get(GapDetector.NAME)).get().isInstanceOf(GapDetector.class);

        PatternOrchestrator orchestrator = new PatternOrchestrator().registerAllAvailable();
        assertThat(orchestrator.getDetectorNames()).contains(GapDetector.NAME);
    }

    @Test
    void unknownDetectorNameIsRejected() {
        assertThatThrownBy(() -> new PatternOrchestrator().register("seasonality"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("No detector found with name: seasonality");

        assertThat(new PatternOrchestrator().registerIfAvailable("seasonality").getDetectorNames()).isEmpty();
    }
}
