package io.commtrace.analysis.config;

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
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class AnalysisConfigTest {

    @Test
    void defaultsMatchDocumentedValues() {
        AnalysisConfig config = AnalysisConfig.defaults();

        assertThat(config.quickThresholdSeconds()).isEqualTo(300.0);
        assertThat(config.delayedThresholdSeconds()).isEqualTo(3600.0);
        assertThat(config.conversationTimeout()).isEqualTo(Duration.ofHours(1));
        assertThat(config.balanceLow()).isEqualTo(0.4);
        assertThat(config.balanceHigh()).isEqualTo(0.6);
        assertThat(config.reciprocityTimeout()).isEqualTo(Duration.ofSeconds(3600));
        assertThat(config.cacheTtl()).isEqualTo(Duration.ofSeconds(3600));
        assertThat(config.minGapHours()).isEqualTo(24.0);
    }

    @Test
    void nestedYamlIsFlattenedIntoDottedKeys() {
        String yaml = String.join("\n",
            "analysis:",
            "  response:",
            "    quick_threshold_sec: 120",
            "    conversation_timeout_hours: 0.5",
            "  reciprocity:",
            "    balance_low: 0.3",
            "  gaps:",
            "    min_gap_hours: 12");

        AnalysisConfig config = AnalysisConfig.fromYaml(yaml);

        assertThat(config.quickThresholdSeconds()).isEqualTo(120.0);
        assertThat(config.conversationTimeout()).isEqualTo(Duration.ofMinutes(30));
        assertThat(config.balanceLow()).isEqualTo(0.3);
        assertThat(config.minGapHours()).isEqualTo(12.0);
        assertThat(config.delayedThresholdSeconds()).isEqualTo(3600.0);
    }

    @Test
    void flatDottedYamlKeysAreAccepted() {
        AnalysisConfig config = AnalysisConfig.fromYaml(
            "analysis.response.delayed_threshold_sec: 1800\nanalysis.cache.ttl_seconds: 60\n");

        assertThat(config.delayedThresholdSeconds()).isEqualTo(1800.0);
        assertThat(config.cacheTtl()).isEqualTo(Duration.ofSeconds(60));
    }

    @Test
    void emptyDocumentYieldsDefaults() {
        assertThat(AnalysisConfig.fromYaml("")).isEqualTo(AnalysisConfig.defaults());
    }

    @Test
    void unknownKeysAreIgnored() {
        AnalysisConfig config = AnalysisConfig.fromMap(Map.of("analysis.unknown.key", 5, "other", "x"));

        assertThat(config).isEqualTo(AnalysisConfig.defaults());
    }

    @Test
    void numericStringsAreParsed() {
        AnalysisConfig config = AnalysisConfig.fromMap(Map.of(AnalysisConfig.BALANCE_HIGH, " 0.75 "));

        assertThat(config.balanceHigh()).isEqualTo(0.75);
    }

    @Test
    void nonNumericValuesAreRejected() {
        assertThatThrownBy(() -> AnalysisConfig.fromMap(Map.of(AnalysisConfig.QUICK_THRESHOLD_SEC, "fast")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining(AnalysisConfig.QUICK_THRESHOLD_SEC);
    }

    @Test
    void invertedBalanceBandIsRejected() {
        assertThatThrownBy(() -> AnalysisConfig.builder().balanceLow(0.7).balanceHigh(0.2).build())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("low <= high");
    }

    @Test
    void nonMappingDocumentIsRejected() {
        assertThatThrownBy(() -> AnalysisConfig.fromYaml("- a\n- b\n"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("YAML mapping");
    }

    @Test
    void loadsFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("commtrace.yaml");
        Files.writeString(file, "analysis:\n  reciprocity:\n    conversation_timeout_seconds: 600\n");

        AnalysisConfig config = AnalysisConfig.load(file);

        assertThat(config.reciprocityTimeout()).isEqualTo(Duration.ofMinutes(10));
    }

    @Test
    void asMapExposesEveryKey() {
        assertThat(AnalysisConfig.defaults().asMap())
            .containsKeys(
                AnalysisConfig.QUICK_THRESHOLD_SEC,
                AnalysisConfig.DELAYED_THRESHOLD_SEC,
                AnalysisConfig.CONVERSATION_TIMEOUT_HOURS,
                AnalysisConfig.BALANCE_LOW,
                AnalysisConfig.BALANCE_HIGH,
                AnalysisConfig.RECIPROCITY_TIMEOUT_SECONDS,
                AnalysisConfig.CACHE_TTL_SECONDS,
                AnalysisConfig.MIN_GAP_HOURS);
    }

    @Test
    void nonPositiveCacheTtlIsRejected() {
        assertThatThrownBy(() -> AnalysisConfig.fromYaml("analysis.cache.ttl_seconds: 0\n"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("ttl");
    }

    @Test
    void malformedYamlIsRejected() {
        assertThatThrownBy(() -> AnalysisConfig.fromYaml("analysis: [unclosed"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageStartingWith("Invalid YAML configuration");
    }
}
