package io.commtrace.analysis.flows;

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
import io.commtrace.analysis.config.AnalysisConfig;
import io.commtrace.analysis.flows.ConversationFlowSummary.SequenceCount;
import io.commtrace.analysis.flows.ConversationFlowSummary.TurnTakingMetrics;
import io.commtrace.analysis.segment.ConversationSegmenter;
import io.commtrace.records.RecordTable;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ConversationFlowAnalyzerTest {

    private final ConversationFlowAnalyzer analyzer = new ConversationFlowAnalyzer(AnalysisConfig.defaults());

    @Test
    void summarizesTwoBlocks() {
        ConversationFlowSummary summary = analyzer.analyze(RecordFixtures.twoBlocks());

        assertThat(summary.conversationCount()).isEqualTo(3);
        assertThat(summary.averageMessageCount()).isCloseTo(8 / 3.0, within(1e-9));
        assertThat(summary.averageDurationSeconds()).isCloseTo((420 + 5400 + 0) / 3.0, within(1e-9));
        assertThat(summary.distributionByHour()).containsEntry(10, 1).containsEntry(14, 1).containsEntry(17, 1);
        assertThat(summary.distributionByDay()).containsExactly(entry("Monday", 3));

        assertThat(summary.commonSequences()).containsExactly(
            new SequenceCount(List.of("received", "sent", "received"), 2),
            new SequenceCount(List.of("sent", "received", "sent"), 1));
    }

    @Test
    void turnTakingCountsRunsInLongConversationsOnly() {
        RecordTable table = RecordFixtures.table(
            "2023-01-02T09:00 alice sent",
            "2023-01-02T09:01 alice sent",
            "2023-01-02T09:02 alice sent",
            "2023-01-02T09:03 alice sent",
            "2023-01-02T09:04 alice sent",
            "2023-01-02T09:05 alice received",
            "2023-01-02T09:06 alice sent",
            // a two-record conversation that is ignored for turns
            "2023-01-02T20:00 alice received",
            "2023-01-02T20:01 alice received");

        TurnTakingMetrics turns = analyzer.analyze(table).turnTaking();

        assertThat(turns.avgUserTurnLength()).isEqualTo(3.0);
        assertThat(turns.maxUserTurnLength()).isEqualTo(5);
        assertThat(turns.avgContactTurnLength()).isEqualTo(1.0);
        assertThat(turns.maxContactTurnLength()).isEqualTo(1);
        assertThat(turns.monologueCount()).isEqualTo(1);
    }

    @Test
    void topSequencesAreCappedAtFive() {
        RecordTable table = RecordFixtures.table(
            "2023-01-02T09:00 alice sent",
            "2023-01-02T09:01 alice sent",
            "2023-01-02T09:02 alice sent",
            "2023-01-02T09:03 alice received",
            "2023-01-02T09:04 alice received",
            "2023-01-02T09:05 alice received",
            "2023-01-02T09:06 alice sent",
            "2023-01-02T09:07 alice received",
            "2023-01-02T09:08 alice sent",
            "2023-01-02T09:09 alice sent");

        List<SequenceCount> sequences = analyzer.analyze(table).commonSequences();

        assertThat(sequences).hasSize(5);
        assertThat(sequences).isSortedAccordingTo((a, b) -> Integer.compare(b.count(), a.count()));
    }

    @Test
    void shortConversationsHaveNoTurnMetrics() {
        ConversationFlowSummary summary = analyzer.analyze(RecordFixtures.table(
            "2023-01-02T09:00 alice sent",
            "2023-01-02T09:01 alice received"));

        assertThat(summary.conversationCount()).isEqualTo(1);
        assertThat(summary.commonSequences()).isEmpty();
        assertThat(summary.turnTaking().avgUserTurnLength()).isNull();
        assertThat(summary.turnTaking().monologueCount()).isZero();
    }

    @Test
    void unboundedTimeoutMergesEverything() {
        ConversationFlowAnalyzer unbounded =
            new ConversationFlowAnalyzer(new ConversationSegmenter(ConversationSegmenter.UNBOUNDED));

        assertThat(unbounded.analyze(RecordFixtures.twoBlocks()).conversationCount()).isEqualTo(1);
    }

    @Test
    void emptyTableGivesEmptySummary() {
        ConversationFlowSummary summary = analyzer.analyze(RecordTable.empty());

        assertThat(summary.conversationCount()).isZero();
        assertThat(summary.conversations()).isEmpty();
    }
}
