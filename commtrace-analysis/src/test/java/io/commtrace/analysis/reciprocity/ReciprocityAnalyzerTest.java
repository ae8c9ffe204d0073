package io.commtrace.analysis.reciprocity;

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
import io.commtrace.records.RecordTable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

class ReciprocityAnalyzerTest {

    private final ReciprocityAnalyzer analyzer = new ReciprocityAnalyzer(AnalysisConfig.defaults());

    @Test
    @DisplayName("send-only counterparty is one-sided with an infinite message ratio")
    void sendOnlyCounterparty() {
        ReciprocityReport report = analyzer.analyze(RecordFixtures.sendOnly());

        ReciprocitySummary carol = report.contacts().get("carol");
        assertThat(carol.sentCount()).isEqualTo(3);
        assertThat(carol.receivedCount()).isZero();
        assertThat(carol.relationshipBalance()).isEqualTo(RelationshipBalance.ONLY_SENT);
        assertThat(carol.messageRatio()).isEqualTo(Double.POSITIVE_INFINITY);
        assertThat(carol.sentRatio()).isEqualTo(1.0);
        assertThat(carol.userInitiations()).isEqualTo(3);
        assertThat(carol.contactInitiations()).isZero();

        assertThat(report.oneSidedContacts()).containsExactly("carol");
        assertThat(report.overallInitiationRatio()).isEqualTo(1.0);
        assertThat(report.balanceDistribution()).containsEntry("only_sent", 1).containsEntry("balanced", 0);
    }

    @Test
    void twoBlocksAreBalanced() {
        ReciprocityReport report = analyzer.analyze(RecordFixtures.twoBlocks());

        assertThat(report.contacts().keySet()).containsExactly("alice", "bob");
        ReciprocitySummary alice = report.contacts().get("alice");
        assertThat(alice.relationshipBalance()).isEqualTo(RelationshipBalance.BALANCED);
        assertThat(alice.messageRatio()).isEqualTo(1.0);
        assertThat(alice.userInitiations()).isEqualTo(1);

        // bob's 15:30 -> 17:00 gap exceeds the hour, so his second block is a new conversation
        ReciprocitySummary bob = report.contacts().get("bob");
        assertThat(bob.contactInitiations()).isEqualTo(1);
        assertThat(bob.userInitiations()).isEqualTo(1);
        assertThat(bob.totalInitiations()).isEqualTo(2);
        assertThat(bob.userInitiationRatio()).isEqualTo(0.5);

        assertThat(report.userInitiations()).isEqualTo(2);
        assertThat(report.contactInitiations()).isEqualTo(1);
        assertThat(report.totalInitiations()).isEqualTo(3);
        assertThat(report.oneSidedContacts()).isEmpty();
    }

    @Test
    void emptyTableGivesEmptyReport() {
        ReciprocityReport report = analyzer.analyze(RecordTable.empty());

        assertThat(report.contacts()).isEmpty();
        assertThat(report.overallInitiationRatio()).isNull();
        assertThat(report.totalInitiations()).isZero();
    }

    @Test
    void receiveOnlyCounterpartyHasZeroMessageRatio() {
        ReciprocityReport report = analyzer.analyze(RecordFixtures.table(
            "2023-01-01T08:00 dave received",
            "2023-01-01T08:01 dave received"));

        ReciprocitySummary dave = report.contacts().get("dave");
        assertThat(dave.relationshipBalance()).isEqualTo(RelationshipBalance.ONLY_RECEIVED);
        assertThat(dave.messageRatio()).isZero();
        assertThat(dave.contactInitiations()).isEqualTo(1);
    }

    @Nested
    class Classification {

        @ParameterizedTest(name = "sent={0} received={1} -> {2}")
        @CsvSource({
            "0, 0, no_messages",
            "3, 0, only_sent",
            "0, 3, only_received",
            "1, 3, mostly_received",
            "3, 1, mostly_sent",
            "2, 3, balanced",
            "3, 2, balanced",
            "1, 1, balanced"
        })
        void classifiesBySentRatio(int sent, int received, String expected) {
            assertThat(RelationshipBalance.classify(sent, received, 0.4, 0.6).label()).isEqualTo(expected);
        }

        @Test
        void bandEdgesAreBalanced() {
            // 2 / 5 = 0.4 exactly
            assertThat(RelationshipBalance.classify(2, 3, 0.4, 0.6)).isEqualTo(RelationshipBalance.BALANCED);
        }

        @Test
        void messageRatioHandlesZeroReceived() {
            assertThat(ReciprocitySummary.messageRatio(4, 2)).isEqualTo(2.0);
            assertThat(ReciprocitySummary.messageRatio(4, 0)).isEqualTo(Double.POSITIVE_INFINITY);
            assertThat(ReciprocitySummary.messageRatio(0, 0)).isEqualTo(1.0);
            assertThat(ReciprocitySummary.messageRatio(0, 5)).isZero();
        }
    }
}
