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

import io.commtrace.analysis.config.AnalysisConfig;
import io.commtrace.analysis.segment.Conversation;
import io.commtrace.analysis.segment.ConversationSegmenter;
import io.commtrace.records.CommRecord;
import io.commtrace.records.Direction;
import io.commtrace.records.RecordTable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/// Per-counterparty message balance and conversation initiation.
///
/// Initiations are counted on each counterparty's own timeline, segmented with the
/// reciprocity timeout rather than the global conversation timeout: the direction of
/// the first record of every such conversation is one initiation for that side.
public final class ReciprocityAnalyzer {

    private static final Logger logger = LogManager.getLogger(ReciprocityAnalyzer.class);

    private final double balanceLow;
    private final double balanceHigh;
    private final ConversationSegmenter segmenter;

    public ReciprocityAnalyzer(AnalysisConfig config) {
        this.balanceLow = config.balanceLow();
        this.balanceHigh = config.balanceHigh();
        this.segmenter = new ConversationSegmenter(config.reciprocityTimeout());
    }

    /// @param table the records
    /// @return the report; empty maps for an empty table
    public ReciprocityReport analyze(RecordTable table) {
        Map<String, ReciprocitySummary> contacts = new TreeMap<>();
        int userInitiations = 0;
        int contactInitiations = 0;

        for (Map.Entry<String, List<CommRecord>> entry : table.byCounterparty().entrySet()) {
            ReciprocitySummary summary = summarize(entry.getKey(), entry.getValue());
            contacts.put(entry.getKey(), summary);
            userInitiations += summary.userInitiations();
            contactInitiations += summary.contactInitiations();
        }

        Map<String, Integer> distribution = new LinkedHashMap<>();
        for (RelationshipBalance balance : RelationshipBalance.values()) {
            distribution.put(balance.label(), 0);
        }
        List<String> oneSided = new ArrayList<>();
        for (ReciprocitySummary summary : contacts.values()) {
            distribution.merge(summary.relationshipBalance().label(), 1, Integer::sum);
            if (summary.relationshipBalance().isOneSided()) {
                oneSided.add(summary.counterparty());
            }
        }

        int totalInitiations = userInitiations + contactInitiations;
        Double overallRatio = totalInitiations == 0 ? null : (double) userInitiations / totalInitiations;
        logger.debug("Reciprocity: {} counterparties, {} initiations, {} one-sided",
            contacts.size(), totalInitiations, oneSided.size());
        return new ReciprocityReport(contacts, userInitiations, contactInitiations, overallRatio,
            distribution, oneSided);
    }

    /// Summarizes one counterparty's time-ordered records.
    ///
    /// @param counterparty the counterparty
    /// @param records its records
    /// @return the summary
    public ReciprocitySummary summarize(String counterparty, List<CommRecord> records) {
        int sent = 0;
        int received = 0;
        for (CommRecord record : records) {
            if (record.isSent()) {
                sent++;
            } else {
                received++;
            }
        }
        int total = sent + received;

        int userStarts = 0;
        int contactStarts = 0;
        for (Conversation conversation : segmenter.segment(records)) {
            if (conversation.initiatorDirection() == Direction.SENT) {
                userStarts++;
            } else {
                contactStarts++;
            }
        }
        int initiations = userStarts + contactStarts;

        return new ReciprocitySummary(
            counterparty,
            sent,
            received,
            total,
            total == 0 ? null : (double) sent / total,
            total == 0 ? null : (double) received / total,
            RelationshipBalance.classify(sent, received, balanceLow, balanceHigh),
            userStarts,
            contactStarts,
            initiations,
            initiations == 0 ? null : (double) userStarts / initiations,
            ReciprocitySummary.messageRatio(sent, received));
    }
}
