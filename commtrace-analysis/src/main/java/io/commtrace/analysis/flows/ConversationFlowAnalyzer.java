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

import io.commtrace.analysis.config.AnalysisConfig;
import io.commtrace.analysis.flows.ConversationFlowSummary.SequenceCount;
import io.commtrace.analysis.flows.ConversationFlowSummary.TurnTakingMetrics;
import io.commtrace.analysis.segment.Conversation;
import io.commtrace.analysis.segment.ConversationSegmenter;
import io.commtrace.records.CommRecord;
import io.commtrace.records.Direction;
import io.commtrace.records.RecordTable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.DayOfWeek;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/// Segments the whole dataset into conversations and describes their shape.
///
/// Sequence and turn metrics only consider conversations with at least three records.
public final class ConversationFlowAnalyzer {

    private static final Logger logger = LogManager.getLogger(ConversationFlowAnalyzer.class);

    static final int SEQUENCE_LENGTH = 3;
    static final int TOP_SEQUENCES = 5;
    static final int MONOLOGUE_LENGTH = 5;

    private final ConversationSegmenter segmenter;

    public ConversationFlowAnalyzer(AnalysisConfig config) {
        this(new ConversationSegmenter(config.conversationTimeout()));
    }

    public ConversationFlowAnalyzer(ConversationSegmenter segmenter) {
        this.segmenter = segmenter;
    }

    public ConversationFlowSummary analyze(RecordTable table) {
        List<Conversation> conversations = segmenter.segment(table.sortedByTime());
        if (conversations.isEmpty()) {
            logger.warn("No conversations identified");
            return ConversationFlowSummary.empty();
        }

        double durationSum = 0;
        double messageSum = 0;
        Map<Integer, Integer> byHour = new TreeMap<>();
        Map<DayOfWeek, Integer> byDayOfWeek = new EnumMap<>(DayOfWeek.class);
        Map<List<String>, Integer> sequences = new LinkedHashMap<>();
        List<Integer> userTurns = new ArrayList<>();
        List<Integer> contactTurns = new ArrayList<>();

        for (Conversation conversation : conversations) {
            durationSum += conversation.durationSeconds();
            messageSum += conversation.messageCount();
            byHour.merge(conversation.startTime().getHour(), 1, Integer::sum);
            byDayOfWeek.merge(conversation.startTime().getDayOfWeek(), 1, Integer::sum);

            List<CommRecord> records = conversation.records();
            if (records.size() < SEQUENCE_LENGTH) {
                continue;
            }
            for (int i = 0; i + SEQUENCE_LENGTH <= records.size(); i++) {
                List<String> window = new ArrayList<>(SEQUENCE_LENGTH);
                for (int j = i; j < i + SEQUENCE_LENGTH; j++) {
                    window.add(records.get(j).direction().label());
                }
                sequences.merge(List.copyOf(window), 1, Integer::sum);
            }
            collectTurns(records, userTurns, contactTurns);
        }

        Map<String, Integer> byDay = new LinkedHashMap<>();
        byDayOfWeek.forEach((day, count) -> byDay.put(day.getDisplayName(TextStyle.FULL, Locale.ENGLISH), count));

        int count = conversations.size();
        logger.debug("Conversation flows: {} conversations, {} distinct sequences", count, sequences.size());
        return new ConversationFlowSummary(
            count,
            durationSum / count,
            messageSum / count,
            byHour,
            byDay,
            topSequences(sequences),
            turnTaking(userTurns, contactTurns),
            conversations);
    }

    /// Ties keep first-appearance order.
    private static List<SequenceCount> topSequences(Map<List<String>, Integer> sequences) {
        List<SequenceCount> counts = new ArrayList<>();
        sequences.forEach((sequence, n) -> counts.add(new SequenceCount(sequence, n)));
        counts.sort((a, b) -> Integer.compare(b.count(), a.count()));
        return counts.size() > TOP_SEQUENCES ? List.copyOf(counts.subList(0, TOP_SEQUENCES)) : counts;
    }

    private static void collectTurns(List<CommRecord> records, List<Integer> userTurns, List<Integer> contactTurns) {
        Direction current = null;
        int length = 0;
        for (CommRecord record : records) {
            if (record.direction() != current) {
                if (length > 0) {
                    (current == Direction.SENT ? userTurns : contactTurns).add(length);
                }
                current = record.direction();
                length = 1;
            } else {
                length++;
            }
        }
        if (length > 0) {
            (current == Direction.SENT ? userTurns : contactTurns).add(length);
        }
    }

    private static TurnTakingMetrics turnTaking(List<Integer> userTurns, List<Integer> contactTurns) {
        int monologues = 0;
        for (int turn : userTurns) {
            if (turn >= MONOLOGUE_LENGTH) {
                monologues++;
            }
        }
        for (int turn : contactTurns) {
            if (turn >= MONOLOGUE_LENGTH) {
                monologues++;
            }
        }
        return new TurnTakingMetrics(
            average(userTurns),
            average(contactTurns),
            userTurns.isEmpty() ? null : userTurns.stream().mapToInt(Integer::intValue).max().getAsInt(),
            contactTurns.isEmpty() ? null : contactTurns.stream().mapToInt(Integer::intValue).max().getAsInt(),
            monologues);
    }

    private static Double average(List<Integer> values) {
        if (values.isEmpty()) {
            return null;
        }
        double sum = 0;
        for (int v : values) {
            sum += v;
        }
        return sum / values.size();
    }
}
