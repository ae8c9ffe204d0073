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

import io.commtrace.analysis.segment.Conversation;

import java.util.List;
import java.util.Map;

/// Dataset-wide conversation statistics.
///
/// @param conversationCount number of conversations
/// @param averageDurationSeconds mean conversation duration, null without conversations
/// @param averageMessageCount mean records per conversation, null without conversations
/// @param distributionByHour start hour to conversation count
/// @param distributionByDay start day name to conversation count
/// @param commonSequences up to five most frequent three-record direction sequences
/// @param turnTaking turn length metrics over conversations of three or more records
/// @param conversations the conversations in time order
public record ConversationFlowSummary(
    int conversationCount,
    Double averageDurationSeconds,
    Double averageMessageCount,
    Map<Integer, Integer> distributionByHour,
    Map<String, Integer> distributionByDay,
    List<SequenceCount> commonSequences,
    TurnTakingMetrics turnTaking,
    List<Conversation> conversations
) {

    /// A direction sequence and how often it occurs.
    ///
    /// @param sequence direction labels, e.g. `[received, sent, received]`
    /// @param count occurrences over all sliding windows
    public record SequenceCount(List<String> sequence, int count) {
    }

    /// Lengths of runs of same-direction records ("turns").
    ///
    /// @param avgUserTurnLength mean run length of sent records, null without any
    /// @param avgContactTurnLength mean run length of received records, null without any
    /// @param maxUserTurnLength longest sent run, null without any
    /// @param maxContactTurnLength longest received run, null without any
    /// @param monologueCount runs of five or more records from either side
    public record TurnTakingMetrics(
        Double avgUserTurnLength,
        Double avgContactTurnLength,
        Integer maxUserTurnLength,
        Integer maxContactTurnLength,
        int monologueCount
    ) {
        public static TurnTakingMetrics empty() {
            return new TurnTakingMetrics(null, null, null, null, 0);
        }
    }

    public static ConversationFlowSummary empty() {
        return new ConversationFlowSummary(0, null, null, Map.of(), Map.of(), List.of(),
            TurnTakingMetrics.empty(), List.of());
    }
}
