package io.commtrace.analysis.segment;

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

import io.commtrace.records.CommRecord;
import io.commtrace.records.RecordTable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/// Splits a record sequence into conversations by inactivity timeout.
///
/// A record starts a new conversation when it is the first record or when the gap to
/// its predecessor is strictly greater than the timeout. Conversation ids are the
/// running count of start markers, starting at 1.
///
/// ```
///  10:00  10:02  10:05        14:00  15:00        17:00
///    |------|------|            |------|            |
///    \___ conversation 1 ___/   \_ conv 2 _/     conv 3     (timeout = 1h)
/// ```
///
/// Each instance carries its own timeout, so the global flow segmenter and the
/// per-counterparty initiation segmenter are configured independently.
public final class ConversationSegmenter {

    private static final Logger logger = LogManager.getLogger(ConversationSegmenter.class);

    /// A timeout no real record span can exceed.
    public static final Duration UNBOUNDED = ChronoUnit.FOREVER.getDuration();

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(3600);

    private final Duration timeout;

    public ConversationSegmenter() {
        this(DEFAULT_TIMEOUT);
    }

    /// @param timeout maximum gap inside a conversation; not negative
    public ConversationSegmenter(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout cannot be null");
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must not be negative: " + timeout);
        }
        this.timeout = timeout;
    }

    public Duration timeout() {
        return timeout;
    }

    /// Segments records into conversations. Input order is not assumed: records are
    /// stably sorted by time first, so ties keep their given order.
    ///
    /// @param records the records, possibly empty
    /// @return conversations in time order; empty for empty input
    public List<Conversation> segment(List<CommRecord> records) {
        List<CommRecord> sorted = new ArrayList<>(records);
        sorted.sort(Comparator.comparing(CommRecord::timestamp));

        List<Conversation> conversations = new ArrayList<>();
        List<CommRecord> current = new ArrayList<>();
        CommRecord previous = null;
        for (CommRecord record : sorted) {
            if (previous != null && startsNewConversation(previous, record)) {
                conversations.add(new Conversation(conversations.size() + 1, current));
                current = new ArrayList<>();
            }
            current.add(record);
            previous = record;
        }
        if (!current.isEmpty()) {
            conversations.add(new Conversation(conversations.size() + 1, current));
        }
        logger.debug("Segmented {} records into {} conversations (timeout {})",
            sorted.size(), conversations.size(), timeout);
        return conversations;
    }

    /// Segments every counterparty's timeline on its own.
    ///
    /// @param table the record table
    /// @return counterparty to its conversations, keys sorted
    public SortedMap<String, List<Conversation>> segmentByCounterparty(RecordTable table) {
        SortedMap<String, List<Conversation>> result = new TreeMap<>();
        for (Map.Entry<String, List<CommRecord>> entry : table.byCounterparty().entrySet()) {
            result.put(entry.getKey(), segment(entry.getValue()));
        }
        return result;
    }

    private boolean startsNewConversation(CommRecord previous, CommRecord current) {
        Duration gap = Duration.between(previous.timestamp(), current.timestamp());
        return gap.compareTo(timeout) > 0;
    }
}
