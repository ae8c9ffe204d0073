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
import io.commtrace.records.Direction;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/// A maximal run of records whose consecutive gaps do not exceed the segmenter timeout.
///
/// Instances are immutable and derived on every analysis call. The member records are
/// kept for downstream analyzers but are not serialized.
public final class Conversation {

    private final int id;
    private final LocalDateTime startTime;
    private final LocalDateTime endTime;
    private final double durationSeconds;
    private final int messageCount;
    private final List<String> counterpartiesInvolved;
    private final Direction initiatorDirection;
    private final Direction terminatorDirection;
    private final transient List<CommRecord> records;

    /// @param id 1-based running count of conversation starts
    /// @param records the member records in time order, not empty
    Conversation(int id, List<CommRecord> records) {
        if (records.isEmpty()) {
            throw new IllegalArgumentException("A conversation requires at least one record");
        }
        this.id = id;
        this.records = Collections.unmodifiableList(new ArrayList<>(records));
        CommRecord first = records.get(0);
        CommRecord last = records.get(records.size() - 1);
        this.startTime = first.timestamp();
        this.endTime = last.timestamp();
        this.durationSeconds = Duration.between(startTime, endTime).toMillis() / 1000d;
        this.messageCount = records.size();
        Set<String> involved = new LinkedHashSet<>();
        for (CommRecord record : records) {
            involved.add(record.counterparty());
        }
        this.counterpartiesInvolved = List.copyOf(involved);
        this.initiatorDirection = first.direction();
        this.terminatorDirection = last.direction();
    }

    public int id() {
        return id;
    }

    public LocalDateTime startTime() {
        return startTime;
    }

    public LocalDateTime endTime() {
        return endTime;
    }

    public double durationSeconds() {
        return durationSeconds;
    }

    public int messageCount() {
        return messageCount;
    }

    /// @return counterparties in order of first appearance
    public List<String> counterpartiesInvolved() {
        return counterpartiesInvolved;
    }

    public Direction initiatorDirection() {
        return initiatorDirection;
    }

    public Direction terminatorDirection() {
        return terminatorDirection;
    }

    public List<CommRecord> records() {
        return records;
    }

    @Override
    public String toString() {
        return "Conversation[id=" + id + ", start=" + startTime + ", messages=" + messageCount
            + ", duration=" + durationSeconds + "s]";
    }
}
