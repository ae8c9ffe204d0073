package io.commtrace.analysis.responses;

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
import java.util.ArrayList;
import java.util.List;

/// Finds reply pairs: a received record directly followed by a sent record within the
/// same counterparty's time-ordered view.
///
/// Only adjacent records pair up. `received, received, sent` yields one pair, measured
/// from the second received record. Pairs whose latency is zero or negative (duplicate
/// timestamps, clock skew) are dropped.
public final class ResponsePairExtractor {

    private static final Logger logger = LogManager.getLogger(ResponsePairExtractor.class);

    /// @param table the records
    /// @return pairs ordered by counterparty, then time
    public List<ResponsePair> extract(RecordTable table) {
        List<CommRecord> sorted = table.sortedByCounterpartyThenTime();
        List<ResponsePair> pairs = new ArrayList<>();
        int dropped = 0;
        for (int i = 1; i < sorted.size(); i++) {
            CommRecord previous = sorted.get(i - 1);
            CommRecord current = sorted.get(i);
            if (!previous.counterparty().equals(current.counterparty())) {
                continue;
            }
            if (!previous.isReceived() || !current.isSent()) {
                continue;
            }
            double latency = Duration.between(previous.timestamp(), current.timestamp()).toMillis() / 1000d;
            if (latency <= 0) {
                dropped++;
                continue;
            }
            pairs.add(ResponsePair.of(current.counterparty(), previous.timestamp(), current.timestamp(),
                previous.ordinal(), current.ordinal(), latency));
        }
        if (dropped > 0) {
            logger.debug("Dropped {} response pairs with non-positive latency", dropped);
        }
        logger.debug("Extracted {} response pairs from {} records", pairs.size(), table.size());
        return pairs;
    }
}
