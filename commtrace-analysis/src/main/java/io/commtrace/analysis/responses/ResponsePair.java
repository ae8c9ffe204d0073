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

import java.time.LocalDateTime;

/// A received record and the sent record that immediately follows it for the same
/// counterparty. Latency is always strictly positive.
///
/// @param counterparty the counterparty of both records
/// @param receivedAt timestamp of the received record
/// @param sentAt timestamp of the reply
/// @param receivedOrdinal input position of the received record
/// @param sentOrdinal input position of the reply
/// @param latencySeconds reply delay in seconds, millisecond precision
/// @param isOutlier latency lies outside the IQR fences of all pairs
/// @param isQuick latency below the quick threshold
/// @param isDelayed latency above the delayed threshold
public record ResponsePair(
    String counterparty,
    LocalDateTime receivedAt,
    LocalDateTime sentAt,
    int receivedOrdinal,
    int sentOrdinal,
    double latencySeconds,
    boolean isOutlier,
    boolean isQuick,
    boolean isDelayed
) {

    public ResponsePair {
        if (!(latencySeconds > 0)) {
            throw new IllegalArgumentException("latency must be positive, got " + latencySeconds);
        }
    }

    /// @return an unclassified pair
    static ResponsePair of(String counterparty, LocalDateTime receivedAt, LocalDateTime sentAt,
                           int receivedOrdinal, int sentOrdinal, double latencySeconds) {
        return new ResponsePair(counterparty, receivedAt, sentAt, receivedOrdinal, sentOrdinal,
            latencySeconds, false, false, false);
    }

    /// @return a copy carrying the given classification flags
    public ResponsePair classified(boolean outlier, boolean quick, boolean delayed) {
        return new ResponsePair(counterparty, receivedAt, sentAt, receivedOrdinal, sentOrdinal,
            latencySeconds, outlier, quick, delayed);
    }
}
