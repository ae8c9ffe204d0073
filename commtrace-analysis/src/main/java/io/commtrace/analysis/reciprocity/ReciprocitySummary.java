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

/// Message balance and initiation behavior for one counterparty.
///
/// @param counterparty the counterparty
/// @param sentCount messages sent to the counterparty
/// @param receivedCount messages received from the counterparty
/// @param total sum of both counts
/// @param sentRatio sent / total, null when total is 0
/// @param receivedRatio received / total, null when total is 0
/// @param relationshipBalance balance class, always defined
/// @param userInitiations conversations started by a sent message
/// @param contactInitiations conversations started by a received message
/// @param totalInitiations sum of both initiation counts
/// @param userInitiationRatio user / total initiations, null when there are none
/// @param messageRatio sent / received; infinite when only sent, 0 when only received, 1 when empty
public record ReciprocitySummary(
    String counterparty,
    int sentCount,
    int receivedCount,
    int total,
    Double sentRatio,
    Double receivedRatio,
    RelationshipBalance relationshipBalance,
    int userInitiations,
    int contactInitiations,
    int totalInitiations,
    Double userInitiationRatio,
    double messageRatio
) {

    /// @param sent sent message count
    /// @param received received message count
    /// @return sent / received with the one-sided cases defined
    public static double messageRatio(int sent, int received) {
        if (received == 0) {
            return sent > 0 ? Double.POSITIVE_INFINITY : 1.0;
        }
        return (double) sent / received;
    }
}
