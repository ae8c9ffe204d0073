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

import java.util.List;
import java.util.Map;

/// Aggregated reply latency statistics.
///
/// When no response pairs exist the result is still structurally valid: averages,
/// distribution and best hour are null, counts are zero, maps and lists are empty.
///
/// @param averageResponseTimeSeconds mean latency, null without pairs
/// @param medianResponseTimeSeconds median latency, null without pairs
/// @param pairCount number of response pairs
/// @param distribution distribution shape, null without pairs
/// @param perCounterpartyAverage counterparty to mean latency
/// @param byHourAverage hour of the reply (0-23) to mean latency
/// @param byDayAverage day of the reply (e.g. `Monday`) to mean latency
/// @param timeOfDayEffects `morning`, `afternoon`, `evening` to the mean of their hourly means
/// @param bestHour hour with the lowest mean latency, null without pairs
/// @param quickResponseCount pairs below the quick threshold
/// @param delayedResponseCount pairs above the delayed threshold
/// @param quickResponders counterparties whose mean latency is below the quick threshold
/// @param delayedResponders counterparties whose mean latency is above the delayed threshold
/// @param outliers pairs outside the IQR fences, in pair order
public record ResponseTimeStatistics(
    Double averageResponseTimeSeconds,
    Double medianResponseTimeSeconds,
    int pairCount,
    LatencyDistribution distribution,
    Map<String, Double> perCounterpartyAverage,
    Map<Integer, Double> byHourAverage,
    Map<String, Double> byDayAverage,
    Map<String, Double> timeOfDayEffects,
    Integer bestHour,
    int quickResponseCount,
    int delayedResponseCount,
    List<String> quickResponders,
    List<String> delayedResponders,
    List<ResponsePair> outliers
) {

    /// @return statistics for a dataset without any response pair
    public static ResponseTimeStatistics empty() {
        return new ResponseTimeStatistics(null, null, 0, null, Map.of(), Map.of(), Map.of(), Map.of(),
            null, 0, 0, List.of(), List.of(), List.of());
    }

    public boolean hasPairs() {
        return pairCount > 0;
    }
}
