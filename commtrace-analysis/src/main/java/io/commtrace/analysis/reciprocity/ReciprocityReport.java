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

import java.util.List;
import java.util.Map;

/// Dataset-wide reciprocity result.
///
/// @param contacts counterparty to its summary, sorted by counterparty
/// @param userInitiations conversations the user started, over all counterparties
/// @param contactInitiations conversations counterparties started
/// @param overallInitiationRatio user / all initiations, null when there are none
/// @param balanceDistribution balance label to number of counterparties in that class
/// @param oneSidedContacts counterparties whose balance is `only_sent` or `only_received`
public record ReciprocityReport(
    Map<String, ReciprocitySummary> contacts,
    int userInitiations,
    int contactInitiations,
    Double overallInitiationRatio,
    Map<String, Integer> balanceDistribution,
    List<String> oneSidedContacts
) {

    public int totalInitiations() {
        return userInitiations + contactInitiations;
    }
}
