package io.commtrace.analysis.harness;

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

import io.commtrace.records.RecordTable;

import java.util.Map;

/// A pattern detector that runs beside the response analyzer: gaps, overlaps,
/// seasonality, trends.
///
/// ## Contract
///
/// - `analyze` receives the same validated table as the response analyzer, plus the
///   orchestrator's parameters (detector specific keys, e.g. `min_gap_hours`).
/// - Patterns must carry a confidence in [0, 1] and an occurrence count; the
///   orchestrator applies [io.commtrace.analysis.patterns.SignificanceScorer] to them.
/// - Problems are reported through [DetectorOutput#error()]. Thrown exceptions are
///   also tolerated: the orchestrator records them and carries on.
///
/// ## Registration
///
/// Implementations with a public no-arg constructor can be listed in
/// `META-INF/services/io.commtrace.analysis.harness.SiblingDetector` and annotated
/// with [DetectorName] to be found by [SiblingDetectorIO].
public interface SiblingDetector {

    /// @return the name errors and `advanced_analysis` entries are filed under
    String name();

    /// @param table the validated records
    /// @param params orchestrator parameters, never null
    /// @return the detector's output
    DetectorOutput analyze(RecordTable table, Map<String, Object> params);
}
