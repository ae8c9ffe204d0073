package io.commtrace.analysis.ml;

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

import io.commtrace.records.FieldAliases;
import io.commtrace.records.RecordTable;

import java.util.Optional;

/// Boundary to an optional, separately trained model service.
///
/// Callers treat every outcome other than a present [Augmentation] as "no augmentation":
/// an empty result, a [ModelNotTrainedException], or any runtime failure. None of them
/// fail the analysis.
@FunctionalInterface
public interface AugmentationService {

    /// Model consulted to augment a full response analysis report.
    String PATTERN_MODEL = "ResponsePatternModel";

    /// Model consulted for per-counterparty response time predictions.
    String RESPONSE_MODEL = "ResponseModel";

    /// @param modelName the model to consult
    /// @param table the records
    /// @param aliases the field aliases the records were loaded with
    /// @return the prediction, or empty when the model has nothing to add
    /// @throws ModelNotTrainedException if the model has not been trained
    Optional<Augmentation> predict(String modelName, RecordTable table, FieldAliases aliases)
        throws ModelNotTrainedException;
}
