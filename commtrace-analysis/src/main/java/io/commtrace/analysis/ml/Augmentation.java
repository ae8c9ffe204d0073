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

import java.util.List;
import java.util.Map;

/// Output of a model prediction, attached to a report as `ml_enhanced`.
///
/// @param modelName the model that produced it
/// @param predictions model specific prediction values
/// @param anomalies model detected anomalies, possibly empty
public record Augmentation(
    String modelName,
    Map<String, Object> predictions,
    List<Map<String, Object>> anomalies
) {

    public Augmentation {
        predictions = predictions == null ? Map.of() : predictions;
        anomalies = anomalies == null ? List.of() : anomalies;
    }
}
