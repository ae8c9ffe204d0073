package io.commtrace.analysis;

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

/// Expected reply latency toward one counterparty.
///
/// @param counterparty the counterparty
/// @param expectedResponseTimeSeconds predicted latency, null when it cannot be predicted
/// @param confidence in [0, 1]
/// @param predictionMethod `statistical` or `model`, null when nothing was predicted
/// @param modelName model used for `model` predictions
/// @param error reason no prediction was made, null on success
public record ResponsePrediction(
    String counterparty,
    Double expectedResponseTimeSeconds,
    double confidence,
    String predictionMethod,
    String modelName,
    String error
) {

    public static final String STATISTICAL = "statistical";
    public static final String MODEL = "model";

    static ResponsePrediction failed(String counterparty, String error) {
        return new ResponsePrediction(counterparty, null, 0.0, null, null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
