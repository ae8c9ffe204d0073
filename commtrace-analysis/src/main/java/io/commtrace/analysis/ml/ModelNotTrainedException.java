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

/**
 * Thrown when a prediction is requested from a model that has not been trained.
 */
public class ModelNotTrainedException extends Exception {

    private final String modelName;

    public ModelNotTrainedException(String modelName) {
        super("Model " + modelName + " is not trained");
        this.modelName = modelName;
    }

    public String getModelName() {
        return modelName;
    }
}
