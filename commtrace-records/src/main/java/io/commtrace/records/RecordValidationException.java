package io.commtrace.records;

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

/// Thrown when input rows cannot be turned into a valid [RecordTable].
///
/// Covers empty datasets, missing required fields, direction values other than
/// `sent`/`received`, and timestamps that cannot be parsed.
public class RecordValidationException extends RuntimeException {

    public RecordValidationException(String message) {
        super(message);
    }

    public RecordValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
