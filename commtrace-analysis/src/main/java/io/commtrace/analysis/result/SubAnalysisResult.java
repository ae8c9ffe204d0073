package io.commtrace.analysis.result;

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

import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/// Outcome of one sub-analysis: either a value or an error message, never both.
///
/// Sub-analyses are run through [#capture(String, Supplier)] so that no exception
/// crosses a sub-analysis boundary:
///
/// ```java
/// SubAnalysisResult<ReciprocityReport> reciprocity =
///     SubAnalysisResult.capture("reciprocity", () -> analyzer.analyze(table));
/// ```
///
/// In JSON a failure is rendered as `{"error": "<message>"}`.
///
/// @param <T> the value type
public final class SubAnalysisResult<T> {

    private final T value;
    private final String error;

    private SubAnalysisResult(T value, String error) {
        this.value = value;
        this.error = error;
    }

    public static <T> SubAnalysisResult<T> success(T value) {
        return new SubAnalysisResult<>(Objects.requireNonNull(value, "value cannot be null"), null);
    }

    public static <T> SubAnalysisResult<T> failure(String error) {
        return new SubAnalysisResult<>(null, Objects.requireNonNull(error, "error cannot be null"));
    }

    /// Runs a computation and captures any runtime failure as an error result.
    ///
    /// @param name sub-analysis name, prefixed to the error message
    /// @param computation the computation
    /// @param <T> the value type
    /// @return success with the value, or failure with `"error in <name>: <message>"`
    public static <T> SubAnalysisResult<T> capture(String name, Supplier<T> computation) {
        try {
            return success(computation.get());
        } catch (RuntimeException e) {
            return failure("error in " + name + ": " + describe(e));
        }
    }

    /// @return the exception message, or its type when it has none
    public static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    public Optional<T> value() {
        return Optional.ofNullable(value);
    }

    /// @return the value, or null for a failure
    public T valueOrNull() {
        return value;
    }

    public Optional<String> error() {
        return Optional.ofNullable(error);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SubAnalysisResult)) {
            return false;
        }
        SubAnalysisResult<?> that = (SubAnalysisResult<?>) o;
        return Objects.equals(value, that.value) && Objects.equals(error, that.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, error);
    }

    @Override
    public String toString() {
        return isSuccess() ? "Success[" + value + "]" : "Failure[" + error + "]";
    }
}
