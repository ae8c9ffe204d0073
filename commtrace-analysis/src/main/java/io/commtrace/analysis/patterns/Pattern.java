package io.commtrace.analysis.patterns;

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

import java.util.Map;
import java.util.Objects;

/// Uniform, scored description of a detected behavior.
///
/// `significance` is the producer's own score (about 0 to 3 for response patterns) and
/// is not comparable across producers. `patternSignificance` is the normalized score in
/// [0, 1] assigned by [SignificanceScorer]; it is null until the pattern has been scored.
///
/// @param patternType family, e.g. `response_time`, `reciprocity`, `conversation_flow`, `time`
/// @param subtype member of the family, e.g. `quick_responder`
/// @param description human readable summary
/// @param significance first-stage score
/// @param confidence in [0, 1]
/// @param occurrences number of observations backing the pattern
/// @param patternSignificance second-stage score, null before scoring
/// @param metadata supporting values
public record Pattern(
    String patternType,
    String subtype,
    String description,
    double significance,
    double confidence,
    int occurrences,
    Double patternSignificance,
    Map<String, Object> metadata
) {

    public Pattern {
        Objects.requireNonNull(patternType, "patternType cannot be null");
        if (confidence < 0 || confidence > 1 || Double.isNaN(confidence)) {
            throw new IllegalArgumentException("confidence must be within [0, 1], got " + confidence);
        }
        if (occurrences < 0) {
            throw new IllegalArgumentException("occurrences must not be negative, got " + occurrences);
        }
        metadata = metadata == null ? Map.of() : metadata;
    }

    /// @return an unscored pattern
    public static Pattern of(String patternType, String subtype, String description, double significance,
                             double confidence, int occurrences, Map<String, Object> metadata) {
        return new Pattern(patternType, subtype, description, significance, confidence, occurrences, null, metadata);
    }

    /// @param score second-stage score
    /// @return a copy carrying the score
    public Pattern withPatternSignificance(double score) {
        return new Pattern(patternType, subtype, description, significance, confidence, occurrences, score, metadata);
    }

    /// @return `patternType/subtype`
    public String key() {
        return patternType + "/" + subtype;
    }
}
