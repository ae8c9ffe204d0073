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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/// Second-stage scoring shared by every pattern producer.
///
/// ```
/// pattern_significance = confidence * min(1, occurrences / max(1, 0.1 * recordCount))
/// ```
///
/// The score is at most 1 and never decreases when confidence or occurrences grow.
public final class SignificanceScorer {

    private SignificanceScorer() {
    }

    /// @param confidence pattern confidence in [0, 1]
    /// @param occurrences observations behind the pattern
    /// @param recordCount records in the analyzed dataset
    /// @return the second-stage score
    public static double score(double confidence, int occurrences, int recordCount) {
        double support = Math.min(1.0, occurrences / Math.max(1.0, recordCount * 0.1));
        return confidence * support;
    }

    /// Scores every pattern and sorts by descending score. Equal scores keep their input order.
    ///
    /// @param patterns patterns from any producer
    /// @param recordCount records in the analyzed dataset
    /// @return scored copies, best first
    public static List<Pattern> scoreAndRank(List<Pattern> patterns, int recordCount) {
        List<Pattern> scored = new ArrayList<>(patterns.size());
        for (Pattern pattern : patterns) {
            scored.add(pattern.withPatternSignificance(score(pattern.confidence(), pattern.occurrences(), recordCount)));
        }
        scored.sort(Comparator.comparingDouble(Pattern::patternSignificance).reversed());
        return scored;
    }

    /// First-stage significance mapped onto a [0, 1] confidence.
    ///
    /// @param significance first-stage score on the 0 to 3 scale
    /// @return `significance / 3` clamped to [0, 1]
    public static double confidenceFromSignificance(double significance) {
        return clamp(significance / 3.0, 0.0, 1.0);
    }

    /// @param patterns patterns to filter
    /// @param minConfidence inclusive lower bound
    /// @param maxConfidence exclusive upper bound; 1.0 also admits confidence 1.0
    /// @return patterns whose confidence lies in the range, order kept
    public static List<Pattern> filterByConfidence(List<Pattern> patterns, double minConfidence, double maxConfidence) {
        List<Pattern> kept = new ArrayList<>();
        for (Pattern pattern : patterns) {
            double c = pattern.confidence();
            boolean belowMax = c < maxConfidence || (maxConfidence >= 1.0 && c <= 1.0);
            if (c >= minConfidence && belowMax) {
                kept.add(pattern);
            }
        }
        return kept;
    }

    static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
