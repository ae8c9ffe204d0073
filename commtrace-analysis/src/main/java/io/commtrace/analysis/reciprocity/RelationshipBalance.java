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

import com.google.gson.annotations.SerializedName;

/// Sent/received balance of one relationship.
public enum RelationshipBalance {
    @SerializedName("balanced") BALANCED("balanced"),
    @SerializedName("mostly_sent") MOSTLY_SENT("mostly_sent"),
    @SerializedName("mostly_received") MOSTLY_RECEIVED("mostly_received"),
    @SerializedName("only_sent") ONLY_SENT("only_sent"),
    @SerializedName("only_received") ONLY_RECEIVED("only_received"),
    @SerializedName("no_messages") NO_MESSAGES("no_messages");

    private final String label;

    RelationshipBalance(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /// Classifies a relationship. Rules are applied in order:
    ///
    /// 1. no messages at all: [#NO_MESSAGES]
    /// 2. nothing received: [#ONLY_SENT]
    /// 3. nothing sent: [#ONLY_RECEIVED]
    /// 4. sent ratio below `low`: [#MOSTLY_RECEIVED]
    /// 5. sent ratio above `high`: [#MOSTLY_SENT]
    /// 6. otherwise [#BALANCED]
    ///
    /// @param sent sent message count
    /// @param received received message count
    /// @param low lower sent-ratio threshold
    /// @param high upper sent-ratio threshold
    /// @return the balance, never null
    public static RelationshipBalance classify(long sent, long received, double low, double high) {
        long total = sent + received;
        if (total == 0) {
            return NO_MESSAGES;
        }
        if (received == 0) {
            return ONLY_SENT;
        }
        if (sent == 0) {
            return ONLY_RECEIVED;
        }
        double sentRatio = (double) sent / total;
        if (sentRatio < low) {
            return MOSTLY_RECEIVED;
        }
        if (sentRatio > high) {
            return MOSTLY_SENT;
        }
        return BALANCED;
    }

    /// @return true for relationships where only one side ever communicated
    public boolean isOneSided() {
        return this == ONLY_SENT || this == ONLY_RECEIVED;
    }

    @Override
    public String toString() {
        return label;
    }
}
