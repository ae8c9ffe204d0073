package io.commtrace.analysis.json;

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

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonSerializationContext;
import com.google.gson.JsonSerializer;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;
import io.commtrace.analysis.result.SubAnalysisResult;
import io.commtrace.records.Direction;

import java.io.IOException;
import java.lang.reflect.Type;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/// Centralized Gson configuration for analysis reports.
///
/// ## Configuration
///
/// | Feature | Setting | Purpose |
/// |---------|---------|---------|
/// | Field naming | lower case with underscores | `response_times`, `pattern_significance` |
/// | Pretty printing | Enabled | Human-readable reports |
/// | Serialize nulls | Disabled | Absent optional sections |
/// | HTML escaping | Disabled | Readable descriptions |
/// | Special floats | Enabled | `message_ratio` may be `Infinity` |
///
/// Timestamps are written as ISO-8601 local date-times, directions by their label, and
/// a failed [SubAnalysisResult] as `{"error": "<message>"}` in place of its value.
///
/// The [Gson] instance is thread-safe and shared.
public final class AnalysisGsonConfig {

    private static final Gson INSTANCE = builder().create();

    private AnalysisGsonConfig() {
    }

    /// @return the shared Gson instance
    public static Gson gson() {
        return INSTANCE;
    }

    /// Creates a new GsonBuilder with the analysis defaults, for callers that need to
    /// customize further.
    ///
    /// @return a new GsonBuilder with analysis configuration
    public static GsonBuilder builder() {
        return compactBuilder().setPrettyPrinting();
    }

    /// Creates a compact (non-pretty-printed) Gson instance, one document per line.
    ///
    /// @return a compact Gson instance
    public static Gson compactGson() {
        return compactBuilder().create();
    }

    private static GsonBuilder compactBuilder() {
        return new GsonBuilder()
            .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
            .disableHtmlEscaping()
            .serializeSpecialFloatingPointValues()
            .registerTypeAdapter(LocalDateTime.class, new LocalDateTimeAdapter().nullSafe())
            .registerTypeAdapter(Direction.class, new DirectionAdapter().nullSafe())
            .registerTypeHierarchyAdapter(SubAnalysisResult.class, new SubAnalysisResultSerializer());
    }

    static final class LocalDateTimeAdapter extends TypeAdapter<LocalDateTime> {
        @Override
        public void write(JsonWriter out, LocalDateTime value) throws IOException {
            out.value(DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(value));
        }

        @Override
        public LocalDateTime read(JsonReader in) throws IOException {
            return LocalDateTime.parse(in.nextString(), DateTimeFormatter.ISO_LOCAL_DATE_TIME);
        }
    }

    static final class DirectionAdapter extends TypeAdapter<Direction> {
        @Override
        public void write(JsonWriter out, Direction value) throws IOException {
            out.value(value.label());
        }

        @Override
        public Direction read(JsonReader in) throws IOException {
            if (in.peek() != JsonToken.STRING) {
                throw new IOException("Expected a direction label at " + in.getPath());
            }
            String label = in.nextString();
            return Direction.fromLabel(label)
                .orElseThrow(() -> new IOException("Invalid direction: " + label));
        }
    }

    static final class SubAnalysisResultSerializer implements JsonSerializer<SubAnalysisResult<?>> {
        @Override
        public JsonElement serialize(SubAnalysisResult<?> src, Type typeOfSrc, JsonSerializationContext context) {
            if (src.isFailure()) {
                JsonObject stub = new JsonObject();
                stub.addProperty("error", src.error().orElse("unknown error"));
                return stub;
            }
            return context.serialize(src.valueOrNull());
        }
    }
}
