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

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Date;
import java.util.List;
import java.util.regex.Pattern;

/// Converts raw timestamp cell values into [LocalDateTime].
///
/// ## Accepted inputs
///
/// | Input | Handling |
/// |-------|----------|
/// | `LocalDateTime` | used as is |
/// | `OffsetDateTime`, `ZonedDateTime`, `Instant`, `Date` | converted to UTC wall-clock time |
/// | `LocalDate` | start of day |
/// | `Number` | epoch milliseconds, UTC; a fractional part is kept as sub-millisecond time |
/// | `String` | all digits as epoch milliseconds, ISO-8601 local/offset date-time, `yyyy-MM-dd HH:mm[:ss[.SSS]]`, `yyyy-MM-dd` |
///
/// Epoch values are read the same way whether they arrive as numbers (JSON) or text (CSV).
///
/// Anything else raises [RecordValidationException].
public final class TimestampParser {

    private static final List<DateTimeFormatter> LOCAL_FORMATS = List.of(
        DateTimeFormatter.ISO_LOCAL_DATE_TIME,
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS"),
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"),
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm")
    );

    private static final Pattern EPOCH_DIGITS = Pattern.compile("-?\\d+");

    private TimestampParser() {
    }

    /// @param value the raw cell value
    /// @return the parsed wall-clock time
    /// @throws RecordValidationException if the value cannot be interpreted as a time
    public static LocalDateTime parse(Object value) {
        if (value == null) {
            throw new RecordValidationException("Invalid timestamp format: null value");
        }
        if (value instanceof LocalDateTime) {
            return (LocalDateTime) value;
        }
        if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
        }
        if (value instanceof ZonedDateTime) {
            return ((ZonedDateTime) value).withZoneSameInstant(ZoneOffset.UTC).toLocalDateTime();
        }
        if (value instanceof Instant) {
            return LocalDateTime.ofInstant((Instant) value, ZoneOffset.UTC);
        }
        if (value instanceof Date) {
            return LocalDateTime.ofInstant(((Date) value).toInstant(), ZoneOffset.UTC);
        }
        if (value instanceof LocalDate) {
            return ((LocalDate) value).atStartOfDay();
        }
        if (value instanceof Number) {
            return fromEpochMillis((Number) value);
        }
        if (value instanceof CharSequence) {
            return parseText(value.toString().trim());
        }
        throw new RecordValidationException("Invalid timestamp format: unsupported value type "
            + value.getClass().getSimpleName());
    }

    private static LocalDateTime fromEpochMillis(Number number) {
        if (number instanceof Double || number instanceof Float || number instanceof BigDecimal) {
            double millis = number.doubleValue();
            if (!Double.isFinite(millis)) {
                throw new RecordValidationException("Invalid timestamp format: " + number + " is not finite");
            }
            long whole = (long) Math.floor(millis);
            long nanos = Math.round((millis - whole) * 1_000_000d);
            return LocalDateTime.ofInstant(Instant.ofEpochMilli(whole).plusNanos(nanos), ZoneOffset.UTC);
        }
        return LocalDateTime.ofInstant(Instant.ofEpochMilli(number.longValue()), ZoneOffset.UTC);
    }

    private static LocalDateTime parseText(String text) {
        if (text.isEmpty()) {
            throw new RecordValidationException("Invalid timestamp format: empty value");
        }
        if (EPOCH_DIGITS.matcher(text).matches()) {
            try {
                return fromEpochMillis(Long.parseLong(text));
            } catch (NumberFormatException e) {
                throw new RecordValidationException("Invalid timestamp format: '" + text + "' is out of range", e);
            }
        }
        for (DateTimeFormatter format : LOCAL_FORMATS) {
            try {
                return LocalDateTime.parse(text, format);
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        try {
            return OffsetDateTime.parse(text).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
        } catch (DateTimeParseException ignored) {
            // next format
        }
        try {
            return LocalDate.parse(text).atStartOfDay();
        } catch (DateTimeParseException e) {
            throw new RecordValidationException("Invalid timestamp format: '" + text + "' could not be parsed", e);
        }
    }
}
