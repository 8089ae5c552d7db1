package io.flowforge.formula.core.function.builtin;

import com.fasterxml.jackson.databind.JsonNode;
import io.flowforge.formula.core.function.Arguments;
import io.flowforge.formula.core.value.Values;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/**
 * Conversions between formula values and {@code java.time}. Dates travel as ISO-8601 strings:
 * {@code 2024-01-15} for calendar dates and {@code 2024-01-15T09:30:00Z} for instants. Numbers
 * are epoch milliseconds. Offset-less date-times are read as UTC.
 */
final class DateSupport {

    /** A parsed date value and whether it was a plain calendar date. */
    record Moment(LocalDateTime dateTime, boolean dateOnly) {}

    private DateSupport() {}

    static Moment parse(Arguments args, int index) {
        Moment moment = tryParse(args.get(index));
        if (moment == null) {
            throw args.fail(index, "is not a valid date: " + Values.toText(args.get(index)));
        }
        return moment;
    }

    static boolean isDate(JsonNode value) {
        return tryParse(value) != null;
    }

    private static Moment tryParse(JsonNode value) {
        if (value.isNumber()) {
            return new Moment(LocalDateTime.ofInstant(Instant.ofEpochMilli(value.longValue()), ZoneOffset.UTC), false);
        }
        if (!value.isTextual()) {
            return null;
        }
        String text = value.textValue().trim();
        try {
            return new Moment(LocalDate.parse(text).atStartOfDay(), true);
        } catch (DateTimeParseException ignored) {
            // not a calendar date, try the date-time forms
        }
        try {
            return new Moment(
                    OffsetDateTime.parse(text).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime(), false);
        } catch (DateTimeParseException ignored) {
            // no offset, try a local date-time
        }
        try {
            return new Moment(LocalDateTime.parse(text), false);
        } catch (DateTimeParseException ignored) {
            return null;
        }
    }

    static JsonNode date(LocalDate date) {
        return Values.text(date.toString());
    }

    static JsonNode instant(LocalDateTime utc) {
        return Values.text(utc.toInstant(ZoneOffset.UTC).toString());
    }

    static JsonNode format(Moment moment) {
        return moment.dateOnly() ? date(moment.dateTime().toLocalDate()) : instant(moment.dateTime());
    }
}
