package io.scheduler4j.utils;

import io.scheduler4j.core.DueTime;
import io.scheduler4j.core.EpochSeconds;
import io.scheduler4j.core.TaskValidationException;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Objects;

/**
 * Resolves a {@link DueTime} into an absolute {@link Instant}.
 * <p>
 * Text forms, tried in order:
 * <ul>
 *   <li>epoch seconds, optionally fractional: "1767225600.5"</li>
 *   <li>relative offset: "+5 minutes", "in 2 hours" (see {@link IntervalParser})</li>
 *   <li>ISO-8601 date-time with offset: "2026-01-20T09:30:00Z", "2026-01-20T09:30:00+02:00"</li>
 *   <li>ISO-8601 local date-time, read in the given zone: "2026-01-20T09:30:00"</li>
 * </ul>
 */
public final class DueTimeResolver {
    private DueTimeResolver() {
    }

    public static Instant resolve(DueTime dueTime, Instant now, ZoneId zone) {
        Objects.requireNonNull(now, "now must not be null");
        if (dueTime == null) {
            throw new TaskValidationException("execution time must not be null");
        }
        if (dueTime instanceof DueTime.At at) {
            return at.instant();
        }
        if (dueTime instanceof DueTime.After after) {
            return now.plus(after.offset());
        }
        if (dueTime instanceof DueTime.Text text) {
            return parseText(text.value(), now, zone == null ? ZoneId.systemDefault() : zone);
        }
        throw new TaskValidationException("Unsupported execution time: " + dueTime);
    }

    private static Instant parseText(String value, Instant now, ZoneId zone) {
        String s = value.trim();
        if (s.isEmpty()) {
            throw new TaskValidationException("execution time must not be blank");
        }

        if (s.matches("^\\d+(\\.\\d+)?$")) {
            try {
                return EpochSeconds.toInstant(Double.parseDouble(s));
            } catch (NumberFormatException ex) {
                throw new TaskValidationException("Invalid epoch seconds: " + value, ex);
            }
        }

        if (s.startsWith("+")) {
            return now.plus(IntervalParser.parseDuration(s.substring(1)));
        }
        if (s.regionMatches(true, 0, "in ", 0, 3)) {
            return now.plus(IntervalParser.parseDuration(s.substring(3)));
        }

        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(s, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime odt) {
                return odt.toInstant();
            }
            return ((LocalDateTime) parsed).atZone(zone).toInstant();
        } catch (DateTimeParseException ex) {
            throw new TaskValidationException("Unrecognized execution time: " + value, ex);
        }
    }
}
