package io.scheduler4j.utils;

import io.scheduler4j.core.TaskValidationException;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Objects;

/**
 * Parses recurrence intervals and relative offsets into {@link Duration}.
 * <p>
 * Supported formats:
 * <ul>
 *   <li>Plain seconds: "90"</li>
 *   <li>Compact units: "30s", "5m", "2h", "1d", "1w"</li>
 *   <li>Human-readable pairs: "5 minutes", "2 hours", "1 day 3 hours"</li>
 *   <li>ISO-8601 durations: "PT15M"</li>
 * </ul>
 * All failures raise {@link TaskValidationException}.
 */
public final class IntervalParser {
    private IntervalParser() {
    }

    /**
     * Parse an interval that must be strictly positive (recurrence).
     */
    public static Duration parsePositive(String spec) {
        Duration d = parseDuration(spec);
        if (d.isZero() || d.isNegative()) {
            throw new TaskValidationException("Interval must be positive: " + spec);
        }
        return d;
    }

    /**
     * Whole positive number of seconds, as used by the snapshot format and JSON commands.
     */
    public static Duration ofSeconds(Number seconds) {
        Objects.requireNonNull(seconds, "seconds must not be null");
        double asDouble = seconds.doubleValue();
        if (asDouble <= 0) {
            throw new TaskValidationException("interval must be a positive number of seconds");
        }
        if (asDouble % 1 != 0) {
            throw new TaskValidationException("interval must be an integer number of seconds");
        }
        return Duration.ofSeconds(seconds.longValue());
    }

    public static Duration parseDuration(String input) {
        if (input == null) {
            throw new TaskValidationException("Interval string must not be null");
        }
        String s = input.trim().toLowerCase(Locale.ROOT);
        if (s.isEmpty()) {
            throw new TaskValidationException("Interval string must not be empty");
        }

        if (s.matches("^\\d+$")) {
            try {
                return Duration.ofSeconds(Long.parseLong(s));
            } catch (NumberFormatException ex) {
                throw new TaskValidationException("Interval seconds out of range: " + input, ex);
            }
        }

        if (s.startsWith("p")) {
            try {
                return Duration.parse(s.toUpperCase(Locale.ROOT));
            } catch (RuntimeException ex) {
                throw new TaskValidationException("Invalid ISO-8601 duration: " + input, ex);
            }
        }

        if (s.matches("^\\d+\\s*[smhdw]$")) {
            String digits = s.replaceAll("[^0-9]", "");
            char u = s.replaceAll("[0-9\\s]", "").charAt(0);
            try {
                long n = Long.parseLong(digits);
                return switch (u) {
                    case 's' -> Duration.ofSeconds(n);
                    case 'm' -> Duration.ofMinutes(n);
                    case 'h' -> Duration.ofHours(n);
                    case 'd' -> Duration.ofDays(n);
                    case 'w' -> Duration.ofDays(Math.multiplyExact(7L, n));
                    default -> throw new TaskValidationException("Unsupported compact unit: " + u);
                };
            } catch (NumberFormatException | ArithmeticException ex) {
                throw new TaskValidationException("Interval out of range: " + input, ex);
            }
        }

        String[] parts = s.split("\\s+");
        if (parts.length % 2 != 0) {
            throw new TaskValidationException("Invalid interval format. Expected pairs like '3 minutes': " + input);
        }

        boolean seenWeek = false, seenDay = false, seenHour = false, seenMinute = false, seenSecond = false;
        long totalSeconds = 0;

        for (int i = 0; i < parts.length; i += 2) {
            long n;
            try {
                n = Long.parseLong(parts[i]);
            } catch (NumberFormatException ex) {
                throw new TaskValidationException("Invalid number in interval: " + parts[i], ex);
            }
            if (n < 0) {
                throw new TaskValidationException("Interval values must be non-negative");
            }

            String unit = parts[i + 1];
            if (unit.endsWith("s")) {
                unit = unit.substring(0, unit.length() - 1);
            }

            switch (unit) {
                case "week" -> {
                    if (seenWeek) throw new TaskValidationException("Duplicate unit: week");
                    seenWeek = true;
                    totalSeconds = addUnits(totalSeconds, ChronoUnit.WEEKS, n, input);
                }
                case "day" -> {
                    if (seenDay) throw new TaskValidationException("Duplicate unit: day");
                    seenDay = true;
                    totalSeconds = addUnits(totalSeconds, ChronoUnit.DAYS, n, input);
                }
                case "hour" -> {
                    if (seenHour) throw new TaskValidationException("Duplicate unit: hour");
                    seenHour = true;
                    totalSeconds = addUnits(totalSeconds, ChronoUnit.HOURS, n, input);
                }
                case "minute" -> {
                    if (seenMinute) throw new TaskValidationException("Duplicate unit: minute");
                    seenMinute = true;
                    totalSeconds = addUnits(totalSeconds, ChronoUnit.MINUTES, n, input);
                }
                case "second" -> {
                    if (seenSecond) throw new TaskValidationException("Duplicate unit: second");
                    seenSecond = true;
                    totalSeconds = addUnits(totalSeconds, ChronoUnit.SECONDS, n, input);
                }
                default -> throw new TaskValidationException("Unsupported interval unit: " + parts[i + 1]);
            }
        }

        return Duration.ofSeconds(totalSeconds);
    }

    private static long addUnits(long totalSeconds, ChronoUnit unit, long n, String input) {
        try {
            return Math.addExact(totalSeconds, Math.multiplyExact(unit.getDuration().toSeconds(), n));
        } catch (ArithmeticException ex) {
            throw new TaskValidationException("Interval out of range: " + input, ex);
        }
    }
}
