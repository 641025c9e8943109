package io.scheduler4j.core;

import java.time.Instant;

/**
 * Conversions between {@link Instant} and fractional epoch seconds, the numeric time format of
 * persisted snapshots and JSON commands.
 */
public final class EpochSeconds {
    private static final double NANOS_PER_SECOND = 1_000_000_000d;

    private EpochSeconds() {
    }

    public static double of(Instant instant) {
        return instant.getEpochSecond() + instant.getNano() / NANOS_PER_SECOND;
    }

    public static Instant toInstant(double epochSeconds) {
        if (Double.isNaN(epochSeconds) || Double.isInfinite(epochSeconds)) {
            throw new TaskValidationException("epoch seconds must be finite: " + epochSeconds);
        }
        long seconds = (long) Math.floor(epochSeconds);
        long nanos = Math.round((epochSeconds - seconds) * NANOS_PER_SECOND);
        return Instant.ofEpochSecond(seconds, nanos);
    }
}
