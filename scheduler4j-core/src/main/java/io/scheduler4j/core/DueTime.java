package io.scheduler4j.core;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * When a task should run, before it is resolved to an absolute instant.
 *
 * <ul>
 *   <li>{@link At}: already absolute</li>
 *   <li>{@link After}: offset from the moment of scheduling</li>
 *   <li>{@link Text}: textual timestamp or offset, parsed at scheduling time</li>
 * </ul>
 */
public sealed interface DueTime permits DueTime.At, DueTime.After, DueTime.Text {

    static DueTime at(Instant instant) {
        return new At(instant);
    }

    static DueTime after(Duration offset) {
        return new After(offset);
    }

    static DueTime parse(String text) {
        return new Text(text);
    }

    /**
     * Absolute time from fractional epoch seconds.
     */
    static DueTime epochSeconds(double epochSeconds) {
        return new At(EpochSeconds.toInstant(epochSeconds));
    }

    record At(Instant instant) implements DueTime {
        public At {
            Objects.requireNonNull(instant, "instant must not be null");
        }
    }

    record After(Duration offset) implements DueTime {
        public After {
            Objects.requireNonNull(offset, "offset must not be null");
        }
    }

    record Text(String value) implements DueTime {
        public Text {
            Objects.requireNonNull(value, "value must not be null");
        }
    }
}
