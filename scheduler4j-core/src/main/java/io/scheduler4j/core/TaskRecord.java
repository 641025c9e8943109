package io.scheduler4j.core;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One scheduled unit of work.
 *
 * <p>Records are immutable. A recurring series advances by creating a fresh record through
 * {@link #nextOccurrence(String, Instant)}; pending state lives in the scheduler's queue,
 * not on the record.
 *
 * @param id        unique among pending tasks only; may be reused once a task ran or was cancelled
 * @param dueTime   instant at which the task becomes eligible
 * @param priority  tie-breaker among equal due times, lower first
 * @param payload   opaque data handed to the executor unmodified
 * @param recurring whether execution schedules a next occurrence
 * @param interval  recurrence interval in whole seconds, required and positive when {@code recurring}
 * @param createdAt informational only
 */
public record TaskRecord(
        String id,
        Instant dueTime,
        int priority,
        Map<String, Object> payload,
        boolean recurring,
        Duration interval,
        Instant createdAt
) {

    public static final int DEFAULT_PRIORITY = Priority.HIGHEST.value();

    /**
     * Payload key naming the capability that handles the task.
     */
    public static final String HANDLER_KEY = "agent";

    public static final String ACTION_KEY = "action";

    public TaskRecord {
        if (id == null || id.isBlank()) {
            throw new TaskValidationException("task id must not be blank");
        }
        if (dueTime == null) {
            throw new TaskValidationException("dueTime must not be null");
        }
        if (payload == null) {
            throw new TaskValidationException("payload must not be null");
        }
        if (recurring && (interval == null || interval.isZero() || interval.isNegative())) {
            throw new TaskValidationException("recurring task " + id + " requires a positive interval");
        }
        if (recurring) {
            // snapshots keep the interval as integer seconds
            if (interval.getNano() != 0) {
                throw new TaskValidationException("recurring task " + id + " interval must be whole seconds: " + interval);
            }
            try {
                dueTime.plus(interval);
            } catch (DateTimeException | ArithmeticException e) {
                throw new TaskValidationException("recurring task " + id + " interval is out of range: " + interval, e);
            }
        }
        payload = Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        if (createdAt == null) {
            createdAt = dueTime;
        }
    }

    /**
     * Next record of a recurring series, due {@code interval} after {@code now}.
     *
     * @throws TaskValidationException if the next due time is past {@link Instant#MAX}
     */
    public TaskRecord nextOccurrence(String nextId, Instant now) {
        if (!recurring) {
            throw new IllegalStateException("task " + id + " is not recurring");
        }
        Instant next;
        try {
            next = now.plus(interval);
        } catch (DateTimeException | ArithmeticException e) {
            throw new TaskValidationException("task " + id + " next occurrence is out of range", e);
        }
        return new TaskRecord(nextId, next, priority, payload, true, interval, now);
    }

    public String handlerName() {
        return stringValue(HANDLER_KEY);
    }

    public String action() {
        return stringValue(ACTION_KEY);
    }

    /**
     * Short "agent/action" label for listings.
     */
    public String summary() {
        String handler = handlerName();
        String action = action();
        return (handler == null ? "unknown" : handler) + "/" + (action == null ? "unknown" : action);
    }

    private String stringValue(String key) {
        Object value = payload.get(key);
        return value == null ? null : value.toString();
    }
}
