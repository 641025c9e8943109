package io.scheduler4j.core;

import java.time.Instant;
import java.util.Map;

/**
 * What the executor receives for one dispatch.
 *
 * @param scheduledTime the due time the task was queued for
 * @param executionTime the time the task was handed to the executor
 */
public record ScheduledTaskEvent(
        String taskId,
        Map<String, Object> payload,
        Instant scheduledTime,
        Instant executionTime
) {

    public static ScheduledTaskEvent of(TaskRecord record, Instant executionTime) {
        return new ScheduledTaskEvent(record.id(), record.payload(), record.dueTime(), executionTime);
    }
}
