package io.scheduler4j.core;

import java.time.Duration;
import java.util.Map;

/**
 * Immutable scheduling request produced by TaskBuilder.build() or by a command.
 * Validation happens when the scheduler accepts it, not here.
 *
 * @param taskId   null to let the scheduler generate one
 * @param interval ignored unless {@code recurring}
 */
public record ScheduleRequest(
        Map<String, Object> payload,
        DueTime executionTime,
        int priority,
        String taskId,
        boolean recurring,
        Duration interval
) {

    public static ScheduleRequest once(Map<String, Object> payload, DueTime executionTime) {
        return new ScheduleRequest(payload, executionTime, TaskRecord.DEFAULT_PRIORITY, null, false, null);
    }

    public static ScheduleRequest recurring(Map<String, Object> payload, DueTime executionTime, Duration interval) {
        return new ScheduleRequest(payload, executionTime, TaskRecord.DEFAULT_PRIORITY, null, true, interval);
    }

    public ScheduleRequest withPriority(int priority) {
        return new ScheduleRequest(payload, executionTime, priority, taskId, recurring, interval);
    }

    public ScheduleRequest withTaskId(String taskId) {
        return new ScheduleRequest(payload, executionTime, priority, taskId, recurring, interval);
    }
}
