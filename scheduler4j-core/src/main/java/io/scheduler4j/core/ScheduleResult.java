package io.scheduler4j.core;

import java.time.Instant;

/**
 * Outcome of scheduling a task. {@code taskId} and {@code executionTime} are null on error.
 */
public record ScheduleResult(
        ResultStatus status,
        String message,
        String taskId,
        Instant executionTime
) implements SchedulerResult {

    public static ScheduleResult scheduled(String taskId, Instant executionTime) {
        return new ScheduleResult(ResultStatus.SUCCESS, "Task scheduled", taskId, executionTime);
    }

    public static ScheduleResult error(String message) {
        return new ScheduleResult(ResultStatus.ERROR, message, null, null);
    }
}
