package io.scheduler4j.core;

import java.time.Instant;

/**
 * Display row for a pending task.
 */
public record PendingTask(
        String taskId,
        Instant executionTime,
        int priority,
        boolean recurring,
        String summary
) {

    public static PendingTask of(TaskRecord record) {
        return new PendingTask(
                record.id(),
                record.dueTime(),
                record.priority(),
                record.recurring(),
                record.summary()
        );
    }
}
