package io.scheduler4j.core;

import java.util.List;

public record PendingTasksResult(
        ResultStatus status,
        String message,
        List<PendingTask> tasks
) implements SchedulerResult {

    public PendingTasksResult {
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
    }

    public static PendingTasksResult of(List<PendingTask> tasks) {
        return new PendingTasksResult(ResultStatus.SUCCESS, tasks.size() + " pending task(s)", tasks);
    }

    public static PendingTasksResult error(String message) {
        return new PendingTasksResult(ResultStatus.ERROR, message, List.of());
    }
}
