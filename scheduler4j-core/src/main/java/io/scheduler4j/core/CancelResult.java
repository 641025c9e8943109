package io.scheduler4j.core;

/**
 * Outcome of cancelling a task.
 */
public record CancelResult(
        ResultStatus status,
        String message,
        String taskId
) implements SchedulerResult {

    public static CancelResult cancelled(String taskId) {
        return new CancelResult(ResultStatus.SUCCESS, "Task " + taskId + " cancelled", taskId);
    }

    public static CancelResult notFound(String taskId) {
        return new CancelResult(ResultStatus.ERROR, "Task " + taskId + " not found", taskId);
    }

    public static CancelResult error(String taskId, String message) {
        return new CancelResult(ResultStatus.ERROR, message, taskId);
    }
}
