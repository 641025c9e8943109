package io.scheduler4j.core;

/**
 * Outcome of start/stop and of commands that could not be understood.
 */
public record ControlResult(
        ResultStatus status,
        String message
) implements SchedulerResult {

    public static ControlResult success(String message) {
        return new ControlResult(ResultStatus.SUCCESS, message);
    }

    public static ControlResult info(String message) {
        return new ControlResult(ResultStatus.INFO, message);
    }

    public static ControlResult error(String message) {
        return new ControlResult(ResultStatus.ERROR, message);
    }
}
