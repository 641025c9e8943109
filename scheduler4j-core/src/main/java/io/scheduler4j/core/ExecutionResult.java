package io.scheduler4j.core;

public record ExecutionResult(
        boolean successful,
        String message
) {

    public static ExecutionResult success() {
        return new ExecutionResult(true, "ok");
    }

    public static ExecutionResult failure(String message) {
        return new ExecutionResult(false, message);
    }
}
