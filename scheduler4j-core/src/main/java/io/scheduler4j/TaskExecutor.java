package io.scheduler4j;

import io.scheduler4j.core.ExecutionResult;
import io.scheduler4j.core.ScheduledTaskEvent;

/**
 * Boundary to whatever performs a task's payload. Called synchronously from the worker
 * thread, outside the scheduler's lock.
 */
@FunctionalInterface
public interface TaskExecutor {

    ExecutionResult execute(ScheduledTaskEvent event) throws Exception;
}
