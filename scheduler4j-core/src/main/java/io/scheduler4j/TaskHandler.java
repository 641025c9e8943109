package io.scheduler4j;

import io.scheduler4j.core.ScheduledTaskEvent;

/**
 * Performs the work named by a task payload. Resolved by {@link #name()} against the
 * payload's {@code agent} value.
 */
public interface TaskHandler<T> {
    String name();

    Class<T> dataClass();

    void execute(T data, ScheduledTaskEvent event) throws Exception;
}
