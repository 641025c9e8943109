package io.scheduler4j.store;

import io.scheduler4j.core.SchedulerException;

public class TaskPersistenceException extends SchedulerException {

    public TaskPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
