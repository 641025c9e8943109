package io.scheduler4j.core;

/**
 * A task could not be accepted: unresolvable due time, bad recurrence, duplicate id, etc.
 * Nothing is scheduled or persisted when this is raised.
 */
public class TaskValidationException extends SchedulerException {

    public TaskValidationException(String message) {
        super(message);
    }

    public TaskValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
