package io.scheduler4j.core;

/**
 * Base type for scheduler failures raised below the public result boundary.
 */
public class SchedulerException extends RuntimeException {

    public SchedulerException(String message) {
        super(message);
    }

    public SchedulerException(String message, Throwable cause) {
        super(message, cause);
    }
}
