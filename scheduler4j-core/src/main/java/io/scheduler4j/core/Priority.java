package io.scheduler4j.core;

/**
 * Named priority levels. Lower values run first among tasks due at the same instant.
 */
public enum Priority {

    HIGHEST(1),
    HIGH(2),
    NORMAL(3),
    LOW(4),
    LOWEST(5);

    private final int value;

    Priority(int value) {
        this.value = value;
    }

    public int value() {
        return value;
    }
}
