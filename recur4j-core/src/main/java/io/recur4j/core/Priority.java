package io.recur4j.core;

/**
 * Named priority levels on the 1..10 scale. Priority only affects listing order.
 */
public enum Priority {

    HIGHEST(10),
    HIGH(8),
    NORMAL(5),
    LOW(3),
    LOWEST(1);

    private final int value;

    Priority(int value) {
        this.value = value;
    }

    public int value() {
        return value;
    }
}
