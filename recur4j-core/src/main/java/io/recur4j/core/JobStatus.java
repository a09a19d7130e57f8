package io.recur4j.core;

public enum JobStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    PAUSED,
    CANCELLED;

    /**
     * Only these may appear on a persisted {@link JobExecution}.
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
