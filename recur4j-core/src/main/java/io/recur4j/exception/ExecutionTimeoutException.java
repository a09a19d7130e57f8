package io.recur4j.exception;

import java.time.Duration;

public class ExecutionTimeoutException extends JobExecutionException {

    private final Duration timeout;

    public ExecutionTimeoutException(String jobId, Duration timeout) {
        super(jobId, "Job execution timed out after " + timeout.toSeconds() + " seconds");
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
