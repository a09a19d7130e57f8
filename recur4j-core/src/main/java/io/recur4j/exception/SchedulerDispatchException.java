package io.recur4j.exception;

/**
 * Failure in the engine's own dispatch path, as opposed to a failure inside a handler.
 */
public class SchedulerDispatchException extends SchedulerException {

    private final String jobId;

    public SchedulerDispatchException(String jobId, String message, Throwable cause) {
        super(message, cause);
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
