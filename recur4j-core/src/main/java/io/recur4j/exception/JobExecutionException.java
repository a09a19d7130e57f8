package io.recur4j.exception;

/**
 * A handler run did not produce a result. Recorded on the execution, never thrown past the executor.
 */
public class JobExecutionException extends SchedulerException {

    private final String jobId;

    public JobExecutionException(String jobId, String message) {
        super(message);
        this.jobId = jobId;
    }

    public JobExecutionException(String jobId, String message, Throwable cause) {
        super(message, cause);
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
