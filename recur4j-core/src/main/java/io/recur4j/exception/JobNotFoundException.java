package io.recur4j.exception;

public class JobNotFoundException extends SchedulerException {

    private final String jobId;

    public JobNotFoundException(String jobId) {
        super("Job with ID " + jobId + " not found");
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
