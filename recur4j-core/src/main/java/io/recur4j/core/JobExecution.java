package io.recur4j.core;

import java.time.Instant;
import java.util.UUID;

/**
 * One historical run of a {@link Job}.
 *
 * <p>An execution is created in-flight by {@link #begin(String, String, Instant)} and only
 * persisted after {@link #complete} or {@link #fail} gave it a terminal status.
 */
public class JobExecution {

    private String id;
    private String jobId;

    private Instant startedAt;
    private Instant completedAt;
    private Double duration; // seconds

    private JobStatus status;

    private String result;
    private String errorMessage;
    private String stackTrace;

    private String workerNode;

    public JobExecution() {
    }

    public static JobExecution begin(String jobId, String workerNode, Instant startedAt) {
        JobExecution e = new JobExecution();
        e.id = UUID.randomUUID().toString();
        e.jobId = jobId;
        e.workerNode = workerNode;
        e.startedAt = startedAt;
        return e;
    }

    public JobExecution complete(String result, Instant completedAt, double durationSeconds) {
        this.status = JobStatus.COMPLETED;
        this.result = result;
        this.completedAt = completedAt;
        this.duration = durationSeconds;
        return this;
    }

    public JobExecution fail(String errorMessage, String stackTrace, Instant completedAt, double durationSeconds) {
        this.status = JobStatus.FAILED;
        this.errorMessage = errorMessage;
        this.stackTrace = stackTrace;
        this.completedAt = completedAt;
        this.duration = durationSeconds;
        return this;
    }

    public boolean isFinished() {
        return status != null && status.isTerminal();
    }

    public JobExecution copy() {
        JobExecution e = new JobExecution();
        e.id = id;
        e.jobId = jobId;
        e.startedAt = startedAt;
        e.completedAt = completedAt;
        e.duration = duration;
        e.status = status;
        e.result = result;
        e.errorMessage = errorMessage;
        e.stackTrace = stackTrace;
        e.workerNode = workerNode;
        return e;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getJobId() {
        return jobId;
    }

    public void setJobId(String jobId) {
        this.jobId = jobId;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(Instant startedAt) {
        this.startedAt = startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(Instant completedAt) {
        this.completedAt = completedAt;
    }

    public Double getDuration() {
        return duration;
    }

    public void setDuration(Double duration) {
        this.duration = duration;
    }

    public JobStatus getStatus() {
        return status;
    }

    public void setStatus(JobStatus status) {
        this.status = status;
    }

    public String getResult() {
        return result;
    }

    public void setResult(String result) {
        this.result = result;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public String getStackTrace() {
        return stackTrace;
    }

    public void setStackTrace(String stackTrace) {
        this.stackTrace = stackTrace;
    }

    public String getWorkerNode() {
        return workerNode;
    }

    public void setWorkerNode(String workerNode) {
        this.workerNode = workerNode;
    }
}
