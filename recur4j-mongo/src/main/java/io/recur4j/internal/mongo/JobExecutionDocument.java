package io.recur4j.internal.mongo;

import io.recur4j.core.JobExecution;
import io.recur4j.core.JobStatus;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Mongo document model for finished executions. Rows reference their job by {@code jobId}.
 */
@Document(collection = JobExecutionDocument.COLLECTION)
public class JobExecutionDocument {

    public static final String COLLECTION = "job_executions";

    @Id
    private String id;
    private String jobId;

    private Instant startedAt;
    private Instant completedAt;
    private Double duration;

    private JobStatus status;
    private String result;
    private String errorMessage;
    private String stackTrace;

    private String workerNode;

    public JobExecutionDocument() {
    }

    static JobExecutionDocument from(JobExecution e) {
        JobExecutionDocument d = new JobExecutionDocument();
        d.id = e.getId();
        d.jobId = e.getJobId();
        d.startedAt = e.getStartedAt();
        d.completedAt = e.getCompletedAt();
        d.duration = e.getDuration();
        d.status = e.getStatus();
        d.result = e.getResult();
        d.errorMessage = e.getErrorMessage();
        d.stackTrace = e.getStackTrace();
        d.workerNode = e.getWorkerNode();
        return d;
    }

    JobExecution toExecution() {
        JobExecution e = new JobExecution();
        e.setId(id);
        e.setJobId(jobId);
        e.setStartedAt(startedAt);
        e.setCompletedAt(completedAt);
        e.setDuration(duration);
        e.setStatus(status);
        e.setResult(result);
        e.setErrorMessage(errorMessage);
        e.setStackTrace(stackTrace);
        e.setWorkerNode(workerNode);
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
