package io.recur4j.internal.mongo;

import io.recur4j.core.Job;
import io.recur4j.core.JobStatus;
import io.recur4j.core.JobType;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Mongo document model for persisted jobs.
 */
@Document(collection = JobDocument.COLLECTION)
public class JobDocument {

    public static final String COLLECTION = "jobs";

    @Id
    private String id;

    private String name;
    private String description;
    private JobType jobType;

    private String cronExpression;
    private Long intervalSeconds;

    @Field(write = Field.Write.ALWAYS)
    private Instant nextRunTime;
    private Instant lastRunTime;

    private Map<String, Object> payload;
    private int maxRetries;
    private int retryCount;
    private int timeoutSeconds;

    private JobStatus status;
    private boolean active;
    private int priority;

    private long totalRuns;
    private long successfulRuns;
    private long failedRuns;
    private double averageRuntime;

    private String createdBy;
    private Instant createdAt;
    private Instant updatedAt;

    public JobDocument() {
    }

    static JobDocument from(Job job) {
        JobDocument d = new JobDocument();
        d.id = job.getId();
        d.name = job.getName();
        d.description = job.getDescription();
        d.jobType = job.getJobType();
        d.cronExpression = job.getCronExpression();
        d.intervalSeconds = job.getIntervalSeconds();
        d.nextRunTime = job.getNextRunTime();
        d.lastRunTime = job.getLastRunTime();
        d.payload = job.getPayload() == null ? null : new LinkedHashMap<>(job.getPayload());
        d.maxRetries = job.getMaxRetries();
        d.retryCount = job.getRetryCount();
        d.timeoutSeconds = job.getTimeoutSeconds();
        d.status = job.getStatus();
        d.active = job.isActive();
        d.priority = job.getPriority();
        d.totalRuns = job.getTotalRuns();
        d.successfulRuns = job.getSuccessfulRuns();
        d.failedRuns = job.getFailedRuns();
        d.averageRuntime = job.getAverageRuntime();
        d.createdBy = job.getCreatedBy();
        d.createdAt = job.getCreatedAt();
        d.updatedAt = job.getUpdatedAt();
        return d;
    }

    Job toJob() {
        Job j = new Job();
        j.setId(id);
        j.setName(name);
        j.setDescription(description);
        j.setJobType(jobType != null ? jobType : JobType.CUSTOM);
        j.setCronExpression(cronExpression);
        j.setIntervalSeconds(intervalSeconds);
        j.setNextRunTime(nextRunTime);
        j.setLastRunTime(lastRunTime);
        j.setPayload(payload == null ? null : new LinkedHashMap<>(payload));
        j.setMaxRetries(maxRetries);
        j.setRetryCount(retryCount);
        j.setTimeoutSeconds(timeoutSeconds);
        j.setStatus(status != null ? status : JobStatus.PENDING);
        j.setActive(active);
        j.setPriority(priority);
        j.setTotalRuns(totalRuns);
        j.setSuccessfulRuns(successfulRuns);
        j.setFailedRuns(failedRuns);
        j.setAverageRuntime(averageRuntime);
        j.setCreatedBy(createdBy);
        j.setCreatedAt(createdAt);
        j.setUpdatedAt(updatedAt);
        return j;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public JobType getJobType() {
        return jobType;
    }

    public void setJobType(JobType jobType) {
        this.jobType = jobType;
    }

    public String getCronExpression() {
        return cronExpression;
    }

    public void setCronExpression(String cronExpression) {
        this.cronExpression = cronExpression;
    }

    public Long getIntervalSeconds() {
        return intervalSeconds;
    }

    public void setIntervalSeconds(Long intervalSeconds) {
        this.intervalSeconds = intervalSeconds;
    }

    public Instant getNextRunTime() {
        return nextRunTime;
    }

    public void setNextRunTime(Instant nextRunTime) {
        this.nextRunTime = nextRunTime;
    }

    public Instant getLastRunTime() {
        return lastRunTime;
    }

    public void setLastRunTime(Instant lastRunTime) {
        this.lastRunTime = lastRunTime;
    }

    public Map<String, Object> getPayload() {
        return payload;
    }

    public void setPayload(Map<String, Object> payload) {
        this.payload = payload;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public void setRetryCount(int retryCount) {
        this.retryCount = retryCount;
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(int timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    public JobStatus getStatus() {
        return status;
    }

    public void setStatus(JobStatus status) {
        this.status = status;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public int getPriority() {
        return priority;
    }

    public void setPriority(int priority) {
        this.priority = priority;
    }

    public long getTotalRuns() {
        return totalRuns;
    }

    public void setTotalRuns(long totalRuns) {
        this.totalRuns = totalRuns;
    }

    public long getSuccessfulRuns() {
        return successfulRuns;
    }

    public void setSuccessfulRuns(long successfulRuns) {
        this.successfulRuns = successfulRuns;
    }

    public long getFailedRuns() {
        return failedRuns;
    }

    public void setFailedRuns(long failedRuns) {
        this.failedRuns = failedRuns;
    }

    public double getAverageRuntime() {
        return averageRuntime;
    }

    public void setAverageRuntime(double averageRuntime) {
        this.averageRuntime = averageRuntime;
    }

    public String getCreatedBy() {
        return createdBy;
    }

    public void setCreatedBy(String createdBy) {
        this.createdBy = createdBy;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
