package io.recur4j.core;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A recurring unit of work together with its scheduling state and run statistics.
 *
 * <p>Instances are plain mutable holders. Repositories hand out copies, so mutating a
 * loaded job has no effect until it is saved again.
 */
public class Job {

    private String id;

    private String name;
    private String description;
    private JobType jobType = JobType.CUSTOM;

    // recurrence: exactly one of the two is set
    private String cronExpression;
    private Long intervalSeconds;

    private Instant nextRunTime;
    private Instant lastRunTime;

    private Map<String, Object> payload;
    private int maxRetries;
    private int retryCount;
    private int timeoutSeconds;

    private JobStatus status = JobStatus.PENDING;
    private boolean active = true;
    private int priority;

    private long totalRuns;
    private long successfulRuns;
    private long failedRuns;
    private double averageRuntime;

    private String createdBy;
    private Instant createdAt;
    private Instant updatedAt;

    public Job() {
    }

    public Job copy() {
        Job j = new Job();
        j.id = id;
        j.name = name;
        j.description = description;
        j.jobType = jobType;
        j.cronExpression = cronExpression;
        j.intervalSeconds = intervalSeconds;
        j.nextRunTime = nextRunTime;
        j.lastRunTime = lastRunTime;
        j.payload = payload == null ? null : new LinkedHashMap<>(payload);
        j.maxRetries = maxRetries;
        j.retryCount = retryCount;
        j.timeoutSeconds = timeoutSeconds;
        j.status = status;
        j.active = active;
        j.priority = priority;
        j.totalRuns = totalRuns;
        j.successfulRuns = successfulRuns;
        j.failedRuns = failedRuns;
        j.averageRuntime = averageRuntime;
        j.createdBy = createdBy;
        j.createdAt = createdAt;
        j.updatedAt = updatedAt;
        return j;
    }

    public boolean hasCron() {
        return cronExpression != null && !cronExpression.isBlank();
    }

    public boolean hasInterval() {
        return intervalSeconds != null;
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

    /**
     * Running average in seconds, updated on each success and weighted by {@link #getTotalRuns()}.
     */
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

    @Override
    public String toString() {
        return "Job{id=" + id + ", name=" + name + ", status=" + status + ", active=" + active
                + ", nextRunTime=" + nextRunTime + "}";
    }
}
