package io.recur4j.core;

/**
 * JobQuery describes which jobs a listing should match.
 *
 * <p>This is an API-layer object. Each repository translates it into its own query; an empty
 * query matches every job.
 */
public final class JobQuery {

    private static final JobQuery ALL = new JobQuery(null, null, null, null);

    private final JobStatus status;
    private final JobType jobType;
    private final String createdBy;
    private final Boolean active;

    private JobQuery(JobStatus status, JobType jobType, String createdBy, Boolean active) {
        this.status = status;
        this.jobType = jobType;
        this.createdBy = (createdBy == null || createdBy.isBlank()) ? null : createdBy;
        this.active = active;
    }

    public static JobQuery all() {
        return ALL;
    }

    public JobStatus status() {
        return status;
    }

    public JobType jobType() {
        return jobType;
    }

    public String createdBy() {
        return createdBy;
    }

    public Boolean active() {
        return active;
    }

    public boolean isEmpty() {
        return status == null && jobType == null && createdBy == null && active == null;
    }

    /**
     * In-memory evaluation, used by repositories without a query language.
     */
    public boolean matches(Job job) {
        if (status != null && job.getStatus() != status) {
            return false;
        }
        if (jobType != null && job.getJobType() != jobType) {
            return false;
        }
        if (createdBy != null && !createdBy.equals(job.getCreatedBy())) {
            return false;
        }
        return active == null || job.isActive() == active;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private JobStatus status;
        private JobType jobType;
        private String createdBy;
        private Boolean active;

        public Builder status(JobStatus status) {
            this.status = status;
            return this;
        }

        public Builder jobType(JobType jobType) {
            this.jobType = jobType;
            return this;
        }

        public Builder createdBy(String createdBy) {
            this.createdBy = createdBy;
            return this;
        }

        public Builder active(Boolean active) {
            this.active = active;
            return this;
        }

        public JobQuery build() {
            return new JobQuery(status, jobType, createdBy, active);
        }
    }
}
