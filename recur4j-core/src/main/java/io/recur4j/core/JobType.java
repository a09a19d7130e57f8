package io.recur4j.core;

import java.util.Locale;

/**
 * Closed set of job kinds. Each kind is served by one {@link io.recur4j.JobHandler};
 * kinds without a registered handler fall back to the {@link #CUSTOM} handler.
 */
public enum JobType {
    EMAIL_NOTIFICATION("email_notification"),
    DATA_PROCESSING("data_processing"),
    REPORT_GENERATION("report_generation"),
    CLEANUP_TASK("cleanup_task"),
    BACKUP_TASK("backup_task"),
    CUSTOM("custom");

    private final String value;

    JobType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Resolve a wire value ("backup_task") or enum name ("BACKUP_TASK").
     */
    public static JobType fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("job type must not be blank");
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (JobType t : values()) {
            if (t.value.equals(v)) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown job type: " + value);
    }
}
