package io.recur4j.internal;

import io.recur4j.exception.InvalidRecurrenceException;
import io.recur4j.exception.JobValidationException;
import io.recur4j.utils.TriggerCalculator;

import java.util.regex.Pattern;

/**
 * Field rules for job definitions, updates and listings. Each check throws
 * {@link JobValidationException} naming the offending field.
 */
public final class JobValidator {

    static final int NAME_MIN = 3;
    static final int NAME_MAX = 255;
    static final long INTERVAL_MIN_SECONDS = 60;
    static final long INTERVAL_MAX_SECONDS = 7L * 24 * 3600;
    static final int TIMEOUT_MIN_SECONDS = 30;
    static final int TIMEOUT_MAX_SECONDS = 24 * 3600;
    static final int PRIORITY_MIN = 1;
    static final int PRIORITY_MAX = 10;
    static final int RETRIES_MAX = 10;

    private static final Pattern NAME_CHARS = Pattern.compile("^[a-zA-Z0-9\\s\\-_]+$");

    private JobValidator() {
    }

    /**
     * @return the trimmed name
     */
    public static String name(String name) {
        if (name == null || name.isBlank()) {
            throw new JobValidationException("name", "Job name is required");
        }
        String n = name.trim();
        if (n.length() < NAME_MIN) {
            throw new JobValidationException("name", "Job name must be at least " + NAME_MIN + " characters");
        }
        if (n.length() > NAME_MAX) {
            throw new JobValidationException("name", "Job name cannot exceed " + NAME_MAX + " characters");
        }
        if (!NAME_CHARS.matcher(n).matches()) {
            throw new JobValidationException("name",
                    "Job name can only contain letters, numbers, spaces, hyphens, and underscores");
        }
        return n;
    }

    /**
     * Exactly one of cron and interval must be given.
     *
     * @return the trimmed cron expression, or null for an interval recurrence
     */
    public static String recurrence(String cronExpression, Long intervalSeconds) {
        boolean hasCron = cronExpression != null && !cronExpression.isBlank();
        boolean hasInterval = intervalSeconds != null;
        if (hasCron && hasInterval) {
            throw new InvalidRecurrenceException("cronExpression",
                    "Only one of cronExpression or intervalSeconds may be provided");
        }
        if (!hasCron && !hasInterval) {
            throw new InvalidRecurrenceException("cronExpression",
                    "Either cronExpression or intervalSeconds must be provided");
        }
        if (hasCron) {
            return cron(cronExpression);
        }
        interval(intervalSeconds);
        return null;
    }

    public static String cron(String cronExpression) {
        if (cronExpression == null || cronExpression.isBlank()) {
            throw new InvalidRecurrenceException("cronExpression", "Cron expression cannot be empty");
        }
        String c = cronExpression.trim();
        if (!TriggerCalculator.isValidCron(c)) {
            throw new InvalidRecurrenceException("cronExpression", "Invalid cron expression: " + c);
        }
        return c;
    }

    public static void interval(long seconds) {
        if (seconds <= 0) {
            throw new InvalidRecurrenceException("intervalSeconds", "Interval must be positive");
        }
        if (seconds < INTERVAL_MIN_SECONDS) {
            throw new InvalidRecurrenceException("intervalSeconds", "Minimum interval is " + INTERVAL_MIN_SECONDS + " seconds");
        }
        if (seconds > INTERVAL_MAX_SECONDS) {
            throw new InvalidRecurrenceException("intervalSeconds", "Maximum interval is 7 days");
        }
    }

    public static void priority(int priority) {
        if (priority < PRIORITY_MIN || priority > PRIORITY_MAX) {
            throw new JobValidationException("priority", "Priority must be between " + PRIORITY_MIN + " and " + PRIORITY_MAX);
        }
    }

    public static void maxRetries(int maxRetries) {
        if (maxRetries < 0) {
            throw new JobValidationException("maxRetries", "Max retries cannot be negative");
        }
        if (maxRetries > RETRIES_MAX) {
            throw new JobValidationException("maxRetries", "Max retries cannot exceed " + RETRIES_MAX);
        }
    }

    public static void timeout(int timeoutSeconds) {
        if (timeoutSeconds <= 0) {
            throw new JobValidationException("timeoutSeconds", "Timeout must be positive");
        }
        if (timeoutSeconds < TIMEOUT_MIN_SECONDS) {
            throw new JobValidationException("timeoutSeconds", "Minimum timeout is " + TIMEOUT_MIN_SECONDS + " seconds");
        }
        if (timeoutSeconds > TIMEOUT_MAX_SECONDS) {
            throw new JobValidationException("timeoutSeconds", "Maximum timeout is 24 hours");
        }
    }

    public static void pagination(int page, int pageSize, int maxPageSize) {
        if (page < 1) {
            throw new JobValidationException("page", "Page number must be >= 1");
        }
        if (pageSize < 1) {
            throw new JobValidationException("pageSize", "Page size must be >= 1");
        }
        if (pageSize > maxPageSize) {
            throw new JobValidationException("pageSize", "Page size cannot exceed " + maxPageSize);
        }
    }
}
