package io.recur4j.exception;

/**
 * Cron expression is malformed, or the job has no (or more than one) recurrence.
 */
public class InvalidRecurrenceException extends JobValidationException {
    public InvalidRecurrenceException(String field, String message) {
        super(field, message);
    }
}
