package io.recur4j.exception;

/**
 * The job repository failed. Trigger state is never changed on the strength of a failed write.
 */
public class JobStoreException extends SchedulerException {
    public JobStoreException(String message) {
        super(message);
    }

    public JobStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
