package io.recur4j.exception;

/**
 * A job could not be created or updated with the given configuration.
 */
public class InvalidJobConfigurationException extends SchedulerException {
    public InvalidJobConfigurationException(String message) {
        super(message);
    }

    public InvalidJobConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
