package io.recur4j.exception;

/**
 * A single field failed validation. Nothing was persisted.
 */
public class JobValidationException extends InvalidJobConfigurationException {

    private final String field;

    public JobValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
