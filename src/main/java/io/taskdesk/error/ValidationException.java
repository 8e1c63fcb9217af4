package io.taskdesk.error;

/**
 * A required field is missing or a supplied value cannot be stored.
 */
public final class ValidationException extends TaskDeskException {
    private final String field;

    public ValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String field() {
        return field;
    }
}
