package io.taskdesk.error;

/**
 * Base type for the failures the task operations report to callers.
 */
public abstract class TaskDeskException extends RuntimeException {
    protected TaskDeskException(String message) {
        super(message);
    }

    protected TaskDeskException(String message, Throwable cause) {
        super(message, cause);
    }
}
