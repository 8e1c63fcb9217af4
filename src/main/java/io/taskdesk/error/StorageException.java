package io.taskdesk.error;

/**
 * The underlying database could not complete an operation.
 */
public final class StorageException extends TaskDeskException {
    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
