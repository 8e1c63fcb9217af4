package io.taskdesk.error;

public final class NotFoundException extends TaskDeskException {
    private final long taskId;

    public NotFoundException(long taskId) {
        super("Task not found: " + taskId);
        this.taskId = taskId;
    }

    public long taskId() {
        return taskId;
    }
}
