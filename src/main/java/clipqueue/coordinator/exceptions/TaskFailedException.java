package clipqueue.coordinator.exceptions;

/**
 * A task reached the failed state while a pipeline was waiting on it.
 */
public class TaskFailedException extends PipelineException {
    private final String taskId;

    public TaskFailedException(String taskId, String message) {
        super(message);
        this.taskId = taskId;
    }

    public String taskId() {
        return taskId;
    }
}
