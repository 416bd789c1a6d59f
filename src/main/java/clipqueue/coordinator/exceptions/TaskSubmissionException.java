package clipqueue.coordinator.exceptions;

public class TaskSubmissionException extends PipelineException {
    private final String taskId;

    public TaskSubmissionException(String taskId, String message) {
        super(message);
        this.taskId = taskId;
    }

    public TaskSubmissionException(String taskId, String message, Throwable cause) {
        super(message, cause);
        this.taskId = taskId;
    }

    public String taskId() {
        return taskId;
    }
}
