package clipqueue.coordinator.exceptions;

import java.time.Duration;

public class TaskTimeoutException extends PipelineException {
    private final String taskId;
    private final Duration timeout;

    public TaskTimeoutException(String taskId, Duration timeout) {
        super("Task " + taskId + " did not finish within " + timeout.toSeconds() + "s");
        this.taskId = taskId;
        this.timeout = timeout;
    }

    public String taskId() {
        return taskId;
    }

    public Duration timeout() {
        return timeout;
    }
}
