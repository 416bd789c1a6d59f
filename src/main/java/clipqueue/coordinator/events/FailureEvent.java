package clipqueue.coordinator.events;

import clipqueue.coordinator.model.TaskType;

public record FailureEvent(String backendJobId, String message, TaskType taskType) {

    public FailureEvent(String backendJobId, String message) {
        this(backendJobId, message, null);
    }
}
