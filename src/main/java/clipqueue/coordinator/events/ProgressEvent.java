package clipqueue.coordinator.events;

import clipqueue.coordinator.model.TaskType;

/**
 * Percentage report for a backend job. {@code percent} of -1 means indeterminate.
 * {@code taskType} names the step within a multi-step backend job, null when
 * the backend did not say.
 */
public record ProgressEvent(String backendJobId, int percent, Integer etaSeconds, String label, TaskType taskType) {

    public ProgressEvent(String backendJobId, int percent, Integer etaSeconds, String label) {
        this(backendJobId, percent, etaSeconds, label, null);
    }

    public static ProgressEvent of(String backendJobId, int percent) {
        return new ProgressEvent(backendJobId, percent, null, null, null);
    }

    public static ProgressEvent of(String backendJobId, TaskType taskType, int percent) {
        return new ProgressEvent(backendJobId, percent, null, null, taskType);
    }
}
