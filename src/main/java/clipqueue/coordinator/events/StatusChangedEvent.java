package clipqueue.coordinator.events;

import clipqueue.coordinator.model.TaskType;

import java.util.Locale;

/**
 * Lifecycle change reported by the backend, optionally carrying the video's
 * library id and current path. Without a {@code taskType} the status is about
 * the backend job as a whole.
 */
public record StatusChangedEvent(String backendJobId, String status, String videoId, String videoPath,
        TaskType taskType) {

    public StatusChangedEvent(String backendJobId, String status, String videoId, String videoPath) {
        this(backendJobId, status, videoId, videoPath, null);
    }

    public static StatusChangedEvent of(String backendJobId, String status) {
        return new StatusChangedEvent(backendJobId, status, null, null, null);
    }

    public static StatusChangedEvent of(String backendJobId, TaskType taskType, String status) {
        return new StatusChangedEvent(backendJobId, status, null, null, taskType);
    }

    public String normalizedStatus() {
        return status == null ? "" : status.trim().toLowerCase(Locale.ROOT);
    }
}
