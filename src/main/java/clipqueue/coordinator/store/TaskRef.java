package clipqueue.coordinator.store;

/** Location of a task inside the store. */
public record TaskRef(String jobId, String taskId) {
}
