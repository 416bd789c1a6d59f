package clipqueue.coordinator.api.internal.v1.dto;

/** The backend sends the correlation id as either {@code jobId} or {@code id}. */
final class EventIds {
    private EventIds() {
    }

    static String resolve(String jobId, String id) {
        if (jobId != null && !jobId.isBlank())
            return jobId;
        if (id != null && !id.isBlank())
            return id;
        return null;
    }
}
