package clipqueue.coordinator.api.internal.v1.dto;

import clipqueue.coordinator.events.StatusChangedEvent;
import clipqueue.coordinator.model.TaskType;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * POST /internal/v1/events/status
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StatusEventRequest(
        @JsonProperty("jobId") String jobId,
        @JsonProperty("id") String id,
        @JsonProperty("status") String status,
        @JsonProperty("videoId") String videoId,
        @JsonProperty("videoPath") String videoPath,
        @JsonProperty("taskType") String taskType) {

    public void validate() {
        if (EventIds.resolve(jobId, id) == null) {
            throw new IllegalArgumentException("jobId is required");
        }
        if (status == null || status.isBlank()) {
            throw new IllegalArgumentException("status is required");
        }
    }

    public StatusChangedEvent toEvent() {
        return new StatusChangedEvent(EventIds.resolve(jobId, id), status, videoId, videoPath,
                TaskType.fromBackendName(taskType).orElse(null));
    }
}
