package clipqueue.coordinator.api.internal.v1.dto;

import clipqueue.coordinator.events.FailureEvent;
import clipqueue.coordinator.model.TaskType;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * POST /internal/v1/events/failure
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FailureEventRequest(
        @JsonProperty("jobId") String jobId,
        @JsonProperty("id") String id,
        @JsonProperty("error") String error,
        @JsonProperty("message") String message,
        @JsonProperty("taskType") String taskType) {

    public void validate() {
        if (EventIds.resolve(jobId, id) == null) {
            throw new IllegalArgumentException("jobId is required");
        }
    }

    public FailureEvent toEvent() {
        return new FailureEvent(EventIds.resolve(jobId, id), error != null ? error : message,
                TaskType.fromBackendName(taskType).orElse(null));
    }
}
