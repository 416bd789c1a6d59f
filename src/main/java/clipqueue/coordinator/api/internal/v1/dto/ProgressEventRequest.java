package clipqueue.coordinator.api.internal.v1.dto;

import clipqueue.coordinator.events.ProgressEvent;
import clipqueue.coordinator.model.TaskType;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * POST /internal/v1/events/progress
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProgressEventRequest(
        @JsonProperty("jobId") String jobId,
        @JsonProperty("id") String id,
        @JsonProperty("progress") Double progress,
        @JsonProperty("eta") Integer eta,
        @JsonProperty("taskLabel") String taskLabel,
        @JsonProperty("taskType") String taskType) {

    public void validate() {
        if (EventIds.resolve(jobId, id) == null) {
            throw new IllegalArgumentException("jobId is required");
        }
        if (progress == null) {
            throw new IllegalArgumentException("progress is required");
        }
    }

    public ProgressEvent toEvent() {
        return new ProgressEvent(EventIds.resolve(jobId, id), percent(progress), eta, taskLabel,
                TaskType.fromBackendName(taskType).orElse(null));
    }

    /** Whole percent in 0..100. Out-of-range values are clamped before rounding; NaN reads as 0. */
    static int percent(double progress) {
        if (Double.isNaN(progress))
            return 0;
        return (int) Math.round(Math.max(0.0, Math.min(100.0, progress)));
    }
}
