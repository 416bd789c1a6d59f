package clipqueue.coordinator.api.v1.dto;

import clipqueue.coordinator.model.Task;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskResponse(
        @JsonProperty("id") String id,
        @JsonProperty("type") String type,
        @JsonProperty("displayName") String displayName,
        @JsonProperty("status") String status,
        @JsonProperty("progress") int progress,
        @JsonProperty("backendJobId") String backendJobId,
        @JsonProperty("error") String error,
        @JsonProperty("attempts") int attempts,
        @JsonProperty("eta") Integer eta,
        @JsonProperty("label") String label,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("finishedAt") Instant finishedAt) {

    public static TaskResponse from(Task task) {
        return new TaskResponse(
                task.id(),
                task.type().wireName(),
                task.displayName(),
                task.status().wireName(),
                task.progress(),
                task.backendJobId(),
                task.error(),
                task.attempts(),
                task.etaSeconds(),
                task.label(),
                task.startedAt(),
                task.finishedAt());
    }
}
