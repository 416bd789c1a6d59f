package clipqueue.coordinator.store;

import clipqueue.coordinator.model.Task;
import clipqueue.coordinator.model.TaskConfig;
import clipqueue.coordinator.model.TaskStatus;
import clipqueue.coordinator.model.TaskType;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Persisted form of a task.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskSnapshot(
        @JsonProperty("id") String id,
        @JsonProperty("type") TaskType type,
        @JsonProperty("status") TaskStatus status,
        @JsonProperty("progress") int progress,
        @JsonProperty("backendJobId") String backendJobId,
        @JsonProperty("error") String error,
        @JsonProperty("config") TaskConfig config,
        @JsonProperty("attempts") int attempts,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("finishedAt") Instant finishedAt) {

    public static TaskSnapshot from(Task task) {
        return new TaskSnapshot(
                task.id(),
                task.type(),
                task.status(),
                task.progress(),
                task.backendJobId(),
                task.error(),
                task.config(),
                task.attempts(),
                task.startedAt(),
                task.finishedAt());
    }

    public Task toTask() {
        return Task.builder()
                .id(id)
                .type(type)
                .status(status != null ? status : TaskStatus.PENDING)
                .progress(progress)
                .backendJobId(backendJobId)
                .error(error)
                .config(config)
                .attempts(attempts)
                .startedAt(startedAt)
                .finishedAt(finishedAt)
                .build();
    }
}
