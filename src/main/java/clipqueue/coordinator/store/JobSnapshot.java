package clipqueue.coordinator.store;

import clipqueue.coordinator.model.Job;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Persisted form of a job. Derived progress and status are not stored.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobSnapshot(
        @JsonProperty("id") String id,
        @JsonProperty("videoId") String videoId,
        @JsonProperty("videoPath") String videoPath,
        @JsonProperty("displayName") String displayName,
        @JsonProperty("tasks") List<TaskSnapshot> tasks,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("completedAt") Instant completedAt,
        @JsonProperty("expanded") boolean expanded) {

    public static JobSnapshot from(Job job) {
        return new JobSnapshot(
                job.id(),
                job.videoId(),
                job.videoPath(),
                job.displayName(),
                job.tasks().stream().map(TaskSnapshot::from).toList(),
                job.createdAt(),
                job.startedAt(),
                job.completedAt(),
                job.expanded());
    }

    public Job toJob() {
        return Job.builder()
                .id(id)
                .videoId(videoId)
                .videoPath(videoPath)
                .displayName(displayName)
                .tasks(tasks == null ? List.of() : tasks.stream().map(TaskSnapshot::toTask).toList())
                .createdAt(createdAt)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .expanded(expanded)
                .build();
    }
}
