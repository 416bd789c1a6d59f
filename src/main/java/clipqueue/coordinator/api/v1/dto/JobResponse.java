package clipqueue.coordinator.api.v1.dto;

import clipqueue.coordinator.model.Job;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Response DTO for job status.
 * GET /api/v1/jobs/{jobId}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobResponse(
        @JsonProperty("id") String id,
        @JsonProperty("videoId") String videoId,
        @JsonProperty("videoPath") String videoPath,
        @JsonProperty("displayName") String displayName,
        @JsonProperty("status") String status,
        @JsonProperty("progress") int progress,
        @JsonProperty("expanded") boolean expanded,
        @JsonProperty("tasks") List<TaskResponse> tasks,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("completedAt") Instant completedAt) {

    public static JobResponse from(Job job) {
        return new JobResponse(
                job.id(),
                job.videoId(),
                job.videoPath(),
                job.displayName(),
                job.overallStatus().wireName(),
                job.overallProgress(),
                job.expanded(),
                job.tasks().stream().map(TaskResponse::from).toList(),
                job.createdAt(),
                job.startedAt(),
                job.completedAt());
    }
}
