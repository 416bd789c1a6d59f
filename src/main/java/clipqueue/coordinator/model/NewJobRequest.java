package clipqueue.coordinator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Input for creating a job: the video it concerns and its ordered steps.
 */
public record NewJobRequest(
        @JsonProperty("videoId") String videoId,
        @JsonProperty("videoPath") String videoPath,
        @JsonProperty("displayName") String displayName,
        @JsonProperty("tasks") List<TaskSpec> tasks) {

    /** One requested step. */
    public record TaskSpec(
            @JsonProperty("type") TaskType type,
            @JsonProperty("config") TaskConfig config) {

        public static TaskSpec of(TaskType type) {
            return new TaskSpec(type, null);
        }

        public static TaskSpec of(TaskType type, TaskConfig config) {
            return new TaskSpec(type, config);
        }
    }

    public NewJobRequest {
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
    }

    /** Validate the request */
    public void validate() {
        if (displayName == null || displayName.isBlank()) {
            throw new IllegalArgumentException("displayName is required");
        }
        if (tasks.isEmpty()) {
            throw new IllegalArgumentException("a job needs at least one task");
        }
        for (TaskSpec spec : tasks) {
            if (spec == null || spec.type() == null) {
                throw new IllegalArgumentException("task type is required");
            }
            if (spec.type() == TaskType.COMBINED_PROCESS_NORMALIZE) {
                throw new IllegalArgumentException("combined-process-normalize is derived, request its parts instead");
            }
            if (spec.config() != null) {
                spec.config().validateFor(spec.type());
            } else if (spec.type() == TaskType.DOWNLOAD || spec.type() == TaskType.ANALYZE) {
                throw new IllegalArgumentException(spec.type().wireName() + " requires a config");
            }
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String videoId;
        private String videoPath;
        private String displayName;
        private final List<TaskSpec> tasks = new ArrayList<>();

        public Builder videoId(String videoId) {
            this.videoId = videoId;
            return this;
        }

        public Builder videoPath(String videoPath) {
            this.videoPath = videoPath;
            return this;
        }

        public Builder displayName(String displayName) {
            this.displayName = displayName;
            return this;
        }

        public Builder task(TaskType type) {
            tasks.add(TaskSpec.of(type));
            return this;
        }

        public Builder task(TaskType type, TaskConfig config) {
            tasks.add(TaskSpec.of(type, config));
            return this;
        }

        public NewJobRequest build() {
            return new NewJobRequest(videoId, videoPath, displayName, tasks);
        }
    }
}
