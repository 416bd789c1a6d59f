package clipqueue.coordinator.api.v1.dto;

import clipqueue.coordinator.model.NewJobRequest;
import clipqueue.coordinator.model.TaskConfig;
import clipqueue.coordinator.model.TaskType;
import clipqueue.coordinator.util.Json;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Request DTO for creating a job.
 * POST /api/v1/jobs
 * <p>
 * Task options are plain objects; their shape follows the task type.
 */
public record CreateJobRequest(
        @JsonProperty("videoId") String videoId,
        @JsonProperty("videoPath") String videoPath,
        @JsonProperty("displayName") String displayName,
        @JsonProperty("tasks") List<TaskRequest> tasks,
        @JsonProperty("submit") boolean submit) {

    public record TaskRequest(
            @JsonProperty("type") String type,
            @JsonProperty("options") Map<String, Object> options) {
    }

    /** Validate the request */
    public void validate() {
        if (displayName == null || displayName.isBlank()) {
            throw new IllegalArgumentException("displayName is required");
        }
        if (tasks == null || tasks.isEmpty()) {
            throw new IllegalArgumentException("tasks must not be empty");
        }
        for (TaskRequest task : tasks) {
            if (task == null || task.type() == null || task.type().isBlank()) {
                throw new IllegalArgumentException("task type is required");
            }
        }
    }

    public NewJobRequest toNewJobRequest() {
        List<NewJobRequest.TaskSpec> specs = new ArrayList<>(tasks.size());
        for (TaskRequest task : tasks) {
            TaskType type = TaskType.fromWireName(task.type());
            specs.add(NewJobRequest.TaskSpec.of(type, configFor(type, task.options())));
        }
        return new NewJobRequest(videoId, videoPath, displayName, specs);
    }

    static TaskConfig configFor(TaskType type, Map<String, Object> options) {
        String kind = switch (type) {
            case DOWNLOAD -> "download";
            case FIX_ASPECT_RATIO -> "aspect-ratio";
            case NORMALIZE_AUDIO -> "audio";
            case TRANSCRIBE -> "transcription";
            case ANALYZE -> "analysis";
            default -> null;
        };
        if (kind == null || options == null || options.isEmpty()) {
            return null;
        }
        Map<String, Object> typed = new LinkedHashMap<>(options);
        typed.put("kind", kind);
        return Json.mapper().convertValue(typed, TaskConfig.class);
    }
}
