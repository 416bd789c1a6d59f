package clipqueue.coordinator.backend;

import clipqueue.coordinator.model.TaskType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * All steps of one job in a single backend submission. The backend runs the
 * steps in order under one backend job id.
 *
 * @param source where the video comes from: {@code url}, {@code videoId} or {@code filePath}
 * @param steps  operation type and options per step
 */
public record BatchRequest(String displayName, Map<String, Object> source, List<BackendRequest> steps) {

    public BatchRequest {
        source = Collections.unmodifiableMap(new LinkedHashMap<>(source));
        steps = List.copyOf(steps);
    }

    public List<TaskType> types() {
        return steps.stream().map(BackendRequest::type).toList();
    }

    /** One entry of the bulk queue body: the source fields, the name and the task list. */
    public Map<String, Object> toJobBody() {
        Map<String, Object> job = new LinkedHashMap<>(source);
        job.put("displayName", displayName);
        List<Map<String, Object>> tasks = new ArrayList<>(steps.size());
        for (BackendRequest step : steps) {
            Map<String, Object> task = new LinkedHashMap<>();
            task.put("type", step.type().backendName());
            task.put("options", step.body());
            tasks.add(task);
        }
        job.put("tasks", tasks);
        return job;
    }
}
