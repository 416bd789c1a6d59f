package clipqueue.coordinator.backend;

import clipqueue.coordinator.model.TaskType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One submission to the processing backend: the operation and its JSON body.
 */
public record BackendRequest(TaskType type, Map<String, Object> body) {

    public BackendRequest {
        body = Collections.unmodifiableMap(new LinkedHashMap<>(body));
    }

    public Object get(String field) {
        return body.get(field);
    }
}
