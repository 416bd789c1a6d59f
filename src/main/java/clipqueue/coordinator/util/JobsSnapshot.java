package clipqueue.coordinator.util;

import clipqueue.coordinator.model.Job;

import java.util.Map;

/**
 * The job collection as of one store version. Versions grow with every change.
 */
public record JobsSnapshot(long version, Map<String, Job> jobs) {

    public boolean isOlderThan(JobsSnapshot other) {
        return other != null && version < other.version;
    }
}
