package clipqueue.coordinator.util;

import clipqueue.coordinator.model.Job;

import java.util.Map;

/**
 * Observer of the job collection. Receives an immutable snapshot keyed by job id,
 * in insertion order.
 */
@FunctionalInterface
public interface JobsListener {
    void onJobsChanged(Map<String, Job> jobs);
}
