package clipqueue.coordinator.store;

import clipqueue.coordinator.model.Job;

import java.util.List;

/**
 * Durable copy of the job collection, read once at startup.
 */
public interface JobCache {

    /** Jobs from the last save, or an empty list if nothing usable is stored. */
    List<Job> load();

    void save(List<Job> jobs);
}
