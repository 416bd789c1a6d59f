package clipqueue.coordinator.store;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Versioned wrapper around the persisted job list. */
public record CacheEnvelope(
        @JsonProperty("version") int version,
        @JsonProperty("jobs") List<JobSnapshot> jobs) {

    public static final int CURRENT_VERSION = 1;

    public static CacheEnvelope of(List<JobSnapshot> jobs) {
        return new CacheEnvelope(CURRENT_VERSION, jobs);
    }
}
