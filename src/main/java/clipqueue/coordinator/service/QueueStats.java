package clipqueue.coordinator.service;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Job counts by overall status. */
public record QueueStats(
        @JsonProperty("pending") int pending,
        @JsonProperty("processing") int processing,
        @JsonProperty("completed") int completed,
        @JsonProperty("failed") int failed) {

    @JsonProperty("total")
    public int total() {
        return pending + processing + completed + failed;
    }
}
