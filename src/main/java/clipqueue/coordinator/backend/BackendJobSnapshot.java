package clipqueue.coordinator.backend;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;

/** One entry of the backend's queue listing. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BackendJobSnapshot(
        @JsonProperty("id") String id,
        @JsonProperty("status") String status,
        @JsonProperty("progress") Integer progress) {

    public boolean isTerminal() {
        String s = status == null ? "" : status.toLowerCase(Locale.ROOT);
        return s.equals("completed") || s.equals("failed") || s.equals("cancelled");
    }
}
