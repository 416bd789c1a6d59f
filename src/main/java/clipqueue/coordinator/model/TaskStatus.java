package clipqueue.coordinator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Task execution status. Jobs use the same domain for their derived status.
 */
public enum TaskStatus {
    /** Created, not yet submitted */
    PENDING,
    /** Submitted to the backend and running */
    PROCESSING,
    /** Finished successfully */
    COMPLETED,
    /** Finished with an error */
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static TaskStatus fromWireName(String value) {
        if (value == null) {
            throw new IllegalArgumentException("status is required");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
