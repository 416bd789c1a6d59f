package clipqueue.coordinator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Kind of processing step a task performs.
 * The wire name is what the backend and the snapshot cache use.
 */
public enum TaskType {
    /** Fetch a remote video into the library */
    DOWNLOAD("download", "Download"),
    /** Import a local file into the library */
    IMPORT("import", "Import"),
    /** Fix aspect ratio (FFmpeg) */
    FIX_ASPECT_RATIO("fix-aspect-ratio", "Fix Aspect Ratio"),
    /** Normalize audio levels (FFmpeg) */
    NORMALIZE_AUDIO("normalize-audio", "Normalize Audio"),
    /** Aspect ratio and audio normalization fused into one backend pass */
    COMBINED_PROCESS_NORMALIZE("combined-process-normalize", "Process Video"),
    /** Whisper transcription */
    TRANSCRIBE("transcribe", "Transcribe"),
    /** AI analysis of the transcript */
    ANALYZE("analyze", "AI Analysis");

    private final String wireName;
    private final String displayName;

    TaskType(String wireName, String displayName) {
        this.wireName = wireName;
        this.displayName = displayName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public String displayName() {
        return displayName;
    }

    /** Task type name in the backend's bulk queue, which calls the combined pass {@code process-video}. */
    public String backendName() {
        return this == COMBINED_PROCESS_NORMALIZE ? "process-video" : wireName;
    }

    /** Whether an event tagged with this type concerns a task of type {@code other}. */
    public boolean covers(TaskType other) {
        return this == other || (this == COMBINED_PROCESS_NORMALIZE && other.isCombinable());
    }

    /**
     * Download and import only finish once the backend has relocated the file,
     * so a 100% progress tick is not enough to complete them.
     */
    public boolean requiresCompletionSignal() {
        return this == DOWNLOAD || this == IMPORT;
    }

    /** The backend may move the video file when one of these completes. */
    public boolean relocatesVideo() {
        return this == FIX_ASPECT_RATIO || this == NORMALIZE_AUDIO || this == COMBINED_PROCESS_NORMALIZE;
    }

    /** Aspect ratio and audio normalization can share one backend operation. */
    public boolean isCombinable() {
        return this == FIX_ASPECT_RATIO || this == NORMALIZE_AUDIO;
    }

    @JsonCreator
    public static TaskType fromWireName(String value) {
        if (value == null) {
            throw new IllegalArgumentException("task type is required");
        }
        for (TaskType type : values()) {
            if (type.wireName.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown task type: " + value);
    }

    /**
     * Lenient lookup for task types reported by the backend. Steps this
     * coordinator does not track, such as {@code get-info}, yield empty.
     */
    public static Optional<TaskType> fromBackendName(String value) {
        if (value == null || value.isBlank())
            return Optional.empty();
        for (TaskType type : values()) {
            if (type.backendName().equalsIgnoreCase(value) || type.wireName.equalsIgnoreCase(value)
                    || type.name().equalsIgnoreCase(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
