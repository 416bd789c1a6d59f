package clipqueue.coordinator.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable domain model representing one processing step of a video job.
 * Updates go through {@link #toBuilder()}; the store swaps whole values.
 */
public final class Task {
    private final String id;
    private final TaskType type;
    private final TaskStatus status;
    private final int progress;
    private final String backendJobId; // set once the backend accepted the submission
    private final String error;
    private final TaskConfig config;
    private final int attempts;
    private final Integer etaSeconds;
    private final String label;
    private final Instant startedAt;
    private final Instant finishedAt;

    private Task(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.type = Objects.requireNonNull(builder.type, "type is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.progress = clampProgress(builder.progress);
        this.backendJobId = builder.backendJobId;
        this.error = builder.status == TaskStatus.FAILED ? builder.error : null;
        this.config = builder.config;
        this.attempts = builder.attempts;
        this.etaSeconds = builder.etaSeconds;
        this.label = builder.label;
        this.startedAt = builder.startedAt;
        this.finishedAt = builder.finishedAt;
    }

    /** Clamp a reported percentage into [0, 100]. */
    public static int clampProgress(int value) {
        return Math.max(0, Math.min(100, value));
    }

    // Getters
    public String id() {
        return id;
    }

    public TaskType type() {
        return type;
    }

    public TaskStatus status() {
        return status;
    }

    public int progress() {
        return progress;
    }

    public String backendJobId() {
        return backendJobId;
    }

    public String error() {
        return error;
    }

    public TaskConfig config() {
        return config;
    }

    public int attempts() {
        return attempts;
    }

    public Integer etaSeconds() {
        return etaSeconds;
    }

    public String label() {
        return label;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant finishedAt() {
        return finishedAt;
    }

    public String displayName() {
        return type.displayName();
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean isSubmitted() {
        return backendJobId != null;
    }

    /** Typed access to the configuration payload, or null if absent or of another kind. */
    public <T extends TaskConfig> T configAs(Class<T> kind) {
        return kind.isInstance(config) ? kind.cast(config) : null;
    }

    /**
     * True when the two values differ only in progress decorations
     * (percentage, eta, label).
     */
    public boolean sameStateAs(Task other) {
        return other != null
                && id.equals(other.id)
                && status == other.status
                && attempts == other.attempts
                && Objects.equals(backendJobId, other.backendJobId)
                && Objects.equals(error, other.error);
    }

    /** Create a builder from this task (for updates) */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .type(type)
                .status(status)
                .progress(progress)
                .backendJobId(backendJobId)
                .error(error)
                .config(config)
                .attempts(attempts)
                .etaSeconds(etaSeconds)
                .label(label)
                .startedAt(startedAt)
                .finishedAt(finishedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private TaskType type;
        private TaskStatus status = TaskStatus.PENDING;
        private int progress;
        private String backendJobId;
        private String error;
        private TaskConfig config;
        private int attempts;
        private Integer etaSeconds;
        private String label;
        private Instant startedAt;
        private Instant finishedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder type(TaskType type) {
            this.type = type;
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder progress(int progress) {
            this.progress = progress;
            return this;
        }

        public Builder backendJobId(String backendJobId) {
            this.backendJobId = backendJobId;
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public Builder config(TaskConfig config) {
            this.config = config;
            return this;
        }

        public Builder attempts(int attempts) {
            this.attempts = attempts;
            return this;
        }

        public Builder etaSeconds(Integer etaSeconds) {
            this.etaSeconds = etaSeconds;
            return this;
        }

        public Builder label(String label) {
            this.label = label;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder finishedAt(Instant finishedAt) {
            this.finishedAt = finishedAt;
            return this;
        }

        public Task build() {
            return new Task(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Task task))
            return false;
        return Objects.equals(id, task.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Task{id='" + id + "', type=" + type.wireName() + ", status=" + status
                + ", progress=" + progress + ", backendJobId='" + backendJobId + "'}";
    }
}
