package clipqueue.coordinator.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable domain model representing all processing steps for one video.
 * Overall progress and status are derived from the tasks on every call.
 */
public final class Job {
    private final String id;
    private final String videoId;
    private final String videoPath;
    private final String displayName;
    private final List<Task> tasks; // execution order
    private final Instant createdAt;
    private final Instant startedAt;
    private final Instant completedAt;
    private final boolean expanded;

    private Job(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.videoId = builder.videoId;
        this.videoPath = builder.videoPath;
        this.displayName = builder.displayName;
        this.tasks = List.copyOf(builder.tasks);
        this.createdAt = builder.createdAt;
        this.startedAt = builder.startedAt;
        this.completedAt = builder.completedAt;
        this.expanded = builder.expanded;
    }

    // Getters
    public String id() {
        return id;
    }

    public String videoId() {
        return videoId;
    }

    public String videoPath() {
        return videoPath;
    }

    public String displayName() {
        return displayName;
    }

    public List<Task> tasks() {
        return tasks;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant completedAt() {
        return completedAt;
    }

    public boolean expanded() {
        return expanded;
    }

    /** Rounded mean of all task progress values */
    public int overallProgress() {
        if (tasks.isEmpty())
            return 0;
        int total = 0;
        for (Task task : tasks) {
            total += task.progress();
        }
        return Math.round((float) total / tasks.size());
    }

    /**
     * completed iff all tasks completed, failed iff any failed,
     * processing iff any processing, else pending.
     */
    public TaskStatus overallStatus() {
        if (tasks.isEmpty())
            return TaskStatus.PENDING;
        boolean allCompleted = true;
        boolean anyProcessing = false;
        for (Task task : tasks) {
            if (task.status() == TaskStatus.FAILED)
                return TaskStatus.FAILED;
            if (task.status() != TaskStatus.COMPLETED)
                allCompleted = false;
            if (task.status() == TaskStatus.PROCESSING)
                anyProcessing = true;
        }
        if (allCompleted)
            return TaskStatus.COMPLETED;
        return anyProcessing ? TaskStatus.PROCESSING : TaskStatus.PENDING;
    }

    /** Check if job is in terminal state */
    public boolean isTerminal() {
        return overallStatus().isTerminal();
    }

    public Optional<Task> task(String taskId) {
        for (Task task : tasks) {
            if (task.id().equals(taskId))
                return Optional.of(task);
        }
        return Optional.empty();
    }

    public Optional<Task> firstTaskOfType(TaskType type) {
        for (Task task : tasks) {
            if (task.type() == type)
                return Optional.of(task);
        }
        return Optional.empty();
    }

    public boolean hasTaskOfType(TaskType type) {
        return firstTaskOfType(type).isPresent();
    }

    /** Distinct backend ids bound to any task of this job. */
    public Set<String> backendJobIds() {
        Set<String> ids = new LinkedHashSet<>();
        for (Task task : tasks) {
            if (task.backendJobId() != null)
                ids.add(task.backendJobId());
        }
        return ids;
    }

    /** Copy of this job with one task replaced (matched by id). */
    public Job withTask(Task updated) {
        List<Task> copy = new ArrayList<>(tasks.size());
        boolean found = false;
        for (Task task : tasks) {
            if (task.id().equals(updated.id())) {
                copy.add(updated);
                found = true;
            } else {
                copy.add(task);
            }
        }
        if (!found)
            throw new IllegalArgumentException("Task " + updated.id() + " does not belong to job " + id);
        return toBuilder().tasks(copy).build();
    }

    /**
     * True when the two values differ only in task progress decorations.
     * Such changes are published on the throttled path.
     */
    public boolean sameStateAs(Job other) {
        if (other == null || !id.equals(other.id) || tasks.size() != other.tasks.size())
            return false;
        if (!Objects.equals(videoId, other.videoId)
                || !Objects.equals(videoPath, other.videoPath)
                || expanded != other.expanded)
            return false;
        for (int i = 0; i < tasks.size(); i++) {
            if (!tasks.get(i).sameStateAs(other.tasks.get(i)))
                return false;
        }
        return true;
    }

    /** Create a builder from this job (for updates) */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .videoId(videoId)
                .videoPath(videoPath)
                .displayName(displayName)
                .tasks(tasks)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .expanded(expanded);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String videoId;
        private String videoPath;
        private String displayName;
        private List<Task> tasks = List.of();
        private Instant createdAt;
        private Instant startedAt;
        private Instant completedAt;
        private boolean expanded;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder videoId(String videoId) {
            this.videoId = videoId;
            return this;
        }

        public Builder videoPath(String videoPath) {
            this.videoPath = videoPath;
            return this;
        }

        public Builder displayName(String displayName) {
            this.displayName = displayName;
            return this;
        }

        public Builder tasks(List<Task> tasks) {
            this.tasks = tasks;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Builder expanded(boolean expanded) {
            this.expanded = expanded;
            return this;
        }

        public Job build() {
            return new Job(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Job job))
            return false;
        return Objects.equals(id, job.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Job{id='" + id + "', status=" + overallStatus() + ", progress=" + overallProgress() + "%}";
    }
}
