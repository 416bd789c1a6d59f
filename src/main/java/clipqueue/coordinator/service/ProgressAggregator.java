package clipqueue.coordinator.service;

import clipqueue.coordinator.backend.ProcessingBackend;
import clipqueue.coordinator.events.BackendEventListener;
import clipqueue.coordinator.events.FailureEvent;
import clipqueue.coordinator.events.ProgressEvent;
import clipqueue.coordinator.events.StatusChangedEvent;
import clipqueue.coordinator.model.Job;
import clipqueue.coordinator.model.Task;
import clipqueue.coordinator.model.TaskStatus;
import clipqueue.coordinator.model.TaskType;
import clipqueue.coordinator.store.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Applies backend events to the tasks bound to their backend job id.
 * <p>
 * A batch submission binds several tasks to one backend job; events then carry
 * a task type, or apply to the step currently running. Terminal tasks ignore
 * further events. Events for ids nobody is bound to are
 * logged and dropped. When a step that may move the video file completes, the
 * job's path is refreshed from the backend in the background.
 */
public class ProgressAggregator implements BackendEventListener, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProgressAggregator.class);

    private final JobStore store;
    private final ProcessingBackend backend;
    private final ExecutorService refreshPool;

    public ProgressAggregator(JobStore store, ProcessingBackend backend) {
        this.store = store;
        this.backend = backend;
        AtomicInteger n = new AtomicInteger();
        this.refreshPool = Executors.newFixedThreadPool(2, r -> {
            Thread t = new Thread(r, "path-refresh-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void onProgress(ProgressEvent event) {
        // -1 is the backend's "indeterminate"
        int percent = Task.clampProgress(event.percent());
        Set<String> relocated = new LinkedHashSet<>();

        int matched = store.applyToBackendJob(event.backendJobId(), (job, bound) -> {
            Job result = completeEarlierSteps(job, bound, event.taskType(), relocated);
            for (Task task : targets(bound, event.taskType())) {
                Task.Builder b = task.toBuilder()
                        .progress(percent)
                        .etaSeconds(event.etaSeconds())
                        .label(event.label());
                if (percent >= 100 && !task.type().requiresCompletionSignal()) {
                    b.status(TaskStatus.COMPLETED);
                    if (task.type().relocatesVideo())
                        relocated.add(job.id());
                } else if (task.status() == TaskStatus.PENDING) {
                    b.status(TaskStatus.PROCESSING);
                }
                result = result.withTask(b.build());
            }
            return result;
        });

        if (matched == 0) {
            log.debug("Progress for unknown backend job {} dropped", event.backendJobId());
            return;
        }
        relocated.forEach(this::scheduleVideoPathRefresh);
    }

    @Override
    public void onFailure(FailureEvent event) {
        String message = event.message() != null && !event.message().isBlank()
                ? event.message()
                : "Processing failed";

        int matched = store.applyToBackendJob(event.backendJobId(), (job, bound) -> {
            Job result = job;
            for (Task task : targets(bound, event.taskType())) {
                result = result.withTask(task.toBuilder()
                        .status(TaskStatus.FAILED)
                        .error(message)
                        .build());
            }
            return result;
        });

        if (matched == 0) {
            log.debug("Failure for unknown backend job {} dropped: {}", event.backendJobId(), message);
        } else {
            log.warn("Backend job {} failed: {}", event.backendJobId(), message);
        }
    }

    @Override
    public void onStatusChanged(StatusChangedEvent event) {
        String status = event.normalizedStatus();
        Set<String> relocated = new LinkedHashSet<>();

        int matched = store.applyToBackendJob(event.backendJobId(), (job, bound) -> {
            // an untyped "completed" closes the whole backend job
            List<Task> tasks = event.taskType() == null && status.equals("completed")
                    ? bound.stream().filter(t -> !t.isTerminal()).toList()
                    : targets(bound, event.taskType());
            Job result = status.equals("completed") || status.equals("processing") || status.equals("running")
                    ? completeEarlierSteps(job, bound, event.taskType(), relocated)
                    : job;

            for (Task task : tasks) {
                Task updated = switch (status) {
                    case "completed" -> task.toBuilder().status(TaskStatus.COMPLETED).progress(100).build();
                    case "failed" -> task.toBuilder().status(TaskStatus.FAILED).error("Processing failed").build();
                    case "cancelled", "canceled" -> task.toBuilder().status(TaskStatus.FAILED).error("Cancelled").build();
                    case "processing", "running" -> task.toBuilder().status(TaskStatus.PROCESSING).build();
                    default -> task;
                };
                if (updated.status() == TaskStatus.COMPLETED && task.type().relocatesVideo())
                    relocated.add(job.id());
                result = result.withTask(updated);
            }

            Job.Builder b = result.toBuilder();
            if (event.videoId() != null)
                b.videoId(event.videoId());
            if (event.videoPath() != null)
                b.videoPath(event.videoPath());
            return b.build();
        });

        if (matched == 0) {
            log.debug("Status '{}' for unknown backend job {} dropped", status, event.backendJobId());
            return;
        }
        log.debug("Backend job {} is now {}", event.backendJobId(), status);
        relocated.forEach(this::scheduleVideoPathRefresh);
    }

    /**
     * Non-terminal bound tasks an event is about. A typed event selects the
     * tasks of that type. An untyped one selects the current step: the first
     * non-terminal task plus the other half of an aspect/audio pair sharing the id.
     */
    static List<Task> targets(List<Task> bound, TaskType type) {
        List<Task> open = bound.stream().filter(t -> !t.isTerminal()).toList();
        if (type != null) {
            return open.stream().filter(t -> type.covers(t.type())).toList();
        }
        if (open.isEmpty())
            return open;
        Task current = open.get(0);
        if (!current.type().isCombinable())
            return List.of(current);
        List<Task> step = new ArrayList<>();
        for (Task t : open) {
            if (t == current || (t.type().isCombinable() && t.type() != current.type()))
                step.add(t);
        }
        return step;
    }

    /**
     * The backend runs a multi-step job in order, so a typed event for a later
     * step means the open steps before it are done.
     */
    private static Job completeEarlierSteps(Job job, List<Task> bound, TaskType type, Set<String> relocated) {
        if (type == null)
            return job;
        Job result = job;
        for (Task task : bound) {
            if (type.covers(task.type()))
                break;
            if (!task.isTerminal()) {
                result = result.withTask(task.toBuilder().status(TaskStatus.COMPLETED).progress(100).build());
                if (task.type().relocatesVideo())
                    relocated.add(job.id());
            }
        }
        return result;
    }

    /**
     * Look up where the backend now keeps the job's video. Fire and forget;
     * failures are logged.
     */
    void scheduleVideoPathRefresh(String jobId) {
        try {
            refreshPool.execute(() -> refreshVideoPath(jobId));
        } catch (RejectedExecutionException e) {
            log.debug("Path refresh for job {} skipped, shutting down", jobId);
        }
    }

    private void refreshVideoPath(String jobId) {
        String videoId = store.getJob(jobId).map(Job::videoId).orElse(null);
        if (videoId == null) {
            log.debug("Job {} has no video id, path refresh skipped", jobId);
            return;
        }
        try {
            backend.fetchVideoPath(videoId).ifPresent(path -> {
                store.updateJob(jobId, j -> path.equals(j.videoPath()) ? j : j.toBuilder().videoPath(path).build());
                log.info("Job {} video path refreshed to {}", jobId, path);
            });
        } catch (RuntimeException e) {
            log.warn("Failed to refresh video path of job {}: {}", jobId, e.getMessage());
        }
    }

    @Override
    public void close() {
        refreshPool.shutdownNow();
    }
}
