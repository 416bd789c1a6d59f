package clipqueue.coordinator.service;

import clipqueue.coordinator.config.QueueConfig;
import clipqueue.coordinator.exceptions.PipelineException;
import clipqueue.coordinator.exceptions.TaskFailedException;
import clipqueue.coordinator.exceptions.TaskSubmissionException;
import clipqueue.coordinator.model.Job;
import clipqueue.coordinator.model.NewJobRequest;
import clipqueue.coordinator.model.Task;
import clipqueue.coordinator.model.TaskStatus;
import clipqueue.coordinator.store.JobStore;
import clipqueue.coordinator.util.JobsListener;
import clipqueue.coordinator.util.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point for everything a client does with the queue: create jobs, run
 * them, retry, remove, observe.
 * <p>
 * Each submitted job runs its pipeline on a worker pool, independently of the
 * others. Within a job, tasks run in list order.
 */
public class VideoQueueService implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(VideoQueueService.class);

    private final JobStore store;
    private final TaskSubmitter submitter;
    private final CompletionWaiter waiter;
    private final BackendReconciler reconciler;
    private final Duration taskTimeout;
    private final Duration retention;
    private final SubmissionMode mode;
    private final Clock clock;
    private final ExecutorService pipelines;
    private final Map<String, CompletableFuture<Void>> running = new ConcurrentHashMap<>();

    public VideoQueueService(JobStore store, TaskSubmitter submitter, CompletionWaiter waiter,
            BackendReconciler reconciler, QueueConfig config, Clock clock) {
        this.store = store;
        this.submitter = submitter;
        this.waiter = waiter;
        this.reconciler = reconciler;
        this.taskTimeout = config.taskTimeout();
        this.retention = config.retention();
        this.mode = config.submissionMode();
        this.clock = clock;
        AtomicInteger n = new AtomicInteger();
        this.pipelines = Executors.newFixedThreadPool(config.submitThreads(), r -> {
            Thread t = new Thread(r, "job-pipeline-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    // ---------- job lifecycle ----------

    /**
     * Create a job with all tasks pending. Nothing is sent to the backend yet.
     *
     * @return the new job id
     * @throws IllegalArgumentException if the request is invalid
     */
    public String addVideoJob(NewJobRequest request) {
        return store.addJob(request);
    }

    /**
     * Run the job's tasks. The future completes when every task has completed
     * or the job was removed, and completes exceptionally with a
     * {@link PipelineException} when a task fails or times out.
     */
    public synchronized CompletableFuture<Void> submitJob(String jobId) {
        if (store.getJob(jobId).isEmpty()) {
            log.warn("submitJob: unknown job {}", jobId);
            return CompletableFuture.completedFuture(null);
        }
        CompletableFuture<Void> existing = running.get(jobId);
        if (existing != null && !existing.isDone()) {
            log.debug("Job {} is already running", jobId);
            return existing;
        }
        CompletableFuture<Void> future = CompletableFuture.runAsync(() -> runPipeline(jobId), pipelines);
        running.put(jobId, future);
        future.whenComplete((ok, error) -> running.remove(jobId, future));
        return future;
    }

    /**
     * Reset every failed task (new attempt, backend id cleared) and run the job again.
     */
    public CompletableFuture<Void> retryJob(String jobId) {
        Optional<Job> reset = store.updateJob(jobId, job -> {
            Job result = job;
            for (Task task : job.tasks()) {
                if (task.status() != TaskStatus.FAILED)
                    continue;
                result = result.withTask(task.toBuilder()
                        .status(TaskStatus.PENDING)
                        .attempts(task.attempts() + 1)
                        .backendJobId(null)
                        .progress(0)
                        .error(null)
                        .etaSeconds(null)
                        .label(null)
                        .startedAt(null)
                        .finishedAt(null)
                        .build());
            }
            return result;
        });
        if (reset.isEmpty()) {
            log.warn("retryJob: unknown job {}", jobId);
            return CompletableFuture.completedFuture(null);
        }
        log.info("Retrying job {}", jobId);
        return submitJob(jobId);
    }

    private void runPipeline(String jobId) {
        Optional<Job> job = store.getJob(jobId);
        if (job.isEmpty())
            return;
        List<String> taskIds = job.get().tasks().stream().map(Task::id).toList();
        log.info("Running job {} ({} tasks, {})", jobId, taskIds.size(), mode);
        try {
            if (mode == SubmissionMode.BATCH) {
                runBatch(jobId, taskIds);
            } else {
                runSequential(jobId, taskIds);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PipelineException("Interrupted while running job " + jobId, e);
        }
    }

    private void runSequential(String jobId, List<String> taskIds) throws InterruptedException {
        for (String taskId : taskIds) {
            Optional<Task> task = currentTask(jobId, taskId);
            if (task.isEmpty())
                return; // job removed
            if (task.get().status() == TaskStatus.COMPLETED)
                continue;
            if (!submit(jobId, task.get()))
                return;
            if (waiter.await(jobId, taskId, taskTimeout) == WaitOutcome.JOB_REMOVED)
                return;
        }
        log.info("Job {} finished", jobId);
    }

    private void runBatch(String jobId, List<String> taskIds) throws InterruptedException {
        for (String taskId : taskIds) {
            if (currentTask(jobId, taskId).isEmpty())
                return;
        }
        try {
            submitter.submitBatch(jobId);
        } catch (TaskSubmissionException e) {
            if (store.getJob(jobId).isEmpty()) {
                log.info("Job {} removed during batch submission", jobId);
                return;
            }
            throw e;
        }
        for (String taskId : taskIds) {
            Optional<Task> task = currentTask(jobId, taskId);
            if (task.isEmpty())
                return;
            if (task.get().status() == TaskStatus.COMPLETED)
                continue;
            if (waiter.await(jobId, taskId, taskTimeout) == WaitOutcome.JOB_REMOVED)
                return;
        }
        log.info("Job {} finished", jobId);
    }

    private Optional<Task> currentTask(String jobId, String taskId) {
        Optional<Job> job = store.getJob(jobId);
        if (job.isEmpty()) {
            log.info("Job {} removed, pipeline stopped", jobId);
            return Optional.empty();
        }
        Task task = job.get().task(taskId)
                .orElseThrow(() -> new TaskFailedException(taskId, "Task not found: " + taskId));
        if (task.status() == TaskStatus.FAILED)
            throw new TaskFailedException(taskId, task.error() != null ? task.error() : task.displayName() + " failed");
        return Optional.of(task);
    }

    /** @return false if the job disappeared during submission */
    private boolean submit(String jobId, Task task) {
        try {
            submitter.submit(jobId, task.id());
            return true;
        } catch (TaskSubmissionException e) {
            if (store.getJob(jobId).isEmpty()) {
                log.info("Job {} removed during submission of {}", jobId, task.displayName());
                return false;
            }
            throw e;
        }
    }

    // ---------- observation ----------

    /** The listener receives the current snapshot right away, then every change. */
    public Subscription subscribe(JobsListener listener) {
        return store.subscribe(listener);
    }

    public Map<String, Job> getJobs() {
        return store.snapshot();
    }

    public Optional<Job> getJob(String jobId) {
        return store.getJob(jobId);
    }

    public QueueStats stats() {
        int pending = 0;
        int processing = 0;
        int completed = 0;
        int failed = 0;
        for (Job job : store.listJobs()) {
            switch (job.overallStatus()) {
                case PENDING -> pending++;
                case PROCESSING -> processing++;
                case COMPLETED -> completed++;
                case FAILED -> failed++;
            }
        }
        return new QueueStats(pending, processing, completed, failed);
    }

    // ---------- housekeeping ----------

    /** Remove a job. A pipeline waiting on it stops without error. */
    public boolean removeJob(String jobId) {
        return store.removeJob(jobId);
    }

    public int clearAllJobs() {
        int removed = store.clear();
        log.info("Cleared {} jobs", removed);
        return removed;
    }

    /** Remove completed and failed jobs. */
    public int clearCompleted() {
        return store.clearCompleted();
    }

    public boolean toggleJobExpansion(String jobId) {
        return store.toggleExpansion(jobId);
    }

    /**
     * Load cached jobs into the store, dropping terminal jobs older than the
     * retention window.
     *
     * @return number of jobs kept
     */
    public int restore(List<Job> cached) {
        Instant cutoff = clock.instant().minus(retention);
        List<Job> kept = new ArrayList<>(cached.size());
        for (Job job : cached) {
            Instant finishedAt = job.completedAt() != null ? job.completedAt() : job.createdAt();
            if (job.isTerminal() && finishedAt != null && finishedAt.isBefore(cutoff)) {
                log.debug("Dropping expired job {}", job.id());
                continue;
            }
            kept.add(job);
        }
        store.restore(kept);
        if (kept.size() < cached.size())
            log.info("Dropped {} jobs older than {}", cached.size() - kept.size(), retention);
        return kept.size();
    }

    public ReconcileReport reconcile() {
        return reconciler.reconcile();
    }

    @Override
    public void close() {
        pipelines.shutdownNow();
    }
}
