package clipqueue.coordinator.store;

import clipqueue.coordinator.model.Job;
import clipqueue.coordinator.model.NewJobRequest;
import clipqueue.coordinator.model.Task;
import clipqueue.coordinator.model.TaskStatus;
import clipqueue.coordinator.util.JobsListener;
import clipqueue.coordinator.util.JobsSnapshot;
import clipqueue.coordinator.util.NotificationKind;
import clipqueue.coordinator.util.NotificationThrottle;
import clipqueue.coordinator.util.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BiFunction;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Authoritative in-memory job collection.
 * <p>
 * One lock guards the job map and the backend id index. Every mutation swaps
 * immutable {@link Job} values, stamps lifecycle timestamps, keeps the index in
 * step, wakes waiters and takes a versioned snapshot. After the lock is
 * released the snapshot goes to the cache writer and listeners are notified.
 */
public final class JobStore implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(JobStore.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final Map<String, Job> jobs = new LinkedHashMap<>();
    private final Map<String, List<TaskRef>> byBackendId = new HashMap<>();
    private final AtomicLong jobCounter = new AtomicLong();
    private long version;

    private final Clock clock;
    private final SnapshotWriter writer;
    private final NotificationThrottle throttle;

    public JobStore(JobCache cache, Duration throttleWindow, Clock clock) {
        this.clock = clock;
        this.writer = new SnapshotWriter(cache);
        this.throttle = new NotificationThrottle(throttleWindow, this::versionedSnapshot);
    }

    // ---------- creation ----------

    /**
     * Create a job with all tasks pending.
     *
     * @return the new job id
     */
    public String addJob(NewJobRequest request) {
        request.validate();

        String jobId = "video-job-" + clock.millis() + "-" + jobCounter.incrementAndGet();
        List<Task> tasks = new ArrayList<>(request.tasks().size());
        for (int i = 0; i < request.tasks().size(); i++) {
            NewJobRequest.TaskSpec spec = request.tasks().get(i);
            tasks.add(Task.builder()
                    .id(jobId + "-task-" + i)
                    .type(spec.type())
                    .status(TaskStatus.PENDING)
                    .config(spec.config())
                    .build());
        }
        Job job = Job.builder()
                .id(jobId)
                .videoId(request.videoId())
                .videoPath(request.videoPath())
                .displayName(request.displayName())
                .tasks(tasks)
                .createdAt(clock.instant())
                .build();

        JobsSnapshot snap;
        lock.lock();
        try {
            jobs.put(jobId, job);
            changed.signalAll();
            snap = capture();
        } finally {
            lock.unlock();
        }
        log.info("Added job {} ({}) with {} tasks", jobId, job.displayName(), tasks.size());
        afterChange(NotificationKind.IMMEDIATE, snap);
        return jobId;
    }

    /**
     * Replace the whole collection, e.g. with jobs loaded from the cache.
     */
    public void restore(Collection<Job> restored) {
        JobsSnapshot snap;
        lock.lock();
        try {
            jobs.clear();
            byBackendId.clear();
            for (Job job : restored) {
                jobs.put(job.id(), job);
                index(job);
            }
            changed.signalAll();
            snap = capture();
        } finally {
            lock.unlock();
        }
        log.info("Restored {} jobs", restored.size());
        afterChange(NotificationKind.IMMEDIATE, snap);
    }

    // ---------- reads ----------

    public Optional<Job> getJob(String jobId) {
        lock.lock();
        try {
            return Optional.ofNullable(jobs.get(jobId));
        } finally {
            lock.unlock();
        }
    }

    public Optional<Task> getTask(String jobId, String taskId) {
        return getJob(jobId).flatMap(job -> job.task(taskId));
    }

    /** Immutable copy of the collection in insertion order. */
    public Map<String, Job> snapshot() {
        lock.lock();
        try {
            return Collections.unmodifiableMap(new LinkedHashMap<>(jobs));
        } finally {
            lock.unlock();
        }
    }

    /** The collection together with the version it was taken at. */
    public JobsSnapshot versionedSnapshot() {
        lock.lock();
        try {
            return new JobsSnapshot(version, Collections.unmodifiableMap(new LinkedHashMap<>(jobs)));
        } finally {
            lock.unlock();
        }
    }

    public List<Job> listJobs() {
        lock.lock();
        try {
            return List.copyOf(jobs.values());
        } finally {
            lock.unlock();
        }
    }

    public List<TaskRef> findByBackendJobId(String backendJobId) {
        lock.lock();
        try {
            List<TaskRef> refs = byBackendId.get(backendJobId);
            return refs == null ? List.of() : List.copyOf(refs);
        } finally {
            lock.unlock();
        }
    }

    // ---------- mutations ----------

    public Optional<Job> updateJob(String jobId, UnaryOperator<Job> fn) {
        NotificationKind kind;
        JobsSnapshot snap;
        Job after;
        lock.lock();
        try {
            Job before = jobs.get(jobId);
            if (before == null)
                return Optional.empty();
            after = fn.apply(before);
            kind = replace(before, after);
            after = jobs.get(jobId);
            snap = kind != null ? capture() : null;
        } finally {
            lock.unlock();
        }
        afterChange(kind, snap);
        return Optional.of(after);
    }

    /**
     * Apply {@code fn} to one task. Empty if the job or the task is gone.
     */
    public Optional<Task> updateTask(String jobId, String taskId, UnaryOperator<Task> fn) {
        NotificationKind kind;
        JobsSnapshot snap;
        Task updated;
        lock.lock();
        try {
            Job before = jobs.get(jobId);
            if (before == null)
                return Optional.empty();
            Optional<Task> current = before.task(taskId);
            if (current.isEmpty())
                return Optional.empty();
            Job after = before.withTask(fn.apply(current.get()));
            kind = replace(before, after);
            updated = jobs.get(jobId).task(taskId).orElseThrow();
            snap = kind != null ? capture() : null;
        } finally {
            lock.unlock();
        }
        afterChange(kind, snap);
        return Optional.of(updated);
    }

    /**
     * Apply {@code fn} once per job that has tasks bound to {@code backendJobId}.
     * The function receives the job and its bound tasks in job order, and returns
     * the whole updated job, so task and job fields change in one step.
     *
     * @return number of tasks the id resolved to
     */
    public int applyToBackendJob(String backendJobId, BiFunction<Job, List<Task>, Job> fn) {
        NotificationKind kind = null;
        JobsSnapshot snap = null;
        int matched = 0;
        lock.lock();
        try {
            List<TaskRef> refs = byBackendId.get(backendJobId);
            if (refs == null)
                return 0;
            Map<String, List<String>> taskIdsByJob = new LinkedHashMap<>();
            for (TaskRef ref : refs) {
                taskIdsByJob.computeIfAbsent(ref.jobId(), k -> new ArrayList<>()).add(ref.taskId());
            }
            for (Map.Entry<String, List<String>> entry : taskIdsByJob.entrySet()) {
                Job before = jobs.get(entry.getKey());
                if (before == null)
                    continue;
                List<Task> bound = before.tasks().stream()
                        .filter(t -> entry.getValue().contains(t.id()))
                        .toList();
                if (bound.isEmpty())
                    continue;
                matched += bound.size();
                kind = merge(kind, replace(before, fn.apply(before, bound)));
            }
            if (kind != null)
                snap = capture();
        } finally {
            lock.unlock();
        }
        afterChange(kind, snap);
        return matched;
    }

    public boolean toggleExpansion(String jobId) {
        return updateJob(jobId, job -> job.toBuilder().expanded(!job.expanded()).build()).isPresent();
    }

    public boolean removeJob(String jobId) {
        Job removed;
        JobsSnapshot snap = null;
        lock.lock();
        try {
            removed = jobs.remove(jobId);
            if (removed != null) {
                unindex(removed);
                changed.signalAll();
                snap = capture();
            }
        } finally {
            lock.unlock();
        }
        if (removed == null)
            return false;
        log.info("Removed job {}", jobId);
        afterChange(NotificationKind.IMMEDIATE, snap);
        return true;
    }

    /** Remove every job matching {@code filter}; returns the removed jobs. */
    public List<Job> removeIf(Predicate<Job> filter) {
        List<Job> removed = new ArrayList<>();
        JobsSnapshot snap = null;
        lock.lock();
        try {
            Iterator<Job> it = jobs.values().iterator();
            while (it.hasNext()) {
                Job job = it.next();
                if (filter.test(job)) {
                    it.remove();
                    unindex(job);
                    removed.add(job);
                }
            }
            if (!removed.isEmpty()) {
                changed.signalAll();
                snap = capture();
            }
        } finally {
            lock.unlock();
        }
        if (!removed.isEmpty())
            afterChange(NotificationKind.IMMEDIATE, snap);
        return removed;
    }

    public int clear() {
        return removeIf(job -> true).size();
    }

    /** Remove completed and failed jobs. */
    public int clearCompleted() {
        return removeIf(Job::isTerminal).size();
    }

    // ---------- waiting / observing ----------

    /**
     * Block until the next mutation or the timeout.
     *
     * @return false if the timeout elapsed first
     */
    public boolean awaitChange(Duration timeout) throws InterruptedException {
        lock.lock();
        try {
            return changed.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } finally {
            lock.unlock();
        }
    }

    public Subscription subscribe(JobsListener listener) {
        return throttle.subscribe(listener);
    }

    /** Wait for queued cache writes, for orderly shutdown and tests. */
    public void flushSnapshots() throws InterruptedException {
        writer.flush(5000);
    }

    @Override
    public void close() {
        throttle.close();
        writer.close();
    }

    // ---------- internals (lock held) ----------

    private NotificationKind replace(Job before, Job after) {
        if (after == before)
            return null;
        if (!before.id().equals(after.id()))
            throw new IllegalArgumentException("job id cannot change");
        checkBackendIds(before, after);

        Job stamped = stamp(after);
        unindex(before);
        jobs.put(stamped.id(), stamped);
        index(stamped);
        changed.signalAll();
        return stamped.sameStateAs(before) ? NotificationKind.THROTTLED : NotificationKind.IMMEDIATE;
    }

    private static void checkBackendIds(Job before, Job after) {
        for (Task old : before.tasks()) {
            if (old.backendJobId() == null)
                continue;
            Task now = after.task(old.id()).orElse(null);
            if (now != null && !old.backendJobId().equals(now.backendJobId())
                    && now.attempts() == old.attempts()) {
                throw new IllegalStateException("backend job id of task " + old.id()
                        + " cannot change within attempt " + old.attempts());
            }
        }
    }

    private Job stamp(Job after) {
        Instant now = clock.instant();
        List<Task> tasks = new ArrayList<>(after.tasks().size());
        for (Task task : after.tasks()) {
            if (task.status() == TaskStatus.PROCESSING && task.startedAt() == null) {
                task = task.toBuilder().startedAt(now).build();
            } else if (task.isTerminal() && task.finishedAt() == null) {
                task = task.toBuilder().finishedAt(now).build();
            }
            tasks.add(task);
        }
        Job.Builder jb = after.toBuilder().tasks(tasks);

        TaskStatus status = jb.build().overallStatus();
        if (status != TaskStatus.PENDING && after.startedAt() == null) {
            jb.startedAt(now);
        }
        if (status.isTerminal() && after.completedAt() == null) {
            jb.completedAt(now);
        } else if (!status.isTerminal() && after.completedAt() != null) {
            jb.completedAt(null); // reopened by a retry
        }
        return jb.build();
    }

    private void index(Job job) {
        for (Task task : job.tasks()) {
            if (task.backendJobId() != null) {
                byBackendId.computeIfAbsent(task.backendJobId(), k -> new ArrayList<>())
                        .add(new TaskRef(job.id(), task.id()));
            }
        }
    }

    private void unindex(Job job) {
        for (Task task : job.tasks()) {
            if (task.backendJobId() == null)
                continue;
            List<TaskRef> refs = byBackendId.get(task.backendJobId());
            if (refs == null)
                continue;
            refs.removeIf(ref -> ref.jobId().equals(job.id()) && ref.taskId().equals(task.id()));
            if (refs.isEmpty())
                byBackendId.remove(task.backendJobId());
        }
    }

    private static NotificationKind merge(NotificationKind a, NotificationKind b) {
        if (a == NotificationKind.IMMEDIATE || b == NotificationKind.IMMEDIATE)
            return NotificationKind.IMMEDIATE;
        return a != null ? a : b;
    }

    private JobsSnapshot capture() {
        return new JobsSnapshot(++version, Collections.unmodifiableMap(new LinkedHashMap<>(jobs)));
    }

    private void afterChange(NotificationKind kind, JobsSnapshot snap) {
        if (kind == null)
            return;
        writer.submit(snap);
        throttle.publish(kind);
    }
}
