package clipqueue.coordinator.service;

import clipqueue.coordinator.exceptions.TaskFailedException;
import clipqueue.coordinator.exceptions.TaskTimeoutException;
import clipqueue.coordinator.model.Job;
import clipqueue.coordinator.model.Task;
import clipqueue.coordinator.model.TaskStatus;
import clipqueue.coordinator.store.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * Blocks a submission pipeline until one task settles.
 * Wakes on every store change and at least once per poll interval.
 */
public class CompletionWaiter {

    private static final Logger log = LoggerFactory.getLogger(CompletionWaiter.class);

    private final JobStore store;
    private final Duration pollInterval;

    public CompletionWaiter(JobStore store, Duration pollInterval) {
        this.store = store;
        this.pollInterval = pollInterval;
    }

    /**
     * @return {@link WaitOutcome#COMPLETED} or {@link WaitOutcome#JOB_REMOVED}
     * @throws TaskFailedException  if the task failed, or is missing from its job
     * @throws TaskTimeoutException if the task is still running after {@code timeout};
     *                              the task is failed first
     */
    public WaitOutcome await(String jobId, String taskId, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            Optional<Job> job = store.getJob(jobId);
            if (job.isEmpty()) {
                log.info("Job {} removed while waiting on {}", jobId, taskId);
                return WaitOutcome.JOB_REMOVED;
            }
            Task task = job.get().task(taskId)
                    .orElseThrow(() -> new TaskFailedException(taskId, "Task not found: " + taskId));
            if (task.status() == TaskStatus.COMPLETED)
                return WaitOutcome.COMPLETED;
            if (task.status() == TaskStatus.FAILED)
                throw new TaskFailedException(taskId, task.error() != null ? task.error()
                        : task.displayName() + " failed");

            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return timedOut(jobId, taskId, timeout);
            }
            store.awaitChange(Duration.ofNanos(Math.min(remaining, pollInterval.toNanos())));
        }
    }

    private WaitOutcome timedOut(String jobId, String taskId, Duration timeout) {
        String message = "Timed out after " + formatDuration(timeout) + " waiting for task to finish";
        Optional<Task> failed = store.updateTask(jobId, taskId, t -> t.isTerminal() ? t
                : t.toBuilder().status(TaskStatus.FAILED).error(message).build());
        if (failed.isEmpty())
            return WaitOutcome.JOB_REMOVED;
        if (failed.get().status() == TaskStatus.COMPLETED)
            return WaitOutcome.COMPLETED; // finished at the last moment
        if (!message.equals(failed.get().error()))
            throw new TaskFailedException(taskId, failed.get().error());
        log.warn("Task {} of job {} timed out after {}", taskId, jobId, timeout);
        throw new TaskTimeoutException(taskId, timeout);
    }

    private static String formatDuration(Duration d) {
        if (d.toHours() > 0)
            return d.toHours() + "h";
        if (d.toMinutes() > 0)
            return d.toMinutes() + "m";
        if (d.getSeconds() > 0)
            return d.getSeconds() + "s";
        return d.toMillis() + "ms";
    }
}
