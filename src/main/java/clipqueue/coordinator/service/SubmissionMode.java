package clipqueue.coordinator.service;

/**
 * How {@link VideoQueueService#submitJob} drives a job's tasks.
 */
public enum SubmissionMode {
    /** Submit one task, wait for it, then the next */
    SEQUENTIAL,
    /** Send every open task as one backend job, then wait for them in order */
    BATCH
}
