package clipqueue.coordinator.service;

public enum WaitOutcome {
    /** The task completed */
    COMPLETED,
    /** The job was removed while waiting; treated as a cancellation */
    JOB_REMOVED
}
