package clipqueue.coordinator.backend;

import clipqueue.coordinator.exceptions.BackendException;

import java.util.List;
import java.util.Optional;

/**
 * The service that actually downloads, converts, transcribes and analyzes videos.
 */
public interface ProcessingBackend {

    /**
     * Start an operation.
     *
     * @throws BackendException on transport failure or a rejected request
     */
    SubmissionResult submit(BackendRequest request);

    /**
     * Queue every step of a job as one backend job.
     *
     * @throws BackendException on transport failure or a rejected request
     */
    SubmissionResult submitBatch(BatchRequest request);

    /** Jobs the backend currently knows about. */
    List<BackendJobSnapshot> fetchQueueSnapshot();

    /** Current file path of a library video, if the backend has it. */
    Optional<String> fetchVideoPath(String videoId);
}
