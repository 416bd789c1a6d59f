package clipqueue.coordinator.exceptions;

/**
 * Base class for errors that stop a job's processing pipeline.
 */
public class PipelineException extends RuntimeException {
    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
