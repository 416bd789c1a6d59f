package clipqueue.coordinator.backend;

/**
 * Accepted submission. {@code videoId} and {@code videoPath} are set when the
 * backend already knows where the video lives.
 */
public record SubmissionResult(String backendJobId, String videoId, String videoPath) {

    public static SubmissionResult of(String backendJobId) {
        return new SubmissionResult(backendJobId, null, null);
    }
}
