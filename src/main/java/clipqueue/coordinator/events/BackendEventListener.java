package clipqueue.coordinator.events;

/**
 * Receiver of the three event kinds the processing backend emits.
 */
public interface BackendEventListener {

    void onProgress(ProgressEvent event);

    void onFailure(FailureEvent event);

    void onStatusChanged(StatusChangedEvent event);
}
