package clipqueue.coordinator.events;

import clipqueue.coordinator.util.Subscription;

/**
 * Channel over which backend events reach the coordinator, correlated by
 * backend job id.
 */
public interface ProgressEventBus {

    Subscription subscribe(BackendEventListener listener);

    void publish(ProgressEvent event);

    void publish(FailureEvent event);

    void publish(StatusChangedEvent event);
}
