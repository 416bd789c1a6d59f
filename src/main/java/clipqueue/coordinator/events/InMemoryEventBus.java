package clipqueue.coordinator.events;

import clipqueue.coordinator.util.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Synchronous in-process bus. Events are delivered on the publishing thread;
 * a failing listener is logged and does not stop delivery to the others.
 */
public final class InMemoryEventBus implements ProgressEventBus {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEventBus.class);

    private final CopyOnWriteArrayList<BackendEventListener> listeners = new CopyOnWriteArrayList<>();

    @Override
    public Subscription subscribe(BackendEventListener listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    @Override
    public void publish(ProgressEvent event) {
        fire(l -> l.onProgress(event), event);
    }

    @Override
    public void publish(FailureEvent event) {
        fire(l -> l.onFailure(event), event);
    }

    @Override
    public void publish(StatusChangedEvent event) {
        fire(l -> l.onStatusChanged(event), event);
    }

    private void fire(Consumer<BackendEventListener> call, Object event) {
        for (var l : listeners) {
            try {
                call.accept(l);
            } catch (RuntimeException e) {
                log.error("Listener failed on {}: {}", event, e.getMessage(), e);
            }
        }
    }
}
