package clipqueue.coordinator.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Fans job snapshots out to listeners.
 * <p>
 * Immediate notifications go out on the caller's thread and cancel any pending
 * trailing flush. Throttled notifications open a window on the first tick; the
 * window closes with one publish of whatever the snapshot is at that moment.
 * <p>
 * Deliveries are serialized, and a listener never receives a snapshot older
 * than one already delivered.
 */
public final class NotificationThrottle implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(NotificationThrottle.class);

    private final ScheduledExecutorService ses = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "jobs-notify");
        t.setDaemon(true);
        return t;
    });
    private final CopyOnWriteArrayList<JobsListener> listeners = new CopyOnWriteArrayList<>();
    private final Object deliveryLock = new Object();
    private final Supplier<JobsSnapshot> snapshotSource;
    private final long windowMs;
    private ScheduledFuture<?> pending;
    private JobsSnapshot lastDelivered;

    public NotificationThrottle(Duration window, Supplier<JobsSnapshot> snapshotSource) {
        this.windowMs = window.toMillis();
        this.snapshotSource = snapshotSource;
    }

    /**
     * Register a listener. It receives the current snapshot before this method returns.
     */
    public Subscription subscribe(JobsListener listener) {
        synchronized (deliveryLock) {
            listeners.add(listener);
            deliver(listener, snapshotSource.get());
        }
        return () -> listeners.remove(listener);
    }

    public int listenerCount() {
        return listeners.size();
    }

    public void publish(NotificationKind kind) {
        if (kind == NotificationKind.IMMEDIATE) {
            synchronized (this) {
                if (pending != null) {
                    pending.cancel(false);
                    pending = null;
                }
            }
            fire();
            return;
        }
        synchronized (this) {
            if (pending != null)
                return; // window already open
            if (ses.isShutdown())
                return;
            pending = ses.schedule(this::flush, windowMs, TimeUnit.MILLISECONDS);
        }
    }

    private void flush() {
        synchronized (this) {
            pending = null;
        }
        fire();
    }

    private void fire() {
        synchronized (deliveryLock) {
            if (listeners.isEmpty())
                return;
            JobsSnapshot snapshot = snapshotSource.get();
            for (JobsListener listener : listeners) {
                // a listener that mutated the store has already fanned out a newer one
                if (snapshot.isOlderThan(lastDelivered))
                    return;
                lastDelivered = snapshot;
                deliver(listener, snapshot);
            }
        }
    }

    private static void deliver(JobsListener listener, JobsSnapshot snapshot) {
        try {
            listener.onJobsChanged(snapshot.jobs());
        } catch (RuntimeException e) {
            log.warn("Jobs listener {} failed: {}", listener, e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        ses.shutdownNow();
    }
}
