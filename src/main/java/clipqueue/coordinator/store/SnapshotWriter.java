package clipqueue.coordinator.store;

import clipqueue.coordinator.util.JobsSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Writes job snapshots to the cache off the caller's thread.
 * Bursts of submissions collapse into a write of the newest version; a snapshot
 * older than one already pending or written is dropped.
 */
public final class SnapshotWriter implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SnapshotWriter.class);

    private final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "snapshot-writer");
        t.setDaemon(true);
        return t;
    });
    private final AtomicReference<JobsSnapshot> latest = new AtomicReference<>();
    private final JobCache cache;
    private volatile long writtenVersion = -1;

    public SnapshotWriter(JobCache cache) {
        this.cache = cache;
    }

    public void submit(JobsSnapshot snapshot) {
        JobsSnapshot previous = latest.getAndUpdate(
                current -> snapshot.isOlderThan(current) ? current : snapshot);
        if (previous == null && !executor.isShutdown()) {
            executor.execute(this::drain);
        }
    }

    /** Version of the last snapshot handed to the cache, -1 before the first. */
    public long writtenVersion() {
        return writtenVersion;
    }

    private synchronized void drain() {
        JobsSnapshot snapshot = latest.getAndSet(null);
        if (snapshot == null || snapshot.version() <= writtenVersion)
            return;
        writtenVersion = snapshot.version();
        try {
            cache.save(List.copyOf(snapshot.jobs().values()));
        } catch (RuntimeException e) {
            log.error("Failed to persist {} jobs: {}", snapshot.jobs().size(), e.getMessage(), e);
        }
    }

    /**
     * Block until every snapshot submitted so far has been written.
     */
    public void flush(long timeoutMs) throws InterruptedException {
        try {
            executor.submit(this::drain).get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (ExecutionException | TimeoutException e) {
            log.warn("Snapshot flush did not complete: {}", e.getMessage());
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(2, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        drain(); // last snapshot, if any
    }
}
