package clipqueue.coordinator.service;

import clipqueue.coordinator.backend.BackendJobSnapshot;
import clipqueue.coordinator.backend.ProcessingBackend;
import clipqueue.coordinator.events.StatusChangedEvent;
import clipqueue.coordinator.model.Job;
import clipqueue.coordinator.model.Task;
import clipqueue.coordinator.store.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Cross-checks cached jobs against the backend's queue after a restart.
 * <p>
 * Terminal jobs the backend has forgotten are dropped. Non-terminal jobs are
 * never failed here; a terminal backend status for one of their tasks is
 * replayed as if the event had arrived.
 */
public class BackendReconciler {

    private static final Logger log = LoggerFactory.getLogger(BackendReconciler.class);

    private final JobStore store;
    private final ProcessingBackend backend;
    private final ProgressAggregator aggregator;

    public BackendReconciler(JobStore store, ProcessingBackend backend, ProgressAggregator aggregator) {
        this.store = store;
        this.backend = backend;
        this.aggregator = aggregator;
    }

    public ReconcileReport reconcile() {
        List<BackendJobSnapshot> snapshot;
        try {
            snapshot = backend.fetchQueueSnapshot();
        } catch (RuntimeException e) {
            log.warn("Backend queue unavailable, skipping reconciliation: {}", e.getMessage());
            return ReconcileReport.unavailable();
        }

        Map<String, BackendJobSnapshot> byId = new HashMap<>();
        for (BackendJobSnapshot entry : snapshot) {
            if (entry.id() != null)
                byId.put(entry.id(), entry);
        }

        // replay before pruning
        int replayed = 0;
        for (Job job : store.listJobs()) {
            if (job.isTerminal())
                continue;
            for (Task task : job.tasks()) {
                if (task.isTerminal() || task.backendJobId() == null)
                    continue;
                BackendJobSnapshot remote = byId.get(task.backendJobId());
                if (remote != null && remote.isTerminal()) {
                    aggregator.onStatusChanged(StatusChangedEvent.of(remote.id(), remote.status()));
                    replayed++;
                }
            }
        }

        List<String> pruned = store.removeIf(job -> job.isTerminal()
                && job.backendJobIds().stream().noneMatch(byId::containsKey))
                .stream()
                .map(Job::id)
                .toList();

        log.info("Reconciled with backend: {} remote jobs, {} pruned, {} replayed",
                snapshot.size(), pruned.size(), replayed);
        return new ReconcileReport(true, pruned, replayed);
    }
}
