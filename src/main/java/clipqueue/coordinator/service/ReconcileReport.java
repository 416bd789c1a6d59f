package clipqueue.coordinator.service;

import java.util.List;

/**
 * Outcome of a startup reconciliation.
 *
 * @param snapshotAvailable false if the backend queue could not be fetched (nothing was pruned)
 * @param prunedJobIds      terminal jobs removed because the backend no longer knows them
 * @param replayedEvents    terminal backend statuses applied to local tasks that missed them
 */
public record ReconcileReport(boolean snapshotAvailable, List<String> prunedJobIds, int replayedEvents) {

    public static ReconcileReport unavailable() {
        return new ReconcileReport(false, List.of(), 0);
    }
}
