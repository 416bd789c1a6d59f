package clipqueue.coordinator.backend;

import clipqueue.coordinator.exceptions.BackendException;
import clipqueue.coordinator.model.TaskType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiConsumer;

/**
 * Scriptable in-memory backend for tests.
 */
public class FakeProcessingBackend implements ProcessingBackend {

    private final List<BackendRequest> submitted = new CopyOnWriteArrayList<>();
    private final List<BatchRequest> batches = new CopyOnWriteArrayList<>();
    private final AtomicInteger ids = new AtomicInteger();
    private final Map<String, String> videoPaths = new ConcurrentHashMap<>();
    private volatile List<BackendJobSnapshot> queue = List.of();
    private volatile boolean queueUnavailable;
    private volatile String rejectMessage;
    private volatile SubmissionResult nextResult;
    private volatile BiConsumer<BackendRequest, SubmissionResult> onSubmit = (r, s) -> {
    };
    private volatile BiConsumer<BatchRequest, SubmissionResult> onBatch = (r, s) -> {
    };

    @Override
    public SubmissionResult submit(BackendRequest request) {
        String reject = rejectMessage;
        if (reject != null) {
            rejectMessage = null;
            throw new BackendException(reject);
        }
        submitted.add(request);
        SubmissionResult result = nextResult;
        nextResult = null;
        if (result == null) {
            result = SubmissionResult.of("backend-" + ids.incrementAndGet());
        }
        onSubmit.accept(request, result);
        return result;
    }

    @Override
    public SubmissionResult submitBatch(BatchRequest request) {
        String reject = rejectMessage;
        if (reject != null) {
            rejectMessage = null;
            throw new BackendException(reject);
        }
        batches.add(request);
        SubmissionResult result = nextResult;
        nextResult = null;
        if (result == null) {
            result = SubmissionResult.of("batch-" + ids.incrementAndGet());
        }
        onBatch.accept(request, result);
        return result;
    }

    @Override
    public List<BackendJobSnapshot> fetchQueueSnapshot() {
        if (queueUnavailable) {
            throw new BackendException("connection refused");
        }
        return queue;
    }

    @Override
    public Optional<String> fetchVideoPath(String videoId) {
        return Optional.ofNullable(videoPaths.get(videoId));
    }

    // ---------- scripting ----------

    public void rejectNext(String message) {
        this.rejectMessage = message;
    }

    public void respondNext(SubmissionResult result) {
        this.nextResult = result;
    }

    /** Called after every accepted submission, before the result is returned. */
    public void onSubmit(BiConsumer<BackendRequest, SubmissionResult> hook) {
        this.onSubmit = hook;
    }

    /** Called after every accepted batch, before the result is returned. */
    public void onBatch(BiConsumer<BatchRequest, SubmissionResult> hook) {
        this.onBatch = hook;
    }

    public void setQueue(List<BackendJobSnapshot> queue) {
        this.queue = List.copyOf(queue);
    }

    public void setQueueUnavailable(boolean unavailable) {
        this.queueUnavailable = unavailable;
    }

    public void setVideoPath(String videoId, String path) {
        videoPaths.put(videoId, path);
    }

    // ---------- inspection ----------

    public List<BackendRequest> submitted() {
        return new ArrayList<>(submitted);
    }

    public List<TaskType> submittedTypes() {
        return submitted.stream().map(BackendRequest::type).toList();
    }

    public List<BatchRequest> batches() {
        return new ArrayList<>(batches);
    }

    public BackendRequest lastRequest() {
        return submitted.isEmpty() ? null : submitted.get(submitted.size() - 1);
    }
}
