package clipqueue.coordinator.service;

import clipqueue.coordinator.backend.FakeProcessingBackend;
import clipqueue.coordinator.config.QueueConfig;
import clipqueue.coordinator.events.FailureEvent;
import clipqueue.coordinator.events.InMemoryEventBus;
import clipqueue.coordinator.events.ProgressEvent;
import clipqueue.coordinator.events.StatusChangedEvent;
import clipqueue.coordinator.exceptions.TaskFailedException;
import clipqueue.coordinator.exceptions.TaskSubmissionException;
import clipqueue.coordinator.exceptions.TaskTimeoutException;
import clipqueue.coordinator.model.Job;
import clipqueue.coordinator.model.NewJobRequest;
import clipqueue.coordinator.model.Task;
import clipqueue.coordinator.model.TaskConfig;
import clipqueue.coordinator.model.TaskStatus;
import clipqueue.coordinator.model.TaskType;
import clipqueue.coordinator.store.InMemoryJobCache;
import clipqueue.coordinator.store.JobStore;
import clipqueue.coordinator.util.Subscription;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

class VideoQueueServiceTest {


    private final List<AutoCloseable> closeables = new ArrayList<>();
    private ExecutorService simulator;
    private FakeProcessingBackend backend;
    private InMemoryEventBus bus;
    private JobStore store;
    private VideoQueueService queue;

    @BeforeEach
    void setUp() {
        simulator = Executors.newCachedThreadPool();
        backend = new FakeProcessingBackend();
        bus = new InMemoryEventBus();
        queue = newService(config(), Clock.systemUTC());
    }

    @AfterEach
    void tearDown() throws Exception {
        simulator.shutdownNow();
        for (int i = closeables.size() - 1; i >= 0; i--) {
            closeables.get(i).close();
        }
    }

    private static QueueConfig config() {
        return QueueConfig.defaults()
                .withPollInterval(Duration.ofMillis(50))
                .withThrottleWindow(Duration.ofMillis(50))
                .withTaskTimeout(Duration.ofSeconds(10));
    }

    private VideoQueueService newService(QueueConfig config, Clock clock) {
        store = new JobStore(new InMemoryJobCache(), config.throttleWindow(), clock);
        ProgressAggregator aggregator = new ProgressAggregator(store, backend);
        Subscription subscription = bus.subscribe(aggregator);
        VideoQueueService service = new VideoQueueService(store,
                new TaskSubmitter(store, backend),
                new CompletionWaiter(store, config.pollInterval()),
                new BackendReconciler(store, backend, aggregator),
                config, clock);
        closeables.add(store);
        closeables.add(aggregator);
        closeables.add(subscription);
        closeables.add(service);
        return service;
    }

    /** Every accepted submission reports progress in quarters, then completes. */
    private void completeEverySubmission() {
        backend.onSubmit((request, result) -> simulator.execute(() -> {
            String id = result.backendJobId();
            waitUntil(() -> !store.findByBackendJobId(id).isEmpty());
            for (int p = 0; p <= 75; p += 25) {
                bus.publish(new ProgressEvent(id, p, null, request.type().displayName()));
            }
            bus.publish(StatusChangedEvent.of(id, "completed"));
        }));
    }

    private static void waitUntil(BooleanSupplier condition) {
        long deadline = System.currentTimeMillis() + 3000;
        while (!condition.getAsBoolean() && System.currentTimeMillis() < deadline) {
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    private String addJob(TaskType... types) {
        NewJobRequest.Builder b = NewJobRequest.builder()
                .videoId("vid-1").videoPath("/media/clip.mp4").displayName("clip.mp4");
        for (TaskType type : types) {
            switch (type) {
                case ANALYZE -> b.task(type, new TaskConfig.AnalysisConfig("openai:gpt-4o", "sk-test", null, null));
                case FIX_ASPECT_RATIO -> b.task(type, new TaskConfig.AspectRatioConfig("9:16"));
                case NORMALIZE_AUDIO -> b.task(type, new TaskConfig.AudioNormalizationConfig(-14.0));
                default -> b.task(type);
            }
        }
        return queue.addVideoJob(b.build());
    }

    private Job job(String jobId) {
        return queue.getJob(jobId).orElseThrow();
    }

    private static Throwable causeOf(CompletableFuture<Void> run) {
        ExecutionException e = assertThrows(ExecutionException.class, () -> run.get(5, TimeUnit.SECONDS));
        return e.getCause();
    }

    @Test
    void jobRunsToCompletion() throws Exception {
        completeEverySubmission();
        String jobId = addJob(TaskType.FIX_ASPECT_RATIO, TaskType.NORMALIZE_AUDIO, TaskType.TRANSCRIBE);

        queue.submitJob(jobId).get(5, TimeUnit.SECONDS);

        Job job = job(jobId);
        assertEquals(TaskStatus.COMPLETED, job.overallStatus());
        assertEquals(100, job.overallProgress());
        assertNotNull(job.completedAt());
        assertEquals(List.of(TaskType.COMBINED_PROCESS_NORMALIZE, TaskType.TRANSCRIBE), backend.submittedTypes());
        assertEquals(job.tasks().get(0).backendJobId(), job.tasks().get(1).backendJobId());
    }

    @Test
    void analyzeWaitsForTranscription() throws Exception {
        List<TaskStatus> transcribeStatusAtAnalyze = new CopyOnWriteArrayList<>();
        String jobId = addJob(TaskType.TRANSCRIBE, TaskType.ANALYZE);
        backend.onSubmit((request, result) -> {
            if (request.type() == TaskType.ANALYZE) {
                transcribeStatusAtAnalyze.add(job(jobId).tasks().get(0).status());
            }
            simulator.execute(() -> {
                waitUntil(() -> !store.findByBackendJobId(result.backendJobId()).isEmpty());
                bus.publish(ProgressEvent.of(result.backendJobId(), 50));
                bus.publish(StatusChangedEvent.of(result.backendJobId(), "completed"));
            });
        });

        queue.submitJob(jobId).get(5, TimeUnit.SECONDS);

        assertEquals(List.of(TaskType.TRANSCRIBE, TaskType.ANALYZE), backend.submittedTypes());
        assertEquals(List.of(TaskStatus.COMPLETED), transcribeStatusAtAnalyze);
        assertEquals("openai", backend.lastRequest().get("aiProvider"));
        assertEquals("sk-test", backend.lastRequest().get("openaiApiKey"));
    }

    @Test
    void listenersSeeProgressAndFinalState() throws Exception {
        completeEverySubmission();
        String jobId = addJob(TaskType.TRANSCRIBE);
        List<Map<String, Job>> seen = new CopyOnWriteArrayList<>();
        queue.subscribe(seen::add);

        queue.submitJob(jobId).get(5, TimeUnit.SECONDS);
        waitUntil(() -> seen.get(seen.size() - 1).get(jobId).isTerminal());

        assertEquals(TaskStatus.PENDING, seen.get(0).get(jobId).overallStatus());
        Job last = seen.get(seen.size() - 1).get(jobId);
        assertEquals(TaskStatus.COMPLETED, last.overallStatus());
        assertTrue(seen.stream().anyMatch(s -> s.get(jobId).overallStatus() == TaskStatus.PROCESSING));
    }

    @Test
    void failureStopsPipeline() {
        backend.onSubmit((request, result) -> simulator.execute(() -> {
            waitUntil(() -> !store.findByBackendJobId(result.backendJobId()).isEmpty());
            bus.publish(new FailureEvent(result.backendJobId(), "Whisper crashed"));
        }));
        String jobId = addJob(TaskType.TRANSCRIBE, TaskType.ANALYZE);

        Throwable cause = causeOf(queue.submitJob(jobId));

        TaskFailedException failure = assertInstanceOf(TaskFailedException.class, cause);
        assertEquals("Whisper crashed", failure.getMessage());
        Job job = job(jobId);
        assertEquals(TaskStatus.FAILED, job.overallStatus());
        assertEquals(TaskStatus.PENDING, job.tasks().get(1).status());
        assertEquals(List.of(TaskType.TRANSCRIBE), backend.submittedTypes());
    }

    @Test
    void rejectedSubmissionFailsJob() {
        backend.rejectNext("Video not found");
        String jobId = addJob(TaskType.TRANSCRIBE);

        Throwable cause = causeOf(queue.submitJob(jobId));

        assertInstanceOf(TaskSubmissionException.class, cause);
        assertEquals("Video not found", job(jobId).tasks().get(0).error());
    }

    @Test
    void retryResubmitsFailedTasks() throws Exception {
        backend.rejectNext("Backend busy");
        String jobId = addJob(TaskType.TRANSCRIBE, TaskType.ANALYZE);
        causeOf(queue.submitJob(jobId));

        completeEverySubmission();
        queue.retryJob(jobId).get(5, TimeUnit.SECONDS);

        Job job = job(jobId);
        assertEquals(TaskStatus.COMPLETED, job.overallStatus());
        assertEquals(1, job.tasks().get(0).attempts());
        assertEquals(0, job.tasks().get(1).attempts());
        assertNull(job.tasks().get(0).error());
        assertEquals(List.of(TaskType.TRANSCRIBE, TaskType.ANALYZE), backend.submittedTypes());
    }

    @Test
    void removingJobEndsPipelineQuietly() throws Exception {
        String jobId = addJob(TaskType.TRANSCRIBE, TaskType.ANALYZE);
        CompletableFuture<Void> run = queue.submitJob(jobId);
        waitUntil(() -> job(jobId).tasks().get(0).isSubmitted());

        assertTrue(queue.removeJob(jobId));

        run.get(1, TimeUnit.SECONDS);
        assertEquals(1, backend.submitted().size());
        assertTrue(queue.getJob(jobId).isEmpty());
    }

    @Test
    void stuckTaskTimesOut() {
        VideoQueueService shortTimeout = newService(config().withTaskTimeout(Duration.ofMillis(300)), Clock.systemUTC());
        String jobId = shortTimeout.addVideoJob(NewJobRequest.builder()
                .videoId("vid-1").displayName("clip.mp4").task(TaskType.TRANSCRIBE).build());

        Throwable cause = causeOf(shortTimeout.submitJob(jobId));

        assertInstanceOf(TaskTimeoutException.class, cause);
        Task task = shortTimeout.getJob(jobId).orElseThrow().tasks().get(0);
        assertEquals(TaskStatus.FAILED, task.status());
        assertTrue(task.error().startsWith("Timed out after"));
    }

    @Test
    void batchModeSendsWholeJobInOneRequest() throws Exception {
        VideoQueueService batch = newService(config().withSubmissionMode(SubmissionMode.BATCH), Clock.systemUTC());
        String jobId = batch.addVideoJob(NewJobRequest.builder()
                .videoPath("/media/clip.mp4").displayName("clip.mp4")
                .task(TaskType.IMPORT)
                .task(TaskType.TRANSCRIBE)
                .build());

        CompletableFuture<Void> run = batch.submitJob(jobId);
        waitUntil(() -> backend.batches().size() == 1
                && batch.getJob(jobId).orElseThrow().tasks().stream().allMatch(Task::isSubmitted));
        assertEquals(List.of(TaskType.IMPORT, TaskType.TRANSCRIBE), backend.batches().get(0).types());
        assertTrue(backend.submitted().isEmpty());
        assertFalse(run.isDone());

        List<Task> tasks = batch.getJob(jobId).orElseThrow().tasks();
        String backendJobId = tasks.get(0).backendJobId();
        assertEquals(backendJobId, tasks.get(1).backendJobId());

        bus.publish(ProgressEvent.of(backendJobId, TaskType.TRANSCRIBE, 50));
        Job halfway = batch.getJob(jobId).orElseThrow();
        assertEquals(TaskStatus.COMPLETED, halfway.tasks().get(0).status());
        assertEquals(50, halfway.tasks().get(1).progress());

        bus.publish(StatusChangedEvent.of(backendJobId, "completed"));
        run.get(5, TimeUnit.SECONDS);
        assertEquals(TaskStatus.COMPLETED, batch.getJob(jobId).orElseThrow().overallStatus());
    }

    @Test
    void batchModeDownloadsThenTranscribesWithoutKnownVideo() throws Exception {
        VideoQueueService batch = newService(config().withSubmissionMode(SubmissionMode.BATCH), Clock.systemUTC());
        String jobId = batch.addVideoJob(NewJobRequest.builder()
                .displayName("talk.mp4")
                .task(TaskType.DOWNLOAD, new TaskConfig.DownloadConfig("https://example.com/talk", null, null))
                .task(TaskType.TRANSCRIBE)
                .build());

        CompletableFuture<Void> run = batch.submitJob(jobId);
        waitUntil(() -> batch.getJob(jobId).orElseThrow().tasks().stream().allMatch(Task::isSubmitted));
        assertEquals(1, backend.batches().size());
        assertEquals(Map.of("url", "https://example.com/talk"), backend.batches().get(0).source());
        String backendJobId = batch.getJob(jobId).orElseThrow().tasks().get(0).backendJobId();

        bus.publish(ProgressEvent.of(backendJobId, TaskType.DOWNLOAD, 100));
        assertEquals(TaskStatus.PROCESSING, batch.getJob(jobId).orElseThrow().tasks().get(0).status());

        bus.publish(new StatusChangedEvent(backendJobId, "completed", "vid-42", "/library/talk.mp4", TaskType.DOWNLOAD));
        bus.publish(ProgressEvent.of(backendJobId, TaskType.TRANSCRIBE, 40));
        Job transcribing = batch.getJob(jobId).orElseThrow();
        assertEquals(TaskStatus.COMPLETED, transcribing.tasks().get(0).status());
        assertEquals(TaskStatus.PROCESSING, transcribing.tasks().get(1).status());
        assertEquals(40, transcribing.tasks().get(1).progress());
        assertEquals("vid-42", transcribing.videoId());

        bus.publish(StatusChangedEvent.of(backendJobId, TaskType.TRANSCRIBE, "completed"));
        run.get(5, TimeUnit.SECONDS);
        Job done = batch.getJob(jobId).orElseThrow();
        assertEquals(TaskStatus.COMPLETED, done.overallStatus());
        assertNull(done.tasks().get(1).error());
    }

    @Test
    void rejectedBatchFailsEveryTask() {
        VideoQueueService batch = newService(config().withSubmissionMode(SubmissionMode.BATCH), Clock.systemUTC());
        String jobId = batch.addVideoJob(NewJobRequest.builder()
                .videoId("vid-1").displayName("clip.mp4")
                .task(TaskType.TRANSCRIBE)
                .task(TaskType.ANALYZE, new TaskConfig.AnalysisConfig("openai:gpt-4o", "sk-test", null, null))
                .build());
        backend.rejectNext("Queue is full");

        Throwable cause = causeOf(batch.submitJob(jobId));

        assertInstanceOf(TaskSubmissionException.class, cause);
        assertEquals("Queue is full", cause.getMessage());
        assertTrue(batch.getJob(jobId).orElseThrow().tasks().stream()
                .allMatch(t -> t.status() == TaskStatus.FAILED && "Queue is full".equals(t.error())));
    }

    @Test
    void resubmittingRunningJobReturnsSameRun() {
        String jobId = addJob(TaskType.TRANSCRIBE);
        CompletableFuture<Void> first = queue.submitJob(jobId);
        CompletableFuture<Void> second = queue.submitJob(jobId);

        assertSame(first, second);
        queue.removeJob(jobId);
    }

    @Test
    void unknownJobsResolveImmediately() {
        assertTrue(queue.submitJob("missing").isDone());
        assertTrue(queue.retryJob("missing").isDone());
        assertFalse(queue.removeJob("missing"));
    }

    @Test
    void statsCountByOverallStatus() {
        String pending = addJob(TaskType.TRANSCRIBE);
        String processing = addJob(TaskType.TRANSCRIBE);
        String failed = addJob(TaskType.TRANSCRIBE);
        store.updateTask(processing, job(processing).tasks().get(0).id(),
                t -> t.toBuilder().status(TaskStatus.PROCESSING).build());
        store.updateTask(failed, job(failed).tasks().get(0).id(),
                t -> t.toBuilder().status(TaskStatus.FAILED).error("x").build());

        QueueStats stats = queue.stats();

        assertEquals(1, stats.pending());
        assertEquals(1, stats.processing());
        assertEquals(0, stats.completed());
        assertEquals(1, stats.failed());
        assertEquals(3, stats.total());
        assertTrue(queue.getJob(pending).isPresent());
    }

    @Test
    void clearCompletedAndClearAll() {
        String done = addJob(TaskType.TRANSCRIBE);
        addJob(TaskType.TRANSCRIBE);
        store.updateTask(done, job(done).tasks().get(0).id(),
                t -> t.toBuilder().status(TaskStatus.COMPLETED).progress(100).build());

        assertEquals(1, queue.clearCompleted());
        assertEquals(1, queue.getJobs().size());
        assertEquals(1, queue.clearAllJobs());
        assertTrue(queue.getJobs().isEmpty());
    }

    @Test
    void restoreDropsExpiredFinishedJobs() {
        Instant now = Instant.parse("2026-03-10T12:00:00Z");
        VideoQueueService restored = newService(config().withRetention(Duration.ofHours(24)),
                Clock.fixed(now, ZoneOffset.UTC));

        Job oldDone = finished("old-done", now.minus(Duration.ofHours(48)));
        Job recentDone = finished("recent-done", now.minus(Duration.ofHours(2)));
        Job oldPending = Job.builder().id("old-pending").displayName("p.mp4")
                .tasks(List.of(Task.builder().id("old-pending-task-0").type(TaskType.TRANSCRIBE).build()))
                .createdAt(now.minus(Duration.ofDays(5)))
                .build();

        int kept = restored.restore(List.of(oldDone, recentDone, oldPending));

        assertEquals(2, kept);
        assertEquals(List.of("recent-done", "old-pending"), List.copyOf(restored.getJobs().keySet()));
    }

    private static Job finished(String id, Instant completedAt) {
        Task task = Task.builder().id(id + "-task-0").type(TaskType.TRANSCRIBE)
                .status(TaskStatus.COMPLETED).progress(100).build();
        return Job.builder().id(id).displayName(id + ".mp4").tasks(List.of(task))
                .createdAt(completedAt.minus(Duration.ofMinutes(10)))
                .completedAt(completedAt)
                .build();
    }

    @Test
    void toggleExpansion() {
        String jobId = addJob(TaskType.TRANSCRIBE);
        assertTrue(queue.toggleJobExpansion(jobId));
        assertTrue(job(jobId).expanded());
    }
}
