package clipqueue.coordinator.service;

import clipqueue.coordinator.backend.BackendRequest;
import clipqueue.coordinator.backend.BatchRequest;
import clipqueue.coordinator.backend.FakeProcessingBackend;
import clipqueue.coordinator.backend.SubmissionResult;
import clipqueue.coordinator.exceptions.TaskSubmissionException;
import clipqueue.coordinator.model.Job;
import clipqueue.coordinator.model.NewJobRequest;
import clipqueue.coordinator.model.Task;
import clipqueue.coordinator.model.TaskConfig;
import clipqueue.coordinator.model.TaskStatus;
import clipqueue.coordinator.model.TaskType;
import clipqueue.coordinator.store.InMemoryJobCache;
import clipqueue.coordinator.store.JobStore;
import clipqueue.coordinator.store.TaskRef;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TaskSubmitterTest {

    private FakeProcessingBackend backend;
    private JobStore store;
    private TaskSubmitter submitter;

    @BeforeEach
    void setUp() {
        backend = new FakeProcessingBackend();
        store = new JobStore(new InMemoryJobCache(), Duration.ofMillis(50), Clock.systemUTC());
        submitter = new TaskSubmitter(store, backend);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    private Task task(String jobId, int index) {
        return store.getJob(jobId).orElseThrow().tasks().get(index);
    }

    @Test
    void submitBindsBackendId() {
        String jobId = store.addJob(NewJobRequest.builder()
                .videoId("vid-1").videoPath("/media/clip.mp4").displayName("clip.mp4")
                .task(TaskType.TRANSCRIBE, new TaskConfig.TranscriptionConfig("small", "de"))
                .build());
        String taskId = task(jobId, 0).id();

        String backendJobId = submitter.submit(jobId, taskId);

        assertEquals("backend-1", backendJobId);
        Task task = task(jobId, 0);
        assertEquals(TaskStatus.PROCESSING, task.status());
        assertEquals("backend-1", task.backendJobId());
        assertEquals(List.of(new TaskRef(jobId, taskId)), store.findByBackendJobId("backend-1"));

        BackendRequest request = backend.lastRequest();
        assertEquals(TaskType.TRANSCRIBE, request.type());
        assertEquals("vid-1", request.get("videoId"));
        assertEquals("small", request.get("whisperModel"));
        assertEquals("de", request.get("language"));
    }

    @Test
    void alreadyBoundTaskIsNotResubmitted() {
        String jobId = store.addJob(NewJobRequest.builder()
                .videoPath("/media/clip.mp4").displayName("clip.mp4")
                .task(TaskType.IMPORT)
                .build());
        String taskId = task(jobId, 0).id();

        String first = submitter.submit(jobId, taskId);
        String second = submitter.submit(jobId, taskId);

        assertEquals(first, second);
        assertEquals(1, backend.submitted().size());
    }

    @Test
    void aspectAndAudioAreCombined() {
        String jobId = store.addJob(NewJobRequest.builder()
                .videoId("vid-1").videoPath("/media/clip.mp4").displayName("clip.mp4")
                .task(TaskType.FIX_ASPECT_RATIO, new TaskConfig.AspectRatioConfig("9:16"))
                .task(TaskType.NORMALIZE_AUDIO, new TaskConfig.AudioNormalizationConfig(-14.0))
                .task(TaskType.TRANSCRIBE)
                .build());

        String backendJobId = submitter.submit(jobId, task(jobId, 0).id());

        BackendRequest request = backend.lastRequest();
        assertEquals(TaskType.COMBINED_PROCESS_NORMALIZE, request.type());
        assertEquals("/media/clip.mp4", request.get("filePath"));
        assertEquals(true, request.get("fixAspectRatio"));
        assertEquals(true, request.get("normalizeAudio"));
        assertEquals(-14.0, request.get("level"));
        assertEquals("9:16", request.get("targetRatio"));

        assertEquals(backendJobId, task(jobId, 0).backendJobId());
        assertEquals(backendJobId, task(jobId, 1).backendJobId());
        assertEquals(TaskStatus.PENDING, task(jobId, 2).status());
        assertEquals(2, store.findByBackendJobId(backendJobId).size());

        // the partner is already bound, so submitting it is a no-op
        assertEquals(backendJobId, submitter.submit(jobId, task(jobId, 1).id()));
        assertEquals(1, backend.submitted().size());
    }

    @Test
    void completedPartnerIsNotCombined() {
        String jobId = store.addJob(NewJobRequest.builder()
                .videoPath("/media/clip.mp4").displayName("clip.mp4")
                .task(TaskType.FIX_ASPECT_RATIO, new TaskConfig.AspectRatioConfig("1:1"))
                .task(TaskType.NORMALIZE_AUDIO, new TaskConfig.AudioNormalizationConfig(null))
                .build());
        store.updateTask(jobId, task(jobId, 0).id(), t -> t.toBuilder()
                .status(TaskStatus.COMPLETED).progress(100).backendJobId("old").build());

        submitter.submit(jobId, task(jobId, 1).id());

        BackendRequest request = backend.lastRequest();
        assertEquals(TaskType.NORMALIZE_AUDIO, request.type());
        assertEquals(-16.0, request.get("level"));
    }

    @Test
    void rejectionFailsTask() {
        String jobId = store.addJob(NewJobRequest.builder()
                .videoId("vid-1").displayName("clip.mp4")
                .task(TaskType.TRANSCRIBE)
                .build());
        String taskId = task(jobId, 0).id();
        backend.rejectNext("Whisper model not installed");

        TaskSubmissionException e = assertThrows(TaskSubmissionException.class,
                () -> submitter.submit(jobId, taskId));

        assertEquals(taskId, e.taskId());
        assertEquals("Whisper model not installed", e.getMessage());
        Task task = task(jobId, 0);
        assertEquals(TaskStatus.FAILED, task.status());
        assertEquals("Whisper model not installed", task.error());
        assertNull(task.backendJobId());
    }

    @Test
    void missingVideoPathFailsTask() {
        String jobId = store.addJob(NewJobRequest.builder()
                .displayName("clip.mp4")
                .task(TaskType.FIX_ASPECT_RATIO, new TaskConfig.AspectRatioConfig(null))
                .build());
        String taskId = task(jobId, 0).id();

        assertThrows(TaskSubmissionException.class, () -> submitter.submit(jobId, taskId));

        assertEquals("No video file available for Fix Aspect Ratio", task(jobId, 0).error());
        assertTrue(backend.submitted().isEmpty());
    }

    @Test
    void analyzeRequestCarriesProviderKey() {
        String jobId = store.addJob(NewJobRequest.builder()
                .videoId("vid-1").displayName("clip.mp4")
                .task(TaskType.TRANSCRIBE)
                .task(TaskType.ANALYZE, new TaskConfig.AnalysisConfig(
                        "claude:claude-3-5-sonnet", "sk-ant", null, "Find the funny bits"))
                .build());

        submitter.submit(jobId, task(jobId, 1).id());

        BackendRequest request = backend.lastRequest();
        assertEquals(TaskType.ANALYZE, request.type());
        assertEquals("vid-1", request.get("videoId"));
        assertEquals("claude:claude-3-5-sonnet", request.get("aiModel"));
        assertEquals("claude", request.get("aiProvider"));
        assertEquals("sk-ant", request.get("claudeApiKey"));
        assertNull(request.get("openaiApiKey"));
        assertEquals("Find the funny bits", request.get("customInstructions"));
        assertEquals(true, request.get("forceReanalyze"));
        assertEquals(true, request.get("forceRetranscribe"));
    }

    @Test
    void analyzeWithoutTranscribeDoesNotForceRetranscribe() {
        String jobId = store.addJob(NewJobRequest.builder()
                .videoId("vid-1").displayName("clip.mp4")
                .task(TaskType.ANALYZE, new TaskConfig.AnalysisConfig("qwen2.5:7b", null, "http://ollama:11434", null))
                .build());

        submitter.submit(jobId, task(jobId, 0).id());

        BackendRequest request = backend.lastRequest();
        assertEquals("ollama", request.get("aiProvider"));
        assertEquals("http://ollama:11434", request.get("endpoint"));
        assertEquals(false, request.get("forceRetranscribe"));
    }

    @Test
    void downloadResultUpdatesVideo() {
        String jobId = store.addJob(NewJobRequest.builder()
                .displayName("https://example.com/watch?v=1")
                .task(TaskType.DOWNLOAD, new TaskConfig.DownloadConfig("https://example.com/watch?v=1", null, "720p"))
                .task(TaskType.TRANSCRIBE)
                .build());
        backend.respondNext(new SubmissionResult("dl-7", "vid-42", "/media/lib/video.mp4"));

        submitter.submit(jobId, task(jobId, 0).id());

        BackendRequest request = backend.lastRequest();
        assertEquals("https://example.com/watch?v=1", request.get("url"));
        assertEquals("720p", request.get("quality"));

        Job job = store.getJob(jobId).orElseThrow();
        assertEquals("vid-42", job.videoId());
        assertEquals("/media/lib/video.mp4", job.videoPath());
        assertEquals("dl-7", job.tasks().get(0).backendJobId());
    }

    @Test
    void transcribeFallsBackToFilePath() {
        BackendRequest request = TaskSubmitter.requestFor(
                Job.builder().id("j").displayName("x").videoPath("/media/x.mp4").tasks(List.of()).build(),
                Task.builder().id("j-task-0").type(TaskType.TRANSCRIBE).build());

        assertNull(request.get("videoId"));
        assertEquals("/media/x.mp4", request.get("filePath"));
        assertEquals("base", request.get("whisperModel"));
        assertEquals("en", request.get("language"));
    }

    @Test
    void batchBindsEveryOpenTaskToOneId() {
        String jobId = store.addJob(NewJobRequest.builder()
                .videoId("vid-1").videoPath("/media/clip.mp4").displayName("clip.mp4")
                .task(TaskType.FIX_ASPECT_RATIO, new TaskConfig.AspectRatioConfig("9:16"))
                .task(TaskType.NORMALIZE_AUDIO, new TaskConfig.AudioNormalizationConfig(-16.0))
                .task(TaskType.TRANSCRIBE, new TaskConfig.TranscriptionConfig("small", "de"))
                .task(TaskType.ANALYZE, new TaskConfig.AnalysisConfig("claude:claude-3-5-sonnet", "sk-ant", null, "Find hooks"))
                .build());

        Optional<String> backendJobId = submitter.submitBatch(jobId);

        assertEquals(Optional.of("batch-1"), backendJobId);
        assertTrue(store.getJob(jobId).orElseThrow().tasks().stream()
                .allMatch(t -> t.status() == TaskStatus.PROCESSING && "batch-1".equals(t.backendJobId())));
        assertEquals(4, store.findByBackendJobId("batch-1").size());

        BatchRequest request = backend.batches().get(0);
        assertEquals(Map.of("videoId", "vid-1"), request.source());
        assertEquals(List.of(TaskType.COMBINED_PROCESS_NORMALIZE, TaskType.TRANSCRIBE, TaskType.ANALYZE), request.types());
        Map<String, Object> combined = request.steps().get(0).body();
        assertEquals(true, combined.get("fixAspectRatio"));
        assertEquals("9:16", combined.get("aspectRatio"));
        assertEquals(-16.0, combined.get("level"));
        assertEquals("small", request.steps().get(1).get("model"));
        BackendRequest analyze = request.steps().get(2);
        assertEquals("claude-3-5-sonnet", analyze.get("aiModel"));
        assertEquals("claude", analyze.get("aiProvider"));
        assertEquals("sk-ant", analyze.get("claudeApiKey"));
        assertEquals(5, analyze.get("analysisGranularity"));
    }

    @Test
    void batchWithDownloadUsesUrlAsSource() {
        String jobId = store.addJob(NewJobRequest.builder()
                .displayName("talk.mp4")
                .task(TaskType.DOWNLOAD, new TaskConfig.DownloadConfig("https://example.com/talk", null, "720"))
                .task(TaskType.TRANSCRIBE)
                .build());

        submitter.submitBatch(jobId);

        BatchRequest request = backend.batches().get(0);
        assertEquals(Map.of("url", "https://example.com/talk"), request.source());
        assertEquals(List.of(TaskType.DOWNLOAD, TaskType.TRANSCRIBE), request.types());
        assertEquals("720", request.steps().get(0).get("quality"));
        assertEquals("talk.mp4", request.displayName());
    }

    @Test
    void batchSkipsCompletedTasks() {
        String jobId = store.addJob(NewJobRequest.builder()
                .videoPath("/media/clip.mp4").displayName("clip.mp4")
                .task(TaskType.IMPORT)
                .task(TaskType.TRANSCRIBE)
                .build());
        store.updateTask(jobId, task(jobId, 0).id(),
                t -> t.toBuilder().status(TaskStatus.COMPLETED).progress(100).build());

        submitter.submitBatch(jobId);

        assertEquals(List.of(TaskType.TRANSCRIBE), backend.batches().get(0).types());
        assertEquals(Map.of("filePath", "/media/clip.mp4"), backend.batches().get(0).source());
        assertNull(task(jobId, 0).backendJobId());
        assertEquals(Optional.empty(), submitter.submitBatch(jobId));
        assertEquals(1, backend.batches().size());
    }

    @Test
    void batchWithoutAnyVideoSourceFailsEveryTask() {
        String jobId = store.addJob(NewJobRequest.builder()
                .displayName("clip.mp4")
                .task(TaskType.TRANSCRIBE)
                .task(TaskType.ANALYZE, new TaskConfig.AnalysisConfig("openai:gpt-4o", "sk", null, null))
                .build());

        TaskSubmissionException e = assertThrows(TaskSubmissionException.class, () -> submitter.submitBatch(jobId));

        assertEquals("Video ID or file path required for Transcribe", e.getMessage());
        assertTrue(backend.batches().isEmpty());
        assertTrue(store.getJob(jobId).orElseThrow().tasks().stream().allMatch(t -> t.status() == TaskStatus.FAILED));
    }
}
