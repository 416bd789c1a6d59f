package clipqueue.coordinator.service;

import clipqueue.coordinator.backend.BackendRequest;
import clipqueue.coordinator.backend.BatchRequest;
import clipqueue.coordinator.backend.ProcessingBackend;
import clipqueue.coordinator.backend.SubmissionResult;
import clipqueue.coordinator.exceptions.TaskSubmissionException;
import clipqueue.coordinator.model.Job;
import clipqueue.coordinator.model.Task;
import clipqueue.coordinator.model.TaskConfig.AnalysisConfig;
import clipqueue.coordinator.model.TaskConfig.AspectRatioConfig;
import clipqueue.coordinator.model.TaskConfig.AudioNormalizationConfig;
import clipqueue.coordinator.model.TaskConfig.DownloadConfig;
import clipqueue.coordinator.model.TaskConfig.TranscriptionConfig;
import clipqueue.coordinator.model.TaskStatus;
import clipqueue.coordinator.model.TaskType;
import clipqueue.coordinator.store.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns a task into a backend request and binds the returned backend job id.
 * <p>
 * A job that holds both an aspect ratio fix and an audio normalization gets one
 * combined backend operation; both tasks are bound to its id. A batch submission
 * sends every open task of a job at once and binds them all to the one id.
 */
public class TaskSubmitter {

    private static final Logger log = LoggerFactory.getLogger(TaskSubmitter.class);

    private final JobStore store;
    private final ProcessingBackend backend;

    public TaskSubmitter(JobStore store, ProcessingBackend backend) {
        this.store = store;
        this.backend = backend;
    }

    /**
     * Submit one task.
     *
     * @return the backend job id the task is bound to
     * @throws TaskSubmissionException if the request could not be built or the backend refused it;
     *                                 the task is failed with the same message
     */
    public String submit(String jobId, String taskId) {
        Job job = store.getJob(jobId)
                .orElseThrow(() -> new TaskSubmissionException(taskId, "Job not found: " + jobId));
        Task task = job.task(taskId)
                .orElseThrow(() -> new TaskSubmissionException(taskId, "Task not found: " + taskId));

        if (task.isSubmitted() && !task.isTerminal()) {
            log.debug("Task {} already bound to backend job {}", taskId, task.backendJobId());
            return task.backendJobId();
        }
        if (task.status() == TaskStatus.COMPLETED) {
            return task.backendJobId();
        }

        Optional<Task> partner = combinationPartner(job, task);
        List<String> taskIds = new ArrayList<>();
        taskIds.add(taskId);
        partner.ifPresent(p -> taskIds.add(p.id()));

        Job marked = store.updateJob(jobId, j -> markProcessing(j, taskIds))
                .orElseThrow(() -> new TaskSubmissionException(taskId, "Job not found: " + jobId));

        BackendRequest request;
        try {
            request = partner.isPresent()
                    ? combinedRequest(marked, task.type() == TaskType.FIX_ASPECT_RATIO ? task : partner.get(),
                            task.type() == TaskType.NORMALIZE_AUDIO ? task : partner.get())
                    : requestFor(marked, marked.task(taskId).orElseThrow());
        } catch (IllegalArgumentException e) {
            fail(jobId, taskIds, e.getMessage());
            throw new TaskSubmissionException(taskId, e.getMessage(), e);
        }

        SubmissionResult result;
        try {
            result = backend.submit(request);
        } catch (RuntimeException e) {
            String message = e.getMessage() != null ? e.getMessage()
                    : "Failed to submit " + task.displayName();
            log.warn("Submission of {} for job {} failed: {}", request.type().wireName(), jobId, message);
            fail(jobId, taskIds, message);
            throw new TaskSubmissionException(taskId, message, e);
        }

        Optional<Job> bound = store.updateJob(jobId, j -> bind(j, taskIds, result));
        if (bound.isEmpty()) {
            log.info("Job {} was removed while {} was being submitted", jobId, request.type().wireName());
        } else {
            log.info("Submitted {} for job {} as backend job {}", request.type().wireName(), jobId,
                    result.backendJobId());
        }
        return result.backendJobId();
    }

    /**
     * Submit every task of the job that is not completed as one backend job.
     * Tasks already running under a backend job are left alone.
     *
     * @return the backend job id the tasks are bound to, empty if nothing needed submitting
     * @throws TaskSubmissionException if the request could not be built or the backend refused it;
     *                                 every included task is failed with the same message
     */
    public Optional<String> submitBatch(String jobId) {
        Job job = store.getJob(jobId)
                .orElseThrow(() -> new TaskSubmissionException(null, "Job not found: " + jobId));
        List<Task> open = job.tasks().stream()
                .filter(t -> t.status() != TaskStatus.COMPLETED)
                .filter(t -> !(t.isSubmitted() && !t.isTerminal()))
                .toList();
        if (open.isEmpty())
            return Optional.empty();
        List<String> taskIds = open.stream().map(Task::id).toList();
        String firstTaskId = taskIds.get(0);

        Job marked = store.updateJob(jobId, j -> markProcessing(j, taskIds))
                .orElseThrow(() -> new TaskSubmissionException(firstTaskId, "Job not found: " + jobId));

        BatchRequest request;
        try {
            request = batchRequest(marked, open);
        } catch (IllegalArgumentException e) {
            fail(jobId, taskIds, e.getMessage());
            throw new TaskSubmissionException(firstTaskId, e.getMessage(), e);
        }

        SubmissionResult result;
        try {
            result = backend.submitBatch(request);
        } catch (RuntimeException e) {
            String message = e.getMessage() != null ? e.getMessage()
                    : "Failed to submit " + job.displayName();
            log.warn("Batch submission {} for job {} failed: {}", request.types(), jobId, message);
            fail(jobId, taskIds, message);
            throw new TaskSubmissionException(firstTaskId, message, e);
        }

        Optional<Job> bound = store.updateJob(jobId, j -> bind(j, taskIds, result));
        if (bound.isEmpty()) {
            log.info("Job {} was removed while its batch was being submitted", jobId);
        } else {
            log.info("Submitted batch {} for job {} as backend job {}", request.types(), jobId,
                    result.backendJobId());
        }
        return Optional.of(result.backendJobId());
    }

    /** The other half of an aspect/audio pair, if it still needs submitting. */
    static Optional<Task> combinationPartner(Job job, Task task) {
        if (!task.type().isCombinable())
            return Optional.empty();
        TaskType other = task.type() == TaskType.FIX_ASPECT_RATIO ? TaskType.NORMALIZE_AUDIO : TaskType.FIX_ASPECT_RATIO;
        return job.firstTaskOfType(other)
                .filter(p -> !p.isTerminal() && !p.isSubmitted());
    }

    private static Job markProcessing(Job job, List<String> taskIds) {
        Job result = job;
        for (String id : taskIds) {
            Task t = result.task(id).orElseThrow();
            result = result.withTask(t.toBuilder()
                    .status(TaskStatus.PROCESSING)
                    .progress(0)
                    .error(null)
                    .build());
        }
        return result;
    }

    private static Job bind(Job job, List<String> taskIds, SubmissionResult submission) {
        Job result = job;
        for (String id : taskIds) {
            Optional<Task> t = result.task(id);
            if (t.isPresent() && !t.get().isTerminal()) {
                result = result.withTask(t.get().toBuilder().backendJobId(submission.backendJobId()).build());
            }
        }
        Job.Builder b = result.toBuilder();
        if (submission.videoId() != null)
            b.videoId(submission.videoId());
        if (submission.videoPath() != null)
            b.videoPath(submission.videoPath());
        return b.build();
    }

    private void fail(String jobId, List<String> taskIds, String message) {
        store.updateJob(jobId, j -> {
            Job result = j;
            for (String id : taskIds) {
                Optional<Task> t = result.task(id);
                if (t.isPresent()) {
                    result = result.withTask(t.get().toBuilder()
                            .status(TaskStatus.FAILED)
                            .error(message)
                            .build());
                }
            }
            return result;
        });
    }

    // ---------- request shapes ----------

    static BackendRequest requestFor(Job job, Task task) {
        Map<String, Object> body = new LinkedHashMap<>();
        switch (task.type()) {
            case DOWNLOAD -> {
                DownloadConfig cfg = task.configAs(DownloadConfig.class);
                if (cfg == null || cfg.url() == null || cfg.url().isBlank())
                    throw new IllegalArgumentException("Download requires a URL");
                body.put("url", cfg.url());
                putIfPresent(body, "outputDir", cfg.outputDir());
                body.put("quality", cfg.qualityOrDefault());
            }
            case IMPORT -> body.put("filePath", requirePath(job, task));
            case FIX_ASPECT_RATIO -> {
                AspectRatioConfig cfg = task.configAs(AspectRatioConfig.class);
                body.put("filePath", requirePath(job, task));
                body.put("targetRatio", cfg != null ? cfg.targetRatioOrDefault() : AspectRatioConfig.DEFAULT_RATIO);
            }
            case NORMALIZE_AUDIO -> {
                AudioNormalizationConfig cfg = task.configAs(AudioNormalizationConfig.class);
                body.put("filePath", requirePath(job, task));
                body.put("level", cfg != null ? cfg.targetLevelOrDefault() : AudioNormalizationConfig.DEFAULT_LEVEL);
            }
            case TRANSCRIBE -> {
                TranscriptionConfig cfg = task.configAs(TranscriptionConfig.class);
                putVideoReference(body, job, task);
                body.put("whisperModel", cfg != null ? cfg.modelOrDefault() : TranscriptionConfig.DEFAULT_MODEL);
                body.put("language", cfg != null ? cfg.languageOrDefault() : TranscriptionConfig.DEFAULT_LANGUAGE);
            }
            case ANALYZE -> {
                AnalysisConfig cfg = task.configAs(AnalysisConfig.class);
                if (cfg == null || cfg.aiModel() == null || cfg.aiModel().isBlank())
                    throw new IllegalArgumentException("AI analysis requires an AI model to be selected");
                putVideoReference(body, job, task);
                body.put("aiModel", cfg.aiModel());
                body.put("aiProvider", cfg.provider());
                if ("claude".equals(cfg.provider()))
                    putIfPresent(body, "claudeApiKey", cfg.apiKey());
                if ("openai".equals(cfg.provider()))
                    putIfPresent(body, "openaiApiKey", cfg.apiKey());
                putIfPresent(body, "endpoint", cfg.endpoint());
                putIfPresent(body, "customInstructions", cfg.customInstructions());
                body.put("forceReanalyze", true);
                body.put("forceRetranscribe", job.hasTaskOfType(TaskType.TRANSCRIBE));
            }
            case COMBINED_PROCESS_NORMALIZE ->
                throw new IllegalArgumentException("combined operation is only built from its parts");
        }
        return new BackendRequest(task.type(), body);
    }

    static BackendRequest combinedRequest(Job job, Task aspectTask, Task audioTask) {
        AspectRatioConfig aspect = aspectTask.configAs(AspectRatioConfig.class);
        AudioNormalizationConfig audio = audioTask.configAs(AudioNormalizationConfig.class);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("filePath", requirePath(job, aspectTask));
        body.put("fixAspectRatio", true);
        body.put("normalizeAudio", true);
        body.put("level", audio != null ? audio.targetLevelOrDefault() : AudioNormalizationConfig.DEFAULT_LEVEL);
        body.put("targetRatio", aspect != null ? aspect.targetRatioOrDefault() : AspectRatioConfig.DEFAULT_RATIO);
        return new BackendRequest(TaskType.COMBINED_PROCESS_NORMALIZE, body);
    }

    /**
     * One step per task, in job order, with an aspect/audio pair folded into one
     * combined step. The video source is the download URL when the batch
     * downloads, else the library id, else the file path.
     */
    static BatchRequest batchRequest(Job job, List<Task> tasks) {
        Map<String, Object> source = new LinkedHashMap<>();
        Optional<Task> download = tasks.stream().filter(t -> t.type() == TaskType.DOWNLOAD).findFirst();
        if (download.isPresent()) {
            DownloadConfig cfg = download.get().configAs(DownloadConfig.class);
            if (cfg == null || cfg.url() == null || cfg.url().isBlank())
                throw new IllegalArgumentException("Download requires a URL");
            source.put("url", cfg.url());
        } else if (job.videoId() != null && !job.videoId().isBlank()) {
            source.put("videoId", job.videoId());
        } else if (job.videoPath() != null && !job.videoPath().isBlank()) {
            source.put("filePath", job.videoPath());
        } else {
            throw new IllegalArgumentException("Video ID or file path required for " + tasks.get(0).displayName());
        }

        Task aspect = firstOfType(tasks, TaskType.FIX_ASPECT_RATIO);
        Task audio = firstOfType(tasks, TaskType.NORMALIZE_AUDIO);
        boolean combine = aspect != null && audio != null;

        List<BackendRequest> steps = new ArrayList<>();
        boolean combinedAdded = false;
        for (Task task : tasks) {
            if (combine && task.type().isCombinable()) {
                if (!combinedAdded) {
                    steps.add(combinedStep(aspect, audio));
                    combinedAdded = true;
                }
                continue;
            }
            steps.add(new BackendRequest(task.type(), stepOptions(task)));
        }
        return new BatchRequest(job.displayName(), source, steps);
    }

    private static Map<String, Object> stepOptions(Task task) {
        Map<String, Object> options = new LinkedHashMap<>();
        switch (task.type()) {
            case DOWNLOAD -> {
                DownloadConfig cfg = task.configAs(DownloadConfig.class);
                if (cfg != null) {
                    putIfPresent(options, "outputDir", cfg.outputDir());
                    options.put("quality", cfg.qualityOrDefault());
                }
            }
            case IMPORT, COMBINED_PROCESS_NORMALIZE -> {
            }
            case FIX_ASPECT_RATIO -> {
                AspectRatioConfig cfg = task.configAs(AspectRatioConfig.class);
                options.put("aspectRatio", cfg != null ? cfg.targetRatioOrDefault() : AspectRatioConfig.DEFAULT_RATIO);
            }
            case NORMALIZE_AUDIO -> {
                AudioNormalizationConfig cfg = task.configAs(AudioNormalizationConfig.class);
                options.put("level", cfg != null ? cfg.targetLevelOrDefault() : AudioNormalizationConfig.DEFAULT_LEVEL);
            }
            case TRANSCRIBE -> {
                TranscriptionConfig cfg = task.configAs(TranscriptionConfig.class);
                options.put("model", cfg != null ? cfg.modelOrDefault() : TranscriptionConfig.DEFAULT_MODEL);
                options.put("language", cfg != null ? cfg.languageOrDefault() : TranscriptionConfig.DEFAULT_LANGUAGE);
            }
            case ANALYZE -> {
                AnalysisConfig cfg = task.configAs(AnalysisConfig.class);
                if (cfg == null || cfg.aiModel() == null || cfg.aiModel().isBlank())
                    throw new IllegalArgumentException("AI analysis requires an AI model to be selected");
                options.put("aiModel", cfg.modelName());
                options.put("aiProvider", cfg.provider());
                if ("claude".equals(cfg.provider()))
                    putIfPresent(options, "claudeApiKey", cfg.apiKey());
                if ("openai".equals(cfg.provider()))
                    putIfPresent(options, "openaiApiKey", cfg.apiKey());
                putIfPresent(options, "endpoint", cfg.endpoint());
                putIfPresent(options, "customInstructions", cfg.customInstructions());
                options.put("analysisGranularity", 5);
                options.put("analysisQuality", "fast");
            }
        }
        return options;
    }

    private static BackendRequest combinedStep(Task aspectTask, Task audioTask) {
        AspectRatioConfig aspect = aspectTask.configAs(AspectRatioConfig.class);
        AudioNormalizationConfig audio = audioTask.configAs(AudioNormalizationConfig.class);
        Map<String, Object> options = new LinkedHashMap<>();
        options.put("fixAspectRatio", true);
        options.put("normalizeAudio", true);
        options.put("level", audio != null ? audio.targetLevelOrDefault() : AudioNormalizationConfig.DEFAULT_LEVEL);
        options.put("aspectRatio", aspect != null ? aspect.targetRatioOrDefault() : AspectRatioConfig.DEFAULT_RATIO);
        return new BackendRequest(TaskType.COMBINED_PROCESS_NORMALIZE, options);
    }

    private static Task firstOfType(List<Task> tasks, TaskType type) {
        return tasks.stream().filter(t -> t.type() == type).findFirst().orElse(null);
    }

    private static String requirePath(Job job, Task task) {
        if (job.videoPath() == null || job.videoPath().isBlank())
            throw new IllegalArgumentException("No video file available for " + task.displayName());
        return job.videoPath();
    }

    private static void putVideoReference(Map<String, Object> body, Job job, Task task) {
        if (job.videoId() != null && !job.videoId().isBlank()) {
            body.put("videoId", job.videoId());
        } else if (job.videoPath() != null && !job.videoPath().isBlank()) {
            body.put("filePath", job.videoPath());
        } else {
            throw new IllegalArgumentException("Video ID or file path required for " + task.displayName());
        }
    }

    private static void putIfPresent(Map<String, Object> body, String key, Object value) {
        if (value != null)
            body.put(key, value);
    }
}
