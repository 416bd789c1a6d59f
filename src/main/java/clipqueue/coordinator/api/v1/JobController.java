package clipqueue.coordinator.api.v1;

import clipqueue.coordinator.api.Controller;
import clipqueue.coordinator.api.v1.dto.CreateJobRequest;
import clipqueue.coordinator.api.v1.dto.JobResponse;
import clipqueue.coordinator.exceptions.JobNotFoundException;
import clipqueue.coordinator.model.Job;
import clipqueue.coordinator.service.VideoQueueService;
import clipqueue.coordinator.util.Json;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for job management (public API).
 *
 * GET /api/v1/jobs - List jobs and queue stats
 * POST /api/v1/jobs - Create a job (optionally submit it)
 * DELETE /api/v1/jobs - Clear all jobs, or only finished ones with ?completed=true
 * GET /api/v1/jobs/{jobId} - Get one job
 * DELETE /api/v1/jobs/{jobId} - Remove a job
 * POST /api/v1/jobs/{jobId}/submit - Run a job
 * POST /api/v1/jobs/{jobId}/retry - Retry failed tasks
 * POST /api/v1/jobs/{jobId}/toggle - Toggle expansion
 */
public class JobController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(JobController.class);

    private static final Pattern JOBS_PATTERN = Pattern.compile("^/api/v1/jobs$");
    private static final Pattern JOB_BY_ID_PATTERN = Pattern.compile("^/api/v1/jobs/([^/]+)$");
    private static final Pattern JOB_ACTION_PATTERN = Pattern.compile("^/api/v1/jobs/([^/]+)/(submit|retry|toggle)$");

    private final VideoQueueService queue;

    public JobController(VideoQueueService queue) {
        this.queue = queue;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (JOBS_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.GET) || method.equals(HttpMethod.POST) || method.equals(HttpMethod.DELETE);
        }
        if (JOB_BY_ID_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.GET) || method.equals(HttpMethod.DELETE);
        }
        return method.equals(HttpMethod.POST) && JOB_ACTION_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        HttpMethod method = req.method();

        if (JOBS_PATTERN.matcher(path).matches()) {
            if (method.equals(HttpMethod.POST))
                return handleCreateJob(req);
            if (method.equals(HttpMethod.DELETE))
                return handleClear(req);
            return handleListJobs();
        }

        Matcher action = JOB_ACTION_PATTERN.matcher(path);
        if (action.matches()) {
            return handleAction(action.group(1), action.group(2));
        }

        Matcher byId = JOB_BY_ID_PATTERN.matcher(path);
        if (byId.matches()) {
            String jobId = byId.group(1);
            if (method.equals(HttpMethod.DELETE)) {
                if (!queue.removeJob(jobId))
                    throw new JobNotFoundException(jobId);
                return ControllerResponse.json("{\"success\":true}");
            }
            Job job = queue.getJob(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
            return ControllerResponse.json(Json.mapper().writeValueAsString(JobResponse.from(job)));
        }

        return ControllerResponse.notFound("unknown job endpoint");
    }

    private ControllerResponse handleCreateJob(FullHttpRequest req) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        CreateJobRequest request = Json.mapper().readValue(body, CreateJobRequest.class);
        request.validate();

        String jobId = queue.addVideoJob(request.toNewJobRequest());
        if (request.submit()) {
            watch(jobId, queue.submitJob(jobId));
        }

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", true);
        response.put("jobId", jobId);
        response.put("submitted", request.submit());
        return ControllerResponse.json(HttpResponseStatus.CREATED, Json.mapper().writeValueAsString(response));
    }

    private ControllerResponse handleListJobs() throws Exception {
        List<JobResponse> jobs = queue.getJobs().values().stream().map(JobResponse::from).toList();
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", true);
        response.put("jobs", jobs);
        response.put("stats", queue.stats());
        return ControllerResponse.json(Json.mapper().writeValueAsString(response));
    }

    private ControllerResponse handleClear(FullHttpRequest req) throws Exception {
        QueryStringDecoder query = new QueryStringDecoder(req.uri());
        boolean onlyCompleted = query.parameters().getOrDefault("completed", List.of("false"))
                .stream().anyMatch("true"::equalsIgnoreCase);
        int removed = onlyCompleted ? queue.clearCompleted() : queue.clearAllJobs();
        return ControllerResponse.json(Json.mapper().writeValueAsString(
                Map.of("success", true, "removed", removed)));
    }

    private ControllerResponse handleAction(String jobId, String action) throws Exception {
        if (queue.getJob(jobId).isEmpty())
            throw new JobNotFoundException(jobId);

        switch (action) {
            case "submit" -> watch(jobId, queue.submitJob(jobId));
            case "retry" -> watch(jobId, queue.retryJob(jobId));
            default -> queue.toggleJobExpansion(jobId);
        }
        HttpResponseStatus status = "toggle".equals(action) ? HttpResponseStatus.OK : HttpResponseStatus.ACCEPTED;
        return ControllerResponse.json(status, Json.mapper().writeValueAsString(
                Map.of("success", true, "jobId", jobId)));
    }

    private static void watch(String jobId, CompletableFuture<Void> run) {
        run.whenComplete((ok, error) -> {
            if (error != null) {
                Throwable cause = error.getCause() != null ? error.getCause() : error;
                log.warn("Job {} stopped: {}", jobId, cause.getMessage());
            }
        });
    }
}
