package clipqueue.coordinator.backend;

import clipqueue.coordinator.exceptions.BackendException;
import clipqueue.coordinator.model.TaskType;
import clipqueue.coordinator.util.Json;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link ProcessingBackend} over the backend's REST API.
 */
public class HttpProcessingBackend implements ProcessingBackend {

    private static final Logger log = LoggerFactory.getLogger(HttpProcessingBackend.class);

    private final HttpClient httpClient;
    private final String baseUrl;
    private final Duration requestTimeout;

    public HttpProcessingBackend(String baseUrl, Duration requestTimeout) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.requestTimeout = requestTimeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    static String endpointFor(TaskType type) {
        return switch (type) {
            case DOWNLOAD -> "/downloader/download";
            case IMPORT -> "/library/import";
            case FIX_ASPECT_RATIO -> "/ffmpeg/fix-aspect-ratio";
            case NORMALIZE_AUDIO -> "/ffmpeg/normalize-audio";
            case COMBINED_PROCESS_NORMALIZE -> "/ffmpeg/process-video";
            case TRANSCRIBE -> "/analysis/transcribe";
            case ANALYZE -> "/analysis/analyze";
        };
    }

    @Override
    public SubmissionResult submit(BackendRequest request) {
        String label = request.type().wireName();
        JsonNode root = post(endpointFor(request.type()), request.body(), label,
                "Backend rejected " + request.type().displayName() + " request");
        return accepted(root, label);
    }

    @Override
    public SubmissionResult submitBatch(BatchRequest request) {
        Map<String, Object> body = Map.of("jobs", List.of(request.toJobBody()));
        JsonNode root = post("/queue/jobs/bulk", body, "batch", "Backend rejected batch for " + request.displayName());
        return accepted(root, "batch " + request.types());
    }

    private JsonNode post(String path, Object payload, String label, String rejectedMessage) {
        String body;
        try {
            body = Json.mapper().writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new BackendException("Failed to encode " + label + " request", e);
        }

        HttpRequest httpRequest = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        JsonNode root = exchange(httpRequest);
        if (!root.path("success").asBoolean(false)) {
            String message = firstText(root, "error", "message");
            throw new BackendException(message != null ? message : rejectedMessage);
        }
        return root;
    }

    private static SubmissionResult accepted(JsonNode root, String label) {
        String backendJobId = extractJobId(root);
        if (backendJobId == null) {
            throw new BackendException("Backend accepted " + label + " but returned no job id");
        }
        log.debug("Submitted {} as backend job {}", label, backendJobId);
        return new SubmissionResult(backendJobId, firstText(root, "videoId"), firstText(root, "videoPath"));
    }

    @Override
    public List<BackendJobSnapshot> fetchQueueSnapshot() {
        HttpRequest httpRequest = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/queue/jobs"))
                .timeout(requestTimeout)
                .GET()
                .build();

        JsonNode root = exchange(httpRequest);
        JsonNode jobs = root.path("jobs");
        if (!root.path("success").asBoolean(false) || !jobs.isArray()) {
            throw new BackendException("Queue listing was not successful");
        }
        List<BackendJobSnapshot> result = new ArrayList<>(jobs.size());
        for (JsonNode node : jobs) {
            try {
                result.add(Json.mapper().treeToValue(node, BackendJobSnapshot.class));
            } catch (JsonProcessingException e) {
                log.warn("Skipping malformed queue entry {}: {}", node, e.getMessage());
            }
        }
        return result;
    }

    @Override
    public Optional<String> fetchVideoPath(String videoId) {
        HttpRequest httpRequest = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/database/videos/"
                        + URLEncoder.encode(videoId, StandardCharsets.UTF_8)))
                .timeout(requestTimeout)
                .GET()
                .build();
        try {
            HttpResponse<String> response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() == 404) {
                return Optional.empty();
            }
            JsonNode root = parse(response);
            JsonNode video = root.has("video") ? root.path("video") : root;
            return Optional.ofNullable(firstText(video, "current_path", "currentPath", "videoPath"));
        } catch (IOException e) {
            throw new BackendException("Video lookup failed: backend unreachable at " + baseUrl, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendException("Interrupted during video lookup", e);
        }
    }

    private JsonNode exchange(HttpRequest request) {
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            return parse(response);
        } catch (IOException e) {
            String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.debug("Call to {} failed: {}", request.uri(), reason);
            throw new BackendException("Backend unreachable at " + baseUrl, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendException("Interrupted calling " + request.uri(), e);
        }
    }

    private static JsonNode parse(HttpResponse<String> response) {
        JsonNode root;
        try {
            String body = response.body();
            root = body == null || body.isBlank() ? Json.mapper().createObjectNode() : Json.mapper().readTree(body);
        } catch (JsonProcessingException e) {
            throw new BackendException("Unreadable backend response (HTTP " + response.statusCode() + ")",
                    response.statusCode());
        }
        if (response.statusCode() >= 400) {
            String message = firstText(root, "error", "message");
            throw new BackendException(message != null ? message : "HTTP " + response.statusCode(),
                    response.statusCode());
        }
        return root;
    }

    /** {@code jobId}, else {@code jobIds[0]} (top level or under {@code data}), else {@code batchId}. */
    static String extractJobId(JsonNode root) {
        String id = firstText(root, "jobId");
        if (id != null)
            return id;
        for (JsonNode holder : List.of(root, root.path("data"))) {
            JsonNode ids = holder.path("jobIds");
            if (ids.isArray() && ids.size() > 0 && !ids.get(0).isNull()) {
                return ids.get(0).asText();
            }
        }
        return firstText(root, "batchId");
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && !value.isNull() && !value.asText().isBlank()) {
                return value.asText();
            }
        }
        return null;
    }
}
