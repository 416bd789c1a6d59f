package clipqueue.coordinator.api.internal.v1;

import clipqueue.coordinator.api.Controller;
import clipqueue.coordinator.api.internal.v1.dto.FailureEventRequest;
import clipqueue.coordinator.api.internal.v1.dto.OperationResponse;
import clipqueue.coordinator.api.internal.v1.dto.ProgressEventRequest;
import clipqueue.coordinator.api.internal.v1.dto.StatusEventRequest;
import clipqueue.coordinator.events.ProgressEventBus;
import clipqueue.coordinator.util.Json;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Ingress for backend events.
 *
 * POST /internal/v1/events/progress - percentage report
 * POST /internal/v1/events/failure - operation failed
 * POST /internal/v1/events/status - lifecycle change
 */
public class EventController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(EventController.class);

    private static final Pattern EVENT_PATTERN = Pattern.compile("^/internal/v1/events/(progress|failure|status)$");

    private final ProgressEventBus bus;

    public EventController(ProgressEventBus bus) {
        this.bus = bus;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.POST) && EVENT_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        Matcher m = EVENT_PATTERN.matcher(path);
        if (!m.matches()) {
            return ControllerResponse.notFound("unknown event endpoint");
        }
        String body = req.content().toString(StandardCharsets.UTF_8);

        switch (m.group(1)) {
            case "progress" -> {
                ProgressEventRequest request = Json.mapper().readValue(body, ProgressEventRequest.class);
                request.validate();
                bus.publish(request.toEvent());
            }
            case "failure" -> {
                FailureEventRequest request = Json.mapper().readValue(body, FailureEventRequest.class);
                request.validate();
                bus.publish(request.toEvent());
            }
            default -> {
                StatusEventRequest request = Json.mapper().readValue(body, StatusEventRequest.class);
                request.validate();
                log.debug("Status event {} -> {}", request.toEvent().backendJobId(), request.status());
                bus.publish(request.toEvent());
            }
        }
        return ControllerResponse.json(Json.mapper().writeValueAsString(OperationResponse.success()));
    }
}
