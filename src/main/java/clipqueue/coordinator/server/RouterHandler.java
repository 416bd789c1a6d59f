package clipqueue.coordinator.server;

import clipqueue.coordinator.api.Controller;
import clipqueue.coordinator.api.Controller.ControllerResponse;
import clipqueue.coordinator.exceptions.JobNotFoundException;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_TYPE;
import static io.netty.handler.codec.http.HttpResponseStatus.BAD_REQUEST;
import static io.netty.handler.codec.http.HttpResponseStatus.INTERNAL_SERVER_ERROR;
import static io.netty.handler.codec.http.HttpResponseStatus.NOT_FOUND;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Dispatches HTTP requests to registered controllers.
 * <p>
 * Handles:
 * - /api/v1/* (job API)
 * - /internal/v1/* (backend event ingress)
 * <p>
 * Anything else is 404. Sharable: no per-channel state.
 */
@Sharable
public class RouterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);

    private final List<Controller> controllers = new ArrayList<>();

    /**
     * Register a controller. Controllers are checked in order of registration.
     */
    public RouterHandler registerController(Controller controller) {
        controllers.add(controller);
        log.debug("Registered controller: {}", controller.getClass().getSimpleName());
        return this;
    }

    public int controllerCount() {
        return controllers.size();
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        String uri = req.uri();
        HttpMethod method = req.method();
        String path = uri.contains("?") ? uri.substring(0, uri.indexOf("?")) : uri;

        try {
            for (Controller controller : controllers) {
                if (controller.matches(method, path)) {
                    ControllerResponse response = controller.handle(ctx, req, path);
                    writeSafe(ctx, response.status(), response.contentType(), response.body());
                    return;
                }
            }

            log.debug("No handler for: {} {}", method, path);
            writeSafe(ctx, NOT_FOUND, "application/json", "{\"success\":false,\"error\":\"not found\"}");

        } catch (JobNotFoundException e) {
            writeSafe(ctx, NOT_FOUND, "application/json",
                    "{\"success\":false,\"error\":\"" + escapeJson(e.getMessage()) + "\"}");
        } catch (JsonProcessingException e) {
            log.warn("Malformed JSON on {} {}: {}", method, path, e.getOriginalMessage());
            writeSafe(ctx, BAD_REQUEST, "application/json",
                    "{\"success\":false,\"error\":\"malformed JSON: " + escapeJson(e.getOriginalMessage()) + "\"}");
        } catch (IllegalArgumentException e) {
            log.warn("Validation error on {} {}: {}", method, path, e.getMessage());
            writeSafe(ctx, BAD_REQUEST, "application/json",
                    "{\"success\":false,\"error\":\"" + escapeJson(e.getMessage()) + "\"}");
        } catch (Exception e) {
            String requestBody = req.content().toString(StandardCharsets.UTF_8);
            log.error("Handler error: {} {} - Body: [{}]", method, path, requestBody, e);
            writeSafe(ctx, INTERNAL_SERVER_ERROR, "application/json",
                    "{\"success\":false,\"error\":\"" + escapeJson(e.toString()) + "\"}");
        }
    }

    /**
     * Write a response, falling back to closing the channel if even that fails.
     */
    private void writeSafe(ChannelHandlerContext ctx, HttpResponseStatus status, String contentType, String body) {
        try {
            byte[] bytes = (body == null ? "" : body).getBytes(StandardCharsets.UTF_8);
            FullHttpResponse response = new DefaultFullHttpResponse(HTTP_1_1, status, Unpooled.wrappedBuffer(bytes));
            response.headers().set(CONTENT_TYPE, contentType + "; charset=utf-8");
            response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
            ctx.writeAndFlush(response);
        } catch (RuntimeException e) {
            log.error("Failed to write response: {}", e.getMessage(), e);
            ctx.close();
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Unhandled exception in channel: {}", cause.getMessage(), cause);
        ctx.close();
    }

    private static String escapeJson(String s) {
        if (s == null)
            return "";
        return s.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n").replace("\r", "\\r");
    }
}
