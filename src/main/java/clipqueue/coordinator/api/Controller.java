package clipqueue.coordinator.api;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;

/**
 * Base interface for HTTP controllers.
 * Controllers handle specific URL patterns and HTTP methods.
 */
public interface Controller {

    /**
     * Check if this controller can handle the given request.
     *
     * @param method HTTP method
     * @param path   Request path (without query string)
     */
    boolean matches(HttpMethod method, String path);

    /**
     * Handle the request.
     *
     * @param path Request path (without query string)
     */
    ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception;

    record ControllerResponse(
            HttpResponseStatus status,
            String contentType,
            String body) {

        public static ControllerResponse json(String body) {
            return new ControllerResponse(HttpResponseStatus.OK, "application/json", body);
        }

        public static ControllerResponse json(HttpResponseStatus status, String body) {
            return new ControllerResponse(status, "application/json", body);
        }

        public static ControllerResponse notFound(String message) {
            return new ControllerResponse(HttpResponseStatus.NOT_FOUND, "application/json",
                    "{\"success\":false,\"error\":\"" + escapeJson(message) + "\"}");
        }

        static String escapeJson(String s) {
            if (s == null)
                return "";
            return s.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n").replace("\r", "\\r");
        }
    }
}
