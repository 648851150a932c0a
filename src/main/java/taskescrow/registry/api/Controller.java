package taskescrow.registry.api;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import taskescrow.registry.error.RegistryException;

/**
 * Base interface for HTTP controllers.
 * Controllers handle specific URL patterns and HTTP methods.
 */
public interface Controller {

    /** Header carrying the authenticated caller identity */
    String CALLER_HEADER = "X-Caller-Id";

    /**
     * Check if this controller can handle the given request.
     *
     * @param method HTTP method
     * @param path   Request path (without query string)
     * @return true if this controller handles this request
     */
    boolean matches(HttpMethod method, String path);

    /**
     * Handle the request.
     *
     * @param ctx  Netty channel context
     * @param req  Full HTTP request
     * @param path Request path (without query string)
     * @return Response to send back
     */
    ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path);

    /**
     * Caller identity of a request, or null when the header is absent.
     */
    static String caller(FullHttpRequest req) {
        return req.headers().get(CALLER_HEADER);
    }

    /**
     * Response from a controller.
     */
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
                    "{\"success\":false,\"error\":\"not_found\",\"message\":\"" + escapeJson(message) + "\"}");
        }

        public static ControllerResponse badRequest(String message) {
            return new ControllerResponse(HttpResponseStatus.BAD_REQUEST, "application/json",
                    "{\"success\":false,\"error\":\"bad_request\",\"message\":\"" + escapeJson(message) + "\"}");
        }

        public static ControllerResponse error(String message) {
            return new ControllerResponse(HttpResponseStatus.INTERNAL_SERVER_ERROR, "application/json",
                    "{\"success\":false,\"error\":\"internal\",\"message\":\"" + escapeJson(message) + "\"}");
        }

        /**
         * Map a registry rejection to its HTTP status.
         */
        public static ControllerResponse rejected(RegistryException e) {
            HttpResponseStatus status = switch (e.error()) {
                case NOT_FOUND -> HttpResponseStatus.NOT_FOUND;
                case UNAUTHORIZED -> HttpResponseStatus.FORBIDDEN;
                case INVALID_STATE -> HttpResponseStatus.CONFLICT;
                case INVALID_INPUT -> HttpResponseStatus.BAD_REQUEST;
                case TRANSFER_FAILURE -> HttpResponseStatus.BAD_GATEWAY;
            };
            return new ControllerResponse(status, "application/json",
                    "{\"success\":false,\"error\":\"" + e.error().code() + "\",\"message\":\""
                            + escapeJson(e.getMessage()) + "\"}");
        }

        private static String escapeJson(String s) {
            if (s == null)
                return "";
            return s.replace("\\", "\\\\").replace("\"", "\\\"");
        }
    }
}
