package taskescrow.registry.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.*;
import taskescrow.registry.api.Controller;
import taskescrow.registry.api.Controller.ControllerResponse;
import taskescrow.registry.config.RegistryConfig;
import taskescrow.registry.error.RegistryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_TYPE;
import static io.netty.handler.codec.http.HttpResponseStatus.*;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Central router that dispatches HTTP requests to registered controllers.
 *
 * Only /api/v1/* endpoints are served; everything else returns 404.
 * When an API key is configured, every non-GET request must carry it in X-Registry-Key.
 *
 * This handler is @Sharable because it has no per-channel state.
 */
@Sharable
public class RouterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);
    private static final String KEY_HEADER = "X-Registry-Key";
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .findAndRegisterModules();

    private final List<Controller> controllers = new ArrayList<>();
    private final RegistryConfig config;

    public RouterHandler(RegistryConfig config) {
        this.config = config;
    }

    /**
     * Register a controller to handle requests.
     * Controllers are checked in order of registration.
     */
    public RouterHandler registerController(Controller controller) {
        controllers.add(controller);
        log.debug("Registered controller: {}", controller.getClass().getSimpleName());
        return this;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        String uri = req.uri();
        HttpMethod method = req.method();

        String path = uri.contains("?") ? uri.substring(0, uri.indexOf("?")) : uri;

        try {
            if (!checkAuth(req)) {
                log.warn("Auth failed for {} {}", method, path);
                writeSafe(ctx, FORBIDDEN, "application/json", "{\"success\":false,\"error\":\"forbidden\"}");
                return;
            }

            for (Controller controller : controllers) {
                if (controller.matches(method, path)) {
                    ControllerResponse response = controller.handle(ctx, req, path);
                    writeSafe(ctx, response.status(), response.contentType(), response.body());
                    return;
                }
            }

            log.debug("No handler for: {} {}", method, path);
            writeSafe(ctx, NOT_FOUND, "application/json", "{\"success\":false,\"error\":\"not found\"}");

        } catch (RegistryException e) {
            ControllerResponse response = ControllerResponse.rejected(e);
            writeSafe(ctx, response.status(), response.contentType(), response.body());
        } catch (IllegalArgumentException e) {
            log.warn("Validation error: {}", e.getMessage());
            writeSafe(ctx, BAD_REQUEST, "application/json",
                    "{\"success\":false,\"error\":\"" + escapeJson(e.getMessage()) + "\"}");
        } catch (Exception e) {
            String requestBody = req.content().toString(StandardCharsets.UTF_8);
            log.error("Handler error: {} {} - Body: [{}]", method, path, requestBody, e);

            StringBuilder errorChain = new StringBuilder(e.toString());
            Throwable cause = e.getCause();
            while (cause != null) {
                errorChain.append(" <- ").append(cause);
                cause = cause.getCause();
            }

            writeSafe(ctx, INTERNAL_SERVER_ERROR, "application/json",
                    "{\"success\":false,\"error\":\"" + escapeJson(errorChain.toString()) + "\"}");
        }
    }

    /**
     * Reads are open; mutations need the shared key when one is configured.
     */
    private boolean checkAuth(FullHttpRequest req) {
        if (!config.hasApiKey()) {
            return true;
        }
        if (req.method().equals(HttpMethod.GET)) {
            return true;
        }
        return config.apiKey().equals(req.headers().get(KEY_HEADER));
    }

    /**
     * Write a response, falling back to a bare 500 if serialization of the response fails.
     */
    private void writeSafe(ChannelHandlerContext ctx, HttpResponseStatus status, String contentType, String body) {
        try {
            if (body == null) {
                body = "";
            }
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
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
        try {
            writeSafe(ctx, INTERNAL_SERVER_ERROR, "application/json",
                    "{\"success\":false,\"error\":\"channel error: " + escapeJson(cause.getMessage()) + "\"}");
        } finally {
            ctx.close();
        }
    }

    private static String escapeJson(String s) {
        if (s == null)
            return "";
        return s.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n").replace("\r", "\\r");
    }

    /**
     * Get the shared ObjectMapper for JSON serialization.
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Parse a request body, reporting malformed JSON as a validation error.
     */
    public static <T> T readBody(FullHttpRequest req, Class<T> type) {
        String body = req.content().toString(StandardCharsets.UTF_8);
        if (body.isBlank()) {
            throw new IllegalArgumentException("request body is required");
        }
        try {
            return MAPPER.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("malformed JSON: " + e.getOriginalMessage());
        }
    }
}
