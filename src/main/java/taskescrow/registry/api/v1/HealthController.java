package taskescrow.registry.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import taskescrow.registry.api.Controller;
import taskescrow.registry.api.v1.dto.HealthResponse;
import taskescrow.registry.model.TaskStatus;
import taskescrow.registry.server.RouterHandler;
import taskescrow.registry.service.TaskRegistry;
import taskescrow.registry.store.Database;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.time.Duration;

/**
 * Health check controller.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);
    private static final String VERSION = "1.0.0";

    private final Database database;
    private final TaskRegistry registry;

    public HealthController(Database database, TaskRegistry registry) {
        this.database = database;
        this.registry = registry;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (!database.isHealthy()) {
                return unhealthy("connection failed");
            }

            HealthResponse response = HealthResponse.healthy(
                    formatUptime(),
                    VERSION,
                    registry.countByStatus(TaskStatus.OPEN),
                    registry.countByStatus(TaskStatus.ASSIGNED),
                    registry.getPlatformState().heldBalance());

            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));

        } catch (Exception e) {
            log.error("Health check failed", e);
            return unhealthy(e.getMessage());
        }
    }

    private ControllerResponse unhealthy(String reason) {
        try {
            return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                    RouterHandler.mapper().writeValueAsString(HealthResponse.unhealthy(reason)));
        } catch (Exception e) {
            return ControllerResponse.error("health check failed");
        }
    }

    private String formatUptime() {
        long uptimeMs = ManagementFactory.getRuntimeMXBean().getUptime();
        Duration duration = Duration.ofMillis(uptimeMs);
        long hours = duration.toHours();
        long minutes = duration.toMinutesPart();
        return hours + "h " + minutes + "m";
    }
}
