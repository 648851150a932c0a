package taskescrow.registry.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.QueryStringDecoder;
import taskescrow.registry.api.Controller;
import taskescrow.registry.api.v1.dto.UserTasksResponse;
import taskescrow.registry.server.RouterHandler;
import taskescrow.registry.service.TaskRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for per-identity history.
 * GET /api/v1/users/{identity}/tasks
 */
public class UserController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(UserController.class);

    private static final Pattern USER_TASKS_PATTERN = Pattern.compile("^/api/v1/users/([^/]+)/tasks$");

    private final TaskRegistry registry;

    public UserController(TaskRegistry registry) {
        this.registry = registry;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && USER_TASKS_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            Matcher m = USER_TASKS_PATTERN.matcher(path);
            if (!m.matches()) {
                return ControllerResponse.notFound("unknown user endpoint");
            }
            String identity = QueryStringDecoder.decodeComponent(m.group(1));

            UserTasksResponse response = new UserTasksResponse(
                    identity,
                    registry.getUserTasks(identity),
                    registry.getCompletedTaskCount(identity));

            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
        } catch (Exception e) {
            log.error("User controller error", e);
            return ControllerResponse.error("internal error");
        }
    }
}
