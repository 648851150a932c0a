package taskescrow.registry.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import taskescrow.registry.api.Controller;
import taskescrow.registry.api.v1.dto.CreateTaskRequest;
import taskescrow.registry.api.v1.dto.TaskResponse;
import taskescrow.registry.error.RegistryException;
import taskescrow.registry.model.CompletionResult;
import taskescrow.registry.model.Task;
import taskescrow.registry.server.RouterHandler;
import taskescrow.registry.service.TaskRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for the task lifecycle (public API).
 *
 * POST /api/v1/tasks - Create and fund a task
 * GET /api/v1/tasks/count - Number of tasks ever created
 * GET /api/v1/tasks/{taskId} - Task details
 * POST /api/v1/tasks/{taskId}/accept - Claim as freelancer
 * POST /api/v1/tasks/{taskId}/complete - Submit (freelancer) or approve (client)
 * POST /api/v1/tasks/{taskId}/cancel - Cancel an open task and refund the client
 */
public class TaskController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(TaskController.class);

    private static final Pattern TASKS_PATTERN = Pattern.compile("^/api/v1/tasks$");
    private static final Pattern COUNT_PATTERN = Pattern.compile("^/api/v1/tasks/count$");
    private static final Pattern TASK_BY_ID_PATTERN = Pattern.compile("^/api/v1/tasks/(\\d+)$");
    private static final Pattern ACTION_PATTERN = Pattern.compile("^/api/v1/tasks/(\\d+)/(accept|complete|cancel)$");

    private final TaskRegistry registry;

    public TaskController(TaskRegistry registry) {
        this.registry = registry;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return TASKS_PATTERN.matcher(path).matches() || ACTION_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.GET)) {
            return COUNT_PATTERN.matcher(path).matches() || TASK_BY_ID_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (req.method().equals(HttpMethod.POST) && TASKS_PATTERN.matcher(path).matches()) {
                return handleCreate(req);
            }

            if (COUNT_PATTERN.matcher(path).matches()) {
                return ControllerResponse.json(RouterHandler.mapper()
                        .writeValueAsString(Map.of("totalTasks", registry.getTotalTasks())));
            }

            Matcher byId = TASK_BY_ID_PATTERN.matcher(path);
            if (byId.matches()) {
                Task task = registry.getTask(Long.parseLong(byId.group(1)));
                return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(TaskResponse.from(task)));
            }

            Matcher action = ACTION_PATTERN.matcher(path);
            if (action.matches()) {
                long taskId = Long.parseLong(action.group(1));
                return switch (action.group(2)) {
                    case "accept" -> handleAccept(req, taskId);
                    case "complete" -> handleComplete(req, taskId);
                    default -> handleCancel(req, taskId);
                };
            }

            return ControllerResponse.notFound("unknown task endpoint");

        } catch (RegistryException e) {
            log.debug("Rejected {} {}: {}", req.method(), path, e.getMessage());
            return ControllerResponse.rejected(e);
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Task controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    /**
     * POST /api/v1/tasks
     */
    private ControllerResponse handleCreate(FullHttpRequest req) throws Exception {
        CreateTaskRequest request = RouterHandler.readBody(req, CreateTaskRequest.class);
        request.validate();

        long taskId = registry.createTask(
                request.title(),
                request.description(),
                request.deadline(),
                request.reward(),
                Controller.caller(req));

        return ControllerResponse.json(
                HttpResponseStatus.CREATED,
                RouterHandler.mapper().writeValueAsString(TaskResponse.from(registry.getTask(taskId))));
    }

    /**
     * POST /api/v1/tasks/{taskId}/accept
     */
    private ControllerResponse handleAccept(FullHttpRequest req, long taskId) throws Exception {
        Task task = registry.acceptTask(taskId, Controller.caller(req));
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(TaskResponse.from(task)));
    }

    /**
     * POST /api/v1/tasks/{taskId}/complete
     */
    private ControllerResponse handleComplete(FullHttpRequest req, long taskId) throws Exception {
        CompletionResult result = registry.completeTask(taskId, Controller.caller(req));
        Task task = registry.getTask(taskId);

        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(Map.of(
                "success", true,
                "result", result.name(),
                "task", TaskResponse.from(task))));
    }

    /**
     * POST /api/v1/tasks/{taskId}/cancel
     */
    private ControllerResponse handleCancel(FullHttpRequest req, long taskId) throws Exception {
        Task task = registry.cancelTask(taskId, Controller.caller(req));
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(TaskResponse.from(task)));
    }
}
