package taskescrow.registry.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import taskescrow.registry.api.Controller;
import taskescrow.registry.api.v1.dto.PlatformResponse;
import taskescrow.registry.api.v1.dto.UpdateFeeRequest;
import taskescrow.registry.error.RegistryException;
import taskescrow.registry.model.PlatformState;
import taskescrow.registry.server.RouterHandler;
import taskescrow.registry.service.TaskRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Controller for owner-level platform operations.
 *
 * GET /api/v1/platform - Owner, fee, task counter and balance in custody
 * PUT /api/v1/platform/fee - Change the platform fee (owner only)
 * POST /api/v1/platform/emergency-withdraw - Sweep the whole balance to the owner (owner only)
 */
public class PlatformController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(PlatformController.class);

    private static final String PLATFORM_PATH = "/api/v1/platform";
    private static final String FEE_PATH = "/api/v1/platform/fee";
    private static final String WITHDRAW_PATH = "/api/v1/platform/emergency-withdraw";

    private final TaskRegistry registry;

    public PlatformController(TaskRegistry registry) {
        this.registry = registry;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return (method.equals(HttpMethod.GET) && PLATFORM_PATH.equals(path))
                || (method.equals(HttpMethod.PUT) && FEE_PATH.equals(path))
                || (method.equals(HttpMethod.POST) && WITHDRAW_PATH.equals(path));
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (PLATFORM_PATH.equals(path)) {
                PlatformResponse response = PlatformResponse.from(registry.getPlatformState());
                return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
            }

            if (FEE_PATH.equals(path)) {
                UpdateFeeRequest request = RouterHandler.readBody(req, UpdateFeeRequest.class);
                request.validate();
                PlatformState updated = registry.updatePlatformFee(request.feePercentage(), Controller.caller(req));
                return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(PlatformResponse.from(updated)));
            }

            long withdrawn = registry.emergencyWithdraw(Controller.caller(req));
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(
                    Map.of("success", true, "withdrawn", withdrawn)));

        } catch (RegistryException e) {
            return ControllerResponse.rejected(e);
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Platform controller error", e);
            return ControllerResponse.error("internal error");
        }
    }
}
