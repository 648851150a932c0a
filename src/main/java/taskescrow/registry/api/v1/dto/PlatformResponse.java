package taskescrow.registry.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import taskescrow.registry.model.PlatformState;

/**
 * Response DTO for registry-wide state.
 * GET /api/v1/platform
 */
public record PlatformResponse(
        @JsonProperty("owner") String owner,
        @JsonProperty("platformFeePercentage") int platformFeePercentage,
        @JsonProperty("totalTasks") long totalTasks,
        @JsonProperty("heldBalance") long heldBalance) {

    public static PlatformResponse from(PlatformState state) {
        return new PlatformResponse(
                state.owner(),
                state.platformFeePercentage(),
                state.taskCounter(),
                state.heldBalance());
    }
}
