package taskescrow.registry.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Request DTO for creating and funding a task.
 * POST /api/v1/tasks
 */
public record CreateTaskRequest(
        @JsonProperty("title") String title,
        @JsonProperty("description") String description,
        @JsonProperty("deadline") Instant deadline,
        @JsonProperty("reward") Long reward) {

    /**
     * Shape checks only; business preconditions (positive reward, future deadline,
     * non-empty title) are enforced by the registry.
     */
    public void validate() {
        if (title == null) {
            throw new IllegalArgumentException("title is required");
        }
        if (deadline == null) {
            throw new IllegalArgumentException("deadline is required");
        }
        if (reward == null) {
            throw new IllegalArgumentException("reward is required");
        }
    }
}
