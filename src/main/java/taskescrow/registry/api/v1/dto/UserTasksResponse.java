package taskescrow.registry.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Response DTO for an identity's task history.
 * GET /api/v1/users/{identity}/tasks
 */
public record UserTasksResponse(
        @JsonProperty("identity") String identity,
        @JsonProperty("taskIds") List<Long> taskIds,
        @JsonProperty("completedTasks") long completedTasks) {
}
