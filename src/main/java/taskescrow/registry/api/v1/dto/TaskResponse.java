package taskescrow.registry.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import taskescrow.registry.model.Task;

import java.time.Instant;

/**
 * Response DTO for task details.
 * GET /api/v1/tasks/{taskId}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskResponse(
        @JsonProperty("taskId") long taskId,
        @JsonProperty("title") String title,
        @JsonProperty("description") String description,
        @JsonProperty("reward") long reward,
        @JsonProperty("client") String client,
        @JsonProperty("freelancer") String freelancer,
        @JsonProperty("status") String status,
        @JsonProperty("deadline") Instant deadline,
        @JsonProperty("freelancerSubmitted") boolean freelancerSubmitted,
        @JsonProperty("clientApproved") boolean clientApproved) {

    /** Create response from domain model */
    public static TaskResponse from(Task task) {
        return new TaskResponse(
                task.id(),
                task.title(),
                task.description(),
                task.reward(),
                task.client(),
                task.freelancer().orElse(null),
                task.status().name(),
                task.deadline(),
                task.freelancerSubmitted(),
                task.clientApproved());
    }
}
