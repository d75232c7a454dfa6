package gpulane.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import gpulane.coordinator.routing.RouteDecision;

/**
 * Response DTO for an accepted generation request.
 * POST /generate
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GenerateResponse(
        @JsonProperty("task_id") String taskId,
        @JsonProperty("status") String status,
        @JsonProperty("fallback_activated") Boolean fallbackActivated) {

    public static GenerateResponse pending(String taskId) {
        return new GenerateResponse(taskId, "pending", null);
    }

    /**
     * Pending response for an accepted decision; flags a request sent to the shared worker.
     */
    public static GenerateResponse accepted(RouteDecision decision) {
        return new GenerateResponse(decision.taskId(), "pending", decision.fallbackActivated() ? Boolean.TRUE : null);
    }
}
