package gpulane.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import gpulane.coordinator.model.Task;
import gpulane.coordinator.model.TaskStatus;

import java.time.Instant;

/**
 * Response DTO for task status.
 * GET /status/{task_id}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StatusResponse(
        @JsonProperty("task_id") String taskId,
        @JsonProperty("status") String status,
        @JsonProperty("progress") int progress,
        @JsonProperty("stage") String stage,
        @JsonProperty("lane_mode") String laneMode,
        @JsonProperty("fallback_reason") String fallbackReason,
        @JsonProperty("fallback_activated") Boolean fallbackActivated,
        @JsonProperty("result_url") String resultUrl,
        @JsonProperty("error_msg") String errorMsg,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt) {

    /**
     * @param publicBaseUrl base for result links; when null the stored location is returned as is
     */
    public static StatusResponse from(Task task, String publicBaseUrl) {
        String resultUrl = null;
        if (task.status() == TaskStatus.DONE) {
            resultUrl = publicBaseUrl != null ? publicBaseUrl + "/results/" + task.id() : task.resultLocation();
        }
        return new StatusResponse(
                task.id(),
                task.status().wireName(),
                task.progress(),
                task.stage(),
                task.laneMode() != null ? task.laneMode().wireName() : null,
                task.fallbackReason() != null ? task.fallbackReason().wireName() : null,
                task.fallbackActivated() ? Boolean.TRUE : null,
                resultUrl,
                task.errorMessage(),
                task.createdAt(),
                task.updatedAt());
    }
}
