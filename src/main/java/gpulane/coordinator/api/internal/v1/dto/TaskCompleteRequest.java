package gpulane.coordinator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for completing a task.
 * POST /internal/v1/tasks/{taskId}/complete
 */
public record TaskCompleteRequest(
        @JsonProperty("result_location") String resultLocation) {

    public void validate() {
        if (resultLocation == null || resultLocation.isBlank()) {
            throw new IllegalArgumentException("result_location is required");
        }
    }
}
