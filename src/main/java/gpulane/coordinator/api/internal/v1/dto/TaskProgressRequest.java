package gpulane.coordinator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for a progress report.
 * POST /internal/v1/tasks/{taskId}/progress
 */
public record TaskProgressRequest(
        @JsonProperty("progress") Integer progress,
        @JsonProperty("stage") String stage) {

    public void validate() {
        if (progress == null) {
            throw new IllegalArgumentException("progress is required");
        }
        if (progress < 0 || progress > 100) {
            throw new IllegalArgumentException("progress must be within 0..100");
        }
    }
}
