package gpulane.coordinator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for reporting task failure.
 * POST /internal/v1/tasks/{taskId}/fail
 *
 * @param error     worker error message
 * @param errorType worker-side error class, optional
 */
public record TaskFailRequest(
        @JsonProperty("error") String error,
        @JsonProperty("error_type") String errorType) {

    public void validate() {
        if (error == null || error.isBlank()) {
            throw new IllegalArgumentException("error is required");
        }
    }
}
