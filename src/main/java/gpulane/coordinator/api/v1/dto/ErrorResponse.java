package gpulane.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Body of every non-2xx response.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        @JsonProperty("code") String code,
        @JsonProperty("detail") String detail,
        @JsonProperty("user_action") String userAction,
        @JsonProperty("metadata") Map<String, Object> metadata) {

    public static ErrorResponse of(int status, String code, String detail) {
        return new ErrorResponse(code, detail, defaultUserAction(status), null);
    }

    public ErrorResponse withMetadata(Map<String, Object> metadata) {
        return new ErrorResponse(code, detail, userAction, metadata);
    }

    public ErrorResponse withUserAction(String userAction) {
        return new ErrorResponse(code, detail, userAction, metadata);
    }

    public static String defaultUserAction(int status) {
        return switch (status) {
            case 400 -> "Check request parameters and retry.";
            case 401 -> "Re-authenticate and retry.";
            case 403 -> "Check credentials and retry.";
            case 404 -> "Verify the identifier and retry.";
            case 409 -> "Retry the operation.";
            case 422 -> "Fix request fields and retry.";
            case 429 -> "Retry after a short delay.";
            case 502 -> "Retry shortly.";
            default -> "Retry later.";
        };
    }
}
