package gpulane.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for health check.
 * GET /health
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("database") String database,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("version") String version,
        @JsonProperty("pendingTasks") Integer pendingTasks,
        @JsonProperty("processingTasks") Integer processingTasks,
        @JsonProperty("queueDepth") Integer queueDepth) {

    public static HealthResponse healthy(String uptime, String version, int pendingTasks, int processingTasks,
            int queueDepth) {
        return new HealthResponse("healthy", "ok", uptime, version, pendingTasks, processingTasks, queueDepth);
    }

    public static HealthResponse unhealthy(String database) {
        return new HealthResponse("unhealthy", database, null, null, null, null, null);
    }
}
