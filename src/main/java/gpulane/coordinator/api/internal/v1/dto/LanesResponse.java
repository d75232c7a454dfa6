package gpulane.coordinator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * GET /internal/v1/lanes
 *
 * @param routes routing decisions per outcome since start
 */
public record LanesResponse(
        @JsonProperty("lanes") List<LaneStateResponse> lanes,
        @JsonProperty("queue_depth") int queueDepth,
        @JsonProperty("queue_waiting") int queueWaiting,
        @JsonProperty("max_depth") int maxDepth,
        @JsonProperty("max_wait_seconds") long maxWaitSeconds,
        @JsonProperty("routes") Map<String, Long> routes) {
}
