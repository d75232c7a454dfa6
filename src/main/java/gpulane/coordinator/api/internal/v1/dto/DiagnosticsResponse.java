package gpulane.coordinator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import gpulane.coordinator.diagnostics.DiagnosticsSnapshot;
import gpulane.coordinator.model.MemoryDiagnosticEvent;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * GET /internal/v1/diagnostics
 */
public record DiagnosticsResponse(
        @JsonProperty("overload_count") long overloadCount,
        @JsonProperty("timeout_count") long timeoutCount,
        @JsonProperty("fallback_count") long fallbackCount,
        @JsonProperty("cleanup_count") long cleanupCount,
        @JsonProperty("by_type") Map<String, Long> byType,
        @JsonProperty("events") List<DiagnosticEventResponse> events) {

    public static DiagnosticsResponse from(DiagnosticsSnapshot snapshot, List<MemoryDiagnosticEvent> recent) {
        Map<String, Long> byType = new TreeMap<>();
        snapshot.byType().forEach((type, count) -> byType.put(type.wireName(), count));
        return new DiagnosticsResponse(
                snapshot.overloadCount(),
                snapshot.timeoutCount(),
                snapshot.fallbackCount(),
                snapshot.cleanupCount(),
                byType,
                recent.stream().map(DiagnosticEventResponse::from).toList());
    }
}
