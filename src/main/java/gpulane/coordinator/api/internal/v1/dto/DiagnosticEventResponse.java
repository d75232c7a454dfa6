package gpulane.coordinator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import gpulane.coordinator.model.MemoryDiagnosticEvent;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record DiagnosticEventResponse(
        @JsonProperty("event_type") String eventType,
        @JsonProperty("task_id") String taskId,
        @JsonProperty("model") String model,
        @JsonProperty("lane_mode") String laneMode,
        @JsonProperty("value") String value,
        @JsonProperty("reason") String reason,
        @JsonProperty("created_at") Instant createdAt) {

    public static DiagnosticEventResponse from(MemoryDiagnosticEvent event) {
        return new DiagnosticEventResponse(
                event.eventType().wireName(),
                event.taskId(),
                event.model(),
                event.laneMode() != null ? event.laneMode().wireName() : null,
                event.value(),
                event.reason(),
                event.timestamp());
    }
}
