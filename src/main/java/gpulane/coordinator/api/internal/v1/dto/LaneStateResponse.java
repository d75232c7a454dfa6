package gpulane.coordinator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import gpulane.coordinator.model.LaneState;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record LaneStateResponse(
        @JsonProperty("lane_key") String laneKey,
        @JsonProperty("mode") String mode,
        @JsonProperty("availability") String availability,
        @JsonProperty("warm") boolean warm,
        @JsonProperty("fallback_reason") String fallbackReason,
        @JsonProperty("updated_at") Instant updatedAt) {

    public static LaneStateResponse from(LaneState state) {
        return new LaneStateResponse(
                state.laneKey(),
                state.mode().wireName(),
                state.availability().wireName(),
                state.warm(),
                state.fallbackReason() != null ? state.fallbackReason().wireName() : null,
                state.updatedAt());
    }
}
