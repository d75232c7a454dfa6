package gpulane.coordinator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import gpulane.coordinator.lane.LaneSignal;

/**
 * Request DTO for a lane health or capacity callback.
 * POST /internal/v1/lanes/{model}/signals
 */
public record LaneSignalRequest(
        @JsonProperty("signal") String signal) {

    public LaneSignal toSignal() {
        return LaneSignal.fromWire(signal);
    }
}
