package gpulane.coordinator.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Snapshot of a dedicated video execution lane as seen by the router.
 * Instances are immutable; the registry replaces them on every transition.
 */
public record LaneState(
        String laneKey,
        LaneMode mode,
        boolean warm,
        LaneAvailability availability,
        FallbackReason fallbackReason,
        Instant updatedAt) {

    public LaneState {
        Objects.requireNonNull(laneKey, "laneKey is required");
        Objects.requireNonNull(mode, "mode is required");
        Objects.requireNonNull(availability, "availability is required");
        if (mode == LaneMode.DEGRADED_SHARED && fallbackReason == null) {
            throw new IllegalArgumentException("fallbackReason is required in degraded_shared mode: " + laneKey);
        }
        if (mode == LaneMode.DEDICATED) {
            fallbackReason = null;
        }
    }

    /** Initial state at process start: dedicated, ready and warm */
    public static LaneState initial(String laneKey, Instant now) {
        return new LaneState(laneKey, LaneMode.DEDICATED, true, LaneAvailability.READY, null, now);
    }

    /** True when a request may go straight to the dedicated lane */
    public boolean isDispatchable() {
        return availability == LaneAvailability.READY && mode == LaneMode.DEDICATED;
    }

    public LaneState withAvailability(LaneAvailability availability, boolean warm, Instant now) {
        return new LaneState(laneKey, mode, warm, availability, fallbackReason, now);
    }

    public LaneState degraded(FallbackReason reason, Instant now) {
        return new LaneState(laneKey, LaneMode.DEGRADED_SHARED, warm, availability, reason, now);
    }

    public LaneState dedicated(Instant now) {
        return new LaneState(laneKey, LaneMode.DEDICATED, warm, availability, null, now);
    }
}
