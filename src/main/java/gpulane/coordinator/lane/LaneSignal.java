package gpulane.coordinator.lane;

import java.util.Locale;

/**
 * Health and capacity callbacks that move a lane between states.
 */
public enum LaneSignal {
    /** Health probe succeeded */
    HEALTH_OK,
    /** Health probe failed; the lane goes unavailable once failures last past the grace period */
    HEALTH_FAILED,
    /** Platform refused to provide a GPU */
    CAPACITY_DENIED,
    /** Account GPU quota exhausted */
    QUOTA_DENIED,
    /** Capacity or quota is available again; a health probe must still confirm */
    CAPACITY_RESTORED,
    /** Idle eviction or autoscale-down */
    IDLE,
    /** Warm-up of the lane finished */
    WARMED,
    /** Worker container recycled; the pipeline is gone */
    RECYCLED,
    /** Operator forced the model onto the shared worker */
    MANUAL_FALLBACK;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static LaneSignal fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("signal is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown lane signal: " + value);
        }
    }
}
