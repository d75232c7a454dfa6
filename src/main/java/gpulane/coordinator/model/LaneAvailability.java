package gpulane.coordinator.model;

import java.util.Locale;

/**
 * Availability of a dedicated execution lane.
 */
public enum LaneAvailability {
    /** Warm and able to take requests */
    READY,
    /** Scaled down or recycled, nothing resident */
    COLD,
    /** Capacity or quota denied, or health checks failing past the grace period */
    UNAVAILABLE;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
