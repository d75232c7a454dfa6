package gpulane.coordinator.model;

import java.util.Locale;

/**
 * Routing mode of a heavy model.
 */
public enum LaneMode {
    DEDICATED,
    DEGRADED_SHARED;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static LaneMode fromWire(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
