package gpulane.coordinator.model;

import java.util.Locale;

/**
 * Why a dedicated lane was bypassed.
 */
public enum FallbackReason {
    CAPACITY,
    QUOTA,
    MANUAL;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static FallbackReason fromWire(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * Classify a worker or platform error message. Anything that is not
     * explicitly a quota or manual switch counts as a capacity problem.
     */
    public static FallbackReason fromErrorMessage(String message) {
        String text = message == null ? "" : message.toLowerCase(Locale.ROOT);
        if (text.contains("quota")) {
            return QUOTA;
        }
        if (text.contains("manual")) {
            return MANUAL;
        }
        return CAPACITY;
    }
}
