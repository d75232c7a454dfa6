package gpulane.coordinator.model;

import java.util.Locale;

/**
 * Operational event types recorded by the diagnostics emitter.
 */
public enum DiagnosticEventType {
    MEMORY_CLEANUP,
    MEMORY_POST_GENERATION,
    FALLBACK_ACTIVATED,
    QUEUE_TIMEOUT,
    QUEUE_OVERLOADED,
    QUEUE_ADMITTED,
    WARM_LANE_READY,
    LANE_RECOVERED;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static DiagnosticEventType fromWire(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
