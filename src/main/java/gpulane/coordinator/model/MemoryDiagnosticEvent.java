package gpulane.coordinator.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Append-only operational record. {@code value} carries a number or a short
 * string (allocated GiB, queue depth, wait seconds) already rendered as text.
 */
public record MemoryDiagnosticEvent(
        DiagnosticEventType eventType,
        String taskId,
        String model,
        LaneMode laneMode,
        String value,
        String reason,
        Instant timestamp) {

    public MemoryDiagnosticEvent {
        Objects.requireNonNull(eventType, "eventType is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        if (eventType == DiagnosticEventType.FALLBACK_ACTIVATED && (reason == null || reason.isBlank())) {
            throw new IllegalArgumentException("reason is required for fallback_activated");
        }
    }

    public static Builder builder(DiagnosticEventType type) {
        return new Builder(type);
    }

    public static final class Builder {
        private final DiagnosticEventType eventType;
        private String taskId;
        private String model;
        private LaneMode laneMode;
        private String value;
        private String reason;
        private Instant timestamp;

        private Builder(DiagnosticEventType eventType) {
            this.eventType = eventType;
        }

        public Builder taskId(String taskId) {
            this.taskId = taskId;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder laneMode(LaneMode laneMode) {
            this.laneMode = laneMode;
            return this;
        }

        public Builder value(Object value) {
            this.value = value == null ? null : String.valueOf(value);
            return this;
        }

        public Builder reason(String reason) {
            this.reason = reason;
            return this;
        }

        public Builder reason(FallbackReason reason) {
            this.reason = reason == null ? null : reason.wireName();
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public MemoryDiagnosticEvent build() {
            return new MemoryDiagnosticEvent(eventType, taskId, model, laneMode, value, reason,
                    timestamp != null ? timestamp : Instant.now());
        }
    }
}
