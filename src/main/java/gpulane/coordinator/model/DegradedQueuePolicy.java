package gpulane.coordinator.model;

import java.time.Duration;

/**
 * Admission limits for degraded shared-worker mode.
 */
public record DegradedQueuePolicy(int maxDepth, Duration maxWait, String overflowCode) {

    public static final String OVERFLOW_CODE = "queue_overloaded";

    /** maxDepth=25, maxWait=30s */
    public static final DegradedQueuePolicy DEFAULT = new DegradedQueuePolicy(25, Duration.ofSeconds(30), OVERFLOW_CODE);

    public DegradedQueuePolicy {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive");
        }
        if (maxWait == null || maxWait.isNegative() || maxWait.isZero()) {
            throw new IllegalArgumentException("maxWait must be positive");
        }
        if (overflowCode == null || overflowCode.isBlank()) {
            throw new IllegalArgumentException("overflowCode is required");
        }
    }

    public long maxWaitSeconds() {
        return maxWait.toSeconds();
    }
}
