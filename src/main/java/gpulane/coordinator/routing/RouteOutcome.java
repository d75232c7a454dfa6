package gpulane.coordinator.routing;

import java.util.Locale;

/**
 * Result of routing one generation request.
 */
public enum RouteOutcome {
    /** Sent to the model's warm dedicated lane (or the image lane) */
    ACCEPTED_DEDICATED,
    /** Admitted to the degraded queue of the shared worker */
    ACCEPTED_DEGRADED,
    /** Degraded queue full; nothing was reserved and no task was created */
    REJECTED_OVERLOADED,
    /** Failed validation before any lane or queue was consulted */
    REJECTED_INVALID;

    public boolean accepted() {
        return this == ACCEPTED_DEDICATED || this == ACCEPTED_DEGRADED;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
