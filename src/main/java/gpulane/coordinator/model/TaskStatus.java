package gpulane.coordinator.model;

import java.util.Locale;

/**
 * Generation task status. Transitions are monotonic:
 * PENDING -> PROCESSING -> {DONE | FAILED}, and PENDING -> FAILED.
 */
public enum TaskStatus {
    /** Admitted, waiting for a lane or degraded slot to begin inference */
    PENDING,
    /** A worker has started inference */
    PROCESSING,
    /** Worker reported a result */
    DONE,
    /** Failed by the worker, the queue policy or the stale task reaper */
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }

    /** Lower-case name used on the wire and in the database */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static TaskStatus fromWire(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
