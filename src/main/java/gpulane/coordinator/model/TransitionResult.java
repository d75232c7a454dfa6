package gpulane.coordinator.model;

/**
 * Result of a conditional task state transition.
 */
public enum TransitionResult {
    /** The transition was applied */
    APPLIED,

    /** Task was already DONE or FAILED - idempotent no-op */
    ALREADY_TERMINAL,

    /** Task is not in the state the transition starts from (e.g. completing a PENDING task) */
    INVALID_STATE,

    /** Task not found */
    NOT_FOUND
}
