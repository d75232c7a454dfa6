package gpulane.coordinator.admission;

/**
 * Outcome of a degraded-queue admission attempt.
 */
public enum AdmissionResult {
    ADMITTED,
    REJECTED
}
