package gpulane.coordinator.admission;

/**
 * Admission outcome together with the queue depth observed when it was made.
 */
public record AdmissionDecision(AdmissionResult result, int depth, int maxDepth) {

    public boolean admitted() {
        return result == AdmissionResult.ADMITTED;
    }
}
