package gpulane.coordinator.routing;

import gpulane.coordinator.admission.AdmissionDecision;
import gpulane.coordinator.model.FallbackReason;
import gpulane.coordinator.model.LaneMode;
import gpulane.coordinator.validation.ValidationResult;

/**
 * Observable routing decision.
 *
 * @param outcome        what happened
 * @param taskId         created task, null when rejected
 * @param laneMode       lane mode the task runs in, null for rejections and image tasks
 * @param fallbackReason why the dedicated lane was bypassed, degraded only
 * @param validation     failed validation, REJECTED_INVALID only
 * @param admission      queue decision, degraded path only
 */
public record RouteDecision(
        RouteOutcome outcome,
        String taskId,
        LaneMode laneMode,
        FallbackReason fallbackReason,
        ValidationResult validation,
        AdmissionDecision admission) {

    /**
     * True when the request was sent to the shared worker instead of its own lane.
     */
    public boolean fallbackActivated() {
        return outcome == RouteOutcome.ACCEPTED_DEGRADED;
    }

    static RouteDecision dedicated(String taskId, LaneMode laneMode) {
        return new RouteDecision(RouteOutcome.ACCEPTED_DEDICATED, taskId, laneMode, null, null, null);
    }

    static RouteDecision degraded(String taskId, FallbackReason reason, AdmissionDecision admission) {
        return new RouteDecision(RouteOutcome.ACCEPTED_DEGRADED, taskId, LaneMode.DEGRADED_SHARED, reason, null,
                admission);
    }

    static RouteDecision overloaded(FallbackReason reason, AdmissionDecision admission) {
        return new RouteDecision(RouteOutcome.REJECTED_OVERLOADED, null, null, reason, null, admission);
    }

    static RouteDecision invalid(ValidationResult validation) {
        return new RouteDecision(RouteOutcome.REJECTED_INVALID, null, null, null, validation, null);
    }
}
