package gpulane.coordinator.lane;

import gpulane.coordinator.model.LaneState;

/**
 * Notified after a lane state change has been committed.
 */
@FunctionalInterface
public interface LaneTransitionListener {

    void onTransition(LaneState previous, LaneState current);
}
