package gpulane.coordinator.scheduler;

import gpulane.coordinator.execution.DedicatedLaneExecutor;
import gpulane.coordinator.execution.DedicatedLanePool;
import gpulane.coordinator.lane.LaneRegistry;
import gpulane.coordinator.model.LaneMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Watches the dedicated lanes. A lane whose oldest queued request has waited
 * longer than the assignment timeout falls back to the shared worker; lanes with
 * failing health probes are re-evaluated against the health grace period.
 *
 * <p>
 * The assignment timeout runs independently of the degraded queue's max wait.
 */
public class LaneAssignmentMonitor implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(LaneAssignmentMonitor.class);

    private final LaneRegistry laneRegistry;
    private final DedicatedLanePool dedicatedLanes;
    private final Duration assignmentTimeout;
    private final Clock clock;

    public LaneAssignmentMonitor(LaneRegistry laneRegistry, DedicatedLanePool dedicatedLanes,
            Duration assignmentTimeout, Clock clock) {
        this.laneRegistry = laneRegistry;
        this.dedicatedLanes = dedicatedLanes;
        this.assignmentTimeout = assignmentTimeout;
        this.clock = clock;
    }

    @Override
    public void run() {
        try {
            check();
        } catch (Exception e) {
            log.error("Lane assignment monitor error", e);
        }
    }

    /**
     * @return number of lanes switched to degraded mode by this check
     */
    public int check() {
        laneRegistry.evaluateHealth();

        Instant now = clock.instant();
        int fallbacks = 0;
        for (DedicatedLaneExecutor lane : dedicatedLanes.lanes()) {
            Optional<Instant> oldest = lane.oldestQueuedSince();
            if (oldest.isEmpty() || Duration.between(oldest.get(), now).compareTo(assignmentTimeout) < 0) {
                continue;
            }
            if (laneRegistry.resolve(lane.model()).mode() == LaneMode.DEDICATED) {
                laneRegistry.reportAssignmentTimeout(lane.model());
                fallbacks++;
            }
        }
        return fallbacks;
    }
}
