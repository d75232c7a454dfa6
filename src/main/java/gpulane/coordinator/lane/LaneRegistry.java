package gpulane.coordinator.lane;

import gpulane.coordinator.diagnostics.DiagnosticsEmitter;
import gpulane.coordinator.model.DiagnosticEventType;
import gpulane.coordinator.model.FallbackReason;
import gpulane.coordinator.model.LaneAvailability;
import gpulane.coordinator.model.LaneMode;
import gpulane.coordinator.model.LaneState;
import gpulane.coordinator.model.MemoryDiagnosticEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

/**
 * State machine of the dedicated video lanes, one per heavy model.
 *
 * <p>
 * Availability: {@code ready -> cold} on idle eviction or recycling,
 * {@code ready|cold -> unavailable} on capacity or quota denial or a health
 * failure lasting at least the grace period, {@code unavailable -> ready} once
 * capacity is restored and a health probe succeeds, {@code cold -> ready} when
 * warm-up finishes.
 *
 * <p>
 * Mode: {@code dedicated -> degraded_shared} on capacity or quota denial,
 * manual fallback or an assignment timeout; back to {@code dedicated} once
 * capacity is restored and a health probe confirms readiness.
 *
 * <p>
 * Each lane has its own lock, so read-decide-mutate is atomic per lane and
 * lanes never contend with each other. {@link #resolve(String)} never mutates.
 */
public class LaneRegistry {

    private static final Logger log = LoggerFactory.getLogger(LaneRegistry.class);

    private final Map<String, Lane> lanes;
    private final Duration healthGrace;
    private final Clock clock;
    private final DiagnosticsEmitter diagnostics;
    private final List<LaneTransitionListener> listeners = new CopyOnWriteArrayList<>();

    public LaneRegistry(Collection<String> laneKeys, Duration healthGrace, Clock clock,
            DiagnosticsEmitter diagnostics) {
        this.healthGrace = healthGrace;
        this.clock = clock;
        this.diagnostics = diagnostics;

        Map<String, Lane> byKey = new LinkedHashMap<>();
        Instant now = clock.instant();
        for (String key : laneKeys) {
            byKey.put(key, new Lane(LaneState.initial(key, now)));
        }
        this.lanes = Collections.unmodifiableMap(byKey);
        log.info("Lane registry created for {}", byKey.keySet());
    }

    public void addListener(LaneTransitionListener listener) {
        listeners.add(listener);
    }

    public boolean contains(String laneKey) {
        return laneKey != null && lanes.containsKey(laneKey);
    }

    /**
     * Current snapshot of a lane. Read-only.
     */
    public LaneState resolve(String laneKey) {
        Lane lane = lane(laneKey);
        lane.lock.lock();
        try {
            return lane.state;
        } finally {
            lane.lock.unlock();
        }
    }

    /**
     * Snapshots of all lanes in registration order.
     */
    public List<LaneState> snapshot() {
        List<LaneState> states = new ArrayList<>(lanes.size());
        for (String key : lanes.keySet()) {
            states.add(resolve(key));
        }
        return states;
    }

    /**
     * Apply a health or capacity callback atomically and return the resulting state.
     */
    public LaneState apply(String laneKey, LaneSignal signal) {
        Lane lane = lane(laneKey);
        Instant now = clock.instant();
        LaneState previous;
        LaneState next;

        lane.lock.lock();
        try {
            previous = lane.state;
            next = switch (signal) {
                case HEALTH_OK -> onHealthOk(lane, now);
                case HEALTH_FAILED -> onHealthFailed(lane, now);
                case CAPACITY_DENIED -> onDenied(lane, FallbackReason.CAPACITY, now);
                case QUOTA_DENIED -> onDenied(lane, FallbackReason.QUOTA, now);
                case CAPACITY_RESTORED -> {
                    lane.awaitingRestore = false;
                    yield lane.state;
                }
                case IDLE, RECYCLED -> lane.state.availability() == LaneAvailability.READY
                        ? lane.state.withAvailability(LaneAvailability.COLD, false, now)
                        : lane.state.withAvailability(lane.state.availability(), false, now);
                case WARMED -> lane.state.availability() == LaneAvailability.COLD
                        ? lane.state.withAvailability(LaneAvailability.READY, true, now)
                        : lane.state;
                case MANUAL_FALLBACK -> {
                    lane.awaitingRestore = true;
                    yield lane.state.mode() == LaneMode.DEGRADED_SHARED
                            ? lane.state
                            : lane.state.degraded(FallbackReason.MANUAL, now);
                }
            };
            lane.state = next;
        } finally {
            lane.lock.unlock();
        }

        log.debug("Lane {} signal {}: {} -> {}", laneKey, signal.wireName(), describe(previous), describe(next));
        publish(previous, next);
        return next;
    }

    /**
     * A request for this lane waited past the assignment timeout without starting.
     * Switches the lane to degraded mode with reason {@code capacity}.
     */
    public LaneState reportAssignmentTimeout(String laneKey) {
        Lane lane = lane(laneKey);
        Instant now = clock.instant();
        LaneState previous;
        LaneState next;

        lane.lock.lock();
        try {
            previous = lane.state;
            next = previous.mode() == LaneMode.DEDICATED
                    ? previous.degraded(FallbackReason.CAPACITY, now)
                    : previous;
            lane.state = next;
        } finally {
            lane.lock.unlock();
        }

        if (previous != next) {
            log.warn("Lane {} not assigned in time, falling back to shared worker", laneKey);
        }
        publish(previous, next);
        return next;
    }

    /**
     * Re-check lanes whose health probes keep failing; called periodically so the
     * grace period expires even when no further probe arrives.
     */
    public void evaluateHealth() {
        Instant now = clock.instant();
        for (Lane lane : lanes.values()) {
            LaneState previous;
            LaneState next;
            lane.lock.lock();
            try {
                previous = lane.state;
                next = expireHealthGrace(lane, now);
                lane.state = next;
            } finally {
                lane.lock.unlock();
            }
            publish(previous, next);
        }
    }

    // ==================== Transitions (lane lock held) ====================

    private LaneState onHealthOk(Lane lane, Instant now) {
        lane.healthFailingSince = null;
        LaneState state = lane.state;
        if (lane.awaitingRestore) {
            // capacity_restored has not arrived yet
            return state;
        }
        if (state.availability() == LaneAvailability.UNAVAILABLE) {
            state = state.withAvailability(LaneAvailability.READY, true, now);
        }
        if (state.mode() == LaneMode.DEGRADED_SHARED && state.availability() == LaneAvailability.READY) {
            state = state.dedicated(now);
        }
        return state;
    }

    private LaneState onHealthFailed(Lane lane, Instant now) {
        if (lane.healthFailingSince == null) {
            lane.healthFailingSince = now;
        }
        return expireHealthGrace(lane, now);
    }

    private LaneState expireHealthGrace(Lane lane, Instant now) {
        LaneState state = lane.state;
        if (lane.healthFailingSince == null || state.availability() == LaneAvailability.UNAVAILABLE) {
            return state;
        }
        Duration failing = Duration.between(lane.healthFailingSince, now);
        if (failing.compareTo(healthGrace) >= 0) {
            log.warn("Lane {} health failing for {}s, marking unavailable", state.laneKey(), failing.toSeconds());
            return state.withAvailability(LaneAvailability.UNAVAILABLE, false, now);
        }
        return state;
    }

    private LaneState onDenied(Lane lane, FallbackReason reason, Instant now) {
        lane.awaitingRestore = true;
        LaneState state = lane.state;
        if (state.availability() != LaneAvailability.UNAVAILABLE) {
            state = state.withAvailability(LaneAvailability.UNAVAILABLE, false, now);
        }
        if (state.mode() == LaneMode.DEDICATED) {
            state = state.degraded(reason, now);
        }
        return state;
    }

    // ==================== Notification ====================

    private void publish(LaneState previous, LaneState current) {
        if (previous == current) {
            return;
        }

        if (previous.mode() != current.mode()) {
            if (current.mode() == LaneMode.DEGRADED_SHARED) {
                log.info("Lane {} switched to degraded_shared (reason={})",
                        current.laneKey(), current.fallbackReason().wireName());
                diagnostics.emit(MemoryDiagnosticEvent.builder(DiagnosticEventType.FALLBACK_ACTIVATED)
                        .model(current.laneKey())
                        .laneMode(current.mode())
                        .reason(current.fallbackReason())
                        .timestamp(current.updatedAt())
                        .build());
            } else {
                log.info("Lane {} recovered to dedicated", current.laneKey());
                diagnostics.emit(MemoryDiagnosticEvent.builder(DiagnosticEventType.LANE_RECOVERED)
                        .model(current.laneKey())
                        .laneMode(current.mode())
                        .reason(previous.fallbackReason())
                        .timestamp(current.updatedAt())
                        .build());
            }
        }

        if (!previous.warm() && current.warm() && current.availability() == LaneAvailability.READY) {
            diagnostics.emit(MemoryDiagnosticEvent.builder(DiagnosticEventType.WARM_LANE_READY)
                    .model(current.laneKey())
                    .laneMode(current.mode())
                    .timestamp(current.updatedAt())
                    .build());
        }

        for (LaneTransitionListener listener : listeners) {
            try {
                listener.onTransition(previous, current);
            } catch (RuntimeException e) {
                log.error("Lane listener failed for {}", current.laneKey(), e);
            }
        }
    }

    private Lane lane(String laneKey) {
        Lane lane = laneKey == null ? null : lanes.get(laneKey);
        if (lane == null) {
            throw new IllegalArgumentException("unknown lane: " + laneKey);
        }
        return lane;
    }

    private static String describe(LaneState state) {
        return state.availability().wireName() + "/" + state.mode().wireName() + (state.warm() ? "/warm" : "");
    }

    private static final class Lane {
        private final ReentrantLock lock = new ReentrantLock();
        private LaneState state;
        private Instant healthFailingSince;
        private boolean awaitingRestore;

        private Lane(LaneState initial) {
            this.state = initial;
        }
    }
}
