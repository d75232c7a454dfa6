package gpulane.coordinator.execution;

import gpulane.coordinator.lane.LaneTransitionListener;
import gpulane.coordinator.model.LaneState;
import gpulane.coordinator.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The dedicated lanes, one per heavy model. Follows lane state changes:
 * losing {@code warm} evicts the pipeline, regaining it warms the lane up.
 */
public class DedicatedLanePool implements LaneTransitionListener, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DedicatedLanePool.class);

    private final Map<String, DedicatedLaneExecutor> lanes;

    public DedicatedLanePool(Collection<DedicatedLaneExecutor> executors) {
        Map<String, DedicatedLaneExecutor> byModel = new LinkedHashMap<>();
        for (DedicatedLaneExecutor executor : executors) {
            byModel.put(executor.model(), executor);
        }
        this.lanes = Collections.unmodifiableMap(byModel);
    }

    public void submit(Task task) {
        lane(task.model()).submit(task);
    }

    public DedicatedLaneExecutor lane(String model) {
        DedicatedLaneExecutor lane = lanes.get(model);
        if (lane == null) {
            throw new IllegalArgumentException("no dedicated lane for model " + model);
        }
        return lane;
    }

    public Collection<DedicatedLaneExecutor> lanes() {
        return lanes.values();
    }

    public void warmUpAll() {
        lanes.values().forEach(DedicatedLaneExecutor::warmUp);
    }

    @Override
    public void onTransition(LaneState previous, LaneState current) {
        DedicatedLaneExecutor lane = lanes.get(current.laneKey());
        if (lane == null) {
            return;
        }
        if (previous.warm() && !current.warm()) {
            log.info("Lane {} went {}, evicting pipeline", current.laneKey(), current.availability().wireName());
            lane.evict();
        } else if (!previous.warm() && current.warm()) {
            lane.warmUp();
        }
    }

    @Override
    public void close() {
        lanes.values().forEach(DedicatedLaneExecutor::close);
    }
}
