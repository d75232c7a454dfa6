package gpulane.coordinator.execution;

import gpulane.coordinator.diagnostics.DiagnosticsEmitter;
import gpulane.coordinator.model.Task;
import gpulane.coordinator.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Single-threaded lane reserved for one heavy model. The pipeline is loaded
 * once and kept resident across requests; only {@link #evict()} (idle eviction
 * or worker recycling) unloads it.
 */
public class DedicatedLaneExecutor extends LaneExecutor {

    private static final Logger log = LoggerFactory.getLogger(DedicatedLaneExecutor.class);

    private final String model;
    private final AtomicInteger loadCount = new AtomicInteger();
    private final AtomicInteger unloadCount = new AtomicInteger();

    // written only on the lane thread
    private volatile boolean loaded;

    public DedicatedLaneExecutor(String model, GpuWorker worker, TaskRepository taskRepository,
            DiagnosticsEmitter diagnostics, Clock clock, String gpuClass) {
        super(model, 1, worker, taskRepository, diagnostics, clock, gpuClass);
        this.model = model;
    }

    public String model() {
        return model;
    }

    /**
     * Load the pipeline ahead of the first request.
     */
    public void warmUp() {
        runOnLane(() -> {
            try {
                ensureLoaded();
            } catch (RuntimeException e) {
                log.warn("Lane {} warm-up failed: {}", model, e.getMessage());
            }
        });
    }

    /**
     * Unload the pipeline. Queued requests load it again on demand.
     */
    public void evict() {
        runOnLane(() -> {
            if (!loaded) {
                return;
            }
            try {
                worker.unloadPipeline(model);
            } catch (RuntimeException e) {
                log.warn("Lane {} unload failed, dropping pipeline reference: {}", model, e.getMessage());
            }
            loaded = false;
            unloadCount.incrementAndGet();
            log.info("Lane {} pipeline unloaded", model);
        });
    }

    public boolean isLoaded() {
        return loaded;
    }

    /** Number of times the pipeline was loaded since start */
    public int loadCount() {
        return loadCount.get();
    }

    public int unloadCount() {
        return unloadCount.get();
    }

    @Override
    protected void preparePipeline(Task task) {
        if (!model.equals(task.model())) {
            throw new IllegalStateException("Lane " + model + " cannot run model " + task.model());
        }
        ensureLoaded();
    }

    private void ensureLoaded() {
        if (!loaded) {
            worker.loadPipeline(model);
            loaded = true;
            log.info("Lane {} pipeline loaded (load #{})", model, loadCount.incrementAndGet());
        }
    }
}
