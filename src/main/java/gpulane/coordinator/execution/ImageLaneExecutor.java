package gpulane.coordinator.execution;

import gpulane.coordinator.diagnostics.DiagnosticsEmitter;
import gpulane.coordinator.model.Task;
import gpulane.coordinator.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.HashSet;
import java.util.Set;

/**
 * Lane for the light image models. Runs a bounded number of generations
 * concurrently and keeps every loaded image pipeline resident.
 */
public class ImageLaneExecutor extends LaneExecutor {

    private static final Logger log = LoggerFactory.getLogger(ImageLaneExecutor.class);

    private final Set<String> loaded = new HashSet<>();

    public ImageLaneExecutor(int concurrency, GpuWorker worker, TaskRepository taskRepository,
            DiagnosticsEmitter diagnostics, Clock clock, String gpuClass) {
        super("image", concurrency, worker, taskRepository, diagnostics, clock, gpuClass);
    }

    @Override
    protected void preparePipeline(Task task) {
        synchronized (loaded) {
            if (loaded.add(task.model())) {
                try {
                    worker.loadPipeline(task.model());
                    log.info("Image lane loaded {}", task.model());
                } catch (RuntimeException e) {
                    loaded.remove(task.model());
                    throw e;
                }
            }
        }
    }
}
