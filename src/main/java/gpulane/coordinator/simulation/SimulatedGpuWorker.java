package gpulane.coordinator.simulation;

import gpulane.coordinator.config.ModelCatalog;
import gpulane.coordinator.config.ModelSpec;
import gpulane.coordinator.execution.GenerationResult;
import gpulane.coordinator.execution.GpuWorker;
import gpulane.coordinator.execution.ProgressListener;
import gpulane.coordinator.model.GenerationKind;
import gpulane.coordinator.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Stand-in for a GPU worker process: sleeps instead of running inference,
 * reports progress in four steps and tracks resident pipeline memory.
 * Fails a configurable share of generations with a CUDA out-of-memory error.
 */
public final class SimulatedGpuWorker implements GpuWorker {

    private static final Logger log = LoggerFactory.getLogger(SimulatedGpuWorker.class);

    private static final double VIDEO_PIPELINE_GIB = 18.5;
    private static final double IMAGE_PIPELINE_GIB = 6.0;
    private static final double CACHE_GIB = 1.25;

    private final String laneName;
    private final ModelCatalog catalog;
    private final int delayMinMs;
    private final int delayMaxMs;
    private final double oomRate;

    private final Map<String, Double> resident = new LinkedHashMap<>();
    private double cached;

    public SimulatedGpuWorker(String laneName, ModelCatalog catalog, int delayMinMs, int delayMaxMs,
            double oomRate) {
        this.laneName = laneName;
        this.catalog = catalog;
        this.delayMinMs = delayMinMs;
        this.delayMaxMs = delayMaxMs;
        this.oomRate = oomRate;
    }

    @Override
    public synchronized void loadPipeline(String model) {
        boolean heavy = catalog.find(model).map(ModelSpec::isHeavy).orElse(true);
        resident.put(model, heavy ? VIDEO_PIPELINE_GIB : IMAGE_PIPELINE_GIB);
        log.debug("Sim worker {} loaded {}", laneName, model);
    }

    @Override
    public synchronized void unloadPipeline(String model) {
        Double freed = resident.remove(model);
        if (freed != null) {
            // freed blocks stay in the allocator cache until clearCache()
            cached += freed;
        }
        log.debug("Sim worker {} unloaded {}", laneName, model);
    }

    @Override
    public synchronized void clearCache() {
        cached = 0;
    }

    @Override
    public GenerationResult generate(Task task, ProgressListener progress) {
        synchronized (this) {
            if (!resident.containsKey(task.model())) {
                throw new IllegalStateException("Pipeline for " + task.model() + " is not loaded");
            }
            cached += CACHE_GIB;
        }

        int delay = delayMinMs >= delayMaxMs ? delayMinMs
                : ThreadLocalRandom.current().nextInt(delayMinMs, delayMaxMs);
        String[] stages = { "encoding", "denoising", "decoding", "saving" };
        for (int i = 0; i < stages.length; i++) {
            sleep(delay / stages.length);
            progress.onProgress((i + 1) * 100 / (stages.length + 1), stages[i]);
        }

        if (oomRate > 0 && ThreadLocalRandom.current().nextDouble() < oomRate) {
            throw new IllegalStateException("CUDA out of memory. Tried to allocate 2.50 GiB");
        }

        String extension = task.kind() == GenerationKind.VIDEO ? ".mp4" : ".png";
        return new GenerationResult("sim://results/" + task.id() + extension);
    }

    @Override
    public synchronized OptionalDouble allocatedMemoryGib() {
        return OptionalDouble.of(resident.values().stream().mapToDouble(Double::doubleValue).sum() + cached);
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Generation interrupted", e);
        }
    }
}
