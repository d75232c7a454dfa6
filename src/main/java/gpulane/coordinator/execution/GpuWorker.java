package gpulane.coordinator.execution;

import gpulane.coordinator.model.Task;

import java.util.OptionalDouble;

/**
 * A GPU worker process running inference pipelines.
 * Implementations report failures by throwing unchecked exceptions whose
 * message is passed through to the task.
 */
public interface GpuWorker {

    /**
     * Load the model's pipeline into GPU memory.
     */
    void loadPipeline(String model);

    /**
     * Release the model's pipeline and its GPU memory.
     */
    void unloadPipeline(String model);

    /**
     * Garbage-collect and empty the allocator cache. Loaded pipelines stay resident.
     */
    void clearCache();

    /**
     * Run one generation with an already loaded pipeline.
     */
    GenerationResult generate(Task task, ProgressListener progress);

    /**
     * GPU memory currently allocated, when the worker can tell.
     */
    OptionalDouble allocatedMemoryGib();
}
