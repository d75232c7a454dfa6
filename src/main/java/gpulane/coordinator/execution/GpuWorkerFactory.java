package gpulane.coordinator.execution;

/**
 * Creates the worker behind one execution lane.
 */
@FunctionalInterface
public interface GpuWorkerFactory {

    GpuWorker create(String laneName);
}
