package gpulane.coordinator.execution;

/**
 * Maps worker errors to the message and stage stored on a failed task.
 */
public final class WorkerErrors {

    public static final String GPU_MEMORY_EXCEEDED = "gpu_memory_exceeded";
    public static final String GPU_OOM_STAGE = "gpu_oom";

    private static final String CUDA_OOM_MARKER = "CUDA out of memory";

    private WorkerErrors() {
    }

    public record WorkerFailure(String message, String stage) {
    }

    public static WorkerFailure describe(Throwable error, String gpuClass) {
        if (error instanceof OutOfMemoryError) {
            return outOfMemory(gpuClass);
        }
        return describe(error.getMessage(), error.getClass().getSimpleName(), gpuClass);
    }

    /**
     * Same mapping for an error reported by an out-of-process worker.
     *
     * @param errorType short error class name, used as the stage
     */
    public static WorkerFailure describe(String message, String errorType, String gpuClass) {
        String type = errorType == null || errorType.isBlank() ? "worker_error" : errorType;
        if (message == null || message.isBlank()) {
            message = type;
        }
        if (message.contains(CUDA_OOM_MARKER)) {
            return outOfMemory(gpuClass);
        }
        return new WorkerFailure(message, type);
    }

    private static WorkerFailure outOfMemory(String gpuClass) {
        return new WorkerFailure(GPU_MEMORY_EXCEEDED + ": GPU memory exhausted during generation. "
                + "Reduce resolution or frame count and retry. (gpu=" + gpuClass + ")", GPU_OOM_STAGE);
    }
}
