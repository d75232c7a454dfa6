package gpulane.coordinator.execution;

import gpulane.coordinator.diagnostics.DiagnosticsEmitter;
import gpulane.coordinator.model.DiagnosticEventType;
import gpulane.coordinator.model.MemoryDiagnosticEvent;
import gpulane.coordinator.model.Task;
import gpulane.coordinator.model.TransitionResult;
import gpulane.coordinator.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Runs tasks on one GPU worker.
 *
 * <p>
 * Every attempt goes: {@link #beforeStart(Task)} -> PENDING to PROCESSING ->
 * {@link #preparePipeline(Task)} -> generate -> DONE or FAILED, and always
 * ends with a cache cleanup, the memory diagnostics and {@link #afterAttempt(Task)}.
 * All task writes are conditional, so a task the reaper already failed stays failed.
 */
public abstract class LaneExecutor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LaneExecutor.class);

    private final String name;
    private final ExecutorService executor;
    private final Map<String, Instant> queued = new ConcurrentHashMap<>();

    protected final GpuWorker worker;
    protected final TaskRepository taskRepository;
    protected final DiagnosticsEmitter diagnostics;
    protected final Clock clock;
    private final String gpuClass;

    protected LaneExecutor(String name, int threads, GpuWorker worker, TaskRepository taskRepository,
            DiagnosticsEmitter diagnostics, Clock clock, String gpuClass) {
        this.name = name;
        this.executor = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "lane-" + name);
            t.setDaemon(true);
            return t;
        });
        this.worker = worker;
        this.taskRepository = taskRepository;
        this.diagnostics = diagnostics;
        this.clock = clock;
        this.gpuClass = gpuClass;
    }

    public String name() {
        return name;
    }

    /**
     * Queue a persisted PENDING task on this lane. A closed lane fails the task.
     */
    public void submit(Task task) {
        if (!trySubmit(task)) {
            taskRepository.fail(task.id(), "Execution lane " + name + " is shut down", "lane_closed",
                    clock.instant());
            afterAttempt(task);
        }
    }

    /**
     * Queue a persisted PENDING task on this lane.
     *
     * @return false if the lane no longer takes work; the task is left untouched
     */
    public boolean trySubmit(Task task) {
        queued.put(task.id(), clock.instant());
        try {
            executor.execute(() -> run(task));
            log.debug("Task {} queued on lane {}", task.id(), name);
            return true;
        } catch (RejectedExecutionException e) {
            queued.remove(task.id());
            log.warn("Lane {} rejected task {}: executor shut down", name, task.id());
            return false;
        }
    }

    public boolean isAccepting() {
        return !executor.isShutdown();
    }

    /**
     * Submission time of the oldest task still waiting for this lane's thread.
     */
    public Optional<Instant> oldestQueuedSince() {
        return queued.values().stream().min(Instant::compareTo);
    }

    public int queuedCount() {
        return queued.size();
    }

    /**
     * Run something on the lane's own thread, serialised with generations.
     */
    protected void runOnLane(Runnable action) {
        try {
            executor.execute(action);
        } catch (RejectedExecutionException e) {
            log.debug("Lane {} closed, skipping maintenance action", name);
        }
    }

    private void run(Task task) {
        queued.remove(task.id());

        if (!beforeStart(task)) {
            return;
        }
        try {
            attempt(task);
        } finally {
            afterAttempt(task);
        }
    }

    private void attempt(Task task) {
        TransitionResult started;
        try {
            started = taskRepository.markProcessing(task.id(), clock.instant());
        } catch (RuntimeException e) {
            log.error("Task {} could not be started on lane {}", task.id(), name, e);
            return;
        }
        if (started != TransitionResult.APPLIED) {
            log.info("Task {} not started on lane {}: {}", task.id(), name, started);
            return;
        }

        try {
            preparePipeline(task);
            GenerationResult result = worker.generate(task,
                    (percent, stage) -> taskRepository.updateProgress(task.id(), percent, stage, clock.instant()));

            TransitionResult done = taskRepository.complete(task.id(), result.resultLocation(), clock.instant());
            if (done == TransitionResult.APPLIED) {
                log.info("Task {} ({}) done on lane {}", task.id(), task.model(), name);
            } else {
                log.warn("Result of task {} discarded on lane {}: {}", task.id(), name, done);
            }
        } catch (Throwable e) {
            WorkerErrors.WorkerFailure failure = WorkerErrors.describe(e, gpuClass);
            log.warn("Task {} ({}) failed on lane {}: {}", task.id(), task.model(), name, failure.message());
            TransitionResult failed = taskRepository.fail(task.id(), failure.message(), failure.stage(),
                    clock.instant());
            if (failed != TransitionResult.APPLIED) {
                log.debug("Failure of task {} not recorded: {}", task.id(), failed);
            }
            // errors other than an OOM still take the lane thread down
            if (e instanceof Error && !(e instanceof OutOfMemoryError)) {
                throw (Error) e;
            }
        } finally {
            recordMemory(task);
        }
    }

    private void recordMemory(Task task) {
        try {
            worker.clearCache();
        } catch (RuntimeException e) {
            log.warn("Cache cleanup failed on lane {}: {}", name, e.getMessage());
        }
        diagnostics.emit(MemoryDiagnosticEvent.builder(DiagnosticEventType.MEMORY_CLEANUP)
                .taskId(task.id())
                .model(task.model())
                .laneMode(task.laneMode())
                .reason("post_generation")
                .timestamp(clock.instant())
                .build());

        OptionalDouble allocated = OptionalDouble.empty();
        try {
            allocated = worker.allocatedMemoryGib();
        } catch (RuntimeException e) {
            log.debug("Worker on lane {} cannot report memory: {}", name, e.getMessage());
        }
        if (allocated.isPresent()) {
            diagnostics.emit(MemoryDiagnosticEvent.builder(DiagnosticEventType.MEMORY_POST_GENERATION)
                    .taskId(task.id())
                    .model(task.model())
                    .laneMode(task.laneMode())
                    .value(String.format(Locale.ROOT, "%.2f", allocated.getAsDouble()))
                    .timestamp(clock.instant())
                    .build());
        }
    }

    /**
     * Gate checked on the lane thread before the task is marked PROCESSING.
     *
     * @return false to drop the task; the implementation handles its failure
     */
    protected boolean beforeStart(Task task) {
        return true;
    }

    /**
     * Make sure the task's model is loaded on the worker.
     */
    protected abstract void preparePipeline(Task task);

    /**
     * Release whatever the attempt held. Runs once per started or refused attempt.
     */
    protected void afterAttempt(Task task) {
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Lane {} forcefully stopped", name);
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
