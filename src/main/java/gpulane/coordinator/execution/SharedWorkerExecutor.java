package gpulane.coordinator.execution;

import gpulane.coordinator.admission.AdmissionController;
import gpulane.coordinator.admission.QueueExpiryHandler;
import gpulane.coordinator.diagnostics.DiagnosticsEmitter;
import gpulane.coordinator.model.DiagnosticEventType;
import gpulane.coordinator.model.LaneMode;
import gpulane.coordinator.model.MemoryDiagnosticEvent;
import gpulane.coordinator.model.Task;
import gpulane.coordinator.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The shared worker used in degraded mode. Holds at most one heavy pipeline;
 * switching models always releases the previous one, clears the cache and only
 * then loads the new one.
 *
 * <p>
 * Tasks start only if their degraded-queue ticket is still valid; the ticket is
 * released after every attempt.
 */
public class SharedWorkerExecutor extends LaneExecutor {

    private static final Logger log = LoggerFactory.getLogger(SharedWorkerExecutor.class);

    private final AdmissionController admission;
    private final QueueExpiryHandler expiryHandler;
    private final AtomicInteger switchCount = new AtomicInteger();

    private volatile String residentModel;

    public SharedWorkerExecutor(GpuWorker worker, AdmissionController admission, QueueExpiryHandler expiryHandler,
            TaskRepository taskRepository, DiagnosticsEmitter diagnostics, Clock clock, String gpuClass) {
        super("shared", 1, worker, taskRepository, diagnostics, clock, gpuClass);
        this.admission = admission;
        this.expiryHandler = expiryHandler;
    }

    /** Model whose pipeline is currently loaded, or null */
    public String residentModel() {
        return residentModel;
    }

    /** Number of times a resident model was replaced by another one */
    public int switchCount() {
        return switchCount.get();
    }

    @Override
    protected boolean beforeStart(Task task) {
        if (admission.markStarted(task.id())) {
            return true;
        }
        expiryHandler.expire(task.id(), task.model(), task.createdAt());
        return false;
    }

    @Override
    protected void preparePipeline(Task task) {
        String target = task.model();
        if (target.equals(residentModel)) {
            return;
        }

        String previous = residentModel;
        if (previous != null) {
            worker.unloadPipeline(previous);
            residentModel = null;
            log.info("Shared worker released {}", previous);
        }

        worker.clearCache();
        if (previous != null) {
            switchCount.incrementAndGet();
            diagnostics.emit(MemoryDiagnosticEvent.builder(DiagnosticEventType.MEMORY_CLEANUP)
                    .taskId(task.id())
                    .model(target)
                    .laneMode(LaneMode.DEGRADED_SHARED)
                    .reason("model_switch")
                    .value(previous)
                    .timestamp(clock.instant())
                    .build());
        }

        worker.loadPipeline(target);
        residentModel = target;
        log.info("Shared worker loaded {} (previous: {})", target, previous);
    }

    @Override
    protected void afterAttempt(Task task) {
        admission.release(task.id());
    }
}
