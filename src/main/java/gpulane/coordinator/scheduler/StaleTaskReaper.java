package gpulane.coordinator.scheduler;

import gpulane.coordinator.admission.AdmissionController;
import gpulane.coordinator.diagnostics.DiagnosticsEmitter;
import gpulane.coordinator.model.DiagnosticEventType;
import gpulane.coordinator.model.GenerationKind;
import gpulane.coordinator.model.MemoryDiagnosticEvent;
import gpulane.coordinator.model.Task;
import gpulane.coordinator.model.TaskStatus;
import gpulane.coordinator.model.TransitionResult;
import gpulane.coordinator.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Background task that force-fails tasks stuck past their kind's TTL
 * (image 10 minutes, video 30 minutes).
 *
 * <p>
 * Tasks can get stuck if a worker crashes, is preempted or never reports back.
 * PROCESSING tasks are measured from startedAt, PENDING ones from createdAt.
 * Each failure is a conditional update, so a task is reaped exactly once and a
 * late worker callback finds it already terminal.
 */
public class StaleTaskReaper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(StaleTaskReaper.class);
    static final String STALE_REASON = "stale_task";

    private final TaskRepository taskRepository;
    private final AdmissionController admission;
    private final DiagnosticsEmitter diagnostics;
    private final Clock clock;

    public StaleTaskReaper(TaskRepository taskRepository, AdmissionController admission,
            DiagnosticsEmitter diagnostics, Clock clock) {
        this.taskRepository = taskRepository;
        this.admission = admission;
        this.diagnostics = diagnostics;
        this.clock = clock;
    }

    @Override
    public void run() {
        try {
            reapStaleTasks();
        } catch (Exception e) {
            log.error("Stale task reaper error", e);
        }
    }

    /**
     * Fail every stale PROCESSING or PENDING task.
     *
     * @return number of tasks this sweep failed
     */
    public int reapStaleTasks() {
        Instant now = clock.instant();
        int reaped = 0;
        for (GenerationKind kind : GenerationKind.values()) {
            Instant cutoff = now.minus(kind.processingTtl());
            reaped += reap(TaskStatus.PROCESSING, kind, cutoff, now);
            reaped += reap(TaskStatus.PENDING, kind, cutoff, now);
        }
        if (reaped > 0) {
            log.info("Stale task reaper: {} tasks failed", reaped);
        } else {
            log.debug("No stale tasks found");
        }
        return reaped;
    }

    /**
     * Deterministic timeout message, e.g.
     * {@code Task timed out: video task exceeded 30 minutes in processing}.
     */
    public static String timeoutMessage(GenerationKind kind, TaskStatus status) {
        return "Task timed out: " + kind.wireName() + " task exceeded " + kind.processingTtl().toMinutes()
                + " minutes in " + status.wireName();
    }

    private int reap(TaskStatus status, GenerationKind kind, Instant cutoff, Instant now) {
        List<Task> stale = taskRepository.findStale(status, kind, cutoff);
        int failed = 0;
        for (Task task : stale) {
            try {
                TransitionResult result = taskRepository.failIfStale(task.id(), status, cutoff,
                        timeoutMessage(kind, status), STALE_REASON, now);
                if (result != TransitionResult.APPLIED) {
                    // completed or failed by its worker since the query
                    log.debug("Stale task {} skipped: {}", task.id(), result);
                    continue;
                }
                failed++;
                admission.release(task.id());
                log.warn("Task {} ({}) force-failed after {} minutes in {}", task.id(), task.model(),
                        kind.processingTtl().toMinutes(), status.wireName());
                diagnostics.emit(MemoryDiagnosticEvent.builder(DiagnosticEventType.QUEUE_TIMEOUT)
                        .taskId(task.id())
                        .model(task.model())
                        .laneMode(task.laneMode())
                        .value(kind.processingTtl().toMinutes())
                        .reason(STALE_REASON)
                        .timestamp(now)
                        .build());
            } catch (Exception e) {
                log.error("Failed to reap task {}", task.id(), e);
            }
        }
        return failed;
    }
}
