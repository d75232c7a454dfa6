package gpulane.coordinator.admission;

import gpulane.coordinator.diagnostics.DiagnosticsEmitter;
import gpulane.coordinator.model.DegradedQueuePolicy;
import gpulane.coordinator.model.DiagnosticEventType;
import gpulane.coordinator.model.LaneMode;
import gpulane.coordinator.model.MemoryDiagnosticEvent;
import gpulane.coordinator.model.TransitionResult;
import gpulane.coordinator.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Turns a degraded-queue wait breach into a failed task with the overflow code.
 * Whoever commits the failure first emits the {@code queue_timeout} event.
 */
public class QueueExpiryHandler {

    private static final Logger log = LoggerFactory.getLogger(QueueExpiryHandler.class);

    private final TaskRepository taskRepository;
    private final DiagnosticsEmitter diagnostics;
    private final DegradedQueuePolicy policy;
    private final Clock clock;

    public QueueExpiryHandler(TaskRepository taskRepository, DiagnosticsEmitter diagnostics,
            DegradedQueuePolicy policy, Clock clock) {
        this.taskRepository = taskRepository;
        this.diagnostics = diagnostics;
        this.policy = policy;
        this.clock = clock;
    }

    public String errorMessage() {
        return policy.overflowCode() + ": Generation queue wait exceeded " + policy.maxWaitSeconds() + " seconds.";
    }

    /**
     * Fail a task whose ticket expired before it could start.
     *
     * @return true if this call failed the task
     */
    public boolean expire(String taskId, String model, Instant arrival) {
        Instant now = clock.instant();
        TransitionResult result = taskRepository.fail(taskId, errorMessage(), "queue_timeout", now);
        if (result != TransitionResult.APPLIED) {
            log.debug("Queue expiry for task {} ignored: {}", taskId, result);
            return false;
        }

        long waited = arrival != null ? Duration.between(arrival, now).toSeconds() : policy.maxWaitSeconds();
        log.warn("Task {} ({}) failed after waiting {}s in degraded queue", taskId, model, waited);
        diagnostics.emit(MemoryDiagnosticEvent.builder(DiagnosticEventType.QUEUE_TIMEOUT)
                .taskId(taskId)
                .model(model)
                .laneMode(LaneMode.DEGRADED_SHARED)
                .value(waited)
                .reason("queue_wait_exceeded")
                .timestamp(now)
                .build());
        return true;
    }

    public boolean expire(QueueTicket ticket) {
        return expire(ticket.taskId(), ticket.model(), ticket.arrival());
    }
}
