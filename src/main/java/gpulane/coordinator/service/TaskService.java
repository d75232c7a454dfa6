package gpulane.coordinator.service;

import gpulane.coordinator.admission.AdmissionController;
import gpulane.coordinator.admission.QueueExpiryHandler;
import gpulane.coordinator.execution.WorkerErrors;
import gpulane.coordinator.model.Task;
import gpulane.coordinator.model.TaskStatus;
import gpulane.coordinator.model.TransitionResult;
import gpulane.coordinator.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Optional;

/**
 * Service layer for task reads and worker callbacks.
 * Callbacks are idempotent: a task that already reached a terminal state is left
 * untouched and the caller gets {@link TransitionResult#ALREADY_TERMINAL}.
 */
public class TaskService {

    private static final Logger log = LoggerFactory.getLogger(TaskService.class);

    private final TaskRepository taskRepository;
    private final AdmissionController admission;
    private final QueueExpiryHandler expiryHandler;
    private final Clock clock;
    private final String gpuClass;

    public TaskService(TaskRepository taskRepository, AdmissionController admission,
            QueueExpiryHandler expiryHandler, Clock clock, String gpuClass) {
        this.taskRepository = taskRepository;
        this.admission = admission;
        this.expiryHandler = expiryHandler;
        this.clock = clock;
        this.gpuClass = gpuClass;
    }

    public Optional<Task> findTask(String taskId) {
        requireTaskId(taskId);
        return taskRepository.findById(taskId);
    }

    /**
     * Worker picked the task up. A degraded task whose queue wait already
     * expired is failed instead of started.
     */
    public TransitionResult start(String taskId) {
        requireTaskId(taskId);
        if (admission.holds(taskId) && !admission.markStarted(taskId)) {
            Task task = taskRepository.findById(taskId).orElse(null);
            if (task == null) {
                return TransitionResult.NOT_FOUND;
            }
            expiryHandler.expire(task.id(), task.model(), task.createdAt());
            return TransitionResult.ALREADY_TERMINAL;
        }
        return taskRepository.markProcessing(taskId, clock.instant());
    }

    public TransitionResult reportProgress(String taskId, int progress, String stage) {
        requireTaskId(taskId);
        if (progress < 0 || progress > 100) {
            throw new IllegalArgumentException("progress must be within 0..100");
        }
        return taskRepository.updateProgress(taskId, progress, stage, clock.instant());
    }

    public TransitionResult complete(String taskId, String resultLocation) {
        requireTaskId(taskId);
        if (resultLocation == null || resultLocation.isBlank()) {
            throw new IllegalArgumentException("result_location is required");
        }
        TransitionResult result = taskRepository.complete(taskId, resultLocation, clock.instant());
        if (result == TransitionResult.APPLIED) {
            admission.release(taskId);
            log.info("Task {} completed by worker callback", taskId);
        }
        return result;
    }

    /**
     * @param errorType worker-side error class, stored as the stage
     */
    public TransitionResult fail(String taskId, String error, String errorType) {
        requireTaskId(taskId);
        WorkerErrors.WorkerFailure failure = WorkerErrors.describe(error, errorType, gpuClass);
        TransitionResult result = taskRepository.fail(taskId, failure.message(), failure.stage(), clock.instant());
        if (result == TransitionResult.APPLIED) {
            admission.release(taskId);
            log.info("Task {} failed by worker callback: {}", taskId, failure.message());
        }
        return result;
    }

    public int countPending() {
        return taskRepository.countByStatus(TaskStatus.PENDING);
    }

    public int countProcessing() {
        return taskRepository.countByStatus(TaskStatus.PROCESSING);
    }

    private static void requireTaskId(String taskId) {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("taskId is required");
        }
    }
}
