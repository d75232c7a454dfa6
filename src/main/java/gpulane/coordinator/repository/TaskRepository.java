package gpulane.coordinator.repository;

import gpulane.coordinator.model.GenerationKind;
import gpulane.coordinator.model.Task;
import gpulane.coordinator.model.TaskStatus;
import gpulane.coordinator.model.TransitionResult;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for generation task persistence.
 * Every state change is a single conditional update, so a terminal status
 * is never overwritten: the first terminal transition wins and later ones
 * return {@link TransitionResult#ALREADY_TERMINAL}.
 */
public interface TaskRepository {

    /**
     * Persist a new task (normally in PENDING).
     */
    void save(Task task);

    /**
     * Find a task by ID.
     */
    Optional<Task> findById(String taskId);

    /**
     * PENDING -> PROCESSING. Sets startedAt.
     */
    TransitionResult markProcessing(String taskId, Instant now);

    /**
     * Record progress of a PROCESSING task. Progress never goes backwards.
     */
    TransitionResult updateProgress(String taskId, int progress, String stage, Instant now);

    /**
     * PROCESSING -> DONE with the result location.
     */
    TransitionResult complete(String taskId, String resultLocation, Instant now);

    /**
     * PENDING or PROCESSING -> FAILED. {@code stage} records where it failed and may be null.
     */
    TransitionResult fail(String taskId, String errorMessage, String stage, Instant now);

    /**
     * Fail a task only if it is still in {@code expected} status and older than the cutoff
     * (startedAt for PROCESSING, createdAt for PENDING).
     */
    TransitionResult failIfStale(String taskId, TaskStatus expected, Instant cutoff, String errorMessage,
            String stage, Instant now);

    /**
     * Tasks of a kind still in {@code status} whose reference time is before the cutoff.
     */
    List<Task> findStale(TaskStatus status, GenerationKind kind, Instant cutoff);

    /**
     * Find tasks by status, oldest first.
     */
    List<Task> findByStatus(TaskStatus status, int limit);

    /**
     * Most recently created tasks first.
     */
    List<Task> findRecent(int limit);

    /**
     * Count tasks by status.
     */
    int countByStatus(TaskStatus status);
}
