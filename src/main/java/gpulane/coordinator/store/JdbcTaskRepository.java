package gpulane.coordinator.store;

import gpulane.coordinator.model.FallbackReason;
import gpulane.coordinator.model.GenerationKind;
import gpulane.coordinator.model.LaneMode;
import gpulane.coordinator.model.Task;
import gpulane.coordinator.model.TaskStatus;
import gpulane.coordinator.model.TransitionResult;
import gpulane.coordinator.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of TaskRepository.
 * Transitions are guarded by the current status in the WHERE clause; a zero
 * update count is resolved into NOT_FOUND, ALREADY_TERMINAL or INVALID_STATE.
 */
public class JdbcTaskRepository implements TaskRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskRepository.class);

    private final Database db;

    public JdbcTaskRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(Task task) {
        String sql = """
                    INSERT INTO tasks (id, model, kind, mode, parameters, status, progress, error_message,
                                       result_location, lane_mode, fallback_reason, fallback_activated, stage,
                                       created_at, updated_at, started_at, finished_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            Instant created = task.createdAt() != null ? task.createdAt() : Instant.now();
            ps.setString(1, task.id());
            ps.setString(2, task.model());
            ps.setString(3, task.kind().wireName());
            ps.setString(4, task.mode());
            ps.setString(5, task.parameters());
            ps.setString(6, task.status().wireName());
            ps.setInt(7, task.progress());
            ps.setString(8, task.errorMessage());
            ps.setString(9, task.resultLocation());
            ps.setString(10, task.laneMode() != null ? task.laneMode().wireName() : null);
            ps.setString(11, task.fallbackReason() != null ? task.fallbackReason().wireName() : null);
            ps.setBoolean(12, task.fallbackActivated());
            ps.setString(13, task.stage());
            setTimestamp(ps, 14, created);
            setTimestamp(ps, 15, task.updatedAt() != null ? task.updatedAt() : created);
            setTimestamp(ps, 16, task.startedAt());
            setTimestamp(ps, 17, task.finishedAt());

            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save task: " + task.id(), e);
        }
    }

    @Override
    public Optional<Task> findById(String taskId) {
        String sql = "SELECT * FROM tasks WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find task: " + taskId, e);
        }
    }

    @Override
    public TransitionResult markProcessing(String taskId, Instant now) {
        String sql = """
                    UPDATE tasks
                    SET status = 'processing', started_at = ?, updated_at = ?
                    WHERE id = ? AND status = 'pending'
                """;

        return transition(taskId, "markProcessing", sql, ps -> {
            setTimestamp(ps, 1, now);
            setTimestamp(ps, 2, now);
            ps.setString(3, taskId);
        });
    }

    @Override
    public TransitionResult updateProgress(String taskId, int progress, String stage, Instant now) {
        if (progress < 0 || progress > 100) {
            throw new IllegalArgumentException("progress must be within 0..100: " + progress);
        }
        String sql = """
                    UPDATE tasks
                    SET progress = GREATEST(progress, CAST(? AS INT)), stage = COALESCE(CAST(? AS VARCHAR(64)), stage), updated_at = ?
                    WHERE id = ? AND status = 'processing'
                """;

        return transition(taskId, "updateProgress", sql, ps -> {
            ps.setInt(1, progress);
            ps.setString(2, stage);
            setTimestamp(ps, 3, now);
            ps.setString(4, taskId);
        });
    }

    @Override
    public TransitionResult complete(String taskId, String resultLocation, Instant now) {
        if (resultLocation == null || resultLocation.isBlank()) {
            throw new IllegalArgumentException("resultLocation is required");
        }
        String sql = """
                    UPDATE tasks
                    SET status = 'done', progress = 100, result_location = ?, finished_at = ?, updated_at = ?
                    WHERE id = ? AND status = 'processing'
                """;

        return transition(taskId, "complete", sql, ps -> {
            ps.setString(1, resultLocation);
            setTimestamp(ps, 2, now);
            setTimestamp(ps, 3, now);
            ps.setString(4, taskId);
        });
    }

    @Override
    public TransitionResult fail(String taskId, String errorMessage, String stage, Instant now) {
        String sql = """
                    UPDATE tasks
                    SET status = 'failed', error_message = ?, stage = COALESCE(CAST(? AS VARCHAR(64)), stage), finished_at = ?, updated_at = ?
                    WHERE id = ? AND status IN ('pending', 'processing')
                """;

        return transition(taskId, "fail", sql, ps -> {
            ps.setString(1, truncate(errorMessage));
            ps.setString(2, stage);
            setTimestamp(ps, 3, now);
            setTimestamp(ps, 4, now);
            ps.setString(5, taskId);
        });
    }

    @Override
    public TransitionResult failIfStale(String taskId, TaskStatus expected, Instant cutoff, String errorMessage,
            String stage, Instant now) {
        String sql = """
                    UPDATE tasks
                    SET status = 'failed', error_message = ?, stage = COALESCE(CAST(? AS VARCHAR(64)), stage), finished_at = ?, updated_at = ?
                    WHERE id = ? AND status = ? AND %s < ?
                """.formatted(referenceColumn(expected));

        return transition(taskId, "failIfStale", sql, ps -> {
            ps.setString(1, truncate(errorMessage));
            ps.setString(2, stage);
            setTimestamp(ps, 3, now);
            setTimestamp(ps, 4, now);
            ps.setString(5, taskId);
            ps.setString(6, expected.wireName());
            setTimestamp(ps, 7, cutoff);
        });
    }

    @Override
    public List<Task> findStale(TaskStatus status, GenerationKind kind, Instant cutoff) {
        String sql = "SELECT * FROM tasks WHERE status = ? AND kind = ? AND %s < ? ORDER BY created_at"
                .formatted(referenceColumn(status));

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.wireName());
            ps.setString(2, kind.wireName());
            setTimestamp(ps, 3, cutoff);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find stale " + kind.wireName() + " tasks", e);
        }
    }

    @Override
    public List<Task> findByStatus(TaskStatus status, int limit) {
        String sql = "SELECT * FROM tasks WHERE status = ? ORDER BY created_at LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.wireName());
            ps.setInt(2, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find tasks by status: " + status, e);
        }
    }

    @Override
    public List<Task> findRecent(int limit) {
        String sql = "SELECT * FROM tasks ORDER BY created_at DESC LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find recent tasks", e);
        }
    }

    @Override
    public int countByStatus(TaskStatus status) {
        String sql = "SELECT COUNT(*) FROM tasks WHERE status = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.wireName());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count tasks by status: " + status, e);
        }
    }

    // ==================== Helpers ====================

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement ps) throws SQLException;
    }

    private TransitionResult transition(String taskId, String operation, String sql, Binder binder) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            binder.bind(ps);
            int updated = ps.executeUpdate();
            conn.commit();

            if (updated > 0) {
                return TransitionResult.APPLIED;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to " + operation + " task: " + taskId, e);
        }

        // Nothing matched the guard; explain why
        Optional<Task> current = findById(taskId);
        if (current.isEmpty()) {
            return TransitionResult.NOT_FOUND;
        }
        if (current.get().isTerminal()) {
            log.debug("{} on task {} ignored: already {}", operation, taskId, current.get().status().wireName());
            return TransitionResult.ALREADY_TERMINAL;
        }
        return TransitionResult.INVALID_STATE;
    }

    private static String referenceColumn(TaskStatus status) {
        return switch (status) {
            case PROCESSING -> "started_at";
            case PENDING -> "created_at";
            default -> throw new IllegalArgumentException("No staleness reference for status " + status);
        };
    }

    private static String truncate(String message) {
        if (message == null) {
            return "unknown error";
        }
        return message.length() > 2048 ? message.substring(0, 2048) : message;
    }

    private List<Task> executeQuery(PreparedStatement ps) throws SQLException {
        List<Task> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(mapRow(rs));
            }
        }
        return results;
    }

    private Task mapRow(ResultSet rs) throws SQLException {
        return Task.builder()
                .id(rs.getString("id"))
                .model(rs.getString("model"))
                .kind(GenerationKind.fromWire(rs.getString("kind")))
                .mode(rs.getString("mode"))
                .parameters(rs.getString("parameters"))
                .status(TaskStatus.fromWire(rs.getString("status")))
                .progress(rs.getInt("progress"))
                .errorMessage(rs.getString("error_message"))
                .resultLocation(rs.getString("result_location"))
                .laneMode(LaneMode.fromWire(rs.getString("lane_mode")))
                .fallbackReason(FallbackReason.fromWire(rs.getString("fallback_reason")))
                .fallbackActivated(rs.getBoolean("fallback_activated"))
                .stage(rs.getString("stage"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                .startedAt(toInstant(rs.getTimestamp("started_at")))
                .finishedAt(toInstant(rs.getTimestamp("finished_at")))
                .build();
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    private static void setTimestamp(PreparedStatement ps, int index, Instant instant) throws SQLException {
        if (instant != null) {
            ps.setTimestamp(index, Timestamp.from(instant));
        } else {
            ps.setNull(index, Types.TIMESTAMP);
        }
    }
}
