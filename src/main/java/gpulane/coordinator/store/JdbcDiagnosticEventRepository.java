package gpulane.coordinator.store;

import gpulane.coordinator.model.DiagnosticEventType;
import gpulane.coordinator.model.LaneMode;
import gpulane.coordinator.model.MemoryDiagnosticEvent;
import gpulane.coordinator.repository.DiagnosticEventRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * JDBC implementation of DiagnosticEventRepository over {@code operational_events}.
 */
public class JdbcDiagnosticEventRepository implements DiagnosticEventRepository {

    private static final String INSERT_SQL = """
                INSERT INTO operational_events (event_type, task_id, model, lane_mode, event_value, reason, created_at)
                VALUES (?, ?, ?, ?, ?, ?, ?)
            """;

    private final Database db;

    public JdbcDiagnosticEventRepository(Database db) {
        this.db = db;
    }

    @Override
    public void append(MemoryDiagnosticEvent event) {
        appendAll(List.of(event));
    }

    @Override
    public void appendAll(List<MemoryDiagnosticEvent> events) {
        if (events.isEmpty())
            return;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(INSERT_SQL)) {

            for (MemoryDiagnosticEvent event : events) {
                ps.setString(1, event.eventType().wireName());
                ps.setString(2, event.taskId());
                ps.setString(3, event.model());
                ps.setString(4, event.laneMode() != null ? event.laneMode().wireName() : null);
                ps.setString(5, event.value());
                ps.setString(6, event.reason());
                ps.setTimestamp(7, Timestamp.from(event.timestamp()));
                ps.addBatch();
            }

            ps.executeBatch();
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to append " + events.size() + " operational events", e);
        }
    }

    @Override
    public List<MemoryDiagnosticEvent> findRecent(int limit) {
        String sql = "SELECT * FROM operational_events ORDER BY created_at DESC, id DESC LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read operational events", e);
        }
    }

    @Override
    public List<MemoryDiagnosticEvent> findByTaskId(String taskId) {
        String sql = "SELECT * FROM operational_events WHERE task_id = ? ORDER BY created_at, id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, taskId);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read operational events for task: " + taskId, e);
        }
    }

    @Override
    public Map<DiagnosticEventType, Long> countByType() {
        String sql = "SELECT event_type, COUNT(*) AS cnt FROM operational_events GROUP BY event_type";

        Map<DiagnosticEventType, Long> counts = new EnumMap<>(DiagnosticEventType.class);
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {

            while (rs.next()) {
                counts.put(DiagnosticEventType.fromWire(rs.getString("event_type")), rs.getLong("cnt"));
            }
            return counts;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count operational events", e);
        }
    }

    private List<MemoryDiagnosticEvent> executeQuery(PreparedStatement ps) throws SQLException {
        List<MemoryDiagnosticEvent> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(new MemoryDiagnosticEvent(
                        DiagnosticEventType.fromWire(rs.getString("event_type")),
                        rs.getString("task_id"),
                        rs.getString("model"),
                        LaneMode.fromWire(rs.getString("lane_mode")),
                        rs.getString("event_value"),
                        rs.getString("reason"),
                        rs.getTimestamp("created_at").toInstant()));
            }
        }
        return results;
    }
}
