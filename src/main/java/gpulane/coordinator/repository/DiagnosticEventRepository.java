package gpulane.coordinator.repository;

import gpulane.coordinator.model.DiagnosticEventType;
import gpulane.coordinator.model.MemoryDiagnosticEvent;

import java.util.List;
import java.util.Map;

/**
 * Append-only store for operational events.
 */
public interface DiagnosticEventRepository {

    void append(MemoryDiagnosticEvent event);

    void appendAll(List<MemoryDiagnosticEvent> events);

    /**
     * Newest first.
     */
    List<MemoryDiagnosticEvent> findRecent(int limit);

    List<MemoryDiagnosticEvent> findByTaskId(String taskId);

    /**
     * Number of recorded events per type. Types with no events are absent.
     */
    Map<DiagnosticEventType, Long> countByType();
}
