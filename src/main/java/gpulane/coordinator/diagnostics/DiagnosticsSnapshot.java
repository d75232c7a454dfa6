package gpulane.coordinator.diagnostics;

import gpulane.coordinator.model.DiagnosticEventType;

import java.util.Map;

/**
 * Aggregate counters over recorded operational events.
 */
public record DiagnosticsSnapshot(
        long overloadCount,
        long timeoutCount,
        long fallbackCount,
        long cleanupCount,
        Map<DiagnosticEventType, Long> byType) {

    public static DiagnosticsSnapshot from(Map<DiagnosticEventType, Long> counts) {
        return new DiagnosticsSnapshot(
                counts.getOrDefault(DiagnosticEventType.QUEUE_OVERLOADED, 0L),
                counts.getOrDefault(DiagnosticEventType.QUEUE_TIMEOUT, 0L),
                counts.getOrDefault(DiagnosticEventType.FALLBACK_ACTIVATED, 0L),
                counts.getOrDefault(DiagnosticEventType.MEMORY_CLEANUP, 0L),
                Map.copyOf(counts));
    }
}
