package gpulane.coordinator.diagnostics;

import gpulane.coordinator.model.MemoryDiagnosticEvent;

/**
 * Sink for operational events. Implementations must never throw and never
 * block the caller; losing an event is acceptable, failing a request is not.
 */
@FunctionalInterface
public interface DiagnosticsEmitter {

    void emit(MemoryDiagnosticEvent event);

    /** Emitter that discards everything */
    static DiagnosticsEmitter noop() {
        return event -> {
        };
    }
}
