package gpulane.coordinator.diagnostics;

import gpulane.coordinator.model.MemoryDiagnosticEvent;
import gpulane.coordinator.repository.DiagnosticEventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Buffers events in a bounded queue and writes them from a single daemon thread.
 * A full queue or a failing store only costs the events themselves.
 */
public class AsyncDiagnosticsEmitter implements DiagnosticsEmitter, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AsyncDiagnosticsEmitter.class);
    private static final int BATCH_SIZE = 100;

    private final DiagnosticEventRepository repository;
    private final BlockingQueue<MemoryDiagnosticEvent> queue;
    private final Thread writer;
    private final AtomicLong inFlight = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();

    private volatile boolean running = true;

    public AsyncDiagnosticsEmitter(DiagnosticEventRepository repository, int capacity) {
        this.repository = repository;
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.writer = new Thread(this::drainLoop, "gpulane-diagnostics");
        this.writer.setDaemon(true);
        this.writer.start();
    }

    @Override
    public void emit(MemoryDiagnosticEvent event) {
        try {
            if (event == null) {
                return;
            }
            inFlight.incrementAndGet();
            if (!running || !queue.offer(event)) {
                inFlight.decrementAndGet();
                long total = dropped.incrementAndGet();
                log.warn("Diagnostic event {} dropped (queue full or closed, {} dropped so far)",
                        event.eventType().wireName(), total);
            }
        } catch (RuntimeException e) {
            log.warn("Failed to enqueue diagnostic event: {}", e.getMessage());
        }
    }

    /**
     * Number of events discarded because the queue was full.
     */
    public long droppedCount() {
        return dropped.get();
    }

    /**
     * Wait until every accepted event has been written (or failed to write).
     *
     * @return true if the queue drained within the timeout
     */
    public boolean awaitDrained(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (inFlight.get() > 0) {
            if (System.nanoTime() >= deadline) {
                return false;
            }
            try {
                Thread.sleep(5);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return true;
    }

    private void drainLoop() {
        List<MemoryDiagnosticEvent> batch = new ArrayList<>(BATCH_SIZE);
        while (running || !queue.isEmpty()) {
            try {
                MemoryDiagnosticEvent first = queue.poll(200, TimeUnit.MILLISECONDS);
                if (first == null) {
                    continue;
                }
                batch.add(first);
                queue.drainTo(batch, BATCH_SIZE - 1);
                write(batch);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } finally {
                inFlight.addAndGet(-batch.size());
                batch.clear();
            }
        }
        log.debug("Diagnostics writer stopped");
    }

    private void write(List<MemoryDiagnosticEvent> batch) {
        try {
            repository.appendAll(batch);
        } catch (Exception e) {
            log.warn("Failed to record {} diagnostic events: {}", batch.size(), e.getMessage());
        }
    }

    @Override
    public void close() {
        awaitDrained(Duration.ofSeconds(2));
        running = false;
        try {
            writer.join(1000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
