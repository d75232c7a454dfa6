package gpulane.coordinator.scheduler;

import gpulane.coordinator.config.SchedulerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Coordinates background scheduled tasks:
 * - StaleTaskReaper: fails tasks stuck past their TTL
 * - DegradedQueueSweeper: expires degraded-queue tickets past max wait
 * - LaneAssignmentMonitor: health grace and assignment timeout checks
 *
 * Uses a single-threaded executor to avoid concurrency issues.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final ScheduledExecutorService executor;
    private final StaleTaskReaper taskReaper;
    private final DegradedQueueSweeper queueSweeper;
    private final LaneAssignmentMonitor laneMonitor;
    private final SchedulerConfig config;

    private volatile boolean running = false;

    public Scheduler(StaleTaskReaper taskReaper, DegradedQueueSweeper queueSweeper,
            LaneAssignmentMonitor laneMonitor, SchedulerConfig config) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "gpulane-scheduler");
            t.setDaemon(true);
            return t;
        });
        this.taskReaper = taskReaper;
        this.queueSweeper = queueSweeper;
        this.laneMonitor = laneMonitor;
        this.config = config;
    }

    /**
     * Start the scheduler.
     */
    public void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }

        running = true;

        schedule("stale-task-reaper", taskReaper, config.reaperInterval());
        schedule("degraded-queue-sweeper", queueSweeper, config.queueSweepInterval());
        schedule("lane-monitor", laneMonitor, config.laneMonitorInterval());

        log.info("Scheduler started");
    }

    /**
     * Stop the scheduler gracefully.
     */
    public void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Get the task reaper for direct access (e.g., manual trigger).
     */
    public StaleTaskReaper taskReaper() {
        return taskReaper;
    }

    private void schedule(String name, Runnable task, Duration interval) {
        long intervalMs = interval.toMillis();
        executor.scheduleAtFixedRate(wrapRunnable(name, task), intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("{} scheduled every {}ms", name, intervalMs);
    }

    /**
     * Wrap a runnable with error handling.
     */
    private Runnable wrapRunnable(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("{} error", name, e);
            }
        };
    }
}
