package gpulane.coordinator.scheduler;

import gpulane.coordinator.admission.AdmissionController;
import gpulane.coordinator.admission.QueueExpiryHandler;
import gpulane.coordinator.model.DegradedQueuePolicy;
import gpulane.coordinator.model.DiagnosticEventType;
import gpulane.coordinator.model.FallbackReason;
import gpulane.coordinator.model.GenerationKind;
import gpulane.coordinator.model.LaneMode;
import gpulane.coordinator.model.MemoryDiagnosticEvent;
import gpulane.coordinator.model.Task;
import gpulane.coordinator.model.TaskStatus;
import gpulane.coordinator.model.TransitionResult;
import gpulane.coordinator.service.TaskService;
import gpulane.coordinator.store.Database;
import gpulane.coordinator.store.JdbcTaskRepository;
import gpulane.coordinator.support.MutableClock;
import gpulane.coordinator.support.RecordingDiagnosticsEmitter;
import gpulane.coordinator.support.TestDatabases;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for StaleTaskReaper functionality.
 */
class StaleTaskReaperTest {

    private static Database db;
    private static JdbcTaskRepository repo;

    private MutableClock clock;
    private RecordingDiagnosticsEmitter diagnostics;
    private AdmissionController admission;
    private StaleTaskReaper reaper;

    @BeforeAll
    static void setup() {
        db = TestDatabases.open("test-reaper");
        repo = new JdbcTaskRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanTasks() throws Exception {
        TestDatabases.clear(db);
        clock = MutableClock.startingAt("2025-01-01T12:00:00Z");
        diagnostics = new RecordingDiagnosticsEmitter();
        admission = new AdmissionController(DegradedQueuePolicy.DEFAULT, clock);
        reaper = new StaleTaskReaper(repo, admission, diagnostics, clock);
    }

    private void saveProcessing(String id, String model, GenerationKind kind) {
        repo.save(Task.builder()
                .id(id)
                .model(model)
                .kind(kind)
                .laneMode(kind == GenerationKind.VIDEO ? LaneMode.DEDICATED : null)
                .createdAt(clock.instant())
                .build());
        assertEquals(TransitionResult.APPLIED, repo.markProcessing(id, clock.instant()));
    }

    @Test
    void reapsVideoTaskStuckInProcessingExactlyOnce() {
        saveProcessing("video-stuck", "anisora", GenerationKind.VIDEO);
        clock.advance(Duration.ofMinutes(31));

        assertEquals(1, reaper.reapStaleTasks());
        assertEquals(0, reaper.reapStaleTasks());

        Task reaped = repo.findById("video-stuck").orElseThrow();
        assertEquals(TaskStatus.FAILED, reaped.status());
        assertEquals("Task timed out: video task exceeded 30 minutes in processing", reaped.errorMessage());
        assertEquals(StaleTaskReaper.STALE_REASON, reaped.stage());

        List<MemoryDiagnosticEvent> timeouts = diagnostics.ofType(DiagnosticEventType.QUEUE_TIMEOUT);
        assertEquals(1, timeouts.size());
        assertEquals("video-stuck", timeouts.get(0).taskId());
        assertEquals("30", timeouts.get(0).value());
        assertEquals("stale_task", timeouts.get(0).reason());
    }

    @Test
    void lateWorkerCallbacksAreNoOps() {
        saveProcessing("video-late", "anisora", GenerationKind.VIDEO);
        clock.advance(Duration.ofMinutes(45));
        reaper.reapStaleTasks();

        QueueExpiryHandler expiryHandler = new QueueExpiryHandler(repo, diagnostics, DegradedQueuePolicy.DEFAULT,
                clock);
        TaskService service = new TaskService(repo, admission, expiryHandler, clock, "A10G");

        assertEquals(TransitionResult.ALREADY_TERMINAL, service.complete("video-late", "s3://out/video-late.mp4"));
        assertEquals(TransitionResult.ALREADY_TERMINAL, service.fail("video-late", "boom", null));
        assertEquals(TransitionResult.ALREADY_TERMINAL, service.reportProgress("video-late", 90, "saving"));

        Task task = repo.findById("video-late").orElseThrow();
        assertEquals(TaskStatus.FAILED, task.status());
        assertNull(task.resultLocation());
    }

    @Test
    void imageTtlIsShorterThanVideoTtl() {
        saveProcessing("image-stuck", "pony", GenerationKind.IMAGE);
        saveProcessing("video-busy", "phr00t", GenerationKind.VIDEO);
        clock.advance(Duration.ofMinutes(11));

        assertEquals(1, reaper.reapStaleTasks());

        assertEquals(TaskStatus.FAILED, repo.findById("image-stuck").orElseThrow().status());
        assertEquals("Task timed out: image task exceeded 10 minutes in processing",
                repo.findById("image-stuck").orElseThrow().errorMessage());
        assertEquals(TaskStatus.PROCESSING, repo.findById("video-busy").orElseThrow().status());
    }

    @Test
    void taskWithinTtlIsLeftAlone() {
        saveProcessing("video-ok", "anisora", GenerationKind.VIDEO);
        clock.advance(Duration.ofMinutes(29));

        assertEquals(0, reaper.reapStaleTasks());
        assertTrue(diagnostics.events().isEmpty());
    }

    @Test
    void reapsTaskNeverStarted() {
        repo.save(Task.builder()
                .id("pending-stuck")
                .model("anisora")
                .kind(GenerationKind.VIDEO)
                .laneMode(LaneMode.DEGRADED_SHARED)
                .fallbackReason(FallbackReason.CAPACITY)
                .createdAt(clock.instant())
                .build());
        admission.tryAdmit("pending-stuck", "anisora", clock.instant());
        admission.markStarted("pending-stuck");
        clock.advance(Duration.ofMinutes(31));

        assertEquals(1, reaper.reapStaleTasks());

        Task task = repo.findById("pending-stuck").orElseThrow();
        assertEquals("Task timed out: video task exceeded 30 minutes in pending", task.errorMessage());
        assertFalse(admission.holds("pending-stuck"));
        assertEquals(LaneMode.DEGRADED_SHARED,
                diagnostics.ofType(DiagnosticEventType.QUEUE_TIMEOUT).get(0).laneMode());
    }

    @Test
    void completedTasksAreNeverReaped() {
        saveProcessing("video-done", "anisora", GenerationKind.VIDEO);
        repo.complete("video-done", "s3://out/video-done.mp4", clock.instant());
        clock.advance(Duration.ofHours(2));

        assertEquals(0, reaper.reapStaleTasks());
        assertEquals(TaskStatus.DONE, repo.findById("video-done").orElseThrow().status());
    }

    @Test
    void timeoutMessageIsDeterministic() {
        assertEquals("Task timed out: video task exceeded 30 minutes in processing",
                StaleTaskReaper.timeoutMessage(GenerationKind.VIDEO, TaskStatus.PROCESSING));
        assertEquals("Task timed out: image task exceeded 10 minutes in pending",
                StaleTaskReaper.timeoutMessage(GenerationKind.IMAGE, TaskStatus.PENDING));
    }
}
