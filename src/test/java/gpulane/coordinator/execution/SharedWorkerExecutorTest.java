package gpulane.coordinator.execution;

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
import gpulane.coordinator.store.Database;
import gpulane.coordinator.store.JdbcTaskRepository;
import gpulane.coordinator.support.FakeGpuWorker;
import gpulane.coordinator.support.MutableClock;
import gpulane.coordinator.support.RecordingDiagnosticsEmitter;
import gpulane.coordinator.support.TestDatabases;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SharedWorkerExecutorTest {

    private static Database db;
    private static JdbcTaskRepository repo;

    private MutableClock clock;
    private RecordingDiagnosticsEmitter diagnostics;
    private AdmissionController admission;
    private FakeGpuWorker worker;
    private SharedWorkerExecutor executor;

    @BeforeAll
    static void setup() {
        db = TestDatabases.open("test-shared-worker");
        repo = new JdbcTaskRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void setupExecutor() throws Exception {
        TestDatabases.clear(db);
        clock = MutableClock.startingAt("2025-01-01T12:00:00Z");
        diagnostics = new RecordingDiagnosticsEmitter();
        admission = new AdmissionController(DegradedQueuePolicy.DEFAULT, clock);
        QueueExpiryHandler expiryHandler = new QueueExpiryHandler(repo, diagnostics, DegradedQueuePolicy.DEFAULT,
                clock);
        worker = new FakeGpuWorker();
        executor = new SharedWorkerExecutor(worker, admission, expiryHandler, repo, diagnostics, clock, "A10G");
    }

    @AfterEach
    void closeExecutor() {
        executor.close();
    }

    private Task degradedTask(String id, String model) {
        Task task = Task.builder()
                .id(id)
                .model(model)
                .kind(GenerationKind.VIDEO)
                .laneMode(LaneMode.DEGRADED_SHARED)
                .fallbackReason(FallbackReason.CAPACITY)
                .createdAt(clock.instant())
                .build();
        repo.save(task);
        return task;
    }

    private Task admitAndSubmit(String id, String model) {
        Task task = degradedTask(id, model);
        assertTrue(admission.tryAdmit(id, model, clock.instant()).admitted());
        executor.submit(task);
        return task;
    }

    private boolean awaitStatus(String taskId, TaskStatus status) throws InterruptedException {
        return TestDatabases.eventually(Duration.ofSeconds(5),
                () -> repo.findById(taskId).map(Task::status).orElse(null) == status);
    }

    @Test
    void modelSwitchReleasesPreviousPipelineBeforeLoading() throws Exception {
        admitAndSubmit("a-1", "anisora");
        admitAndSubmit("p-1", "phr00t");

        assertTrue(awaitStatus("p-1", TaskStatus.DONE));
        assertTrue(TestDatabases.eventually(Duration.ofSeconds(5), () -> worker.calls().size() == 9));

        assertEquals(List.of(
                "clear", "load:anisora", "generate:a-1", "clear",
                "unload:anisora", "clear", "load:phr00t", "generate:p-1", "clear"), worker.calls());
        assertEquals("phr00t", executor.residentModel());
        assertEquals(1, executor.switchCount());

        List<MemoryDiagnosticEvent> switches = diagnostics.ofType(DiagnosticEventType.MEMORY_CLEANUP).stream()
                .filter(e -> "model_switch".equals(e.reason()))
                .toList();
        assertEquals(1, switches.size(), "The first load replaces nothing");
        assertEquals("phr00t", switches.get(0).model());
        assertEquals("anisora", switches.get(0).value());
    }

    @Test
    void sameModelKeepsPipelineResident() throws Exception {
        admitAndSubmit("a-1", "anisora");
        admitAndSubmit("a-2", "anisora");

        assertTrue(awaitStatus("a-2", TaskStatus.DONE));
        assertEquals(1, worker.count("load:"));
        assertEquals(0, worker.count("unload:"));
        assertEquals(0, executor.switchCount());
    }

    @Test
    void ticketReleasedAfterCompletion() throws Exception {
        admitAndSubmit("a-1", "anisora");

        assertTrue(awaitStatus("a-1", TaskStatus.DONE));
        assertTrue(TestDatabases.eventually(Duration.ofSeconds(5), () -> admission.depth() == 0));
        assertEquals("mem://a-1", repo.findById("a-1").orElseThrow().resultLocation());
    }

    @Test
    void everyAttemptEndsWithCleanupAndMemoryReading() throws Exception {
        worker.reportMemory(6.25);
        admitAndSubmit("a-1", "anisora");

        assertTrue(awaitStatus("a-1", TaskStatus.DONE));
        assertTrue(TestDatabases.eventually(Duration.ofSeconds(5),
                () -> diagnostics.count(DiagnosticEventType.MEMORY_POST_GENERATION) == 1));

        MemoryDiagnosticEvent reading = diagnostics.ofType(DiagnosticEventType.MEMORY_POST_GENERATION).get(0);
        assertEquals("6.25", reading.value());
        assertEquals(LaneMode.DEGRADED_SHARED, reading.laneMode());
        assertTrue(diagnostics.ofType(DiagnosticEventType.MEMORY_CLEANUP).stream()
                .anyMatch(e -> "post_generation".equals(e.reason())));
    }

    @Test
    void requestWaitingPastMaxWaitNeverRuns() throws Exception {
        Task task = degradedTask("late", "anisora");
        admission.tryAdmit("late", "anisora", clock.instant());
        clock.advance(Duration.ofSeconds(30));

        executor.submit(task);

        assertTrue(awaitStatus("late", TaskStatus.FAILED));
        Task failed = repo.findById("late").orElseThrow();
        assertEquals("queue_overloaded: Generation queue wait exceeded 30 seconds.", failed.errorMessage());
        assertEquals("queue_timeout", failed.stage());
        assertEquals(0, worker.count("generate:"));
        assertFalse(admission.holds("late"));
        assertEquals(1, diagnostics.count(DiagnosticEventType.QUEUE_TIMEOUT));
    }

    @Test
    void outOfMemoryFailureIsMapped() throws Exception {
        worker.failWith("CUDA out of memory. Tried to allocate 2.50 GiB");
        admitAndSubmit("a-1", "anisora");

        assertTrue(awaitStatus("a-1", TaskStatus.FAILED));
        Task failed = repo.findById("a-1").orElseThrow();
        assertTrue(failed.errorMessage().startsWith("gpu_memory_exceeded:"));
        assertTrue(failed.errorMessage().contains("gpu=A10G"));
        assertEquals("gpu_oom", failed.stage());
        assertTrue(TestDatabases.eventually(Duration.ofSeconds(5), () -> admission.depth() == 0));
        // cache is still cleared after a failed attempt
        assertTrue(TestDatabases.eventually(Duration.ofSeconds(5),
                () -> worker.calls().get(worker.calls().size() - 1).equals("clear")));
    }

    @Test
    void ticketReleasedWhenTaskCannotBeStarted() throws Exception {
        executor.close();
        JdbcTaskRepository brokenStart = new JdbcTaskRepository(db) {
            @Override
            public TransitionResult markProcessing(String taskId, Instant now) {
                throw new IllegalStateException("connection reset");
            }
        };
        QueueExpiryHandler expiryHandler = new QueueExpiryHandler(brokenStart, diagnostics,
                DegradedQueuePolicy.DEFAULT, clock);
        executor = new SharedWorkerExecutor(worker, admission, expiryHandler, brokenStart, diagnostics, clock,
                "A10G");

        admitAndSubmit("a-1", "anisora");

        assertTrue(TestDatabases.eventually(Duration.ofSeconds(5), () -> admission.depth() == 0));
        assertFalse(admission.holds("a-1"));
        assertEquals(0, worker.count("generate:"));
        assertEquals(TaskStatus.PENDING, repo.findById("a-1").orElseThrow().status());
    }
}
