package gpulane.coordinator.routing;

import gpulane.coordinator.admission.AdmissionController;
import gpulane.coordinator.admission.QueueExpiryHandler;
import gpulane.coordinator.config.ModelCatalog;
import gpulane.coordinator.execution.DedicatedLaneExecutor;
import gpulane.coordinator.execution.DedicatedLanePool;
import gpulane.coordinator.execution.ImageLaneExecutor;
import gpulane.coordinator.execution.SharedWorkerExecutor;
import gpulane.coordinator.lane.LaneRegistry;
import gpulane.coordinator.lane.LaneSignal;
import gpulane.coordinator.model.DegradedQueuePolicy;
import gpulane.coordinator.model.DiagnosticEventType;
import gpulane.coordinator.model.FallbackReason;
import gpulane.coordinator.model.GenerationRequest;
import gpulane.coordinator.model.LaneMode;
import gpulane.coordinator.model.MemoryDiagnosticEvent;
import gpulane.coordinator.model.Task;
import gpulane.coordinator.model.TaskStatus;
import gpulane.coordinator.store.Database;
import gpulane.coordinator.store.JdbcTaskRepository;
import gpulane.coordinator.support.FakeGpuWorker;
import gpulane.coordinator.support.MutableClock;
import gpulane.coordinator.support.RecordingDiagnosticsEmitter;
import gpulane.coordinator.support.TestDatabases;
import gpulane.coordinator.validation.ConstraintValidator;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;

import static org.junit.jupiter.api.Assertions.*;

class GenerationRouterTest {

    private static Database db;
    private static JdbcTaskRepository repo;
    private static ModelCatalog catalog;

    private MutableClock clock;
    private RecordingDiagnosticsEmitter diagnostics;
    private LaneRegistry registry;
    private AdmissionController admission;
    private FakeGpuWorker anisoraWorker;
    private FakeGpuWorker phr00tWorker;
    private FakeGpuWorker sharedWorkerBackend;
    private FakeGpuWorker imageWorker;
    private DedicatedLanePool lanes;
    private SharedWorkerExecutor sharedWorker;
    private ImageLaneExecutor imageLane;
    private GenerationRouter router;

    @BeforeAll
    static void setupDatabase() {
        db = TestDatabases.open("test-router");
        repo = new JdbcTaskRepository(db);
        catalog = ModelCatalog.loadDefault();
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void setup() throws Exception {
        TestDatabases.clear(db);

        clock = MutableClock.startingAt("2025-01-01T00:00:00Z");
        diagnostics = new RecordingDiagnosticsEmitter();
        registry = new LaneRegistry(List.of("anisora", "phr00t"), Duration.ofSeconds(60), clock, diagnostics);
        admission = new AdmissionController(DegradedQueuePolicy.DEFAULT, clock);
        QueueExpiryHandler expiryHandler = new QueueExpiryHandler(repo, diagnostics, DegradedQueuePolicy.DEFAULT,
                clock);

        anisoraWorker = new FakeGpuWorker();
        phr00tWorker = new FakeGpuWorker();
        sharedWorkerBackend = new FakeGpuWorker();
        imageWorker = new FakeGpuWorker();

        lanes = new DedicatedLanePool(List.of(
                new DedicatedLaneExecutor("anisora", anisoraWorker, repo, diagnostics, clock, "A10G"),
                new DedicatedLaneExecutor("phr00t", phr00tWorker, repo, diagnostics, clock, "A10G")));
        registry.addListener(lanes);
        sharedWorker = new SharedWorkerExecutor(sharedWorkerBackend, admission, expiryHandler, repo, diagnostics,
                clock, "A10G");
        imageLane = new ImageLaneExecutor(2, imageWorker, repo, diagnostics, clock, "A10G");

        router = new GenerationRouter(catalog, new ConstraintValidator(catalog), registry, admission, repo, lanes,
                sharedWorker, imageLane, diagnostics, clock, Duration.ZERO);
    }

    @AfterEach
    void closeLanes() {
        lanes.close();
        sharedWorker.close();
        imageLane.close();
    }

    private GenerationRequest request(String model, Map<String, Object> params) {
        return new GenerationRequest(model, null, null, "a lighthouse at dusk", params, clock.instant());
    }

    private boolean awaitStatus(String taskId, TaskStatus status) throws InterruptedException {
        return TestDatabases.eventually(Duration.ofSeconds(5),
                () -> repo.findById(taskId).map(Task::status).orElse(null) == status);
    }

    @Test
    @DisplayName("Fixed steps violation is rejected before any lane or queue state changes")
    void fixedStepsViolationTouchesNothing() {
        RouteDecision decision = router.route(request("anisora", Map.of("steps", 6)));

        assertEquals(RouteOutcome.REJECTED_INVALID, decision.outcome());
        assertNull(decision.taskId());
        assertEquals("steps", decision.validation().field());
        assertEquals("8", decision.validation().expected());
        assertEquals("6", decision.validation().actual());

        assertEquals(0, admission.depth());
        assertEquals(0, repo.countByStatus(TaskStatus.PENDING));
        assertTrue(registry.resolve("anisora").isDispatchable());
        assertTrue(diagnostics.events().isEmpty());
        assertTrue(anisoraWorker.calls().isEmpty());
        assertEquals(1, router.count(RouteOutcome.REJECTED_INVALID));
        assertEquals(0, router.count(RouteOutcome.ACCEPTED_DEDICATED));
        assertEquals(0, router.count(RouteOutcome.ACCEPTED_DEGRADED));
    }

    @Test
    @DisplayName("Sequential requests on a ready lane reuse the resident pipeline")
    void readyLaneStaysWarmAcrossRequests() throws Exception {
        DedicatedLaneExecutor lane = lanes.lane("phr00t");
        lanes.warmUpAll();
        assertTrue(TestDatabases.eventually(Duration.ofSeconds(5), lane::isLoaded));

        for (int i = 0; i < 3; i++) {
            RouteDecision decision = router.route(request("phr00t", Map.of()));
            assertEquals(RouteOutcome.ACCEPTED_DEDICATED, decision.outcome());
            assertEquals(LaneMode.DEDICATED, decision.laneMode());
            assertTrue(awaitStatus(decision.taskId(), TaskStatus.DONE));
            assertTrue(registry.resolve("phr00t").warm());
        }

        assertEquals(1, lane.loadCount());
        assertEquals(0, lane.unloadCount());
        assertEquals(1, phr00tWorker.count("load:"));
        assertEquals(0, phr00tWorker.count("unload:"));
        assertEquals(3, phr00tWorker.count("generate:"));
        assertEquals(0, diagnostics.count(DiagnosticEventType.WARM_LANE_READY));
        assertEquals(0, diagnostics.count(DiagnosticEventType.FALLBACK_ACTIVATED));
        assertTrue(sharedWorkerBackend.calls().isEmpty());
    }

    @Test
    @DisplayName("Quota-denied lane routes to the shared worker with a quota fallback event")
    void quotaDeniedLaneRoutesDegraded() throws Exception {
        registry.apply("anisora", LaneSignal.QUOTA_DENIED);
        diagnostics.clear();

        RouteDecision decision = router.route(request("anisora", Map.of("steps", 8)));

        assertEquals(RouteOutcome.ACCEPTED_DEGRADED, decision.outcome());
        assertEquals(LaneMode.DEGRADED_SHARED, decision.laneMode());
        assertEquals(FallbackReason.QUOTA, decision.fallbackReason());

        List<MemoryDiagnosticEvent> fallbacks = diagnostics.ofType(DiagnosticEventType.FALLBACK_ACTIVATED);
        assertEquals(1, fallbacks.size());
        assertEquals("quota", fallbacks.get(0).reason());
        assertEquals(decision.taskId(), fallbacks.get(0).taskId());
        assertEquals(1, diagnostics.count(DiagnosticEventType.QUEUE_ADMITTED));

        Task stored = repo.findById(decision.taskId()).orElseThrow();
        assertEquals(LaneMode.DEGRADED_SHARED, stored.laneMode());
        assertEquals(FallbackReason.QUOTA, stored.fallbackReason());
        assertTrue(stored.fallbackActivated());
        assertTrue(decision.fallbackActivated());

        assertTrue(awaitStatus(decision.taskId(), TaskStatus.DONE));
        assertTrue(TestDatabases.eventually(Duration.ofSeconds(5), () -> admission.depth() == 0));
        assertEquals("anisora", sharedWorker.residentModel());
        assertEquals(0, anisoraWorker.count("generate:"));
    }

    @Test
    @DisplayName("Image request goes to the image lane while it accepts work")
    void imageRequestUsesImageLane() throws Exception {
        RouteDecision decision = router.route(request("pony", Map.of()));

        assertEquals(RouteOutcome.ACCEPTED_DEDICATED, decision.outcome());
        assertFalse(decision.fallbackActivated());
        assertTrue(awaitStatus(decision.taskId(), TaskStatus.DONE));
        assertFalse(repo.findById(decision.taskId()).orElseThrow().fallbackActivated());
        assertEquals(1, imageWorker.count("generate:"));
        assertTrue(sharedWorkerBackend.calls().isEmpty());
    }

    @Test
    @DisplayName("Closed image lane sends image requests to the shared worker")
    void closedImageLaneFallsBackToSharedWorker() throws Exception {
        imageLane.close();

        RouteDecision decision = router.route(request("flux", Map.of()));

        assertEquals(RouteOutcome.ACCEPTED_DEGRADED, decision.outcome());
        assertEquals(FallbackReason.CAPACITY, decision.fallbackReason());
        assertTrue(decision.fallbackActivated());
        assertEquals(1, diagnostics.count(DiagnosticEventType.FALLBACK_ACTIVATED));

        Task stored = repo.findById(decision.taskId()).orElseThrow();
        assertEquals(LaneMode.DEGRADED_SHARED, stored.laneMode());
        assertTrue(stored.fallbackActivated());

        assertTrue(awaitStatus(decision.taskId(), TaskStatus.DONE));
        assertTrue(TestDatabases.eventually(Duration.ofSeconds(5), () -> sharedWorkerBackend.calls().size() == 4));
        assertEquals(List.of("clear", "load:flux", "generate:" + decision.taskId(), "clear"),
                sharedWorkerBackend.calls());
        assertTrue(imageWorker.calls().isEmpty());
        assertTrue(TestDatabases.eventually(Duration.ofSeconds(5), () -> admission.depth() == 0));
    }

    @Test
    @DisplayName("26th concurrent degraded request is rejected as overloaded")
    void twentySixthDegradedRequestOverloaded() throws Exception {
        registry.apply("anisora", LaneSignal.QUOTA_DENIED);
        CountDownLatch gate = sharedWorkerBackend.blockGenerations();
        try {
            for (int i = 0; i < 25; i++) {
                RouteDecision accepted = router.route(request("anisora", Map.of()));
                assertEquals(RouteOutcome.ACCEPTED_DEGRADED, accepted.outcome(), "request " + (i + 1));
            }
            assertEquals(25, admission.depth());

            RouteDecision rejected = router.route(request("anisora", Map.of()));

            assertEquals(RouteOutcome.REJECTED_OVERLOADED, rejected.outcome());
            assertNull(rejected.taskId());
            assertEquals(25, rejected.admission().depth());
            assertEquals(25, rejected.admission().maxDepth());
            assertEquals(1, diagnostics.count(DiagnosticEventType.QUEUE_OVERLOADED));
            assertEquals(25, repo.countByStatus(TaskStatus.PENDING) + repo.countByStatus(TaskStatus.PROCESSING));
            assertEquals(25, admission.depth());
        } finally {
            gate.countDown();
        }
    }

    @Test
    void coldLaneFallsBackWithCapacityReason() {
        registry.apply("phr00t", LaneSignal.IDLE);

        RouteDecision decision = router.route(request("phr00t", Map.of()));

        assertEquals(RouteOutcome.ACCEPTED_DEGRADED, decision.outcome());
        assertEquals(FallbackReason.CAPACITY, decision.fallbackReason());
    }

    @Test
    void manualFallbackKeepsManualReason() {
        registry.apply("phr00t", LaneSignal.MANUAL_FALLBACK);

        RouteDecision decision = router.route(request("phr00t", Map.of()));

        assertEquals(FallbackReason.MANUAL, decision.fallbackReason());
    }

    @Test
    void imageModelsUseImageLane() throws Exception {
        RouteDecision decision = router.route(request("pony", Map.of("steps", 25)));

        assertEquals(RouteOutcome.ACCEPTED_DEDICATED, decision.outcome());
        assertNull(decision.laneMode());
        assertTrue(awaitStatus(decision.taskId(), TaskStatus.DONE));
        assertEquals(1, imageWorker.count("load:pony"));
        assertEquals(0, admission.depth());
    }

    @Test
    void storedTaskCarriesNormalisedParameters() {
        Map<String, Object> params = new HashMap<>();
        params.put("seed", 42);
        RouteDecision decision = router.route(request("phr00t", params));

        Task stored = repo.findById(decision.taskId()).orElseThrow();
        assertEquals("phr00t", stored.model());
        assertEquals("t2v", stored.mode());
        assertTrue(stored.parameters().contains("\"prompt\":\"a lighthouse at dusk\""));
        assertTrue(stored.parameters().contains("\"steps\":4"));
        assertTrue(stored.parameters().contains("\"cfg_scale\":1.0"));
        assertTrue(stored.parameters().contains("\"seed\":42"));
    }

    @Test
    void outcomeCountsCoverEveryOutcome() {
        router.route(request("anisora", Map.of("steps", 6)));
        router.route(request("pony", Map.of()));

        Map<RouteOutcome, Long> counts = router.outcomeCounts();
        assertEquals(RouteOutcome.values().length, counts.size());
        assertEquals(1L, counts.get(RouteOutcome.REJECTED_INVALID));
        assertEquals(1L, counts.get(RouteOutcome.ACCEPTED_DEDICATED));
        assertEquals(0L, counts.get(RouteOutcome.REJECTED_OVERLOADED));
    }
}
