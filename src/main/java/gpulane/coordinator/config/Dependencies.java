package gpulane.coordinator.config;

import gpulane.coordinator.admission.AdmissionController;
import gpulane.coordinator.admission.QueueExpiryHandler;
import gpulane.coordinator.api.internal.v1.DiagnosticsController;
import gpulane.coordinator.api.internal.v1.LaneController;
import gpulane.coordinator.api.internal.v1.WorkerCallbackController;
import gpulane.coordinator.api.v1.GenerationController;
import gpulane.coordinator.api.v1.HealthController;
import gpulane.coordinator.api.v1.StatusController;
import gpulane.coordinator.auth.ApiKeyAuthenticator;
import gpulane.coordinator.auth.SessionValidator;
import gpulane.coordinator.diagnostics.AsyncDiagnosticsEmitter;
import gpulane.coordinator.execution.DedicatedLaneExecutor;
import gpulane.coordinator.execution.DedicatedLanePool;
import gpulane.coordinator.execution.GpuWorkerFactory;
import gpulane.coordinator.execution.ImageLaneExecutor;
import gpulane.coordinator.execution.SharedWorkerExecutor;
import gpulane.coordinator.lane.LaneRegistry;
import gpulane.coordinator.model.DegradedQueuePolicy;
import gpulane.coordinator.repository.DiagnosticEventRepository;
import gpulane.coordinator.repository.TaskRepository;
import gpulane.coordinator.routing.GenerationRouter;
import gpulane.coordinator.scheduler.DegradedQueueSweeper;
import gpulane.coordinator.scheduler.LaneAssignmentMonitor;
import gpulane.coordinator.scheduler.Scheduler;
import gpulane.coordinator.scheduler.StaleTaskReaper;
import gpulane.coordinator.server.RouterHandler;
import gpulane.coordinator.service.TaskService;
import gpulane.coordinator.simulation.SimulatedGpuWorker;
import gpulane.coordinator.store.Database;
import gpulane.coordinator.store.JdbcDiagnosticEventRepository;
import gpulane.coordinator.store.JdbcTaskRepository;
import gpulane.coordinator.validation.ConstraintValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(SchedulerConfig.fromEnv());
 * deps.warmUpLanes();
 * deps.startScheduler(); // start background tasks
 * GenerationRouter router = deps.router();
 * // ... use services ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final SchedulerConfig config;
    private final Database database;
    private final TaskRepository taskRepository;
    private final DiagnosticEventRepository eventRepository;
    private final ModelCatalog catalog;
    private final AsyncDiagnosticsEmitter diagnostics;
    private final LaneRegistry laneRegistry;
    private final AdmissionController admission;
    private final QueueExpiryHandler expiryHandler;
    private final DedicatedLanePool dedicatedLanes;
    private final SharedWorkerExecutor sharedWorker;
    private final ImageLaneExecutor imageLane;
    private final GenerationRouter router;
    private final TaskService taskService;
    private final SessionValidator sessionValidator;
    private final ExecutorService admissionExecutor;

    // Controllers
    private final HealthController healthController;
    private final GenerationController generationController;
    private final StatusController statusController;
    private final WorkerCallbackController workerCallbackController;
    private final LaneController laneController;
    private final DiagnosticsController diagnosticsController;

    // Background jobs
    private final StaleTaskReaper taskReaper;
    private final DegradedQueueSweeper queueSweeper;
    private final LaneAssignmentMonitor laneMonitor;

    // Router (lazy-initialized)
    private RouterHandler routerHandler;

    // Scheduler (lazy-initialized)
    private Scheduler scheduler;

    private Dependencies(SchedulerConfig config, GpuWorkerFactory workerFactory, SessionValidator sessionValidator) {
        this.config = config;
        this.sessionValidator = sessionValidator;
        Clock clock = config.clock();
        DegradedQueuePolicy policy = config.degradedQueuePolicy();
        String gpuClass = config.gpuClass();

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);
        this.catalog = ModelCatalog.loadDefault();

        // Repositories
        this.taskRepository = new JdbcTaskRepository(database);
        this.eventRepository = new JdbcDiagnosticEventRepository(database);
        this.diagnostics = new AsyncDiagnosticsEmitter(eventRepository, config.diagnosticsQueueCapacity());

        // Lanes and admission
        List<String> heavyModels = catalog.heavyModels().stream().map(ModelSpec::id).toList();
        this.laneRegistry = new LaneRegistry(heavyModels, config.laneHealthGrace(), clock, diagnostics);
        this.admission = new AdmissionController(policy, clock);
        this.expiryHandler = new QueueExpiryHandler(taskRepository, diagnostics, policy, clock);

        List<DedicatedLaneExecutor> executors = new ArrayList<>();
        for (String model : heavyModels) {
            executors.add(new DedicatedLaneExecutor(model, workerFactory.create(model), taskRepository,
                    diagnostics, clock, gpuClass));
        }
        this.dedicatedLanes = new DedicatedLanePool(executors);
        this.laneRegistry.addListener(dedicatedLanes);
        this.sharedWorker = new SharedWorkerExecutor(workerFactory.create("shared"), admission, expiryHandler,
                taskRepository, diagnostics, clock, gpuClass);
        this.imageLane = new ImageLaneExecutor(config.imageLaneConcurrency(), workerFactory.create("image"),
                taskRepository, diagnostics, clock, gpuClass);

        // Services
        this.router = new GenerationRouter(catalog, new ConstraintValidator(catalog), laneRegistry, admission,
                taskRepository, dedicatedLanes, sharedWorker, imageLane, diagnostics, clock,
                config.degradedAdmissionWait());
        this.taskService = new TaskService(taskRepository, admission, expiryHandler, clock, gpuClass);

        // Requests waiting for a degraded-queue slot park here, off the event loop
        this.admissionExecutor = Executors.newFixedThreadPool(policy.maxDepth(), r -> {
            Thread t = new Thread(r, "admission-wait");
            t.setDaemon(true);
            return t;
        });

        // Controllers (public API)
        this.healthController = new HealthController(database, taskService, admission);
        this.generationController = new GenerationController(router, policy, clock, admissionExecutor);
        this.statusController = new StatusController(taskService, config.publicBaseUrl());

        // Controllers (internal API)
        this.workerCallbackController = new WorkerCallbackController(taskService);
        this.laneController = new LaneController(laneRegistry, admission, router);
        this.diagnosticsController = new DiagnosticsController(eventRepository);

        // Background jobs
        this.taskReaper = new StaleTaskReaper(taskRepository, admission, diagnostics, clock);
        this.queueSweeper = new DegradedQueueSweeper(admission, expiryHandler);
        this.laneMonitor = new LaneAssignmentMonitor(laneRegistry, dedicatedLanes,
                config.laneAssignmentTimeout(), clock);

        log.info("Dependencies initialized successfully ({} dedicated lanes)", heavyModels.size());
    }

    /**
     * Create dependencies with the given config and simulated GPU workers.
     */
    public static Dependencies create(SchedulerConfig config) {
        ModelCatalog catalog = ModelCatalog.loadDefault();
        GpuWorkerFactory simulated = lane -> new SimulatedGpuWorker(lane, catalog,
                config.simulationDelayMinMs(), config.simulationDelayMaxMs(), config.simulationOomRate());
        return create(config, simulated, SessionValidator.rejectAll());
    }

    public static Dependencies create(SchedulerConfig config, GpuWorkerFactory workerFactory,
            SessionValidator sessionValidator) {
        return new Dependencies(config, workerFactory, sessionValidator);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(SchedulerConfig.fromEnv());
    }

    // Getters
    public SchedulerConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public TaskRepository taskRepository() {
        return taskRepository;
    }

    public DiagnosticEventRepository eventRepository() {
        return eventRepository;
    }

    public ModelCatalog catalog() {
        return catalog;
    }

    public AsyncDiagnosticsEmitter diagnostics() {
        return diagnostics;
    }

    public LaneRegistry laneRegistry() {
        return laneRegistry;
    }

    public AdmissionController admission() {
        return admission;
    }

    public DedicatedLanePool dedicatedLanes() {
        return dedicatedLanes;
    }

    public SharedWorkerExecutor sharedWorker() {
        return sharedWorker;
    }

    public ImageLaneExecutor imageLane() {
        return imageLane;
    }

    public GenerationRouter router() {
        return router;
    }

    public TaskService taskService() {
        return taskService;
    }

    public StaleTaskReaper taskReaper() {
        return taskReaper;
    }

    public DegradedQueueSweeper queueSweeper() {
        return queueSweeper;
    }

    public LaneAssignmentMonitor laneMonitor() {
        return laneMonitor;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     * This is the main entry point for serving HTTP requests.
     */
    public RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler(new ApiKeyAuthenticator(config.apiKey(), sessionValidator))
                    .registerController(healthController)
                    .registerController(generationController)
                    .registerController(statusController)
                    .registerController(workerCallbackController)
                    .registerController(laneController)
                    .registerController(diagnosticsController);
            log.info("RouterHandler created with {} controllers", routerHandler.controllerCount());
        }
        return routerHandler;
    }

    /**
     * Load every dedicated pipeline so the lanes start warm.
     */
    public void warmUpLanes() {
        dedicatedLanes.warmUpAll();
    }

    /**
     * Get the scheduler (creates it if not yet created).
     */
    public Scheduler scheduler() {
        if (scheduler == null) {
            scheduler = new Scheduler(taskReaper, queueSweeper, laneMonitor, config);
        }
        return scheduler;
    }

    /**
     * Start the background scheduler for reaping, queue expiry and lane checks.
     * Should be called after server startup.
     */
    public void startScheduler() {
        scheduler().start();
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        // Stop scheduler first
        if (scheduler != null) {
            try {
                scheduler.stop();
            } catch (Exception e) {
                log.warn("Error stopping scheduler: {}", e.getMessage());
            }
        }

        admissionExecutor.shutdownNow();
        closeQuietly("dedicated lanes", dedicatedLanes);
        closeQuietly("shared worker", sharedWorker);
        closeQuietly("image lane", imageLane);
        closeQuietly("diagnostics emitter", diagnostics);
        closeQuietly("database", database);

        log.info("Dependencies closed");
    }

    private static void closeQuietly(String name, AutoCloseable resource) {
        try {
            resource.close();
        } catch (Exception e) {
            log.warn("Error closing {}: {}", name, e.getMessage());
        }
    }
}
