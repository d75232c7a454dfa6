package gpulane.coordinator.routing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import gpulane.coordinator.admission.AdmissionController;
import gpulane.coordinator.admission.AdmissionDecision;
import gpulane.coordinator.config.ModelCatalog;
import gpulane.coordinator.config.ModelSpec;
import gpulane.coordinator.diagnostics.DiagnosticsEmitter;
import gpulane.coordinator.execution.DedicatedLanePool;
import gpulane.coordinator.execution.ImageLaneExecutor;
import gpulane.coordinator.execution.SharedWorkerExecutor;
import gpulane.coordinator.lane.LaneRegistry;
import gpulane.coordinator.model.DiagnosticEventType;
import gpulane.coordinator.model.FallbackReason;
import gpulane.coordinator.model.GenerationRequest;
import gpulane.coordinator.model.LaneMode;
import gpulane.coordinator.model.LaneState;
import gpulane.coordinator.model.MemoryDiagnosticEvent;
import gpulane.coordinator.model.Task;
import gpulane.coordinator.repository.TaskRepository;
import gpulane.coordinator.validation.ConstraintValidator;
import gpulane.coordinator.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.LongAdder;

/**
 * Decides where a generation request runs, in a fixed order:
 * <ol>
 * <li>validate; an invalid request touches no lane or queue state</li>
 * <li>image models go to the image lane, or to the shared worker when that lane is down</li>
 * <li>a ready, dedicated lane takes the request directly</li>
 * <li>otherwise the request needs a degraded-queue ticket; without one it is
 * rejected as overloaded and nothing is created</li>
 * </ol>
 */
public class GenerationRouter {

    private static final Logger log = LoggerFactory.getLogger(GenerationRouter.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ModelCatalog catalog;
    private final ConstraintValidator validator;
    private final LaneRegistry laneRegistry;
    private final AdmissionController admission;
    private final TaskRepository taskRepository;
    private final DedicatedLanePool dedicatedLanes;
    private final SharedWorkerExecutor sharedWorker;
    private final ImageLaneExecutor imageLane;
    private final DiagnosticsEmitter diagnostics;
    private final Clock clock;
    private final Duration admissionWait;
    private final Map<RouteOutcome, LongAdder> counters = new EnumMap<>(RouteOutcome.class);

    public GenerationRouter(ModelCatalog catalog,
            ConstraintValidator validator,
            LaneRegistry laneRegistry,
            AdmissionController admission,
            TaskRepository taskRepository,
            DedicatedLanePool dedicatedLanes,
            SharedWorkerExecutor sharedWorker,
            ImageLaneExecutor imageLane,
            DiagnosticsEmitter diagnostics,
            Clock clock,
            Duration admissionWait) {
        this.catalog = catalog;
        this.validator = validator;
        this.laneRegistry = laneRegistry;
        this.admission = admission;
        this.taskRepository = taskRepository;
        this.dedicatedLanes = dedicatedLanes;
        this.sharedWorker = sharedWorker;
        this.imageLane = imageLane;
        this.diagnostics = diagnostics;
        this.clock = clock;
        this.admissionWait = admissionWait;
        for (RouteOutcome outcome : RouteOutcome.values()) {
            counters.put(outcome, new LongAdder());
        }
    }

    public RouteDecision route(GenerationRequest request) {
        ValidationResult validation = validator.validate(request);
        if (!validation.valid()) {
            log.info("Rejected {} request: {}", request.model(), validation.message());
            return record(RouteDecision.invalid(validation));
        }

        ModelSpec spec = catalog.find(request.model()).orElseThrow();
        String taskId = UUID.randomUUID().toString();
        Task.Builder task = Task.builder()
                .id(taskId)
                .model(spec.id())
                .kind(spec.kind())
                .mode(validation.mode())
                .parameters(toJson(request.prompt(), validation.normalizedParameters()))
                .createdAt(request.arrival());

        if (!spec.isHeavy()) {
            if (imageLane.isAccepting()) {
                Task created = task.build();
                taskRepository.save(created);
                imageLane.submit(created);
                log.debug("Task {} ({}) sent to image lane", taskId, spec.id());
                return record(RouteDecision.dedicated(taskId, null));
            }
            log.warn("Image lane unavailable, sending {} request to the shared worker", spec.id());
            return routeDegraded(taskId, task, spec, FallbackReason.CAPACITY, request);
        }

        LaneState lane = laneRegistry.resolve(spec.id());
        if (lane.isDispatchable()) {
            Task created = task.laneMode(LaneMode.DEDICATED).build();
            taskRepository.save(created);
            dedicatedLanes.submit(created);
            log.debug("Task {} ({}) sent to dedicated lane", taskId, spec.id());
            return record(RouteDecision.dedicated(taskId, LaneMode.DEDICATED));
        }

        // a cold or unavailable lane still in dedicated mode counts as a capacity fallback
        FallbackReason reason = lane.fallbackReason() != null ? lane.fallbackReason() : FallbackReason.CAPACITY;
        return routeDegraded(taskId, task, spec, reason, request);
    }

    private RouteDecision routeDegraded(String taskId, Task.Builder task, ModelSpec spec, FallbackReason reason,
            GenerationRequest request) {
        AdmissionDecision decision = admissionWait.isZero()
                ? admission.tryAdmit(taskId, spec.id(), request.arrival())
                : admission.awaitAdmission(taskId, spec.id(), request.arrival(), admissionWait);

        if (!decision.admitted()) {
            log.warn("Degraded queue full for {} (depth={}/{}), rejecting", spec.id(), decision.depth(),
                    decision.maxDepth());
            diagnostics.emit(MemoryDiagnosticEvent.builder(DiagnosticEventType.QUEUE_OVERLOADED)
                    .model(spec.id())
                    .laneMode(LaneMode.DEGRADED_SHARED)
                    .value(decision.depth())
                    .reason("max_depth")
                    .timestamp(clock.instant())
                    .build());
            return record(RouteDecision.overloaded(reason, decision));
        }

        Task created = task.laneMode(LaneMode.DEGRADED_SHARED)
                .fallbackReason(reason)
                .fallbackActivated(true)
                .build();
        try {
            taskRepository.save(created);
        } catch (RuntimeException e) {
            admission.release(taskId);
            throw e;
        }

        diagnostics.emit(MemoryDiagnosticEvent.builder(DiagnosticEventType.FALLBACK_ACTIVATED)
                .taskId(taskId)
                .model(spec.id())
                .laneMode(LaneMode.DEGRADED_SHARED)
                .reason(reason)
                .timestamp(clock.instant())
                .build());
        diagnostics.emit(MemoryDiagnosticEvent.builder(DiagnosticEventType.QUEUE_ADMITTED)
                .taskId(taskId)
                .model(spec.id())
                .laneMode(LaneMode.DEGRADED_SHARED)
                .value(decision.depth())
                .timestamp(clock.instant())
                .build());

        sharedWorker.submit(created);
        log.info("Task {} ({}) admitted to degraded queue (reason={}, depth={})", taskId, spec.id(),
                reason.wireName(), decision.depth());
        return record(RouteDecision.degraded(taskId, reason, decision));
    }

    /**
     * True when routing may block waiting for a degraded-queue slot.
     */
    public boolean waitsForAdmission() {
        return !admissionWait.isZero();
    }

    /**
     * Number of decisions per outcome since start.
     */
    public Map<RouteOutcome, Long> outcomeCounts() {
        Map<RouteOutcome, Long> snapshot = new EnumMap<>(RouteOutcome.class);
        counters.forEach((outcome, adder) -> snapshot.put(outcome, adder.sum()));
        return snapshot;
    }

    public long count(RouteOutcome outcome) {
        return counters.get(outcome).sum();
    }

    private RouteDecision record(RouteDecision decision) {
        counters.get(decision.outcome()).increment();
        return decision;
    }

    private static String toJson(String prompt, Map<String, Object> parameters) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("prompt", prompt);
        payload.putAll(parameters);
        try {
            return MAPPER.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("parameters are not serializable: " + e.getOriginalMessage(), e);
        }
    }
}
