package gpulane.coordinator.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import gpulane.coordinator.admission.AdmissionDecision;
import gpulane.coordinator.api.Controller;
import gpulane.coordinator.api.v1.dto.ErrorResponse;
import gpulane.coordinator.api.v1.dto.GenerateRequest;
import gpulane.coordinator.api.v1.dto.GenerateResponse;
import gpulane.coordinator.model.DegradedQueuePolicy;
import gpulane.coordinator.model.GenerationRequest;
import gpulane.coordinator.routing.GenerationRouter;
import gpulane.coordinator.routing.RouteDecision;
import gpulane.coordinator.server.RouterHandler;
import gpulane.coordinator.validation.ValidationResult;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Generation submission.
 * POST /generate - 202 on acceptance, 422 on validation failure, 503 when the
 * degraded queue is full. With an admission wait configured, routing runs on the
 * admission executor so a waiting request never holds the event loop.
 */
public class GenerationController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(GenerationController.class);
    private static final TypeReference<LinkedHashMap<String, Object>> BODY_TYPE = new TypeReference<>() {
    };

    private final GenerationRouter router;
    private final DegradedQueuePolicy policy;
    private final Clock clock;
    private final Executor admissionExecutor;

    /**
     * @param admissionExecutor runs routing when it may block waiting for a degraded-queue slot
     */
    public GenerationController(GenerationRouter router, DegradedQueuePolicy policy, Clock clock,
            Executor admissionExecutor) {
        this.router = router;
        this.policy = policy;
        this.clock = clock;
        this.admissionExecutor = admissionExecutor;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.POST) && "/generate".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        return handleAsync(ctx, req, path).join();
    }

    @Override
    public CompletableFuture<ControllerResponse> handleAsync(ChannelHandlerContext ctx, FullHttpRequest req,
            String path) {
        GenerationRequest request;
        try {
            String body = req.content().toString(StandardCharsets.UTF_8);
            request = GenerateRequest.parse(RouterHandler.mapper().readValue(body, BODY_TYPE), clock.instant());
        } catch (JsonProcessingException e) {
            return CompletableFuture.completedFuture(
                    ControllerResponse.badRequest("Malformed JSON body: " + e.getOriginalMessage()));
        }

        if (!router.waitsForAdmission()) {
            return CompletableFuture.completedFuture(respond(router.route(request)));
        }
        return CompletableFuture.supplyAsync(() -> respond(router.route(request)), admissionExecutor);
    }

    private ControllerResponse respond(RouteDecision decision) {
        try {
            return switch (decision.outcome()) {
                case ACCEPTED_DEDICATED, ACCEPTED_DEGRADED -> ControllerResponse.json(HttpResponseStatus.ACCEPTED,
                        RouterHandler.mapper().writeValueAsString(GenerateResponse.accepted(decision)));
                case REJECTED_INVALID -> validationError(decision.validation());
                case REJECTED_OVERLOADED -> overloaded(decision.admission());
            };
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize generate response", e);
            return ControllerResponse.error("failed to serialize response");
        }
    }

    private ControllerResponse validationError(ValidationResult validation) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("field", validation.field());
        metadata.put("expected", validation.expected());
        metadata.put("actual", validation.actual());
        ErrorResponse error = ErrorResponse.of(422, "validation_error", validation.message())
                .withMetadata(metadata);
        return ControllerResponse.error(HttpResponseStatus.UNPROCESSABLE_ENTITY, error);
    }

    private ControllerResponse overloaded(AdmissionDecision admission) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("depth", admission.depth());
        metadata.put("max_depth", admission.maxDepth());
        metadata.put("max_wait_seconds", policy.maxWaitSeconds());
        ErrorResponse error = ErrorResponse.of(503, policy.overflowCode(),
                "Generation queue is overloaded (depth=" + admission.depth() + ").")
                .withMetadata(metadata);
        return ControllerResponse.error(HttpResponseStatus.SERVICE_UNAVAILABLE, error);
    }
}
