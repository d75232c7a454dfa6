package gpulane.coordinator.api.internal.v1;

import gpulane.coordinator.admission.AdmissionController;
import com.fasterxml.jackson.core.JsonProcessingException;
import gpulane.coordinator.api.Controller;
import gpulane.coordinator.api.internal.v1.dto.LaneSignalRequest;
import gpulane.coordinator.api.internal.v1.dto.LaneStateResponse;
import gpulane.coordinator.api.internal.v1.dto.LanesResponse;
import gpulane.coordinator.lane.LaneRegistry;
import gpulane.coordinator.lane.LaneSignal;
import gpulane.coordinator.model.LaneState;
import gpulane.coordinator.routing.GenerationRouter;
import gpulane.coordinator.server.RouterHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lane state (internal API).
 * GET /internal/v1/lanes - Lane snapshots, degraded queue depth and routing counters
 * POST /internal/v1/lanes/{model}/signals - Health or capacity callback
 */
public class LaneController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(LaneController.class);

    private static final String LIST_PATH = "/internal/v1/lanes";
    private static final Pattern SIGNAL_PATTERN = Pattern.compile("^/internal/v1/lanes/([^/]+)/signals$");

    private final LaneRegistry laneRegistry;
    private final AdmissionController admission;
    private final GenerationRouter router;

    public LaneController(LaneRegistry laneRegistry, AdmissionController admission, GenerationRouter router) {
        this.laneRegistry = laneRegistry;
        this.admission = admission;
        this.router = router;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.GET)) {
            return LIST_PATH.equals(path);
        }
        return method.equals(HttpMethod.POST) && SIGNAL_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (LIST_PATH.equals(path)) {
                return handleList();
            }

            Matcher matcher = SIGNAL_PATTERN.matcher(path);
            if (matcher.matches()) {
                return handleSignal(req, matcher.group(1));
            }

            return ControllerResponse.notFound("not_found", "Unknown lane endpoint.");

        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("Malformed JSON body: " + e.getOriginalMessage());
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Lane controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    private ControllerResponse handleList() throws Exception {
        Map<String, Long> routes = new LinkedHashMap<>();
        router.outcomeCounts().forEach((outcome, count) -> routes.put(outcome.wireName(), count));

        LanesResponse response = new LanesResponse(
                laneRegistry.snapshot().stream().map(LaneStateResponse::from).toList(),
                admission.depth(),
                admission.waitingCount(),
                admission.policy().maxDepth(),
                admission.policy().maxWaitSeconds(),
                routes);
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }

    private ControllerResponse handleSignal(FullHttpRequest req, String model) throws Exception {
        if (!laneRegistry.contains(model)) {
            return ControllerResponse.notFound("lane_not_found", "No dedicated lane for model '" + model + "'.");
        }
        String body = req.content().toString(StandardCharsets.UTF_8);
        LaneSignal signal = RouterHandler.mapper().readValue(body, LaneSignalRequest.class).toSignal();

        LaneState state = laneRegistry.apply(model, signal);
        log.info("Lane {} signal {} -> {}/{}", model, signal.wireName(), state.availability().wireName(),
                state.mode().wireName());
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(LaneStateResponse.from(state)));
    }
}
