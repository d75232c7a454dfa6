package gpulane.coordinator.api.internal.v1;

import gpulane.coordinator.api.Controller;
import gpulane.coordinator.api.internal.v1.dto.DiagnosticsResponse;
import gpulane.coordinator.diagnostics.DiagnosticsSnapshot;
import gpulane.coordinator.repository.DiagnosticEventRepository;
import gpulane.coordinator.server.RouterHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Operational events (internal API).
 * GET /internal/v1/diagnostics?limit=N - Counters plus the N most recent events
 */
public class DiagnosticsController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(DiagnosticsController.class);

    private static final int DEFAULT_LIMIT = 50;
    private static final int MAX_LIMIT = 500;

    private final DiagnosticEventRepository eventRepository;

    public DiagnosticsController(DiagnosticEventRepository eventRepository) {
        this.eventRepository = eventRepository;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/internal/v1/diagnostics".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            int limit = parseLimit(new QueryStringDecoder(req.uri()).parameters().get("limit"));
            DiagnosticsSnapshot snapshot = DiagnosticsSnapshot.from(eventRepository.countByType());
            DiagnosticsResponse response = DiagnosticsResponse.from(snapshot, eventRepository.findRecent(limit));
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));

        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Diagnostics controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    private static int parseLimit(List<String> values) {
        if (values == null || values.isEmpty()) {
            return DEFAULT_LIMIT;
        }
        try {
            int limit = Integer.parseInt(values.get(0));
            if (limit <= 0) {
                throw new IllegalArgumentException("limit must be positive");
            }
            return Math.min(limit, MAX_LIMIT);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("limit must be an integer");
        }
    }
}
