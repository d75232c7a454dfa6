package gpulane.coordinator.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import gpulane.coordinator.api.Controller;
import gpulane.coordinator.api.Controller.ControllerResponse;
import gpulane.coordinator.auth.ApiKeyAuthenticator;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_TYPE;
import static io.netty.handler.codec.http.HttpResponseStatus.INTERNAL_SERVER_ERROR;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Central router that dispatches HTTP requests to registered controllers.
 *
 * Every path except {@code /health} goes through the {@link ApiKeyAuthenticator}.
 * Unmatched paths return 404; every error body has the
 * {@code {code, detail, user_action}} shape.
 *
 * This handler is @Sharable because it has no per-channel state.
 */
@Sharable
public class RouterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .findAndRegisterModules();

    private static final String HEALTH_PATH = "/health";

    private final List<Controller> controllers = new ArrayList<>();
    private final ApiKeyAuthenticator authenticator;

    public RouterHandler(ApiKeyAuthenticator authenticator) {
        this.authenticator = authenticator;
    }

    /**
     * Register a controller to handle requests.
     * Controllers are checked in order of registration.
     */
    public RouterHandler registerController(Controller controller) {
        controllers.add(controller);
        log.debug("Registered controller: {}", controller.getClass().getSimpleName());
        return this;
    }

    public int controllerCount() {
        return controllers.size();
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        String uri = req.uri();
        HttpMethod method = req.method();

        // Extract path without query string
        String path = uri.contains("?") ? uri.substring(0, uri.indexOf("?")) : uri;

        try {
            if (!HEALTH_PATH.equals(path) && !authenticator.authenticate(req)) {
                log.warn("Auth failed for {} {}", method, path);
                write(ctx, ControllerResponse.unauthorized("Missing or invalid credentials."));
                return;
            }

            for (Controller controller : controllers) {
                if (controller.matches(method, path)) {
                    CompletableFuture<ControllerResponse> pending = controller.handleAsync(ctx, req, path);
                    if (pending.isDone()) {
                        write(ctx, pending.join());
                    } else {
                        pending.whenComplete((response, error) -> ctx.executor().execute(() -> write(ctx,
                                error == null ? response : failureResponse(method, path, unwrap(error)))));
                    }
                    return;
                }
            }

            log.debug("No handler for: {} {}", method, path);
            write(ctx, ControllerResponse.notFound("not_found", "No route for " + method + " " + path + "."));

        } catch (Throwable t) {
            write(ctx, failureResponse(method, path, unwrap(t)));
        }
    }

    private static ControllerResponse failureResponse(HttpMethod method, String path, Throwable t) {
        if (t instanceof IllegalArgumentException) {
            log.warn("Validation error: {}", t.getMessage());
            return ControllerResponse.badRequest(t.getMessage());
        }
        log.error("Handler error: {} {} - Exception: {}", method, path, t.toString(), t);
        return ControllerResponse.error("Internal error while handling the request.");
    }

    private static Throwable unwrap(Throwable t) {
        return t instanceof CompletionException && t.getCause() != null ? t.getCause() : t;
    }

    private void write(ChannelHandlerContext ctx, ControllerResponse response) {
        writeSafe(ctx, response.status(), response.contentType(), response.body());
    }

    /**
     * Safe write that catches any exceptions during response writing.
     * Ensures we never silently close the connection.
     */
    private void writeSafe(ChannelHandlerContext ctx, HttpResponseStatus status, String contentType, String body) {
        try {
            if (body == null) {
                body = "";
            }
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            FullHttpResponse response = new DefaultFullHttpResponse(HTTP_1_1, status, Unpooled.wrappedBuffer(bytes));
            response.headers().set(CONTENT_TYPE, contentType + "; charset=utf-8");
            response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
            ctx.writeAndFlush(response);
        } catch (Throwable t) {
            log.error("Failed to write response: {}", t.getMessage(), t);
            try {
                byte[] errorBytes = "{\"code\":\"internal_error\",\"detail\":\"Failed to write response.\",\"user_action\":\"Retry later.\"}"
                        .getBytes(StandardCharsets.UTF_8);
                FullHttpResponse errorResponse = new DefaultFullHttpResponse(HTTP_1_1, INTERNAL_SERVER_ERROR,
                        Unpooled.wrappedBuffer(errorBytes));
                errorResponse.headers().set(CONTENT_TYPE, "application/json; charset=utf-8");
                errorResponse.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, errorBytes.length);
                ctx.writeAndFlush(errorResponse);
            } catch (Throwable t2) {
                log.error("Complete failure writing error response", t2);
                ctx.close();
            }
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Unhandled exception in channel: {}", cause.getMessage(), cause);
        ctx.close();
    }

    /**
     * Get the shared ObjectMapper for JSON serialization.
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
