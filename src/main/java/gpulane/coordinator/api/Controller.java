package gpulane.coordinator.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import gpulane.coordinator.api.v1.dto.ErrorResponse;
import gpulane.coordinator.server.RouterHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;

import java.io.UncheckedIOException;
import java.util.concurrent.CompletableFuture;

/**
 * Base interface for HTTP controllers.
 * Controllers handle specific URL patterns and HTTP methods.
 */
public interface Controller {

    /**
     * Check if this controller can handle the given request.
     *
     * @param method HTTP method
     * @param path   Request path (without query string)
     * @return true if this controller handles this request
     */
    boolean matches(HttpMethod method, String path);

    /**
     * Handle the request.
     *
     * @param ctx  Netty channel context
     * @param req  Full HTTP request
     * @param path Request path (without query string)
     * @return Response to send back
     */
    ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path);

    /**
     * Handle the request, possibly completing off the event loop.
     * The request is released once this returns, so read it before handing off.
     */
    default CompletableFuture<ControllerResponse> handleAsync(ChannelHandlerContext ctx, FullHttpRequest req,
            String path) {
        return CompletableFuture.completedFuture(handle(ctx, req, path));
    }

    /**
     * Response from a controller.
     */
    record ControllerResponse(
            HttpResponseStatus status,
            String contentType,
            String body) {

        public static ControllerResponse json(String body) {
            return new ControllerResponse(HttpResponseStatus.OK, "application/json", body);
        }

        public static ControllerResponse json(HttpResponseStatus status, String body) {
            return new ControllerResponse(status, "application/json", body);
        }

        public static ControllerResponse error(HttpResponseStatus status, ErrorResponse error) {
            try {
                return json(status, RouterHandler.mapper().writeValueAsString(error));
            } catch (JsonProcessingException e) {
                throw new UncheckedIOException("Failed to serialize error response", e);
            }
        }

        public static ControllerResponse error(HttpResponseStatus status, String code, String detail) {
            return error(status, ErrorResponse.of(status.code(), code, detail));
        }

        public static ControllerResponse badRequest(String message) {
            return error(HttpResponseStatus.BAD_REQUEST, "bad_request", message);
        }

        public static ControllerResponse notFound(String code, String detail) {
            return error(HttpResponseStatus.NOT_FOUND, code, detail);
        }

        public static ControllerResponse error(String message) {
            return error(HttpResponseStatus.INTERNAL_SERVER_ERROR, "internal_error", message);
        }

        public static ControllerResponse unauthorized(String message) {
            return error(HttpResponseStatus.UNAUTHORIZED, "unauthorized", message);
        }
    }
}
