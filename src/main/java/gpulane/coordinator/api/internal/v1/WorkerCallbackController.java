package gpulane.coordinator.api.internal.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import gpulane.coordinator.api.Controller;
import gpulane.coordinator.api.internal.v1.dto.OperationResponse;
import gpulane.coordinator.api.internal.v1.dto.TaskCompleteRequest;
import gpulane.coordinator.api.internal.v1.dto.TaskFailRequest;
import gpulane.coordinator.api.internal.v1.dto.TaskProgressRequest;
import gpulane.coordinator.api.v1.dto.ErrorResponse;
import gpulane.coordinator.model.TransitionResult;
import gpulane.coordinator.server.RouterHandler;
import gpulane.coordinator.service.TaskService;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Callbacks from out-of-process GPU workers (internal API).
 * POST /internal/v1/tasks/{taskId}/start - Worker began inference
 * POST /internal/v1/tasks/{taskId}/progress - Progress report
 * POST /internal/v1/tasks/{taskId}/complete - Report completion (idempotent)
 * POST /internal/v1/tasks/{taskId}/fail - Report failure (idempotent)
 */
public class WorkerCallbackController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(WorkerCallbackController.class);

    private static final Pattern CALLBACK_PATTERN = Pattern
            .compile("^/internal/v1/tasks/([^/]+)/(start|progress|complete|fail)$");

    private final TaskService taskService;

    public WorkerCallbackController(TaskService taskService) {
        this.taskService = taskService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.POST) && CALLBACK_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        Matcher matcher = CALLBACK_PATTERN.matcher(path);
        if (!matcher.matches()) {
            return ControllerResponse.notFound("not_found", "Unknown task endpoint.");
        }
        String taskId = matcher.group(1);
        String operation = matcher.group(2);

        try {
            TransitionResult result = switch (operation) {
                case "start" -> taskService.start(taskId);
                case "progress" -> handleProgress(req, taskId);
                case "complete" -> handleComplete(req, taskId);
                default -> handleFail(req, taskId);
            };
            return respond(taskId, operation, result);

        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("Malformed JSON body: " + e.getOriginalMessage());
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Worker callback error", e);
            return ControllerResponse.error("internal error");
        }
    }

    private TransitionResult handleProgress(FullHttpRequest req, String taskId) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        TaskProgressRequest request = RouterHandler.mapper().readValue(body, TaskProgressRequest.class);
        request.validate();
        return taskService.reportProgress(taskId, request.progress(), request.stage());
    }

    private TransitionResult handleComplete(FullHttpRequest req, String taskId) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        TaskCompleteRequest request = RouterHandler.mapper().readValue(body, TaskCompleteRequest.class);
        request.validate();
        return taskService.complete(taskId, request.resultLocation());
    }

    private TransitionResult handleFail(FullHttpRequest req, String taskId) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        TaskFailRequest request = RouterHandler.mapper().readValue(body, TaskFailRequest.class);
        request.validate();
        return taskService.fail(taskId, request.error(), request.errorType());
    }

    private ControllerResponse respond(String taskId, String operation, TransitionResult result) throws Exception {
        return switch (result) {
            case APPLIED -> ControllerResponse.json(
                    RouterHandler.mapper().writeValueAsString(OperationResponse.success()));
            case ALREADY_TERMINAL -> ControllerResponse.json(
                    RouterHandler.mapper().writeValueAsString(OperationResponse.alreadyTerminal()));
            case INVALID_STATE -> ControllerResponse.error(HttpResponseStatus.CONFLICT,
                    ErrorResponse.of(409, "invalid_state",
                            "Task '" + taskId + "' cannot accept '" + operation + "' in its current state."));
            case NOT_FOUND -> ControllerResponse.error(HttpResponseStatus.NOT_FOUND,
                    ErrorResponse.of(404, "task_not_found", "Task '" + taskId + "' not found.")
                            .withUserAction("Verify task id and retry."));
        };
    }
}
