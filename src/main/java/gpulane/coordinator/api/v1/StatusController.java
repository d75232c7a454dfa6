package gpulane.coordinator.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import gpulane.coordinator.api.Controller;
import gpulane.coordinator.api.v1.dto.ErrorResponse;
import gpulane.coordinator.api.v1.dto.StatusResponse;
import gpulane.coordinator.model.Task;
import gpulane.coordinator.server.RouterHandler;
import gpulane.coordinator.service.TaskService;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Task status polling.
 * GET /status/{task_id}
 */
public class StatusController implements Controller {

    private static final Pattern STATUS_PATTERN = Pattern.compile("^/status/([^/]+)$");

    private final TaskService taskService;
    private final String publicBaseUrl;

    public StatusController(TaskService taskService, String publicBaseUrl) {
        this.taskService = taskService;
        this.publicBaseUrl = publicBaseUrl;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && STATUS_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        Matcher matcher = STATUS_PATTERN.matcher(path);
        if (!matcher.matches()) {
            return ControllerResponse.notFound("not_found", "Unknown status endpoint.");
        }
        String taskId = matcher.group(1);

        Optional<Task> task = taskService.findTask(taskId);
        if (task.isEmpty()) {
            ErrorResponse error = ErrorResponse.of(404, "task_not_found", "Task '" + taskId + "' not found.")
                    .withUserAction("Verify task id and retry.");
            return ControllerResponse.error(HttpResponseStatus.NOT_FOUND, error);
        }

        try {
            return ControllerResponse.json(
                    RouterHandler.mapper().writeValueAsString(StatusResponse.from(task.get(), publicBaseUrl)));
        } catch (JsonProcessingException e) {
            return ControllerResponse.error("failed to serialize task status");
        }
    }
}
