package inkwell.coordinator.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import inkwell.coordinator.api.Controller;
import inkwell.coordinator.api.v1.dto.RunResponse;
import inkwell.coordinator.api.v1.dto.StartRunRequest;
import inkwell.coordinator.api.v1.dto.TaskLogResponse;
import inkwell.coordinator.model.PipelineRun;
import inkwell.coordinator.monitor.PipelineMonitor;
import inkwell.coordinator.pipeline.PipelineScheduler;
import inkwell.coordinator.pipeline.PipelineScheduler.AbortResult;
import inkwell.coordinator.repository.TaskLogRepository;
import inkwell.coordinator.server.RouterHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for pipeline runs.
 *
 * POST /api/v1/runs - Start a run for a topic
 * GET /api/v1/runs/{runId} - Run status with per-stage reports
 * GET /api/v1/runs/{runId}/tasks - Task log of the run
 * POST /api/v1/runs/{runId}/abort - Abort a running run
 */
public class RunController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(RunController.class);

    private static final Pattern RUNS_PATTERN = Pattern.compile("^/api/v1/runs$");
    private static final Pattern RUN_BY_ID_PATTERN = Pattern.compile("^/api/v1/runs/([^/]+)$");
    private static final Pattern RUN_TASKS_PATTERN = Pattern.compile("^/api/v1/runs/([^/]+)/tasks$");
    private static final Pattern RUN_ABORT_PATTERN = Pattern.compile("^/api/v1/runs/([^/]+)/abort$");

    private final PipelineScheduler scheduler;
    private final PipelineMonitor monitor;
    private final TaskLogRepository taskLog;

    public RunController(PipelineScheduler scheduler, PipelineMonitor monitor, TaskLogRepository taskLog) {
        this.scheduler = scheduler;
        this.monitor = monitor;
        this.taskLog = taskLog;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return RUNS_PATTERN.matcher(path).matches() || RUN_ABORT_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.GET)) {
            return RUN_BY_ID_PATTERN.matcher(path).matches() || RUN_TASKS_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (req.method().equals(HttpMethod.POST)) {
                if (RUNS_PATTERN.matcher(path).matches()) {
                    return handleStart(req);
                }
                Matcher abortMatcher = RUN_ABORT_PATTERN.matcher(path);
                if (abortMatcher.matches()) {
                    return handleAbort(abortMatcher.group(1));
                }
            }

            Matcher tasksMatcher = RUN_TASKS_PATTERN.matcher(path);
            if (req.method().equals(HttpMethod.GET) && tasksMatcher.matches()) {
                return handleTasks(tasksMatcher.group(1));
            }

            Matcher runMatcher = RUN_BY_ID_PATTERN.matcher(path);
            if (req.method().equals(HttpMethod.GET) && runMatcher.matches()) {
                return handleGetRun(runMatcher.group(1));
            }

            return ControllerResponse.notFound("unknown run endpoint");

        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Run controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    private ControllerResponse handleStart(FullHttpRequest req) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        if (body.isBlank()) {
            throw new IllegalArgumentException("request body is required");
        }
        StartRunRequest request;
        try {
            request = RouterHandler.mapper().readValue(body, StartRunRequest.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("invalid JSON body");
        }
        request.validate();

        PipelineRun run = scheduler.start(request.topic(), request.options());
        return ControllerResponse.json(
                HttpResponseStatus.CREATED,
                RouterHandler.mapper().writeValueAsString(RunResponse.started(run)));
    }

    private ControllerResponse handleGetRun(String runId) throws Exception {
        Optional<PipelineRun> run = scheduler.status(runId);
        if (run.isEmpty()) {
            return ControllerResponse.notFound("run not found");
        }
        RunResponse response = RunResponse.from(run.get(), monitor.metrics(runId));
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }

    private ControllerResponse handleTasks(String runId) throws Exception {
        if (scheduler.status(runId).isEmpty()) {
            return ControllerResponse.notFound("run not found");
        }
        List<TaskLogResponse> tasks = taskLog.findByRun(runId).stream()
                .map(TaskLogResponse::from)
                .toList();
        Map<String, Object> response = Map.of(
                "runId", runId,
                "count", tasks.size(),
                "tasks", tasks);
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }

    private ControllerResponse handleAbort(String runId) throws Exception {
        AbortResult result = scheduler.abort(runId);
        return switch (result) {
            case ACCEPTED -> ControllerResponse.json(
                    HttpResponseStatus.ACCEPTED,
                    RouterHandler.mapper().writeValueAsString(Map.of("runId", runId, "abort", "requested")));
            case ALREADY_TERMINAL -> ControllerResponse.conflict("run already finished");
            case NOT_FOUND -> ControllerResponse.notFound("run not found");
        };
    }
}
