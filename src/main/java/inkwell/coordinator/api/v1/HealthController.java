package inkwell.coordinator.api.v1;

import inkwell.coordinator.api.Controller;
import inkwell.coordinator.api.v1.dto.HealthResponse;
import inkwell.coordinator.pipeline.PipelineScheduler;
import inkwell.coordinator.queue.MessageQueue;
import inkwell.coordinator.server.RouterHandler;
import inkwell.coordinator.store.Database;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.time.Duration;

/**
 * Health check controller.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);
    private static final String VERSION = "1.0.0";

    private final Database database;
    private final MessageQueue queue;
    private final PipelineScheduler scheduler;

    public HealthController(Database database, MessageQueue queue, PipelineScheduler scheduler) {
        this.database = database;
        this.queue = queue;
        this.scheduler = scheduler;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (!database.isHealthy()) {
                return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                        RouterHandler.mapper().writeValueAsString(HealthResponse.unhealthy("connection failed")));
            }

            HealthResponse response = HealthResponse.healthy(
                    formatUptime(), VERSION, scheduler.activeRuns().size(), queue.stats());
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));

        } catch (Exception e) {
            log.error("Health check failed", e);
            return ControllerResponse.unavailable("health check failed");
        }
    }

    private String formatUptime() {
        Duration uptime = Duration.ofMillis(ManagementFactory.getRuntimeMXBean().getUptime());
        return uptime.toHours() + "h " + uptime.toMinutesPart() + "m";
    }
}
