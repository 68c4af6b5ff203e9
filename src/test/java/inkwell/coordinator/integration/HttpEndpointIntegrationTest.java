package inkwell.coordinator.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import inkwell.coordinator.agent.AgentAdapter;
import inkwell.coordinator.agent.AgentContext;
import inkwell.coordinator.agent.AgentResult;
import inkwell.coordinator.config.CoordinatorConfig;
import inkwell.coordinator.config.Dependencies;
import inkwell.coordinator.config.PipelineConfig;
import inkwell.coordinator.model.Stage;
import inkwell.coordinator.model.TaskMessage;
import inkwell.coordinator.server.RouterHandler;
import org.junit.jupiter.api.*;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test that drives runs through the operator HTTP API.
 */
class HttpEndpointIntegrationTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final int TEST_PORT = 18080;
    private static final String BASE_URL = "http://localhost:" + TEST_PORT;
    private static final List<String> ROLES = List.of("researcher", "writer", "editor", "seo", "image", "publisher");

    private final CountDownLatch researchGate = new CountDownLatch(1);
    private Dependencies deps;
    private HttpClient httpClient;
    private volatile boolean gateResearch = false;

    @BeforeEach
    void setUp() {
        httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    @AfterEach
    void tearDown() {
        researchGate.countDown();
        if (deps != null) {
            deps.close();
        }
    }

    private void startServer(String operatorKey) throws Exception {
        CoordinatorConfig config = CoordinatorConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-http-" + System.nanoTime()
                        + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE")
                .withServerPort(TEST_PORT)
                .withOperatorKey(operatorKey);
        PipelineConfig pipeline = PipelineConfig.defaults().toBuilder()
                .stageDeadline(Duration.ofSeconds(5))
                .pollInterval(Duration.ofMillis(20))
                .build();

        deps = Dependencies.create(config, pipeline);
        for (String role : ROLES) {
            deps.registerAgent(new EchoAgent(role));
        }
        deps.start();
        deps.server().start();
    }

    private final class EchoAgent implements AgentAdapter {
        private final String role;

        EchoAgent(String role) {
            this.role = role;
        }

        @Override
        public String role() {
            return role;
        }

        @Override
        public AgentResult perform(TaskMessage task, AgentContext context) throws Exception {
            if (gateResearch && task.stage() == Stage.RESEARCHING) {
                researchGate.await(10, TimeUnit.SECONDS);
            }
            return AgentResult.complete(role + " on " + context.topic() + ": " + task.subject());
        }
    }

    private HttpResponse<String> post(String path, String body, String key) throws Exception {
        HttpRequest.Builder request = HttpRequest.newBuilder()
                .uri(URI.create(BASE_URL + path))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body));
        if (key != null) {
            request.header(RouterHandler.KEY_HEADER, key);
        }
        return httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> get(String path) throws Exception {
        return httpClient.send(
                HttpRequest.newBuilder().uri(URI.create(BASE_URL + path)).GET().build(),
                HttpResponse.BodyHandlers.ofString());
    }

    private JsonNode getRun(String runId) throws Exception {
        HttpResponse<String> response = get("/api/v1/runs/" + runId);
        assertEquals(200, response.statusCode(), "Body: " + response.body());
        return MAPPER.readTree(response.body());
    }

    @Test
    @DisplayName("Full HTTP flow: start a run, follow it to completion, read its task log")
    void runCompletesThroughHttp() throws Exception {
        startServer(null);

        HttpResponse<String> created = post("/api/v1/runs", "{\"topic\":\"Kelp forests\"}", null);
        assertEquals(201, created.statusCode(), "Body: " + created.body());
        JsonNode started = MAPPER.readTree(created.body());
        String runId = started.get("runId").asText();
        assertTrue(runId.startsWith("run-kelp-forests-"), runId);
        assertEquals("RUNNING", started.get("status").asText());

        await().atMost(Duration.ofSeconds(20))
                .pollInterval(Duration.ofMillis(100))
                .until(() -> !"RUNNING".equals(getRun(runId).get("status").asText()));

        JsonNode run = getRun(runId);
        assertEquals("COMPLETED", run.get("status").asText());
        assertEquals("completed", run.get("currentStage").asText());
        assertFalse(run.get("degraded").asBoolean());
        assertEquals(6, run.get("stages").size());
        for (JsonNode stage : run.get("stages")) {
            assertEquals("COMPLETED", stage.get("status").asText(), stage.get("stage").asText());
        }
        assertEquals(10, run.get("metrics").get("tasksDispatched").asInt());

        HttpResponse<String> tasks = get("/api/v1/runs/" + runId + "/tasks");
        assertEquals(200, tasks.statusCode());
        JsonNode taskLog = MAPPER.readTree(tasks.body());
        assertEquals(10, taskLog.get("count").asInt());
        for (JsonNode task : taskLog.get("tasks")) {
            assertEquals("SUCCESS", task.get("outcome").asText());
        }

        assertEquals("Kelp forests", deps.memoryStore().require(runId, "input/topic"));
        assertEquals(2, run.get("metrics").get("roles").get("researcher").get("succeeded").asInt());
    }

    @Test
    void runOptionsAreAcceptedAndEchoed() throws Exception {
        startServer(null);

        HttpResponse<String> created = post("/api/v1/runs",
                "{\"topic\":\"Sea otters\",\"styleGuide\":\"warm, concrete\",\"targetLength\":750}", null);
        assertEquals(201, created.statusCode(), "Body: " + created.body());
        JsonNode started = MAPPER.readTree(created.body());
        assertEquals("warm, concrete", started.get("styleGuide").asText());
        assertEquals(750, started.get("targetLength").asInt());

        JsonNode run = getRun(started.get("runId").asText());
        assertEquals(750, run.get("targetLength").asInt());

        assertEquals(400, post("/api/v1/runs", "{\"topic\":\"Sea otters\",\"targetLength\":0}", null).statusCode());
    }

    @Test
    void abortThroughHttp() throws Exception {
        gateResearch = true;
        startServer(null);

        JsonNode started = MAPPER.readTree(post("/api/v1/runs", "{\"topic\":\"Glaciers\"}", null).body());
        String runId = started.get("runId").asText();
        await().atMost(Duration.ofSeconds(5))
                .until(() -> "researching".equals(getRun(runId).get("currentStage").asText()));

        HttpResponse<String> abort = post("/api/v1/runs/" + runId + "/abort", "", null);
        assertEquals(202, abort.statusCode(), "Body: " + abort.body());
        assertEquals("requested", MAPPER.readTree(abort.body()).get("abort").asText());

        await().atMost(Duration.ofSeconds(10))
                .until(() -> "ABORTED".equals(getRun(runId).get("status").asText()));

        HttpResponse<String> again = post("/api/v1/runs/" + runId + "/abort", "", null);
        assertEquals(409, again.statusCode());

        JsonNode run = getRun(runId);
        assertEquals("researching", run.get("currentStage").asText());
        assertEquals("ABORTED", run.get("stages").get(0).get("status").asText());
        assertEquals("PENDING", run.get("stages").get(1).get("status").asText());
    }

    @Test
    void badRequestsAreRejected() throws Exception {
        startServer(null);

        assertEquals(400, post("/api/v1/runs", "", null).statusCode());
        assertEquals(400, post("/api/v1/runs", "{\"topic\":\"  \"}", null).statusCode());
        assertEquals(400, post("/api/v1/runs", "{not json", null).statusCode());

        HttpResponse<String> unknown = get("/api/v1/runs/run-missing");
        assertEquals(404, unknown.statusCode());
        assertEquals("run not found", MAPPER.readTree(unknown.body()).get("error").asText());
        assertEquals(404, get("/api/v1/runs/run-missing/tasks").statusCode());
        assertEquals(404, post("/api/v1/runs/run-missing/abort", "", null).statusCode());
        assertEquals(404, get("/metrics").statusCode());
    }

    @Test
    void healthReportsQueueAndActiveRuns() throws Exception {
        startServer(null);

        HttpResponse<String> response = get("/api/v1/health");

        assertEquals(200, response.statusCode());
        JsonNode health = MAPPER.readTree(response.body());
        assertEquals("healthy", health.get("status").asText());
        assertEquals("ok", health.get("database").asText());
        assertEquals(0, health.get("activeRuns").asInt());
        assertTrue(health.has("queue"));
    }

    @Test
    void operatorKeyGuardsMutatingCalls() throws Exception {
        startServer("s3cret");

        HttpResponse<String> denied = post("/api/v1/runs", "{\"topic\":\"Dunes\"}", null);
        assertEquals(403, denied.statusCode());
        assertEquals(403, post("/api/v1/runs", "{\"topic\":\"Dunes\"}", "wrong").statusCode());

        HttpResponse<String> allowed = post("/api/v1/runs", "{\"topic\":\"Dunes\"}", "s3cret");
        assertEquals(201, allowed.statusCode(), "Body: " + allowed.body());

        // reads stay open
        assertEquals(200, get("/api/v1/health").statusCode());
    }
}
