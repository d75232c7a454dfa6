package gpulane.coordinator.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import gpulane.coordinator.auth.SessionValidator;
import gpulane.coordinator.config.Dependencies;
import gpulane.coordinator.config.SchedulerConfig;
import gpulane.coordinator.server.LaneSchedulerServer;
import gpulane.coordinator.support.FakeGpuWorker;
import gpulane.coordinator.support.TestDatabases;
import org.junit.jupiter.api.*;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test that hits the HTTP endpoints through the Netty server,
 * backed by an H2 database and fake GPU workers.
 */
class HttpEndpointIntegrationTest {

        private static final ObjectMapper MAPPER = new ObjectMapper();

        private final Map<String, FakeGpuWorker> workers = new ConcurrentHashMap<>();
        private final Map<String, CountDownLatch> gates = new ConcurrentHashMap<>();

        private HttpClient httpClient;
        private Dependencies deps;
        private LaneSchedulerServer server;
        private String baseUrl;

        @BeforeEach
        void setUp() {
                httpClient = HttpClient.newBuilder()
                                .connectTimeout(Duration.ofSeconds(5))
                                .build();
        }

        @AfterEach
        void tearDown() {
                gates.values().forEach(CountDownLatch::countDown);
                if (server != null) {
                        server.stop();
                }
                if (deps != null) {
                        deps.close();
                }
        }

        private void start(SchedulerConfig config, String... blockedLanes) throws Exception {
                for (String lane : blockedLanes) {
                        FakeGpuWorker worker = new FakeGpuWorker();
                        gates.put(lane, worker.blockGenerations());
                        workers.put(lane, worker);
                }
                deps = Dependencies.create(config,
                                lane -> workers.computeIfAbsent(lane, l -> new FakeGpuWorker()),
                                SessionValidator.rejectAll());
                deps.warmUpLanes();
                server = new LaneSchedulerServer("127.0.0.1", 0, deps.routerHandler());
                server.start();
                baseUrl = "http://127.0.0.1:" + server.boundPort();

                // Wait for server to be ready
                TimeUnit.MILLISECONDS.sleep(200);
        }

        private static SchedulerConfig config() {
                return SchedulerConfig.defaults()
                                .withDatabaseUrl(TestDatabases.memUrl("test-http-" + System.nanoTime()))
                                .withDegradedAdmissionWait(Duration.ZERO);
        }

        private HttpResponse<String> post(String path, String body) throws Exception {
                return httpClient.send(
                                HttpRequest.newBuilder()
                                                .uri(URI.create(baseUrl + path))
                                                .header("Content-Type", "application/json")
                                                .POST(HttpRequest.BodyPublishers.ofString(body))
                                                .build(),
                                HttpResponse.BodyHandlers.ofString());
        }

        private HttpResponse<String> get(String path) throws Exception {
                return httpClient.send(
                                HttpRequest.newBuilder()
                                                .uri(URI.create(baseUrl + path))
                                                .GET()
                                                .build(),
                                HttpResponse.BodyHandlers.ofString());
        }

        private String submit(String body) throws Exception {
                HttpResponse<String> response = post("/generate", body);
                assertEquals(202, response.statusCode(), "Generate should return 202. Body: " + response.body());
                JsonNode result = MAPPER.readTree(response.body());
                assertEquals("pending", result.get("status").asText());
                return result.get("task_id").asText();
        }

        private JsonNode status(String taskId) throws Exception {
                HttpResponse<String> response = get("/status/" + taskId);
                assertEquals(200, response.statusCode(), "Status should return 200. Body: " + response.body());
                return MAPPER.readTree(response.body());
        }

        private boolean awaitStatus(String taskId, String expected) throws InterruptedException {
                return TestDatabases.eventually(Duration.ofSeconds(5), () -> {
                        try {
                                return expected.equals(status(taskId).get("status").asText());
                        } catch (Exception e) {
                                return false;
                        }
                });
        }

        @Test
        @DisplayName("Generate on a warm lane returns 202 and the task finishes with a result url")
        void generateOnWarmLaneCompletes() throws Exception {
                start(config());

                String taskId = submit("""
                                {"model": "anisora", "prompt": "a lighthouse at dusk", "steps": 8}
                                """);

                assertTrue(awaitStatus(taskId, "done"), "Task should finish");
                JsonNode done = status(taskId);
                assertEquals(100, done.get("progress").asInt());
                assertEquals("dedicated", done.get("lane_mode").asText());
                assertFalse(done.has("fallback_activated"));
                assertEquals("mem://" + taskId, done.get("result_url").asText());
                assertEquals(1, workers.get("anisora").count("load:"), "Warm lane must not reload");
        }

        @Test
        @DisplayName("Fixed steps violation returns 422 with field metadata")
        void fixedStepsViolationReturns422() throws Exception {
                start(config());

                HttpResponse<String> response = post("/generate", """
                                {"model": "anisora", "prompt": "a lighthouse at dusk", "steps": 6}
                                """);

                assertEquals(422, response.statusCode());
                JsonNode error = MAPPER.readTree(response.body());
                assertEquals("validation_error", error.get("code").asText());
                assertEquals("steps", error.get("metadata").get("field").asText());
                assertEquals("8", error.get("metadata").get("expected").asText());
                assertEquals("6", error.get("metadata").get("actual").asText());
                assertNotNull(error.get("user_action"));
                assertEquals(0, workers.get("anisora").count("generate:"));
        }

        @Test
        @DisplayName("Full degraded queue returns 503 with depth metadata")
        void fullDegradedQueueReturns503() throws Exception {
                start(config().withDegradedQueue(1, Duration.ofSeconds(30)), "shared");

                HttpResponse<String> signal = post("/internal/v1/lanes/anisora/signals", """
                                {"signal": "quota_denied"}
                                """);
                assertEquals(200, signal.statusCode(), "Signal body: " + signal.body());
                JsonNode lane = MAPPER.readTree(signal.body());
                assertEquals("degraded_shared", lane.get("mode").asText());
                assertEquals("quota", lane.get("fallback_reason").asText());

                String first = submit("""
                                {"model": "anisora", "prompt": "first"}
                                """);

                HttpResponse<String> rejected = post("/generate", """
                                {"model": "anisora", "prompt": "second"}
                                """);
                assertEquals(503, rejected.statusCode(), "Body: " + rejected.body());
                JsonNode error = MAPPER.readTree(rejected.body());
                assertEquals("queue_overloaded", error.get("code").asText());
                assertEquals("Generation queue is overloaded (depth=1).", error.get("detail").asText());
                assertEquals(1, error.get("metadata").get("depth").asInt());
                assertEquals(1, error.get("metadata").get("max_depth").asInt());
                assertEquals(30, error.get("metadata").get("max_wait_seconds").asInt());

                JsonNode admitted = status(first);
                assertEquals("degraded_shared", admitted.get("lane_mode").asText());
                assertEquals("quota", admitted.get("fallback_reason").asText());
        }

        @Test
        @DisplayName("A request waiting for a degraded slot does not hold up other requests")
        void admissionWaitRunsOffEventLoop() throws Exception {
                start(config().withDegradedQueue(1, Duration.ofSeconds(30))
                                .withDegradedAdmissionWait(Duration.ofSeconds(10)), "shared");
                post("/internal/v1/lanes/anisora/signals", """
                                {"signal": "quota_denied"}
                                """);

                String first = submit("""
                                {"model": "anisora", "prompt": "first"}
                                """);
                CompletableFuture<HttpResponse<String>> waiting = httpClient.sendAsync(
                                HttpRequest.newBuilder()
                                                .uri(URI.create(baseUrl + "/generate"))
                                                .header("Content-Type", "application/json")
                                                .POST(HttpRequest.BodyPublishers.ofString("""
                                                                {"model": "anisora", "prompt": "second"}
                                                                """))
                                                .build(),
                                HttpResponse.BodyHandlers.ofString());
                TimeUnit.MILLISECONDS.sleep(200);

                for (int i = 0; i < 3; i++) {
                        assertEquals(200, get("/health").statusCode());
                        assertEquals(200, get("/status/" + first).statusCode());
                }
                assertFalse(waiting.isDone(), "Second request should still be waiting for a slot");

                gates.get("shared").countDown();

                HttpResponse<String> admitted = waiting.get(10, TimeUnit.SECONDS);
                assertEquals(202, admitted.statusCode(), "Body: " + admitted.body());
                JsonNode body = MAPPER.readTree(admitted.body());
                assertTrue(body.get("fallback_activated").asBoolean());
                assertTrue(awaitStatus(body.get("task_id").asText(), "done"));
        }

        @Test
        @DisplayName("Image requests fall back to the shared worker when the image lane is down")
        void imageFallbackToSharedWorker() throws Exception {
                start(config());
                deps.imageLane().close();

                HttpResponse<String> response = post("/generate", """
                                {"model": "pony", "prompt": "a red fox"}
                                """);
                assertEquals(202, response.statusCode(), "Body: " + response.body());
                JsonNode accepted = MAPPER.readTree(response.body());
                assertTrue(accepted.get("fallback_activated").asBoolean());
                String taskId = accepted.get("task_id").asText();

                assertTrue(awaitStatus(taskId, "done"));
                JsonNode done = status(taskId);
                assertEquals("degraded_shared", done.get("lane_mode").asText());
                assertEquals("capacity", done.get("fallback_reason").asText());
                assertTrue(done.get("fallback_activated").asBoolean());
                assertEquals(1, workers.get("shared").count("generate:" + taskId));
                assertEquals(0, workers.get("image").count("generate:"));
        }

        @Test
        @DisplayName("Unknown task id returns 404 task_not_found")
        void unknownTaskReturns404() throws Exception {
                start(config());

                HttpResponse<String> response = get("/status/no-such-task");

                assertEquals(404, response.statusCode());
                JsonNode error = MAPPER.readTree(response.body());
                assertEquals("task_not_found", error.get("code").asText());
                assertEquals("Task 'no-such-task' not found.", error.get("detail").asText());
        }

        @Test
        @DisplayName("Malformed JSON returns 400")
        void malformedJsonReturns400() throws Exception {
                start(config());

                HttpResponse<String> response = post("/generate", "{not json");

                assertEquals(400, response.statusCode());
        }

        @Test
        @DisplayName("Health reports healthy with queue depth")
        void healthReportsHealthy() throws Exception {
                start(config());

                HttpResponse<String> response = get("/health");

                assertEquals(200, response.statusCode());
                JsonNode health = MAPPER.readTree(response.body());
                assertEquals("healthy", health.get("status").asText());
                assertEquals("1.0.0", health.get("version").asText());
                assertEquals(0, health.get("queueDepth").asInt());
        }

        @Test
        @DisplayName("API key is required everywhere except /health")
        void apiKeyIsEnforced() throws Exception {
                start(config().withApiKey("secret-key"));

                assertEquals(401, get("/status/any").statusCode());
                assertEquals(401, get("/internal/v1/lanes").statusCode());
                assertEquals(200, get("/health").statusCode());

                HttpResponse<String> withHeader = httpClient.send(
                                HttpRequest.newBuilder()
                                                .uri(URI.create(baseUrl + "/internal/v1/lanes"))
                                                .header("X-API-Key", "secret-key")
                                                .GET()
                                                .build(),
                                HttpResponse.BodyHandlers.ofString());
                assertEquals(200, withHeader.statusCode());

                assertEquals(200, get("/internal/v1/lanes?api_key=secret-key").statusCode());
        }

        @Test
        @DisplayName("Worker callbacks drive a task and a late result is ignored")
        void workerCallbacksDriveTask() throws Exception {
                start(config(), "phr00t");

                String taskId = submit("""
                                {"model": "phr00t", "prompt": "rain on a window"}
                                """);
                assertTrue(awaitStatus(taskId, "processing"), "Task should start on its lane");

                HttpResponse<String> progress = post("/internal/v1/tasks/" + taskId + "/progress", """
                                {"progress": 70, "stage": "decoding"}
                                """);
                assertEquals(200, progress.statusCode(), "Body: " + progress.body());
                assertEquals(70, status(taskId).get("progress").asInt());

                HttpResponse<String> failed = post("/internal/v1/tasks/" + taskId + "/fail", """
                                {"error": "worker lost", "error_type": "ConnectionError"}
                                """);
                assertEquals(200, failed.statusCode(), "Body: " + failed.body());

                HttpResponse<String> lateComplete = post("/internal/v1/tasks/" + taskId + "/complete", """
                                {"result_location": "s3://late.mp4"}
                                """);
                assertEquals(200, lateComplete.statusCode());
                assertEquals("already terminal", MAPPER.readTree(lateComplete.body()).get("message").asText());

                // let the lane's own generation return; its result must be discarded
                FakeGpuWorker worker = workers.get("phr00t");
                long clearsBefore = worker.count("clear");
                gates.get("phr00t").countDown();
                assertTrue(TestDatabases.eventually(Duration.ofSeconds(5),
                                () -> worker.count("clear") > clearsBefore));

                JsonNode finalState = status(taskId);
                assertEquals("failed", finalState.get("status").asText());
                assertTrue(finalState.get("error_msg").asText().contains("worker lost"));
                assertFalse(finalState.has("result_url"));
        }

        @Test
        @DisplayName("Callbacks for unknown tasks return 404 and bad bodies 400")
        void callbackErrors() throws Exception {
                start(config());

                HttpResponse<String> unknown = post("/internal/v1/tasks/missing/complete", """
                                {"result_location": "s3://x.mp4"}
                                """);
                assertEquals(404, unknown.statusCode());

                HttpResponse<String> invalid = post("/internal/v1/tasks/missing/progress", """
                                {"progress": 150}
                                """);
                assertEquals(400, invalid.statusCode());
        }

        @Test
        @DisplayName("Lanes and diagnostics endpoints expose state and counters")
        void lanesAndDiagnostics() throws Exception {
                start(config());

                String taskId = submit("""
                                {"model": "pony", "prompt": "a red fox"}
                                """);
                assertTrue(awaitStatus(taskId, "done"));

                HttpResponse<String> lanes = get("/internal/v1/lanes");
                assertEquals(200, lanes.statusCode());
                JsonNode lanesBody = MAPPER.readTree(lanes.body());
                assertEquals(2, lanesBody.get("lanes").size());
                assertEquals(25, lanesBody.get("max_depth").asInt());
                assertEquals(1, lanesBody.get("routes").get("accepted_dedicated").asLong());

                HttpResponse<String> unknownLane = post("/internal/v1/lanes/pony/signals", """
                                {"signal": "quota_denied"}
                                """);
                assertEquals(404, unknownLane.statusCode());

                assertTrue(TestDatabases.eventually(Duration.ofSeconds(5), () -> {
                        try {
                                JsonNode diagnostics = MAPPER.readTree(get("/internal/v1/diagnostics?limit=10").body());
                                return diagnostics.get("cleanup_count").asLong() >= 1;
                        } catch (Exception e) {
                                return false;
                        }
                }), "post-generation cleanup should be recorded");

                assertEquals(400, get("/internal/v1/diagnostics?limit=abc").statusCode());
        }
}
