package gpulane.coordinator.config;

import gpulane.coordinator.model.DegradedQueuePolicy;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;

/**
 * Configuration holder for the lane scheduler.
 * All settings have sensible defaults.
 */
public final class SchedulerConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/gpulane;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Server settings
    private int serverPort = 8080;
    private String serverHost = "0.0.0.0";
    private String publicBaseUrl = null;

    // Degraded queue
    private int degradedQueueMaxDepth = 25;
    private Duration degradedQueueMaxWait = Duration.ofSeconds(30);
    private Duration degradedAdmissionWait = Duration.ZERO;

    // Lanes
    private Duration laneHealthGrace = Duration.ofSeconds(60);
    private Duration laneAssignmentTimeout = Duration.ofSeconds(30);
    private int imageLaneConcurrency = 2;
    private String gpuClass = "A10G";

    // Background jobs
    private Duration reaperInterval = Duration.ofSeconds(30);
    private Duration queueSweepInterval = Duration.ofSeconds(1);
    private Duration laneMonitorInterval = Duration.ofSeconds(5);
    private int diagnosticsQueueCapacity = 10_000;

    // Simulated workers
    private int simulationDelayMinMs = 2000;
    private int simulationDelayMaxMs = 6000;
    private double simulationOomRate = 0.0;

    // Auth settings (optional)
    private String apiKey = null; // If set, requests must present it (header, query or session)

    private Clock clock = Clock.systemUTC();

    private SchedulerConfig() {
    }

    public static SchedulerConfig defaults() {
        return new SchedulerConfig();
    }

    public static SchedulerConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    /**
     * Read overrides from the given environment; unset or blank entries keep the defaults.
     */
    public static SchedulerConfig fromEnv(Map<String, String> env) {
        SchedulerConfig config = new SchedulerConfig();

        String dbUrl = env.get("LANESCHED_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String port = env.get("LANESCHED_PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = Integer.parseInt(port);
        }

        String apiKey = env.get("LANESCHED_API_KEY");
        if (apiKey != null && !apiKey.isBlank()) {
            config.apiKey = apiKey;
        }

        String baseUrl = env.get("PUBLIC_BASE_URL");
        if (baseUrl != null && !baseUrl.isBlank()) {
            config.publicBaseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        }

        String maxDepth = env.get("VIDEO_DEGRADED_QUEUE_MAX_DEPTH");
        if (maxDepth != null && !maxDepth.isBlank()) {
            config.degradedQueueMaxDepth = Integer.parseInt(maxDepth);
        }

        String maxWait = env.get("VIDEO_DEGRADED_QUEUE_MAX_WAIT_SECONDS");
        if (maxWait != null && !maxWait.isBlank()) {
            config.degradedQueueMaxWait = Duration.ofSeconds(Long.parseLong(maxWait));
        }

        String admissionWait = env.get("VIDEO_DEGRADED_ADMISSION_WAIT_SECONDS");
        if (admissionWait != null && !admissionWait.isBlank()) {
            config.degradedAdmissionWait = Duration.ofSeconds(Long.parseLong(admissionWait));
        }

        String healthGrace = env.get("VIDEO_LANE_HEALTH_GRACE_SECONDS");
        if (healthGrace != null && !healthGrace.isBlank()) {
            config.laneHealthGrace = Duration.ofSeconds(Long.parseLong(healthGrace));
        }

        String assignment = env.get("VIDEO_LANE_ASSIGNMENT_TIMEOUT_SECONDS");
        if (assignment != null && !assignment.isBlank()) {
            config.laneAssignmentTimeout = Duration.ofSeconds(Long.parseLong(assignment));
        }

        String imageConcurrency = env.get("IMAGE_CONCURRENCY");
        if (imageConcurrency != null && !imageConcurrency.isBlank()) {
            config.imageLaneConcurrency = Integer.parseInt(imageConcurrency);
        }

        String gpu = env.get("VIDEO_GPU");
        if (gpu != null && !gpu.isBlank()) {
            config.gpuClass = gpu;
        }

        return config;
    }

    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public String publicBaseUrl() {
        return publicBaseUrl;
    }

    public DegradedQueuePolicy degradedQueuePolicy() {
        return new DegradedQueuePolicy(degradedQueueMaxDepth, degradedQueueMaxWait, DegradedQueuePolicy.OVERFLOW_CODE);
    }

    /**
     * How long the router may block waiting for a degraded slot before rejecting.
     * Zero rejects a full queue immediately; never longer than the queue max wait.
     */
    public Duration degradedAdmissionWait() {
        return degradedAdmissionWait.compareTo(degradedQueueMaxWait) > 0 ? degradedQueueMaxWait : degradedAdmissionWait;
    }

    public Duration laneHealthGrace() {
        return laneHealthGrace;
    }

    public Duration laneAssignmentTimeout() {
        return laneAssignmentTimeout;
    }

    public int imageLaneConcurrency() {
        return imageLaneConcurrency;
    }

    public String gpuClass() {
        return gpuClass;
    }

    public Duration reaperInterval() {
        return reaperInterval;
    }

    public Duration queueSweepInterval() {
        return queueSweepInterval;
    }

    public Duration laneMonitorInterval() {
        return laneMonitorInterval;
    }

    public int diagnosticsQueueCapacity() {
        return diagnosticsQueueCapacity;
    }

    public String apiKey() {
        return apiKey;
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    public int simulationDelayMinMs() {
        return simulationDelayMinMs;
    }

    public int simulationDelayMaxMs() {
        return simulationDelayMaxMs;
    }

    public double simulationOomRate() {
        return simulationOomRate;
    }

    public Clock clock() {
        return clock;
    }

    // Fluent setters for testing/customization
    public SchedulerConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public SchedulerConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public SchedulerConfig withApiKey(String key) {
        this.apiKey = key;
        return this;
    }

    public SchedulerConfig withPublicBaseUrl(String url) {
        this.publicBaseUrl = url;
        return this;
    }

    public SchedulerConfig withDegradedQueue(int maxDepth, Duration maxWait) {
        this.degradedQueueMaxDepth = maxDepth;
        this.degradedQueueMaxWait = maxWait;
        return this;
    }

    public SchedulerConfig withDegradedAdmissionWait(Duration wait) {
        this.degradedAdmissionWait = wait;
        return this;
    }

    public SchedulerConfig withLaneHealthGrace(Duration grace) {
        this.laneHealthGrace = grace;
        return this;
    }

    public SchedulerConfig withLaneAssignmentTimeout(Duration timeout) {
        this.laneAssignmentTimeout = timeout;
        return this;
    }

    public SchedulerConfig withImageLaneConcurrency(int concurrency) {
        this.imageLaneConcurrency = concurrency;
        return this;
    }

    public SchedulerConfig withReaperInterval(Duration interval) {
        this.reaperInterval = interval;
        return this;
    }

    public SchedulerConfig withDiagnosticsQueueCapacity(int capacity) {
        this.diagnosticsQueueCapacity = capacity;
        return this;
    }

    public SchedulerConfig withSimulation(int delayMinMs, int delayMaxMs, double oomRate) {
        this.simulationDelayMinMs = delayMinMs;
        this.simulationDelayMaxMs = delayMaxMs;
        this.simulationOomRate = oomRate;
        return this;
    }

    public SchedulerConfig withClock(Clock clock) {
        this.clock = clock;
        return this;
    }

    @Override
    public String toString() {
        return "SchedulerConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", serverPort=" + serverPort +
                ", degradedQueue=" + degradedQueueMaxDepth + "/" + degradedQueueMaxWait.toSeconds() + "s" +
                ", laneHealthGrace=" + laneHealthGrace.toSeconds() + "s" +
                ", laneAssignmentTimeout=" + laneAssignmentTimeout.toSeconds() + "s" +
                ", apiKeySet=" + hasApiKey() +
                '}';
    }
}
