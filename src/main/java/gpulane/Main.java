package gpulane;

import gpulane.coordinator.config.Dependencies;
import gpulane.coordinator.config.SchedulerConfig;
import gpulane.coordinator.server.LaneSchedulerServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lane scheduler entry point.
 *
 * Wires dependencies, warms the dedicated lanes, starts the HTTP server and
 * then the background scheduler. A JVM shutdown hook stops everything.
 */
public final class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    private Main() {
    }

    public static void main(String[] args) throws Exception {
        SchedulerConfig config = SchedulerConfig.fromEnv();
        Dependencies deps = Dependencies.create(config);
        LaneSchedulerServer server = new LaneSchedulerServer(config.serverHost(), config.serverPort(),
                deps.routerHandler());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down lane scheduler...");
            server.stop();
            deps.close();
        }, "gpulane-shutdown"));

        try {
            deps.warmUpLanes();
            server.start();
            deps.startScheduler();
        } catch (Exception e) {
            log.error("Failed to start lane scheduler", e);
            server.stop();
            deps.close();
            throw e;
        }

        server.awaitClose();
    }
}
