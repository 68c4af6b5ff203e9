package inkwell;

import inkwell.coordinator.config.CoordinatorConfig;
import inkwell.coordinator.config.Dependencies;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Standalone coordinator entry point.
 *
 * Starts maintenance, the resolution monitor and the operator API, then blocks until the JVM
 * is asked to shut down. Agent adapters are registered by embedding applications through
 * {@link Dependencies#registerAgent}.
 */
public final class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) throws InterruptedException {
        CoordinatorConfig config = CoordinatorConfig.fromEnv();
        Dependencies deps = Dependencies.create(config);
        CountDownLatch stopped = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested, stopping coordinator...");
            deps.close();
            stopped.countDown();
        }, "inkwell-shutdown"));

        deps.start();
        try {
            deps.server().start();
        } catch (RuntimeException e) {
            log.error("Failed to start operator API on port {}", config.serverPort(), e);
            deps.close();
            System.exit(1);
        }

        log.info("Coordinator ready");
        stopped.await();
    }
}
