package taskescrow;

import taskescrow.registry.config.Dependencies;
import taskescrow.registry.config.RegistryConfig;
import taskescrow.registry.server.RegistryNettyServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Application entry point.
 *
 * Wires the registry from environment config, starts the HTTP server and
 * blocks until the JVM is asked to shut down.
 */
public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws InterruptedException {
        RegistryConfig config = RegistryConfig.fromEnv();

        Dependencies deps = Dependencies.create(config);
        RegistryNettyServer server = new RegistryNettyServer(deps.routerHandler());
        CountDownLatch stopped = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Application closing, stopping server...");
            try {
                server.stop();
            } finally {
                deps.close();
                stopped.countDown();
            }
        }, "taskescrow-shutdown"));

        try {
            server.start(config.serverHost(), config.serverPort());
        } catch (RuntimeException e) {
            log.error("Failed to start task registry server", e);
            deps.close();
            System.exit(1);
        }

        stopped.await();
    }
}
