package fr.lapetina.ollama.council;

import fr.lapetina.ollama.council.api.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Main entry point for the Ollama Council server.
 */
public class CouncilApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CouncilApplication.class);

    private final CouncilFactory factory;
    private final HttpServer httpServer;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    public CouncilApplication(String configPath) throws Exception {
        log.info("Starting Ollama Council...");

        this.factory = CouncilFactory.create(configPath).start();

        this.httpServer = new HttpServer(
                factory.getConfig().getServer().getPort(),
                factory.getConfig().getServer().getBacklog(),
                factory
        );

        log.info("Ollama Council initialized");
    }

    public void start() {
        httpServer.start();
        log.info("Ollama Council started on port {} with {} advisors",
                httpServer.getPort(), factory.currentRoster().size());
    }

    public void awaitShutdown() throws InterruptedException {
        shutdownLatch.await();
    }

    public void requestShutdown() {
        shutdownLatch.countDown();
    }

    public CouncilFactory getFactory() {
        return factory;
    }

    @Override
    public void close() {
        log.info("Shutting down Ollama Council...");

        try {
            httpServer.close();
        } catch (Exception e) {
            log.warn("Error closing HTTP server", e);
        }

        try {
            factory.close();
        } catch (Exception e) {
            log.warn("Error closing factory", e);
        }

        log.info("Ollama Council shut down");
    }

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : "council.yaml";

        try {
            CouncilApplication app = new CouncilApplication(configPath);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                app.requestShutdown();
                app.close();
            }));

            app.start();
            app.awaitShutdown();

        } catch (Exception e) {
            log.error("Failed to start Ollama Council", e);
            System.exit(1);
        }
    }
}
