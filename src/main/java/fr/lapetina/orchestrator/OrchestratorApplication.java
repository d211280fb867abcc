package fr.lapetina.orchestrator;

import fr.lapetina.orchestrator.api.HttpServer;
import fr.lapetina.orchestrator.infrastructure.config.OrchestratorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Main entry point for the orchestrator service.
 */
public class OrchestratorApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorApplication.class);

    private final OrchestratorFactory factory;
    private final HttpServer httpServer;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    public OrchestratorApplication(String configPath) throws Exception {
        log.info("Starting AI orchestrator...");

        this.factory = OrchestratorFactory.create(configPath).start();

        OrchestratorConfig.ServerConfig server = factory.getConfig().getServer();
        this.httpServer = server.isEnabled()
                ? new HttpServer(
                        server.getHost(),
                        server.getPort(),
                        server.getBacklog(),
                        factory.getService(),
                        factory.getMetricsRegistry(),
                        factory.getConfigLoader(),
                        factory.getObjectMapper(),
                        factory.getClock())
                : null;

        log.info("AI orchestrator initialized");
    }

    public void start() {
        if (httpServer != null) {
            httpServer.start();
            log.info("AI orchestrator started on port {}", httpServer.getPort());
        } else {
            log.info("AI orchestrator started without HTTP server");
        }
    }

    public void awaitShutdown() throws InterruptedException {
        shutdownLatch.await();
    }

    public void requestShutdown() {
        shutdownLatch.countDown();
    }

    public OrchestratorFactory getFactory() {
        return factory;
    }

    @Override
    public void close() {
        log.info("Shutting down AI orchestrator...");

        if (httpServer != null) {
            try {
                httpServer.close();
            } catch (Exception e) {
                log.warn("Error closing HTTP server", e);
            }
        }

        try {
            factory.close();
        } catch (Exception e) {
            log.warn("Error closing factory", e);
        }

        log.info("AI orchestrator shut down");
    }

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : "config.yaml";

        try {
            OrchestratorApplication app = new OrchestratorApplication(configPath);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                app.requestShutdown();
                app.close();
            }));

            app.start();
            app.awaitShutdown();

        } catch (Exception e) {
            log.error("Failed to start AI orchestrator", e);
            System.exit(1);
        }
    }
}
