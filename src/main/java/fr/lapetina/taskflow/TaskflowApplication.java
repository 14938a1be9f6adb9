package fr.lapetina.taskflow;

import fr.lapetina.taskflow.api.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.CountDownLatch;

/**
 * Main entry point for the Taskflow backend.
 */
public class TaskflowApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TaskflowApplication.class);

    private final PipelineFactory factory;
    private final HttpServer httpServer;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    public TaskflowApplication(String configPath) throws IOException {
        this(PipelineFactory.create(configPath));
    }

    public TaskflowApplication(PipelineFactory factory) throws IOException {
        log.info("Starting Taskflow...");
        this.factory = factory.start();
        this.httpServer = new HttpServer(
                factory.getConfig().getServer(),
                factory.getPipeline(),
                factory.getMiddleware(),
                factory.getAuthenticator()
        );
        log.info("Taskflow initialized");
    }

    public void start() {
        httpServer.start();
        log.info("Taskflow started on port {} (environment={})",
                httpServer.getPort(), factory.getConfig().getEnvironment());
    }

    public void awaitShutdown() throws InterruptedException {
        shutdownLatch.await();
    }

    public void requestShutdown() {
        shutdownLatch.countDown();
    }

    public PipelineFactory getFactory() {
        return factory;
    }

    public int getPort() {
        return httpServer.getPort();
    }

    @Override
    public void close() {
        log.info("Shutting down Taskflow...");

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

        log.info("Taskflow shut down");
    }

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : "config.yaml";

        try {
            TaskflowApplication app = new TaskflowApplication(configPath);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                app.requestShutdown();
                app.close();
            }));

            app.start();
            app.awaitShutdown();

        } catch (Exception e) {
            log.error("Failed to start Taskflow", e);
            System.exit(1);
        }
    }
}
