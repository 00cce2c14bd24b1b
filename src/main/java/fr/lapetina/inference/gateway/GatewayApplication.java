package fr.lapetina.inference.gateway;

import fr.lapetina.inference.gateway.api.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Main entry point for the Federated Inference Gateway.
 */
public class GatewayApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(GatewayApplication.class);

    private final GatewayFactory factory;
    private final HttpServer httpServer;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    public GatewayApplication(String configPath) throws Exception {
        this(GatewayFactory.create(configPath));
    }

    /**
     * Wraps an already built factory, starting it.
     */
    public GatewayApplication(GatewayFactory factory) throws Exception {
        log.info("Starting Federated Inference Gateway...");

        this.factory = factory.start();
        try {
            this.httpServer = new HttpServer(factory.getConfig().getServer(), factory);
        } catch (Exception e) {
            factory.close();
            throw e;
        }

        log.info("Federated Inference Gateway initialized");
    }

    public void start() {
        httpServer.start();
        log.info("Federated Inference Gateway started on port {}", httpServer.getPort());
    }

    public void awaitShutdown() throws InterruptedException {
        shutdownLatch.await();
    }

    public void requestShutdown() {
        shutdownLatch.countDown();
    }

    public GatewayFactory getFactory() {
        return factory;
    }

    public int getPort() {
        return httpServer.getPort();
    }

    @Override
    public void close() {
        log.info("Shutting down Federated Inference Gateway...");

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

        log.info("Federated Inference Gateway shut down");
    }

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : "config.yaml";

        try {
            GatewayApplication app = new GatewayApplication(configPath);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                app.requestShutdown();
                app.close();
            }));

            app.start();
            app.awaitShutdown();

        } catch (Exception e) {
            log.error("Failed to start Federated Inference Gateway", e);
            System.exit(1);
        }
    }
}
