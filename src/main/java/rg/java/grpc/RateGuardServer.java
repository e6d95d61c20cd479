package rg.java.grpc;

import io.grpc.Server;
import io.grpc.ServerBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rg.java.engine.RateGuardEngine;
import rg.java.engine.RateGuardFactory;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Standalone gRPC server for the rate guard service.
 *
 * <p>Features:
 * <ul>
 *   <li>Configurable port (default: 9090)</li>
 *   <li>Graceful shutdown with timeout, then engine teardown</li>
 *   <li>Policy from {@code rate-guard.properties} and {@code -Drate-guard.*} overrides</li>
 *   <li>SystemClock for production</li>
 * </ul>
 *
 * <p>Usage:
 * <pre>
 * // Run with defaults
 * java -cp rate-guard.jar rg.java.grpc.RateGuardServer
 *
 * // Run with custom port and a tighter idea limit
 * java -Drate-guard.idea-limit=3 -cp rate-guard.jar rg.java.grpc.RateGuardServer 8080
 * </pre>
 */
public final class RateGuardServer {

    private static final Logger log = LoggerFactory.getLogger(RateGuardServer.class);

    private static final int DEFAULT_PORT = 9090;
    private static final int SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final Server server;
    private final RateGuardEngine engine;

    /**
     * Creates a server on the specified port with the default engine.
     *
     * @param port Port to listen on
     */
    public RateGuardServer(int port) {
        this(port, RateGuardFactory.createDefault());
    }

    /**
     * Creates a server with custom engine (useful for testing).
     *
     * @param port Port to listen on
     * @param engine Rate guard engine, destroyed when the server stops
     */
    public RateGuardServer(int port, RateGuardEngine engine) {
        this.engine = engine;
        this.server = ServerBuilder.forPort(port)
            .addService(new RateGuardServiceImpl(engine))
            .build();
    }

    /**
     * Starts the server.
     *
     * @throws IOException if server fails to start
     */
    public void start() throws IOException {
        server.start();
        log.info("RateGuardServer started on port {} with {}", server.getPort(), engine.getPolicy());

        // Graceful shutdown hook
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down gRPC server (JVM shutdown hook)");
            try {
                RateGuardServer.this.stop();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Shutdown interrupted", e);
            }
        }));
    }

    /**
     * Stops the server gracefully and destroys the engine.
     *
     * @throws InterruptedException if shutdown is interrupted
     */
    public void stop() throws InterruptedException {
        try {
            server.shutdown().awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } finally {
            engine.destroy();
        }
        log.info("RateGuardServer stopped");
    }

    /**
     * Blocks until server is terminated.
     *
     * @throws InterruptedException if waiting is interrupted
     */
    public void blockUntilShutdown() throws InterruptedException {
        server.awaitTermination();
    }

    /**
     * Returns the port the server is listening on.
     *
     * @return port number, or -1 if not started
     */
    public int getPort() {
        return server.getPort();
    }

    /**
     * Main entry point.
     *
     * @param args Optional: port number
     * @throws IOException if server fails to start
     * @throws InterruptedException if server is interrupted
     */
    public static void main(String[] args) throws IOException, InterruptedException {
        int port = DEFAULT_PORT;

        if (args.length > 0) {
            try {
                port = Integer.parseInt(args[0]);
            } catch (NumberFormatException e) {
                log.error("Invalid port: {}", args[0]);
                System.exit(1);
            }
        }

        RateGuardServer server = new RateGuardServer(port);
        server.start();
        server.blockUntilShutdown();
    }
}
