package com.medusa;

import com.medusa.core.InMemoryStore;
import com.medusa.core.KVStore;
import com.medusa.network.TcpServer;
import com.medusa.network.protocol.CommandDispatcher;
import com.medusa.util.MetricsCollector;
import com.medusa.util.MetricsHttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Medusa Server entry point.
 * Starts a single-node in-memory key-value store speaking the line protocol.
 */
public class MedusaServer {

    private static final Logger logger = LoggerFactory.getLogger(MedusaServer.class);

    private final ServerConfig config;
    private final KVStore store;
    private final MetricsCollector metrics;
    private final TcpServer tcpServer;
    private final CountDownLatch shutdownLatch;
    private final AtomicBoolean stopped;
    private MetricsHttpServer metricsHttpServer;

    /**
     * Create a server with a fresh store and metrics collector.
     *
     * @param config the server configuration
     */
    public MedusaServer(ServerConfig config) {
        this(config, new InMemoryStore(), new MetricsCollector());
    }

    /**
     * Create a server with custom store and metrics.
     *
     * @param config  the server configuration
     * @param store   the key-value store to use
     * @param metrics the metrics collector to use
     */
    public MedusaServer(ServerConfig config, KVStore store, MetricsCollector metrics) {
        this.config = config;
        this.store = store;
        this.metrics = metrics;
        this.tcpServer = new TcpServer(config, new CommandDispatcher(store, metrics), metrics);
        this.shutdownLatch = new CountDownLatch(1);
        this.stopped = new AtomicBoolean(false);
    }

    /**
     * Start the server.
     */
    public void start() throws IOException {
        logger.info("Starting Medusa Server v{}", InMemoryStore.VERSION);
        logger.info("Configuration: {}", config.describe());

        tcpServer.start();

        if (config.isMetricsEnabled()) {
            metricsHttpServer = new MetricsHttpServer(config.getHost(), config.getMetricsPort(), metrics, store);
            try {
                metricsHttpServer.start();
            } catch (IOException e) {
                logger.warn("Failed to start metrics HTTP server: {}", e.getMessage());
                metricsHttpServer = null;
            }
        }

        logger.info("Medusa Server started successfully");
    }

    /**
     * Start the server and block until stopped.
     */
    public void startAndBlock() throws IOException, InterruptedException {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutdown signal received");
            stop();
        }, "medusa-shutdown"));

        start();
        shutdownLatch.await();
    }

    /**
     * Stop the server. Further calls have no effect.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        logger.info("Stopping Medusa Server");

        if (metricsHttpServer != null) {
            metricsHttpServer.stop();
        }
        tcpServer.stop();

        shutdownLatch.countDown();
        logger.info("Medusa Server stopped");
        logger.info("Final metrics:\n{}", metrics.summary());
    }

    public boolean isRunning() {
        return tcpServer.isRunning();
    }

    /**
     * Get the port the server listens on, resolved once started.
     */
    public int getPort() {
        return tcpServer.getPort();
    }

    /**
     * Get the port of the metrics endpoint, or -1 when it is not running.
     */
    public int getMetricsPort() {
        return metricsHttpServer != null ? metricsHttpServer.getPort() : -1;
    }

    public KVStore getStore() {
        return store;
    }

    public MetricsCollector getMetrics() {
        return metrics;
    }

    public int getConnectionCount() {
        return tcpServer.getConnectionCount();
    }

    /**
     * Main entry point.
     */
    public static void main(String[] args) {
        ServerConfig.Builder builder = ServerConfig.fromEnvironment().toBuilder();

        try {
            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case "--host":
                        builder.host(requireValue(args, ++i, "--host"));
                        break;
                    case "--port":
                    case "-p":
                        builder.port(parseInt(requireValue(args, ++i, "--port"), "--port"));
                        break;
                    case "--max-connections":
                        builder.maxConnections(parseInt(requireValue(args, ++i, "--max-connections"),
                                "--max-connections"));
                        break;
                    case "--timeout":
                        builder.connectionTimeout(Duration.ofSeconds(
                                parseInt(requireValue(args, ++i, "--timeout"), "--timeout")));
                        builder.timeoutsEnabled(true);
                        break;
                    case "--metrics":
                        builder.metricsEnabled(true);
                        break;
                    case "--metrics-port":
                        builder.metricsPort(parseInt(requireValue(args, ++i, "--metrics-port"), "--metrics-port"));
                        builder.metricsEnabled(true);
                        break;
                    case "--help":
                    case "-h":
                        printHelp();
                        return;
                    case "--version":
                    case "-v":
                        System.out.println("Medusa Server v" + InMemoryStore.VERSION);
                        return;
                    default:
                        exitWithError("Unknown option: " + args[i]);
                }
            }
        } catch (IllegalArgumentException e) {
            exitWithError(e.getMessage());
        }

        printBanner();
        ensureLogsDirectory();

        MedusaServer server = new MedusaServer(builder.build());
        try {
            server.startAndBlock();
        } catch (IOException e) {
            logger.error("Failed to start server: {}", e.getMessage());
            System.exit(1);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static String requireValue(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException(option + " requires a value");
        }
        return args[index];
    }

    private static int parseInt(String value, String option) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + option + ": " + value, e);
        }
    }

    private static void ensureLogsDirectory() {
        File logsDir = new File("logs");
        if (!logsDir.exists()) {
            if (logsDir.mkdir()) {
                logger.info("Created logs directory");
            } else {
                logger.warn("Failed to create logs directory, file logging may not work");
            }
        }
    }

    private static void printBanner() {
        System.out.println();
        System.out.println("  __  __          _                 ");
        System.out.println(" |  \\/  | ___  __| |_   _ ___  __ _ ");
        System.out.println(" | |\\/| |/ _ \\/ _` | | | / __|/ _` |");
        System.out.println(" | |  | |  __/ (_| | |_| \\__ \\ (_| |");
        System.out.println(" |_|  |_|\\___|\\__,_|\\__,_|___/\\__,_|");
        System.out.println();
        System.out.println("  In-Memory Key-Value Store v" + InMemoryStore.VERSION);
        System.out.println();
    }

    private static void exitWithError(String message) {
        System.err.println("Error: " + message);
        System.err.println("Use --help for usage information");
        System.exit(1);
    }

    private static void printHelp() {
        System.out.println("Medusa Server - In-Memory Key-Value Store");
        System.out.println();
        System.out.println("Usage: medusa [options]");
        System.out.println();
        System.out.println("Options:");
        System.out.println("      --host <host>            Address to bind (default: " + ServerConfig.DEFAULT_HOST + ")");
        System.out.println("  -p, --port <port>            Port to listen on (default: " + ServerConfig.DEFAULT_PORT + ")");
        System.out.println("      --max-connections <n>    Maximum concurrent clients (default: "
                + ServerConfig.DEFAULT_MAX_CONNECTIONS + ")");
        System.out.println("      --timeout <seconds>      Close connections idle for this long");
        System.out.println("      --metrics                Serve metrics over HTTP");
        System.out.println("      --metrics-port <port>    Metrics HTTP port (default: "
                + ServerConfig.DEFAULT_METRICS_PORT + ")");
        System.out.println("  -h, --help                   Show this help message");
        System.out.println("  -v, --version                Show version");
        System.out.println();
        System.out.println("Environment:");
        System.out.println("  MEDUSA_HOST, MEDUSA_PORT, MEDUSA_MAX_CONNECTIONS, MEDUSA_TIMEOUT,");
        System.out.println("  MEDUSA_ENABLE_TIMEOUTS, MEDUSA_METRICS, MEDUSA_METRICS_PORT");
        System.out.println();
    }
}
