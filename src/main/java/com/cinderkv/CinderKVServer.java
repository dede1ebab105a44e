package com.cinderkv;

import com.cinderkv.config.ServerConfig;
import com.cinderkv.core.InMemoryStore;
import com.cinderkv.core.KVStore;
import com.cinderkv.network.TcpServer;
import com.cinderkv.util.MetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * CinderKV Server entry point.
 * Starts a single-node, in-memory key-value server speaking RESP.
 */
public class CinderKVServer {

    private static final Logger logger = LoggerFactory.getLogger(CinderKVServer.class);

    public static final String VERSION = "1.0.0";

    private final ServerConfig config;
    private final KVStore store;
    private final MetricsCollector metrics;
    private final TcpServer tcpServer;
    private final CountDownLatch shutdownLatch;
    private final AtomicBoolean stopped;

    /**
     * Create a new CinderKV server with a fresh store.
     *
     * @param config the server configuration
     */
    public CinderKVServer(ServerConfig config) {
        this(config, new InMemoryStore(), new MetricsCollector());
    }

    /**
     * Create a server with custom store and metrics.
     *
     * @param config  the server configuration
     * @param store   the key-value store to use
     * @param metrics the metrics collector to use
     */
    public CinderKVServer(ServerConfig config, KVStore store, MetricsCollector metrics) {
        this.config = config;
        this.store = store;
        this.metrics = metrics;
        this.shutdownLatch = new CountDownLatch(1);
        this.stopped = new AtomicBoolean(false);
        metrics.bindKeyCount(store);
        this.tcpServer = new TcpServer(config, store, metrics);
    }

    /**
     * Start the server.
     */
    public void start() throws IOException {
        logger.info("Starting CinderKV Server v{}", VERSION);
        logger.info("Listen address: {}", config.getListen());

        tcpServer.start();

        logger.info("CinderKV Server started successfully on port {}", tcpServer.getPort());
    }

    /**
     * Start the server and block until stopped. Installs a shutdown hook so
     * that SIGINT/SIGTERM stop the server cleanly.
     */
    public void startAndBlock() throws IOException, InterruptedException {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutdown signal received");
            stop();
        }, "cinderkv-shutdown"));

        start();
        shutdownLatch.await();
    }

    /**
     * Stop the server.
     */
    public void stop() {
        if (stopped.getAndSet(true)) {
            return;
        }
        logger.info("Stopping CinderKV Server");

        tcpServer.stop();

        logger.info("{}", metrics.summary());
        shutdownLatch.countDown();
        logger.info("CinderKV Server stopped");
    }

    /**
     * Check if the server is running.
     */
    public boolean isRunning() {
        return tcpServer.isRunning();
    }

    /**
     * Get the bound port.
     */
    public int getPort() {
        return tcpServer.getPort();
    }

    /**
     * Get the underlying store.
     */
    public KVStore getStore() {
        return store;
    }

    /**
     * Get the metrics collector.
     */
    public MetricsCollector getMetrics() {
        return metrics;
    }

    /**
     * Get the number of active connections.
     */
    public int getConnectionCount() {
        return tcpServer.getConnectionCount();
    }

    /**
     * Main entry point.
     */
    public static void main(String[] args) {
        ServerConfig config = ServerConfig.fromEnvironment();

        // Parse command line arguments
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--listen":
                case "-l":
                    if (i + 1 >= args.length) {
                        exitWithError("--listen requires a value");
                    }
                    try {
                        config.setListen(args[++i]);
                    } catch (IllegalArgumentException e) {
                        exitWithError("Invalid listen address: " + e.getMessage());
                    }
                    break;
                case "--help":
                case "-h":
                    printHelp();
                    return;
                case "--version":
                case "-v":
                    System.out.println("CinderKV Server v" + VERSION);
                    return;
                default:
                    exitWithError("Unknown option: " + args[i]);
            }
        }

        printBanner();

        // Ensure logs directory exists
        ensureLogsDirectory();

        CinderKVServer server = new CinderKVServer(config);
        try {
            server.startAndBlock();
        } catch (IOException e) {
            logger.error("Failed to start server: {}", e.getMessage());
            System.exit(1);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void ensureLogsDirectory() {
        java.io.File logsDir = new java.io.File("logs");
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
        System.out.println("   ____ _           _           _  ____     __");
        System.out.println("  / ___(_)_ __   __| | ___ _ __| |/ /\\ \\   / /");
        System.out.println(" | |   | | '_ \\ / _` |/ _ \\ '__| ' /  \\ \\ / / ");
        System.out.println(" | |___| | | | | (_| |  __/ |  | . \\   \\ V /  ");
        System.out.println("  \\____|_|_| |_|\\__,_|\\___|_|  |_|\\_\\   \\_/   ");
        System.out.println();
        System.out.println("  In-Memory Key-Value Server v" + VERSION);
        System.out.println();
    }

    private static void exitWithError(String message) {
        System.err.println("Error: " + message);
        System.err.println("Use --help for usage information");
        System.exit(1);
    }

    private static void printHelp() {
        System.out.println("CinderKV Server - In-Memory Key-Value Server");
        System.out.println();
        System.out.println("Usage: cinderkv [options]");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  -l, --listen <addr>    Address to listen on, host:port (default: " + ServerConfig.DEFAULT_LISTEN + ")");
        System.out.println("  -h, --help             Show this help message");
        System.out.println("  -v, --version          Show version");
        System.out.println();
        System.out.println("Environment:");
        System.out.println("  CINDERKV_LISTEN            Listen address (or -Dcinderkv.listen)");
        System.out.println("  CINDERKV_READ_TIMEOUT_MS   Idle client timeout in ms, 0 = none (or -Dcinderkv.read.timeout.ms)");
        System.out.println();
        System.out.println("Examples:");
        System.out.println("  cinderkv --listen :6379");
        System.out.println("  cinderkv -l 127.0.0.1:5555");
        System.out.println();
    }
}
