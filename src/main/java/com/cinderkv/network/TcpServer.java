package com.cinderkv.network;

import com.cinderkv.command.CommandDispatcher;
import com.cinderkv.config.ServerConfig;
import com.cinderkv.core.KVStore;
import com.cinderkv.util.MetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Blocking TCP server for CinderKV.
 * An acceptor thread hands every accepted socket to its own worker thread,
 * which serves the connection until the client leaves.
 */
public class TcpServer {

    private static final Logger logger = LoggerFactory.getLogger(TcpServer.class);

    private final ServerConfig config;
    private final MetricsCollector metrics;
    private final CommandDispatcher dispatcher;
    private final AtomicBoolean running;
    private final Map<String, ConnectionHandler> connections;
    private final ExecutorService workerPool;

    private volatile ServerSocket serverSocket;
    private volatile int port;
    private Thread acceptorThread;

    /**
     * Create a new TCP server.
     *
     * @param config  the listen address and socket settings
     * @param store   the key-value store to serve
     * @param metrics the metrics collector
     */
    public TcpServer(ServerConfig config, KVStore store, MetricsCollector metrics) {
        this.config = config;
        this.metrics = metrics;
        this.dispatcher = new CommandDispatcher(store, metrics);
        this.running = new AtomicBoolean(false);
        this.connections = new ConcurrentHashMap<>();
        this.port = config.getBindAddress().getPort();
        AtomicInteger threadCounter = new AtomicInteger();
        this.workerPool = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "cinderkv-conn-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Bind the listen address and start accepting connections.
     *
     * @throws IOException if the address cannot be bound
     */
    public void start() throws IOException {
        if (running.getAndSet(true)) {
            throw new IllegalStateException("Server already running");
        }

        try {
            ServerSocket socket = new ServerSocket();
            socket.setReuseAddress(true);
            socket.bind(config.getBindAddress());
            serverSocket = socket;
            port = socket.getLocalPort();
        } catch (IOException e) {
            running.set(false);
            throw e;
        }

        acceptorThread = new Thread(this::acceptLoop, "cinderkv-acceptor-" + port);
        acceptorThread.start();

        logger.info("CinderKV server listening on {}", serverSocket.getLocalSocketAddress());
    }

    private void acceptLoop() {
        while (running.get()) {
            try {
                Socket socket = serverSocket.accept();
                accept(socket);
            } catch (IOException e) {
                if (running.get()) {
                    logger.error("Accept error: {}", e.getMessage());
                }
            }
        }
    }

    private void accept(Socket socket) {
        try {
            socket.setTcpNoDelay(true);
            socket.setKeepAlive(true);
            socket.setSoTimeout(config.getReadTimeoutMs());
        } catch (IOException e) {
            logger.warn("Cannot configure connection from {}: {}", socket.getRemoteSocketAddress(), e.getMessage());
            try {
                socket.close();
            } catch (IOException closeEx) {
                logger.debug("Error closing socket: {}", closeEx.getMessage());
            }
            return;
        }

        ConnectionHandler handler = new ConnectionHandler(socket, dispatcher, metrics, this);
        connections.put(handler.getRemoteAddress(), handler);
        try {
            workerPool.execute(handler);
        } catch (RejectedExecutionException e) {
            logger.warn("Rejected connection from {}: server is stopping", handler.getRemoteAddress());
            handler.close();
            return;
        }

        logger.debug("Accepted connection from {}", handler.getRemoteAddress());
    }

    /**
     * Stop the server: close the listener and every open connection.
     */
    public void stop() {
        if (!running.getAndSet(false)) {
            return;
        }

        logger.info("Stopping CinderKV server on port {}", port);

        // Unblocks the acceptor
        if (serverSocket != null) {
            try {
                serverSocket.close();
            } catch (IOException e) {
                logger.debug("Error closing server socket: {}", e.getMessage());
            }
        }

        if (acceptorThread != null && acceptorThread != Thread.currentThread()) {
            try {
                acceptorThread.join(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        cleanup();
    }

    private void cleanup() {
        // Closing the sockets unblocks the workers
        for (ConnectionHandler handler : connections.values()) {
            handler.close();
        }
        connections.clear();

        workerPool.shutdown();
        try {
            if (!workerPool.awaitTermination(5, TimeUnit.SECONDS)) {
                workerPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            workerPool.shutdownNow();
            Thread.currentThread().interrupt();
        }

        logger.info("CinderKV server stopped on port {}", port);
    }

    /**
     * Check if the server is running.
     */
    public boolean isRunning() {
        return running.get();
    }

    /**
     * Get the number of active connections.
     */
    public int getConnectionCount() {
        return connections.size();
    }

    /**
     * Get the port this server is listening on. After {@link #start()} this is
     * the bound port, also when port 0 was configured.
     */
    public int getPort() {
        return port;
    }

    /**
     * Remove a connection from tracking.
     * Package-private, called by ConnectionHandler when connection is closed.
     */
    void removeConnection(String remoteAddress) {
        connections.remove(remoteAddress);
    }
}
