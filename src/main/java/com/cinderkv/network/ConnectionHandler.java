package com.cinderkv.network;

import com.cinderkv.command.CommandDispatcher;
import com.cinderkv.command.CommandParseException;
import com.cinderkv.network.protocol.ProtocolException;
import com.cinderkv.network.protocol.RespProtocol;
import com.cinderkv.network.protocol.Response;
import com.cinderkv.util.MetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.util.List;

/**
 * Serves one client connection on its own worker thread.
 * Requests are read, executed and answered strictly in order; each reply is
 * flushed before the next request is read.
 */
public class ConnectionHandler implements Runnable {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionHandler.class);
    private static final int BUFFER_SIZE = 64 * 1024;

    private final Socket socket;
    private final CommandDispatcher dispatcher;
    private final MetricsCollector metrics;
    private final TcpServer server;
    private final String clientAddress;
    private boolean closed = false;

    public ConnectionHandler(Socket socket, CommandDispatcher dispatcher, MetricsCollector metrics,
                             TcpServer server) {
        this.socket = socket;
        this.dispatcher = dispatcher;
        this.metrics = metrics;
        this.server = server;
        this.clientAddress = String.valueOf(socket.getRemoteSocketAddress());
        metrics.connectionOpened();
        logger.debug("New connection from {}", clientAddress);
    }

    @Override
    public void run() {
        try (InputStream in = new BufferedInputStream(socket.getInputStream(), BUFFER_SIZE);
             OutputStream out = new BufferedOutputStream(socket.getOutputStream(), BUFFER_SIZE)) {
            serve(in, out);
        } catch (ProtocolException e) {
            metrics.recordError(MetricsCollector.KIND_PARSE);
            logger.warn("Protocol violation from {} (closing connection): {}", clientAddress, e.getMessage());
        } catch (SocketTimeoutException e) {
            logger.debug("Connection from {} idle too long, closing", clientAddress);
        } catch (EOFException e) {
            logger.debug("Client {} disconnected mid-request: {}", clientAddress, e.getMessage());
        } catch (IOException e) {
            if (!isClosed()) {
                logger.warn("I/O error on {}: {}", clientAddress, e.getMessage());
            }
        } catch (RuntimeException e) {
            logger.error("Unexpected error on connection {}", clientAddress, e);
        } finally {
            close();
        }
    }

    private void serve(InputStream in, OutputStream out) throws IOException {
        while (!isClosed()) {
            Response response;
            try {
                List<byte[]> tokens = RespProtocol.readRequest(in);
                if (tokens == null) {
                    logger.debug("Client {} disconnected", clientAddress);
                    return;
                }
                response = dispatcher.handle(tokens);
            } catch (CommandParseException e) {
                metrics.recordError(MetricsCollector.KIND_PARSE);
                response = Response.error(e.getMessage());
            }
            RespProtocol.write(response, out);
            out.flush();
        }
    }

    private synchronized boolean isClosed() {
        return closed;
    }

    /**
     * Close the connection. Safe to call from any thread, and more than once.
     */
    public void close() {
        synchronized (this) {
            if (closed) {
                return; // Already closed
            }
            closed = true;
        }

        try {
            socket.close();
        } catch (IOException e) {
            logger.debug("Error closing connection: {}", e.getMessage());
        }

        // Remove from server's connection tracking
        if (server != null) {
            server.removeConnection(clientAddress);
        }

        metrics.connectionClosed();
        logger.debug("Connection closed: {}", clientAddress);
    }

    public String getRemoteAddress() {
        return clientAddress;
    }
}
