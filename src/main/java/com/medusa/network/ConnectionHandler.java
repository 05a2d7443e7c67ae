package com.medusa.network;

import com.medusa.network.protocol.CommandDispatcher;
import com.medusa.network.protocol.Response;
import com.medusa.util.MetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;

/**
 * Serves one client connection on its own thread.
 * Reads request lines, dispatches each one and writes the reply before reading the next,
 * so replies are returned in request order.
 */
public class ConnectionHandler implements Runnable {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionHandler.class);

    static final String WELCOME = "Welcome to Medusa server! Type HELP for a list of commands.\n";

    private final Socket socket;
    private final CommandDispatcher dispatcher;
    private final MetricsCollector metrics;
    private final TcpServer server;
    private final String clientAddress;
    private volatile boolean closed = false;

    ConnectionHandler(Socket socket, CommandDispatcher dispatcher, MetricsCollector metrics, TcpServer server) {
        this.socket = socket;
        this.dispatcher = dispatcher;
        this.metrics = metrics;
        this.server = server;
        this.clientAddress = String.valueOf(socket.getRemoteSocketAddress());
    }

    @Override
    public void run() {
        metrics.connectionOpened();
        logger.debug("New connection from {}", clientAddress);
        try {
            BufferedReader reader = new BufferedReader(
                    new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
            Writer writer = new BufferedWriter(
                    new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8));

            writer.write(WELCOME);
            writer.flush();

            String line;
            while (!closed && (line = reader.readLine()) != null) {
                logger.trace("Received from {}: {}", clientAddress, line);
                Response response = dispatcher.dispatch(line.trim());
                writer.write(response.encode());
                writer.flush();
                if (response.shouldClose()) {
                    logger.debug("Client {} quit", clientAddress);
                    break;
                }
            }
        } catch (SocketTimeoutException e) {
            logger.debug("Closing idle connection from {}", clientAddress);
        } catch (IOException e) {
            if (!closed) {
                logger.warn("I/O error on connection from {}: {}", clientAddress, e.getMessage());
            }
        } catch (RuntimeException e) {
            logger.error("Unexpected error on connection from {}: {}", clientAddress, e.toString(), e);
        } finally {
            close();
            server.removeConnection(this);
            metrics.connectionClosed();
        }
    }

    /**
     * Close the connection. Safe to call more than once and from other threads.
     */
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            socket.close();
        } catch (IOException e) {
            logger.debug("Error closing connection: {}", e.getMessage());
        }
        logger.debug("Connection closed: {}", clientAddress);
    }

    public String getRemoteAddress() {
        return clientAddress;
    }

    public boolean isClosed() {
        return closed;
    }
}
