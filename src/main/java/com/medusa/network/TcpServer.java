package com.medusa.network;

import com.medusa.ServerConfig;
import com.medusa.network.protocol.CommandDispatcher;
import com.medusa.util.MetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Blocking TCP server for Medusa.
 * A single accept thread hands every connection to its own worker thread. The number
 * of open connections is capped by the configured limit; connections over it are
 * told so and closed.
 */
public class TcpServer {

    private static final Logger logger = LoggerFactory.getLogger(TcpServer.class);

    private static final int ACCEPT_TIMEOUT_MS = 1000; // lets the accept loop notice shutdown
    private static final String REJECT_MESSAGE = "ERROR: Max connections reached\n";

    private final ServerConfig config;
    private final CommandDispatcher dispatcher;
    private final MetricsCollector metrics;
    private final AtomicBoolean running;
    private final Set<ConnectionHandler> connections;
    private final ThreadPoolExecutor workerPool;

    private ServerSocket serverSocket;
    private Thread acceptThread;
    private volatile int boundPort;

    /**
     * Create a new TCP server.
     *
     * @param config     listener settings (host, port, limits, timeouts)
     * @param dispatcher executes the commands read from clients
     * @param metrics    the metrics collector
     */
    public TcpServer(ServerConfig config, CommandDispatcher dispatcher, MetricsCollector metrics) {
        this.config = config;
        this.dispatcher = dispatcher;
        this.metrics = metrics;
        this.running = new AtomicBoolean(false);
        this.connections = ConcurrentHashMap.newKeySet();
        AtomicInteger threadIds = new AtomicInteger();
        this.workerPool = new ThreadPoolExecutor(
                0,
                Integer.MAX_VALUE,
                60L,
                TimeUnit.SECONDS,
                new SynchronousQueue<>(),
                r -> {
                    Thread t = new Thread(r, "medusa-conn-" + threadIds.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                },
                new ThreadPoolExecutor.AbortPolicy());
        this.boundPort = config.getPort();
    }

    /**
     * Start the server.
     *
     * @throws IOException if the server cannot be started
     */
    public void start() throws IOException {
        if (running.getAndSet(true)) {
            throw new IllegalStateException("Server already running");
        }

        try {
            serverSocket = new ServerSocket();
            serverSocket.setReuseAddress(true);
            serverSocket.bind(new InetSocketAddress(config.getHost(), config.getPort()));
            serverSocket.setSoTimeout(ACCEPT_TIMEOUT_MS);
        } catch (IOException e) {
            running.set(false);
            closeServerSocket();
            throw e;
        }
        boundPort = serverSocket.getLocalPort();

        acceptThread = new Thread(this::acceptLoop, "medusa-accept-" + boundPort);
        acceptThread.start();

        logger.info("Medusa server listening on {}:{}", config.getHost(), boundPort);
    }

    private void acceptLoop() {
        while (running.get()) {
            Socket client;
            try {
                client = serverSocket.accept();
            } catch (SocketTimeoutException e) {
                continue;
            } catch (IOException e) {
                if (running.get()) {
                    logger.error("Error accepting connection: {}", e.getMessage());
                }
                continue;
            }

            try {
                handOff(client);
            } catch (IOException | RuntimeException e) {
                logger.error("Error setting up connection {}: {}", client.getRemoteSocketAddress(), e.getMessage(), e);
                closeQuietly(client);
            }
        }
        logger.debug("Accept loop on port {} finished", boundPort);
    }

    private void handOff(Socket client) throws IOException {
        if (connections.size() >= config.getMaxConnections()) {
            reject(client);
            return;
        }

        client.setTcpNoDelay(true);
        client.setKeepAlive(true);
        if (config.isTimeoutsEnabled()) {
            client.setSoTimeout((int) config.getConnectionTimeout().toMillis());
        }

        ConnectionHandler handler = new ConnectionHandler(client, dispatcher, metrics, this);
        connections.add(handler);
        try {
            workerPool.execute(handler);
        } catch (RejectedExecutionException e) {
            connections.remove(handler);
            reject(client);
            return;
        }
        logger.debug("Accepted connection from {}", handler.getRemoteAddress());
    }

    private void reject(Socket client) {
        logger.warn("Rejecting connection from {}: limit of {} reached",
                client.getRemoteSocketAddress(), config.getMaxConnections());
        metrics.connectionRejected();
        try {
            OutputStream out = client.getOutputStream();
            out.write(REJECT_MESSAGE.getBytes(StandardCharsets.UTF_8));
            out.flush();
        } catch (IOException e) {
            logger.debug("Could not notify rejected client: {}", e.getMessage());
        } finally {
            closeQuietly(client);
        }
    }

    /**
     * Stop the server and close all client connections.
     */
    public void stop() {
        if (!running.getAndSet(false)) {
            return;
        }

        logger.info("Stopping Medusa server on port {}", boundPort);

        closeServerSocket();

        if (acceptThread != null && acceptThread != Thread.currentThread()) {
            try {
                acceptThread.join(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        for (ConnectionHandler handler : connections) {
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

        logger.info("Medusa server stopped on port {}", boundPort);
    }

    private void closeServerSocket() {
        if (serverSocket != null) {
            try {
                serverSocket.close();
            } catch (IOException e) {
                logger.debug("Error closing server socket: {}", e.getMessage());
            }
        }
    }

    private static void closeQuietly(Socket socket) {
        try {
            socket.close();
        } catch (IOException e) {
            logger.debug("Error closing socket: {}", e.getMessage());
        }
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
     * Get the port this server is listening on. Resolves an ephemeral port once started.
     */
    public int getPort() {
        return boundPort;
    }

    /**
     * Remove a connection from tracking.
     * Package-private, called by ConnectionHandler when connection is closed.
     */
    void removeConnection(ConnectionHandler handler) {
        connections.remove(handler);
    }
}
