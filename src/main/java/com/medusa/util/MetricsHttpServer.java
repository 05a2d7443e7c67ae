package com.medusa.util;

import com.medusa.core.InMemoryStore;
import com.medusa.core.KVStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Minimal HTTP endpoint exposing server metrics.
 * <p>
 * Routes (GET only):
 * <ul>
 *   <li>{@code /metrics} - every registered meter in Prometheus text format</li>
 *   <li>{@code /health} - liveness probe</li>
 *   <li>{@code /status} - JSON summary of keyspace, traffic and connections</li>
 * </ul>
 * One request per connection; the connection is closed after the reply.
 */
public class MetricsHttpServer {

    private static final Logger logger = LoggerFactory.getLogger(MetricsHttpServer.class);

    private static final int ACCEPT_TIMEOUT_MS = 1000;
    private static final int REQUEST_TIMEOUT_MS = 5000;
    private static final int WORKER_THREADS = 2;
    private static final String CRLF = "\r\n";
    private static final String PROMETHEUS_CONTENT_TYPE = "text/plain; version=0.0.4; charset=utf-8";
    private static final String JSON_CONTENT_TYPE = "application/json";

    private final String host;
    private final int port;
    private final MetricsCollector metrics;
    private final KVStore store;
    private final AtomicBoolean running;
    private final ExecutorService workers;

    private ServerSocket serverSocket;
    private Thread acceptThread;
    private volatile int boundPort;

    /**
     * Create a metrics endpoint.
     *
     * @param host    address to bind
     * @param port    port to bind, 0 for an ephemeral port
     * @param metrics metrics to export
     * @param store   store whose key count is reported
     */
    public MetricsHttpServer(String host, int port, MetricsCollector metrics, KVStore store) {
        this.host = host;
        this.port = port;
        this.boundPort = port;
        this.metrics = metrics;
        this.store = store;
        this.running = new AtomicBoolean(false);
        AtomicInteger threadIds = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(WORKER_THREADS, r -> {
            Thread t = new Thread(r, "medusa-metrics-" + threadIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Bind the port and start serving.
     *
     * @throws IOException if the port cannot be bound
     */
    public void start() throws IOException {
        if (running.getAndSet(true)) {
            throw new IllegalStateException("Metrics server already running");
        }

        try {
            serverSocket = new ServerSocket();
            serverSocket.setReuseAddress(true);
            serverSocket.bind(new InetSocketAddress(host, port));
            serverSocket.setSoTimeout(ACCEPT_TIMEOUT_MS);
        } catch (IOException e) {
            running.set(false);
            closeServerSocket();
            throw e;
        }
        boundPort = serverSocket.getLocalPort();

        acceptThread = new Thread(this::acceptLoop, "medusa-metrics-accept");
        acceptThread.setDaemon(true);
        acceptThread.start();

        logger.info("Metrics endpoint listening on http://{}:{}/metrics", host, boundPort);
    }

    /**
     * Stop serving and release the port.
     */
    public void stop() {
        if (!running.getAndSet(false)) {
            return;
        }

        closeServerSocket();
        if (acceptThread != null) {
            try {
                acceptThread.join(ACCEPT_TIMEOUT_MS * 5L);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        workers.shutdown();
        try {
            if (!workers.awaitTermination(REQUEST_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }

        logger.info("Metrics endpoint on port {} stopped", boundPort);
    }

    /**
     * Get the bound port. Resolves an ephemeral port once started.
     */
    public int getPort() {
        return boundPort;
    }

    public boolean isRunning() {
        return running.get();
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
                    logger.error("Error accepting metrics connection: {}", e.getMessage());
                }
                continue;
            }

            try {
                client.setSoTimeout(REQUEST_TIMEOUT_MS);
                workers.execute(() -> serve(client));
            } catch (IOException | RejectedExecutionException e) {
                logger.debug("Dropping metrics connection: {}", e.getMessage());
                closeQuietly(client);
            }
        }
    }

    private void serve(Socket client) {
        try (Socket socket = client;
             BufferedReader reader = new BufferedReader(
                     new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8))) {
            String requestLine = reader.readLine();
            if (requestLine == null || requestLine.isEmpty()) {
                return;
            }
            String header;
            while ((header = reader.readLine()) != null && !header.isEmpty()) {
                logger.trace("Metrics request header: {}", header);
            }

            String[] parts = requestLine.split(" ");
            HttpReply reply = parts.length < 2
                    ? HttpReply.error(400, "Bad Request")
                    : route(parts[0], parts[1]);
            write(socket.getOutputStream(), reply);
        } catch (IOException e) {
            logger.debug("Error serving metrics request: {}", e.getMessage());
        }
    }

    /**
     * Produce the reply for a request.
     *
     * @param method HTTP method
     * @param target request target, a query string is ignored
     * @return the reply to send
     */
    HttpReply route(String method, String target) {
        if (!"GET".equalsIgnoreCase(method)) {
            return HttpReply.error(405, "Method Not Allowed");
        }
        int query = target.indexOf('?');
        String path = query >= 0 ? target.substring(0, query) : target;

        switch (path) {
            case "/metrics":
                return new HttpReply(200, PROMETHEUS_CONTENT_TYPE, renderPrometheus());
            case "/health":
                return new HttpReply(200, JSON_CONTENT_TYPE, "{\"status\":\"healthy\"}");
            case "/status":
                return new HttpReply(200, JSON_CONTENT_TYPE, renderStatus());
            default:
                return HttpReply.error(404, "Not Found");
        }
    }

    /**
     * Render the registry plus store gauges in Prometheus text exposition format.
     */
    String renderPrometheus() {
        List<Meter> meters = new ArrayList<>(metrics.getRegistry().getMeters());
        meters.sort(Comparator.comparing(m -> m.getId().getName()));

        StringBuilder sb = new StringBuilder();
        String lastName = null;
        for (Meter meter : meters) {
            String name = sanitize(meter.getId().getName());
            if (!name.equals(lastName)) {
                String description = meter.getId().getDescription();
                if (description != null) {
                    sb.append("# HELP ").append(name).append(' ').append(description).append('\n');
                }
                sb.append("# TYPE ").append(name).append(' ').append(prometheusType(meter)).append('\n');
                lastName = name;
            }
            String labels = labels(meter.getId().getTags());
            meter.measure().forEach(measurement -> {
                String statistic = measurement.getStatistic().name().toLowerCase(Locale.ROOT);
                boolean plain = statistic.equals("count") || statistic.equals("value");
                sb.append(plain ? name : name + "_" + statistic)
                  .append(labels)
                  .append(' ')
                  .append(measurement.getValue())
                  .append('\n');
            });
        }

        sb.append("# HELP medusa_info Build information\n");
        sb.append("# TYPE medusa_info gauge\n");
        sb.append("medusa_info{version=\"").append(InMemoryStore.VERSION).append("\"} 1\n");
        sb.append("# HELP medusa_store_keys Live keys in the store\n");
        sb.append("# TYPE medusa_store_keys gauge\n");
        sb.append("medusa_store_keys ").append(store.count()).append('\n');
        return sb.toString();
    }

    private String renderStatus() {
        return "{" +
               "\"version\":\"" + InMemoryStore.VERSION + "\"," +
               "\"keys\":" + store.count() + "," +
               "\"commands\":" + metrics.getTotalCommands() + "," +
               "\"errors\":" + metrics.getTotalErrors() + "," +
               "\"hit_rate\":" + String.format(Locale.ROOT, "%.4f", metrics.getHitRate()) + "," +
               "\"mean_latency_ms\":" + String.format(Locale.ROOT, "%.3f", metrics.getMeanLatencyMs()) + "," +
               "\"active_connections\":" + metrics.getActiveConnections() + "," +
               "\"rejected_connections\":" + metrics.getRejectedConnections() +
               "}";
    }

    private static String prometheusType(Meter meter) {
        if (meter instanceof Counter || meter instanceof FunctionCounter) {
            return "counter";
        }
        if (meter instanceof Gauge) {
            return "gauge";
        }
        if (meter instanceof Timer) {
            return "summary";
        }
        return "untyped";
    }

    private static String sanitize(String meterName) {
        return meterName.replace('.', '_').replace('-', '_');
    }

    private static String labels(List<Tag> tags) {
        if (tags.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder("{");
        for (Tag tag : tags) {
            if (sb.length() > 1) {
                sb.append(',');
            }
            sb.append(sanitize(tag.getKey()))
              .append("=\"")
              .append(tag.getValue().replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n"))
              .append('"');
        }
        return sb.append('}').toString();
    }

    private static void write(OutputStream out, HttpReply reply) throws IOException {
        byte[] body = reply.body.getBytes(StandardCharsets.UTF_8);
        String head = "HTTP/1.1 " + reply.status + " " + reasonPhrase(reply.status) + CRLF
                + "Content-Type: " + reply.contentType + CRLF
                + "Content-Length: " + body.length + CRLF
                + "Connection: close" + CRLF
                + CRLF;
        out.write(head.getBytes(StandardCharsets.US_ASCII));
        out.write(body);
        out.flush();
    }

    private static String reasonPhrase(int status) {
        switch (status) {
            case 200: return "OK";
            case 400: return "Bad Request";
            case 404: return "Not Found";
            case 405: return "Method Not Allowed";
            default: return "Error";
        }
    }

    private void closeServerSocket() {
        if (serverSocket != null) {
            try {
                serverSocket.close();
            } catch (IOException e) {
                logger.debug("Error closing metrics socket: {}", e.getMessage());
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
     * Status, content type and body of an HTTP reply.
     */
    static final class HttpReply {

        final int status;
        final String contentType;
        final String body;

        HttpReply(int status, String contentType, String body) {
            this.status = status;
            this.contentType = contentType;
            this.body = body;
        }

        static HttpReply error(int status, String message) {
            return new HttpReply(status, JSON_CONTENT_TYPE, "{\"error\":\"" + message + "\"}");
        }
    }
}
