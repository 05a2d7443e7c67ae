package com.medusa;

import com.medusa.client.ClientConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Optional;

/**
 * Medusa client library.
 * Holds one blocking connection to a Medusa server and exchanges one request line
 * for one reply line.
 */
public class MedusaClient implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(MedusaClient.class);

    private static final String ERROR_PREFIX = "ERROR:";
    private static final String OK_PREFIX = "OK: ";

    private final String address;
    private final Socket socket;
    private final BufferedReader reader;
    private final Writer writer;
    private final String welcome;
    private volatile boolean closed = false;

    /**
     * Connect with default timeouts.
     *
     * @param host server host
     * @param port server port
     * @throws IOException if the connection fails or the server turns it away
     */
    public MedusaClient(String host, int port) throws IOException {
        this(ClientConfig.builder().host(host).port(port).build());
    }

    /**
     * Connect using the given settings.
     *
     * @param config server address and timeouts
     * @throws IOException if the connection fails or the server turns it away
     */
    public MedusaClient(ClientConfig config) throws IOException {
        this.address = config.getHost() + ":" + config.getPort();
        this.socket = new Socket();
        try {
            socket.connect(new InetSocketAddress(config.getHost(), config.getPort()),
                    (int) config.getConnectTimeout().toMillis());
            socket.setSoTimeout((int) config.getReadTimeout().toMillis());
            socket.setTcpNoDelay(true);
            this.reader = new BufferedReader(
                    new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
            this.writer = new BufferedWriter(
                    new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8));
            String greeting = readLine();
            if (greeting.startsWith(ERROR_PREFIX)) {
                throw new IOException("Server rejected connection: " + greeting);
            }
            this.welcome = greeting;
        } catch (IOException e) {
            closeSocket();
            throw e;
        }
        logger.debug("Connected to {}", address);
    }

    /**
     * Send a raw request line and return the reply.
     * For INFO the whole report is returned, its lines joined by {@code \n}.
     *
     * @param command the request line
     * @return the reply text, including its status prefix
     * @throws IOException if the connection fails
     */
    public String send(String command) throws IOException {
        ensureOpen();
        if (command.indexOf('\n') >= 0 || command.indexOf('\r') >= 0) {
            throw new IllegalArgumentException("Command cannot contain line breaks");
        }
        writer.write(command);
        writer.write('\n');
        writer.flush();

        String reply = readLine();
        if (isInfo(command) && !reply.startsWith(ERROR_PREFIX)) {
            StringBuilder sb = new StringBuilder(reply);
            String line;
            while (!(line = readLine()).isEmpty()) {
                sb.append('\n').append(line);
            }
            return sb.toString();
        }
        return reply;
    }

    /**
     * Ping the server to check connectivity.
     *
     * @return true if the server responds
     */
    public boolean ping() {
        try {
            return "PONG".equals(send("PING"));
        } catch (IOException e) {
            logger.debug("Ping failed: {}", e.getMessage());
            return false;
        }
    }

    public void set(String key, String value) throws IOException {
        checked(send("SET " + quote(key) + " " + quote(value)));
    }

    /**
     * Store a string value that expires after the given number of seconds.
     */
    public void set(String key, String value, long ttlSeconds) throws IOException {
        if (ttlSeconds < 0) {
            throw new IllegalArgumentException("TTL cannot be negative: " + ttlSeconds);
        }
        checked(send("SET " + quote(key) + " " + quote(value) + " " + ttlSeconds));
    }

    /**
     * Get a string value.
     *
     * @param key the key to retrieve
     * @return the value if the key holds a live string, empty if it is absent
     * @throws IOException if the request fails or the key holds another type
     */
    public Optional<String> get(String key) throws IOException {
        String reply = checked(send("GET " + quote(key)));
        if (!reply.startsWith(OK_PREFIX)) {
            return Optional.empty();
        }
        String prefix = OK_PREFIX + "'" + key + "' = ";
        if (reply.startsWith(prefix)) {
            return Optional.of(reply.substring(prefix.length()));
        }
        int separator = reply.indexOf(" = ");
        return Optional.of(separator >= 0 ? reply.substring(separator + 3) : reply.substring(OK_PREFIX.length()));
    }

    /**
     * Delete a key.
     *
     * @return true if a live key was removed
     */
    public boolean delete(String key) throws IOException {
        return checked(send("DELETE " + quote(key))).startsWith(OK_PREFIX);
    }

    public boolean exists(String key) throws IOException {
        return checked(send("EXISTS " + quote(key))).startsWith("TRUE:");
    }

    /**
     * Fetch the server report.
     *
     * @return the report lines following the status line
     */
    public String info() throws IOException {
        String reply = checked(send("INFO"));
        int firstBreak = reply.indexOf('\n');
        return firstBreak >= 0 ? reply.substring(firstBreak + 1) : "";
    }

    /**
     * Get the greeting the server sent on connect.
     */
    public String getWelcome() {
        return welcome;
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            closeSocket();
            logger.debug("Medusa client closed: {}", address);
        }
    }

    public boolean isClosed() {
        return closed;
    }

    private String readLine() throws IOException {
        String line = reader.readLine();
        if (line == null) {
            throw new IOException("Connection closed by server");
        }
        return line;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Client is closed");
        }
    }

    private void closeSocket() {
        try {
            socket.close();
        } catch (IOException e) {
            logger.debug("Error closing socket: {}", e.getMessage());
        }
    }

    private static String checked(String reply) throws IOException {
        if (reply.startsWith(ERROR_PREFIX)) {
            throw new IOException("Server error: " + reply.substring(ERROR_PREFIX.length()).trim());
        }
        return reply;
    }

    private static boolean isInfo(String command) {
        String trimmed = command.trim();
        int end = 0;
        while (end < trimmed.length() && !Character.isWhitespace(trimmed.charAt(end))) {
            end++;
        }
        return trimmed.substring(0, end).toUpperCase(Locale.ROOT).equals("INFO");
    }

    /**
     * Quote an argument so the server reads it back as one token.
     */
    static String quote(String arg) {
        boolean plain = !arg.isEmpty();
        for (int i = 0; i < arg.length() && plain; i++) {
            char c = arg.charAt(i);
            plain = !Character.isWhitespace(c) && c != '"' && c != '\'';
        }
        if (plain) {
            return arg;
        }
        if (arg.indexOf('"') < 0) {
            return '"' + arg + '"';
        }
        if (arg.indexOf('\'') < 0) {
            return '\'' + arg + '\'';
        }
        throw new IllegalArgumentException("Argument cannot contain both quote characters: " + arg);
    }

    /**
     * Interactive shell.
     */
    public static void main(String[] args) {
        ClientConfig.Builder builder = ClientConfig.fromEnvironment().toBuilder();
        try {
            if (args.length > 0) {
                builder.host(args[0]);
            }
            if (args.length > 1) {
                builder.port(Integer.parseInt(args[1]));
            }
        } catch (IllegalArgumentException e) {
            System.err.println("Usage: MedusaClient [host] [port]: " + e.getMessage());
            System.exit(1);
        }

        try (MedusaClient client = new MedusaClient(builder.build());
             BufferedReader stdin = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8))) {
            System.out.println(client.getWelcome());
            while (true) {
                System.out.print("medusa> ");
                System.out.flush();
                String line = stdin.readLine();
                if (line == null) {
                    break;
                }
                if (line.trim().isEmpty()) {
                    continue;
                }
                String reply = client.send(line);
                System.out.println(reply);
                if (reply.equals("OK: Goodbye!")) {
                    break;
                }
            }
        } catch (IOException e) {
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
        }
    }
}
