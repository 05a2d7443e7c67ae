package com.medusa.network.protocol;

import java.util.Objects;

/**
 * Immutable response object representing a server reply.
 * <p>
 * A reply is a single line {@code STATUS: message}. A multi-line reply (INFO) continues
 * with its body lines and is terminated by an empty line.
 */
public final class Response {

    /**
     * Response status, rendered as the line prefix.
     */
    public enum Status {
        OK("OK"),
        NULL("NULL"),
        TRUE("TRUE"),
        FALSE("FALSE"),
        ERROR("ERROR"),
        PONG("PONG");

        private final String prefix;

        Status(String prefix) {
            this.prefix = prefix;
        }

        public String getPrefix() {
            return prefix;
        }
    }

    private static final Response PONG = new Response(Status.PONG, null, null, false);
    private static final Response GOODBYE = new Response(Status.OK, "Goodbye!", null, true);

    private final Status status;
    private final String message;
    private final String body; // extra lines for multi-line replies, may be null
    private final boolean closeConnection;

    private Response(Status status, String message, String body, boolean closeConnection) {
        this.status = Objects.requireNonNull(status, "status");
        this.message = message;
        this.body = body;
        this.closeConnection = closeConnection;
    }

    public static Response ok(String message) {
        return new Response(Status.OK, message, null, false);
    }

    /**
     * Create a multi-line OK response.
     *
     * @param message first line
     * @param body    following lines, separated by {@code \n}
     */
    public static Response okMultiline(String message, String body) {
        return new Response(Status.OK, message, body, false);
    }

    public static Response notFound(String message) {
        return new Response(Status.NULL, message, null, false);
    }

    public static Response bool(boolean value, String message) {
        return new Response(value ? Status.TRUE : Status.FALSE, message, null, false);
    }

    public static Response error(String message) {
        return new Response(Status.ERROR, message, null, false);
    }

    public static Response pong() {
        return PONG;
    }

    /**
     * Reply to QUIT: the connection is closed once it has been written.
     */
    public static Response goodbye() {
        return GOODBYE;
    }

    public Status getStatus() {
        return status;
    }

    public String getMessage() {
        return message;
    }

    public String getBody() {
        return body;
    }

    public boolean isMultiline() {
        return body != null;
    }

    public boolean shouldClose() {
        return closeConnection;
    }

    public boolean isError() {
        return status == Status.ERROR;
    }

    /**
     * Render the response as wire text, including line terminators.
     *
     * @return the encoded reply
     */
    public String encode() {
        StringBuilder sb = new StringBuilder(status.getPrefix());
        if (message != null) {
            sb.append(": ").append(message);
        }
        sb.append('\n');
        if (body != null) {
            sb.append(body);
            if (!body.endsWith("\n")) {
                sb.append('\n');
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Response response = (Response) o;
        return status == response.status
                && Objects.equals(message, response.message)
                && Objects.equals(body, response.body)
                && closeConnection == response.closeConnection;
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, message, body, closeConnection);
    }

    @Override
    public String toString() {
        return "Response{" +
               "status=" + status +
               ", message='" + message + '\'' +
               ", multiline=" + isMultiline() +
               '}';
    }
}
