package com.medusa.network.protocol;

import com.medusa.core.KVStore;
import com.medusa.core.StoreException;
import com.medusa.core.TypeMismatchException;
import com.medusa.core.Value;
import com.medusa.util.MetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Maps parsed commands onto store operations and renders their results.
 * Every command results in exactly one store call (or none for PING, HELP and QUIT).
 * Stateless apart from the store and metrics, so one instance is shared by all connections.
 */
public class CommandDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(CommandDispatcher.class);

    private static final String HELP_TEXT = Arrays.stream(CommandType.values())
            .map(CommandType::getUsage)
            .collect(Collectors.joining("; ", "Commands: ", ""));

    private final KVStore store;
    private final MetricsCollector metrics;

    public CommandDispatcher(KVStore store, MetricsCollector metrics) {
        this.store = store;
        this.metrics = metrics;
    }

    /**
     * Parse and execute one request line.
     *
     * @param line the raw request line
     * @return the response to send back, never null
     */
    public Response dispatch(String line) {
        Command command;
        try {
            command = CommandParser.parse(line);
        } catch (ProtocolException e) {
            logger.debug("Rejected request: {}", e.getMessage());
            metrics.recordError();
            return Response.error(e.getMessage());
        }
        return execute(command);
    }

    /**
     * Execute a parsed command, turning every failure into an error response.
     *
     * @param command the command to execute
     * @return the response to send back, never null
     */
    public Response execute(Command command) {
        long startTime = System.nanoTime();
        Response response;
        try {
            response = handle(command);
        } catch (TypeMismatchException e) {
            logger.debug("Type mismatch for {}: {}", command.getType(), e.getMessage());
            response = Response.error("WRONGTYPE " + e.getMessage());
        } catch (ProtocolException e) {
            logger.debug("Invalid request for {}: {}", command.getType(), e.getMessage());
            response = Response.error(e.getMessage());
        } catch (IllegalArgumentException e) {
            logger.warn("Invalid argument for command {}: {}", command.getType(), e.getMessage());
            response = Response.error("Invalid argument: " + e.getMessage());
        } catch (StoreException e) {
            logger.error("Store error processing command {}: {}", command.getType(), e.getMessage());
            response = Response.error("Internal error: " + e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Error processing command {}: {}", command.getType(), e.toString(), e);
            response = Response.error("Internal error: " + e.getMessage());
        }

        metrics.recordCommand(command.getType(), System.nanoTime() - startTime);
        if (response.isError()) {
            metrics.recordError();
        }
        return response;
    }

    private Response handle(Command command) {
        switch (command.getType()) {
            case SET:
                return handleSet(command);
            case GET:
                return handleGet(command);
            case DELETE:
                return handleDelete(command);
            case EXISTS:
                return handleExists(command);
            case TTL:
                return handleTtl(command);
            case EXPIRE:
                return handleExpire(command);
            case LIST:
                return renderKeys(store.listKeys(), "No keys found");
            case KEYS:
                return renderKeys(store.keys(command.arg(0)), "No keys matching '" + command.arg(0) + "'");
            case COUNT:
                return Response.ok(store.count() + " entries");
            case CLEAR:
                store.clear();
                return Response.ok("All entries cleared");
            case INFO:
                return Response.okMultiline("Server info", store.info());
            case HSET:
                return handleHset(command);
            case HGET:
                return handleHget(command);
            case HGETALL:
                return Response.ok(renderHash(store.hgetall(command.getKey())));
            case HDEL:
                return handleHdel(command);
            case HEXISTS:
                return handleHexists(command);
            case HLEN:
                return Response.ok(store.hlen(command.getKey()) + " fields");
            case LPUSH:
                return renderPush(command.getKey(), store.lpush(command.getKey(), command.arg(1)));
            case RPUSH:
                return renderPush(command.getKey(), store.rpush(command.getKey(), command.arg(1)));
            case LPOP:
                return renderPop(command.getKey(), store.lpop(command.getKey()));
            case RPOP:
                return renderPop(command.getKey(), store.rpop(command.getKey()));
            case LLEN:
                return Response.ok(store.llen(command.getKey()) + " elements");
            case LRANGE:
                return handleLrange(command);
            case PING:
                return Response.pong();
            case HELP:
                return Response.ok(HELP_TEXT);
            case QUIT:
                return Response.goodbye();
            default:
                throw new ProtocolException("Unsupported command " + command.getType());
        }
    }

    /**
     * SET key value [ttl]. With exactly three arguments and a non-negative integer last,
     * the last one is the TTL in seconds. Otherwise every argument after the key forms
     * the value, joined by single spaces.
     */
    private Response handleSet(Command command) {
        String key = command.getKey();
        List<String> args = command.getArgs();
        if (args.size() == 3 && isTtl(args.get(2))) {
            String value = args.get(1);
            long ttl = Long.parseLong(args.get(2));
            store.setWithTtl(key, value, ttl);
            return Response.ok("Set '" + key + "' = '" + value + "' (expires in " + ttl + " seconds)");
        }
        String value = String.join(" ", args.subList(1, args.size()));
        store.set(key, value);
        return Response.ok("Set '" + key + "' = '" + value + "'");
    }

    private Response handleGet(Command command) {
        String key = command.getKey();
        Optional<String> value = store.get(key);
        metrics.recordLookup(value.isPresent());
        return value.map(v -> Response.ok("'" + key + "' = " + v))
                .orElseGet(() -> Response.notFound("Key '" + key + "' not found"));
    }

    private Response handleDelete(Command command) {
        String key = command.getKey();
        Optional<Value> removed = store.delete(key);
        return removed.map(v -> Response.ok("Deleted '" + key + "' (was '" + v.describe() + "')"))
                .orElseGet(() -> Response.notFound("Key '" + key + "' not found"));
    }

    private Response handleExists(Command command) {
        String key = command.getKey();
        boolean exists = store.exists(key);
        return Response.bool(exists, exists
                ? "Key '" + key + "' exists"
                : "Key '" + key + "' does not exist");
    }

    private Response handleTtl(Command command) {
        String key = command.getKey();
        OptionalLong ttl = store.ttl(key);
        if (ttl.isEmpty()) {
            return Response.notFound("Key '" + key + "' does not exist or has no expiration");
        }
        if (ttl.getAsLong() < 0) {
            return Response.notFound("Key '" + key + "' has expired");
        }
        return Response.ok("Key '" + key + "' expires in " + ttl.getAsLong() + " seconds");
    }

    private Response handleExpire(Command command) {
        String key = command.getKey();
        long seconds = command.longArg(1, "seconds");
        if (store.expire(key, seconds)) {
            return Response.ok("Key '" + key + "' expires in " + seconds + " seconds");
        }
        return Response.notFound("Key '" + key + "' not found");
    }

    private Response handleHset(Command command) {
        String key = command.getKey();
        String field = command.arg(1);
        boolean created = store.hset(key, field, command.arg(2));
        return Response.ok("Field '" + field + "' " + (created ? "created" : "updated") + " in '" + key + "'");
    }

    private Response handleHget(Command command) {
        String key = command.getKey();
        String field = command.arg(1);
        return store.hget(key, field)
                .map(v -> Response.ok("'" + field + "' = " + v))
                .orElseGet(() -> Response.notFound("Field '" + field + "' not found in '" + key + "'"));
    }

    private Response handleHdel(Command command) {
        String key = command.getKey();
        String field = command.arg(1);
        if (store.hdel(key, field)) {
            return Response.ok("Field '" + field + "' deleted from '" + key + "'");
        }
        return Response.notFound("Field '" + field + "' not found in '" + key + "'");
    }

    private Response handleHexists(Command command) {
        String key = command.getKey();
        String field = command.arg(1);
        boolean exists = store.hexists(key, field);
        return Response.bool(exists, exists
                ? "Field '" + field + "' exists in '" + key + "'"
                : "Field '" + field + "' does not exist in '" + key + "'");
    }

    private Response handleLrange(Command command) {
        long start = command.longArg(1, "start");
        long stop = command.longArg(2, "stop");
        return Response.ok(store.lrange(command.getKey(), start, stop).toString());
    }

    private static Response renderKeys(Set<String> keys, String emptyMessage) {
        if (keys.isEmpty()) {
            return Response.ok(emptyMessage);
        }
        return Response.ok("Keys: " + joinSorted(keys));
    }

    private static String renderHash(Map<String, String> fields) {
        return new TreeMap<>(fields).entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(", ", "{", "}"));
    }

    private static Response renderPush(String key, int length) {
        return Response.ok("List '" + key + "' now has " + length + " elements");
    }

    private static Response renderPop(String key, Optional<String> value) {
        return value.map(Response::ok)
                .orElseGet(() -> Response.notFound("List '" + key + "' is empty"));
    }

    private static String joinSorted(Collection<String> keys) {
        return String.join(", ", new TreeSet<>(keys));
    }

    private static boolean isTtl(String token) {
        if (token.isEmpty() || token.length() > 18) {
            return false;
        }
        for (int i = 0; i < token.length(); i++) {
            char c = token.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }
}
