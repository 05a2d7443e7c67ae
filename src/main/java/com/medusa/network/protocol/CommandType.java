package com.medusa.network.protocol;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Closed set of commands understood by the server, with their arity.
 */
public enum CommandType {
    SET(2, Integer.MAX_VALUE, "SET key value [ttl]"),
    GET(1, 1, "GET key"),
    DELETE(1, 1, "DELETE key", "DEL"),
    EXISTS(1, 1, "EXISTS key"),
    TTL(1, 1, "TTL key"),
    EXPIRE(2, 2, "EXPIRE key seconds"),
    LIST(0, 0, "LIST"),
    KEYS(1, 1, "KEYS pattern"),
    COUNT(0, 0, "COUNT"),
    CLEAR(0, 0, "CLEAR"),
    INFO(0, 0, "INFO"),
    HSET(3, 3, "HSET key field value"),
    HGET(2, 2, "HGET key field"),
    HGETALL(1, 1, "HGETALL key"),
    HDEL(2, 2, "HDEL key field"),
    HEXISTS(2, 2, "HEXISTS key field"),
    HLEN(1, 1, "HLEN key"),
    LPUSH(2, 2, "LPUSH key value"),
    RPUSH(2, 2, "RPUSH key value"),
    LPOP(1, 1, "LPOP key"),
    RPOP(1, 1, "RPOP key"),
    LLEN(1, 1, "LLEN key"),
    LRANGE(3, 3, "LRANGE key start stop"),
    PING(0, 0, "PING"),
    HELP(0, 0, "HELP"),
    QUIT(0, 0, "QUIT", "EXIT");

    private static final Map<String, CommandType> BY_NAME = new HashMap<>();

    static {
        for (CommandType type : values()) {
            BY_NAME.put(type.name(), type);
            for (String alias : type.aliases) {
                BY_NAME.put(alias, type);
            }
        }
    }

    private final int minArgs;
    private final int maxArgs;
    private final String usage;
    private final String[] aliases;

    CommandType(int minArgs, int maxArgs, String usage, String... aliases) {
        this.minArgs = minArgs;
        this.maxArgs = maxArgs;
        this.usage = usage;
        this.aliases = aliases;
    }

    /**
     * Look up a command by name or alias, ignoring case.
     *
     * @param name the verb as typed by the client
     * @return the command type, or empty if unknown
     */
    public static Optional<CommandType> fromName(String name) {
        return Optional.ofNullable(BY_NAME.get(name.toUpperCase(Locale.ROOT)));
    }

    public String getUsage() {
        return usage;
    }

    public boolean acceptsArgCount(int count) {
        return count >= minArgs && count <= maxArgs;
    }
}
