package com.medusa.network.protocol;

import java.util.List;
import java.util.Objects;

/**
 * Immutable command object representing a client request.
 */
public final class Command {

    private final CommandType type;
    private final List<String> args;

    /**
     * Create a new command.
     *
     * @param type the command type
     * @param args the arguments following the verb
     */
    public Command(CommandType type, List<String> args) {
        this.type = Objects.requireNonNull(type, "type");
        this.args = List.copyOf(args);
    }

    public CommandType getType() {
        return type;
    }

    public List<String> getArgs() {
        return args;
    }

    /**
     * Get an argument by position.
     *
     * @param index zero-based position after the verb
     * @return the argument
     */
    public String arg(int index) {
        return args.get(index);
    }

    /**
     * Get the first argument, which is the key for keyed commands.
     *
     * @return the key
     */
    public String getKey() {
        return args.get(0);
    }

    /**
     * Parse an argument as a whole number.
     *
     * @param index zero-based position after the verb
     * @param name  argument name, for the error message
     * @return the parsed value
     * @throws ProtocolException if the argument is not an integer
     */
    public long longArg(int index, String name) {
        String raw = args.get(index);
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new ProtocolException(name + " must be an integer, got '" + raw + "'", e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Command command = (Command) o;
        return type == command.type && args.equals(command.args);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, args);
    }

    @Override
    public String toString() {
        return "Command{" +
               "type=" + type +
               ", args=" + args.size() +
               '}';
    }
}
