package com.medusa.network.protocol;

import java.util.ArrayList;
import java.util.List;

/**
 * Parser for the line-oriented request format.
 * <p>
 * A request is one line: a verb followed by whitespace separated arguments.
 * An argument wrapped in single or double quotes may contain whitespace. A quote
 * character inside an unquoted argument is taken literally.
 * The verb is case-insensitive.
 */
public final class CommandParser {

    private CommandParser() {
    }

    /**
     * Parse a request line into a command.
     *
     * @param line the request line, without its terminator
     * @return the parsed command
     * @throws ProtocolException if the line is empty, the verb unknown, the quoting
     *                           unbalanced or the argument count wrong
     */
    public static Command parse(String line) {
        List<String> tokens = tokenize(line);
        if (tokens.isEmpty()) {
            throw new ProtocolException("Empty command");
        }

        String verb = tokens.get(0);
        CommandType type = CommandType.fromName(verb)
                .orElseThrow(() -> new ProtocolException("Unknown command '" + verb + "'"));

        List<String> args = tokens.subList(1, tokens.size());
        if (!type.acceptsArgCount(args.size())) {
            throw new ProtocolException("Wrong number of arguments for " + type
                    + " (usage: " + type.getUsage() + ")");
        }
        return new Command(type, args);
    }

    /**
     * Split a line into tokens, honouring quotes.
     *
     * @param line the line to split
     * @return the tokens, empty for a blank line
     * @throws ProtocolException if a quote is not closed
     */
    static List<String> tokenize(String line) {
        List<String> tokens = new ArrayList<>();
        if (line == null) {
            return tokens;
        }

        StringBuilder current = new StringBuilder();
        boolean inToken = false;
        char quote = 0;

        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                } else {
                    current.append(c);
                }
            } else if (!inToken && (c == '"' || c == '\'')) {
                quote = c;
                inToken = true;
            } else if (Character.isWhitespace(c)) {
                if (inToken) {
                    tokens.add(current.toString());
                    current.setLength(0);
                    inToken = false;
                }
            } else {
                current.append(c);
                inToken = true;
            }
        }

        if (quote != 0) {
            throw new ProtocolException("Unterminated quoted argument");
        }
        if (inToken) {
            tokens.add(current.toString());
        }
        return tokens;
    }
}
