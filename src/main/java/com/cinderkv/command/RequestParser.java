package com.cinderkv.command;

import com.cinderkv.core.KeyValue;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns a decoded request (command name followed by its arguments) into a
 * validated {@link Command}.
 *
 * The parser never touches the store. Every failure is reported as a
 * {@link CommandParseException} whose message is sent to the client as-is.
 */
public final class RequestParser {

    /** Largest value SETRANGE may produce. */
    public static final long MAX_STRING_LENGTH = 512L * 1024 * 1024;

    static final String EMPTY_COMMAND = "empty command";
    static final String NOT_AN_INTEGER = "value is not an integer or out of range";
    static final String SYNTAX_ERROR = "syntax error";
    static final String OFFSET_OUT_OF_RANGE = "offset is out of range";
    static final String STRING_TOO_LONG = "string exceeds maximum allowed size (512MB)";

    private static final long MILLIS_PER_SECOND = 1000L;

    private RequestParser() {
        // Utility class
    }

    /**
     * Parse a request.
     *
     * @param tokens the request tokens, command name first
     * @return the parsed command
     * @throws CommandParseException if the request is invalid
     */
    public static Command parse(List<byte[]> tokens) {
        if (tokens == null || tokens.isEmpty()) {
            throw new CommandParseException(EMPTY_COMMAND);
        }

        String name = new String(tokens.get(0), StandardCharsets.UTF_8);
        CommandType type = CommandType.fromName(name);
        if (type == null) {
            throw new CommandParseException("unknown command '" + name + "'");
        }

        switch (type) {
            case SET:
                return parseSet(tokens);
            case GET:
                requireExactly(tokens, 2, type);
                return new Command.Get(tokens.get(1));
            case DEL:
                requireAtLeast(tokens, 2, type);
                return new Command.Del(tail(tokens));
            case EXISTS:
                requireAtLeast(tokens, 2, type);
                return new Command.Exists(tail(tokens));
            case MGET:
                requireAtLeast(tokens, 2, type);
                return new Command.MGet(tail(tokens));
            case APPEND:
                requireExactly(tokens, 3, type);
                return new Command.Append(tokens.get(1), tokens.get(2));
            case GETSET:
                requireExactly(tokens, 3, type);
                return new Command.GetSet(tokens.get(1), tokens.get(2));
            case STRLEN:
                requireExactly(tokens, 2, type);
                return new Command.Strlen(tokens.get(1));
            case GETRANGE:
                requireExactly(tokens, 4, type);
                return new Command.GetRange(tokens.get(1), parseLong(tokens.get(2)), parseLong(tokens.get(3)));
            case SETRANGE:
                return parseSetRange(tokens);
            case INCR:
            case DECR:
                requireExactly(tokens, 2, type);
                return new Command.Counter(type, tokens.get(1), 1);
            case INCRBY:
            case DECRBY:
                requireExactly(tokens, 3, type);
                return new Command.Counter(type, tokens.get(1), parseLong(tokens.get(2)));
            case MSET:
                return parseMSet(tokens);
            case KEYS:
                requireExactly(tokens, 2, type);
                return new Command.Keys(tokens.get(1));
            case FLUSHALL:
                requireExactly(tokens, 1, type);
                return new Command.FlushAll();
            case HELLO:
            case CLIENT:
            case PING:
                return new Command.Connection(type, tokens.size() > 1 ? tokens.get(1) : null);
            default:
                throw new CommandParseException("unknown command '" + name + "'");
        }
    }

    /**
     * SET key value, or SET key value EX seconds.
     */
    private static Command parseSet(List<byte[]> tokens) {
        requireAtLeast(tokens, 3, CommandType.SET);
        byte[] key = tokens.get(1);
        byte[] value = tokens.get(2);
        if (tokens.size() == 3) {
            return new Command.Set(key, value, 0);
        }
        if (tokens.size() != 5 || !"EX".equalsIgnoreCase(new String(tokens.get(3), StandardCharsets.UTF_8))) {
            throw new CommandParseException(SYNTAX_ERROR);
        }
        long seconds = parseLong(tokens.get(4));
        if (seconds <= 0 || seconds > Long.MAX_VALUE / MILLIS_PER_SECOND) {
            throw new CommandParseException("invalid expire time in 'set' command");
        }
        return new Command.Set(key, value, seconds * MILLIS_PER_SECOND);
    }

    private static Command parseSetRange(List<byte[]> tokens) {
        requireExactly(tokens, 4, CommandType.SETRANGE);
        long offset = parseLong(tokens.get(2));
        if (offset < 0) {
            throw new CommandParseException(OFFSET_OUT_OF_RANGE);
        }
        byte[] value = tokens.get(3);
        if (offset > MAX_STRING_LENGTH - value.length) {
            throw new CommandParseException(STRING_TOO_LONG);
        }
        return new Command.SetRange(tokens.get(1), (int) offset, value);
    }

    private static Command parseMSet(List<byte[]> tokens) {
        if (tokens.size() < 3 || tokens.size() % 2 == 0) {
            throw wrongArity(CommandType.MSET);
        }
        List<KeyValue> pairs = new ArrayList<>((tokens.size() - 1) / 2);
        for (int i = 1; i < tokens.size(); i += 2) {
            pairs.add(new KeyValue(tokens.get(i), tokens.get(i + 1)));
        }
        return new Command.MSet(pairs);
    }

    private static void requireExactly(List<byte[]> tokens, int count, CommandType type) {
        if (tokens.size() != count) {
            throw wrongArity(type);
        }
    }

    private static void requireAtLeast(List<byte[]> tokens, int count, CommandType type) {
        if (tokens.size() < count) {
            throw wrongArity(type);
        }
    }

    private static CommandParseException wrongArity(CommandType type) {
        return new CommandParseException("wrong number of arguments for '" + type.displayName() + "' command");
    }

    private static List<byte[]> tail(List<byte[]> tokens) {
        return tokens.subList(1, tokens.size());
    }

    /**
     * Parse a base-10 signed 64-bit integer argument.
     */
    static long parseLong(byte[] token) {
        try {
            return Long.parseLong(new String(token, StandardCharsets.US_ASCII));
        } catch (NumberFormatException e) {
            throw new CommandParseException(NOT_AN_INTEGER, e);
        }
    }
}
