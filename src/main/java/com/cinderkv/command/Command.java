package com.cinderkv.command;

import com.cinderkv.core.KeyValue;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Immutable, validated client request.
 *
 * The set of variants is closed: every subclass is nested here and the
 * constructor is private, so {@link CommandDispatcher} can switch on
 * {@link #getType()} and cast to the matching variant.
 */
public abstract class Command {

    private final CommandType type;

    private Command(CommandType type) {
        this.type = type;
    }

    /**
     * Get the command type.
     *
     * @return the command type
     */
    public CommandType getType() {
        return type;
    }

    @Override
    public String toString() {
        return "Command{type=" + type + '}';
    }

    private static byte[] copy(byte[] bytes) {
        return Arrays.copyOf(bytes, bytes.length);
    }

    private static List<byte[]> copyAll(List<byte[]> items) {
        List<byte[]> result = new ArrayList<>(items.size());
        for (byte[] item : items) {
            result.add(copy(item));
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Base for commands that address a single key.
     */
    public abstract static class KeyCommand extends Command {
        private final byte[] key;

        private KeyCommand(CommandType type, byte[] key) {
            super(type);
            this.key = copy(key);
        }

        public byte[] getKey() {
            return copy(key);
        }

        /**
         * Get the raw key without copying.
         *
         * @return internal key array
         */
        public byte[] getKeyUnsafe() {
            return key;
        }

        @Override
        public String toString() {
            return "Command{type=" + getType() + ", key='" + new String(key, StandardCharsets.UTF_8) + "'}";
        }
    }

    /**
     * Base for commands that address a list of keys.
     */
    public abstract static class MultiKeyCommand extends Command {
        private final List<byte[]> keys;

        private MultiKeyCommand(CommandType type, List<byte[]> keys) {
            super(type);
            this.keys = copyAll(keys);
        }

        /**
         * @return unmodifiable view of the keys; do not modify the arrays
         */
        public List<byte[]> getKeys() {
            return keys;
        }

        @Override
        public String toString() {
            return "Command{type=" + getType() + ", keys=" + keys.size() + '}';
        }
    }

    /** SET key value [EX seconds]. */
    public static final class Set extends KeyCommand {
        private final byte[] value;
        private final long ttlMillis;

        public Set(byte[] key, byte[] value, long ttlMillis) {
            super(CommandType.SET, key);
            this.value = copy(value);
            this.ttlMillis = ttlMillis;
        }

        public byte[] getValueUnsafe() {
            return value;
        }

        /**
         * @return TTL in milliseconds, or 0 when the key should not expire
         */
        public long getTtlMillis() {
            return ttlMillis;
        }

        public boolean hasTtl() {
            return ttlMillis > 0;
        }
    }

    /** GET key. */
    public static final class Get extends KeyCommand {
        public Get(byte[] key) {
            super(CommandType.GET, key);
        }
    }

    /** DEL key [key ...]. */
    public static final class Del extends MultiKeyCommand {
        public Del(List<byte[]> keys) {
            super(CommandType.DEL, keys);
        }
    }

    /** EXISTS key [key ...]. */
    public static final class Exists extends MultiKeyCommand {
        public Exists(List<byte[]> keys) {
            super(CommandType.EXISTS, keys);
        }
    }

    /** APPEND key value. */
    public static final class Append extends KeyCommand {
        private final byte[] value;

        public Append(byte[] key, byte[] value) {
            super(CommandType.APPEND, key);
            this.value = copy(value);
        }

        public byte[] getValueUnsafe() {
            return value;
        }
    }

    /** STRLEN key. */
    public static final class Strlen extends KeyCommand {
        public Strlen(byte[] key) {
            super(CommandType.STRLEN, key);
        }
    }

    /** GETRANGE key start end. */
    public static final class GetRange extends KeyCommand {
        private final long start;
        private final long end;

        public GetRange(byte[] key, long start, long end) {
            super(CommandType.GETRANGE, key);
            this.start = start;
            this.end = end;
        }

        public long getStart() {
            return start;
        }

        public long getEnd() {
            return end;
        }
    }

    /** SETRANGE key offset value. */
    public static final class SetRange extends KeyCommand {
        private final int offset;
        private final byte[] value;

        public SetRange(byte[] key, int offset, byte[] value) {
            super(CommandType.SETRANGE, key);
            this.offset = offset;
            this.value = copy(value);
        }

        public int getOffset() {
            return offset;
        }

        public byte[] getValueUnsafe() {
            return value;
        }
    }

    /**
     * INCR, DECR, INCRBY and DECRBY. The parser folds the four forms into a
     * type plus an amount; the dispatcher applies the sign.
     */
    public static final class Counter extends KeyCommand {
        private final long amount;

        public Counter(CommandType type, byte[] key, long amount) {
            super(type, key);
            if (type != CommandType.INCR && type != CommandType.DECR
                    && type != CommandType.INCRBY && type != CommandType.DECRBY) {
                throw new IllegalArgumentException("Not a counter command: " + type);
            }
            this.amount = amount;
        }

        public long getAmount() {
            return amount;
        }
    }

    /** MGET key [key ...]. */
    public static final class MGet extends MultiKeyCommand {
        public MGet(List<byte[]> keys) {
            super(CommandType.MGET, keys);
        }
    }

    /** MSET key value [key value ...]. */
    public static final class MSet extends Command {
        private final List<KeyValue> pairs;

        public MSet(List<KeyValue> pairs) {
            super(CommandType.MSET);
            this.pairs = Collections.unmodifiableList(new ArrayList<>(pairs));
        }

        public List<KeyValue> getPairs() {
            return pairs;
        }
    }

    /** GETSET key value. */
    public static final class GetSet extends KeyCommand {
        private final byte[] value;

        public GetSet(byte[] key, byte[] value) {
            super(CommandType.GETSET, key);
            this.value = copy(value);
        }

        public byte[] getValueUnsafe() {
            return value;
        }
    }

    /** KEYS pattern. */
    public static final class Keys extends Command {
        private final byte[] pattern;

        public Keys(byte[] pattern) {
            super(CommandType.KEYS);
            this.pattern = copy(pattern);
        }

        public byte[] getPatternUnsafe() {
            return pattern;
        }
    }

    /** FLUSHALL. */
    public static final class FlushAll extends Command {
        public FlushAll() {
            super(CommandType.FLUSHALL);
        }
    }

    /**
     * HELLO, CLIENT and PING: connection-level commands with at most one
     * meaningful argument.
     */
    public static final class Connection extends Command {
        private final byte[] argument;

        public Connection(CommandType type, byte[] argument) {
            super(type);
            if (type != CommandType.HELLO && type != CommandType.CLIENT && type != CommandType.PING) {
                throw new IllegalArgumentException("Not a connection command: " + type);
            }
            this.argument = argument != null ? copy(argument) : null;
        }

        /**
         * @return the optional argument, or null when none was sent
         */
        public byte[] getArgumentUnsafe() {
            return argument;
        }

        public boolean hasArgument() {
            return argument != null;
        }
    }
}
