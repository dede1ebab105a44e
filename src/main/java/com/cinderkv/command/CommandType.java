package com.cinderkv.command;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * The supported commands, keyed by their wire name.
 */
public enum CommandType {
    SET,
    GET,
    DEL,
    EXISTS,
    APPEND,
    STRLEN,
    GETRANGE,
    SETRANGE,
    INCR,
    DECR,
    INCRBY,
    DECRBY,
    MGET,
    MSET,
    GETSET,
    KEYS,
    FLUSHALL,
    HELLO,
    CLIENT,
    PING;

    private static final Map<String, CommandType> BY_NAME = new HashMap<>();

    static {
        for (CommandType type : values()) {
            BY_NAME.put(type.name(), type);
        }
    }

    /**
     * Look up a command by name, ignoring case.
     *
     * @param name the command name as sent by the client
     * @return the command type, or null if unknown or not ASCII
     */
    public static CommandType fromName(String name) {
        // only ASCII letters fold, so e.g. U+017F does not turn into 'S'
        for (int i = 0; i < name.length(); i++) {
            if (name.charAt(i) > 0x7F) {
                return null;
            }
        }
        return BY_NAME.get(name.toUpperCase(Locale.ROOT));
    }

    /**
     * @return the name used in error messages
     */
    public String displayName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
