package com.cinderkv.command;

/**
 * Exception thrown when a request cannot be turned into a command: unknown
 * name, wrong arity, or a malformed argument. The connection stays usable.
 */
public class CommandParseException extends RuntimeException {

    public CommandParseException(String message) {
        super(message);
    }

    public CommandParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
