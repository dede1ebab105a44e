package com.cinderkv.network.protocol;

/**
 * Exception thrown when a RESP frame is malformed. The stream cannot be
 * resynchronised after one, so the connection is closed.
 */
public class ProtocolException extends RuntimeException {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
