package com.cinderkv.network.protocol;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable result of executing a command, tagged with the frame it must be
 * written as. The status byte is the RESP type prefix of that frame, except
 * for {@link #NULL}.
 */
public final class Response {

    // Frame types
    public static final byte SIMPLE = '+';
    public static final byte ERROR = '-';
    public static final byte INTEGER = ':';
    public static final byte BULK = '$';
    // Internal tag only: a null reply is written as the RESP2 null bulk "$-1"
    public static final byte NULL = '_';
    public static final byte ARRAY = '*';
    public static final byte MAP = '%';

    private static final Response OK = new Response(SIMPLE, "OK".getBytes(StandardCharsets.US_ASCII), 0, null, null);
    private static final Response PONG = new Response(SIMPLE, "PONG".getBytes(StandardCharsets.US_ASCII), 0, null, null);
    private static final Response NULL_RESPONSE = new Response(NULL, null, 0, null, null);

    private final byte status;
    private final byte[] value;
    private final long integer;
    private final List<byte[]> elements;
    private final Map<String, String> fields;

    private Response(byte status, byte[] value, long integer, List<byte[]> elements, Map<String, String> fields) {
        this.status = status;
        this.value = value;
        this.integer = integer;
        this.elements = elements;
        this.fields = fields;
    }

    /**
     * Create a simple-string {@code OK} response.
     */
    public static Response ok() {
        return OK;
    }

    /**
     * Create a simple-string {@code PONG} response.
     */
    public static Response pong() {
        return PONG;
    }

    /**
     * Create a bulk-string response.
     */
    public static Response bulk(byte[] value) {
        if (value == null) {
            return NULL_RESPONSE;
        }
        return new Response(BULK, Arrays.copyOf(value, value.length), 0, null, null);
    }

    /**
     * Create a null bulk-string response.
     */
    public static Response nullBulk() {
        return NULL_RESPONSE;
    }

    /**
     * Create an integer response.
     */
    public static Response integer(long value) {
        return new Response(INTEGER, null, value, null, null);
    }

    /**
     * Create an array response; null elements are written as null bulk strings.
     */
    public static Response array(List<byte[]> elements) {
        List<byte[]> copy = new ArrayList<>(elements.size());
        for (byte[] element : elements) {
            copy.add(element != null ? Arrays.copyOf(element, element.length) : null);
        }
        return new Response(ARRAY, null, 0, Collections.unmodifiableList(copy), null);
    }

    /**
     * Create a map response. Iteration order of the given map is preserved.
     */
    public static Response map(Map<String, String> fields) {
        return new Response(MAP, null, 0, null, Collections.unmodifiableMap(new LinkedHashMap<>(fields)));
    }

    /**
     * Create an error response. The message is prefixed with {@code ERR }.
     */
    public static Response error(String message) {
        String text = "ERR " + (message != null ? message : "unknown error");
        // error frames are single-line
        text = text.replace('\r', ' ').replace('\n', ' ');
        return new Response(ERROR, text.getBytes(StandardCharsets.UTF_8), 0, null, null);
    }

    /**
     * Get the response status, which is the RESP type prefix of the frame.
     *
     * @return status code
     */
    public byte getStatus() {
        return status;
    }

    /**
     * Get the payload of a simple, error or bulk response.
     *
     * @return copy of the value, or null
     */
    public byte[] getValue() {
        return value != null ? Arrays.copyOf(value, value.length) : null;
    }

    /**
     * Get the raw value without copying.
     *
     * @return internal value array, or null
     */
    public byte[] getValueUnsafe() {
        return value;
    }

    public long getInteger() {
        return integer;
    }

    /**
     * @return the elements of an array response, or null
     */
    public List<byte[]> getElements() {
        return elements;
    }

    /**
     * @return the fields of a map response, or null
     */
    public Map<String, String> getFields() {
        return fields;
    }

    /**
     * Get the error message, including the {@code ERR} prefix.
     *
     * @return error message, or null if not an error
     */
    public String getErrorMessage() {
        return status == ERROR ? new String(value, StandardCharsets.UTF_8) : null;
    }

    public boolean isError() {
        return status == ERROR;
    }

    public boolean isNull() {
        return status == NULL;
    }

    /**
     * Get a human-readable status name.
     */
    public String getStatusName() {
        switch (status) {
            case SIMPLE: return "SIMPLE";
            case ERROR: return "ERROR";
            case INTEGER: return "INTEGER";
            case BULK: return "BULK";
            case NULL: return "NULL";
            case ARRAY: return "ARRAY";
            case MAP: return "MAP";
            default: return "UNKNOWN(" + status + ")";
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Response response = (Response) o;
        if (status != response.status || integer != response.integer
                || !Arrays.equals(value, response.value)
                || !Objects.equals(fields, response.fields)) {
            return false;
        }
        if (elements == null || response.elements == null) {
            return elements == response.elements;
        }
        if (elements.size() != response.elements.size()) {
            return false;
        }
        for (int i = 0; i < elements.size(); i++) {
            if (!Arrays.equals(elements.get(i), response.elements.get(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(status, integer, fields);
        result = 31 * result + Arrays.hashCode(value);
        if (elements != null) {
            for (byte[] element : elements) {
                result = 31 * result + Arrays.hashCode(element);
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return "Response{" +
               "status=" + getStatusName() +
               (value != null ? ", valueLength=" + value.length : "") +
               (status == INTEGER ? ", integer=" + integer : "") +
               (elements != null ? ", elements=" + elements.size() : "") +
               (fields != null ? ", fields=" + fields.keySet() : "") +
               '}';
    }
}
