package com.cinderkv.network.protocol;

import com.cinderkv.command.CommandParseException;

import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * RESP encoder/decoder for CinderKV.
 *
 * Requests are arrays of bulk strings:
 * <pre>
 * *2\r\n$3\r\nGET\r\n$3\r\nfoo\r\n
 * </pre>
 * or inline commands ({@code GET foo\r\n}) as typed into telnet.
 * Replies use the RESP2 frames plus the RESP3 map frame for HELLO.
 *
 * The reader pulls single bytes, so callers should pass a buffered stream.
 */
public final class RespProtocol {

    // Maximum sizes
    public static final int MAX_BULK_LENGTH = 512 * 1024 * 1024;  // 512MB max bulk string
    public static final int MAX_ARRAY_LENGTH = 1024 * 1024;       // 1M elements per request
    public static final int MAX_INLINE_LENGTH = 64 * 1024;        // 64KB max inline/header line

    static final String EXPECTED_ARRAY = "expected array";

    private static final byte[] CRLF = {'\r', '\n'};
    private static final byte[] NULL_BULK = "$-1\r\n".getBytes(StandardCharsets.US_ASCII);

    private RespProtocol() {
        // Utility class
    }

    // ==================== Decoding ====================

    /**
     * Read one request from the stream.
     *
     * @param in the stream to read from
     * @return the request tokens, command name first, or null on a clean end of stream
     * @throws ProtocolException     if the framing is malformed; the stream cannot be reused
     * @throws CommandParseException if a well-formed frame other than an array was sent;
     *                               the frame has been consumed and the stream stays usable
     * @throws IOException           on read failure or an end of stream inside a frame
     */
    public static List<byte[]> readRequest(InputStream in) throws IOException {
        while (true) {
            int prefix = in.read();
            if (prefix == -1) {
                return null;
            }

            switch (prefix) {
                case '*': {
                    long count = readLength(in);
                    if (count <= 0) {
                        // empty and null arrays carry no command
                        continue;
                    }
                    if (count > MAX_ARRAY_LENGTH) {
                        throw new ProtocolException("invalid multibulk length: " + count);
                    }
                    List<byte[]> tokens = new ArrayList<>((int) count);
                    for (int i = 0; i < count; i++) {
                        tokens.add(readBulkElement(in));
                    }
                    return tokens;
                }
                case '+':
                case '-':
                case ':':
                    readLine(in);
                    throw new CommandParseException(EXPECTED_ARRAY);
                case '$': {
                    long length = readLength(in);
                    if (length >= 0) {
                        readBulkBody(in, length);
                    }
                    throw new CommandParseException(EXPECTED_ARRAY);
                }
                default: {
                    List<byte[]> tokens = readInline(in, (byte) prefix);
                    if (tokens.isEmpty()) {
                        continue;
                    }
                    return tokens;
                }
            }
        }
    }

    private static byte[] readBulkElement(InputStream in) throws IOException {
        int prefix = in.read();
        if (prefix == -1) {
            throw new EOFException("Stream ended inside a request");
        }
        if (prefix != '$') {
            throw new ProtocolException("expected '$', got '" + (char) prefix + "'");
        }
        long length = readLength(in);
        if (length < 0) {
            throw new ProtocolException("invalid bulk length: " + length);
        }
        return readBulkBody(in, length);
    }

    private static byte[] readBulkBody(InputStream in, long length) throws IOException {
        if (length > MAX_BULK_LENGTH) {
            throw new ProtocolException("invalid bulk length: " + length);
        }
        byte[] data = in.readNBytes((int) length);
        if (data.length < length) {
            throw new EOFException("Stream ended inside a bulk string");
        }
        int cr = in.read();
        int lf = in.read();
        if (cr == -1 || lf == -1) {
            throw new EOFException("Stream ended inside a bulk string");
        }
        if (cr != '\r' || lf != '\n') {
            throw new ProtocolException("bulk string not terminated by CRLF");
        }
        return data;
    }

    /**
     * Read a length header line. {@code -1} is returned for null frames.
     */
    private static long readLength(InputStream in) throws IOException {
        String line = readLine(in);
        try {
            long length = Long.parseLong(line);
            if (length < -1) {
                throw new ProtocolException("invalid length: " + line);
            }
            return length;
        } catch (NumberFormatException e) {
            throw new ProtocolException("invalid length: '" + line + "'", e);
        }
    }

    /**
     * Read a CRLF-terminated header line, without the terminator.
     */
    private static String readLine(InputStream in) throws IOException {
        ByteArrayOutputStream line = new ByteArrayOutputStream(16);
        while (true) {
            int b = in.read();
            if (b == -1) {
                throw new EOFException("Stream ended inside a header line");
            }
            if (b == '\r') {
                int lf = in.read();
                if (lf == -1) {
                    throw new EOFException("Stream ended inside a header line");
                }
                if (lf != '\n') {
                    throw new ProtocolException("header line not terminated by CRLF");
                }
                return line.toString(StandardCharsets.US_ASCII);
            }
            if (line.size() >= MAX_INLINE_LENGTH) {
                throw new ProtocolException("header line too long");
            }
            line.write(b);
        }
    }

    /**
     * Read the rest of an inline command and split it on spaces and tabs.
     * Accepts a bare LF terminator.
     */
    private static List<byte[]> readInline(InputStream in, byte first) throws IOException {
        List<byte[]> tokens = new ArrayList<>();
        ByteArrayOutputStream token = new ByteArrayOutputStream();
        int length = 0;
        int b = first;
        while (b != '\n') {
            if (b == -1) {
                throw new EOFException("Stream ended inside an inline command");
            }
            if (++length > MAX_INLINE_LENGTH) {
                throw new ProtocolException("inline command too long");
            }
            if (b == ' ' || b == '\t' || b == '\r') {
                if (token.size() > 0) {
                    tokens.add(token.toByteArray());
                    token.reset();
                }
            } else {
                token.write(b);
            }
            b = in.read();
        }
        if (token.size() > 0) {
            tokens.add(token.toByteArray());
        }
        return tokens;
    }

    // ==================== Encoding ====================

    /**
     * Write a reply frame. The stream is not flushed.
     *
     * @param response the reply to write
     * @param out      the stream to write to
     * @throws IOException if the write fails
     */
    public static void write(Response response, OutputStream out) throws IOException {
        switch (response.getStatus()) {
            case Response.SIMPLE:
            case Response.ERROR:
                out.write(response.getStatus());
                out.write(response.getValueUnsafe());
                out.write(CRLF);
                break;
            case Response.INTEGER:
                writeHeader(out, ':', response.getInteger());
                break;
            case Response.BULK:
                writeBulk(out, response.getValueUnsafe());
                break;
            case Response.NULL:
                out.write(NULL_BULK);
                break;
            case Response.ARRAY:
                writeArray(out, response.getElements());
                break;
            case Response.MAP:
                writeHeader(out, '%', response.getFields().size());
                for (Map.Entry<String, String> field : response.getFields().entrySet()) {
                    out.write('+');
                    out.write(field.getKey().getBytes(StandardCharsets.UTF_8));
                    out.write(CRLF);
                    writeBulk(out, field.getValue().getBytes(StandardCharsets.UTF_8));
                }
                break;
            default:
                throw new IllegalArgumentException("Cannot encode response " + response);
        }
    }

    /**
     * Encode a reply frame into a new array.
     *
     * @param response the reply to encode
     * @return the encoded frame
     */
    public static byte[] encode(Response response) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            write(response, out);
        } catch (IOException e) {
            // ByteArrayOutputStream does not throw
            throw new IllegalStateException(e);
        }
        return out.toByteArray();
    }

    /**
     * Encode a request as an array of bulk strings, the form clients send.
     *
     * @param tokens the command name followed by its arguments
     * @return the encoded frame
     */
    public static byte[] encodeRequest(List<byte[]> tokens) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            writeArray(out, tokens);
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
        return out.toByteArray();
    }

    /**
     * Encode a request given as strings.
     */
    public static byte[] encodeRequest(String... tokens) {
        List<byte[]> bytes = new ArrayList<>(tokens.length);
        for (String token : tokens) {
            bytes.add(token.getBytes(StandardCharsets.UTF_8));
        }
        return encodeRequest(Collections.unmodifiableList(bytes));
    }

    private static void writeArray(OutputStream out, List<byte[]> elements) throws IOException {
        writeHeader(out, '*', elements.size());
        for (byte[] element : elements) {
            if (element == null) {
                out.write(NULL_BULK);
            } else {
                writeBulk(out, element);
            }
        }
    }

    private static void writeBulk(OutputStream out, byte[] value) throws IOException {
        writeHeader(out, '$', value.length);
        out.write(value);
        out.write(CRLF);
    }

    private static void writeHeader(OutputStream out, char prefix, long number) throws IOException {
        out.write(prefix);
        out.write(Long.toString(number).getBytes(StandardCharsets.US_ASCII));
        out.write(CRLF);
    }
}
