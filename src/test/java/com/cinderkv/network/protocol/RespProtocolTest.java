package com.cinderkv.network.protocol;

import com.cinderkv.command.CommandParseException;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class RespProtocolTest {

    private static InputStream input(String raw) {
        return new ByteArrayInputStream(raw.getBytes(StandardCharsets.UTF_8));
    }

    private static List<String> strings(List<byte[]> tokens) {
        List<String> result = new ArrayList<>();
        for (byte[] token : tokens) {
            result.add(new String(token, StandardCharsets.UTF_8));
        }
        return result;
    }

    private static String encoded(Response response) {
        return new String(RespProtocol.encode(response), StandardCharsets.UTF_8);
    }

    // ==================== Decoding ====================

    @Test
    void readRequest_arrayOfBulkStrings() throws IOException {
        InputStream in = input("*3\r\n$3\r\nSET\r\n$3\r\nkey\r\n$5\r\nvalue\r\n");

        assertThat(strings(RespProtocol.readRequest(in))).containsExactly("SET", "key", "value");
        assertThat(RespProtocol.readRequest(in)).isNull();
    }

    @Test
    void readRequest_pipelinedRequests() throws IOException {
        InputStream in = input("*1\r\n$4\r\nPING\r\n*2\r\n$3\r\nGET\r\n$1\r\nk\r\n");

        assertThat(strings(RespProtocol.readRequest(in))).containsExactly("PING");
        assertThat(strings(RespProtocol.readRequest(in))).containsExactly("GET", "k");
        assertThat(RespProtocol.readRequest(in)).isNull();
    }

    @Test
    void readRequest_binarySafeBulk() throws IOException {
        byte[] raw = {'*', '1', '\r', '\n', '$', '4', '\r', '\n', 0x00, '\r', '\n', (byte) 0xFF, '\r', '\n'};

        List<byte[]> tokens = RespProtocol.readRequest(new ByteArrayInputStream(raw));

        assertThat(tokens.get(0)).containsExactly(0x00, '\r', '\n', 0xFF);
    }

    @Test
    void readRequest_emptyBulkString() throws IOException {
        List<byte[]> tokens = RespProtocol.readRequest(input("*3\r\n$3\r\nSET\r\n$1\r\nk\r\n$0\r\n\r\n"));

        assertThat(tokens.get(2)).isEmpty();
    }

    @Test
    void readRequest_inlineCommand() throws IOException {
        InputStream in = input("SET  key\tvalue\r\n\r\nPING\n");

        assertThat(strings(RespProtocol.readRequest(in))).containsExactly("SET", "key", "value");
        assertThat(strings(RespProtocol.readRequest(in))).containsExactly("PING");
        assertThat(RespProtocol.readRequest(in)).isNull();
    }

    @Test
    void readRequest_emptyArraysAreSkipped() throws IOException {
        InputStream in = input("*0\r\n*-1\r\n*1\r\n$4\r\nPING\r\n");

        assertThat(strings(RespProtocol.readRequest(in))).containsExactly("PING");
    }

    @Test
    void readRequest_nonArrayFrame_isRecoverable() throws IOException {
        InputStream in = input("+OK\r\n$3\r\nabc\r\n*1\r\n$4\r\nPING\r\n");

        assertThatThrownBy(() -> RespProtocol.readRequest(in))
            .isInstanceOf(CommandParseException.class)
            .hasMessage("expected array");
        assertThatThrownBy(() -> RespProtocol.readRequest(in))
            .isInstanceOf(CommandParseException.class);
        assertThat(strings(RespProtocol.readRequest(in))).containsExactly("PING");
    }

    @Test
    void readRequest_badLength_isProtocolError() {
        assertThatThrownBy(() -> RespProtocol.readRequest(input("*x\r\n")))
            .isInstanceOf(ProtocolException.class);
        assertThatThrownBy(() -> RespProtocol.readRequest(input("*1\r\n$-1\r\n")))
            .isInstanceOf(ProtocolException.class);
        assertThatThrownBy(() -> RespProtocol.readRequest(input("*1\r\n:1\r\n")))
            .isInstanceOf(ProtocolException.class);
        assertThatThrownBy(() -> RespProtocol.readRequest(input("*1\r\n$3\r\nabcd\r\n")))
            .isInstanceOf(ProtocolException.class);
    }

    @Test
    void readRequest_overLimits_isProtocolError() {
        assertThatThrownBy(() -> RespProtocol.readRequest(input("*2000000\r\n")))
            .isInstanceOf(ProtocolException.class);
        assertThatThrownBy(() -> RespProtocol.readRequest(input("*1\r\n$999999999999\r\n")))
            .isInstanceOf(ProtocolException.class);

        char[] longLine = new char[RespProtocol.MAX_INLINE_LENGTH + 1];
        Arrays.fill(longLine, 'a');
        assertThatThrownBy(() -> RespProtocol.readRequest(input(new String(longLine) + "\r\n")))
            .isInstanceOf(ProtocolException.class);
    }

    @Test
    void readRequest_truncatedFrame_isEof() {
        assertThatThrownBy(() -> RespProtocol.readRequest(input("*2\r\n$3\r\nGET\r\n")))
            .isInstanceOf(EOFException.class);
        assertThatThrownBy(() -> RespProtocol.readRequest(input("*1\r\n$5\r\nab")))
            .isInstanceOf(EOFException.class);
    }

    // ==================== Encoding ====================

    @Test
    void encode_simpleAndError() {
        assertThat(encoded(Response.ok())).isEqualTo("+OK\r\n");
        assertThat(encoded(Response.pong())).isEqualTo("+PONG\r\n");
        assertThat(encoded(Response.error("syntax error"))).isEqualTo("-ERR syntax error\r\n");
    }

    @Test
    void encode_integer() {
        assertThat(encoded(Response.integer(42))).isEqualTo(":42\r\n");
        assertThat(encoded(Response.integer(-7))).isEqualTo(":-7\r\n");
    }

    @Test
    void encode_bulkAndNull() {
        assertThat(encoded(Response.bulk("hello".getBytes(StandardCharsets.UTF_8)))).isEqualTo("$5\r\nhello\r\n");
        assertThat(encoded(Response.bulk(new byte[0]))).isEqualTo("$0\r\n\r\n");
        assertThat(encoded(Response.nullBulk())).isEqualTo("$-1\r\n");
        assertThat(encoded(Response.bulk(null))).isEqualTo("$-1\r\n");
        assertThat(encoded(Response.nullBulk())).doesNotContain("_");
    }

    @Test
    void encode_arrayWithNulls() {
        Response response = Response.array(Arrays.asList("a".getBytes(StandardCharsets.UTF_8), null));

        assertThat(encoded(response)).isEqualTo("*2\r\n$1\r\na\r\n$-1\r\n");
        assertThat(encoded(Response.array(new ArrayList<>()))).isEqualTo("*0\r\n");
    }

    @Test
    void encode_map() {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("server", "cinderkv");
        fields.put("proto", "3");

        assertThat(encoded(Response.map(fields)))
            .isEqualTo("%2\r\n+server\r\n$8\r\ncinderkv\r\n+proto\r\n$1\r\n3\r\n");
    }

    @Test
    void encodeRequest_isReadBack() throws IOException {
        byte[] frame = RespProtocol.encodeRequest("MSET", "a", "1");

        assertThat(new String(frame, StandardCharsets.UTF_8))
            .isEqualTo("*3\r\n$4\r\nMSET\r\n$1\r\na\r\n$1\r\n1\r\n");
        assertThat(strings(RespProtocol.readRequest(new ByteArrayInputStream(frame))))
            .containsExactly("MSET", "a", "1");
    }

    @Test
    void errorMessages_areSingleLine() {
        assertThat(encoded(Response.error("bad\r\nthing"))).isEqualTo("-ERR bad  thing\r\n");
    }
}
