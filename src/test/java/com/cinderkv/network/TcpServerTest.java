package com.cinderkv.network;

import com.cinderkv.config.ServerConfig;
import com.cinderkv.core.InMemoryStore;
import com.cinderkv.network.protocol.RespProtocol;
import com.cinderkv.util.MetricsCollector;
import org.junit.jupiter.api.*;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

/**
 * Integration tests for the TCP server over real sockets.
 */
class TcpServerTest {

    private InMemoryStore store;
    private MetricsCollector metrics;
    private TcpServer server;
    private Client client;

    @BeforeEach
    void setUp() throws Exception {
        store = new InMemoryStore();
        metrics = new MetricsCollector();
        server = new TcpServer(ServerConfig.builder().listen("127.0.0.1:0").build(), store, metrics);
        server.start();

        client = new Client(server.getPort());
    }

    @AfterEach
    void tearDown() throws IOException {
        if (client != null) {
            client.close();
        }
        if (server != null) {
            server.stop();
        }
    }

    @Test
    void serverStartsOnEphemeralPort() throws IOException {
        assertThat(server.isRunning()).isTrue();
        assertThat(server.getPort()).isGreaterThan(0);
        assertThat(client.call("PING")).isEqualTo("+PONG\r\n");
    }

    @Test
    void setThenGet() throws IOException {
        assertThat(client.call("SET", "name", "John")).isEqualTo("+OK\r\n");
        assertThat(client.call("GET", "name")).isEqualTo("$4\r\nJohn\r\n");
    }

    @Test
    void setWithExpire_expires() throws Exception {
        assertThat(client.call("SET", "temp", "data", "EX", "1")).isEqualTo("+OK\r\n");
        assertThat(client.call("GET", "temp")).isEqualTo("$4\r\ndata\r\n");

        Thread.sleep(1100);

        assertThat(client.call("GET", "temp")).isEqualTo("$-1\r\n");
    }

    @Test
    void incrFromAbsence() throws IOException {
        assertThat(client.call("INCR", "counter")).isEqualTo(":1\r\n");
        assertThat(client.call("INCR", "counter")).isEqualTo(":2\r\n");
        assertThat(client.call("INCR", "counter")).isEqualTo(":3\r\n");
    }

    @Test
    void msetThenMget() throws IOException {
        assertThat(client.call("MSET", "a", "1", "b", "2")).isEqualTo("+OK\r\n");
        assertThat(client.call("MGET", "a", "b", "c"))
            .isEqualTo("*3\r\n$1\r\n1\r\n$1\r\n2\r\n$-1\r\n");
    }

    @Test
    void appendBuildsValue() throws IOException {
        assertThat(client.call("APPEND", "greet", "Hello")).isEqualTo(":5\r\n");
        assertThat(client.call("APPEND", "greet", " World")).isEqualTo(":11\r\n");
        assertThat(client.call("GET", "greet")).isEqualTo("$11\r\nHello World\r\n");
    }

    @Test
    void delCountsExistingKeys() throws IOException {
        client.call("SET", "a", "1");

        assertThat(client.call("DEL", "a", "b", "c")).isEqualTo(":1\r\n");
    }

    @Test
    void hello_repliesMap() throws IOException {
        String reply = client.call("HELLO", "3");

        assertThat(reply).startsWith("%4\r\n+server\r\n$8\r\ncinderkv\r\n");
        assertThat(reply).contains("+mode\r\n$10\r\nstandalone\r\n");
    }

    @Test
    void errors_keepConnectionOpen() throws IOException {
        assertThat(client.call("NOPE")).isEqualTo("-ERR unknown command 'NOPE'\r\n");
        assertThat(client.call("GET")).isEqualTo("-ERR wrong number of arguments for 'get' command\r\n");
        client.call("SET", "k", "abc");
        assertThat(client.call("INCR", "k")).isEqualTo("-ERR value is not an integer or out of range\r\n");

        assertThat(client.call("PING")).isEqualTo("+PONG\r\n");
    }

    @Test
    void inlineCommands_areAccepted() throws IOException {
        client.sendRaw("SET color blue\r\n");
        assertThat(client.readReply()).isEqualTo("+OK\r\n");
        client.sendRaw("GET color\r\n");
        assertThat(client.readReply()).isEqualTo("$4\r\nblue\r\n");
    }

    @Test
    void pipelinedRequests_answeredInOrder() throws IOException {
        client.sendRaw(new String(RespProtocol.encodeRequest("SET", "p", "1"), StandardCharsets.UTF_8)
            + new String(RespProtocol.encodeRequest("INCR", "p"), StandardCharsets.UTF_8)
            + new String(RespProtocol.encodeRequest("GET", "p"), StandardCharsets.UTF_8));

        assertThat(client.readReply()).isEqualTo("+OK\r\n");
        assertThat(client.readReply()).isEqualTo(":2\r\n");
        assertThat(client.readReply()).isEqualTo("$1\r\n2\r\n");
    }

    @Test
    void protocolViolation_closesOnlyThatConnection() throws Exception {
        try (Client other = new Client(server.getPort())) {
            other.sendRaw("*1\r\n$x\r\n");
            assertThat(other.readUntilClosed()).isEmpty();
        }

        assertThat(client.call("PING")).isEqualTo("+PONG\r\n");
    }

    @Test
    void connectionRegistry_tracksClients() throws Exception {
        client.call("PING");
        assertThat(server.getConnectionCount()).isEqualTo(1);
        assertThat(metrics.getActiveConnections()).isEqualTo(1);

        client.close();
        client = null;

        long deadline = System.currentTimeMillis() + 5000;
        while (server.getConnectionCount() > 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertThat(server.getConnectionCount()).isZero();
        assertThat(metrics.getActiveConnections()).isZero();
    }

    @Test
    void concurrentClients_incrementAtomically() throws Exception {
        int clients = 8;
        int incrementsPerClient = 200;
        ExecutorService executor = Executors.newFixedThreadPool(clients);
        CountDownLatch latch = new CountDownLatch(clients);
        AtomicInteger failures = new AtomicInteger();

        for (int c = 0; c < clients; c++) {
            executor.submit(() -> {
                try (Client worker = new Client(server.getPort())) {
                    for (int i = 0; i < incrementsPerClient; i++) {
                        if (!worker.call("INCR", "shared").startsWith(":")) {
                            failures.incrementAndGet();
                        }
                    }
                } catch (IOException e) {
                    failures.incrementAndGet();
                } finally {
                    latch.countDown();
                }
            });
        }

        assertThat(latch.await(30, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();

        assertThat(failures.get()).isZero();
        assertThat(client.call("GET", "shared"))
            .isEqualTo("$4\r\n" + (clients * incrementsPerClient) + "\r\n");
    }

    @Test
    void stop_closesListener() throws IOException {
        int port = server.getPort();
        server.stop();

        assertThat(server.isRunning()).isFalse();
        assertThatThrownBy(() -> new Socket("127.0.0.1", port).close())
            .isInstanceOf(IOException.class);
    }

    /**
     * Minimal RESP client that returns replies as raw text.
     */
    private static final class Client implements AutoCloseable {
        private final Socket socket;
        private final InputStream in;
        private final OutputStream out;

        Client(int port) throws IOException {
            this.socket = new Socket("127.0.0.1", port);
            this.socket.setSoTimeout(5000);
            this.in = new BufferedInputStream(socket.getInputStream());
            this.out = socket.getOutputStream();
        }

        String call(String... tokens) throws IOException {
            out.write(RespProtocol.encodeRequest(tokens));
            out.flush();
            return readReply();
        }

        void sendRaw(String raw) throws IOException {
            out.write(raw.getBytes(StandardCharsets.UTF_8));
            out.flush();
        }

        String readReply() throws IOException {
            ByteArrayOutputStream reply = new ByteArrayOutputStream();
            readFrame(reply);
            return reply.toString(StandardCharsets.UTF_8);
        }

        String readUntilClosed() throws IOException {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }

        private void readFrame(ByteArrayOutputStream reply) throws IOException {
            String line = readLine(reply);
            char type = line.charAt(0);
            switch (type) {
                case '$': {
                    int length = Integer.parseInt(line.substring(1));
                    if (length >= 0) {
                        reply.write(in.readNBytes(length + 2));
                    }
                    break;
                }
                case '*': {
                    int count = Integer.parseInt(line.substring(1));
                    for (int i = 0; i < count; i++) {
                        readFrame(reply);
                    }
                    break;
                }
                case '%': {
                    int count = Integer.parseInt(line.substring(1));
                    for (int i = 0; i < count * 2; i++) {
                        readFrame(reply);
                    }
                    break;
                }
                default:
                    break;
            }
        }

        private String readLine(ByteArrayOutputStream reply) throws IOException {
            StringBuilder line = new StringBuilder();
            int b;
            while ((b = in.read()) != '\n') {
                if (b == -1) {
                    throw new EOFException("Connection closed");
                }
                reply.write(b);
                if (b != '\r') {
                    line.append((char) b);
                }
            }
            reply.write('\n');
            return line.toString();
        }

        @Override
        public void close() throws IOException {
            socket.close();
        }
    }
}
