package com.cinderkv.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.function.Function;

/**
 * Configuration for the CinderKV server.
 */
public class ServerConfig {

    private static final Logger logger = LoggerFactory.getLogger(ServerConfig.class);

    public static final String DEFAULT_LISTEN = ":5555";

    static final String LISTEN_ENV = "CINDERKV_LISTEN";
    static final String LISTEN_PROPERTY = "cinderkv.listen";
    static final String READ_TIMEOUT_ENV = "CINDERKV_READ_TIMEOUT_MS";
    static final String READ_TIMEOUT_PROPERTY = "cinderkv.read.timeout.ms";

    private String listen = DEFAULT_LISTEN;
    private InetSocketAddress bindAddress = parseListenAddress(DEFAULT_LISTEN);
    private int readTimeoutMs = 0;

    /**
     * Create a config with built-in defaults.
     */
    public ServerConfig() {
    }

    /**
     * Create a config from defaults overridden by environment variables, then
     * system properties. Checks CINDERKV_LISTEN / cinderkv.listen and
     * CINDERKV_READ_TIMEOUT_MS / cinderkv.read.timeout.ms.
     */
    public static ServerConfig fromEnvironment() {
        return fromLookup(System::getenv, System::getProperty);
    }

    static ServerConfig fromLookup(Function<String, String> env, Function<String, String> properties) {
        ServerConfig config = new ServerConfig();

        String listen = lookup(env, LISTEN_ENV, properties, LISTEN_PROPERTY);
        if (listen != null) {
            try {
                config.setListen(listen);
                logger.info("Using listen address {}", listen);
            } catch (IllegalArgumentException e) {
                logger.warn("Invalid listen address: {}, using default {}", listen, DEFAULT_LISTEN);
            }
        }

        String timeout = lookup(env, READ_TIMEOUT_ENV, properties, READ_TIMEOUT_PROPERTY);
        if (timeout != null) {
            try {
                config.setReadTimeoutMs(Integer.parseInt(timeout));
                logger.info("Using read timeout {}ms", timeout);
            } catch (IllegalArgumentException e) {
                logger.warn("Invalid read timeout: {}, using default", timeout);
            }
        }

        return config;
    }

    private static String lookup(Function<String, String> env, String envName,
                                 Function<String, String> properties, String propertyName) {
        String value = env.apply(envName);
        if (value == null || value.trim().isEmpty()) {
            value = properties.apply(propertyName);
        }
        if (value == null || value.trim().isEmpty()) {
            return null;
        }
        return value.trim();
    }

    /**
     * Create a config builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Parse a listen address of the form {@code host:port}, {@code :port} or
     * {@code [ipv6]:port}. An empty host binds all interfaces.
     *
     * @param address the address to parse
     * @return the socket address to bind
     * @throws IllegalArgumentException if the address is malformed or the host cannot be resolved
     */
    public static InetSocketAddress parseListenAddress(String address) {
        if (address == null || address.isEmpty()) {
            throw new IllegalArgumentException("listen address cannot be empty");
        }
        int colon = address.lastIndexOf(':');
        if (colon < 0) {
            throw new IllegalArgumentException("listen address must be host:port, got: " + address);
        }

        String host = address.substring(0, colon);
        String portText = address.substring(colon + 1);
        if (host.startsWith("[")) {
            if (!host.endsWith("]")) {
                throw new IllegalArgumentException("unterminated IPv6 address: " + address);
            }
            host = host.substring(1, host.length() - 1);
        } else if (host.indexOf(':') >= 0) {
            throw new IllegalArgumentException("IPv6 addresses must be bracketed, got: " + address);
        }

        int port;
        try {
            port = Integer.parseInt(portText);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid port in listen address: " + address, e);
        }
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port must be between 0 and 65535, got: " + port);
        }

        if (host.isEmpty()) {
            return new InetSocketAddress(port);
        }
        InetSocketAddress resolved = new InetSocketAddress(host, port);
        if (resolved.isUnresolved()) {
            throw new IllegalArgumentException("cannot resolve host: " + host);
        }
        return resolved;
    }

    public String getListen() {
        return listen;
    }

    public void setListen(String listen) {
        this.bindAddress = parseListenAddress(listen);
        this.listen = listen;
    }

    /**
     * @return the socket address the server binds
     */
    public InetSocketAddress getBindAddress() {
        return bindAddress;
    }

    public int getReadTimeoutMs() {
        return readTimeoutMs;
    }

    /**
     * @param readTimeoutMs idle timeout for client reads, 0 to wait forever
     */
    public void setReadTimeoutMs(int readTimeoutMs) {
        if (readTimeoutMs < 0) {
            throw new IllegalArgumentException("readTimeoutMs must be non-negative, got: " + readTimeoutMs);
        }
        this.readTimeoutMs = readTimeoutMs;
    }

    @Override
    public String toString() {
        return "ServerConfig{" +
               "listen='" + listen + '\'' +
               ", readTimeoutMs=" + readTimeoutMs +
               '}';
    }

    /**
     * Builder for ServerConfig.
     */
    public static class Builder {
        private final ServerConfig config = new ServerConfig();

        public Builder listen(String listen) {
            config.setListen(listen);
            return this;
        }

        public Builder readTimeoutMs(int timeout) {
            config.setReadTimeoutMs(timeout);
            return this;
        }

        public ServerConfig build() {
            return config;
        }
    }
}
