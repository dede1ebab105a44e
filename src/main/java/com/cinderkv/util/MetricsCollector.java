package com.cinderkv.util;

import com.cinderkv.core.KVStore;
import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;

/**
 * Metrics collector for CinderKV.
 * Tracks per-command throughput and latency, keyspace hits, errors and connections.
 */
public class MetricsCollector {

    public static final String KIND_PARSE = "parse";
    public static final String KIND_EXECUTION = "execution";
    public static final String KIND_INTERNAL = "internal";

    private final MeterRegistry registry;

    // Per-command meters, created on first use
    private final Map<String, Counter> commandCounters = new ConcurrentHashMap<>();
    private final Map<String, Timer> commandTimers = new ConcurrentHashMap<>();

    // Counters
    private final Counter keyspaceHits;
    private final Counter keyspaceMisses;
    private final Counter parseErrors;
    private final Counter executionErrors;
    private final Counter internalErrors;

    // Gauges
    private final LongAdder activeConnections;

    /**
     * Create a metrics collector with a simple registry.
     */
    public MetricsCollector() {
        this(new SimpleMeterRegistry());
    }

    /**
     * Create a metrics collector with a custom registry.
     *
     * @param registry the Micrometer registry to use
     */
    public MetricsCollector(MeterRegistry registry) {
        this.registry = registry;

        this.keyspaceHits = Counter.builder("cinderkv.keyspace")
            .tag("result", "hit")
            .description("GET requests that found a value")
            .register(registry);

        this.keyspaceMisses = Counter.builder("cinderkv.keyspace")
            .tag("result", "miss")
            .description("GET requests for an absent key")
            .register(registry);

        this.parseErrors = errorCounter(KIND_PARSE);
        this.executionErrors = errorCounter(KIND_EXECUTION);
        this.internalErrors = errorCounter(KIND_INTERNAL);

        this.activeConnections = new LongAdder();
        Gauge.builder("cinderkv.connections", activeConnections, LongAdder::sum)
            .description("Active connections")
            .register(registry);
    }

    private Counter errorCounter(String kind) {
        return Counter.builder("cinderkv.errors")
            .tag("kind", kind)
            .description("Error replies by kind")
            .register(registry);
    }

    /**
     * Report the live key count of a store through the {@code cinderkv.keys} gauge.
     *
     * @param store the store to observe
     */
    public void bindKeyCount(KVStore store) {
        Gauge.builder("cinderkv.keys", store, KVStore::size)
            .description("Number of live keys")
            .register(registry);
    }

    // Command recording

    /**
     * Record one executed command.
     *
     * @param command       lower-case command name
     * @param durationNanos time spent executing it
     */
    public void recordCommand(String command, long durationNanos) {
        commandCounters.computeIfAbsent(command, name -> Counter.builder("cinderkv.commands")
            .tag("command", name)
            .description("Commands executed")
            .register(registry)).increment();
        commandTimers.computeIfAbsent(command, name -> Timer.builder("cinderkv.latency")
            .tag("command", name)
            .description("Command execution latency")
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(registry)).record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void recordKeyspace(boolean hit) {
        if (hit) {
            keyspaceHits.increment();
        } else {
            keyspaceMisses.increment();
        }
    }

    /**
     * Record an error reply.
     *
     * @param kind one of {@link #KIND_PARSE}, {@link #KIND_EXECUTION}, {@link #KIND_INTERNAL}
     */
    public void recordError(String kind) {
        switch (kind) {
            case KIND_PARSE:
                parseErrors.increment();
                break;
            case KIND_EXECUTION:
                executionErrors.increment();
                break;
            case KIND_INTERNAL:
                internalErrors.increment();
                break;
            default:
                throw new IllegalArgumentException("Unknown error kind: " + kind);
        }
    }

    // Connection tracking

    public void connectionOpened() {
        activeConnections.increment();
    }

    public void connectionClosed() {
        activeConnections.decrement();
    }

    // Getters for metrics values

    public long getCommandCount(String command) {
        Counter counter = commandCounters.get(command);
        return counter != null ? (long) counter.count() : 0;
    }

    public long getTotalCommands() {
        long total = 0;
        for (Counter counter : commandCounters.values()) {
            total += (long) counter.count();
        }
        return total;
    }

    public long getErrorCount(String kind) {
        switch (kind) {
            case KIND_PARSE: return (long) parseErrors.count();
            case KIND_EXECUTION: return (long) executionErrors.count();
            case KIND_INTERNAL: return (long) internalErrors.count();
            default: throw new IllegalArgumentException("Unknown error kind: " + kind);
        }
    }

    public long getTotalErrors() {
        return (long) (parseErrors.count() + executionErrors.count() + internalErrors.count());
    }

    public long getActiveConnections() {
        return activeConnections.sum();
    }

    public double getHitRate() {
        double hits = keyspaceHits.count();
        double misses = keyspaceMisses.count();
        double total = hits + misses;
        return total > 0 ? hits / total : 0.0;
    }

    public double getMeanLatencyMs(String command) {
        Timer timer = commandTimers.get(command);
        return timer != null ? timer.mean(TimeUnit.MILLISECONDS) : 0.0;
    }

    /**
     * Get the underlying registry.
     *
     * @return the MeterRegistry
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    /**
     * Print a summary of current metrics.
     *
     * @return formatted metrics string
     */
    public String summary() {
        Gauge keys = registry.find("cinderkv.keys").gauge();
        return String.format(
            "CinderKV Metrics Summary%n" +
            "========================%n" +
            "Commands: total=%d, GET=%d, SET=%d%n" +
            "Keyspace: hits=%d, misses=%d, hitRate=%.2f%%%n" +
            "Errors: parse=%d, execution=%d, internal=%d%n" +
            "Connections: %d active%n" +
            "Keys: %d%n" +
            "Latency (mean): GET=%.3fms, SET=%.3fms",
            getTotalCommands(), getCommandCount("get"), getCommandCount("set"),
            (long) keyspaceHits.count(), (long) keyspaceMisses.count(), getHitRate() * 100,
            (long) parseErrors.count(), (long) executionErrors.count(), (long) internalErrors.count(),
            getActiveConnections(),
            keys != null ? (long) keys.value() : 0L,
            getMeanLatencyMs("get"), getMeanLatencyMs("set")
        );
    }
}
