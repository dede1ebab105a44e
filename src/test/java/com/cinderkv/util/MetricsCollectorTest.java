package com.cinderkv.util;

import com.cinderkv.core.InMemoryStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

class MetricsCollectorTest {

    private SimpleMeterRegistry registry;
    private MetricsCollector metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new MetricsCollector(registry);
    }

    @Test
    void recordCommand_countsPerCommand() {
        metrics.recordCommand("get", 1_000_000L);
        metrics.recordCommand("get", 2_000_000L);
        metrics.recordCommand("set", 500_000L);

        assertThat(metrics.getCommandCount("get")).isEqualTo(2);
        assertThat(metrics.getCommandCount("set")).isEqualTo(1);
        assertThat(metrics.getCommandCount("del")).isZero();
        assertThat(metrics.getTotalCommands()).isEqualTo(3);
        assertThat(registry.get("cinderkv.commands").tag("command", "get").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("cinderkv.latency").tag("command", "get").timer().count()).isEqualTo(2);
    }

    @Test
    void meanLatency_isReportedInMillis() {
        metrics.recordCommand("get", 1_000_000L);
        metrics.recordCommand("get", 3_000_000L);

        assertThat(metrics.getMeanLatencyMs("get")).isEqualTo(2.0);
        assertThat(metrics.getMeanLatencyMs("keys")).isZero();
    }

    @Test
    void recordKeyspace_tracksHitRate() {
        metrics.recordKeyspace(true);
        metrics.recordKeyspace(true);
        metrics.recordKeyspace(false);

        assertThat(metrics.getHitRate()).isEqualTo(2.0 / 3.0);
    }

    @Test
    void hitRate_withNoLookups_isZero() {
        assertThat(metrics.getHitRate()).isZero();
    }

    @Test
    void recordError_countsByKind() {
        metrics.recordError(MetricsCollector.KIND_PARSE);
        metrics.recordError(MetricsCollector.KIND_PARSE);
        metrics.recordError(MetricsCollector.KIND_EXECUTION);

        assertThat(metrics.getErrorCount(MetricsCollector.KIND_PARSE)).isEqualTo(2);
        assertThat(metrics.getErrorCount(MetricsCollector.KIND_EXECUTION)).isEqualTo(1);
        assertThat(metrics.getErrorCount(MetricsCollector.KIND_INTERNAL)).isZero();
        assertThat(metrics.getTotalErrors()).isEqualTo(3);
    }

    @Test
    void recordError_unknownKind_throws() {
        assertThatThrownBy(() -> metrics.recordError("disk"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void connections_areTracked() {
        metrics.connectionOpened();
        metrics.connectionOpened();
        metrics.connectionClosed();

        assertThat(metrics.getActiveConnections()).isEqualTo(1);
        assertThat(registry.get("cinderkv.connections").gauge().value()).isEqualTo(1.0);
    }

    @Test
    void keyGauge_followsStore() {
        InMemoryStore store = new InMemoryStore();
        metrics.bindKeyCount(store);

        store.set("a".getBytes(StandardCharsets.UTF_8), "1".getBytes(StandardCharsets.UTF_8));
        store.set("b".getBytes(StandardCharsets.UTF_8), "2".getBytes(StandardCharsets.UTF_8));

        assertThat(registry.get("cinderkv.keys").gauge().value()).isEqualTo(2.0);
    }

    @Test
    void summary_containsKeyFigures() {
        metrics.recordCommand("get", 1_000_000L);
        metrics.recordKeyspace(true);
        metrics.recordError(MetricsCollector.KIND_INTERNAL);

        String summary = metrics.summary();

        assertThat(summary).contains("CinderKV Metrics Summary");
        assertThat(summary).contains("GET=1");
        assertThat(summary).contains("internal=1");
    }
}
