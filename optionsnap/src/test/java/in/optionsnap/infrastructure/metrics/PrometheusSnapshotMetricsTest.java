package in.optionsnap.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PrometheusSnapshotMetricsTest {

    private CollectorRegistry registry;
    private PrometheusSnapshotMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new CollectorRegistry();
        metrics = new PrometheusSnapshotMetrics(registry);
    }

    @Test
    void testRecordCycleByOutcome() {
        metrics.recordCycle("SUCCESS", Duration.ofSeconds(2), 4100, 0);
        metrics.recordCycle("PARTIAL", Duration.ofSeconds(3), 3900, 1);
        metrics.recordCycle("NO_QUOTES", Duration.ofSeconds(1), 0, 5);

        assertEquals(1.0, sample("snapshot_cycles_total", "outcome", "SUCCESS"));
        assertEquals(1.0, sample("snapshot_cycles_total", "outcome", "PARTIAL"));
        assertEquals(6.0, registry.getSampleValue("snapshot_batch_failures_total"));
        assertEquals(3900.0, registry.getSampleValue("snapshot_quotes"),
            "Gauge follows the last published cycle");

        Map<String, Object> summary = metrics.getSummary();
        assertEquals(3L, summary.get("cycles"));
        assertEquals(1L, summary.get("failed_cycles"));
    }

    @Test
    void testVendorAndRateLimitMetrics() {
        metrics.recordVendorRequest(true, Duration.ofMillis(120));
        metrics.recordVendorRequest(false, Duration.ofMillis(20000));
        metrics.recordRateLimitWait(Duration.ofSeconds(12));
        metrics.updateRateLimit(60);

        assertEquals(1.0, sample("vendor_requests_total", "status", "success"));
        assertEquals(1.0, sample("vendor_requests_total", "status", "failure"));
        assertEquals(1.0, registry.getSampleValue("rate_limit_waits_total"));
        assertEquals(60.0, registry.getSampleValue("rate_limit_max_requests"));
        assertEquals(1L, metrics.getSummary().get("vendor_failures"));
    }

    @Test
    void testSymbolRefreshMetrics() {
        metrics.recordSymbolRefresh(true, Duration.ofSeconds(4), 4200);
        metrics.recordSymbolRefresh(false, Duration.ofSeconds(30), 4200);

        assertEquals(1.0, sample("symbol_refresh_total", "status", "success"));
        assertEquals(1.0, sample("symbol_refresh_total", "status", "failure"));
        assertEquals(4200.0, registry.getSampleValue("symbol_universe_size"));
    }

    private Double sample(String name, String label, String value) {
        return registry.getSampleValue(name, new String[]{label}, new String[]{value});
    }
}
