package in.optionsnap.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Prometheus implementation of SnapshotMetrics.
 *
 * Key Metrics:
 * - snapshot_cycles_total{outcome} - Refresh cycles by outcome
 * - snapshot_cycle_duration_seconds - Cycle duration distribution
 * - snapshot_quotes - Quotes aggregated by the latest cycle
 * - snapshot_batch_failures_total - Batches that failed inside cycles
 * - vendor_requests_total{status} - Vendor call success/failure
 * - vendor_request_latency_seconds - Vendor call latency
 * - rate_limit_waits_total / rate_limit_max_requests - Throttling
 * - symbol_refresh_total{status}, symbol_refresh_duration_seconds, symbol_universe_size
 *
 * Metrics are exposed at /metrics via {@link PrometheusMetricsHandler}.
 */
public class PrometheusSnapshotMetrics implements SnapshotMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusSnapshotMetrics.class);

    private final CollectorRegistry registry;

    // Cycle metrics
    private final Counter cycleCounter;
    private final Histogram cycleDuration;
    private final Gauge quoteCount;
    private final Counter batchFailureCounter;

    // Vendor metrics
    private final Counter vendorRequestCounter;
    private final Histogram vendorLatency;

    // Rate limit metrics
    private final Counter rateLimitWaitCounter;
    private final Histogram rateLimitWaitDuration;
    private final Gauge rateLimitMax;

    // Symbol universe metrics
    private final Counter symbolRefreshCounter;
    private final Histogram symbolRefreshDuration;
    private final Gauge universeSize;

    // In-memory totals for the status endpoint
    private final AtomicLong cycles = new AtomicLong();
    private final AtomicLong failedCycles = new AtomicLong();
    private final AtomicLong vendorFailures = new AtomicLong();
    private final AtomicLong rateLimitWaits = new AtomicLong();

    public PrometheusSnapshotMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusSnapshotMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.cycleCounter = Counter.build()
            .name("snapshot_cycles_total")
            .help("Total number of snapshot refresh cycles")
            .labelNames("outcome")
            .register(registry);

        this.cycleDuration = Histogram.build()
            .name("snapshot_cycle_duration_seconds")
            .help("Snapshot refresh cycle duration in seconds")
            .buckets(0.5, 1, 2, 5, 10, 30, 60, 120)
            .register(registry);

        this.quoteCount = Gauge.build()
            .name("snapshot_quotes")
            .help("Quotes in the published snapshot")
            .register(registry);

        this.batchFailureCounter = Counter.build()
            .name("snapshot_batch_failures_total")
            .help("Total number of failed quote batches")
            .register(registry);

        this.vendorRequestCounter = Counter.build()
            .name("vendor_requests_total")
            .help("Total number of vendor quote requests")
            .labelNames("status")
            .register(registry);

        this.vendorLatency = Histogram.build()
            .name("vendor_request_latency_seconds")
            .help("Vendor quote request latency in seconds")
            .buckets(0.05, 0.1, 0.25, 0.5, 1.0, 2.0, 5.0, 10.0, 20.0)
            .register(registry);

        this.rateLimitWaitCounter = Counter.build()
            .name("rate_limit_waits_total")
            .help("Total number of requests held back by the rate limiter")
            .register(registry);

        this.rateLimitWaitDuration = Histogram.build()
            .name("rate_limit_wait_seconds")
            .help("Time requests spent waiting on the rate limiter")
            .buckets(0.1, 1, 5, 15, 30, 60)
            .register(registry);

        this.rateLimitMax = Gauge.build()
            .name("rate_limit_max_requests")
            .help("Requests per window currently enforced")
            .register(registry);

        this.symbolRefreshCounter = Counter.build()
            .name("symbol_refresh_total")
            .help("Total number of symbol universe refreshes")
            .labelNames("status")
            .register(registry);

        this.symbolRefreshDuration = Histogram.build()
            .name("symbol_refresh_duration_seconds")
            .help("Symbol universe refresh duration in seconds")
            .buckets(1, 5, 10, 30, 60)
            .register(registry);

        this.universeSize = Gauge.build()
            .name("symbol_universe_size")
            .help("Number of symbols in the current universe")
            .register(registry);

        log.info("[PrometheusSnapshotMetrics] Initialized");
    }

    @Override
    public void recordCycle(String outcome, Duration duration, int quotes, int failedBatches) {
        cycleCounter.labels(outcome).inc();
        cycleDuration.observe(duration.toMillis() / 1000.0);
        if (failedBatches > 0) {
            batchFailureCounter.inc(failedBatches);
        }

        cycles.incrementAndGet();
        if ("SUCCESS".equals(outcome) || "PARTIAL".equals(outcome)) {
            // Only published cycles change what readers see
            quoteCount.set(quotes);
        } else {
            failedCycles.incrementAndGet();
        }
    }

    @Override
    public void recordVendorRequest(boolean success, Duration latency) {
        vendorRequestCounter.labels(success ? "success" : "failure").inc();
        vendorLatency.observe(latency.toMillis() / 1000.0);
        if (!success) {
            vendorFailures.incrementAndGet();
        }
    }

    @Override
    public void recordRateLimitWait(Duration wait) {
        rateLimitWaitCounter.inc();
        rateLimitWaitDuration.observe(wait.toMillis() / 1000.0);
        rateLimitWaits.incrementAndGet();
    }

    @Override
    public void updateRateLimit(int maxRequests) {
        rateLimitMax.set(maxRequests);
    }

    @Override
    public void recordSymbolRefresh(boolean success, Duration duration, int symbolCount) {
        symbolRefreshCounter.labels(success ? "success" : "failure").inc();
        symbolRefreshDuration.observe(duration.toMillis() / 1000.0);
        universeSize.set(symbolCount);

        log.debug("[PrometheusSnapshotMetrics] Recorded symbol refresh: success={}, symbols={}, {}ms",
            success, symbolCount, duration.toMillis());
    }

    @Override
    public Map<String, Object> getSummary() {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("cycles", cycles.get());
        summary.put("failed_cycles", failedCycles.get());
        summary.put("vendor_failures", vendorFailures.get());
        summary.put("rate_limit_waits", rateLimitWaits.get());
        return summary;
    }

    /**
     * Get Prometheus CollectorRegistry for /metrics endpoint.
     */
    public CollectorRegistry getRegistry() {
        return registry;
    }
}
