package in.optionsnap.infrastructure.metrics;

import java.time.Duration;
import java.util.Map;

/**
 * Metrics for the quote snapshot pipeline.
 *
 * Implementations can publish to Prometheus, CloudWatch, etc.
 *
 * Key metrics:
 * - Refresh cycle outcomes and duration
 * - Failed batches per cycle
 * - Vendor request success/failure and latency
 * - Rate limiter waits and the adopted quota
 * - Symbol universe refreshes and size
 */
public interface SnapshotMetrics {

    /**
     * Record a finished refresh cycle.
     *
     * @param outcome Cycle outcome (SUCCESS, PARTIAL, NO_QUOTES, EMPTY_UNIVERSE, ERROR)
     * @param duration Cycle wall-clock time
     * @param quoteCount Quotes aggregated in the cycle
     * @param failedBatches Batches that contributed nothing
     */
    void recordCycle(String outcome, Duration duration, int quoteCount, int failedBatches);

    /**
     * Record one vendor quotes call.
     *
     * @param success Whether the call returned a usable payload
     * @param latency Time from request to response (or failure)
     */
    void recordVendorRequest(boolean success, Duration latency);

    /**
     * Record that the rate limiter had to hold a caller back.
     *
     * @param wait Time the caller will be suspended
     */
    void recordRateLimitWait(Duration wait);

    /**
     * Record the quota the rate limiter is currently enforcing.
     */
    void updateRateLimit(int maxRequests);

    /**
     * Record a symbol universe refresh.
     *
     * @param success Whether the stored universe was replaced
     * @param duration Download plus parse time
     * @param symbolCount Symbols held after the refresh
     */
    void recordSymbolRefresh(boolean success, Duration duration, int symbolCount);

    /**
     * Aggregated counters for diagnostics endpoints.
     */
    Map<String, Object> getSummary();
}
