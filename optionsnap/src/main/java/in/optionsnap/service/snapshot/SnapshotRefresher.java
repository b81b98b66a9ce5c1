package in.optionsnap.service.snapshot;

import com.fasterxml.jackson.annotation.JsonProperty;
import in.optionsnap.domain.model.QuoteRecord;
import in.optionsnap.domain.model.Snapshot;
import in.optionsnap.infrastructure.metrics.SnapshotMetrics;
import in.optionsnap.infrastructure.vendor.QuoteVendor;
import in.optionsnap.service.symbols.SymbolUniverse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Periodically rebuilds the quote snapshot from the symbol universe.
 *
 * One cycle:
 * 1. Read the current symbols (abort when there are none)
 * 2. Partition into batches of at most {@code batchSize}
 * 3. Fetch batches on a pool of {@code maxConcurrency} threads, each call
 *    passing through the vendor's rate limiter
 * 4. Aggregate in batch order, skipping failed batches
 * 5. Publish when at least one quote came back, else keep the old snapshot
 *
 * Cycles never overlap. A failing cycle never stops the loop.
 */
public class SnapshotRefresher {
    private static final Logger log = LoggerFactory.getLogger(SnapshotRefresher.class);

    private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

    private final SymbolUniverse universe;
    private final QuoteVendor vendor;
    private final QuoteSnapshotStore store;
    private final SnapshotMetrics metrics;
    private final Clock clock;

    private final int batchSize;
    private final int maxConcurrency;
    private final Duration refreshInterval;
    private final Duration startDelay;

    private final ReentrantLock cycleLock = new ReentrantLock();

    // Background task state, guarded by this
    private ScheduledExecutorService scheduler;
    private ExecutorService batchPool;
    private ScheduledFuture<?> task;
    private volatile boolean running = false;
    private volatile Instant startedAt;

    // Statistics
    private final AtomicInteger cyclesCompleted = new AtomicInteger(0);
    private final AtomicInteger cyclesFailed = new AtomicInteger(0);
    private volatile CycleResult lastCycle;

    public SnapshotRefresher(
        SymbolUniverse universe,
        QuoteVendor vendor,
        QuoteSnapshotStore store,
        SnapshotMetrics metrics,
        int batchSize,
        int maxConcurrency,
        Duration refreshInterval,
        Duration startDelay
    ) {
        this(universe, vendor, store, metrics, batchSize, maxConcurrency, refreshInterval, startDelay,
            Clock.systemUTC());
    }

    public SnapshotRefresher(
        SymbolUniverse universe,
        QuoteVendor vendor,
        QuoteSnapshotStore store,
        SnapshotMetrics metrics,
        int batchSize,
        int maxConcurrency,
        Duration refreshInterval,
        Duration startDelay,
        Clock clock
    ) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        if (maxConcurrency <= 0) {
            throw new IllegalArgumentException("maxConcurrency must be positive");
        }
        if (refreshInterval.isNegative() || refreshInterval.isZero()) {
            throw new IllegalArgumentException("refreshInterval must be positive");
        }
        this.universe = universe;
        this.vendor = vendor;
        this.store = store;
        this.metrics = metrics;
        this.batchSize = batchSize;
        this.maxConcurrency = maxConcurrency;
        this.refreshInterval = refreshInterval;
        this.startDelay = startDelay.isNegative() ? Duration.ZERO : startDelay;
        this.clock = clock;
    }

    // ════════════════════════════════════════════════════════════════════════
    // BACKGROUND TASK
    // ════════════════════════════════════════════════════════════════════════

    /**
     * Run the first cycle after the start delay, then one every refresh interval.
     */
    public synchronized void startBackgroundTask() {
        if (running) {
            log.warn("[SnapshotRefresher] Background task already running");
            return;
        }

        scheduler = Executors.newSingleThreadScheduledExecutor(daemonFactory("SnapshotRefresher"));
        batchPool = newBatchPool();
        ExecutorService pool = batchPool;

        task = scheduler.scheduleWithFixedDelay(
            () -> runScheduledCycle(pool),
            startDelay.toMillis(),
            refreshInterval.toMillis(),
            TimeUnit.MILLISECONDS
        );
        running = true;
        startedAt = clock.instant();

        log.info("[SnapshotRefresher] Background task started (interval {}s, batch size {}, concurrency {})",
            refreshInterval.toSeconds(), batchSize, maxConcurrency);
    }

    /**
     * Cancel the loop, interrupting a cycle in flight.
     */
    public synchronized void stopBackgroundTask() {
        if (!running) {
            return;
        }

        log.info("[SnapshotRefresher] Stopping background task");
        running = false;

        task.cancel(true);
        scheduler.shutdownNow();
        batchPool.shutdownNow();
        try {
            if (!scheduler.awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("[SnapshotRefresher] Refresh thread did not stop within {}s", SHUTDOWN_TIMEOUT.toSeconds());
            }
            if (!batchPool.awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("[SnapshotRefresher] Batch pool did not stop within {}s", SHUTDOWN_TIMEOUT.toSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        task = null;
        scheduler = null;
        batchPool = null;
        log.info("[SnapshotRefresher] Background task stopped");
    }

    public TaskStatus getBackgroundTaskStatus() {
        return new TaskStatus(
            running,
            running ? startedAt : null,
            cyclesCompleted.get(),
            cyclesFailed.get(),
            lastCycle,
            refreshInterval.toSeconds(),
            batchSize,
            maxConcurrency
        );
    }

    public boolean isRunning() {
        return running;
    }

    // ════════════════════════════════════════════════════════════════════════
    // CYCLE
    // ════════════════════════════════════════════════════════════════════════

    /**
     * Run one cycle on the calling thread and wait for it.
     */
    public CycleResult refreshNow() {
        ExecutorService pool = newBatchPool();
        try {
            return runCycle(pool);
        } finally {
            pool.shutdownNow();
        }
    }

    // An exception escaping a fixed-delay task cancels every later run
    private void runScheduledCycle(ExecutorService pool) {
        try {
            runCycle(pool);
        } catch (RuntimeException e) {
            log.error("[SnapshotRefresher] Scheduled cycle failed: {}", e.getMessage(), e);
        }
    }

    private CycleResult runCycle(ExecutorService pool) {
        cycleLock.lock();
        try {
            CycleResult result = executeCycle(pool);
            cyclesCompleted.incrementAndGet();
            if (!result.success()) {
                cyclesFailed.incrementAndGet();
            }
            lastCycle = result;
            if (metrics != null) {
                try {
                    metrics.recordCycle(result.outcome().name(), result.duration(), result.quotes(), result.failedBatches());
                } catch (RuntimeException e) {
                    log.error("[SnapshotRefresher] Failed to record cycle metrics: {}", e.getMessage(), e);
                }
            }
            return result;
        } finally {
            cycleLock.unlock();
        }
    }

    private CycleResult executeCycle(ExecutorService pool) {
        long startTime = System.nanoTime();
        int symbolsRequested = 0;

        try {
            List<String> symbols = new ArrayList<>(universe.getSymbols());
            if (symbols.isEmpty()) {
                log.warn("[SnapshotRefresher] Symbol universe is empty, skipping cycle");
                return CycleResult.emptyUniverse(elapsedSince(startTime), clock.instant());
            }
            Collections.sort(symbols);
            symbolsRequested = symbols.size();

            List<List<String>> batches = Batches.partition(symbols, batchSize);
            log.debug("[SnapshotRefresher] Fetching {} symbols in {} batches", symbolsRequested, batches.size());

            List<Future<List<QuoteRecord>>> futures = new ArrayList<>(batches.size());
            for (List<String> batch : batches) {
                futures.add(pool.submit(() -> vendor.fetchQuotes(batch)));
            }

            List<QuoteRecord> aggregated = new ArrayList<>();
            int failedBatches = 0;
            try {
                for (int i = 0; i < futures.size(); i++) {
                    try {
                        List<QuoteRecord> records = futures.get(i).get();
                        if (records == null) {
                            failedBatches++;
                            log.warn("[SnapshotRefresher] Batch {}/{} ({} symbols) returned no result",
                                i + 1, batches.size(), batches.get(i).size());
                            continue;
                        }
                        for (QuoteRecord record : records) {
                            if (record == null) {
                                log.debug("[SnapshotRefresher] Skipping null quote in batch {}/{}", i + 1, batches.size());
                                continue;
                            }
                            aggregated.add(record.trimmed());
                        }
                    } catch (ExecutionException e) {
                        failedBatches++;
                        Throwable cause = e.getCause() != null ? e.getCause() : e;
                        log.warn("[SnapshotRefresher] Batch {}/{} ({} symbols) failed: {}",
                            i + 1, batches.size(), batches.get(i).size(), cause.getMessage());
                    } catch (CancellationException e) {
                        failedBatches++;
                        log.warn("[SnapshotRefresher] Batch {}/{} ({} symbols) was cancelled",
                            i + 1, batches.size(), batches.get(i).size());
                    } catch (RuntimeException e) {
                        failedBatches++;
                        log.warn("[SnapshotRefresher] Batch {}/{} ({} symbols) produced a bad result: {}",
                            i + 1, batches.size(), batches.get(i).size(), e.toString());
                    }
                }
            } catch (InterruptedException e) {
                futures.forEach(f -> f.cancel(true));
                throw e;
            }

            Duration duration = elapsedSince(startTime);
            Instant finishedAt = clock.instant();

            if (aggregated.isEmpty()) {
                log.warn("[SnapshotRefresher] No quotes returned ({} of {} batches failed), keeping snapshot of {} quotes",
                    failedBatches, batches.size(), store.current().count());
                return new CycleResult(CycleResult.Outcome.NO_QUOTES, symbolsRequested, batches.size(),
                    failedBatches, 0, duration.toMillis(), finishedAt, null);
            }

            Snapshot published = store.publish(aggregated, finishedAt);
            CycleResult.Outcome outcome = failedBatches == 0
                ? CycleResult.Outcome.SUCCESS
                : CycleResult.Outcome.PARTIAL;

            log.info("[SnapshotRefresher] Published {} quotes for {} symbols in {}ms ({}/{} batches failed)",
                published.count(), symbolsRequested, duration.toMillis(), failedBatches, batches.size());
            return new CycleResult(outcome, symbolsRequested, batches.size(), failedBatches,
                published.count(), duration.toMillis(), finishedAt, null);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("[SnapshotRefresher] Cycle interrupted");
            return CycleResult.error(symbolsRequested, elapsedSince(startTime), clock.instant(), "interrupted");
        } catch (Exception e) {
            log.error("[SnapshotRefresher] Refresh cycle failed: {}", e.getMessage(), e);
            return CycleResult.error(symbolsRequested, elapsedSince(startTime), clock.instant(), e.getMessage());
        }
    }

    private ExecutorService newBatchPool() {
        return Executors.newFixedThreadPool(maxConcurrency, daemonFactory("QuoteBatch"));
    }

    private static ThreadFactory daemonFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger(0);
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    /**
     * Background loop state for the status endpoint.
     */
    public record TaskStatus(
        @JsonProperty("running") boolean running,
        @JsonProperty("started_at") Instant startedAt,
        @JsonProperty("cycles_completed") int cyclesCompleted,
        @JsonProperty("cycles_failed") int cyclesFailed,
        @JsonProperty("last_cycle") CycleResult lastCycle,
        @JsonProperty("refresh_interval_seconds") long refreshIntervalSeconds,
        @JsonProperty("batch_size") int batchSize,
        @JsonProperty("max_concurrency") int maxConcurrency
    ) {
    }
}
