package in.optionsnap.service.symbols;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Keeps the symbol universe current.
 *
 * Features:
 * - Background load on startup (non-blocking)
 * - Daily refresh at a fixed local time (default 2 AM New York, before the open)
 * - Manual refresh on the same thread
 * - Load statistics
 *
 * Usage:
 * <pre>
 * SymbolRefreshScheduler scheduler = new SymbolRefreshScheduler(universe);
 * scheduler.setRefreshTime(LocalTime.of(2, 0));
 * scheduler.start();
 * </pre>
 */
public class SymbolRefreshScheduler {
    private static final Logger log = LoggerFactory.getLogger(SymbolRefreshScheduler.class);

    private final SymbolUniverse universe;

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "SymbolRefresh");
        t.setDaemon(true);
        return t;
    });

    // Configuration
    private LocalTime dailyRefreshTime = LocalTime.of(2, 0);
    private ZoneId timezone = ZoneId.of("America/New_York");
    private boolean enableDailyRefresh = true;

    // State
    private volatile boolean running = false;
    private ScheduledFuture<?> dailyRefreshTask;
    private CompletableFuture<SymbolUniverse.RefreshResult> initialLoadFuture;

    // Statistics
    private final AtomicInteger successCount = new AtomicInteger(0);
    private final AtomicInteger failureCount = new AtomicInteger(0);
    private volatile SymbolUniverse.RefreshResult lastResult;
    private volatile Instant lastRunTime;

    public SymbolRefreshScheduler(SymbolUniverse universe) {
        this.universe = universe;
    }

    /**
     * Trigger the initial load in the background and schedule the daily refresh.
     */
    public void start() {
        if (running) {
            log.warn("[SymbolRefresh] Already running");
            return;
        }

        log.info("[SymbolRefresh] Starting symbol refresh scheduler");
        running = true;

        initialLoadFuture = CompletableFuture.supplyAsync(() -> performRefresh("initial"), scheduler);

        if (enableDailyRefresh) {
            scheduleDailyRefresh();
        }
    }

    public void stop() {
        if (!running) {
            return;
        }

        log.info("[SymbolRefresh] Stopping symbol refresh scheduler");
        running = false;

        synchronized (this) {
            if (dailyRefreshTask != null) {
                dailyRefreshTask.cancel(false);
            }
        }

        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(10, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Wait for the startup load (blocking).
     *
     * @return true if the load finished and succeeded within the timeout
     */
    public boolean awaitInitialLoad(Duration timeout) {
        if (initialLoadFuture == null) {
            return false;
        }

        try {
            return initialLoadFuture.get(timeout.toMillis(), TimeUnit.MILLISECONDS).success();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (Exception e) {
            log.warn("[SymbolRefresh] Initial load not completed within timeout: {}", e.getMessage());
            return false;
        }
    }

    public boolean isInitialLoadComplete() {
        return initialLoadFuture != null && initialLoadFuture.isDone();
    }

    /**
     * Queue a refresh on the scheduler thread.
     */
    public CompletableFuture<SymbolUniverse.RefreshResult> triggerRefresh() {
        log.info("[SymbolRefresh] Manual refresh triggered");
        return CompletableFuture.supplyAsync(() -> performRefresh("manual"), scheduler);
    }

    private SymbolUniverse.RefreshResult performRefresh(String reason) {
        log.info("[SymbolRefresh] Running {} symbol refresh", reason);
        SymbolUniverse.RefreshResult result = universe.refresh(false);

        if (result.success()) {
            successCount.incrementAndGet();
        } else {
            failureCount.incrementAndGet();
        }
        lastResult = result;
        lastRunTime = Instant.now();
        return result;
    }

    private synchronized void scheduleDailyRefresh() {
        if (!running) {
            return;
        }
        Duration delay = delayUntilNext(ZonedDateTime.now(timezone), dailyRefreshTime);

        log.info("[SymbolRefresh] Scheduling daily refresh at {} {} (next refresh in {}h)",
            dailyRefreshTime, timezone, delay.toHours());

        try {
            dailyRefreshTask = scheduler.schedule(this::runDailyRefresh, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.info("[SymbolRefresh] Scheduler shut down, daily refresh not rescheduled");
        }
    }

    // One-shot per day, so each run recomputes the wall-clock delay across DST changes
    private void runDailyRefresh() {
        try {
            performRefresh("daily");
        } catch (RuntimeException e) {
            failureCount.incrementAndGet();
            log.error("[SymbolRefresh] Daily refresh failed: {}", e.getMessage(), e);
        } finally {
            scheduleDailyRefresh();
        }
    }

    /**
     * Time from {@code now} until the next occurrence of {@code at}, today if
     * it is still ahead, else tomorrow.
     */
    static Duration delayUntilNext(ZonedDateTime now, LocalTime at) {
        ZonedDateTime next = now.with(at);
        if (!next.isAfter(now)) {
            next = next.plusDays(1);
        }
        return Duration.between(now, next);
    }

    // ════════════════════════════════════════════════════════════════════════
    // CONFIGURATION
    // ════════════════════════════════════════════════════════════════════════

    public void setRefreshTime(LocalTime refreshTime) {
        this.dailyRefreshTime = refreshTime;
    }

    public void setTimezone(ZoneId timezone) {
        this.timezone = timezone;
    }

    public void setEnableDailyRefresh(boolean enable) {
        this.enableDailyRefresh = enable;
    }

    // ════════════════════════════════════════════════════════════════════════
    // STATISTICS
    // ════════════════════════════════════════════════════════════════════════

    public boolean isRunning() {
        return running;
    }

    public int getSuccessCount() {
        return successCount.get();
    }

    public int getFailureCount() {
        return failureCount.get();
    }

    public SymbolUniverse.RefreshResult getLastResult() {
        return lastResult;
    }

    public Instant getLastRunTime() {
        return lastRunTime;
    }

    /**
     * Time until the pending daily refresh, or null when none is scheduled.
     */
    synchronized Duration getNextDailyRefreshDelay() {
        if (dailyRefreshTask == null || dailyRefreshTask.isDone()) {
            return null;
        }
        return Duration.ofMillis(dailyRefreshTask.getDelay(TimeUnit.MILLISECONDS));
    }
}
