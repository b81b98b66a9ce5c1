package in.optionsnap.service.symbols;

import in.optionsnap.infrastructure.feed.OccSymbolFeed;
import in.optionsnap.infrastructure.feed.OccSymbolParser;
import in.optionsnap.infrastructure.metrics.SnapshotMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Current set of optionable underlyings.
 *
 * Readers see either the empty startup state or the complete result of one
 * successful refresh. A failed refresh keeps whatever was there before.
 */
public class SymbolUniverse {
    private static final Logger log = LoggerFactory.getLogger(SymbolUniverse.class);

    private final OccSymbolFeed feed;
    private final SnapshotMetrics metrics;
    private final Clock clock;

    private final ReentrantLock refreshLock = new ReentrantLock();
    private volatile UniverseState state = UniverseState.EMPTY;

    public SymbolUniverse(OccSymbolFeed feed, SnapshotMetrics metrics) {
        this(feed, metrics, Clock.systemUTC());
    }

    public SymbolUniverse(OccSymbolFeed feed, SnapshotMetrics metrics, Clock clock) {
        this.feed = feed;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Download and parse the feed without touching the current state.
     */
    public OccSymbolParser.ParseResult fetchAndParse() throws InterruptedException {
        String text = feed.download();
        OccSymbolParser.ParseResult result = OccSymbolParser.parse(text);
        log.info("[SymbolUniverse] Parsed {} unique symbols from {} lines ({} skipped)",
            result.symbols().size(), result.lines(), result.skipped());
        return result;
    }

    /**
     * Replace the universe with a fresh download.
     *
     * Refreshes are serialized. On failure the previous symbols and timestamp
     * are kept.
     *
     * @param raiseOnError rethrow the failure instead of only logging it
     * @return what happened
     */
    public RefreshResult refresh(boolean raiseOnError) {
        refreshLock.lock();
        try {
            return doRefresh(raiseOnError);
        } finally {
            refreshLock.unlock();
        }
    }

    private RefreshResult doRefresh(boolean raiseOnError) {
        long startTime = System.nanoTime();
        try {
            OccSymbolParser.ParseResult parsed = fetchAndParse();
            if (parsed.symbols().isEmpty()) {
                throw new EmptyUniverseException(parsed.lines());
            }

            UniverseState next = new UniverseState(parsed.symbols(), clock.instant());
            int previousCount = state.symbols().size();
            state = next;

            Duration elapsed = Duration.ofNanos(System.nanoTime() - startTime);
            if (metrics != null) {
                metrics.recordSymbolRefresh(true, elapsed, next.symbols().size());
            }
            log.info("[SymbolUniverse] Symbols refreshed: {} unique symbols stored (was {}) in {}ms",
                next.symbols().size(), previousCount, elapsed.toMillis());
            return RefreshResult.success(next.symbols().size(), next.lastUpdate(), elapsed);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failed(e, startTime, raiseOnError);
        } catch (RuntimeException e) {
            return failed(e, startTime, raiseOnError);
        }
    }

    private RefreshResult failed(Exception e, long startTime, boolean raiseOnError) {
        Duration elapsed = Duration.ofNanos(System.nanoTime() - startTime);
        UniverseState current = state;

        log.error("[SymbolUniverse] Failed to refresh symbols, keeping {} existing: {}",
            current.symbols().size(), e.getMessage(), e);
        if (metrics != null) {
            metrics.recordSymbolRefresh(false, elapsed, current.symbols().size());
        }

        if (raiseOnError) {
            if (e instanceof RuntimeException) {
                throw (RuntimeException) e;
            }
            throw new IllegalStateException("Symbol refresh interrupted", e);
        }
        return RefreshResult.failure(current.symbols().size(), current.lastUpdate(), elapsed, e.getMessage());
    }

    /**
     * Immutable view of the current symbols, sorted.
     */
    public Set<String> getSymbols() {
        return state.symbols();
    }

    public int getSymbolCount() {
        return state.symbols().size();
    }

    /**
     * Time of the last successful refresh, or null before the first one.
     */
    public Instant getLastUpdate() {
        return state.lastUpdate();
    }

    public boolean isSymbolAvailable(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            return false;
        }
        return state.symbols().contains(symbol.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * Symbols and timestamp published together.
     */
    record UniverseState(Set<String> symbols, Instant lastUpdate) {
        static final UniverseState EMPTY = new UniverseState(Set.of(), null);
    }

    /**
     * Outcome of one refresh. On failure {@code symbolCount} and
     * {@code lastUpdate} describe the retained state.
     */
    public record RefreshResult(
        boolean success,
        int symbolCount,
        Instant lastUpdate,
        Duration duration,
        String error
    ) {
        static RefreshResult success(int symbolCount, Instant lastUpdate, Duration duration) {
            return new RefreshResult(true, symbolCount, lastUpdate, duration, null);
        }

        static RefreshResult failure(int symbolCount, Instant lastUpdate, Duration duration, String error) {
            return new RefreshResult(false, symbolCount, lastUpdate, duration, error);
        }
    }
}
