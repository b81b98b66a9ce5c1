package in.optionsnap.domain.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable quote snapshot produced by one refresh cycle.
 *
 * Invariant: {@code count() == results().size() == bySymbol().size()} and the
 * keys of {@code bySymbol} are exactly the symbols in {@code results}.
 */
public record Snapshot(
    Instant lastUpdate,
    List<QuoteRecord> results,
    Map<String, QuoteRecord> bySymbol
) {
    public static final Snapshot EMPTY = new Snapshot(null, List.of(), Map.of());

    /**
     * Builds a snapshot from aggregated records. A symbol seen more than once
     * keeps its first position and its last record.
     */
    public static Snapshot of(List<QuoteRecord> records, Instant lastUpdate) {
        Map<String, QuoteRecord> index = new LinkedHashMap<>();
        for (QuoteRecord record : records) {
            index.put(record.symbol(), record);
        }
        List<QuoteRecord> results = new ArrayList<>(index.values());
        return new Snapshot(
            lastUpdate,
            Collections.unmodifiableList(results),
            Collections.unmodifiableMap(index)
        );
    }

    public int count() {
        return results.size();
    }

    public boolean isEmpty() {
        return results.isEmpty();
    }
}
