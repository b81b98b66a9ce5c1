package in.optionsnap.service.snapshot;

import in.optionsnap.domain.model.LastUpdateMeta;
import in.optionsnap.domain.model.QuoteRecord;
import in.optionsnap.domain.model.Snapshot;
import in.optionsnap.domain.model.SnapshotView;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the current quote snapshot. Readers never block and always see one
 * complete snapshot.
 */
public class QuoteSnapshotStore {

    private final AtomicReference<Snapshot> current = new AtomicReference<>(Snapshot.EMPTY);

    /**
     * Replace the snapshot with one built from {@code records}.
     */
    public Snapshot publish(List<QuoteRecord> records, Instant at) {
        Snapshot next = Snapshot.of(records, at);
        current.set(next);
        return next;
    }

    public Snapshot current() {
        return current.get();
    }

    /**
     * Whole snapshot when {@code symbols} is null or empty; otherwise the
     * requested symbols in request order, unknown ones left out.
     */
    public SnapshotView getSnapshot(Collection<String> symbols) {
        Snapshot snapshot = current.get();
        if (symbols == null || symbols.isEmpty()) {
            return new SnapshotView(snapshot.lastUpdate(), snapshot.count(), snapshot.results());
        }

        List<QuoteRecord> filtered = new ArrayList<>();
        for (String symbol : symbols) {
            if (symbol == null) {
                continue;
            }
            QuoteRecord record = snapshot.bySymbol().get(symbol.trim().toUpperCase(Locale.ROOT));
            if (record != null) {
                filtered.add(record);
            }
        }
        return new SnapshotView(snapshot.lastUpdate(), filtered.size(), List.copyOf(filtered));
    }

    public LastUpdateMeta getLastUpdateMeta() {
        Snapshot snapshot = current.get();
        return new LastUpdateMeta(snapshot.lastUpdate(), snapshot.count());
    }
}
