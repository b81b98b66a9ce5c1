package in.optionsnap.service.snapshot;

import in.optionsnap.domain.model.LastUpdateMeta;
import in.optionsnap.domain.model.QuoteRecord;
import in.optionsnap.domain.model.SnapshotView;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class QuoteSnapshotStoreTest {

    private static final Instant AT = Instant.parse("2024-03-01T15:00:00Z");

    private QuoteSnapshotStore store;

    @BeforeEach
    void setUp() {
        store = new QuoteSnapshotStore();
        store.publish(List.of(
            QuoteRecord.core("AAPL", "Apple Inc", 180.5, 180.4, 180.6, 1_000_000),
            QuoteRecord.core("MSFT", "Microsoft Corp", 410.0, 409.9, 410.1, 500_000),
            QuoteRecord.core("SPY", "SPDR S&P 500", 510.2, 510.1, 510.3, 9_000_000)
        ), AT);
    }

    @Test
    void testInitialSnapshotIsEmpty() {
        SnapshotView view = new QuoteSnapshotStore().getSnapshot(null);

        assertNull(view.lastUpdate());
        assertEquals(0, view.count());
        assertTrue(view.results().isEmpty());
    }

    @Test
    void testUnfilteredReturnsEverything() {
        SnapshotView view = store.getSnapshot(null);

        assertEquals(3, view.count());
        assertEquals(3, view.results().size());
        assertEquals(AT, view.lastUpdate());
        assertEquals(view, store.getSnapshot(List.of()), "Empty filter behaves like no filter");
    }

    @Test
    void testFilterReturnsOnlyRequestedSymbol() {
        SnapshotView view = store.getSnapshot(List.of("AAPL"));

        assertEquals(1, view.count());
        assertEquals("AAPL", view.results().get(0).symbol());
        assertEquals(AT, view.lastUpdate());
    }

    @Test
    void testFilterIsCaseInsensitiveAndKeepsRequestOrder() {
        SnapshotView view = store.getSnapshot(List.of("spy", "aapl"));

        assertEquals(2, view.count());
        assertEquals("SPY", view.results().get(0).symbol());
        assertEquals("AAPL", view.results().get(1).symbol());
    }

    @Test
    void testUnknownSymbolsAreExcluded() {
        SnapshotView view = store.getSnapshot(Arrays.asList("ZZZZ", null));

        assertEquals(0, view.count());
        assertTrue(view.results().isEmpty());
        assertEquals(AT, view.lastUpdate(), "Timestamp still reported");
    }

    @Test
    void testLastUpdateMeta() {
        LastUpdateMeta meta = store.getLastUpdateMeta();

        assertEquals(AT, meta.lastUpdate());
        assertEquals(3, meta.count());
    }

    @Test
    void testPublishReplacesWholesale() {
        Instant later = AT.plusSeconds(61);
        store.publish(List.of(QuoteRecord.core("QQQ", "Invesco QQQ", 440.0, 439.9, 440.1, 2_000_000)), later);

        assertEquals(1, store.getSnapshot(null).count());
        assertEquals(0, store.getSnapshot(List.of("AAPL")).count(), "Previous quotes gone");
        assertEquals(later, store.getLastUpdateMeta().lastUpdate());
    }
}
