package in.optionsnap.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Read-side projection of the snapshot, optionally filtered by symbol.
 */
public record SnapshotView(
    @JsonProperty("last_update") Instant lastUpdate,
    @JsonProperty("count") int count,
    @JsonProperty("results") List<QuoteRecord> results
) {
}
