package in.optionsnap.service.snapshot;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of one snapshot refresh cycle.
 */
public record CycleResult(
    @JsonProperty("outcome") Outcome outcome,
    @JsonProperty("symbols_requested") int symbolsRequested,
    @JsonProperty("batches") int batches,
    @JsonProperty("failed_batches") int failedBatches,
    @JsonProperty("quotes") int quotes,
    @JsonProperty("duration_ms") long durationMs,
    @JsonProperty("finished_at") Instant finishedAt,
    @JsonProperty("error") String error
) {
    public enum Outcome {
        /** Published, every batch answered. */
        SUCCESS,
        /** Published, some batches failed. */
        PARTIAL,
        /** Every batch failed or returned nothing; snapshot kept. */
        NO_QUOTES,
        /** No symbols to request; snapshot kept. */
        EMPTY_UNIVERSE,
        /** Unexpected failure; snapshot kept. */
        ERROR
    }

    public static CycleResult emptyUniverse(Duration duration, Instant finishedAt) {
        return new CycleResult(Outcome.EMPTY_UNIVERSE, 0, 0, 0, 0, duration.toMillis(), finishedAt, null);
    }

    public static CycleResult error(int symbolsRequested, Duration duration, Instant finishedAt, String error) {
        return new CycleResult(Outcome.ERROR, symbolsRequested, 0, 0, 0, duration.toMillis(), finishedAt, error);
    }

    /**
     * True when the cycle published a new snapshot.
     */
    @JsonProperty("success")
    public boolean success() {
        return outcome == Outcome.SUCCESS || outcome == Outcome.PARTIAL;
    }

    public Duration duration() {
        return Duration.ofMillis(durationMs);
    }
}
