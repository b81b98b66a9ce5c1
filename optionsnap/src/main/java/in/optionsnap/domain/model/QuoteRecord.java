package in.optionsnap.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Normalized quote for one underlying.
 *
 * The six core fields are never null: numbers default to zero and text to the
 * empty string when the vendor omits them. The vendor-only fields
 * (exchange, tradeTime, change, changePercent) are null once the record has
 * been trimmed for the snapshot.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QuoteRecord(
    @JsonProperty("symbol") String symbol,
    @JsonProperty("description") String description,
    @JsonProperty("last") double last,
    @JsonProperty("bid") double bid,
    @JsonProperty("ask") double ask,
    @JsonProperty("volume") long volume,
    @JsonProperty("exchange") String exchange,
    @JsonProperty("trade_time") Instant tradeTime,
    @JsonProperty("change") Double change,
    @JsonProperty("change_percent") Double changePercent
) {
    public QuoteRecord {
        symbol = symbol == null ? "" : symbol;
        description = description == null ? "" : description;
    }

    /**
     * Core-fields-only record, as stored in the snapshot.
     */
    public static QuoteRecord core(String symbol, String description, double last, double bid, double ask, long volume) {
        return new QuoteRecord(symbol, description, last, bid, ask, volume, null, null, null, null);
    }

    public QuoteRecord trimmed() {
        if (exchange == null && tradeTime == null && change == null && changePercent == null) {
            return this;
        }
        return core(symbol, description, last, bid, ask, volume);
    }
}
