package in.optionsnap.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record LastUpdateMeta(
    @JsonProperty("last_update") Instant lastUpdate,
    @JsonProperty("count") int count
) {
}
