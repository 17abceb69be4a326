package com.portfoliotracker.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One (symbol, share count) pair as entered by the user. Values are raw input.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PositionRequest(
    @JsonProperty("symbol") String symbol,
    @JsonProperty("shares") Integer shares
) {
    public static PositionRequest of(String symbol, Integer shares) {
        return new PositionRequest(symbol, shares);
    }

    /** True when both symbol and share count are present and usable. */
    public boolean isActionable() {
        return symbol != null && !symbol.isBlank() && shares != null && shares > 0;
    }
}
