package com.portfoliotracker.marketdata.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.portfoliotracker.common.model.DailyBar;

import java.time.LocalDate;
import java.util.Map;

/**
 * {@code TIME_SERIES_DAILY} body as Alpha Vantage returns it: bars keyed by ISO date,
 * every number as a string. Meta data is ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AlphaVantageTimeSeriesResponse(
    @JsonProperty("Time Series (Daily)") Map<String, DailyOhlcv> timeSeriesDaily
) {
    public static final String DAILY_SERIES_FIELD = "Time Series (Daily)";

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DailyOhlcv(
        @JsonProperty("1. open") String open,
        @JsonProperty("2. high") String high,
        @JsonProperty("3. low") String low,
        @JsonProperty("4. close") String close,
        @JsonProperty("5. volume") String volume
    ) {
        /** Converts the string fields; throws {@link NumberFormatException} on a non-numeric value. */
        public DailyBar toBar(LocalDate date) {
            return new DailyBar(date, Double.parseDouble(open), Double.parseDouble(high),
                Double.parseDouble(low), Double.parseDouble(close), Long.parseLong(volume));
        }
    }
}
