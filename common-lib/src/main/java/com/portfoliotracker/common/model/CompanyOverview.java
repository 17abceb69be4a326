package com.portfoliotracker.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.Set;

/**
 * Normalized company/instrument attributes for one symbol.
 *
 * <p>Never partially null: text attributes that the provider left out are reported as
 * {@link #UNKNOWN}, numeric attributes as {@link #NOT_AVAILABLE}, and a missing name
 * falls back to the symbol itself.
 */
public record CompanyOverview(
    @JsonProperty("name") String name,
    @JsonProperty("assetType") String assetType,
    @JsonProperty("sector") String sector,
    @JsonProperty("industry") String industry,
    @JsonProperty("exchange") String exchange,
    @JsonProperty("currency") String currency,
    @JsonProperty("country") String country,
    @JsonProperty("marketCapitalization") String marketCapitalization,
    @JsonProperty("peRatio") String peRatio,
    @JsonProperty("beta") String beta,
    @JsonProperty("dividendYield") String dividendYield,
    @JsonProperty("week52High") String week52High,
    @JsonProperty("week52Low") String week52Low,
    @JsonProperty("movingAverage50Day") String movingAverage50Day,
    @JsonProperty("movingAverage200Day") String movingAverage200Day
) {
    public static final String UNKNOWN = "Unknown";
    public static final String NOT_AVAILABLE = "N/A";

    // Placeholders the provider uses in place of a real value.
    private static final Set<String> ABSENT_MARKERS = Set.of("", "None", "-", "null");

    /**
     * Builds an overview from the provider's flat attribute map, keyed by provider field names
     * ({@code Name}, {@code AssetType}, {@code Sector}, ...).
     */
    public static CompanyOverview from(Symbol symbol, Map<String, String> attributes) {
        return new CompanyOverview(
            text(attributes, "Name", symbol.value()),
            text(attributes, "AssetType", UNKNOWN),
            text(attributes, "Sector", UNKNOWN),
            text(attributes, "Industry", UNKNOWN),
            text(attributes, "Exchange", UNKNOWN),
            text(attributes, "Currency", UNKNOWN),
            text(attributes, "Country", UNKNOWN),
            text(attributes, "MarketCapitalization", NOT_AVAILABLE),
            text(attributes, "PERatio", NOT_AVAILABLE),
            text(attributes, "Beta", NOT_AVAILABLE),
            text(attributes, "DividendYield", NOT_AVAILABLE),
            text(attributes, "52WeekHigh", NOT_AVAILABLE),
            text(attributes, "52WeekLow", NOT_AVAILABLE),
            text(attributes, "50DayMovingAverage", NOT_AVAILABLE),
            text(attributes, "200DayMovingAverage", NOT_AVAILABLE)
        );
    }

    /** Overview with every attribute set to its sentinel. */
    public static CompanyOverview unknown(Symbol symbol) {
        return from(symbol, Map.of());
    }

    private static String text(Map<String, String> attributes, String key, String fallback) {
        String value = attributes.get(key);
        if (value == null) return fallback;
        String trimmed = value.trim();
        return ABSENT_MARKERS.contains(trimmed) ? fallback : trimmed;
    }
}
