package com.portfoliotracker.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Portfolio-level summary over successful holdings only. Recomputed on every aggregation.
 */
public record PortfolioMetrics(
    @JsonProperty("totalValue") double totalValue,
    @JsonProperty("assetCount") int assetCount,
    @JsonProperty("averageValue") double averageValue,
    @JsonProperty("highestValueAsset") String highestValueAsset,
    @JsonProperty("lowestValueAsset") String lowestValueAsset,
    @JsonProperty("mostSharesAsset") String mostSharesAsset,
    @JsonProperty("fewestSharesAsset") String fewestSharesAsset,
    @JsonProperty("highestPriceAsset") String highestPriceAsset,
    @JsonProperty("lowestPriceAsset") String lowestPriceAsset,
    @JsonProperty("sectorCount") int sectorCount,
    @JsonProperty("dominantSector") String dominantSector,
    @JsonProperty("dominantSectorValue") double dominantSectorValue,
    @JsonProperty("sectorAllocation") Map<String, Double> sectorAllocation
) {
    public static final String NOT_AVAILABLE = "N/A";

    public static PortfolioMetrics empty() {
        return new PortfolioMetrics(0.0, 0, 0.0,
            NOT_AVAILABLE, NOT_AVAILABLE, NOT_AVAILABLE, NOT_AVAILABLE, NOT_AVAILABLE, NOT_AVAILABLE,
            0, NOT_AVAILABLE, 0.0, Map.of());
    }

    /**
     * Label/value view in the order the metrics table displays them.
     */
    public Map<String, String> asDisplayTable() {
        Map<String, String> table = new LinkedHashMap<>();
        table.put("Total Portfolio Value", money(totalValue));
        table.put("Number of Assets", String.valueOf(assetCount));
        table.put("Average Asset Value", money(averageValue));
        table.put("Highest Value Asset", highestValueAsset);
        table.put("Lowest Value Asset", lowestValueAsset);
        table.put("Most Shares Held", mostSharesAsset);
        table.put("Fewest Shares Held", fewestSharesAsset);
        table.put("Highest Price Asset", highestPriceAsset);
        table.put("Lowest Price Asset", lowestPriceAsset);
        table.put("Number of Sectors", String.valueOf(sectorCount));
        table.put("Dominant Sector", dominantSector);
        return table;
    }

    private static String money(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
