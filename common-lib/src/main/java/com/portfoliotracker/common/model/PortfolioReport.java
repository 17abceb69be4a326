package com.portfoliotracker.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Comparator;
import java.util.List;

/**
 * Result of one aggregation pass: rows in input order plus metrics over the successful ones.
 */
public record PortfolioReport(
    @JsonProperty("rows") List<PortfolioRow> rows,
    @JsonProperty("metrics") PortfolioMetrics metrics
) {
    /**
     * Display ordering: holdings by total value descending, failures after them in input order.
     */
    public List<PortfolioRow> sortedByTotalValue() {
        return rows.stream()
            .sorted(Comparator.comparingDouble(PortfolioReport::sortKey))
            .toList();
    }

    private static double sortKey(PortfolioRow row) {
        return row instanceof PortfolioRow.Holding holding ? -holding.totalValue() : Double.POSITIVE_INFINITY;
    }
}
