package com.portfoliotracker.common.metrics;

import com.portfoliotracker.common.model.PortfolioMetrics;
import com.portfoliotracker.common.model.PortfolioRow;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToDoubleFunction;

/**
 * Derives {@link PortfolioMetrics} from a set of aggregated rows.
 *
 * <p>Only {@link PortfolioRow.Holding} rows contribute; failure rows are ignored and
 * the input list is never modified. Ties for highest/lowest go to the earliest row.
 * With no holdings the result is {@link PortfolioMetrics#empty()}.
 */
public final class PortfolioMetricsCalculator {

    private PortfolioMetricsCalculator() { /* utility class */ }

    public static PortfolioMetrics compute(List<PortfolioRow> rows) {
        List<PortfolioRow.Holding> holdings = rows.stream()
            .filter(PortfolioRow.Holding.class::isInstance)
            .map(PortfolioRow.Holding.class::cast)
            .toList();

        if (holdings.isEmpty()) {
            return PortfolioMetrics.empty();
        }

        double total = holdings.stream().mapToDouble(PortfolioRow.Holding::totalValue).sum();

        Map<String, Double> bySector = new LinkedHashMap<>();
        for (PortfolioRow.Holding h : holdings) {
            bySector.merge(h.sector(), h.totalValue(), Double::sum);
        }
        Map.Entry<String, Double> dominant = null;
        for (Map.Entry<String, Double> e : bySector.entrySet()) {
            if (dominant == null || e.getValue() > dominant.getValue()) {
                dominant = e;
            }
        }

        return new PortfolioMetrics(
            total,
            holdings.size(),
            total / holdings.size(),
            max(holdings, PortfolioRow.Holding::totalValue),
            min(holdings, PortfolioRow.Holding::totalValue),
            max(holdings, PortfolioRow.Holding::shares),
            min(holdings, PortfolioRow.Holding::shares),
            max(holdings, PortfolioRow.Holding::latestClose),
            min(holdings, PortfolioRow.Holding::latestClose),
            bySector.size(),
            dominant.getKey(),
            dominant.getValue(),
            Collections.unmodifiableMap(bySector)
        );
    }

    static String max(List<PortfolioRow.Holding> holdings, ToDoubleFunction<PortfolioRow.Holding> field) {
        PortfolioRow.Holding best = holdings.get(0);
        for (PortfolioRow.Holding h : holdings) {
            if (field.applyAsDouble(h) > field.applyAsDouble(best)) best = h;
        }
        return best.symbol();
    }

    static String min(List<PortfolioRow.Holding> holdings, ToDoubleFunction<PortfolioRow.Holding> field) {
        PortfolioRow.Holding best = holdings.get(0);
        for (PortfolioRow.Holding h : holdings) {
            if (field.applyAsDouble(h) < field.applyAsDouble(best)) best = h;
        }
        return best.symbol();
    }
}
