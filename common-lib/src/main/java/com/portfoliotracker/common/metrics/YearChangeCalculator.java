package com.portfoliotracker.common.metrics;

import com.portfoliotracker.common.model.DailyBar;

import java.util.List;

/**
 * Approximate 52-week price change from a daily series.
 *
 * <p>Uses a fixed bar offset rather than calendar dates: with at least
 * {@value #TRADING_DAYS_PER_YEAR} bars the reference is the bar at offset
 * {@code TRADING_DAYS_PER_YEAR - 1}, otherwise the oldest bar available.
 * Bars are not checked for gaps or duplicates.
 */
public final class YearChangeCalculator {

    public static final int TRADING_DAYS_PER_YEAR = 252;

    private YearChangeCalculator() { /* utility class */ }

    /**
     * @param barsMostRecentFirst daily bars ordered newest first
     * @return fractional change ({@code 0.25} for +25%), or {@code null} when there are
     *         no bars or the reference close is zero
     */
    public static Double yearChange(List<DailyBar> barsMostRecentFirst) {
        if (barsMostRecentFirst == null || barsMostRecentFirst.isEmpty()) {
            return null;
        }
        int referenceIndex = barsMostRecentFirst.size() >= TRADING_DAYS_PER_YEAR
            ? TRADING_DAYS_PER_YEAR - 1
            : barsMostRecentFirst.size() - 1;
        double latest = barsMostRecentFirst.get(0).close();
        double reference = barsMostRecentFirst.get(referenceIndex).close();
        if (reference == 0.0) {
            return null;
        }
        return latest / reference - 1.0;
    }
}
