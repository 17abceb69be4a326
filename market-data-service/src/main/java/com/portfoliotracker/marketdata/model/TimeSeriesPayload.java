package com.portfoliotracker.marketdata.model;

import com.portfoliotracker.common.model.DailyBar;

import java.util.List;

/**
 * A daily series as returned by the provider: the raw body (what gets cached)
 * and its parsed bars, newest first.
 */
public record TimeSeriesPayload(String raw, List<DailyBar> bars) {

    public DailyBar latest() {
        return bars.get(0);
    }
}
