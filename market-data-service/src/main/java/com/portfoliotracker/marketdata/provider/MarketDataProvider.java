package com.portfoliotracker.marketdata.provider;

import com.portfoliotracker.common.model.Symbol;
import com.portfoliotracker.marketdata.model.OverviewPayload;
import com.portfoliotracker.marketdata.model.TimeSeriesPayload;
import reactor.core.publisher.Mono;

/**
 * Upstream data provider. Both calls fail with a
 * {@link com.portfoliotracker.common.exception.QuoteRetrievalException} subtype and are never retried.
 */
public interface MarketDataProvider {

    Mono<TimeSeriesPayload> fetchTimeSeries(Symbol symbol);

    Mono<OverviewPayload> fetchOverview(Symbol symbol);
}
