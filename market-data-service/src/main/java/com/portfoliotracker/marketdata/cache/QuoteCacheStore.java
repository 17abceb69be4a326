package com.portfoliotracker.marketdata.cache;

import com.portfoliotracker.common.model.DataClass;
import com.portfoliotracker.common.model.Symbol;
import reactor.core.publisher.Mono;

import java.time.LocalDate;

/**
 * Durable per-symbol store with one namespace per {@link DataClass}.
 *
 * <p>{@code put} is an upsert keyed by symbol (plus fetch date for time series); a concurrent
 * reader sees either the previous or the new payload. The store makes no freshness decisions.
 */
public interface QuoteCacheStore {

    /** Latest entry for the key, or empty on a miss. */
    Mono<CachedPayload> get(Symbol symbol, DataClass dataClass);

    Mono<Void> put(Symbol symbol, DataClass dataClass, String payload, LocalDate fetchedOn);
}
