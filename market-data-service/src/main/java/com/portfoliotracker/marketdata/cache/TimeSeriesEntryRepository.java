package com.portfoliotracker.marketdata.cache;

import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.time.LocalDate;

@Repository
public interface TimeSeriesEntryRepository extends ReactiveCrudRepository<TimeSeriesEntry, Long> {

    Mono<TimeSeriesEntry> findFirstBySymbolOrderByFetchDateDesc(String symbol);

    /**
     * Atomic UPSERT: a second fetch on the same day replaces that day's payload.
     */
    @Modifying
    @Query("""
        INSERT INTO time_series (symbol, fetch_date, payload)
        VALUES (:symbol, :fetchDate, :payload)
        ON CONFLICT (symbol, fetch_date) DO UPDATE SET
            payload = EXCLUDED.payload
        """)
    Mono<Void> upsert(String symbol, LocalDate fetchDate, String payload);
}
