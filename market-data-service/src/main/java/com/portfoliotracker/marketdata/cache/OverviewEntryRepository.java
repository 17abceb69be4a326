package com.portfoliotracker.marketdata.cache;

import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.time.LocalDate;

@Repository
public interface OverviewEntryRepository extends ReactiveCrudRepository<OverviewEntry, String> {

    /**
     * Atomic UPSERT: one row per symbol, latest write wins.
     */
    @Modifying
    @Query("""
        INSERT INTO overview (symbol, payload, last_updated)
        VALUES (:symbol, :payload, :lastUpdated)
        ON CONFLICT (symbol) DO UPDATE SET
            payload      = EXCLUDED.payload,
            last_updated = EXCLUDED.last_updated
        """)
    Mono<Void> upsert(String symbol, String payload, LocalDate lastUpdated);
}
