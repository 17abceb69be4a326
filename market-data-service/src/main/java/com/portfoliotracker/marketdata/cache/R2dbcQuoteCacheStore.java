package com.portfoliotracker.marketdata.cache;

import com.portfoliotracker.common.model.DataClass;
import com.portfoliotracker.common.model.Symbol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.LocalDate;

/**
 * PostgreSQL-backed {@link QuoteCacheStore} over two R2DBC repositories.
 *
 * <p>Time series keep one row per symbol per fetch day and reads return the most recent day.
 * Overview keeps a single row per symbol.
 */
@Component
public class R2dbcQuoteCacheStore implements QuoteCacheStore {

    private static final Logger log = LoggerFactory.getLogger(R2dbcQuoteCacheStore.class);

    private final TimeSeriesEntryRepository timeSeriesRepository;
    private final OverviewEntryRepository overviewRepository;

    public R2dbcQuoteCacheStore(TimeSeriesEntryRepository timeSeriesRepository,
                                OverviewEntryRepository overviewRepository) {
        this.timeSeriesRepository = timeSeriesRepository;
        this.overviewRepository   = overviewRepository;
    }

    @Override
    public Mono<CachedPayload> get(Symbol symbol, DataClass dataClass) {
        return switch (dataClass) {
            case TIME_SERIES -> timeSeriesRepository.findFirstBySymbolOrderByFetchDateDesc(symbol.value())
                .map(e -> new CachedPayload(e.getPayload(), e.getFetchDate()));
            case OVERVIEW -> overviewRepository.findById(symbol.value())
                .map(e -> new CachedPayload(e.getPayload(), e.getLastUpdated()));
        };
    }

    @Override
    public Mono<Void> put(Symbol symbol, DataClass dataClass, String payload, LocalDate fetchedOn) {
        Mono<Void> write = switch (dataClass) {
            case TIME_SERIES -> timeSeriesRepository.upsert(symbol.value(), fetchedOn, payload);
            case OVERVIEW -> overviewRepository.upsert(symbol.value(), payload, fetchedOn);
        };
        return write.doOnSuccess(v -> log.info("CACHE_WRITE symbol={} dataClass={} fetchedOn={}",
            symbol, dataClass, fetchedOn));
    }
}
