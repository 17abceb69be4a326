package com.portfoliotracker.marketdata.service;

import com.portfoliotracker.common.exception.QuoteRetrievalException;
import com.portfoliotracker.common.freshness.FreshnessPolicy;
import com.portfoliotracker.common.metrics.YearChangeCalculator;
import com.portfoliotracker.common.model.DailyBar;
import com.portfoliotracker.common.model.DataClass;
import com.portfoliotracker.common.model.PortfolioRow;
import com.portfoliotracker.common.model.Symbol;
import com.portfoliotracker.marketdata.cache.CachedPayload;
import com.portfoliotracker.marketdata.cache.QuoteCacheStore;
import com.portfoliotracker.marketdata.client.AlphaVantageResponseParser;
import com.portfoliotracker.marketdata.model.OverviewPayload;
import com.portfoliotracker.marketdata.model.SymbolQuote;
import com.portfoliotracker.marketdata.model.TimeSeriesPayload;
import com.portfoliotracker.marketdata.provider.MarketDataProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Per-symbol retrieval: cache first, provider on miss or stale, write back, assemble.
 *
 * <p><strong>Flow for each data class</strong> (time series first, then overview):
 * <ol>
 *   <li>Read {@link QuoteCacheStore}; serve the entry when {@link FreshnessPolicy} says FRESH.</li>
 *   <li>Otherwise call the {@link MarketDataProvider} and upsert the raw body with today's date.</li>
 *   <li>A provider failure propagates as-is. There is no fallback to a stale entry.</li>
 * </ol>
 *
 * <p>The overview is only requested once the time series has resolved, so a rate-limit
 * signal on the first call never triggers a second call for the same symbol.
 * Cache read/write failures are logged and treated as a miss / skipped write.
 */
@Service
public class QuoteRetrievalService {

    private static final Logger log = LoggerFactory.getLogger(QuoteRetrievalService.class);

    private final MarketDataProvider provider;
    private final QuoteCacheStore cache;
    private final AlphaVantageResponseParser parser;
    private final Clock clock;

    public QuoteRetrievalService(MarketDataProvider provider,
                                 QuoteCacheStore cache,
                                 AlphaVantageResponseParser parser,
                                 Clock clock) {
        this.provider = provider;
        this.cache    = cache;
        this.parser   = parser;
        this.clock    = clock;
    }

    /**
     * Resolves latest close, 52-week change and overview for one symbol.
     * Fails with a {@link QuoteRetrievalException} subtype.
     */
    public Mono<SymbolQuote> retrieve(Symbol symbol) {
        return timeSeries(symbol)
            .flatMap(ts -> overview(symbol).map(ov -> assemble(symbol, ts, ov)));
    }

    /**
     * Values a position from a (possibly shared) retrieval. Never fails: every error
     * becomes a {@link PortfolioRow.Failure} for this symbol only.
     */
    public Mono<PortfolioRow> toRow(Symbol symbol, int shares, Mono<SymbolQuote> quote) {
        return quote
            .<PortfolioRow>map(q -> PortfolioRow.Holding.of(symbol, shares, q.latestClose(), q.yearChange(), q.overview()))
            .onErrorResume(e -> {
                if (e instanceof QuoteRetrievalException qre) {
                    log.warn("Symbol retrieval failed. symbol={} kind={} err={}",
                        symbol, qre.kind(), qre.getMessage());
                } else {
                    log.error("Unexpected error retrieving symbol={}", symbol, e);
                }
                return Mono.just(PortfolioRow.Failure.of(symbol.value(), e));
            });
    }

    /**
     * Cached daily bars for the symbol, oldest first. Reads the cache only; empty when
     * nothing is stored or the stored body cannot be read.
     */
    public Flux<DailyBar> cachedHistory(Symbol symbol) {
        return cache.get(symbol, DataClass.TIME_SERIES)
            .flatMapMany(entry -> {
                try {
                    List<DailyBar> bars = new ArrayList<>(parser.parseTimeSeries(symbol, entry.payload()).bars());
                    Collections.reverse(bars);
                    return Flux.fromIterable(bars);
                } catch (QuoteRetrievalException e) {
                    log.warn("Cached time series unreadable. symbol={} err={}", symbol, e.getMessage());
                    return Flux.empty();
                }
            });
    }

    // ── per data class ────────────────────────────────────────────────────────

    private Mono<TimeSeriesPayload> timeSeries(Symbol symbol) {
        return resolve(symbol, DataClass.TIME_SERIES, parser::parseTimeSeries,
            provider::fetchTimeSeries, TimeSeriesPayload::raw);
    }

    private Mono<OverviewPayload> overview(Symbol symbol) {
        return resolve(symbol, DataClass.OVERVIEW, parser::parseOverview,
            provider::fetchOverview, OverviewPayload::raw);
    }

    private <T> Mono<T> resolve(Symbol symbol,
                                DataClass dataClass,
                                BiFunction<Symbol, String, T> parseCached,
                                Function<Symbol, Mono<T>> fetch,
                                Function<T, String> rawOf) {
        return Mono.defer(() -> {
            LocalDate today = LocalDate.now(clock);
            return readCache(symbol, dataClass)
                .flatMap(entry -> fromCacheIfFresh(symbol, dataClass, entry, today, parseCached))
                .switchIfEmpty(Mono.defer(() -> {
                    log.info("CACHE_MISS symbol={} dataClass={}", symbol, dataClass);
                    return fetch.apply(symbol)
                        .flatMap(payload -> writeBack(symbol, dataClass, rawOf.apply(payload), today)
                            .thenReturn(payload));
                }));
        });
    }

    private Mono<CachedPayload> readCache(Symbol symbol, DataClass dataClass) {
        return cache.get(symbol, dataClass)
            .onErrorResume(e -> {
                log.warn("CACHE_READ_FAILED symbol={} dataClass={} err={}", symbol, dataClass, e.toString());
                return Mono.empty();
            });
    }

    private <T> Mono<T> fromCacheIfFresh(Symbol symbol, DataClass dataClass, CachedPayload entry,
                                         LocalDate today, BiFunction<Symbol, String, T> parseCached) {
        if (!FreshnessPolicy.isFresh(entry.fetchedOn(), today, dataClass)) {
            log.info("CACHE_STALE symbol={} dataClass={} fetchedOn={}", symbol, dataClass, entry.fetchedOn());
            return Mono.empty();
        }
        try {
            T payload = parseCached.apply(symbol, entry.payload());
            log.info("CACHE_HIT symbol={} dataClass={} fetchedOn={}", symbol, dataClass, entry.fetchedOn());
            return Mono.just(payload);
        } catch (QuoteRetrievalException e) {
            log.warn("Cached entry unreadable, refetching. symbol={} dataClass={} err={}",
                symbol, dataClass, e.getMessage());
            return Mono.empty();
        }
    }

    private Mono<Void> writeBack(Symbol symbol, DataClass dataClass, String raw, LocalDate today) {
        return cache.put(symbol, dataClass, raw, today)
            .onErrorResume(e -> {
                log.warn("CACHE_WRITE_FAILED symbol={} dataClass={} err={}", symbol, dataClass, e.toString());
                return Mono.empty();
            });
    }

    private SymbolQuote assemble(Symbol symbol, TimeSeriesPayload ts, OverviewPayload ov) {
        DailyBar latest = ts.latest();
        return new SymbolQuote(symbol, latest.close(), latest.date(),
            YearChangeCalculator.yearChange(ts.bars()), ov.overview());
    }
}
