package com.portfoliotracker.marketdata.portfolio;

import com.portfoliotracker.common.exception.InvalidPortfolioRequestException;
import com.portfoliotracker.common.exception.QuoteRetrievalException;
import com.portfoliotracker.common.metrics.PortfolioMetricsCalculator;
import com.portfoliotracker.common.model.DailyBar;
import com.portfoliotracker.common.model.PortfolioReport;
import com.portfoliotracker.common.model.PortfolioRow;
import com.portfoliotracker.common.model.PositionRequest;
import com.portfoliotracker.common.model.Symbol;
import com.portfoliotracker.marketdata.model.SymbolQuote;
import com.portfoliotracker.marketdata.service.QuoteRetrievalService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Fans retrieval out over a requested position list and folds the outcomes into a
 * {@link PortfolioReport}.
 *
 * <ul>
 *   <li>Null positions, positions without a symbol and positions with a missing or non-positive
 *       share count are skipped.</li>
 *   <li>Retrievals run concurrently, at most {@code portfolio.max-concurrency} at a time;
 *       rows are emitted in input order ({@code flatMapSequential}).</li>
 *   <li>A symbol requested on several rows is retrieved once per pass.</li>
 *   <li>A failing symbol yields a failure row and never affects the other rows.</li>
 * </ul>
 */
@Service
public class PortfolioAggregator {

    private static final Logger log = LoggerFactory.getLogger(PortfolioAggregator.class);

    private final QuoteRetrievalService retrievalService;
    private final int maxConcurrency;

    public PortfolioAggregator(QuoteRetrievalService retrievalService,
                               @Value("${portfolio.max-concurrency:4}") int maxConcurrency) {
        this.retrievalService = retrievalService;
        this.maxConcurrency   = Math.max(1, maxConcurrency);
    }

    /**
     * Parallel-list form, as the input form and CSV import supply it.
     * Fails as a whole only when the two lists differ in length.
     */
    public Mono<PortfolioReport> aggregate(List<String> symbols, List<Integer> shares) {
        if (symbols == null || shares == null || symbols.size() != shares.size()) {
            return Mono.error(new InvalidPortfolioRequestException(
                "symbols and shares must have the same length (symbols=" + sizeOf(symbols)
                    + ", shares=" + sizeOf(shares) + ")"));
        }
        List<PositionRequest> requests = new ArrayList<>(symbols.size());
        for (int i = 0; i < symbols.size(); i++) {
            requests.add(PositionRequest.of(symbols.get(i), shares.get(i)));
        }
        return aggregate(requests);
    }

    public Mono<PortfolioReport> aggregate(List<PositionRequest> requests) {
        return Mono.defer(() -> {
            List<PositionRequest> actionable = requests.stream()
                .filter(Objects::nonNull)
                .filter(PositionRequest::isActionable)
                .toList();
            log.info("Aggregating portfolio. requested={} actionable={} maxConcurrency={}",
                requests.size(), actionable.size(), maxConcurrency);

            Map<Symbol, Mono<SymbolQuote>> retrievals = new HashMap<>();
            return Flux.fromIterable(actionable)
                .flatMapSequential(request -> toRow(request, retrievals), maxConcurrency)
                .collectList()
                .map(rows -> new PortfolioReport(List.copyOf(rows), PortfolioMetricsCalculator.compute(rows)))
                .doOnSuccess(report -> log.info("Portfolio aggregated. rows={} holdings={} totalValue={}",
                    report.rows().size(), report.metrics().assetCount(), report.metrics().totalValue()));
        });
    }

    /**
     * Cached price history for the performance chart; never calls the provider.
     */
    public Flux<DailyBar> priceHistory(String rawSymbol) {
        return Flux.defer(() -> retrievalService.cachedHistory(Symbol.parse(rawSymbol)));
    }

    // flatMapSequential invokes the mapper serially, so the per-pass map needs no locking.
    private Mono<PortfolioRow> toRow(PositionRequest request, Map<Symbol, Mono<SymbolQuote>> retrievals) {
        Symbol symbol;
        try {
            symbol = Symbol.parse(request.symbol());
        } catch (QuoteRetrievalException e) {
            log.info("Rejected symbol before retrieval. input={} reason={}", request.symbol(), e.getMessage());
            return Mono.just(PortfolioRow.Failure.of(Symbol.normalize(request.symbol()), e));
        }
        Mono<SymbolQuote> quote = retrievals.computeIfAbsent(symbol, s -> retrievalService.retrieve(s).cache());
        return retrievalService.toRow(symbol, request.shares(), quote);
    }

    private static int sizeOf(List<?> list) {
        return list == null ? 0 : list.size();
    }
}
