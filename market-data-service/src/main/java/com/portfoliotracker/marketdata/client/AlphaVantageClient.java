package com.portfoliotracker.marketdata.client;

import com.portfoliotracker.common.exception.QuoteRetrievalException;
import com.portfoliotracker.common.exception.UpstreamErrorException;
import com.portfoliotracker.common.model.DataClass;
import com.portfoliotracker.common.model.Symbol;
import com.portfoliotracker.marketdata.model.OverviewPayload;
import com.portfoliotracker.marketdata.model.TimeSeriesPayload;
import com.portfoliotracker.marketdata.provider.MarketDataProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Alpha Vantage implementation of {@link MarketDataProvider}.
 *
 * <p>Every body, including error statuses, is handed to {@link RawResponseArchive} before
 * classification. Transport failures and timeouts surface as {@link UpstreamErrorException};
 * nothing is retried.
 */
public class AlphaVantageClient implements MarketDataProvider {

    private static final Logger log = LoggerFactory.getLogger(AlphaVantageClient.class);

    static final String FUNCTION_TIME_SERIES = "TIME_SERIES_DAILY";
    static final String FUNCTION_OVERVIEW    = "OVERVIEW";

    private final WebClient webClient;
    private final AlphaVantageResponseParser parser;
    private final RawResponseArchive archive;
    private final String apiKey;
    private final Duration timeout;

    public AlphaVantageClient(WebClient webClient,
                              AlphaVantageResponseParser parser,
                              RawResponseArchive archive,
                              String apiKey,
                              Duration timeout) {
        this.webClient = webClient;
        this.parser    = parser;
        this.archive   = archive;
        this.apiKey    = apiKey;
        this.timeout   = timeout;
    }

    @Override
    public Mono<TimeSeriesPayload> fetchTimeSeries(Symbol symbol) {
        return call(symbol, DataClass.TIME_SERIES, FUNCTION_TIME_SERIES)
            .map(body -> parser.parseTimeSeries(symbol, body))
            .doOnSuccess(p -> log.info("Time series fetched. provider=AlphaVantage symbol={} bars={} latestClose={}",
                symbol, p.bars().size(), p.latest().close()))
            .doOnError(e -> log.warn("Time series fetch failed. symbol={} err={}", symbol, e.getMessage()));
    }

    @Override
    public Mono<OverviewPayload> fetchOverview(Symbol symbol) {
        return call(symbol, DataClass.OVERVIEW, FUNCTION_OVERVIEW)
            .map(body -> parser.parseOverview(symbol, body))
            .doOnSuccess(p -> log.info("Overview fetched. provider=AlphaVantage symbol={} name={} sector={}",
                symbol, p.overview().name(), p.overview().sector()))
            .doOnError(e -> log.warn("Overview fetch failed. symbol={} err={}", symbol, e.getMessage()));
    }

    private Mono<String> call(Symbol symbol, DataClass dataClass, String function) {
        log.info("Fetching market data. provider=AlphaVantage function={} symbol={}", function, symbol);
        return webClient.get()
            .uri(uriBuilder -> uriBuilder
                .path("/query")
                .queryParam("function", function)
                .queryParam("symbol", symbol.value())
                .queryParam("apikey", apiKey)
                .build())
            .exchangeToMono(response -> response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .flatMap(body -> {
                    archive.record(symbol, dataClass, body);
                    if (response.statusCode().isError()) {
                        return Mono.error(new UpstreamErrorException(symbol.value(),
                            "Alpha Vantage returned HTTP " + response.statusCode().value()));
                    }
                    return Mono.just(body);
                }))
            .timeout(timeout)
            .onErrorMap(e -> !(e instanceof QuoteRetrievalException), e -> toNetworkError(symbol, e));
    }

    private UpstreamErrorException toNetworkError(Symbol symbol, Throwable e) {
        String detail = e instanceof TimeoutException
            ? "no response within " + timeout.toSeconds() + "s"
            : (e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        return new UpstreamErrorException(symbol.value(), "Network error calling Alpha Vantage: " + detail, e);
    }
}
