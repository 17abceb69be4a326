package com.portfoliotracker.marketdata.controller;

import com.portfoliotracker.common.exception.InvalidPortfolioRequestException;
import com.portfoliotracker.common.exception.InvalidSymbolException;
import com.portfoliotracker.common.model.PortfolioReport;
import com.portfoliotracker.marketdata.portfolio.PortfolioAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/portfolio")
public class PortfolioController {

    private static final Logger log = LoggerFactory.getLogger(PortfolioController.class);

    private final PortfolioAggregator aggregator;

    public PortfolioController(PortfolioAggregator aggregator) {
        this.aggregator = aggregator;
    }

    @PostMapping("/aggregate")
    public Mono<ResponseEntity<Object>> aggregate(@RequestBody AggregateRequest request) {
        Mono<PortfolioReport> report = request.positions() != null
            ? aggregator.aggregate(request.positions())
            : aggregator.aggregate(request.symbols(), request.shares());

        return report
            .<ResponseEntity<Object>>map(ResponseEntity::ok)
            .onErrorResume(InvalidPortfolioRequestException.class, e -> {
                log.warn("Rejected aggregation request. reason={}", e.getMessage());
                return Mono.just(ResponseEntity.badRequest().body(Map.of("error", e.getMessage())));
            });
    }

    @GetMapping("/history/{symbol}")
    public Mono<ResponseEntity<Object>> history(@PathVariable String symbol) {
        return aggregator.priceHistory(symbol)
            .collectList()
            .<ResponseEntity<Object>>map(ResponseEntity::ok)
            .onErrorResume(InvalidSymbolException.class,
                e -> Mono.just(ResponseEntity.badRequest().body(Map.of("error", e.getMessage()))));
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
