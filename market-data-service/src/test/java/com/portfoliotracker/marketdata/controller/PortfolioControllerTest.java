package com.portfoliotracker.marketdata.controller;

import com.portfoliotracker.common.exception.InvalidPortfolioRequestException;
import com.portfoliotracker.common.exception.InvalidSymbolException;
import com.portfoliotracker.common.metrics.PortfolioMetricsCalculator;
import com.portfoliotracker.common.model.CompanyOverview;
import com.portfoliotracker.common.model.DailyBar;
import com.portfoliotracker.common.model.PortfolioReport;
import com.portfoliotracker.common.model.PortfolioRow;
import com.portfoliotracker.common.model.PositionRequest;
import com.portfoliotracker.common.model.RetrievalErrorKind;
import com.portfoliotracker.common.model.Symbol;
import com.portfoliotracker.marketdata.portfolio.PortfolioAggregator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class PortfolioControllerTest {

    private PortfolioAggregator aggregator;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        aggregator = mock(PortfolioAggregator.class);
        client = WebTestClient.bindToController(new PortfolioController(aggregator)).build();
    }

    private static PortfolioReport report() {
        Symbol aapl = Symbol.parse("AAPL");
        List<PortfolioRow> rows = List.of(
            PortfolioRow.Holding.of(aapl, 10, 150.0, 0.25,
                CompanyOverview.from(aapl, Map.of("Name", "Apple Inc", "Sector", "TECHNOLOGY"))),
            new PortfolioRow.Failure("XYZ", RetrievalErrorKind.RATE_LIMIT_EXCEEDED, "daily limit"));
        return new PortfolioReport(rows, PortfolioMetricsCalculator.compute(rows));
    }

    @Test
    @DisplayName("POST /aggregate with positions → rows tagged OK / ERROR plus metrics")
    void aggregatePositions() {
        when(aggregator.aggregate(eq(List.of(PositionRequest.of("AAPL", 10), PositionRequest.of("XYZ", 1)))))
            .thenReturn(Mono.just(report()));

        client.post().uri("/api/v1/portfolio/aggregate")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"positions\": [{\"symbol\": \"AAPL\", \"shares\": 10}, {\"symbol\": \"XYZ\", \"shares\": 1}]}")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.rows[0].status").isEqualTo("OK")
            .jsonPath("$.rows[0].totalValue").isEqualTo(1500.0)
            .jsonPath("$.rows[0].sector").isEqualTo("TECHNOLOGY")
            .jsonPath("$.rows[1].status").isEqualTo("ERROR")
            .jsonPath("$.rows[1].kind").isEqualTo("RATE_LIMIT_EXCEEDED")
            .jsonPath("$.metrics.totalValue").isEqualTo(1500.0)
            .jsonPath("$.metrics.assetCount").isEqualTo(1);
    }

    @Test
    @DisplayName("POST /aggregate with parallel lists delegates to the list form")
    void aggregateParallelLists() {
        when(aggregator.aggregate(eq(List.of("AAPL", "XYZ")), eq(List.of(10, 1))))
            .thenReturn(Mono.just(report()));

        client.post().uri("/api/v1/portfolio/aggregate")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"symbols\": [\"AAPL\", \"XYZ\"], \"shares\": [10, 1]}")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.rows.length()").isEqualTo(2);
    }

    @Test
    @DisplayName("length mismatch → 400 with error message")
    void mismatch() {
        when(aggregator.aggregate(eq(List.of("AAPL")), eq(List.of(10, 1))))
            .thenReturn(Mono.error(new InvalidPortfolioRequestException("symbols and shares must have the same length")));

        client.post().uri("/api/v1/portfolio/aggregate")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"symbols\": [\"AAPL\"], \"shares\": [10, 1]}")
            .exchange()
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.error").isEqualTo("symbols and shares must have the same length");
    }

    @Test
    @DisplayName("GET /history/{symbol} → cached bars with ISO dates")
    void history() {
        when(aggregator.priceHistory("AAPL")).thenReturn(Flux.just(
            new DailyBar(LocalDate.of(2024, 6, 27), 1, 2, 0.5, 1.5, 100),
            new DailyBar(LocalDate.of(2024, 6, 28), 1.5, 2.5, 1, 2, 200)));

        client.get().uri("/api/v1/portfolio/history/AAPL")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.length()").isEqualTo(2)
            .jsonPath("$[0].date").isEqualTo("2024-06-27")
            .jsonPath("$[1].close").isEqualTo(2.0);
    }

    @Test
    @DisplayName("GET /history with an invalid symbol → 400")
    void historyInvalidSymbol() {
        when(aggregator.priceHistory("BAD-1")).thenReturn(Flux.error(new InvalidSymbolException("BAD-1")));

        client.get().uri("/api/v1/portfolio/history/BAD-1")
            .exchange()
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.error").exists();
    }

    @Test
    @DisplayName("GET /health → OK")
    void health() {
        client.get().uri("/api/v1/portfolio/health")
            .exchange()
            .expectStatus().isOk()
            .expectBody(String.class).isEqualTo("OK");
    }
}
