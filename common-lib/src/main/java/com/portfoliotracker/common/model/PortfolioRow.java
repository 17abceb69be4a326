package com.portfoliotracker.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.portfoliotracker.common.exception.QuoteRetrievalException;

/**
 * Outcome for one requested position: either a fully populated {@link Holding}
 * or a pure {@link Failure} carrying only the symbol and what went wrong.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "status")
@JsonSubTypes({
    @JsonSubTypes.Type(value = PortfolioRow.Holding.class, name = "OK"),
    @JsonSubTypes.Type(value = PortfolioRow.Failure.class, name = "ERROR")
})
public sealed interface PortfolioRow permits PortfolioRow.Holding, PortfolioRow.Failure {

    String symbol();

    record Holding(
        @JsonProperty("symbol") String symbol,
        @JsonProperty("name") String name,
        @JsonProperty("assetType") String assetType,
        @JsonProperty("sector") String sector,
        @JsonProperty("industry") String industry,
        @JsonProperty("shares") int shares,
        @JsonProperty("latestClose") double latestClose,
        @JsonProperty("totalValue") double totalValue,
        @JsonProperty("yearChange") Double yearChange,      // fraction, null when not computable
        @JsonProperty("overview") CompanyOverview overview
    ) implements PortfolioRow {

        /**
         * Values a position at the latest close. Total value is always shares x latest close.
         */
        public static Holding of(Symbol symbol, int shares, double latestClose,
                                 Double yearChange, CompanyOverview overview) {
            return new Holding(symbol.value(), overview.name(), overview.assetType(),
                overview.sector(), overview.industry(), shares, latestClose,
                shares * latestClose, yearChange, overview);
        }
    }

    record Failure(
        @JsonProperty("symbol") String symbol,
        @JsonProperty("kind") RetrievalErrorKind kind,
        @JsonProperty("error") String error
    ) implements PortfolioRow {

        /**
         * Maps any retrieval failure onto a row. Unclassified throwables are reported
         * as {@link RetrievalErrorKind#UPSTREAM_ERROR}.
         */
        public static Failure of(String symbol, Throwable cause) {
            if (cause instanceof QuoteRetrievalException qre) {
                return new Failure(symbol, qre.kind(), qre.getMessage());
            }
            String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
            return new Failure(symbol, RetrievalErrorKind.UPSTREAM_ERROR, message);
        }
    }
}
