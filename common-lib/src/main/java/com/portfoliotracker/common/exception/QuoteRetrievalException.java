package com.portfoliotracker.common.exception;

import com.portfoliotracker.common.model.RetrievalErrorKind;

/**
 * Base class for every failure that is scoped to a single symbol.
 */
public abstract class QuoteRetrievalException extends RuntimeException {
    private final String symbol;
    private final RetrievalErrorKind kind;

    protected QuoteRetrievalException(String symbol, RetrievalErrorKind kind, String message) {
        super(message);
        this.symbol = symbol;
        this.kind = kind;
    }

    protected QuoteRetrievalException(String symbol, RetrievalErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.symbol = symbol;
        this.kind = kind;
    }

    public String symbol() {
        return symbol;
    }

    public RetrievalErrorKind kind() {
        return kind;
    }
}
