package com.portfoliotracker.common.exception;

import com.portfoliotracker.common.model.RetrievalErrorKind;

public class RateLimitExceededException extends QuoteRetrievalException {

    public static final String DEFAULT_MESSAGE =
        "Alpha Vantage API daily limit reached. Please try again tomorrow or upgrade to a premium plan.";

    public RateLimitExceededException(String symbol) {
        super(symbol, RetrievalErrorKind.RATE_LIMIT_EXCEEDED, DEFAULT_MESSAGE);
    }
}
