package com.portfoliotracker.common.exception;

import com.portfoliotracker.common.model.RetrievalErrorKind;

/**
 * The provider named an error for this symbol, or the call itself failed
 * (connection refused, HTTP error status, timeout).
 */
public class UpstreamErrorException extends QuoteRetrievalException {

    public UpstreamErrorException(String symbol, String message) {
        super(symbol, RetrievalErrorKind.UPSTREAM_ERROR, message);
    }

    public UpstreamErrorException(String symbol, String message, Throwable cause) {
        super(symbol, RetrievalErrorKind.UPSTREAM_ERROR, message, cause);
    }
}
