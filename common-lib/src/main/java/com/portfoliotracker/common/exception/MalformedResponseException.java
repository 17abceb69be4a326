package com.portfoliotracker.common.exception;

import com.portfoliotracker.common.model.RetrievalErrorKind;

public class MalformedResponseException extends QuoteRetrievalException {

    public MalformedResponseException(String symbol, String message) {
        super(symbol, RetrievalErrorKind.MALFORMED_RESPONSE, message);
    }

    public MalformedResponseException(String symbol, String message, Throwable cause) {
        super(symbol, RetrievalErrorKind.MALFORMED_RESPONSE, message, cause);
    }
}
