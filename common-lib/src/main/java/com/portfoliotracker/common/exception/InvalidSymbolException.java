package com.portfoliotracker.common.exception;

import com.portfoliotracker.common.model.RetrievalErrorKind;
import com.portfoliotracker.common.model.Symbol;

public class InvalidSymbolException extends QuoteRetrievalException {

    public InvalidSymbolException(String symbol) {
        super(symbol, RetrievalErrorKind.INVALID_SYMBOL,
            "Invalid symbol '" + (symbol == null ? "" : symbol) + "': only letters and digits are allowed, at most "
                + Symbol.MAX_LENGTH + " characters");
    }
}
