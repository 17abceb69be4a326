package com.portfoliotracker.common.exception;

/**
 * Structural problem with a whole aggregation request, such as symbol and
 * share-count lists of different lengths. Never raised for a single bad row.
 */
public class InvalidPortfolioRequestException extends RuntimeException {

    public InvalidPortfolioRequestException(String message) {
        super(message);
    }
}
