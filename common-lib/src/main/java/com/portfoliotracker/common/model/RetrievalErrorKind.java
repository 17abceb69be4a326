package com.portfoliotracker.common.model;

/**
 * Row-level failure categories. None of them is retried automatically.
 */
public enum RetrievalErrorKind {
    /** Local validation failure; nothing was sent upstream. */
    INVALID_SYMBOL,
    /** Provider quota exhausted for the day. */
    RATE_LIMIT_EXCEEDED,
    /** Provider named an error for this symbol, or the call failed in transport. */
    UPSTREAM_ERROR,
    /** Response matched neither the expected data shape nor a known error shape. */
    MALFORMED_RESPONSE
}
