package com.portfoliotracker.marketdata.cache;

import java.time.LocalDate;

/**
 * A stored raw provider body and the calendar date it was fetched.
 */
public record CachedPayload(String payload, LocalDate fetchedOn) {}
