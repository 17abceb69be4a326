package com.portfoliotracker.common.freshness;

import com.portfoliotracker.common.model.DataClass;
import com.portfoliotracker.common.model.Freshness;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Decides whether a cached entry may still be served.
 *
 * <p>Age is the difference in calendar dates, not elapsed hours: a time series fetched
 * at 23:59 is already stale at 00:01 the next day. An entry is {@link Freshness#FRESH}
 * while its age is below the data class's TTL ({@link DataClass#ttlDays()}).
 */
public final class FreshnessPolicy {

    private FreshnessPolicy() {}

    /**
     * @param fetchedOn date the entry was written, {@code null} for a cache miss
     * @param today     current calendar date
     */
    public static Freshness evaluate(LocalDate fetchedOn, LocalDate today, DataClass dataClass) {
        if (fetchedOn == null) {
            return Freshness.STALE;
        }
        long ageDays = ChronoUnit.DAYS.between(fetchedOn, today);
        return ageDays < dataClass.ttlDays() ? Freshness.FRESH : Freshness.STALE;
    }

    public static boolean isFresh(LocalDate fetchedOn, LocalDate today, DataClass dataClass) {
        return evaluate(fetchedOn, today, dataClass) == Freshness.FRESH;
    }
}
