package com.portfoliotracker.common.freshness;

import com.portfoliotracker.common.model.DataClass;
import com.portfoliotracker.common.model.Freshness;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class FreshnessPolicyTest {

    private static final LocalDate FETCHED = LocalDate.of(2024, 3, 14);

    @Test
    @DisplayName("absent entry → STALE for both data classes")
    void absentEntryIsStale() {
        assertEquals(Freshness.STALE, FreshnessPolicy.evaluate(null, FETCHED, DataClass.TIME_SERIES));
        assertEquals(Freshness.STALE, FreshnessPolicy.evaluate(null, FETCHED, DataClass.OVERVIEW));
    }

    @Nested
    @DisplayName("time series (TTL 1 day)")
    class TimeSeries {

        @Test
        @DisplayName("same calendar day → FRESH")
        void sameDay() {
            assertEquals(Freshness.FRESH, FreshnessPolicy.evaluate(FETCHED, FETCHED, DataClass.TIME_SERIES));
        }

        @Test
        @DisplayName("next calendar day → STALE regardless of elapsed hours")
        void nextDay() {
            assertEquals(Freshness.STALE,
                FreshnessPolicy.evaluate(FETCHED, FETCHED.plusDays(1), DataClass.TIME_SERIES));
        }

        @Test
        @DisplayName("across a year boundary → STALE")
        void yearBoundary() {
            LocalDate newYearsEve = LocalDate.of(2023, 12, 31);
            assertFalse(FreshnessPolicy.isFresh(newYearsEve, LocalDate.of(2024, 1, 1), DataClass.TIME_SERIES));
        }
    }

    @Nested
    @DisplayName("overview (TTL 7 days)")
    class Overview {

        @Test
        @DisplayName("day 6 after fetch → FRESH")
        void daySix() {
            assertEquals(Freshness.FRESH,
                FreshnessPolicy.evaluate(FETCHED, FETCHED.plusDays(6), DataClass.OVERVIEW));
        }

        @Test
        @DisplayName("day 7 after fetch → STALE")
        void daySeven() {
            assertEquals(Freshness.STALE,
                FreshnessPolicy.evaluate(FETCHED, FETCHED.plusDays(7), DataClass.OVERVIEW));
        }

        @Test
        @DisplayName("day 30 after fetch → STALE")
        void monthLater() {
            assertEquals(Freshness.STALE,
                FreshnessPolicy.evaluate(FETCHED, FETCHED.plusDays(30), DataClass.OVERVIEW));
        }
    }
}
