package com.portfoliotracker.marketdata.model;

import com.portfoliotracker.common.model.CompanyOverview;
import com.portfoliotracker.common.model.Symbol;

import java.time.LocalDate;

/**
 * Everything retrieved for one symbol, independent of how many shares are held.
 */
public record SymbolQuote(
    Symbol symbol,
    double latestClose,
    LocalDate latestDate,
    Double yearChange,          // fraction, null when not computable
    CompanyOverview overview
) {}
