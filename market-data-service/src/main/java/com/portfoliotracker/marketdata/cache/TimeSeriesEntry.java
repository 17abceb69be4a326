package com.portfoliotracker.marketdata.cache;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDate;

/**
 * One raw daily-series body per symbol per fetch day, stored in {@code time_series}.
 * UNIQUE(symbol, fetch_date); rows are never pruned.
 */
@Data
@NoArgsConstructor
@Table("time_series")
public class TimeSeriesEntry {

    @Id
    private Long id;

    private String    symbol;
    private LocalDate fetchDate;
    private String    payload;
}
