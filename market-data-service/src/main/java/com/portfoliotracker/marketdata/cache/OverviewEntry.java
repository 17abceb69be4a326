package com.portfoliotracker.marketdata.cache;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDate;

/**
 * Latest raw overview body per symbol, overwritten on refresh.
 */
@Data
@NoArgsConstructor
@Table("overview")
public class OverviewEntry {

    @Id
    private String symbol;

    private String    payload;
    private LocalDate lastUpdated;
}
