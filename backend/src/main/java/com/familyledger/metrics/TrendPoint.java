package com.familyledger.metrics;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Cumulative net cash flow (income minus daily expense) up to and including one dated ledger row.
 */
public record TrendPoint(LocalDate date, BigDecimal cumulativeNetCashFlow) {
}
