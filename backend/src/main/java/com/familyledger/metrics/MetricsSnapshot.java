package com.familyledger.metrics;

import java.math.BigDecimal;
import java.util.List;

/**
 * Derived figures for one ledger. Recomputed on demand, never mutated.
 *
 * @param totalIncome          sum of income buckets
 * @param totalExpense         sum of daily-expense buckets
 * @param totalStockInvestment sum of stock-savings buckets
 * @param totalGoldPurchase    sum of gold-purchase buckets (currency spent on gold)
 * @param totalGoldGrams       sum of gold weight over all rows
 * @param netCashFlow          totalIncome - totalExpense
 * @param estimatedTotalWealth rough wealth <b>estimate</b>: netCashFlow + totalStockInvestment + totalGoldGrams x goldPricePerGram.
 *                             The gold price is a configured constant, not a live market valuation.
 * @param goldPricePerGram     the constant used for the estimate
 * @param cumulativeTrend      date-ascending running net cash flow over rows that have a date
 * @param allocation           outflow per category, for categories present in the ledger
 */
public record MetricsSnapshot(
        BigDecimal totalIncome,
        BigDecimal totalExpense,
        BigDecimal totalStockInvestment,
        BigDecimal totalGoldPurchase,
        BigDecimal totalGoldGrams,
        BigDecimal netCashFlow,
        BigDecimal estimatedTotalWealth,
        BigDecimal goldPricePerGram,
        List<TrendPoint> cumulativeTrend,
        List<AllocationSlice> allocation
) {

    public MetricsSnapshot {
        cumulativeTrend = cumulativeTrend == null ? List.of() : List.copyOf(cumulativeTrend);
        allocation = allocation == null ? List.of() : List.copyOf(allocation);
    }

    /**
     * False when no row has a usable date: the trend is "not enough data", not an error.
     */
    public boolean hasTrend() {
        return !cumulativeTrend.isEmpty();
    }

    public boolean hasAllocation() {
        return allocation.stream()
                .map(AllocationSlice::amount)
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .signum() > 0;
    }
}
