package com.familyledger.api.dto;

import com.familyledger.common.RupiahFormatter;
import com.familyledger.metrics.MetricsSnapshot;
import com.familyledger.query.DashboardView;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * GET /api/v1/dashboard and POST /api/v1/ledger/reload response.
 * On SCHEMA_ERROR or READ_ERROR the totals are zero and errorMessage explains why.
 */
public record DashboardResponse(
        String status,
        String errorMessage,
        int transactionCount,
        Totals totals,
        boolean hasTrend,
        List<TrendEntry> trend,
        boolean hasAllocation,
        List<AllocationEntry> allocation
) {

    public record Totals(
            BigDecimal income,
            BigDecimal expense,
            BigDecimal stockInvestment,
            BigDecimal goldPurchase,
            BigDecimal goldGrams,
            BigDecimal netCashFlow,
            BigDecimal estimatedTotalWealth,
            BigDecimal goldPricePerGram,
            String incomeDisplay,
            String expenseDisplay,
            String stockInvestmentDisplay,
            String goldPurchaseDisplay,
            String goldGramsDisplay,
            String netCashFlowDisplay,
            String estimatedTotalWealthDisplay
    ) {
    }

    public record TrendEntry(LocalDate date, BigDecimal cumulativeNetCashFlow) {
    }

    public record AllocationEntry(String type, BigDecimal amount, String amountDisplay) {
    }

    public static DashboardResponse from(DashboardView view) {
        MetricsSnapshot m = view.metrics();
        Totals totals = new Totals(
                m.totalIncome(),
                m.totalExpense(),
                m.totalStockInvestment(),
                m.totalGoldPurchase(),
                m.totalGoldGrams(),
                m.netCashFlow(),
                m.estimatedTotalWealth(),
                m.goldPricePerGram(),
                RupiahFormatter.format(m.totalIncome()),
                RupiahFormatter.format(m.totalExpense()),
                RupiahFormatter.format(m.totalStockInvestment()),
                RupiahFormatter.format(m.totalGoldPurchase()),
                RupiahFormatter.formatGrams(m.totalGoldGrams()),
                RupiahFormatter.format(m.netCashFlow()),
                RupiahFormatter.format(m.estimatedTotalWealth()));
        return new DashboardResponse(
                view.status().name(),
                view.errorMessage(),
                view.ledger().size(),
                totals,
                m.hasTrend(),
                m.cumulativeTrend().stream()
                        .map(p -> new TrendEntry(p.date(), p.cumulativeNetCashFlow()))
                        .toList(),
                m.hasAllocation(),
                m.allocation().stream()
                        .map(s -> new AllocationEntry(s.type().getLabel(), s.amount(), RupiahFormatter.format(s.amount())))
                        .toList());
    }
}
