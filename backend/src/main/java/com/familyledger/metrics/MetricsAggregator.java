package com.familyledger.metrics;

import com.familyledger.domain.Ledger;
import com.familyledger.domain.LedgerTransaction;
import com.familyledger.domain.TransactionType;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Pure computation of {@link MetricsSnapshot} from a {@link Ledger}. No I/O, no state besides the gold price.
 * <p>
 * Totals include every row; the cumulative trend only rows with a date, stable-sorted ascending, so rows sharing
 * a date keep their ledger order.
 */
public class MetricsAggregator {

    private static final Set<TransactionType> OUTFLOW_TYPES =
            EnumSet.of(TransactionType.DAILY_EXPENSE, TransactionType.STOCK_SAVINGS, TransactionType.GOLD_PURCHASE);

    private final BigDecimal goldPricePerGram;

    public MetricsAggregator(BigDecimal goldPricePerGram) {
        if (goldPricePerGram == null || goldPricePerGram.signum() < 0) {
            throw new IllegalArgumentException("goldPricePerGram must be zero or positive");
        }
        this.goldPricePerGram = goldPricePerGram;
    }

    public MetricsSnapshot aggregate(Ledger ledger) {
        List<LedgerTransaction> rows = ledger == null ? List.of() : ledger.transactions();

        BigDecimal income = sum(rows, LedgerTransaction::incomeAmount);
        BigDecimal expense = sum(rows, LedgerTransaction::expenseAmount);
        BigDecimal stock = sum(rows, LedgerTransaction::stockInvestmentAmount);
        BigDecimal goldSpent = sum(rows, LedgerTransaction::goldPurchaseAmount);
        BigDecimal goldGrams = sum(rows, LedgerTransaction::goldGrams);

        BigDecimal net = income.subtract(expense);
        BigDecimal wealth = net.add(stock).add(goldGrams.multiply(goldPricePerGram));

        return new MetricsSnapshot(
                income,
                expense,
                stock,
                goldSpent,
                goldGrams,
                net,
                wealth,
                goldPricePerGram,
                cumulativeTrend(rows),
                allocation(rows));
    }

    private static List<TrendPoint> cumulativeTrend(List<LedgerTransaction> rows) {
        List<LedgerTransaction> dated = new ArrayList<>();
        for (LedgerTransaction tx : rows) {
            if (tx.hasDate()) dated.add(tx);
        }
        // List.sort is stable
        dated.sort(Comparator.comparing(LedgerTransaction::date));

        List<TrendPoint> trend = new ArrayList<>(dated.size());
        BigDecimal running = BigDecimal.ZERO;
        for (LedgerTransaction tx : dated) {
            running = running.add(tx.netCashFlow());
            trend.add(new TrendPoint(tx.date(), running));
        }
        return trend;
    }

    private static List<AllocationSlice> allocation(List<LedgerTransaction> rows) {
        Map<TransactionType, BigDecimal> byType = new EnumMap<>(TransactionType.class);
        for (LedgerTransaction tx : rows) {
            if (tx.type() != null && OUTFLOW_TYPES.contains(tx.type())) {
                byType.merge(tx.type(), tx.amount(), BigDecimal::add);
            }
        }
        return byType.entrySet().stream()
                .map(e -> new AllocationSlice(e.getKey(), e.getValue()))
                .toList();
    }

    private static BigDecimal sum(List<LedgerTransaction> rows, Function<LedgerTransaction, BigDecimal> field) {
        return rows.stream()
                .map(field)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
