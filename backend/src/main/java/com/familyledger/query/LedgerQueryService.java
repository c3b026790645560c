package com.familyledger.query;

import com.familyledger.cache.LedgerCache;
import com.familyledger.domain.Ledger;
import com.familyledger.domain.LedgerTransaction;
import com.familyledger.ingestion.LedgerLoadError;
import com.familyledger.ingestion.LedgerLoadResult;
import com.familyledger.metrics.MetricsAggregator;
import com.familyledger.metrics.MetricsSnapshot;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Read side: cached ledger plus metrics for the dashboard, and the transaction history.
 * Connection failures propagate as {@link com.familyledger.store.LedgerConnectionException}.
 */
@Service
@RequiredArgsConstructor
public class LedgerQueryService {

    private static final Comparator<LedgerTransaction> NEWEST_FIRST = Comparator.comparing(
            LedgerTransaction::date, Comparator.nullsLast(Comparator.reverseOrder()));

    private final LedgerCache ledgerCache;
    private final MetricsAggregator metricsAggregator;

    public DashboardView currentView() {
        return toView(ledgerCache.get());
    }

    /** Bypasses the freshness window. */
    public DashboardView reload() {
        return toView(ledgerCache.refresh());
    }

    /**
     * Ledger rows by date descending; undated rows last; rows on the same date keep ledger order.
     */
    public List<LedgerTransaction> history() {
        List<LedgerTransaction> rows = new ArrayList<>(ledgerCache.get().ledger().transactions());
        rows.sort(NEWEST_FIRST);
        return rows;
    }

    private DashboardView toView(LedgerLoadResult result) {
        Ledger ledger = result.ledger();
        MetricsSnapshot metrics = metricsAggregator.aggregate(ledger);
        if (result.hasError()) {
            LedgerLoadError error = result.loadError();
            LedgerStatus status = error.kind() == LedgerLoadError.Kind.SCHEMA
                    ? LedgerStatus.SCHEMA_ERROR
                    : LedgerStatus.READ_ERROR;
            return new DashboardView(status, ledger, metrics, error.message());
        }
        LedgerStatus status = ledger.isEmpty() ? LedgerStatus.EMPTY : LedgerStatus.READY;
        return new DashboardView(status, ledger, metrics, null);
    }
}
