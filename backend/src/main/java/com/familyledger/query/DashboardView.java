package com.familyledger.query;

import com.familyledger.domain.Ledger;
import com.familyledger.metrics.MetricsSnapshot;

/**
 * One read cycle: ledger, metrics over it, and the load error message when the status is an error.
 */
public record DashboardView(LedgerStatus status, Ledger ledger, MetricsSnapshot metrics, String errorMessage) {

    public boolean isError() {
        return status == LedgerStatus.SCHEMA_ERROR || status == LedgerStatus.READ_ERROR;
    }
}
