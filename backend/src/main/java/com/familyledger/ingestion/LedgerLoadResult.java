package com.familyledger.ingestion;

import com.familyledger.domain.Ledger;

import java.util.Optional;

/**
 * Either a fully coerced ledger, or an empty ledger with the reason it is empty.
 */
public record LedgerLoadResult(Ledger ledger, LedgerLoadError loadError) {

    public LedgerLoadResult {
        ledger = ledger == null ? Ledger.empty() : ledger;
    }

    public static LedgerLoadResult ok(Ledger ledger) {
        return new LedgerLoadResult(ledger, null);
    }

    public static LedgerLoadResult failed(LedgerLoadError error) {
        return new LedgerLoadResult(Ledger.empty(), error);
    }

    public Optional<LedgerLoadError> error() {
        return Optional.ofNullable(loadError);
    }

    public boolean hasError() {
        return loadError != null;
    }
}
