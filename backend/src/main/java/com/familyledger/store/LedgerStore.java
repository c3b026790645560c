package com.familyledger.store;

import com.familyledger.domain.LedgerRow;

import java.util.List;
import java.util.Map;

/**
 * Append-only tabular ledger with a fixed five-column header. Schema validation is the caller's job.
 */
public interface LedgerStore {

    /**
     * All data rows as header-keyed records, in storage order. Cells are {@code String}, {@code BigDecimal} or "".
     *
     * @throws LedgerStoreException when the store cannot be read
     */
    List<Map<String, Object>> readAll();

    /**
     * Appends one row positionally. Either the whole row is stored or the call fails.
     *
     * @throws LedgerStoreException when the write is refused or its outcome is unknown
     */
    void appendRow(LedgerRow row);

    /** Human-readable identity of the backing resource, for logs. */
    String describe();
}
