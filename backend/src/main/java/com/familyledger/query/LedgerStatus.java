package com.familyledger.query;

/**
 * What the dashboard can show for the current cycle.
 */
public enum LedgerStatus {
    /** Ledger loaded with at least one row. */
    READY,
    /** No rows yet. Not an error. */
    EMPTY,
    SCHEMA_ERROR,
    READ_ERROR
}
