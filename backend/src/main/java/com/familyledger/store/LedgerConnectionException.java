package com.familyledger.store;

/**
 * The ledger store could not be reached or authorised. Fatal for the current read or write cycle.
 */
public class LedgerConnectionException extends RuntimeException {

    public LedgerConnectionException(String message) {
        super(message);
    }

    public LedgerConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
