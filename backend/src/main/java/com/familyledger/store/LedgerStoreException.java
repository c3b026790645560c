package com.familyledger.store;

/**
 * A read or append against an open ledger store failed.
 */
public class LedgerStoreException extends RuntimeException {

    public LedgerStoreException(String message) {
        super(message);
    }

    public LedgerStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
