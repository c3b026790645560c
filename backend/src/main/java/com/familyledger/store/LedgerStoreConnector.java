package com.familyledger.store;

/**
 * Opens a {@link LedgerStore} handle. Called at most once per connection TTL.
 */
public interface LedgerStoreConnector {

    /**
     * @throws LedgerConnectionException when the store is unreachable or access is not authorised
     */
    LedgerStore connect();
}
