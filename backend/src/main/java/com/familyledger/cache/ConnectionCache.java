package com.familyledger.cache;

import com.familyledger.config.CaffeineConfig;
import com.familyledger.store.LedgerConnectionException;
import com.familyledger.store.LedgerStore;
import com.familyledger.store.LedgerStoreConnector;
import com.github.benmanes.caffeine.cache.Cache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Holds the single open {@link LedgerStore} handle. A failed connect is never cached: the
 * {@link LedgerConnectionException} reaches the caller and the next call tries again.
 */
@Component
@Slf4j
public class ConnectionCache {

    private static final String KEY = "ledger-store";

    private final Cache<String, LedgerStore> cache;
    private final LedgerStoreConnector connector;

    public ConnectionCache(@Qualifier(CaffeineConfig.CONNECTION_CACHE) Cache<String, LedgerStore> cache,
                           LedgerStoreConnector connector) {
        this.cache = cache;
        this.connector = connector;
    }

    /**
     * @throws LedgerConnectionException when no handle is cached and connecting fails
     */
    public LedgerStore get() {
        return cache.get(KEY, k -> connect());
    }

    public LedgerStore refresh() {
        invalidate();
        return get();
    }

    public void invalidate() {
        cache.invalidate(KEY);
    }

    private LedgerStore connect() {
        try {
            return connector.connect();
        } catch (LedgerConnectionException e) {
            log.error("Ledger store connection failed: {}", e.getMessage());
            throw e;
        }
    }
}
