package com.familyledger.cache;

import com.familyledger.config.CaffeineConfig;
import com.familyledger.ingestion.LedgerLoadError;
import com.familyledger.ingestion.LedgerLoadResult;
import com.familyledger.ingestion.LedgerLoader;
import com.familyledger.store.LedgerConnectionException;
import com.familyledger.store.LedgerStore;
import com.familyledger.store.LedgerStoreException;
import com.github.benmanes.caffeine.cache.Cache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Holds the most recent {@link LedgerLoadResult}.
 * <p>
 * A failed read is cached as an empty ledger with a READ error for the normal TTL, replacing any earlier ledger,
 * so stale data is never served silently. Connection failures are not cached and propagate; one raised by a read
 * also drops the cached store handle.
 */
@Component
@Slf4j
public class LedgerCache {

    private static final String KEY = "ledger";

    private final Cache<String, LedgerLoadResult> cache;
    private final ConnectionCache connectionCache;
    private final LedgerLoader loader;

    public LedgerCache(@Qualifier(CaffeineConfig.LEDGER_CACHE) Cache<String, LedgerLoadResult> cache,
                       ConnectionCache connectionCache,
                       LedgerLoader loader) {
        this.cache = cache;
        this.connectionCache = connectionCache;
        this.loader = loader;
    }

    /**
     * @throws LedgerConnectionException when a reload is due and the store cannot be opened or authorised
     */
    public LedgerLoadResult get() {
        return cache.get(KEY, k -> load());
    }

    public LedgerLoadResult refresh() {
        invalidate();
        return get();
    }

    /** Forces the next {@link #get()} to reload regardless of age. */
    public void invalidate() {
        cache.invalidate(KEY);
        log.debug("Ledger cache invalidated");
    }

    private LedgerLoadResult load() {
        LedgerStore store = connectionCache.get();
        List<Map<String, Object>> rows;
        try {
            rows = store.readAll();
        } catch (LedgerConnectionException e) {
            log.warn("Connection to {} lost during read: {}", store.describe(), e.getMessage());
            connectionCache.invalidate();
            throw e;
        } catch (LedgerStoreException e) {
            log.warn("Reading {} failed: {}", store.describe(), e.getMessage());
            return LedgerLoadResult.failed(LedgerLoadError.read(e.getMessage()));
        }
        LedgerLoadResult result = loader.load(rows);
        log.debug("Ledger reloaded from {}: {} rows{}", store.describe(), result.ledger().size(),
                result.hasError() ? " (" + result.loadError().kind() + ")" : "");
        return result;
    }
}
