package com.familyledger.config;

import com.familyledger.ingestion.LedgerLoadResult;
import com.familyledger.store.LedgerStore;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Caffeine single-entry caches: store connection (1h) and loaded ledger (60s).
 */
@Configuration
@EnableConfigurationProperties(LedgerCacheProperties.class)
public class CaffeineConfig {

    public static final String CONNECTION_CACHE = "connectionCache";
    public static final String LEDGER_CACHE = "ledgerCache";

    @Bean
    @ConditionalOnMissingBean
    public Ticker cacheTicker() {
        return Ticker.systemTicker();
    }

    @Bean(name = CONNECTION_CACHE)
    public Cache<String, LedgerStore> connectionCache(LedgerCacheProperties properties, Ticker cacheTicker) {
        return Caffeine.newBuilder()
                .expireAfterWrite(properties.getConnectionTtl())
                .maximumSize(1)
                .ticker(cacheTicker)
                .build();
    }

    @Bean(name = LEDGER_CACHE)
    public Cache<String, LedgerLoadResult> ledgerCache(LedgerCacheProperties properties, Ticker cacheTicker) {
        return Caffeine.newBuilder()
                .expireAfterWrite(properties.getLedgerTtl())
                .maximumSize(1)
                .ticker(cacheTicker)
                .build();
    }
}
