package com.familyledger.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Freshness windows of the two cache slots. Documented in application.yml under familyledger.cache.
 */
@ConfigurationProperties(prefix = "familyledger.cache")
@NoArgsConstructor
@Getter
@Setter
public class LedgerCacheProperties {

    /** How long an open store handle is reused before reconnecting. */
    private Duration connectionTtl = Duration.ofHours(1);

    /** How long a loaded ledger is served before re-reading the store. */
    private Duration ledgerTtl = Duration.ofSeconds(60);
}
