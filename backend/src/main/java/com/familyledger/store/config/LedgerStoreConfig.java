package com.familyledger.store.config;

import com.familyledger.domain.LedgerColumns;
import com.familyledger.store.LedgerStoreConnector;
import com.familyledger.store.mongo.MongoLedgerStoreConnector;
import com.familyledger.store.sheets.AccessTokenProvider;
import com.familyledger.store.sheets.SheetsLedgerStoreConnector;
import com.familyledger.store.sheets.StaticAccessTokenProvider;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Selects the ledger store adapter from familyledger.store.type (sheets by default).
 */
@Configuration
@EnableConfigurationProperties(LedgerStoreProperties.class)
public class LedgerStoreConfig {

    public static final String SHEETS_RATE_LIMITER = "sheetsRateLimiter";

    @Configuration
    @ConditionalOnProperty(prefix = "familyledger.store", name = "type", havingValue = "sheets", matchIfMissing = true)
    static class SheetsStoreConfig {

        @Bean
        @ConditionalOnMissingBean
        public AccessTokenProvider accessTokenProvider(LedgerStoreProperties properties) {
            return new StaticAccessTokenProvider(properties.getSheets().getAccessToken());
        }

        @Bean(name = SHEETS_RATE_LIMITER)
        public RateLimiter sheetsRateLimiter(LedgerStoreProperties properties) {
            LedgerStoreProperties.Sheets sheets = properties.getSheets();
            RateLimiterConfig config = RateLimiterConfig.custom()
                    .limitRefreshPeriod(Duration.ofMinutes(1))
                    .limitForPeriod(Math.max(1, sheets.getRequestsPerMinute()))
                    .timeoutDuration(Duration.ofMillis(Math.max(0L, sheets.getLimiterTimeoutMs())))
                    .build();
            return RateLimiter.of("google-sheets", config);
        }

        @Bean
        public LedgerStoreConnector sheetsLedgerStoreConnector(LedgerStoreProperties properties,
                                                               WebClient.Builder webClientBuilder,
                                                               AccessTokenProvider accessTokenProvider,
                                                               @Qualifier(SHEETS_RATE_LIMITER) RateLimiter rateLimiter) {
            return new SheetsLedgerStoreConnector(properties.getSheets(), webClientBuilder, accessTokenProvider, rateLimiter);
        }
    }

    @Configuration
    @ConditionalOnProperty(prefix = "familyledger.store", name = "type", havingValue = "mongo")
    static class MongoStoreConfig {

        @Bean
        public LedgerStoreConnector mongoLedgerStoreConnector(MongoTemplate mongoTemplate,
                                                              LedgerStoreProperties properties,
                                                              LedgerColumns ledgerColumns) {
            return new MongoLedgerStoreConnector(mongoTemplate, properties.getMongo().getCollection(), ledgerColumns);
        }
    }
}
