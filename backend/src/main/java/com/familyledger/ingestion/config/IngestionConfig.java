package com.familyledger.ingestion.config;

import com.familyledger.domain.LedgerColumns;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(LedgerSchemaProperties.class)
public class IngestionConfig {

    @Bean
    public LedgerColumns ledgerColumns(LedgerSchemaProperties properties) {
        return properties.toColumns();
    }
}
