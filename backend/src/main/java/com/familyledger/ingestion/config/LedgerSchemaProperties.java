package com.familyledger.ingestion.config;

import com.familyledger.domain.LedgerColumns;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Header names of the ledger columns. Documented in application.yml under familyledger.ledger.columns.
 */
@ConfigurationProperties(prefix = "familyledger.ledger.columns")
@NoArgsConstructor
@Getter
@Setter
public class LedgerSchemaProperties {

    private String date = LedgerColumns.DEFAULT.date();

    private String type = LedgerColumns.DEFAULT.type();

    private String description = LedgerColumns.DEFAULT.description();

    private String amount = LedgerColumns.DEFAULT.amount();

    private String goldGrams = LedgerColumns.DEFAULT.goldGrams();

    public LedgerColumns toColumns() {
        return new LedgerColumns(date, type, description, amount, goldGrams);
    }
}
