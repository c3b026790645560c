package com.familyledger.store.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Ledger store configuration. Documented in application.yml under familyledger.store.
 */
@ConfigurationProperties(prefix = "familyledger.store")
@NoArgsConstructor
@Getter
@Setter
public class LedgerStoreProperties {

    /** Backing store: "sheets" (Google Sheets) or "mongo". */
    private String type = "sheets";

    private Sheets sheets = new Sheets();

    private Mongo mongo = new Mongo();

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Sheets {
        /** Sheets REST API base URL. */
        private String baseUrl = "https://sheets.googleapis.com/v4";
        /** Spreadsheet id (the long token in the spreadsheet URL). */
        private String spreadsheetId;
        /** Worksheet title; blank means the first worksheet. */
        private String worksheet;
        /** OAuth2 bearer token used by the default token provider. */
        private String accessToken;
        /** Client-side quota; Sheets allows 60 read requests per minute per user. */
        private int requestsPerMinute = 60;
        /** How long a call may wait for a rate-limiter permit before failing. */
        private long limiterTimeoutMs = 2000L;
        /** Upper bound for one blocking HTTP call. */
        private int readTimeoutSeconds = 15;
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Mongo {
        /** Append-only collection holding one document per ledger row. */
        private String collection = "ledger_rows";
    }
}
