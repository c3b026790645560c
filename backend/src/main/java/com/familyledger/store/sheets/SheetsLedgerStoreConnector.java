package com.familyledger.store.sheets;

import com.familyledger.store.LedgerConnectionException;
import com.familyledger.store.LedgerStore;
import com.familyledger.store.LedgerStoreConnector;
import com.familyledger.store.config.LedgerStoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.List;

/**
 * Opens a spreadsheet by id and resolves the ledger worksheet (configured title, or the first tab).
 */
@Slf4j
public class SheetsLedgerStoreConnector implements LedgerStoreConnector {

    private final LedgerStoreProperties.Sheets properties;
    private final WebClient webClient;
    private final AccessTokenProvider tokenProvider;
    private final RateLimiter rateLimiter;
    private final Duration timeout;

    public SheetsLedgerStoreConnector(LedgerStoreProperties.Sheets properties,
                                      WebClient.Builder webClientBuilder,
                                      AccessTokenProvider tokenProvider,
                                      RateLimiter rateLimiter) {
        this.properties = properties;
        this.webClient = webClientBuilder.baseUrl(properties.getBaseUrl()).build();
        this.tokenProvider = tokenProvider;
        this.rateLimiter = rateLimiter;
        this.timeout = Duration.ofSeconds(Math.max(1, properties.getReadTimeoutSeconds()));
    }

    @Override
    public LedgerStore connect() {
        String spreadsheetId = properties.getSpreadsheetId();
        if (spreadsheetId == null || spreadsheetId.isBlank()) {
            throw new LedgerConnectionException("No spreadsheet id configured (familyledger.store.sheets.spreadsheet-id)");
        }
        String token = tokenProvider.accessToken();
        if (!rateLimiter.acquirePermission()) {
            throw new LedgerConnectionException("Google Sheets connection rejected by the local rate limiter");
        }
        JsonNode spreadsheet;
        try {
            spreadsheet = webClient.get()
                    .uri(b -> b.path("/spreadsheets/{id}")
                            .queryParam("fields", "sheets.properties.title")
                            .build(spreadsheetId))
                    .headers(h -> h.setBearerAuth(token))
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block(timeout);
        } catch (WebClientResponseException e) {
            throw new LedgerConnectionException("Google Sheets refused spreadsheet " + spreadsheetId
                    + " (HTTP " + e.getStatusCode().value() + "); check the id and that it is shared with the service account", e);
        } catch (RuntimeException e) {
            throw new LedgerConnectionException("Google Sheets unreachable: " + e.getMessage(), e);
        }

        String worksheet = resolveWorksheet(SheetsValuesParser.sheetTitles(spreadsheet));
        log.info("Connected to Google Sheets spreadsheet {} worksheet '{}'", spreadsheetId, worksheet);
        return new SheetsLedgerStore(webClient, spreadsheetId, worksheet, tokenProvider, rateLimiter, timeout);
    }

    private String resolveWorksheet(List<String> titles) {
        if (titles.isEmpty()) {
            throw new LedgerConnectionException("Spreadsheet " + properties.getSpreadsheetId() + " has no worksheets");
        }
        String wanted = properties.getWorksheet();
        if (wanted == null || wanted.isBlank()) {
            return titles.get(0);
        }
        return titles.stream()
                .filter(wanted::equals)
                .findFirst()
                .orElseThrow(() -> new LedgerConnectionException("Worksheet '" + wanted + "' not found in spreadsheet "
                        + properties.getSpreadsheetId() + "; available: " + titles));
    }
}
