package com.familyledger.store.sheets;

import com.familyledger.domain.LedgerRow;
import com.familyledger.store.LedgerConnectionException;
import com.familyledger.store.LedgerStore;
import com.familyledger.store.LedgerStoreException;
import com.fasterxml.jackson.databind.JsonNode;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * One worksheet of a Google spreadsheet, accessed through the Sheets REST API v4.
 * Reads request unformatted values (numbers stay numbers) with dates rendered as text; appends are RAW inserts.
 * <p>
 * The bearer token is fetched per request. HTTP 401 and 403 surface as {@link LedgerConnectionException}
 * so callers drop this handle and reconnect.
 */
@Slf4j
public class SheetsLedgerStore implements LedgerStore {

    private final WebClient webClient;
    private final String spreadsheetId;
    private final String worksheet;
    private final AccessTokenProvider tokenProvider;
    private final RateLimiter rateLimiter;
    private final Duration timeout;

    public SheetsLedgerStore(WebClient webClient, String spreadsheetId, String worksheet, AccessTokenProvider tokenProvider,
                             RateLimiter rateLimiter, Duration timeout) {
        this.webClient = webClient;
        this.spreadsheetId = spreadsheetId;
        this.worksheet = worksheet;
        this.tokenProvider = tokenProvider;
        this.rateLimiter = rateLimiter;
        this.timeout = timeout;
    }

    @Override
    public List<Map<String, Object>> readAll() {
        JsonNode valueRange = call("read", token -> webClient.get()
                .uri(b -> b.path("/spreadsheets/{id}/values/{range}")
                        .queryParam("valueRenderOption", "UNFORMATTED_VALUE")
                        .queryParam("dateTimeRenderOption", "FORMATTED_STRING")
                        .build(spreadsheetId, range()))
                .headers(h -> h.setBearerAuth(token))
                .retrieve()
                .bodyToMono(JsonNode.class)
                .block(timeout));
        List<Map<String, Object>> records = SheetsValuesParser.toRecords(valueRange);
        log.debug("Read {} rows from {}", records.size(), describe());
        return records;
    }

    @Override
    public void appendRow(LedgerRow row) {
        Map<String, Object> body = Map.of("values", List.of(row.cells()));
        JsonNode response = call("append", token -> webClient.post()
                .uri(b -> b.path("/spreadsheets/{id}/values/{range}:append")
                        .queryParam("valueInputOption", "RAW")
                        .queryParam("insertDataOption", "INSERT_ROWS")
                        .build(spreadsheetId, range()))
                .headers(h -> h.setBearerAuth(token))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .block(timeout));
        int updatedRows = SheetsValuesParser.updatedRows(response)
                .orElseThrow(() -> new LedgerStoreException("Malformed append response from Google Sheets"));
        if (updatedRows != 1) {
            throw new LedgerStoreException("Google Sheets reported " + updatedRows + " rows appended, expected 1");
        }
    }

    @Override
    public String describe() {
        return "sheets:" + spreadsheetId + "/" + worksheet;
    }

    /** A1 range covering the whole worksheet; single quotes inside the title are doubled. */
    String range() {
        return "'" + worksheet.replace("'", "''") + "'";
    }

    private JsonNode call(String operation, Function<String, JsonNode> request) {
        String token = tokenProvider.accessToken();
        if (!rateLimiter.acquirePermission()) {
            throw new LedgerStoreException("Google Sheets " + operation + " rejected by the local rate limiter");
        }
        try {
            return request.apply(token);
        } catch (WebClientResponseException.Unauthorized | WebClientResponseException.Forbidden e) {
            throw new LedgerConnectionException("Google Sheets " + operation + " on " + describe()
                    + " not authorised (HTTP " + e.getStatusCode().value() + ")", e);
        } catch (WebClientResponseException e) {
            throw new LedgerStoreException("Google Sheets " + operation + " failed with HTTP " + e.getStatusCode().value(), e);
        } catch (RuntimeException e) {
            throw new LedgerStoreException("Google Sheets " + operation + " failed: " + e.getMessage(), e);
        }
    }
}
