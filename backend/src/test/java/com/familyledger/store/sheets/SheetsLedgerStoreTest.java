package com.familyledger.store.sheets;

import com.familyledger.domain.LedgerRow;
import com.familyledger.store.LedgerConnectionException;
import com.familyledger.store.LedgerStoreException;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SheetsLedgerStoreTest {

    private static final LedgerRow ROW = new LedgerRow("2024-01-01", "Income", "Salary", new BigDecimal("5000000"), BigDecimal.ZERO);

    private final List<ClientRequest> requests = new ArrayList<>();

    @Test
    @DisplayName("readAll requests unformatted values of the worksheet with the bearer token")
    void readAll() {
        SheetsLedgerStore store = store(HttpStatus.OK, """
                {"values":[["Date","TransactionType","Description","Amount","GoldGrams"],["2024-01-01","Income","Salary",5000000,0]]}
                """, limiter(10));

        List<Map<String, Object>> records = store.readAll();

        assertThat(records).hasSize(1);
        assertThat(records.get(0)).containsEntry("TransactionType", "Income");
        ClientRequest request = requests.get(0);
        assertThat(request.method()).isEqualTo(HttpMethod.GET);
        assertThat(request.url().getPath()).isEqualTo("/v4/spreadsheets/sheet-123/values/'Ledger'");
        assertThat(request.url().getQuery())
                .contains("valueRenderOption=UNFORMATTED_VALUE")
                .contains("dateTimeRenderOption=FORMATTED_STRING");
        assertThat(request.headers().getFirst("Authorization")).isEqualTo("Bearer tok");
    }

    @Test
    @DisplayName("appendRow posts a RAW insert to the worksheet")
    void appendRow() {
        SheetsLedgerStore store = store(HttpStatus.OK, """
                {"spreadsheetId":"sheet-123","updates":{"updatedRange":"'Ledger'!A5:E5","updatedRows":1}}
                """, limiter(10));

        store.appendRow(ROW);

        ClientRequest request = requests.get(0);
        assertThat(request.method()).isEqualTo(HttpMethod.POST);
        assertThat(request.url().getPath()).isEqualTo("/v4/spreadsheets/sheet-123/values/'Ledger':append");
        assertThat(request.url().getQuery())
                .contains("valueInputOption=RAW")
                .contains("insertDataOption=INSERT_ROWS");
    }

    @Test
    void appendRow_responseWithoutUpdates_fails() {
        SheetsLedgerStore store = store(HttpStatus.OK, "{\"spreadsheetId\":\"sheet-123\"}", limiter(10));

        assertThatThrownBy(() -> store.appendRow(ROW))
                .isInstanceOf(LedgerStoreException.class)
                .hasMessageContaining("Malformed append response");
    }

    @Test
    @DisplayName("HTTP errors surface as store exceptions with the status code")
    void httpErrorWrapped() {
        SheetsLedgerStore store = store(HttpStatus.TOO_MANY_REQUESTS, "{\"error\":{\"code\":429}}", limiter(10));

        assertThatThrownBy(store::readAll)
                .isInstanceOf(LedgerStoreException.class)
                .hasMessageContaining("HTTP 429");
        assertThatThrownBy(() -> store.appendRow(ROW))
                .isInstanceOf(LedgerStoreException.class)
                .hasMessageContaining("HTTP 429");
    }

    @Test
    @DisplayName("calls beyond the local quota fail without reaching the API")
    void rateLimited() {
        SheetsLedgerStore store = store(HttpStatus.OK, "{\"values\":[]}", limiter(1));

        store.readAll();

        assertThatThrownBy(store::readAll)
                .isInstanceOf(LedgerStoreException.class)
                .hasMessageContaining("rate limiter");
        assertThat(requests).hasSize(1);
    }

    @Test
    void range_doublesSingleQuotes() {
        SheetsLedgerStore store = new SheetsLedgerStore(WebClient.create(), "id", "Mom's ledger", () -> "tok", limiter(1), Duration.ofSeconds(1));

        assertThat(store.range()).isEqualTo("'Mom''s ledger'");
        assertThat(store.describe()).isEqualTo("sheets:id/Mom's ledger");
    }

    @Test
    @DisplayName("HTTP 401 and 403 surface as connection failures so the handle gets dropped")
    void authorisationErrorIsConnectionFailure() {
        SheetsLedgerStore expired = store(HttpStatus.UNAUTHORIZED, "{\"error\":{\"code\":401}}", limiter(10));
        SheetsLedgerStore revoked = store(HttpStatus.FORBIDDEN, "{\"error\":{\"code\":403}}", limiter(10));

        assertThatThrownBy(expired::readAll)
                .isInstanceOf(LedgerConnectionException.class)
                .hasMessageContaining("HTTP 401");
        assertThatThrownBy(() -> revoked.appendRow(ROW))
                .isInstanceOf(LedgerConnectionException.class)
                .hasMessageContaining("HTTP 403");
    }

    @Test
    @DisplayName("each request asks the provider for a token, so rotated tokens are picked up")
    void tokenFetchedPerRequest() {
        AtomicInteger issued = new AtomicInteger();
        SheetsLedgerStore store = store(HttpStatus.OK, "{\"values\":[]}", limiter(10),
                () -> "tok-" + issued.incrementAndGet());

        store.readAll();
        store.readAll();

        assertThat(requests).extracting(r -> r.headers().getFirst("Authorization"))
                .containsExactly("Bearer tok-1", "Bearer tok-2");
    }

    @Test
    void tokenUnavailable_failsBeforeRequest() {
        SheetsLedgerStore store = store(HttpStatus.OK, "{\"values\":[]}", limiter(10), () -> {
            throw new LedgerConnectionException("No access token configured");
        });

        assertThatThrownBy(store::readAll).isInstanceOf(LedgerConnectionException.class);
        assertThat(requests).isEmpty();
    }

    private SheetsLedgerStore store(HttpStatus status, String body, RateLimiter rateLimiter) {
        return store(status, body, rateLimiter, () -> "tok");
    }

    private SheetsLedgerStore store(HttpStatus status, String body, RateLimiter rateLimiter, AccessTokenProvider tokens) {
        WebClient webClient = WebClient.builder()
                .baseUrl("https://sheets.test/v4")
                .exchangeFunction(req -> {
                    requests.add(req);
                    return Mono.just(ClientResponse.create(status)
                            .header("Content-Type", "application/json")
                            .body(body)
                            .build());
                })
                .build();
        return new SheetsLedgerStore(webClient, "sheet-123", "Ledger", tokens, rateLimiter, Duration.ofSeconds(5));
    }

    static RateLimiter limiter(int perMinute) {
        return RateLimiter.of("sheets-test", RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofMinutes(1))
                .limitForPeriod(perMinute)
                .timeoutDuration(Duration.ZERO)
                .build());
    }
}
