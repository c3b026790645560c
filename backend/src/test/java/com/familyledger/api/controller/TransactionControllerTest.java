package com.familyledger.api.controller;

import com.familyledger.domain.Ledger;
import com.familyledger.domain.TransactionDraft;
import com.familyledger.domain.TransactionType;
import com.familyledger.ingestion.classifier.TransactionBucketClassifier;
import com.familyledger.ledger.AppendOutcome;
import com.familyledger.ledger.LedgerAppendService;
import com.familyledger.query.LedgerQueryService;
import com.familyledger.store.LedgerConnectionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@SpringBootTest
@AutoConfigureWebTestClient
class TransactionControllerTest {

    @Autowired
    WebTestClient webTestClient;

    @MockBean
    LedgerQueryService ledgerQueryService;
    @MockBean
    LedgerAppendService ledgerAppendService;

    @Test
    @DisplayName("POST /transactions returns 201 with the confirmation message")
    void appendAccepted() {
        when(ledgerAppendService.append(any())).thenReturn(
                AppendOutcome.accepted(TransactionType.INCOME, "Rp 5.000.000", "Transaction 'Income' of Rp 5.000.000 saved"));

        webTestClient.post().uri("/api/v1/transactions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                        {"date":"2024-01-01","type":"Income","description":"Salary","amount":5000000,"goldGrams":3}
                        """)
                .exchange()
                .expectStatus().isCreated()
                .expectBody()
                .jsonPath("$.status").isEqualTo("ACCEPTED")
                .jsonPath("$.type").isEqualTo("Income")
                .jsonPath("$.formattedAmount").isEqualTo("Rp 5.000.000")
                .jsonPath("$.message").isEqualTo("Transaction 'Income' of Rp 5.000.000 saved");

        ArgumentCaptor<TransactionDraft> draft = ArgumentCaptor.forClass(TransactionDraft.class);
        verify(ledgerAppendService).append(draft.capture());
        assertThat(draft.getValue().date()).isEqualTo(LocalDate.of(2024, 1, 1));
        assertThat(draft.getValue().type()).isEqualTo(TransactionType.INCOME);
        assertThat(draft.getValue().amount()).isEqualByComparingTo("5000000");
        assertThat(draft.getValue().goldGrams()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("missing date defaults to today; gold grams kept for GoldPurchase")
    void appendDefaults() {
        when(ledgerAppendService.append(any())).thenReturn(
                AppendOutcome.accepted(TransactionType.GOLD_PURCHASE, "Rp 900.000", "Transaction 'GoldPurchase' of Rp 900.000 saved"));

        webTestClient.post().uri("/api/v1/transactions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                        {"type":"GoldPurchase","amount":900000,"goldGrams":1.5}
                        """)
                .exchange()
                .expectStatus().isCreated();

        ArgumentCaptor<TransactionDraft> draft = ArgumentCaptor.forClass(TransactionDraft.class);
        verify(ledgerAppendService).append(draft.capture());
        assertThat(draft.getValue().date()).isEqualTo(LocalDate.now());
        assertThat(draft.getValue().goldGrams()).isEqualByComparingTo("1.5");
        assertThat(draft.getValue().description()).isEmpty();
    }

    @Test
    void appendRejected_returns422() {
        when(ledgerAppendService.append(any())).thenReturn(AppendOutcome.rejected("Enter an amount or a gold weight"));

        webTestClient.post().uri("/api/v1/transactions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"type\":\"DailyExpense\",\"amount\":0,\"goldGrams\":0}")
                .exchange()
                .expectStatus().isEqualTo(422)
                .expectBody()
                .jsonPath("$.status").isEqualTo("REJECTED")
                .jsonPath("$.message").isEqualTo("Enter an amount or a gold weight");
    }

    @Test
    void writeFailure_returns502() {
        when(ledgerAppendService.append(any())).thenReturn(AppendOutcome.writeFailed("Google Sheets append failed with HTTP 500"));

        webTestClient.post().uri("/api/v1/transactions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"type\":\"Income\",\"amount\":10}")
                .exchange()
                .expectStatus().isEqualTo(502)
                .expectBody()
                .jsonPath("$.status").isEqualTo("WRITE_FAILED");
    }

    @Test
    @DisplayName("unknown type is a 400 validation error and never reaches the service")
    void unknownType_returns400() {
        webTestClient.post().uri("/api/v1/transactions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"type\":\"income\",\"amount\":10}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_TRANSACTION_TYPE")
                .jsonPath("$.timestamp").exists();

        verify(ledgerAppendService, never()).append(any());
    }

    @Test
    void negativeAmount_returns400() {
        webTestClient.post().uri("/api/v1/transactions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"type\":\"Income\",\"amount\":-5}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_AMOUNT");
    }

    @Test
    void negativeGoldGrams_returns400() {
        webTestClient.post().uri("/api/v1/transactions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"type\":\"GoldPurchase\",\"amount\":10,\"goldGrams\":-1}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_GOLD_GRAMS");
    }

    @Test
    @DisplayName("unreadable JSON body returns 400 INVALID_REQUEST")
    void malformedBody_returns400() {
        webTestClient.post().uri("/api/v1/transactions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"type\":\"Income\",\"amount\":")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_REQUEST")
                .jsonPath("$.message").exists();

        verify(ledgerAppendService, never()).append(any());
    }

    @Test
    void connectionFailure_returns503() {
        when(ledgerAppendService.append(any())).thenThrow(new LedgerConnectionException("No Google Sheets access token configured"));

        webTestClient.post().uri("/api/v1/transactions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"type\":\"Income\",\"amount\":10}")
                .exchange()
                .expectStatus().isEqualTo(503)
                .expectBody()
                .jsonPath("$.error").isEqualTo("LEDGER_UNAVAILABLE");
    }

    @Test
    @DisplayName("GET /transactions lists history items with display strings")
    void history() {
        when(ledgerQueryService.history()).thenReturn(new Ledger(List.of(
                TransactionBucketClassifier.classify(LocalDate.of(2024, 2, 1), "GoldPurchase", "Antam",
                        new BigDecimal("1800000"), new BigDecimal("2")),
                TransactionBucketClassifier.classify(null, "Gift", "", new BigDecimal("5"), BigDecimal.ZERO)
        )).transactions());

        webTestClient.get().uri("/api/v1/transactions")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.count").isEqualTo(2)
                .jsonPath("$.items[0].date").isEqualTo("2024-02-01")
                .jsonPath("$.items[0].type").isEqualTo("GoldPurchase")
                .jsonPath("$.items[0].amountDisplay").isEqualTo("Rp 1.800.000")
                .jsonPath("$.items[0].goldGramsDisplay").isEqualTo("2.00")
                .jsonPath("$.items[1].date").doesNotExist()
                .jsonPath("$.items[1].type").isEqualTo("Gift");
    }
}
