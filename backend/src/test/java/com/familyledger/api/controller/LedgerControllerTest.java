package com.familyledger.api.controller;

import com.familyledger.domain.Ledger;
import com.familyledger.metrics.MetricsAggregator;
import com.familyledger.query.DashboardView;
import com.familyledger.query.LedgerQueryService;
import com.familyledger.query.LedgerStatus;
import com.familyledger.store.LedgerConnectionException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LedgerControllerTest {

    @Mock
    LedgerQueryService ledgerQueryService;

    @InjectMocks
    LedgerController ledgerController;

    @Test
    void reload_emitsRefreshedDashboard() {
        MetricsAggregator aggregator = new MetricsAggregator(BigDecimal.ZERO);
        when(ledgerQueryService.reload())
                .thenReturn(new DashboardView(LedgerStatus.EMPTY, Ledger.empty(), aggregator.aggregate(Ledger.empty()), null));

        StepVerifier.create(ledgerController.reload())
                .assertNext(response -> {
                    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
                    assertThat(response.getBody().status()).isEqualTo("EMPTY");
                    assertThat(response.getBody().transactionCount()).isZero();
                })
                .verifyComplete();
    }

    @Test
    void reload_connectionFailure_isErrorSignal() {
        when(ledgerQueryService.reload()).thenThrow(new LedgerConnectionException("offline"));

        StepVerifier.create(ledgerController.reload())
                .expectError(LedgerConnectionException.class)
                .verify();
    }
}
