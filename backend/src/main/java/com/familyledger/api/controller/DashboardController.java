package com.familyledger.api.controller;

import com.familyledger.api.dto.DashboardResponse;
import com.familyledger.query.LedgerQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * GET /dashboard: totals, trend and allocation over the cached ledger.
 */
@RestController
@RequestMapping("/api/v1/dashboard")
@RequiredArgsConstructor
public class DashboardController {

    private final LedgerQueryService ledgerQueryService;

    @GetMapping
    public Mono<ResponseEntity<DashboardResponse>> getDashboard() {
        return Mono.fromCallable(() -> ResponseEntity.ok(DashboardResponse.from(ledgerQueryService.currentView())))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
