package com.familyledger.api.controller;

import com.familyledger.api.dto.DashboardResponse;
import com.familyledger.query.LedgerQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * POST /ledger/reload: re-reads the store now instead of waiting for the cache to expire.
 */
@RestController
@RequestMapping("/api/v1/ledger")
@RequiredArgsConstructor
public class LedgerController {

    private final LedgerQueryService ledgerQueryService;

    @PostMapping("/reload")
    public Mono<ResponseEntity<DashboardResponse>> reload() {
        return Mono.fromCallable(() -> ResponseEntity.ok(DashboardResponse.from(ledgerQueryService.reload())))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
