package com.familyledger.api.controller;

import com.familyledger.api.dto.AppendTransactionRequest;
import com.familyledger.api.dto.AppendTransactionResponse;
import com.familyledger.api.dto.TransactionHistoryResponse;
import com.familyledger.api.dto.TransactionItemResponse;
import com.familyledger.common.RupiahFormatter;
import com.familyledger.domain.LedgerTransaction;
import com.familyledger.domain.TransactionDraft;
import com.familyledger.domain.TransactionType;
import com.familyledger.ledger.AppendOutcome;
import com.familyledger.ledger.LedgerAppendService;
import com.familyledger.query.LedgerQueryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * GET /transactions (history, newest first) and POST /transactions (append one row).
 */
@RestController
@RequestMapping("/api/v1/transactions")
@RequiredArgsConstructor
public class TransactionController {

    private final LedgerQueryService ledgerQueryService;
    private final LedgerAppendService ledgerAppendService;

    @GetMapping
    public Mono<ResponseEntity<TransactionHistoryResponse>> getTransactions() {
        return Mono.fromCallable(() -> {
                    List<TransactionItemResponse> items = ledgerQueryService.history().stream()
                            .map(TransactionController::toItem)
                            .toList();
                    return ResponseEntity.ok(new TransactionHistoryResponse(items, items.size()));
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping
    public Mono<ResponseEntity<AppendTransactionResponse>> appendTransaction(@Valid @RequestBody AppendTransactionRequest request) {
        TransactionDraft draft = toDraft(request);
        return Mono.fromCallable(() -> toResponse(ledgerAppendService.append(draft)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    static TransactionDraft toDraft(AppendTransactionRequest request) {
        TransactionType type = TransactionType.fromLabel(request.type())
                .orElseThrow(() -> new IllegalArgumentException("Unknown transaction type: " + request.type()));
        BigDecimal goldGrams = type == TransactionType.GOLD_PURCHASE ? request.goldGrams() : BigDecimal.ZERO;
        return new TransactionDraft(
                request.date() != null ? request.date() : LocalDate.now(),
                type,
                request.description() != null ? request.description().trim() : "",
                request.amount(),
                goldGrams);
    }

    private static ResponseEntity<AppendTransactionResponse> toResponse(AppendOutcome outcome) {
        AppendTransactionResponse body = new AppendTransactionResponse(
                outcome.getStatus().name(),
                outcome.getType() != null ? outcome.getType().getLabel() : null,
                outcome.getFormattedAmount(),
                outcome.getMessage());
        HttpStatus status = switch (outcome.getStatus()) {
            case ACCEPTED -> HttpStatus.CREATED;
            case REJECTED -> HttpStatus.UNPROCESSABLE_ENTITY;
            case WRITE_FAILED -> HttpStatus.BAD_GATEWAY;
        };
        return ResponseEntity.status(status).body(body);
    }

    private static TransactionItemResponse toItem(LedgerTransaction tx) {
        return new TransactionItemResponse(
                tx.date(),
                tx.rawType(),
                tx.description(),
                tx.amount(),
                tx.goldGrams(),
                RupiahFormatter.format(tx.amount()),
                RupiahFormatter.formatGrams(tx.goldGrams()));
    }
}
