package com.familyledger.api.dto;

import java.util.List;

public record TransactionHistoryResponse(List<TransactionItemResponse> items, int count) {
}
