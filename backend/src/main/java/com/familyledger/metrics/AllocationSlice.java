package com.familyledger.metrics;

import com.familyledger.domain.TransactionType;

import java.math.BigDecimal;

/**
 * Total amount that went to one outflow category (spending, stock savings or gold).
 */
public record AllocationSlice(TransactionType type, BigDecimal amount) {
}
