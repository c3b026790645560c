package com.familyledger.ledger;

import com.familyledger.domain.TransactionType;
import lombok.Getter;

/**
 * Result of an append attempt. Only an accepted outcome carries the type and the formatted amount.
 */
@Getter
public class AppendOutcome {

    public enum Status {
        ACCEPTED,
        REJECTED,
        WRITE_FAILED
    }

    private final Status status;
    private final TransactionType type;
    private final String formattedAmount;
    private final String message;

    private AppendOutcome(Status status, TransactionType type, String formattedAmount, String message) {
        this.status = status;
        this.type = type;
        this.formattedAmount = formattedAmount;
        this.message = message;
    }

    public static AppendOutcome accepted(TransactionType type, String formattedAmount, String message) {
        return new AppendOutcome(Status.ACCEPTED, type, formattedAmount, message);
    }

    public static AppendOutcome rejected(String reason) {
        return new AppendOutcome(Status.REJECTED, null, null, reason);
    }

    public static AppendOutcome writeFailed(String reason) {
        return new AppendOutcome(Status.WRITE_FAILED, null, null, reason);
    }

    public boolean isAccepted() {
        return status == Status.ACCEPTED;
    }
}
