package com.familyledger.ledger;

import com.familyledger.cache.ConnectionCache;
import com.familyledger.cache.LedgerCache;
import com.familyledger.common.RupiahFormatter;
import com.familyledger.domain.LedgerRow;
import com.familyledger.domain.TransactionDraft;
import com.familyledger.store.LedgerConnectionException;
import com.familyledger.store.LedgerStore;
import com.familyledger.store.LedgerStoreException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Validates a draft, writes it as one row at the end of the ledger and invalidates the ledger cache on success.
 * Writes are never retried.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerAppendService {

    static final String NO_VALUE_MESSAGE = "Enter an amount or a gold weight";

    private final ConnectionCache connectionCache;
    private final LedgerCache ledgerCache;

    /**
     * @throws LedgerConnectionException when the store cannot be opened, or rejects the write as unauthorised
     */
    public AppendOutcome append(TransactionDraft draft) {
        if (draft.hasNoValue()) {
            log.warn("Rejected draft without amount or gold weight (type={})", draft.type());
            return AppendOutcome.rejected(NO_VALUE_MESSAGE);
        }
        LedgerStore store = connectionCache.get();
        LedgerRow row = LedgerRow.fromDraft(draft);
        try {
            store.appendRow(row);
        } catch (LedgerConnectionException e) {
            log.error("Connection to {} lost during append: {}", store.describe(), e.getMessage());
            connectionCache.invalidate();
            throw e;
        } catch (LedgerStoreException e) {
            log.error("Append to {} failed: {}", store.describe(), e.getMessage(), e);
            return AppendOutcome.writeFailed(e.getMessage());
        }
        ledgerCache.invalidate();

        String formattedAmount = RupiahFormatter.format(draft.amount());
        String label = draft.type() != null ? draft.type().getLabel() : "";
        String message = "Transaction '" + label + "' of " + formattedAmount + " saved";
        log.info("Appended {} row dated {} to {}", label, row.isoDate(), store.describe());
        return AppendOutcome.accepted(draft.type(), formattedAmount, message);
    }
}
