package com.familyledger.ingestion;

import com.familyledger.domain.Ledger;
import com.familyledger.domain.LedgerColumns;
import com.familyledger.domain.LedgerTransaction;
import com.familyledger.ingestion.classifier.TransactionBucketClassifier;
import com.familyledger.ingestion.normalizer.CellCoercion;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns raw header-keyed records into a {@link Ledger}.
 * <p>
 * All-or-nothing: if any required column is absent no row is processed and the result carries a schema error.
 * Otherwise every row is kept, in source order, with unparseable cells degraded to null (date) or zero (numbers).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LedgerLoader {

    private final LedgerColumns columns;

    public LedgerLoadResult load(List<Map<String, Object>> rawRows) {
        if (rawRows == null || rawRows.isEmpty()) {
            return LedgerLoadResult.ok(Ledger.empty());
        }
        List<String> missing = missingColumns(rawRows);
        if (!missing.isEmpty()) {
            log.warn("Ledger schema check failed, missing columns {}", missing);
            return LedgerLoadResult.failed(LedgerLoadError.schema(missing));
        }

        List<LedgerTransaction> transactions = new ArrayList<>(rawRows.size());
        int undated = 0;
        int unknownType = 0;
        for (Map<String, Object> row : rawRows) {
            LedgerTransaction tx = toTransaction(row);
            if (!tx.hasDate()) undated++;
            if (tx.type() == null) unknownType++;
            transactions.add(tx);
        }
        log.debug("Loaded {} ledger rows ({} without a valid date, {} with an unknown type)",
                transactions.size(), undated, unknownType);
        return LedgerLoadResult.ok(new Ledger(transactions));
    }

    private List<String> missingColumns(List<Map<String, Object>> rawRows) {
        Set<String> present = new HashSet<>();
        for (Map<String, Object> row : rawRows) {
            if (row != null) {
                present.addAll(row.keySet());
            }
        }
        return columns.inOrder().stream()
                .filter(c -> !present.contains(c))
                .toList();
    }

    private LedgerTransaction toTransaction(Map<String, Object> row) {
        Map<String, Object> cells = row != null ? row : Map.of();
        return TransactionBucketClassifier.classify(
                CellCoercion.toDate(cells.get(columns.date())),
                CellCoercion.toText(cells.get(columns.type())),
                CellCoercion.toText(cells.get(columns.description())),
                CellCoercion.toAmount(cells.get(columns.amount())),
                CellCoercion.toAmount(cells.get(columns.goldGrams())));
    }
}
