package com.familyledger.ingestion;

import java.util.List;

/**
 * Non-fatal load failure. The ledger that accompanies it is always empty.
 */
public record LedgerLoadError(Kind kind, String message, List<String> missingColumns) {

    public enum Kind {
        /** A required column is absent from the source data. */
        SCHEMA,
        /** The store could not be read. */
        READ
    }

    public LedgerLoadError {
        missingColumns = missingColumns == null ? List.of() : List.copyOf(missingColumns);
    }

    public static LedgerLoadError schema(List<String> missingColumns) {
        String message = "Missing ledger column(s) " + String.join(", ", missingColumns)
                + "; check the header row of the ledger";
        return new LedgerLoadError(Kind.SCHEMA, message, missingColumns);
    }

    public static LedgerLoadError read(String reason) {
        return new LedgerLoadError(Kind.READ, "Could not read the ledger: " + reason, List.of());
    }
}
