package com.sparky.suppress.csv;

import com.sparky.suppress.model.SuppressionRecord;

/**
 * Result of normalizing one data row.
 *
 * @param lineNumber      file line the row ended on
 * @param record          the record built from the row; recipient is the raw value when {@code valid} is false
 * @param valid           whether the recipient passed address validation
 * @param typeDisposition where the record's type came from
 */
public record NormalizedRecord(long lineNumber, SuppressionRecord record, boolean valid, TypeDisposition typeDisposition) {

    public enum TypeDisposition {
        /** resolved from the {@code type} column */
        FROM_TYPE,
        /** resolved from the deprecated {@code transactional} / {@code non_transactional} pair */
        FROM_FLAGS,
        /** neither resolved, configured default applied */
        DEFAULTED
    }

    public boolean isDefaulted() {
        return typeDisposition == TypeDisposition.DEFAULTED;
    }
}
