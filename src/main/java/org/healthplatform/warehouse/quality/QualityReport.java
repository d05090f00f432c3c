package org.healthplatform.warehouse.quality;

import lombok.Value;

/**
 * Outcome of every quality check over one table.
 */
@Value
public class QualityReport {
    long rowsChecked;
    /** Rows with a null or non-finite value. */
    long missingValues;
    /** Rows whose natural key already appeared earlier in the table. */
    long duplicateRows;

    public boolean isPassed() {
        return missingValues == 0 && duplicateRows == 0;
    }
}
