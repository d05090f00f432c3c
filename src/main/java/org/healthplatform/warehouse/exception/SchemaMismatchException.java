package org.healthplatform.warehouse.exception;

import java.util.List;

/**
 * The target table's declared columns do not match the canonical column order.
 */
public class SchemaMismatchException extends TransformException {

    private final List<String> expectedColumns;
    private final List<String> actualColumns;

    public SchemaMismatchException(String table, List<String> expectedColumns, List<String> actualColumns) {
        super(String.format("Table %s has columns %s but the canonical row is %s",
            table, actualColumns, expectedColumns));
        this.expectedColumns = List.copyOf(expectedColumns);
        this.actualColumns = List.copyOf(actualColumns);
    }

    public List<String> getExpectedColumns() {
        return expectedColumns;
    }

    public List<String> getActualColumns() {
        return actualColumns;
    }

    @Override
    public String getDetail() {
        return "SchemaMismatch expected=" + expectedColumns + " actual=" + actualColumns;
    }
}
