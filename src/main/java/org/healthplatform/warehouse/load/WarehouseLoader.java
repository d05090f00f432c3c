package org.healthplatform.warehouse.load;

import org.healthplatform.warehouse.normalize.CanonicalRecord;

import java.util.List;

/**
 * Appends one canonical batch to the warehouse table, all rows or none.
 */
public interface WarehouseLoader {

    /**
     * @return number of rows committed
     * @throws org.healthplatform.warehouse.exception.SchemaMismatchException if the target table's
     *         columns differ from {@link CanonicalRecord#COLUMNS}
     * @throws org.healthplatform.warehouse.exception.LoadException if the copy or commit fails
     */
    long load(List<CanonicalRecord> records);
}
