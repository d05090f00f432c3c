package org.healthplatform.warehouse.staging;

import java.util.List;

/**
 * Object store holding the raw snapshots written by the ingestion job.
 *
 * @see S3StagingStore
 */
public interface StagingStore {

    /**
     * Lists every object under the prefix, recursively.
     *
     * @throws org.healthplatform.warehouse.exception.StoreException if the store cannot be listed
     */
    List<StagedObject> list(String prefix);

    /**
     * Reads the full content of one object.
     *
     * @throws org.healthplatform.warehouse.exception.StoreException if the object cannot be read
     */
    byte[] fetch(String name);
}
