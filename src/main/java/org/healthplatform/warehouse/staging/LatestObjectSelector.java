package org.healthplatform.warehouse.staging;

import org.healthplatform.warehouse.exception.StoreException;

import java.util.Comparator;
import java.util.List;

/**
 * Picks the snapshot a run transforms: greatest {@code lastModified}, and among objects
 * modified at the same instant the lexicographically greatest name.
 */
public final class LatestObjectSelector {

    static final Comparator<StagedObject> LATEST_LAST = Comparator
        .comparing(StagedObject::getLastModified)
        .thenComparing(StagedObject::getName);

    private LatestObjectSelector() {
    }

    public static StagedObject select(String prefix, List<StagedObject> objects) {
        return objects.stream()
            .max(LATEST_LAST)
            .orElseThrow(() -> new StoreException("No objects found under prefix '" + prefix + "'"));
    }
}
