package org.healthplatform.warehouse.staging;

import lombok.Value;

import java.time.Instant;

/**
 * One entry of a staging store listing.
 */
@Value
public class StagedObject {
    String name;
    Instant lastModified;
    long size;
}
