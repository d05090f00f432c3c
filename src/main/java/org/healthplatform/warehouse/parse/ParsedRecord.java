package org.healthplatform.warehouse.parse;

import lombok.Builder;
import lombok.Value;

/**
 * A source row mapped onto the five semantic columns, whichever format it came from.
 * Only {@code value} is expected to be null on otherwise well-formed rows.
 */
@Value
@Builder
public class ParsedRecord {
    String regionName;
    String regionCode;
    Integer timeDim;
    String category;
    Double value;
}
