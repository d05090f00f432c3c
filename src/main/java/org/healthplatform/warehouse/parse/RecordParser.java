package org.healthplatform.warehouse.parse;

import java.util.List;

/**
 * Turns the bytes of one snapshot into parsed rows. Implementations exist per
 * {@link SourceFormat} and must all yield the same columns for the same logical data.
 */
public interface RecordParser {

    SourceFormat getFormat();

    /**
     * @throws org.healthplatform.warehouse.exception.FormatException if the payload is unreadable
     *         or a structural column cannot be resolved
     */
    List<ParsedRecord> parse(RawBatch batch);
}
