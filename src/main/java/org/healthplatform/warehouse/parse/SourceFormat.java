package org.healthplatform.warehouse.parse;

/**
 * Wire format of a raw snapshot.
 */
public enum SourceFormat {
    /** Delimited text with a header row. */
    TABULAR,
    /** JSON record envelope (OData {@code value} array or a bare array). */
    STRUCTURED
}
