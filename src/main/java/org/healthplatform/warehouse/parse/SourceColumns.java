package org.healthplatform.warehouse.parse;

import java.util.List;

/**
 * Field names used by the WHO GHO export in both the CSV and the OData JSON form.
 */
public final class SourceColumns {

    public static final String REGION_NAME = "SpatialDim";
    public static final String REGION_CODE = "SpatialDimCode";
    public static final String TIME_DIM = "TimeDim";
    public static final String CATEGORY = "Dim1";
    public static final String VALUE = "NumericValue";

    /** Columns that must be present, in addition to at least one region column. */
    public static final List<String> REQUIRED = List.of(TIME_DIM, CATEGORY, VALUE);

    private SourceColumns() {
    }
}
