package org.healthplatform.warehouse.parse;

import org.healthplatform.warehouse.exception.FormatException;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Column resolution and value conversion shared by both parsers, so that a row reads
 * the same whether it arrived as CSV text or as JSON.
 */
public abstract class AbstractRecordParser implements RecordParser {

    /**
     * Fails unless the structural columns can be resolved from the names the source provides.
     */
    protected void requireStructuralColumns(Collection<String> available) {
        List<String> missing = new ArrayList<>();
        if (!available.contains(SourceColumns.REGION_NAME) && !available.contains(SourceColumns.REGION_CODE)) {
            missing.add(SourceColumns.REGION_NAME + "|" + SourceColumns.REGION_CODE);
        }
        for (String column : SourceColumns.REQUIRED) {
            if (!available.contains(column)) {
                missing.add(column);
            }
        }
        if (!missing.isEmpty()) {
            throw new FormatException(String.format("%s source is missing required column(s) %s",
                getFormat(), missing));
        }
    }

    /**
     * Builds a record from the raw text of its fields. A missing region name falls back to the
     * code and vice versa.
     *
     * @param row 1-based row number, for error messages
     */
    protected ParsedRecord toRecord(long row, String regionName, String regionCode,
                                    String timeDim, String category, String value) {
        String name = blankToNull(regionName);
        String code = blankToNull(regionCode);
        return ParsedRecord.builder()
            .regionName(name != null ? name : code)
            .regionCode(code != null ? code : name)
            .timeDim(parseTimeDim(row, timeDim))
            .category(blankToNull(category))
            .value(parseValue(row, value))
            .build();
    }

    private Integer parseTimeDim(long row, String text) {
        String trimmed = blankToNull(text);
        if (trimmed == null) {
            throw new FormatException(String.format("Row %d: %s is empty", row, SourceColumns.TIME_DIM));
        }
        try {
            return new BigDecimal(trimmed).intValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw new FormatException(String.format("Row %d: %s '%s' is not a whole year",
                row, SourceColumns.TIME_DIM, trimmed), e);
        }
    }

    private Double parseValue(long row, String text) {
        String trimmed = blankToNull(text);
        if (trimmed == null) {
            return null;
        }
        try {
            return Double.valueOf(trimmed);
        } catch (NumberFormatException e) {
            throw new FormatException(String.format("Row %d: %s '%s' is not numeric",
                row, SourceColumns.VALUE, trimmed), e);
        }
    }

    private static String blankToNull(String text) {
        if (text == null) {
            return null;
        }
        String trimmed = text.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
