package org.healthplatform.warehouse.parse;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.healthplatform.warehouse.exception.FormatException;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the CSV export: a header row naming the source columns, one observation per line.
 * Optional columns may be absent; their fields are then null.
 */
@Component
public class TabularRecordParser extends AbstractRecordParser {

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
        .setHeader()
        .setSkipHeaderRecord(true)
        .setIgnoreEmptyLines(true)
        .setAllowMissingColumnNames(true)
        .setTrim(true)
        .build();

    @Override
    public SourceFormat getFormat() {
        return SourceFormat.TABULAR;
    }

    @Override
    public List<ParsedRecord> parse(RawBatch batch) {
        try (Reader reader = skipByteOrderMark(
                 new BufferedReader(new InputStreamReader(batch.openStream(), StandardCharsets.UTF_8)));
             CSVParser parser = FORMAT.parse(reader)) {

            requireStructuralColumns(parser.getHeaderNames());

            List<ParsedRecord> records = new ArrayList<>();
            for (CSVRecord csvRecord : parser) {
                long row = csvRecord.getRecordNumber();
                records.add(toRecord(row,
                    field(csvRecord, SourceColumns.REGION_NAME),
                    field(csvRecord, SourceColumns.REGION_CODE),
                    field(csvRecord, SourceColumns.TIME_DIM),
                    field(csvRecord, SourceColumns.CATEGORY),
                    field(csvRecord, SourceColumns.VALUE)));
            }
            return records;
        } catch (IOException | UncheckedIOException | IllegalArgumentException | IllegalStateException e) {
            throw new FormatException("Unreadable CSV in " + batch.getObjectName() + ": " + e.getMessage(), e);
        }
    }

    private static String field(CSVRecord csvRecord, String column) {
        return csvRecord.isSet(column) ? csvRecord.get(column) : null;
    }

    private static Reader skipByteOrderMark(BufferedReader reader) throws IOException {
        reader.mark(1);
        if (reader.read() != '\uFEFF') {
            reader.reset();
        }
        return reader;
    }
}
