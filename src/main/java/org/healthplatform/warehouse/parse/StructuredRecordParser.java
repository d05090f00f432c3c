package org.healthplatform.warehouse.parse;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import org.healthplatform.warehouse.exception.FormatException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads the OData JSON export: {@code {"value": [ {...}, ... ]}}, or a bare array of the same
 * objects. A column counts as present if any object in the sequence carries it.
 */
@Component
public class StructuredRecordParser extends AbstractRecordParser {

    static final String ENVELOPE_FIELD = "value";

    private final ObjectReader reader;

    public StructuredRecordParser(ObjectMapper objectMapper) {
        // A second document or stray text after the root value makes the whole payload malformed
        this.reader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    @Override
    public SourceFormat getFormat() {
        return SourceFormat.STRUCTURED;
    }

    @Override
    public List<ParsedRecord> parse(RawBatch batch) {
        JsonNode root = readTree(batch);
        JsonNode rows = extractRows(root, batch.getObjectName());

        Set<String> columns = new LinkedHashSet<>();
        for (JsonNode row : rows) {
            if (!row.isObject()) {
                throw new FormatException("Expected JSON objects in the record sequence of "
                    + batch.getObjectName() + ", found " + row.getNodeType());
            }
            Iterator<String> names = row.fieldNames();
            names.forEachRemaining(columns::add);
        }
        requireStructuralColumns(columns);

        List<ParsedRecord> records = new ArrayList<>(rows.size());
        long rowNumber = 0;
        for (JsonNode row : rows) {
            rowNumber++;
            records.add(toRecord(rowNumber,
                text(row, SourceColumns.REGION_NAME),
                text(row, SourceColumns.REGION_CODE),
                text(row, SourceColumns.TIME_DIM),
                text(row, SourceColumns.CATEGORY),
                text(row, SourceColumns.VALUE)));
        }
        return records;
    }

    private JsonNode readTree(RawBatch batch) {
        try (InputStream in = batch.openStream()) {
            JsonNode root = reader.readTree(in);
            if (root == null || root.isMissingNode()) {
                throw new FormatException("Empty JSON document in " + batch.getObjectName());
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new FormatException("Malformed JSON in " + batch.getObjectName() + ": "
                + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new FormatException("Unreadable JSON in " + batch.getObjectName(), e);
        }
    }

    private static JsonNode extractRows(JsonNode root, String objectName) {
        JsonNode rows;
        if (root.isArray()) {
            rows = root;
        } else if (root.isObject() && root.path(ENVELOPE_FIELD).isArray()) {
            rows = root.get(ENVELOPE_FIELD);
        } else {
            throw new FormatException("JSON in " + objectName + " has no '" + ENVELOPE_FIELD + "' array");
        }
        if (rows.isEmpty()) {
            throw new FormatException("JSON record sequence in " + objectName + " is empty");
        }
        return rows;
    }

    private static String text(JsonNode row, String field) {
        JsonNode node = row.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isContainerNode()) {
            throw new FormatException("Field " + field + " holds a nested " + node.getNodeType());
        }
        return node.asText();
    }
}
