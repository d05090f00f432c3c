package org.healthplatform.warehouse.parse;

import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Dispatches a raw batch to the parser registered for its detected format.
 */
@Component
public class RecordParsers {

    private final Map<SourceFormat, RecordParser> byFormat = new EnumMap<>(SourceFormat.class);

    public RecordParsers(List<RecordParser> parsers) {
        for (RecordParser parser : parsers) {
            RecordParser previous = byFormat.put(parser.getFormat(), parser);
            if (previous != null) {
                throw new IllegalStateException("Two parsers registered for " + parser.getFormat() + ": "
                    + previous.getClass().getSimpleName() + ", " + parser.getClass().getSimpleName());
            }
        }
        for (SourceFormat format : SourceFormat.values()) {
            if (!byFormat.containsKey(format)) {
                throw new IllegalStateException("No parser registered for " + format);
            }
        }
    }

    public List<ParsedRecord> parse(RawBatch batch) {
        return byFormat.get(batch.getFormat()).parse(batch);
    }
}
