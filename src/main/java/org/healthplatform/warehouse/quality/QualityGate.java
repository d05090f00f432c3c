package org.healthplatform.warehouse.quality;

import lombok.Value;
import org.healthplatform.warehouse.exception.QualityException;
import org.healthplatform.warehouse.normalize.SexCategory;
import org.healthplatform.warehouse.parse.ParsedRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Hard stop in front of the load: the filtered table must have a value on every row and
 * no repeated (region code, year, category) key. Nothing is corrected here.
 */
@Component
public class QualityGate {

    private static final Logger log = LoggerFactory.getLogger(QualityGate.class);

    /**
     * Runs both checks to completion.
     *
     * @return the report of a passing table
     * @throws QualityException on missing values (reported first) or duplicate keys
     */
    public QualityReport validate(List<ParsedRecord> records) {
        QualityReport report = inspect(records);
        log.info("Quality checks over {} rows: {} missing value(s), {} duplicate row(s)",
            report.getRowsChecked(), report.getMissingValues(), report.getDuplicateRows());

        if (report.getMissingValues() > 0) {
            throw new QualityException(QualityException.Kind.MISSING_VALUES, report.getMissingValues(), report);
        }
        if (report.getDuplicateRows() > 0) {
            throw new QualityException(QualityException.Kind.DUPLICATE_ROWS, report.getDuplicateRows(), report);
        }
        return report;
    }

    /**
     * Computes the counts without judging them.
     */
    public QualityReport inspect(List<ParsedRecord> records) {
        long missing = 0;
        long duplicates = 0;
        Set<NaturalKey> seen = new HashSet<>();
        for (ParsedRecord record : records) {
            Double value = record.getValue();
            if (value == null || !Double.isFinite(value)) {
                missing++;
            }
            if (!seen.add(NaturalKey.of(record))) {
                duplicates++;
            }
        }
        return new QualityReport(records.size(), missing, duplicates);
    }

    /**
     * Equivalent category tokens ("Both sexes", "SEX_BTSX") compare equal.
     */
    @Value
    private static class NaturalKey {
        String regionCode;
        Integer timeDim;
        Object category;

        static NaturalKey of(ParsedRecord record) {
            Object category = SexCategory.fromToken(record.getCategory())
                .<Object>map(c -> c)
                .orElse(record.getCategory());
            return new NaturalKey(record.getRegionCode(), record.getTimeDim(), category);
        }
    }
}
