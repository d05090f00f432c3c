package org.healthplatform.warehouse.exception;

import org.healthplatform.warehouse.quality.QualityReport;

/**
 * The batch failed the quality gate. Carries the failing check and its count,
 * plus the full report with the result of every check.
 */
public class QualityException extends TransformException {

    public enum Kind {
        MISSING_VALUES("MissingValues"),
        DUPLICATE_ROWS("DuplicateRows");

        private final String label;

        Kind(String label) {
            this.label = label;
        }

        public String getLabel() {
            return label;
        }
    }

    private final Kind kind;
    private final long count;
    private final QualityReport report;

    public QualityException(Kind kind, long count, QualityReport report) {
        super(String.format("Quality gate failed: %s count=%d (rows checked: %d)",
            kind.getLabel(), count, report.getRowsChecked()));
        this.kind = kind;
        this.count = count;
        this.report = report;
    }

    public Kind getKind() {
        return kind;
    }

    public long getCount() {
        return count;
    }

    public QualityReport getReport() {
        return report;
    }

    @Override
    public String getDetail() {
        return kind.getLabel() + " count=" + count;
    }
}
