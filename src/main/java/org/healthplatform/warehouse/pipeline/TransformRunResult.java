package org.healthplatform.warehouse.pipeline;

import lombok.Builder;
import lombok.Value;
import org.healthplatform.warehouse.parse.SourceFormat;
import org.healthplatform.warehouse.quality.QualityReport;

import java.time.LocalDateTime;

/**
 * Summary of a successful run.
 */
@Value
@Builder
public class TransformRunResult {
    String objectName;
    SourceFormat format;
    long bytesFetched;
    long rowsParsed;
    long rowsRetained;
    QualityReport qualityReport;
    long rowsWritten;
    LocalDateTime ingestedAt;
    PipelineState state;
}
