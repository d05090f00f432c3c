package org.healthplatform.warehouse.normalize;

import org.healthplatform.warehouse.config.TransformProperties;
import org.healthplatform.warehouse.exception.EmptyResultException;
import org.healthplatform.warehouse.parse.ParsedRecord;
import org.healthplatform.warehouse.parse.SourceColumns;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Reduces parsed rows to the both-sexes aggregate and projects them onto the canonical row.
 * Filtering and projection are separate calls so the quality gate can run in between.
 */
@Component
public class Normalizer {

    private static final Logger log = LoggerFactory.getLogger(Normalizer.class);

    private final Integer maxRows;

    @Autowired
    public Normalizer(TransformProperties properties) {
        this(properties.getMaxRows());
    }

    public Normalizer(Integer maxRows) {
        if (maxRows != null && maxRows < 1) {
            throw new IllegalArgumentException("transform.max-rows must be at least 1, was " + maxRows);
        }
        this.maxRows = maxRows;
    }

    /**
     * Keeps only both-sexes rows in their original order, then applies the max-rows limit.
     *
     * @throws EmptyResultException if no both-sexes row remains
     */
    public List<ParsedRecord> filter(List<ParsedRecord> records) {
        List<ParsedRecord> retained = records.stream()
            .filter(r -> SexCategory.BOTH.matches(r.getCategory()))
            .collect(Collectors.toList());

        if (retained.isEmpty()) {
            throw new EmptyResultException(String.format(
                "No rows left after filtering %d row(s) for both sexes (%s in %s)",
                records.size(), SourceColumns.CATEGORY, SexCategory.BOTH.getSourceTokens()));
        }
        if (maxRows != null && retained.size() > maxRows) {
            log.warn("Limiting {} filtered rows to {} (transform.max-rows)", retained.size(), maxRows);
            retained = new ArrayList<>(retained.subList(0, maxRows));
        }
        return retained;
    }

    /**
     * Projects validated rows onto the canonical schema, stamping all of them with {@code ingestedAt}.
     * Rows must already have passed the quality gate.
     */
    public List<CanonicalRecord> normalize(List<ParsedRecord> records, LocalDateTime ingestedAt) {
        Objects.requireNonNull(ingestedAt, "ingestedAt");
        List<CanonicalRecord> canonical = new ArrayList<>(records.size());
        for (ParsedRecord record : records) {
            SexCategory sex = SexCategory.fromToken(record.getCategory())
                .orElseThrow(() -> new IllegalArgumentException("Unknown category " + record.getCategory()));
            Double value = record.getValue();
            if (value == null || !Double.isFinite(value)) {
                throw new IllegalArgumentException(String.format(
                    "Unvalidated row %s/%d has no finite value", record.getRegionCode(), record.getTimeDim()));
            }
            canonical.add(CanonicalRecord.builder()
                .countryName(record.getRegionName())
                .countryCode(record.getRegionCode())
                .year(record.getTimeDim())
                .sex(sex)
                .lifeExpectancy(value)
                .ingestedAt(ingestedAt)
                .build());
        }
        return canonical;
    }
}
