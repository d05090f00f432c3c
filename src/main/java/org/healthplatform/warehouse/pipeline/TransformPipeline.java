package org.healthplatform.warehouse.pipeline;

import org.healthplatform.warehouse.config.TransformProperties;
import org.healthplatform.warehouse.exception.TransformException;
import org.healthplatform.warehouse.load.WarehouseLoader;
import org.healthplatform.warehouse.normalize.CanonicalRecord;
import org.healthplatform.warehouse.normalize.Normalizer;
import org.healthplatform.warehouse.parse.ParsedRecord;
import org.healthplatform.warehouse.parse.RawBatch;
import org.healthplatform.warehouse.parse.RecordParsers;
import org.healthplatform.warehouse.quality.QualityGate;
import org.healthplatform.warehouse.quality.QualityReport;
import org.healthplatform.warehouse.repository.LifeExpectancyRepository;
import org.healthplatform.warehouse.staging.LatestObjectSelector;
import org.healthplatform.warehouse.staging.StagedObject;
import org.healthplatform.warehouse.staging.StagingStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * One-shot transform of the latest staged snapshot into the warehouse:
 * fetch, detect, parse, filter, validate, normalize, load.
 *
 * <p>Single-threaded and all-or-nothing. Every stage consumes the previous stage's full output;
 * the first error stops the run, and nothing reaches the warehouse unless every earlier stage
 * succeeded. No retries happen here.
 */
@Service
public class TransformPipeline {

    private static final Logger log = LoggerFactory.getLogger(TransformPipeline.class);

    private final StagingStore stagingStore;
    private final RecordParsers parsers;
    private final Normalizer normalizer;
    private final QualityGate qualityGate;
    private final WarehouseLoader loader;
    private final LifeExpectancyRepository repository;
    private final String prefix;
    private final Clock clock;

    public TransformPipeline(StagingStore stagingStore, RecordParsers parsers, Normalizer normalizer,
                             QualityGate qualityGate, WarehouseLoader loader,
                             LifeExpectancyRepository repository, TransformProperties properties, Clock clock) {
        this.stagingStore = stagingStore;
        this.parsers = parsers;
        this.normalizer = normalizer;
        this.qualityGate = qualityGate;
        this.loader = loader;
        this.repository = repository;
        this.prefix = properties.getStaging().getPrefix();
        this.clock = clock;
    }

    /**
     * @throws TransformFailedException naming the stage that failed and its typed error
     */
    public TransformRunResult run() {
        // Captured once so every row of the batch carries the same stamp
        LocalDateTime ingestedAt = LocalDateTime.now(clock).truncatedTo(ChronoUnit.MICROS);
        long runStarted = System.currentTimeMillis();
        log.info("Starting transformation run {} for prefix '{}'", ingestedAt, prefix);

        TransformRunResult.TransformRunResultBuilder result = TransformRunResult.builder().ingestedAt(ingestedAt);
        PipelineState state = PipelineState.FETCHING;
        try {
            long t0 = System.currentTimeMillis();
            List<StagedObject> objects = stagingStore.list(prefix);
            StagedObject latest = LatestObjectSelector.select(prefix, objects);
            byte[] payload = stagingStore.fetch(latest.getName());
            log.info("Staging store: {} object(s), fetched {} ({} bytes) in {} ms",
                objects.size(), latest.getName(), payload.length, System.currentTimeMillis() - t0);
            result.objectName(latest.getName()).bytesFetched(payload.length);

            state = state.next();
            RawBatch batch = RawBatch.of(latest.getName(), payload);
            log.info("Detected {} format", batch.getFormat());
            result.format(batch.getFormat());

            state = state.next();
            t0 = System.currentTimeMillis();
            List<ParsedRecord> parsed = parsers.parse(batch);
            log.info("Parsed {} rows in {} ms", parsed.size(), System.currentTimeMillis() - t0);
            result.rowsParsed(parsed.size());

            state = state.next();
            List<ParsedRecord> retained = normalizer.filter(parsed);
            log.info("Filter kept {} of {} rows", retained.size(), parsed.size());
            result.rowsRetained(retained.size());

            state = state.next();
            QualityReport report = qualityGate.validate(retained);
            result.qualityReport(report);

            state = state.next();
            List<CanonicalRecord> canonical = normalizer.normalize(retained, ingestedAt);

            state = state.next();
            long written = loader.load(canonical);
            result.rowsWritten(written);

            state = state.next();
            logWarehouseTotals(ingestedAt, written);
            log.info("Transformation completed in {} ms", System.currentTimeMillis() - runStarted);
            return result.state(state).build();
        } catch (TransformException e) {
            log.error("Transformation failed while {}: {}", state.getLabel(), e.getDetail());
            throw new TransformFailedException(state, e);
        }
    }

    /**
     * Read-back after commit. The batch is already durable here, so a failing query must not fail the run.
     */
    private void logWarehouseTotals(LocalDateTime ingestedAt, long written) {
        try {
            long inBatch = repository.countByIngestedAt(ingestedAt);
            if (inBatch != written) {
                log.warn("Warehouse holds {} rows stamped {} but {} were written; another writer may share the table",
                    inBatch, ingestedAt, written);
            }
            log.info("Warehouse holds {} rows for batch {} ({} in total)", inBatch, ingestedAt, repository.count());
        } catch (DataAccessException e) {
            log.warn("Batch {} committed ({} rows) but the warehouse totals could not be read: {}",
                ingestedAt, written, e.getMessage());
        }
    }
}
