package org.healthplatform.warehouse.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.healthplatform.warehouse.config.TransformProperties;
import org.healthplatform.warehouse.exception.EmptyResultException;
import org.healthplatform.warehouse.exception.FormatException;
import org.healthplatform.warehouse.exception.LoadException;
import org.healthplatform.warehouse.exception.QualityException;
import org.healthplatform.warehouse.exception.StoreException;
import org.healthplatform.warehouse.load.WarehouseLoader;
import org.healthplatform.warehouse.normalize.CanonicalRecord;
import org.healthplatform.warehouse.normalize.Normalizer;
import org.healthplatform.warehouse.normalize.SexCategory;
import org.healthplatform.warehouse.parse.RecordParsers;
import org.healthplatform.warehouse.parse.SourceFormat;
import org.healthplatform.warehouse.parse.StructuredRecordParser;
import org.healthplatform.warehouse.parse.TabularRecordParser;
import org.healthplatform.warehouse.quality.QualityGate;
import org.healthplatform.warehouse.repository.LifeExpectancyRepository;
import org.healthplatform.warehouse.staging.StagedObject;
import org.healthplatform.warehouse.staging.StagingStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@DisplayName("TransformPipeline Unit Tests")
class TransformPipelineTest {

    private static final Instant RUN_STARTED = Instant.parse("2026-10-18T06:00:00Z");
    private static final LocalDateTime RUN_TS = LocalDateTime.ofInstant(RUN_STARTED, ZoneOffset.UTC);
    private static final String LATEST = "who_life_expectancy/ingestion_date=2026-10-18/life_expectancy.json";

    private StagingStore stagingStore;
    private WarehouseLoader loader;
    private LifeExpectancyRepository repository;
    private List<CanonicalRecord> loaded;

    @BeforeEach
    void setUp() {
        stagingStore = mock(StagingStore.class);
        loader = mock(WarehouseLoader.class);
        repository = mock(LifeExpectancyRepository.class);
        loaded = new ArrayList<>();
        when(loader.load(anyList())).thenAnswer(invocation -> {
            List<CanonicalRecord> records = invocation.getArgument(0);
            loaded.addAll(records);
            return (long) records.size();
        });
        when(repository.countByIngestedAt(any())).thenAnswer(invocation -> (long) loaded.size());
    }

    @Test
    @DisplayName("Scenario A: structured input loads one canonical both-sexes row")
    void shouldLoadStructuredInput() {
        // Given
        stage("{\"value\":[{\"SpatialDim\":\"RWA\",\"TimeDim\":2020,\"Dim1\":\"SEX_BTSX\",\"NumericValue\":69.3}]}");

        // When
        TransformRunResult result = pipeline(null).run();

        // Then
        assertThat(loaded).containsExactly(
            rwanda2020());
        assertThat(result.getState()).isEqualTo(PipelineState.DONE);
        assertThat(result.getFormat()).isEqualTo(SourceFormat.STRUCTURED);
        assertThat(result.getObjectName()).isEqualTo(LATEST);
        assertThat(result.getRowsWritten()).isEqualTo(1);
        assertThat(result.getIngestedAt()).isEqualTo(RUN_TS);
    }

    @Test
    @DisplayName("Scenario B: tabular input loads the same row as the structured input")
    void shouldLoadTabularInputIdentically() {
        // Given
        stage("SpatialDimCode,TimeDim,Dim1,NumericValue\nRWA,2020,Both sexes,69.3\n");

        // When
        TransformRunResult result = pipeline(null).run();

        // Then
        assertThat(loaded).containsExactly(
            rwanda2020());
        assertThat(result.getFormat()).isEqualTo(SourceFormat.TABULAR);
    }

    @Test
    @DisplayName("Scenario C: a missing value fails validation and nothing is loaded")
    void shouldFailOnMissingValue() {
        // Given
        stage("SpatialDimCode,TimeDim,Dim1,NumericValue\nRWA,2020,Both sexes,\nKEN,2020,Both sexes,66.7\n");

        // Then
        assertThatThrownBy(() -> pipeline(null).run())
            .isInstanceOfSatisfying(TransformFailedException.class, e -> {
                assertThat(e.getFailedAt()).isEqualTo(PipelineState.VALIDATING);
                assertThat(e.getError()).isInstanceOfSatisfying(QualityException.class, q -> {
                    assertThat(q.getKind()).isEqualTo(QualityException.Kind.MISSING_VALUES);
                    assertThat(q.getCount()).isEqualTo(1);
                });
                assertThat(e.getMessage()).isEqualTo("Validating failed: MissingValues count=1");
            });
        verifyNoInteractions(loader);
    }

    @Test
    @DisplayName("Scenario D: a repeated natural key fails validation")
    void shouldFailOnDuplicateRows() {
        // Given
        stage("SpatialDimCode,TimeDim,Dim1,NumericValue\nRWA,2020,Both sexes,69.3\nRWA,2020,Both sexes,69.5\n");

        // Then
        assertThatThrownBy(() -> pipeline(null).run())
            .isInstanceOfSatisfying(TransformFailedException.class, e -> {
                assertThat(e.getFailedAt()).isEqualTo(PipelineState.VALIDATING);
                assertThat(e.getError()).isInstanceOfSatisfying(QualityException.class, q -> {
                    assertThat(q.getKind()).isEqualTo(QualityException.Kind.DUPLICATE_ROWS);
                    assertThat(q.getCount()).isEqualTo(1);
                });
            });
        verifyNoInteractions(loader);
    }

    @Test
    @DisplayName("Scenario E: only sex-disaggregated rows leave nothing to load")
    void shouldFailWhenFilterRemovesEverything() {
        // Given
        stage("{\"value\":["
            + "{\"SpatialDim\":\"RWA\",\"TimeDim\":2020,\"Dim1\":\"SEX_MLE\",\"NumericValue\":67.0},"
            + "{\"SpatialDim\":\"RWA\",\"TimeDim\":2020,\"Dim1\":\"SEX_FMLE\",\"NumericValue\":71.5}]}");

        // Then
        assertThatThrownBy(() -> pipeline(null).run())
            .isInstanceOfSatisfying(TransformFailedException.class, e -> {
                assertThat(e.getFailedAt()).isEqualTo(PipelineState.FILTERING);
                assertThat(e.getError()).isInstanceOf(EmptyResultException.class);
            });
        verifyNoInteractions(loader);
    }

    @Test
    @DisplayName("Should fetch the latest object and truncate to max rows")
    void shouldFetchLatestAndTruncate() {
        // Given
        when(stagingStore.list("who_life_expectancy")).thenReturn(List.of(
            new StagedObject(LATEST, Instant.parse("2026-10-18T02:00:00Z"), 10),
            new StagedObject("who_life_expectancy/ingestion_date=2026-10-17/life_expectancy.json",
                Instant.parse("2026-10-17T02:00:00Z"), 10)));
        when(stagingStore.fetch(LATEST)).thenReturn(bytes("SpatialDim,SpatialDimCode,TimeDim,Dim1,NumericValue\n"
            + "Rwanda,RWA,2020,Both sexes,69.3\n"
            + "Rwanda,RWA,2020,Male,67.0\n"
            + "Kenya,KEN,2020,Both sexes,66.7\n"
            + "Uganda,UGA,2020,Both sexes,63.4\n"));

        // When
        TransformRunResult result = pipeline(2).run();

        // Then
        verify(stagingStore).fetch(LATEST);
        assertThat(loaded).extracting(CanonicalRecord::getCountryName).containsExactly("Rwanda", "Kenya");
        assertThat(result.getRowsParsed()).isEqualTo(4);
        assertThat(result.getRowsRetained()).isEqualTo(2);
        assertThat(result.getQualityReport().isPassed()).isTrue();
    }

    @Test
    @DisplayName("Should fail while fetching when the prefix is empty")
    void shouldFailOnEmptyStore() {
        when(stagingStore.list("who_life_expectancy")).thenReturn(List.of());

        assertThatThrownBy(() -> pipeline(null).run())
            .isInstanceOfSatisfying(TransformFailedException.class, e -> {
                assertThat(e.getFailedAt()).isEqualTo(PipelineState.FETCHING);
                assertThat(e.getError()).isInstanceOf(StoreException.class);
            });
    }

    @Test
    @DisplayName("Should fail while parsing on a malformed payload")
    void shouldFailOnMalformedPayload() {
        stage("{\"value\": [ {\"SpatialDim\": ");

        assertThatThrownBy(() -> pipeline(null).run())
            .isInstanceOfSatisfying(TransformFailedException.class, e -> {
                assertThat(e.getFailedAt()).isEqualTo(PipelineState.PARSING);
                assertThat(e.getError()).isInstanceOf(FormatException.class);
            });
        verifyNoInteractions(loader);
    }

    @Test
    @DisplayName("Should report a load failure at the loading stage")
    void shouldReportLoadFailure() {
        // Given
        stage("SpatialDimCode,TimeDim,Dim1,NumericValue\nRWA,2020,Both sexes,69.3\n");
        doThrow(new LoadException("connection reset")).when(loader).load(anyList());

        // Then
        assertThatThrownBy(() -> pipeline(null).run())
            .isInstanceOfSatisfying(TransformFailedException.class, e -> {
                assertThat(e.getFailedAt()).isEqualTo(PipelineState.LOADING);
                assertThat(e.getError()).isInstanceOf(LoadException.class);
            });
    }

    @Test
    @DisplayName("Should complete once committed even when the warehouse totals cannot be read")
    void shouldCompleteWhenReadBackFails() {
        // Given
        stage("SpatialDimCode,TimeDim,Dim1,NumericValue\nRWA,2020,Both sexes,69.3\n");
        doThrow(new DataAccessResourceFailureException("connection reset"))
            .when(repository).countByIngestedAt(any());

        // When
        TransformRunResult result = pipeline(null).run();

        // Then
        assertThat(result.getState()).isEqualTo(PipelineState.DONE);
        assertThat(result.getRowsWritten()).isEqualTo(1);
        assertThat(loaded).containsExactly(rwanda2020());
        verify(loader).load(anyList());
    }

    private static CanonicalRecord rwanda2020() {
        return CanonicalRecord.builder()
            .countryName("RWA")
            .countryCode("RWA")
            .year(2020)
            .sex(SexCategory.BOTH)
            .lifeExpectancy(69.3)
            .ingestedAt(RUN_TS)
            .build();
    }

    private TransformPipeline pipeline(Integer maxRows) {
        TransformProperties properties = new TransformProperties();
        properties.setMaxRows(maxRows);
        RecordParsers parsers = new RecordParsers(List.of(
            new TabularRecordParser(), new StructuredRecordParser(new ObjectMapper())));
        return new TransformPipeline(stagingStore, parsers, new Normalizer(properties), new QualityGate(),
            loader, repository, properties, Clock.fixed(RUN_STARTED, ZoneOffset.UTC));
    }

    private void stage(String content) {
        when(stagingStore.list("who_life_expectancy"))
            .thenReturn(List.of(new StagedObject(LATEST, Instant.parse("2026-10-18T02:00:00Z"), content.length())));
        when(stagingStore.fetch(LATEST)).thenReturn(bytes(content));
    }

    private static byte[] bytes(String content) {
        return content.getBytes(StandardCharsets.UTF_8);
    }
}
