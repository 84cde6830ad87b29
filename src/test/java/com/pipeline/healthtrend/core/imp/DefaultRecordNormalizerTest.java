package com.pipeline.healthtrend.core.imp;

import com.pipeline.healthtrend.exception.RecordTypeException;
import com.pipeline.healthtrend.exception.RecordValidationException;
import com.pipeline.healthtrend.model.*;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.*;
import java.util.concurrent.ForkJoinPool;

import static org.junit.jupiter.api.Assertions.*;

class DefaultRecordNormalizerTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private final PipelineConfig config = new PipelineConfig();
    private final DefaultRecordNormalizer normalizer = new DefaultRecordNormalizer(config, CLOCK);
    private ForkJoinPool pool;

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.shutdownNow();
        }
    }

    private static Map<String, Object> record(String id, String metric, Object timestamp, Object value) {
        Map<String, Object> raw = new HashMap<>();
        if (id != null) raw.put("source_record_id", id);
        if (metric != null) raw.put("metric_name", metric);
        if (timestamp != null) raw.put("timestamp", timestamp);
        if (value != null) raw.put("value", value);
        return raw;
    }

    @Test
    void normalize_shouldCoerceNumericStringAndCanonicalizeMetric() {
        MetricSample sample = normalizer.normalize(
                record("r1", "  Heart Rate ", "2024-03-01T10:15:00Z", "72.5"), SchemaDescriptor.standard());

        assertEquals("heart_rate", sample.getMetricName());
        assertEquals(Instant.parse("2024-03-01T10:15:00Z"), sample.getTimestamp());
        assertEquals(72.5, sample.getValue());
        assertEquals("r1", sample.getSourceRecordId());
    }

    @Test
    void normalize_shouldAcceptSeveralTimestampForms() {
        SchemaDescriptor schema = SchemaDescriptor.standard();
        Instant expected = Instant.parse("2024-03-01T10:00:00Z");

        assertEquals(expected, normalizer.normalize(
                record("a", "hr", expected.toEpochMilli(), 1), schema).getTimestamp());
        assertEquals(expected, normalizer.normalize(
                record("b", "hr", String.valueOf(expected.toEpochMilli()), 1), schema).getTimestamp());
        assertEquals(expected, normalizer.normalize(
                record("c", "hr", "2024-03-01T11:00:00+01:00", 1), schema).getTimestamp());
        assertEquals(expected, normalizer.normalize(
                record("d", "hr", "2024-03-01 10:00:00", 1), schema).getTimestamp());
        assertEquals(expected, normalizer.normalize(
                record("e", "hr", Date.from(expected), 1), schema).getTimestamp());
    }

    @Test
    void normalize_shouldRejectMissingRequiredField() {
        RecordValidationException e = assertThrows(RecordValidationException.class,
                () -> normalizer.normalize(record("r1", "hr", "2024-03-01T10:00:00Z", null),
                        SchemaDescriptor.standard()));
        assertEquals(ValidationReason.MISSING_FIELD, e.getReason());
        assertEquals("value", e.getField());
    }

    @Test
    void normalize_shouldRejectBlankMetricAsMissing() {
        RecordValidationException e = assertThrows(RecordValidationException.class,
                () -> normalizer.normalize(record("r1", "   ", "2024-03-01T10:00:00Z", 1),
                        SchemaDescriptor.standard()));
        assertEquals(ValidationReason.MISSING_FIELD, e.getReason());
    }

    @Test
    void normalize_shouldRaiseTypeErrorForNonNumericValue() {
        RecordTypeException e = assertThrows(RecordTypeException.class,
                () -> normalizer.normalize(record("r1", "hr", "2024-03-01T10:00:00Z", "seventy"),
                        SchemaDescriptor.standard()));
        assertEquals(ValidationReason.TYPE_MISMATCH, e.getReason());
    }

    @Test
    void normalize_shouldRejectNonFiniteValues() {
        for (Object bad : List.of("NaN", "Infinity", Double.NaN, Double.POSITIVE_INFINITY)) {
            RecordValidationException e = assertThrows(RecordValidationException.class,
                    () -> normalizer.normalize(record("r1", "hr", "2024-03-01T10:00:00Z", bad),
                            SchemaDescriptor.standard()));
            assertEquals(ValidationReason.TYPE_MISMATCH, e.getReason(), "value " + bad);
        }
    }

    @Test
    void normalize_shouldRejectUnparseableTimestamp() {
        RecordValidationException e = assertThrows(RecordValidationException.class,
                () -> normalizer.normalize(record("r1", "hr", "yesterday", 1), SchemaDescriptor.standard()));
        assertEquals(ValidationReason.INVALID_TIMESTAMP, e.getReason());
    }

    @Test
    void normalize_shouldEnforceRetentionWindow() {
        RecordValidationException old = assertThrows(RecordValidationException.class,
                () -> normalizer.normalize(record("r1", "hr", "2022-01-01T00:00:00Z", 1),
                        SchemaDescriptor.standard()));
        assertEquals(ValidationReason.TOO_OLD, old.getReason());

        RecordValidationException future = assertThrows(RecordValidationException.class,
                () -> normalizer.normalize(record("r2", "hr", "2024-03-01T13:00:00Z", 1),
                        SchemaDescriptor.standard()));
        assertEquals(ValidationReason.FUTURE_DATED, future.getReason());

        // 允许的时钟偏差以内
        assertNotNull(normalizer.normalize(record("r3", "hr", "2024-03-01T12:04:00Z", 1),
                SchemaDescriptor.standard()));
    }

    @Test
    void normalize_shouldIgnoreUnrecognizedFields() {
        Map<String, Object> raw = record("r1", "hr", "2024-03-01T10:00:00Z", 60);
        raw.put("ward", "B-12");
        raw.put("nested", Map.of("x", 1));

        MetricSample sample = normalizer.normalize(raw, SchemaDescriptor.standard());
        assertEquals(60.0, sample.getValue());
    }

    @Test
    void normalize_shouldDeriveStableContentIdWhenRecordIdAbsent() {
        SchemaDescriptor schema = SchemaDescriptor.caseCounts();
        schema.setRecordIdField(null);

        Map<String, Object> first = new HashMap<>(Map.of(
                "disease", "Influenza", "timestamp", "2024-03-01T10:00:00Z", "patient_id", "p-1", "age", "40"));
        Map<String, Object> again = new HashMap<>(first);
        Map<String, Object> otherPatient = new HashMap<>(first);
        otherPatient.put("patient_id", "p-2");

        MetricSample a = normalizer.normalize(first, schema);
        MetricSample b = normalizer.normalize(again, schema);
        MetricSample c = normalizer.normalize(otherPatient, schema);

        assertEquals("influenza", a.getMetricName());
        assertEquals(1.0, a.getValue());
        assertTrue(a.getSourceRecordId().startsWith("sha256:"));
        assertEquals(a.getSourceRecordId(), b.getSourceRecordId());
        assertNotEquals(a.getSourceRecordId(), c.getSourceRecordId());
    }

    @Test
    void normalize_shouldValidateDeclaredOptionalFields() {
        SchemaDescriptor schema = SchemaDescriptor.caseCounts();
        Map<String, Object> tooOld = new HashMap<>(Map.of(
                "record_id", "c1", "disease", "flu", "timestamp", "2024-03-01T10:00:00Z", "age", 130));
        RecordValidationException range = assertThrows(RecordValidationException.class,
                () -> normalizer.normalize(tooOld, schema));
        assertEquals(ValidationReason.OUT_OF_RANGE, range.getReason());
        assertEquals("age", range.getField());

        Map<String, Object> fractional = new HashMap<>(tooOld);
        fractional.put("age", "30.5");
        RecordValidationException type = assertThrows(RecordValidationException.class,
                () -> normalizer.normalize(fractional, schema));
        assertEquals(ValidationReason.TYPE_MISMATCH, type.getReason());
    }

    @Test
    void normalizeBatch_shouldCollectErrorsWithoutAborting() {
        List<Map<String, Object>> batch = List.of(
                record("r1", "heart_rate", "2024-03-01T10:00:00Z", 70),
                record("r2", "heart_rate", "2024-03-01T10:05:00Z", "72"),
                record("r3", "heart_rate", "2024-03-01T10:10:00Z", "n/a"),
                record("r4", "heart_rate", "2024-03-01T10:15:00Z", 71),
                record(null, "heart_rate", "2024-03-01T10:20:00Z", 69));

        NormalizationResult result = normalizer.normalizeBatch(batch, SchemaDescriptor.standard());

        assertEquals(4, result.getSamples().size());
        assertEquals(1, result.getErrors().size());
        RecordError error = result.getErrors().get(0);
        assertEquals("r3", error.getRecordId());
        assertEquals("value", error.getField());
        assertEquals(ValidationReason.TYPE_MISMATCH, error.getReason());
    }

    @Test
    void normalize_shouldReadSqlDateAsUtcMidnight() {
        MetricSample sample = normalizer.normalize(
                record("r1", "hr", java.sql.Date.valueOf("2024-02-29"), 60), SchemaDescriptor.standard());

        assertEquals(Instant.parse("2024-02-29T00:00:00Z"), sample.getTimestamp());
    }

    @Test
    void normalizeBatch_shouldCollectTimeOnlyValueAsInvalidTimestamp() {
        List<Map<String, Object>> batch = List.of(
                record("r1", "hr", "2024-03-01T10:00:00Z", 60),
                record("r2", "hr", java.sql.Time.valueOf("10:00:00"), 61));

        NormalizationResult result = normalizer.normalizeBatch(batch, SchemaDescriptor.standard());

        assertEquals(1, result.getSamples().size());
        assertEquals(1, result.getErrors().size());
        assertEquals("r2", result.getErrors().get(0).getRecordId());
        assertEquals(ValidationReason.INVALID_TIMESTAMP, result.getErrors().get(0).getReason());
    }

    @Test
    void normalizeBatch_shouldUsePositionForRecordsWithoutId() {
        List<Map<String, Object>> batch = new ArrayList<>();
        batch.add(record(null, "hr", "bad-time", 1));

        NormalizationResult result = normalizer.normalizeBatch(batch, SchemaDescriptor.standard());
        assertEquals("#0", result.getErrors().get(0).getRecordId());
    }

    @Test
    void normalizeBatch_shouldPreserveInputOrderWhenParallel() {
        pool = new ForkJoinPool(4);
        config.setNormalizationChunkSize(3);
        DefaultRecordNormalizer parallel = new DefaultRecordNormalizer(config, CLOCK, pool);

        List<Map<String, Object>> batch = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            Object value = (i % 7 == 0) ? "oops" : (Object) i;
            batch.add(record("r" + i, "hr", "2024-03-01T10:00:00Z", value));
        }

        NormalizationResult result = parallel.normalizeBatch(batch, SchemaDescriptor.standard());

        List<String> expectedIds = new ArrayList<>();
        List<String> expectedErrors = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            (i % 7 == 0 ? expectedErrors : expectedIds).add("r" + i);
        }
        List<String> ids = new ArrayList<>();
        result.getSamples().forEach(s -> ids.add(s.getSourceRecordId()));
        List<String> errorIds = new ArrayList<>();
        result.getErrors().forEach(e -> errorIds.add(e.getRecordId()));

        assertEquals(expectedIds, ids);
        assertEquals(expectedErrors, errorIds);
    }

    @Test
    void normalizeBatch_shouldReturnEmptyResultForEmptyInput() {
        NormalizationResult result = normalizer.normalizeBatch(List.of(), SchemaDescriptor.standard());
        assertTrue(result.getSamples().isEmpty());
        assertTrue(result.getErrors().isEmpty());
    }
}
