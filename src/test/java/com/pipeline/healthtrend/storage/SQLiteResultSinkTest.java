package com.pipeline.healthtrend.storage;

import com.pipeline.healthtrend.exception.CollaboratorUnavailableException;
import com.pipeline.healthtrend.model.Aggregate;
import com.pipeline.healthtrend.model.Anomaly;
import com.pipeline.healthtrend.model.Severity;
import com.pipeline.healthtrend.model.TimeRange;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SQLiteResultSinkTest {

    private static final Instant T0 = Instant.parse("2024-03-01T00:00:00Z");
    private static final Duration HOUR = Duration.ofHours(1);

    @TempDir
    Path tempDir;

    private SQLiteResultSink sink;

    @BeforeEach
    void setUp() {
        sink = new SQLiteResultSink(tempDir.resolve("storage").toString());
    }

    @AfterEach
    void tearDown() {
        sink.shutdown();
    }

    private static Aggregate aggregate(String metric, Instant bucket, long count, double sum, Set<String> ids) {
        double mean = count == 0 ? 0.0 : sum / count;
        return new Aggregate(metric, bucket, HOUR, count, sum, sum * sum, 1.0, 9.0, mean, 2.0, ids);
    }

    @Test
    void putAggregate_shouldRoundTripStatisticsAndRecordIds() {
        sink.putAggregate(aggregate("heart_rate", T0, 3, 213.0, Set.of("r1", "r2", "r3")));

        Aggregate loaded = sink.getAggregate("heart_rate", T0).orElseThrow();
        assertEquals(3, loaded.getCount());
        assertEquals(213.0, loaded.getSum(), 1e-9);
        assertEquals(71.0, loaded.getMean(), 1e-9);
        assertEquals(2.0, loaded.getM2(), 1e-9);
        assertEquals(HOUR, loaded.getBucketWidth());
        assertEquals(Set.of("r1", "r2", "r3"), loaded.getAppliedRecordIds());
    }

    @Test
    void putAggregate_shouldReplacePreviousValueForSameBucket() {
        sink.putAggregate(aggregate("heart_rate", T0, 1, 70.0, Set.of("r1")));
        sink.putAggregate(aggregate("heart_rate", T0, 2, 142.0, Set.of("r1", "r2")));

        Aggregate loaded = sink.getAggregate("heart_rate", T0).orElseThrow();
        assertEquals(2, loaded.getCount());
        assertEquals(Set.of("r1", "r2"), loaded.getAppliedRecordIds());
    }

    @Test
    void getAggregate_shouldReturnEmptyForUnknownBucket() {
        assertTrue(sink.getAggregate("heart_rate", T0).isEmpty());
    }

    @Test
    void data_shouldSurviveReopen() {
        sink.putAggregate(aggregate("heart_rate", T0, 1, 70.0, Set.of("r1")));
        sink.shutdown();

        sink = new SQLiteResultSink(tempDir.resolve("storage").toString());
        assertEquals(1, sink.getAggregate("heart_rate", T0).orElseThrow().getCount());
    }

    @Test
    void listSeries_shouldFilterByMetricAndRange() {
        for (int i = 0; i < 4; i++) {
            sink.putAggregate(aggregate("heart_rate", T0.plus(HOUR.multipliedBy(i)), 1, 70.0 + i, Set.of("h" + i)));
        }
        sink.putAggregate(aggregate("spo2", T0, 1, 98.0, Set.of("s0")));

        List<Aggregate> since = sink.listSeries("heart_rate", T0.plus(HOUR));
        assertEquals(3, since.size());
        assertEquals(T0.plus(HOUR), since.get(0).getBucketStart());

        List<Aggregate> range = sink.listSeries("heart_rate", new TimeRange(T0, T0.plus(HOUR.multipliedBy(2))));
        assertEquals(2, range.size());
        assertEquals(T0, range.get(0).getBucketStart());
        assertEquals(T0.plus(HOUR), range.get(1).getBucketStart());
    }

    @Test
    void listSeriesBefore_shouldPageBackwardsByBucketCount() {
        for (int hour = 0; hour <= 12; hour += 4) {
            sink.putAggregate(aggregate("heart_rate", T0.plus(HOUR.multipliedBy(hour)), 1, 70.0 + hour, Set.of("h" + hour)));
        }
        sink.putAggregate(aggregate("spo2", T0.plus(HOUR.multipliedBy(10)), 1, 98.0, Set.of("s10")));

        List<Aggregate> page = sink.listSeriesBefore("heart_rate", T0.plus(HOUR.multipliedBy(12)), 2);
        assertEquals(2, page.size());
        assertEquals(T0.plus(HOUR.multipliedBy(4)), page.get(0).getBucketStart());
        assertEquals(T0.plus(HOUR.multipliedBy(8)), page.get(1).getBucketStart());
        assertEquals(Set.of("h8"), page.get(1).getAppliedRecordIds());

        List<Aggregate> older = sink.listSeriesBefore("heart_rate", page.get(0).getBucketStart(), 2);
        assertEquals(1, older.size());
        assertEquals(T0, older.get(0).getBucketStart());

        assertTrue(sink.listSeriesBefore("heart_rate", T0, 5).isEmpty());
        assertTrue(sink.listSeriesBefore("blood_pressure", T0.plus(HOUR.multipliedBy(20)), 5).isEmpty());
    }

    @Test
    void anomalies_shouldBeUpsertedListedAndDeleted() {
        Instant detectedAt = T0.plus(Duration.ofDays(1));
        sink.putAnomaly(new Anomaly("heart_rate", T0.plus(HOUR), 130.0, 100.0, 6.0, Severity.HIGH, detectedAt));
        sink.putAnomaly(new Anomaly("heart_rate", T0.plus(HOUR), 115.0, 100.0, 3.0, Severity.MEDIUM, detectedAt));
        sink.putAnomaly(new Anomaly("spo2", T0, 90.0, 98.0, -2.5, Severity.LOW, detectedAt));

        List<Anomaly> all = sink.listAnomalies(T0);
        assertEquals(2, all.size());
        assertEquals("spo2", all.get(0).getMetricName());
        assertEquals(Severity.MEDIUM, all.get(1).getSeverity());
        assertEquals(detectedAt, all.get(1).getDetectedAt());

        assertEquals(1, sink.listAnomalies(T0.plus(HOUR)).size());

        sink.deleteAnomaly("heart_rate", T0.plus(HOUR));
        assertEquals(1, sink.listAnomalies(T0).size());
    }

    @Test
    void operations_shouldReportUnavailableAfterShutdown() {
        sink.shutdown();

        assertThrows(CollaboratorUnavailableException.class, () -> sink.getAggregate("heart_rate", T0));
        assertThrows(CollaboratorUnavailableException.class, () -> sink.listAnomalies(T0));
    }
}
