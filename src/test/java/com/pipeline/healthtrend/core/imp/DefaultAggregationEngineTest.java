package com.pipeline.healthtrend.core.imp;

import com.pipeline.healthtrend.model.Aggregate;
import com.pipeline.healthtrend.model.AggregateStats;
import com.pipeline.healthtrend.model.MetricSample;
import com.pipeline.healthtrend.model.PipelineConfig;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DefaultAggregationEngineTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    private final DefaultAggregationEngine engine = new DefaultAggregationEngine(Duration.ofHours(1));

    private static MetricSample sample(String id, double value, int minuteOffset) {
        return new MetricSample("heart_rate", T0.plus(Duration.ofMinutes(minuteOffset)), value, id);
    }

    @Test
    void mergeAll_shouldProduceExpectedSufficientStatistics() {
        Aggregate aggregate = engine.mergeAll(null, List.of(
                sample("r1", 70, 0), sample("r2", 72, 10), sample("r3", 71, 20)));

        assertEquals("heart_rate", aggregate.getMetricName());
        assertEquals(T0, aggregate.getBucketStart());
        assertEquals(3, aggregate.getCount());
        assertEquals(213.0, aggregate.getSum(), 1e-9);
        assertEquals(70.0, aggregate.getMin());
        assertEquals(72.0, aggregate.getMax());
        assertEquals(70 * 70 + 72 * 72 + 71 * 71, aggregate.getSumSq(), 1e-9);

        AggregateStats stats = engine.finalize(aggregate);
        assertEquals(71.0, stats.getMean(), 1e-9);
        assertEquals(2.0 / 3.0, stats.getVariance(), 1e-9);
    }

    @Test
    void merge_shouldSkipAlreadyAppliedRecord() {
        Aggregate once = engine.merge(null, sample("r1", 70, 0));
        Aggregate twice = engine.merge(once, sample("r1", 70, 0));

        assertSame(once, twice);
        assertEquals(1, twice.getCount());
    }

    @Test
    void mergeAll_shouldBeIdempotentOnReupload() {
        List<MetricSample> batch = List.of(sample("r1", 70, 0), sample("r2", 72, 5));
        Aggregate first = engine.mergeAll(null, batch);
        Aggregate second = engine.mergeAll(first, batch);

        assertEquals(first, second);
    }

    @Test
    void merge_shouldBeOrderIndependent() {
        List<MetricSample> samples = new ArrayList<>();
        Random random = new Random(42);
        for (int i = 0; i < 40; i++) {
            samples.add(sample("r" + i, 50 + random.nextDouble() * 50, i));
        }
        Aggregate forward = engine.mergeAll(null, samples);

        List<MetricSample> shuffled = new ArrayList<>(samples);
        Collections.shuffle(shuffled, new Random(7));
        Aggregate permuted = engine.mergeAll(null, shuffled);

        assertEquals(forward.getCount(), permuted.getCount());
        assertEquals(forward.getSum(), permuted.getSum(), 1e-9);
        assertEquals(forward.getMin(), permuted.getMin());
        assertEquals(forward.getMax(), permuted.getMax());
        assertEquals(forward.getMean(), permuted.getMean(), 1e-9);
        assertEquals(forward.getM2(), permuted.getM2(), 1e-6);
        assertEquals(forward.getAppliedRecordIds(), permuted.getAppliedRecordIds());
    }

    @Test
    void combine_shouldMatchSequentialMerge() {
        List<MetricSample> left = List.of(sample("a", 10, 0), sample("b", 20, 1), sample("c", 30, 2));
        List<MetricSample> right = List.of(sample("d", 40, 3), sample("e", 50, 4));

        Aggregate combined = engine.combine(engine.mergeAll(null, left), engine.mergeAll(null, right));
        List<MetricSample> all = new ArrayList<>(left);
        all.addAll(right);
        Aggregate sequential = engine.mergeAll(null, all);

        assertEquals(sequential.getCount(), combined.getCount());
        assertEquals(sequential.getSum(), combined.getSum(), 1e-9);
        assertEquals(sequential.getMean(), combined.getMean(), 1e-9);
        assertEquals(sequential.getM2(), combined.getM2(), 1e-9);
        assertEquals(10.0, combined.getMin());
        assertEquals(50.0, combined.getMax());
        assertEquals(Set.of("a", "b", "c", "d", "e"), combined.getAppliedRecordIds());
    }

    @Test
    void combine_shouldRejectOverlappingRecords() {
        Aggregate left = engine.mergeAll(null, List.of(sample("a", 10, 0), sample("b", 20, 1)));
        Aggregate right = engine.mergeAll(null, List.of(sample("b", 20, 1), sample("c", 30, 2)));

        assertThrows(IllegalArgumentException.class, () -> engine.combine(left, right));
    }

    @Test
    void combine_shouldTreatEmptyAsIdentity() {
        Aggregate filled = engine.merge(null, sample("a", 10, 0));
        Aggregate empty = Aggregate.empty("heart_rate", T0, Duration.ofHours(1));

        assertSame(filled, engine.combine(empty, filled));
        assertSame(filled, engine.combine(filled, empty));
    }

    @Test
    void bucketStart_shouldFloorToBucketWidth() {
        assertEquals(T0, engine.bucketStart(T0.plus(Duration.ofMinutes(59)).plusSeconds(59)));
        assertEquals(T0.plus(Duration.ofHours(1)), engine.bucketStart(T0.plus(Duration.ofHours(1))));
        // 纪元前的时间戳向下取整
        assertEquals(Instant.ofEpochMilli(-3_600_000L), engine.bucketStart(Instant.ofEpochMilli(-1)));
    }

    @Test
    void merge_shouldRejectSampleFromAnotherBucket() {
        Aggregate aggregate = engine.merge(null, sample("a", 10, 0));
        MetricSample later = sample("b", 10, 90);
        MetricSample otherMetric = new MetricSample("spo2", T0, 97, "c");

        assertThrows(IllegalArgumentException.class, () -> engine.merge(aggregate, later));
        assertThrows(IllegalArgumentException.class, () -> engine.merge(aggregate, otherMetric));
    }

    @Test
    void finalize_shouldClampNegativeVarianceToZero() {
        Aggregate drifted = new Aggregate("heart_rate", T0, Duration.ofHours(1),
                2, 140, 9800, 70, 70, 70, -1e-12, Set.of("a", "b"));

        AggregateStats stats = engine.finalize(drifted);
        assertEquals(0.0, stats.getVariance());
        assertEquals(0.0, stats.getStddev());
    }

    @Test
    void finalize_shouldReturnZeroesForEmptyAggregate() {
        AggregateStats stats = engine.finalize(Aggregate.empty("heart_rate", T0, Duration.ofHours(1)));
        assertEquals(0, stats.getCount());
        assertEquals(0.0, stats.getMean());
    }

    @Test
    void constructor_shouldRejectNonPositiveWidth() {
        assertThrows(IllegalArgumentException.class, () -> new DefaultAggregationEngine(Duration.ZERO));
    }

    @Test
    void constructor_shouldRejectSubMillisecondWidth() {
        assertThrows(IllegalArgumentException.class, () -> new DefaultAggregationEngine(Duration.ofNanos(500)));
        assertThrows(IllegalArgumentException.class,
                () -> new PipelineConfig().setBucketWidth(Duration.ofNanos(999_999)).validate());
    }
}
