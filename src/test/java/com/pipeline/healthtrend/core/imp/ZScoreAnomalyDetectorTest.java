package com.pipeline.healthtrend.core.imp;

import com.pipeline.healthtrend.model.*;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ZScoreAnomalyDetectorTest {

    private static final Instant T0 = Instant.parse("2024-03-01T00:00:00Z");
    private static final Instant NOW = Instant.parse("2024-03-02T00:00:00Z");
    private static final Duration HOUR = Duration.ofHours(1);

    private final ZScoreAnomalyDetector detector = new ZScoreAnomalyDetector(
            SeverityThresholds.defaults(), 3, 1e-6, Clock.fixed(NOW, ZoneOffset.UTC));

    private static Aggregate bucket(int hour, double mean, long count) {
        return bucket("heart_rate", hour, mean, count);
    }

    private static Aggregate bucket(String metric, int hour, double mean, long count) {
        return new Aggregate(metric, T0.plus(HOUR.multipliedBy(hour)), HOUR,
                count, mean * count, mean * mean * count, mean, mean, mean, 0.0, Set.of());
    }

    /** 10 个交替 95/105 的历史桶，后接一个观测桶 */
    private static List<Aggregate> alternatingHistoryThen(double observed) {
        List<Aggregate> series = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            series.add(bucket(i, i % 2 == 0 ? 95 : 105, 5));
        }
        series.add(bucket(10, observed, 5));
        return series;
    }

    @Test
    void detect_shouldFlagHighSeverityForSixSigmaSpike() {
        List<Anomaly> anomalies = detector.detect(alternatingHistoryThen(130), 10);

        assertEquals(1, anomalies.size());
        Anomaly anomaly = anomalies.get(0);
        assertEquals("heart_rate", anomaly.getMetricName());
        assertEquals(T0.plus(HOUR.multipliedBy(10)), anomaly.getBucketStart());
        assertEquals(130.0, anomaly.getObservedValue(), 1e-9);
        assertEquals(100.0, anomaly.getExpectedValue(), 1e-9);
        assertEquals(6.0, anomaly.getDeviationScore(), 1e-9);
        assertEquals(Severity.HIGH, anomaly.getSeverity());
        assertEquals(NOW, anomaly.getDetectedAt());
    }

    @Test
    void detect_shouldClassifyThresholdBoundariesAsClosedOpen() {
        assertEquals(Severity.LOW, detector.detect(alternatingHistoryThen(110), 10).get(0).getSeverity());
        assertEquals(Severity.MEDIUM, detector.detect(alternatingHistoryThen(115), 10).get(0).getSeverity());
        assertEquals(Severity.HIGH, detector.detect(alternatingHistoryThen(120), 10).get(0).getSeverity());
        assertTrue(detector.detect(alternatingHistoryThen(109.99), 10).isEmpty());
    }

    @Test
    void detect_shouldFlagNegativeDeviationsToo() {
        List<Anomaly> anomalies = detector.detect(alternatingHistoryThen(70), 10);

        assertEquals(1, anomalies.size());
        assertEquals(-6.0, anomalies.get(0).getDeviationScore(), 1e-9);
        assertEquals(Severity.HIGH, anomalies.get(0).getSeverity());
    }

    @Test
    void evaluate_shouldReportInsufficientDataForSparseBucket() {
        List<Aggregate> series = alternatingHistoryThen(130);
        series.set(10, bucket(10, 130, 2));

        List<BucketAssessment> assessments = detector.evaluate(series, 10);
        BucketAssessment last = assessments.get(assessments.size() - 1);

        assertEquals(DetectionStatus.INSUFFICIENT_DATA, last.getStatus());
        assertFalse(last.getAnomaly().isPresent());
        assertTrue(detector.detect(series, 10).isEmpty());
    }

    @Test
    void evaluate_shouldReportUnknownWithoutFullWindow() {
        List<BucketAssessment> assessments = detector.evaluate(alternatingHistoryThen(130), 10);

        for (int i = 0; i < 10; i++) {
            assertEquals(DetectionStatus.UNKNOWN, assessments.get(i).getStatus(), "bucket " + i);
        }
        assertEquals(DetectionStatus.ANOMALY, assessments.get(10).getStatus());
    }

    @Test
    void evaluate_shouldSkipSparseBucketsInsideTrailingWindow() {
        List<Aggregate> series = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            series.add(bucket(i, i % 2 == 0 ? 95 : 105, 5));
        }
        // 样本不足的桶既不计入窗口，也不截断窗口
        series.add(bucket(10, 1000, 1));
        series.add(bucket(11, 130, 5));

        List<Anomaly> anomalies = detector.detect(series, 10);

        assertEquals(1, anomalies.size());
        assertEquals(T0.plus(HOUR.multipliedBy(11)), anomalies.get(0).getBucketStart());
        assertEquals(6.0, anomalies.get(0).getDeviationScore(), 1e-9);
    }

    @Test
    void evaluate_shouldApplyStddevFloorOnConstantHistory() {
        List<Aggregate> series = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            series.add(bucket(i, 100, 4));
        }
        series.add(bucket(5, 100, 4));
        series.add(bucket(6, 101, 4));

        List<BucketAssessment> assessments = detector.evaluate(series, 5);

        BucketAssessment steady = assessments.get(5);
        assertEquals(DetectionStatus.NORMAL, steady.getStatus());
        assertEquals(0.0, steady.getDeviationScore(), 1e-9);

        BucketAssessment shifted = assessments.get(6);
        assertEquals(DetectionStatus.ANOMALY, shifted.getStatus());
        assertTrue(Double.isFinite(shifted.getDeviationScore()));
    }

    @Test
    void evaluate_shouldOnlyAssessBucketsFromGivenInstant() {
        List<Aggregate> series = alternatingHistoryThen(130);
        Instant from = T0.plus(HOUR.multipliedBy(10));

        List<BucketAssessment> assessments = detector.evaluate(series, 10, from);

        assertEquals(1, assessments.size());
        assertEquals(DetectionStatus.ANOMALY, assessments.get(0).getStatus());
    }

    @Test
    void evaluate_shouldSortUnorderedInput() {
        List<Aggregate> series = alternatingHistoryThen(130);
        Collections.reverse(series);

        List<Anomaly> anomalies = detector.detect(series, 10);
        assertEquals(1, anomalies.size());
        assertEquals(6.0, anomalies.get(0).getDeviationScore(), 1e-9);
    }

    @Test
    void evaluate_shouldRejectMixedMetrics() {
        List<Aggregate> series = List.of(bucket("heart_rate", 0, 70, 5), bucket("spo2", 1, 97, 5));
        assertThrows(IllegalArgumentException.class, () -> detector.evaluate(series, 1));
    }

    @Test
    void evaluate_shouldReturnEmptyForEmptySeries() {
        assertTrue(detector.evaluate(List.of(), 10).isEmpty());
    }

    @Test
    void detect_shouldRejectNonPositiveWindow() {
        assertThrows(IllegalArgumentException.class, () -> detector.detect(alternatingHistoryThen(130), 0));
    }

    @Test
    void evaluate_shouldUseBucketCountWhenObservingCaseCounts() {
        // 计数型指标每条记录值为 1，均值恒为 1，只有样本数能反映病例激增
        List<Aggregate> series = List.of(
                bucket("flu", 0, 1.0, 4),
                bucket("flu", 1, 1.0, 6),
                bucket("flu", 2, 1.0, 5),
                bucket("flu", 3, 1.0, 40));

        assertTrue(detector.detect(series, 3).isEmpty());

        List<BucketAssessment> assessments = detector.evaluate(series, 3, null, ObservedStatistic.COUNT);
        BucketAssessment spike = assessments.get(assessments.size() - 1);
        Anomaly anomaly = spike.getAnomaly().orElseThrow();
        assertEquals(40.0, anomaly.getObservedValue(), 1e-9);
        assertEquals(5.0, anomaly.getExpectedValue(), 1e-9);
        assertEquals(Severity.HIGH, anomaly.getSeverity());
    }
}
