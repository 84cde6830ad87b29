package com.pipeline.healthtrend.core.imp;

import com.pipeline.healthtrend.core.AnomalyDetector;
import com.pipeline.healthtrend.exception.InsufficientHistoryException;
import com.pipeline.healthtrend.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * 基于 z-score 的尾随窗口异常检测器。
 *
 * 观测值取当前桶的统计量（默认均值）；尾随窗口取当前桶之前最近的 W 个有效桶（样本数达到下限），
 * 期望值为这些桶同一统计量的平均，离散度取其总体标准差，并以 stddevFloor 作为下限。
 */
public class ZScoreAnomalyDetector implements AnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(ZScoreAnomalyDetector.class);

    private final SeverityThresholds thresholds;
    private final int minimumSampleThreshold;
    private final double stddevFloor;
    private final Clock clock;

    public ZScoreAnomalyDetector(PipelineConfig config, Clock clock) {
        this(config.getSeverityThresholds(), config.getMinimumSampleThreshold(), config.getStddevFloor(), clock);
    }

    public ZScoreAnomalyDetector(SeverityThresholds thresholds, int minimumSampleThreshold,
                                 double stddevFloor, Clock clock) {
        if (minimumSampleThreshold < 1) {
            throw new IllegalArgumentException("minimumSampleThreshold must be at least 1");
        }
        if (!(stddevFloor > 0)) {
            throw new IllegalArgumentException("stddevFloor must be positive");
        }
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds");
        this.minimumSampleThreshold = minimumSampleThreshold;
        this.stddevFloor = stddevFloor;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public List<Anomaly> detect(List<Aggregate> series, int window) {
        List<Anomaly> anomalies = new ArrayList<>();
        for (BucketAssessment assessment : evaluate(series, window, null)) {
            assessment.getAnomaly().ifPresent(anomalies::add);
        }
        return anomalies;
    }

    @Override
    public List<BucketAssessment> evaluate(List<Aggregate> series, int window) {
        return evaluate(series, window, null);
    }

    @Override
    public List<BucketAssessment> evaluate(List<Aggregate> series, int window, Instant from) {
        return evaluate(series, window, from, ObservedStatistic.MEAN);
    }

    @Override
    public List<BucketAssessment> evaluate(List<Aggregate> series, int window, Instant from,
                                           ObservedStatistic statistic) {
        Objects.requireNonNull(statistic, "statistic");
        if (window < 1) {
            throw new IllegalArgumentException("Detection window must be at least 1, got: " + window);
        }
        if (series == null || series.isEmpty()) {
            return List.of();
        }

        List<Aggregate> ordered = new ArrayList<>(series);
        ordered.sort(Comparator.comparing(Aggregate::getBucketStart));
        String metricName = ordered.get(0).getMetricName();
        for (Aggregate aggregate : ordered) {
            if (!metricName.equals(aggregate.getMetricName())) {
                throw new IllegalArgumentException("Series mixes metrics '" + metricName
                        + "' and '" + aggregate.getMetricName() + "'");
            }
        }

        Instant detectedAt = clock.instant();
        List<BucketAssessment> assessments = new ArrayList<>();
        int anomalyCount = 0;

        for (int i = 0; i < ordered.size(); i++) {
            Aggregate current = ordered.get(i);
            if (from != null && current.getBucketStart().isBefore(from)) {
                continue;
            }
            if (current.getCount() < minimumSampleThreshold) {
                assessments.add(BucketAssessment.insufficientData(metricName, current.getBucketStart()));
                continue;
            }

            double[] trailing;
            try {
                trailing = trailingValues(ordered, i, window, statistic);
            } catch (InsufficientHistoryException e) {
                log.debug("{} for metric '{}'", e.getMessage(), metricName);
                assessments.add(BucketAssessment.unknown(metricName, current.getBucketStart()));
                continue;
            }

            double expected = average(trailing);
            double stddev = populationStddev(trailing, expected);
            double observed = statistic.of(current);
            double score = (observed - expected) / Math.max(stddev, stddevFloor);

            Severity severity = thresholds.classify(score);
            if (severity == null) {
                assessments.add(BucketAssessment.normal(metricName, current.getBucketStart(), score));
            } else {
                Anomaly anomaly = new Anomaly(metricName, current.getBucketStart(), observed, expected,
                        score, severity, detectedAt);
                log.debug("Anomaly detected: {}", anomaly);
                assessments.add(BucketAssessment.anomaly(anomaly));
                anomalyCount++;
            }
        }

        log.debug("Evaluated {} buckets of metric '{}', {} anomalies.", assessments.size(), metricName, anomalyCount);
        return assessments;
    }

    /**
     * 收集 index 之前最近的 window 个有效桶的统计量，不足时抛出 InsufficientHistoryException
     */
    private double[] trailingValues(List<Aggregate> ordered, int index, int window, ObservedStatistic statistic) {
        double[] values = new double[window];
        int found = 0;
        for (int j = index - 1; j >= 0 && found < window; j--) {
            Aggregate previous = ordered.get(j);
            if (previous.getCount() >= minimumSampleThreshold) {
                values[found++] = statistic.of(previous);
            }
        }
        if (found < window) {
            throw new InsufficientHistoryException(ordered.get(index).getBucketStart(), found, window);
        }
        return values;
    }

    private static double average(double[] values) {
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    private static double populationStddev(double[] values, double mean) {
        double squares = 0.0;
        for (double v : values) {
            double d = v - mean;
            squares += d * d;
        }
        return Math.sqrt(squares / values.length);
    }
}
