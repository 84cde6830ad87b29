package com.pipeline.healthtrend.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * 单个桶的检测评估：状态 + 可选的异常结果。
 * 让下游能够区分"正常"与"未测量"。
 */
public final class BucketAssessment implements Serializable {
    private final String metricName;
    private final Instant bucketStart;
    private final DetectionStatus status;
    /** NORMAL/ANOMALY 时为偏离分数，其余状态为 NaN */
    private final double deviationScore;
    private final Anomaly anomaly;

    private BucketAssessment(String metricName, Instant bucketStart, DetectionStatus status,
                             double deviationScore, Anomaly anomaly) {
        this.metricName = Objects.requireNonNull(metricName, "metricName");
        this.bucketStart = Objects.requireNonNull(bucketStart, "bucketStart");
        this.status = status;
        this.deviationScore = deviationScore;
        this.anomaly = anomaly;
    }

    public static BucketAssessment anomaly(Anomaly anomaly) {
        return new BucketAssessment(anomaly.getMetricName(), anomaly.getBucketStart(),
                DetectionStatus.ANOMALY, anomaly.getDeviationScore(), anomaly);
    }

    public static BucketAssessment normal(String metricName, Instant bucketStart, double deviationScore) {
        return new BucketAssessment(metricName, bucketStart, DetectionStatus.NORMAL, deviationScore, null);
    }

    public static BucketAssessment insufficientData(String metricName, Instant bucketStart) {
        return new BucketAssessment(metricName, bucketStart, DetectionStatus.INSUFFICIENT_DATA, Double.NaN, null);
    }

    public static BucketAssessment unknown(String metricName, Instant bucketStart) {
        return new BucketAssessment(metricName, bucketStart, DetectionStatus.UNKNOWN, Double.NaN, null);
    }

    public String getMetricName() { return metricName; }
    public Instant getBucketStart() { return bucketStart; }
    public DetectionStatus getStatus() { return status; }
    public double getDeviationScore() { return deviationScore; }
    public Optional<Anomaly> getAnomaly() { return Optional.ofNullable(anomaly); }

    @Override
    public String toString() {
        return "BucketAssessment{" + metricName + "@" + bucketStart + ", " + status + "}";
    }
}
