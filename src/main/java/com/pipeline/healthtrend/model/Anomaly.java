package com.pipeline.healthtrend.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * 异常检测结果。
 * 仅由异常检测器创建，创建后不可变；以 (metricName, bucketStart) 标识，
 * 每个桶至多一条，重新检测时以最新结果覆盖。
 */
public final class Anomaly implements Serializable {
    private final String metricName;
    private final Instant bucketStart;
    /** 当前桶的观测值（桶均值） */
    private final double observedValue;
    /** 尾随窗口给出的期望值 */
    private final double expectedValue;
    /** 偏离分数（带下限保护的 z-score） */
    private final double deviationScore;
    private final Severity severity;
    private final Instant detectedAt;

    public Anomaly(String metricName, Instant bucketStart, double observedValue, double expectedValue,
                   double deviationScore, Severity severity, Instant detectedAt) {
        this.metricName = Objects.requireNonNull(metricName, "metricName");
        this.bucketStart = Objects.requireNonNull(bucketStart, "bucketStart");
        this.observedValue = observedValue;
        this.expectedValue = expectedValue;
        this.deviationScore = deviationScore;
        this.severity = Objects.requireNonNull(severity, "severity");
        this.detectedAt = Objects.requireNonNull(detectedAt, "detectedAt");
    }

    public String getMetricName() { return metricName; }
    public Instant getBucketStart() { return bucketStart; }
    public double getObservedValue() { return observedValue; }
    public double getExpectedValue() { return expectedValue; }
    public double getDeviationScore() { return deviationScore; }
    public Severity getSeverity() { return severity; }
    public Instant getDetectedAt() { return detectedAt; }

    public BucketKey key() {
        return new BucketKey(metricName, bucketStart);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Anomaly)) return false;
        Anomaly that = (Anomaly) o;
        return Double.compare(that.observedValue, observedValue) == 0
                && Double.compare(that.expectedValue, expectedValue) == 0
                && Double.compare(that.deviationScore, deviationScore) == 0
                && metricName.equals(that.metricName)
                && bucketStart.equals(that.bucketStart)
                && severity == that.severity
                && detectedAt.equals(that.detectedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metricName, bucketStart, observedValue, expectedValue, deviationScore,
                severity, detectedAt);
    }

    @Override
    public String toString() {
        return "Anomaly{" + metricName + "@" + bucketStart
                + ", observed=" + observedValue + ", expected=" + expectedValue
                + ", score=" + deviationScore + ", severity=" + severity + "}";
    }
}
