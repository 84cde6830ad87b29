package com.pipeline.healthtrend.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * 聚合唯一键：(指标名, 桶起点)
 */
public final class BucketKey implements Serializable, Comparable<BucketKey> {
    private final String metricName;
    private final Instant bucketStart;

    public BucketKey(String metricName, Instant bucketStart) {
        this.metricName = Objects.requireNonNull(metricName, "metricName");
        this.bucketStart = Objects.requireNonNull(bucketStart, "bucketStart");
    }

    public String getMetricName() { return metricName; }
    public Instant getBucketStart() { return bucketStart; }

    @Override
    public int compareTo(BucketKey other) {
        int byMetric = metricName.compareTo(other.metricName);
        return byMetric != 0 ? byMetric : bucketStart.compareTo(other.bucketStart);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BucketKey)) return false;
        BucketKey that = (BucketKey) o;
        return metricName.equals(that.metricName) && bucketStart.equals(that.bucketStart);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metricName, bucketStart);
    }

    @Override
    public String toString() {
        return metricName + "@" + bucketStart;
    }
}
