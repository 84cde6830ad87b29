package com.pipeline.healthtrend.model;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * 单个指标在单个时间桶内的充分统计量。
 *
 * 同一 (metricName, bucketStart) 只存在一个聚合值。实例不可变，
 * 只能由聚合引擎的 merge/combine 生成新实例，不允许整体覆盖写。
 *
 * 除计数、和、平方和、极值外，还维护 Welford 形式的均值与二阶中心矩（m2），
 * 用于数值稳定的方差计算；appliedRecordIds 记录已并入的来源记录标识，
 * 重复上传同一记录时据此跳过。
 */
public final class Aggregate implements Serializable {
    private final String metricName;
    private final Instant bucketStart;
    private final Duration bucketWidth;
    private final long count;
    private final double sum;
    private final double sumSq;
    private final double min;
    private final double max;
    /** Welford 均值 */
    private final double mean;
    /** Welford 二阶中心矩 */
    private final double m2;
    /** 已并入本桶的来源记录标识（有序，便于持久化比对） */
    private final Set<String> appliedRecordIds;

    public Aggregate(String metricName, Instant bucketStart, Duration bucketWidth,
                     long count, double sum, double sumSq, double min, double max,
                     double mean, double m2, Set<String> appliedRecordIds) {
        this.metricName = Objects.requireNonNull(metricName, "metricName");
        this.bucketStart = Objects.requireNonNull(bucketStart, "bucketStart");
        this.bucketWidth = Objects.requireNonNull(bucketWidth, "bucketWidth");
        if (count < 0) {
            throw new IllegalArgumentException("Aggregate count must not be negative: " + count);
        }
        this.count = count;
        this.sum = sum;
        this.sumSq = sumSq;
        this.min = min;
        this.max = max;
        this.mean = mean;
        this.m2 = m2;
        this.appliedRecordIds = Collections.unmodifiableSet(
                new TreeSet<>(appliedRecordIds != null ? appliedRecordIds : Set.of()));
    }

    /** 空桶，作为首个样本合并的起点 */
    public static Aggregate empty(String metricName, Instant bucketStart, Duration bucketWidth) {
        return new Aggregate(metricName, bucketStart, bucketWidth, 0, 0.0, 0.0,
                Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY, 0.0, 0.0, Set.of());
    }

    public String getMetricName() { return metricName; }
    public Instant getBucketStart() { return bucketStart; }
    public Duration getBucketWidth() { return bucketWidth; }
    public long getCount() { return count; }
    public double getSum() { return sum; }
    public double getSumSq() { return sumSq; }
    public double getMin() { return min; }
    public double getMax() { return max; }
    public double getMean() { return mean; }
    public double getM2() { return m2; }
    public Set<String> getAppliedRecordIds() { return appliedRecordIds; }

    public boolean isEmpty() {
        return count == 0;
    }

    public boolean hasApplied(String sourceRecordId) {
        return appliedRecordIds.contains(sourceRecordId);
    }

    public BucketKey key() {
        return new BucketKey(metricName, bucketStart);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Aggregate)) return false;
        Aggregate that = (Aggregate) o;
        return count == that.count
                && Double.compare(that.sum, sum) == 0
                && Double.compare(that.sumSq, sumSq) == 0
                && Double.compare(that.min, min) == 0
                && Double.compare(that.max, max) == 0
                && Double.compare(that.mean, mean) == 0
                && Double.compare(that.m2, m2) == 0
                && metricName.equals(that.metricName)
                && bucketStart.equals(that.bucketStart)
                && bucketWidth.equals(that.bucketWidth)
                && appliedRecordIds.equals(that.appliedRecordIds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metricName, bucketStart, bucketWidth, count, sum, sumSq, min, max, mean, m2,
                appliedRecordIds);
    }

    @Override
    public String toString() {
        return "Aggregate{" + metricName + "@" + bucketStart
                + ", count=" + count + ", sum=" + sum
                + ", min=" + min + ", max=" + max + "}";
    }
}
