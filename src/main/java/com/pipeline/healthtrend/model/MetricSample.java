package com.pipeline.healthtrend.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * 归一化后的单条指标样本：指标名 + 时间戳 + 数值 + 来源记录标识。
 * 创建后不可变，由记录归一化器产生，供聚合引擎消费。
 */
public final class MetricSample implements Serializable {
    private final String metricName;
    private final Instant timestamp;
    private final double value;
    /** 来源记录标识，聚合幂等去重的依据 */
    private final String sourceRecordId;

    public MetricSample(String metricName, Instant timestamp, double value, String sourceRecordId) {
        this.metricName = Objects.requireNonNull(metricName, "metricName");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.value = value;
        this.sourceRecordId = Objects.requireNonNull(sourceRecordId, "sourceRecordId");
    }

    public String getMetricName() { return metricName; }
    public Instant getTimestamp() { return timestamp; }
    public double getValue() { return value; }
    public String getSourceRecordId() { return sourceRecordId; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MetricSample)) return false;
        MetricSample that = (MetricSample) o;
        return Double.compare(that.value, value) == 0
                && metricName.equals(that.metricName)
                && timestamp.equals(that.timestamp)
                && sourceRecordId.equals(that.sourceRecordId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metricName, timestamp, value, sourceRecordId);
    }

    @Override
    public String toString() {
        return "MetricSample{" + metricName + "@" + timestamp + "=" + value
                + ", record='" + sourceRecordId + "'}";
    }
}
