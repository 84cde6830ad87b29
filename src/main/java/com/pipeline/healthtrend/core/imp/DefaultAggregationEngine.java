package com.pipeline.healthtrend.core.imp;

import com.pipeline.healthtrend.core.AggregationEngine;
import com.pipeline.healthtrend.model.Aggregate;
import com.pipeline.healthtrend.model.AggregateStats;
import com.pipeline.healthtrend.model.MetricSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * 聚合引擎默认实现。
 * 单样本合并采用 Welford 在线算法，部分聚合归并采用 Chan 并行公式，
 * 两者都只依赖 (count, mean, m2)，与合并顺序无关。
 */
public class DefaultAggregationEngine implements AggregationEngine {

    private static final Logger log = LoggerFactory.getLogger(DefaultAggregationEngine.class);

    private final Duration bucketWidth;
    private final long widthMillis;

    public DefaultAggregationEngine(Duration bucketWidth) {
        if (bucketWidth == null || bucketWidth.isZero() || bucketWidth.isNegative()) {
            throw new IllegalArgumentException("bucketWidth must be positive, got: " + bucketWidth);
        }
        // 桶边界按毫秒计算
        if (bucketWidth.toMillis() < 1) {
            throw new IllegalArgumentException("bucketWidth must be at least 1 ms, got: " + bucketWidth);
        }
        this.bucketWidth = bucketWidth;
        this.widthMillis = bucketWidth.toMillis();
    }

    public Duration getBucketWidth() {
        return bucketWidth;
    }

    @Override
    public Instant bucketStart(Instant timestamp) {
        // floorDiv 保证纪元前的时间戳也向下取整
        long millis = timestamp.toEpochMilli();
        return Instant.ofEpochMilli(Math.floorDiv(millis, widthMillis) * widthMillis);
    }

    @Override
    public Aggregate merge(Aggregate existing, MetricSample sample) {
        Objects.requireNonNull(sample, "sample");
        Instant bucket = bucketStart(sample.getTimestamp());
        Aggregate base = existing != null
                ? existing
                : Aggregate.empty(sample.getMetricName(), bucket, bucketWidth);

        if (!base.getMetricName().equals(sample.getMetricName()) || !base.getBucketStart().equals(bucket)) {
            throw new IllegalArgumentException("Sample " + sample.getMetricName() + "@" + bucket
                    + " does not belong to aggregate " + base.key());
        }
        if (base.hasApplied(sample.getSourceRecordId())) {
            log.debug("Record '{}' already applied to {}, skipping.", sample.getSourceRecordId(), base.key());
            return base;
        }

        double x = sample.getValue();
        long count = base.getCount() + 1;
        double delta = x - base.getMean();
        double mean = base.getMean() + delta / count;
        double m2 = base.getM2() + delta * (x - mean);

        Set<String> applied = new HashSet<>(base.getAppliedRecordIds());
        applied.add(sample.getSourceRecordId());

        return new Aggregate(base.getMetricName(), base.getBucketStart(), base.getBucketWidth(),
                count,
                base.getSum() + x,
                base.getSumSq() + x * x,
                Math.min(base.getMin(), x),
                Math.max(base.getMax(), x),
                mean, m2, applied);
    }

    @Override
    public Aggregate mergeAll(Aggregate existing, Collection<MetricSample> samples) {
        Aggregate result = existing;
        for (MetricSample sample : samples) {
            result = merge(result, sample);
        }
        return result;
    }

    @Override
    public Aggregate combine(Aggregate left, Aggregate right) {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
        if (!left.key().equals(right.key())) {
            throw new IllegalArgumentException("Cannot combine aggregates of different buckets: "
                    + left.key() + " vs " + right.key());
        }
        for (String id : right.getAppliedRecordIds()) {
            if (left.hasApplied(id)) {
                throw new IllegalArgumentException("Record '" + id + "' is present in both partial aggregates of "
                        + left.key());
            }
        }
        if (left.isEmpty()) {
            return right;
        }
        if (right.isEmpty()) {
            return left;
        }

        long count = left.getCount() + right.getCount();
        double delta = right.getMean() - left.getMean();
        double mean = left.getMean() + delta * right.getCount() / count;
        double m2 = left.getM2() + right.getM2()
                + delta * delta * ((double) left.getCount() * right.getCount() / count);

        Set<String> applied = new HashSet<>(left.getAppliedRecordIds());
        applied.addAll(right.getAppliedRecordIds());

        return new Aggregate(left.getMetricName(), left.getBucketStart(), left.getBucketWidth(),
                count,
                left.getSum() + right.getSum(),
                left.getSumSq() + right.getSumSq(),
                Math.min(left.getMin(), right.getMin()),
                Math.max(left.getMax(), right.getMax()),
                mean, m2, applied);
    }

    @Override
    public AggregateStats finalize(Aggregate aggregate) {
        if (aggregate.isEmpty()) {
            return new AggregateStats(0, 0.0, 0.0);
        }
        double variance = aggregate.getM2() / aggregate.getCount();
        if (variance < 0) {
            log.debug("Clamping negative variance {} to 0 for {}", variance, aggregate.key());
            variance = 0.0;
        }
        return new AggregateStats(aggregate.getCount(), aggregate.getMean(), variance);
    }
}
