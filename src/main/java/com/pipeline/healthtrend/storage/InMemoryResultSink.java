package com.pipeline.healthtrend.storage;

import com.pipeline.healthtrend.core.ResultSink;
import com.pipeline.healthtrend.model.Aggregate;
import com.pipeline.healthtrend.model.Anomaly;
import com.pipeline.healthtrend.model.BucketKey;
import com.pipeline.healthtrend.model.TimeRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * 内存结果存储，用于测试和临时运行。
 * 以有序跳表按 (指标, 桶起点) 索引，序列查询直接取子映射。
 */
public class InMemoryResultSink implements ResultSink {

    private static final Logger log = LoggerFactory.getLogger(InMemoryResultSink.class);

    private final ConcurrentSkipListMap<BucketKey, Aggregate> aggregates = new ConcurrentSkipListMap<>();
    private final ConcurrentSkipListMap<BucketKey, Anomaly> anomalies = new ConcurrentSkipListMap<>();

    public InMemoryResultSink() {
        log.info("InMemoryResultSink initialized.");
    }

    @Override
    public Optional<Aggregate> getAggregate(String metricName, Instant bucketStart) {
        return Optional.ofNullable(aggregates.get(new BucketKey(metricName, bucketStart)));
    }

    @Override
    public void putAggregate(Aggregate aggregate) {
        aggregates.put(aggregate.key(), aggregate);
    }

    @Override
    public void putAnomaly(Anomaly anomaly) {
        anomalies.put(anomaly.key(), anomaly);
    }

    @Override
    public void deleteAnomaly(String metricName, Instant bucketStart) {
        anomalies.remove(new BucketKey(metricName, bucketStart));
    }

    @Override
    public List<Aggregate> listSeries(String metricName, Instant since) {
        return new ArrayList<>(aggregates.subMap(
                new BucketKey(metricName, since), true,
                new BucketKey(metricName, Instant.MAX), true).values());
    }

    @Override
    public List<Aggregate> listSeries(String metricName, TimeRange range) {
        return new ArrayList<>(aggregates.subMap(
                new BucketKey(metricName, range.getStart()), true,
                new BucketKey(metricName, range.getEnd()), false).values());
    }

    @Override
    public List<Aggregate> listSeriesBefore(String metricName, Instant before, int limit) {
        List<Aggregate> recent = new ArrayList<>();
        for (Aggregate aggregate : aggregates.subMap(
                new BucketKey(metricName, Instant.MIN), true,
                new BucketKey(metricName, before), false).descendingMap().values()) {
            if (recent.size() >= limit) {
                break;
            }
            recent.add(aggregate);
        }
        Collections.reverse(recent);
        return recent;
    }

    @Override
    public List<Anomaly> listAnomalies(Instant since) {
        List<Anomaly> result = new ArrayList<>();
        for (Map.Entry<BucketKey, Anomaly> entry : anomalies.entrySet()) {
            if (!entry.getKey().getBucketStart().isBefore(since)) {
                result.add(entry.getValue());
            }
        }
        return result;
    }

    public int aggregateCount() {
        return aggregates.size();
    }

    public int anomalyCount() {
        return anomalies.size();
    }
}
