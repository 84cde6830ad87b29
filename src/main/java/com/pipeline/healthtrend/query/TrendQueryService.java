package com.pipeline.healthtrend.query;

import com.pipeline.healthtrend.core.AggregationEngine;
import com.pipeline.healthtrend.core.ResultSink;
import com.pipeline.healthtrend.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

/**
 * 趋势查询服务，面向看板的只读视图。
 * 所有数据均来自结果存储，本身不持有状态。
 */
public class TrendQueryService {

    private static final Logger log = LoggerFactory.getLogger(TrendQueryService.class);

    private final ResultSink resultSink;
    private final AggregationEngine aggregationEngine;

    public TrendQueryService(ResultSink resultSink, AggregationEngine aggregationEngine) {
        this.resultSink = Objects.requireNonNull(resultSink, "resultSink");
        this.aggregationEngine = Objects.requireNonNull(aggregationEngine, "aggregationEngine");
    }

    /**
     * 查询近期异常。
     *
     * @param since       桶起点下限（含）
     * @param minSeverity 最低严重等级；为null时不过滤
     * @return 按桶起点降序排列的异常，同一桶内按指标名升序
     */
    public List<Anomaly> recentAnomalies(Instant since, Severity minSeverity) {
        List<Anomaly> result = resultSink.listAnomalies(since).stream()
                .filter(a -> minSeverity == null || a.getSeverity().isAtLeast(minSeverity))
                .sorted(Comparator.comparing(Anomaly::getBucketStart).reversed()
                        .thenComparing(Anomaly::getMetricName))
                .collect(Collectors.toList());
        log.debug("Found {} anomalies since {} at severity >= {}", result.size(), since, minSeverity);
        return result;
    }

    /**
     * 查询指标在区间内的聚合序列。
     *
     * @return 按桶起点升序
     */
    public List<Aggregate> trend(String metricName, TimeRange range) {
        List<Aggregate> series = new ArrayList<>(resultSink.listSeries(metricName, range));
        series.sort(Comparator.comparing(Aggregate::getBucketStart));
        return series;
    }

    /**
     * 查询指标在区间内每个桶的派生统计（均值、方差、标准差）。
     *
     * @return 桶起点 -> 统计视图，按桶起点升序
     */
    public SortedMap<Instant, AggregateStats> trendStats(String metricName, TimeRange range) {
        SortedMap<Instant, AggregateStats> stats = new TreeMap<>();
        for (Aggregate aggregate : trend(metricName, range)) {
            stats.put(aggregate.getBucketStart(), aggregationEngine.finalize(aggregate));
        }
        return stats;
    }
}
