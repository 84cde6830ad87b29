package com.pipeline.healthtrend.core;

import com.pipeline.healthtrend.model.Aggregate;
import com.pipeline.healthtrend.model.Anomaly;
import com.pipeline.healthtrend.model.TimeRange;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 结果存储接口 —— 聚合值与异常的持久化层，也是并发作业之间唯一的协调点。
 *
 * 核心只依赖这一窄契约，不依赖具体存储。
 * 每个桶的写入相互独立，不假设跨键事务。
 * 存储不可用时抛出 CollaboratorUnavailableException，由调用方按重试策略处理。
 */
public interface ResultSink {

    /**
     * 读取单个桶的聚合值。
     *
     * @param metricName  指标名
     * @param bucketStart 桶起点
     * @return 聚合值；不存在时为空
     */
    Optional<Aggregate> getAggregate(String metricName, Instant bucketStart);

    /**
     * 写入聚合值（按 (指标, 桶) 覆盖）。
     *
     * @param aggregate 合并后的聚合值
     */
    void putAggregate(Aggregate aggregate);

    /**
     * 写入异常（按 (指标, 桶) 覆盖，最新检测生效）。
     *
     * @param anomaly 异常
     */
    void putAnomaly(Anomaly anomaly);

    /**
     * 删除单个桶的异常；重新检测判定为非异常时调用。
     *
     * @param metricName  指标名
     * @param bucketStart 桶起点
     */
    void deleteAnomaly(String metricName, Instant bucketStart);

    /**
     * 读取指标自 since（含）起的聚合序列。
     *
     * @param metricName 指标名
     * @param since      起始桶
     * @return 按桶起点升序的聚合序列
     */
    List<Aggregate> listSeries(String metricName, Instant since);

    /**
     * 读取指标在时间区间内的聚合序列。
     *
     * @param metricName 指标名
     * @param range      半开区间，按桶起点过滤
     * @return 按桶起点升序的聚合序列
     */
    List<Aggregate> listSeries(String metricName, TimeRange range);

    /**
     * 读取桶起点早于 before 的最近 limit 个聚合，不受日历跨度限制。
     *
     * @param metricName 指标名
     * @param before     桶起点上限（不含）
     * @param limit      最多返回的桶数
     * @return 按桶起点升序的聚合序列
     */
    List<Aggregate> listSeriesBefore(String metricName, Instant before, int limit);

    /**
     * 读取桶起点不早于 since 的全部异常。
     *
     * @param since 起始时间
     * @return 异常列表，顺序不作保证
     */
    List<Anomaly> listAnomalies(Instant since);
}
