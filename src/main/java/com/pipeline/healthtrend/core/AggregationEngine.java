package com.pipeline.healthtrend.core;

import com.pipeline.healthtrend.model.Aggregate;
import com.pipeline.healthtrend.model.AggregateStats;
import com.pipeline.healthtrend.model.MetricSample;

import java.time.Instant;
import java.util.Collection;

/**
 * 聚合引擎接口 —— 将样本折叠为按 (指标, 时间桶) 划分的充分统计量。
 *
 * 桶分配只依赖样本时间戳和配置的桶宽：
 *   bucketStart = floor(timestamp / bucketWidth) * bucketWidth
 * 与墙钟无关，重放结果确定。
 *
 * 合并满足交换律与结合律；同一来源记录标识在同一个桶内只生效一次，
 * 保证部分失败后重试上传不会重复计数。
 */
public interface AggregationEngine {

    /**
     * 计算样本时间戳所属桶的起点。
     *
     * @param timestamp 样本时间戳
     * @return 桶起点
     */
    Instant bucketStart(Instant timestamp);

    /**
     * 将一个样本合并入聚合值。
     *
     * @param existing 已有聚合值；为null表示该桶尚不存在
     * @param sample   待合并样本，必须属于 existing 对应的 (指标, 桶)
     * @return 合并后的新聚合值；样本已并入过时原样返回 existing
     * @throws IllegalArgumentException 样本与已有聚合值的指标或桶不一致时抛出
     */
    Aggregate merge(Aggregate existing, MetricSample sample);

    /**
     * 依次合并一组同键样本。
     *
     * @param existing 已有聚合值，可为null
     * @param samples  同一 (指标, 桶) 的样本
     * @return 合并结果；samples 为空且 existing 为null时返回null
     */
    Aggregate mergeAll(Aggregate existing, Collection<MetricSample> samples);

    /**
     * 合并两个同键的部分聚合值（并行分区归并）。
     * 两者的已并入记录集合必须不相交。
     *
     * @param left  部分聚合值
     * @param right 部分聚合值
     * @return 合并结果
     */
    Aggregate combine(Aggregate left, Aggregate right);

    /**
     * 计算派生统计视图。
     * 方差由 Welford 二阶矩得出，浮点漂移导致的负值被钳制为0。
     *
     * @param aggregate 聚合值
     * @return 均值、方差、标准差
     */
    AggregateStats finalize(Aggregate aggregate);
}
