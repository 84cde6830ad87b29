package com.pipeline.healthtrend.core;

import com.pipeline.healthtrend.model.Aggregate;
import com.pipeline.healthtrend.model.Anomaly;
import com.pipeline.healthtrend.model.BucketAssessment;
import com.pipeline.healthtrend.model.ObservedStatistic;

import java.time.Instant;
import java.util.List;

/**
 * 异常检测器接口 —— 基于尾随窗口的统计检测。
 *
 * 对单个指标的有序聚合序列，逐桶计算：
 *   observed  = 当前桶的统计量（默认均值，计数型指标取样本数）
 *   expected  = 尾随 W 个有效桶同一统计量的平均
 *   deviation = (observed - expected) / max(尾随标准差, epsilon)
 * 再按分级阈值归为 LOW / MEDIUM / HIGH。
 *
 * 检测器在调用之间无状态，除传入的序列外不依赖任何历史，
 * 对固定输入可重放、可测试。
 */
public interface AnomalyDetector {

    /**
     * 检测异常。
     *
     * @param series 单个指标的聚合序列
     * @param window 尾随窗口大小 W
     * @return 已分级的异常列表，按桶起点升序
     */
    List<Anomaly> detect(List<Aggregate> series, int window);

    /**
     * 逐桶评估，包含 NORMAL / INSUFFICIENT_DATA / UNKNOWN 等非异常结论。
     *
     * @param series 单个指标的聚合序列
     * @param window 尾随窗口大小 W
     * @return 每个桶一条评估，按桶起点升序
     */
    List<BucketAssessment> evaluate(List<Aggregate> series, int window);

    /**
     * 只评估桶起点不早于 from 的桶；更早的桶仍参与尾随窗口。
     *
     * @param series 单个指标的聚合序列
     * @param window 尾随窗口大小 W
     * @param from   评估起点；为null时评估全部
     * @return 评估列表
     */
    List<BucketAssessment> evaluate(List<Aggregate> series, int window, Instant from);

    /**
     * 以指定统计量代表每个桶进行评估。
     *
     * @param series    单个指标的聚合序列
     * @param window    尾随窗口大小 W
     * @param from      评估起点；为null时评估全部
     * @param statistic 观测值与尾随窗口共同使用的统计量
     * @return 评估列表
     */
    List<BucketAssessment> evaluate(List<Aggregate> series, int window, Instant from, ObservedStatistic statistic);
}
