package com.pipeline.healthtrend.model;

/**
 * 异常检测中代表一个桶的统计量。
 * 观测值与尾随窗口使用同一统计量。
 */
public enum ObservedStatistic {
    /** 桶内样本均值，适用于生命体征等测量型指标 */
    MEAN,
    /** 桶内样本数，适用于病例等计数型指标 */
    COUNT,
    /** 桶内样本值之和 */
    SUM;

    public double of(Aggregate aggregate) {
        switch (this) {
            case COUNT:
                return aggregate.getCount();
            case SUM:
                return aggregate.getSum();
            case MEAN:
            default:
                return aggregate.getMean();
        }
    }
}
