package com.pipeline.healthtrend.model;

/**
 * 单个桶的检测结论
 */
public enum DetectionStatus {
    /** 偏离分数低于最低阈值 */
    NORMAL,
    /** 已分级的异常 */
    ANOMALY,
    /** 桶内样本数低于最小样本阈值，未参与检测 */
    INSUFFICIENT_DATA,
    /** 尾随窗口不足 W 个有效桶，无法判断 */
    UNKNOWN
}
