package com.pipeline.healthtrend.model;

/**
 * 记录校验失败原因
 */
public enum ValidationReason {
    /** 必选字段缺失或为空 */
    MISSING_FIELD,
    /** 字段内容无法转换为声明类型 */
    TYPE_MISMATCH,
    /** 时间戳格式无法解析 */
    INVALID_TIMESTAMP,
    /** 时间戳早于保留窗口 */
    TOO_OLD,
    /** 时间戳晚于允许的未来偏移 */
    FUTURE_DATED,
    /** 数值超出字段声明的范围 */
    OUT_OF_RANGE
}
