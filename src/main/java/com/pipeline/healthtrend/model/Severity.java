package com.pipeline.healthtrend.model;

/**
 * 异常严重等级，按声明顺序递增
 */
public enum Severity {
    /** 偏离分数落在 [low, medium) */
    LOW,
    /** 偏离分数落在 [medium, high) */
    MEDIUM,
    /** 偏离分数不低于 high */
    HIGH;

    public boolean isAtLeast(Severity other) {
        return this.compareTo(other) >= 0;
    }
}
