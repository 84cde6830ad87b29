package com.pipeline.healthtrend.model;

/**
 * 作业阶段枚举。
 * 正常路径按声明顺序单调推进：NORMALIZING → AGGREGATING → DETECTING → DONE。
 */
public enum JobStage {
    /** 记录归一化 */
    NORMALIZING,
    /** 聚合合并与提交 */
    AGGREGATING,
    /** 异常检测与提交 */
    DETECTING,
    /** 全部阶段已提交 */
    DONE,
    /** 不可恢复错误，终态 */
    FAILED,
    /** 阶段边界处被取消，终态 */
    CANCELLED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED || this == CANCELLED;
    }

    /** 是否为可执行（可重试进入）的处理阶段 */
    public boolean isProcessing() {
        return this == NORMALIZING || this == AGGREGATING || this == DETECTING;
    }
}
