package com.pipeline.healthtrend.model;

/**
 * 记录字段的声明类型
 */
public enum FieldType {
    TEXT,
    NUMBER,
    /** 整数，数字字符串同样可接受 */
    INTEGER,
    TIMESTAMP
}
