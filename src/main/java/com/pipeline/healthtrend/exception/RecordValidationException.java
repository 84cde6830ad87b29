package com.pipeline.healthtrend.exception;

import com.pipeline.healthtrend.model.ValidationReason;

/**
 * 原始记录校验失败。
 * 可恢复：由批量归一化收集为作业错误条目，不中断同批其它记录。
 */
public class RecordValidationException extends RuntimeException {

    private final String field;
    private final ValidationReason reason;

    public RecordValidationException(String field, ValidationReason reason, String message) {
        super(message);
        this.field = field;
        this.reason = reason;
    }

    public String getField() { return field; }
    public ValidationReason getReason() { return reason; }
}
