package com.pipeline.healthtrend.exception;

import com.pipeline.healthtrend.model.ValidationReason;

/**
 * 字段内容无法转换为声明类型（如非数字的 value）
 */
public class RecordTypeException extends RecordValidationException {

    public RecordTypeException(String field, String message) {
        super(field, ValidationReason.TYPE_MISMATCH, message);
    }
}
