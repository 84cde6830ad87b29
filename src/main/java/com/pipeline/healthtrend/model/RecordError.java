package com.pipeline.healthtrend.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * 单条记录的处理错误，按输入顺序累积在作业上
 */
public final class RecordError implements Serializable {
    /** 记录标识；记录自身无标识时为批内序号，形如 "#3" */
    private final String recordId;
    private final String field;
    private final ValidationReason reason;
    private final String message;

    public RecordError(String recordId, String field, ValidationReason reason, String message) {
        this.recordId = Objects.requireNonNull(recordId, "recordId");
        this.field = field;
        this.reason = Objects.requireNonNull(reason, "reason");
        this.message = message;
    }

    public String getRecordId() { return recordId; }
    public String getField() { return field; }
    public ValidationReason getReason() { return reason; }
    public String getMessage() { return message; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RecordError)) return false;
        RecordError that = (RecordError) o;
        return recordId.equals(that.recordId) && Objects.equals(field, that.field)
                && reason == that.reason && Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(recordId, field, reason, message);
    }

    @Override
    public String toString() {
        return recordId + ": " + reason + (field != null ? " [" + field + "]" : "")
                + (message != null ? " " + message : "");
    }
}
