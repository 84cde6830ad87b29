package com.pipeline.healthtrend.exception;

import java.time.Instant;

/**
 * 尾随窗口内的有效历史桶不足 W 个。
 * 属于稳态下的正常情况，检测器将其转换为 UNKNOWN 状态，不会导致作业失败。
 */
public class InsufficientHistoryException extends RuntimeException {

    private final Instant bucketStart;
    private final int available;
    private final int required;

    public InsufficientHistoryException(Instant bucketStart, int available, int required) {
        super("Only " + available + " of " + required + " history buckets available before " + bucketStart);
        this.bucketStart = bucketStart;
        this.available = available;
        this.required = required;
    }

    public Instant getBucketStart() { return bucketStart; }
    public int getAvailable() { return available; }
    public int getRequired() { return required; }
}
