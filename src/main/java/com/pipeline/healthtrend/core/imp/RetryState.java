package com.pipeline.healthtrend.core.imp;

import com.pipeline.healthtrend.model.RetryPolicy;

import java.time.Duration;
import java.util.function.LongSupplier;

/**
 * 单次受保护调用的重试状态：显式的尝试计数、截止时间与最近一次失败原因。
 * 每个调用点独立持有，不跨调用共享。
 */
public class RetryState {

    private final RetryPolicy policy;
    private final LongSupplier nanoTime;
    /** 截止时刻（纳秒时钟）；策略未设时限时为 Long.MAX_VALUE */
    private final long deadlineNanos;
    private int attempts;
    private Duration totalBackoff = Duration.ZERO;
    private Exception lastFailure;
    private boolean deadlineExceeded;

    public RetryState(RetryPolicy policy) {
        this(policy, System::nanoTime);
    }

    public RetryState(RetryPolicy policy, LongSupplier nanoTime) {
        this.policy = policy;
        this.nanoTime = nanoTime;
        this.deadlineNanos = policy.getDeadline() != null
                ? nanoTime.getAsLong() + policy.getDeadline().toNanos()
                : Long.MAX_VALUE;
    }

    /** 记录一次失败，返回是否还允许再次尝试 */
    public boolean recordFailure(Exception failure) {
        attempts++;
        lastFailure = failure;
        if (attempts >= policy.getMaxAttempts()) {
            return false;
        }
        // 退避结束时已超过截止时间则不再尝试
        long resumeAt = nanoTime.getAsLong() + policy.backoffAfter(attempts).toNanos();
        if (deadlineNanos != Long.MAX_VALUE && resumeAt >= deadlineNanos) {
            deadlineExceeded = true;
            return false;
        }
        return true;
    }

    /** 当前失败之后应等待的时长 */
    public Duration nextBackoff() {
        Duration backoff = policy.backoffAfter(attempts);
        totalBackoff = totalBackoff.plus(backoff);
        return backoff;
    }

    public int getAttempts() { return attempts; }
    public Duration getTotalBackoff() { return totalBackoff; }
    public Exception getLastFailure() { return lastFailure; }
    public boolean isDeadlineExceeded() { return deadlineExceeded; }
    public boolean isExhausted() { return deadlineExceeded || attempts >= policy.getMaxAttempts(); }
}
