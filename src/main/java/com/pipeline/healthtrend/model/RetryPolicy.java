package com.pipeline.healthtrend.model;

import java.io.Serializable;
import java.time.Duration;

/**
 * 外部协作者调用的重试策略：最大尝试次数 + 指数退避 + 总时限
 */
public final class RetryPolicy implements Serializable {
    private final int maxAttempts;
    private final Duration backoffBase;
    private final Duration backoffMax;
    /** 单次调用超时，计入重试预算 */
    private final Duration callTimeout;
    /** 一次受保护调用从首次尝试起的总时限；为null时只受尝试次数约束 */
    private final Duration deadline;

    public RetryPolicy(int maxAttempts, Duration backoffBase, Duration backoffMax, Duration callTimeout) {
        this(maxAttempts, backoffBase, backoffMax, callTimeout, null);
    }

    public RetryPolicy(int maxAttempts, Duration backoffBase, Duration backoffMax, Duration callTimeout,
                       Duration deadline) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got: " + maxAttempts);
        }
        if (backoffBase.isNegative() || backoffMax.compareTo(backoffBase) < 0) {
            throw new IllegalArgumentException("Invalid backoff bounds: base=" + backoffBase + ", max=" + backoffMax);
        }
        this.maxAttempts = maxAttempts;
        this.backoffBase = backoffBase;
        this.backoffMax = backoffMax;
        if (deadline != null && (deadline.isZero() || deadline.isNegative())) {
            throw new IllegalArgumentException("Retry deadline must be positive, got: " + deadline);
        }
        this.callTimeout = callTimeout;
        this.deadline = deadline;
    }

    /**
     * 第 attempt 次失败后的等待时长：base * 2^(attempt-1)，不超过 backoffMax
     */
    public Duration backoffAfter(int attempt) {
        int exponent = Math.min(20, Math.max(0, attempt - 1));
        Duration delay = backoffBase.multipliedBy(1L << exponent);
        return delay.compareTo(backoffMax) > 0 ? backoffMax : delay;
    }

    public int getMaxAttempts() { return maxAttempts; }
    public Duration getBackoffBase() { return backoffBase; }
    public Duration getBackoffMax() { return backoffMax; }
    public Duration getCallTimeout() { return callTimeout; }
    public Duration getDeadline() { return deadline; }

    @Override
    public String toString() {
        return "RetryPolicy{maxAttempts=" + maxAttempts + ", base=" + backoffBase
                + ", max=" + backoffMax + ", timeout=" + callTimeout + ", deadline=" + deadline + "}";
    }
}
