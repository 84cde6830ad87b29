package com.pipeline.healthtrend.core.imp;

import com.pipeline.healthtrend.exception.CollaboratorUnavailableException;
import com.pipeline.healthtrend.model.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.*;
import java.util.function.LongSupplier;

/**
 * 外部协作者调用的重试执行器。
 *
 * 只有 CollaboratorUnavailableException 与单次调用超时被视为瞬时故障，
 * 按指数退避重试；其余异常立即向上抛出。尝试次数或总时限耗尽后抛出
 * CollaboratorUnavailableException，由编排器升级为作业失败。
 */
public class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    /** 退避等待，测试中可替换为不实际休眠的实现 */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    public static final Sleeper THREAD_SLEEPER = d -> Thread.sleep(d.toMillis());

    private final RetryPolicy policy;
    /** 执行带超时调用的线程池；为null时在调用线程直接执行，不做超时控制 */
    private final ExecutorService callPool;
    private final Sleeper sleeper;
    private final LongSupplier nanoTime;

    public RetryExecutor(RetryPolicy policy) {
        this(policy, null, THREAD_SLEEPER);
    }

    public RetryExecutor(RetryPolicy policy, ExecutorService callPool, Sleeper sleeper) {
        this(policy, callPool, sleeper, System::nanoTime);
    }

    public RetryExecutor(RetryPolicy policy, ExecutorService callPool, Sleeper sleeper, LongSupplier nanoTime) {
        this.nanoTime = Objects.requireNonNull(nanoTime, "nanoTime");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.callPool = callPool;
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    public RetryPolicy getPolicy() {
        return policy;
    }

    public void run(String operation, Runnable action) {
        call(operation, () -> {
            action.run();
            return null;
        });
    }

    public <T> T call(String operation, Callable<T> action) {
        RetryState state = new RetryState(policy, nanoTime);
        while (true) {
            try {
                return invoke(operation, action);
            } catch (CollaboratorUnavailableException e) {
                if (!state.recordFailure(e)) {
                    String limit = state.isDeadlineExceeded()
                            ? " attempts (deadline " + policy.getDeadline().toMillis() + " ms exceeded)"
                            : " attempts";
                    log.error("{} failed after {}{}: {}", operation, state.getAttempts(), limit, e.getMessage());
                    throw new CollaboratorUnavailableException(operation + " failed after "
                            + state.getAttempts() + limit + ": " + e.getMessage(), e);
                }
                Duration backoff = state.nextBackoff();
                log.warn("{} failed (attempt {}/{}), retrying in {} ms: {}", operation,
                        state.getAttempts(), policy.getMaxAttempts(), backoff.toMillis(), e.getMessage());
                pause(operation, backoff);
            }
        }
    }

    private <T> T invoke(String operation, Callable<T> action) {
        if (callPool == null || policy.getCallTimeout() == null) {
            try {
                return action.call();
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new IllegalStateException(operation + " failed", e);
            }
        }

        Future<T> future = callPool.submit(action);
        try {
            return future.get(policy.getCallTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new CollaboratorUnavailableException(operation + " timed out after "
                    + policy.getCallTimeout().toMillis() + " ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new IllegalStateException(operation + " interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException(operation + " failed", cause);
        }
    }

    private void pause(String operation, Duration backoff) {
        try {
            sleeper.sleep(backoff);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(operation + " interrupted during backoff", e);
        }
    }
}
