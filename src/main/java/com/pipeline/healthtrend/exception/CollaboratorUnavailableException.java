package com.pipeline.healthtrend.exception;

/**
 * 外部协作者（结果存储等）暂不可用。
 * 瞬时故障，按重试策略退避重试；预算耗尽后升级为作业失败。
 */
public class CollaboratorUnavailableException extends RuntimeException {

    public CollaboratorUnavailableException(String message) {
        super(message);
    }

    public CollaboratorUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
