package com.pipeline.healthtrend.exception;

/**
 * 作业不存在或阶段转换不合法
 */
public class JobStateException extends RuntimeException {

    public JobStateException(String message) {
        super(message);
    }
}
