package com.pipeline.healthtrend.core;

/**
 * 上传来源接口 —— 持续接收上传批次并提交为作业的后台采集器
 */
public interface UploadSource {

    /**
     * 开始接收上传。重复调用应被忽略。
     */
    void start();

    /**
     * 停止接收上传，已提交的作业不受影响。
     */
    void stop();
}
