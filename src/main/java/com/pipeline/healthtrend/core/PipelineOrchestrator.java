package com.pipeline.healthtrend.core;

import com.pipeline.healthtrend.model.Job;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Future;

/**
 * 管道编排器接口 —— 驱动 归一化 → 聚合 → 检测 的多阶段作业。
 *
 * 执行流程：
 *   NORMALIZING → AGGREGATING → DETECTING → DONE
 *   （任一阶段遇到不可恢复错误转入 FAILED；阶段边界处可被取消）
 *
 * 每个阶段先提交输出再推进阶段（先提交聚合值，再提交异常），
 * 因而对已处于 DETECTING 的作业重新 run 会幂等地重新检测。
 * 记录级错误只累积到作业上，不会导致整个作业失败。
 */
public interface PipelineOrchestrator {

    /**
     * 创建作业并提交到作业线程池异步执行。
     *
     * @param inputBatchRef 上传批次引用
     * @param rawBatch      原始记录批次
     * @return 作业完成后的状态
     */
    Future<Job> submit(String inputBatchRef, List<Map<String, Object>> rawBatch);

    /**
     * 在当前线程同步执行作业，从作业当前阶段继续。
     *
     * @param jobId    作业标识
     * @param rawBatch 原始记录批次
     * @return 执行结束后的作业
     */
    Job run(String jobId, List<Map<String, Object>> rawBatch);

    /**
     * 显式重试 FAILED 作业：从失败阶段重新进入并执行。
     *
     * @param jobId    作业标识
     * @param rawBatch 原始记录批次（与首次提交相同）
     * @return 执行结束后的作业
     */
    Job retry(String jobId, List<Map<String, Object>> rawBatch);

    /**
     * 请求取消作业，在下一个阶段开始前生效；阶段中途不中断。
     *
     * @param jobId 作业标识
     * @return 请求是否被接受
     */
    boolean cancel(String jobId);

    /**
     * 停止接收新作业，等待执行中的作业结束。
     */
    void shutdown();
}
