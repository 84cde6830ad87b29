package com.pipeline.healthtrend.core;

import com.pipeline.healthtrend.model.Job;
import com.pipeline.healthtrend.model.JobStage;
import com.pipeline.healthtrend.model.RecordError;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * 作业存储接口 —— 作业的注册、阶段跟踪与生命周期管理中枢。
 *
 * 作为可注入的协作者在服务启动时创建、关闭时销毁，
 * 取代进程级的全局作业注册表。
 *
 * 阶段转换受转换表约束，只能单调前进；
 * 唯一的回退路径是对 FAILED 作业显式调用 retryFromStage。
 */
public interface JobStore {

    /**
     * 为一次上传创建作业，初始阶段为 NORMALIZING。
     *
     * @param inputBatchRef 上传批次引用
     * @return 新作业
     */
    Job create(String inputBatchRef);

    /**
     * 获取指定作业。
     *
     * @param jobId 作业标识
     * @return 作业实体
     * @throws com.pipeline.healthtrend.exception.JobStateException 作业不存在时抛出
     */
    Job get(String jobId);

    /**
     * 获取所有作业。
     *
     * @return 作业列表，按创建时间升序
     */
    List<Job> list();

    /**
     * 推进作业阶段。
     *
     * @param jobId 作业标识
     * @param stage 目标阶段
     * @throws com.pipeline.healthtrend.exception.JobStateException 转换不合法时抛出
     */
    void advance(String jobId, JobStage stage);

    /**
     * 将作业置为 FAILED，记录失败时所处阶段与错误摘要。
     *
     * @param jobId   作业标识
     * @param summary 可读的错误摘要
     */
    void fail(String jobId, String summary);

    /**
     * 对 FAILED 作业显式重试：回退到指定阶段（不晚于失败时所处阶段）。
     *
     * @param jobId 作业标识
     * @param stage 重新进入的阶段
     * @throws com.pipeline.healthtrend.exception.JobStateException 作业非 FAILED 或阶段不合法时抛出
     */
    void retryFromStage(String jobId, JobStage stage);

    /**
     * 记录归一化结果：处理/拒绝计数与记录级错误，重新归一化时覆盖上一次结果。
     *
     * @param jobId     作业标识
     * @param processed 成功归一化的记录数
     * @param errors    被拒记录
     */
    void recordNormalization(String jobId, long processed, List<RecordError> errors);

    /**
     * 记录聚合提交涉及的桶（指标 -> 最早桶起点）。
     *
     * @param jobId   作业标识
     * @param buckets 触达的桶
     */
    void recordTouchedBuckets(String jobId, Map<String, Instant> buckets);

    /**
     * 请求取消作业，在下一个阶段边界生效。
     *
     * @param jobId 作业标识
     * @return 请求是否被接受（作业已处于终态时返回false）
     */
    boolean requestCancel(String jobId);

    /**
     * 释放存储持有的资源。
     */
    void close();
}
