package com.pipeline.healthtrend.core;

/**
 * 运行时环境接口 —— 系统的骨架和生命周期管理者。
 *
 * 采用构建者模式支持链式配置，将各组件注入后统一启动。
 * 典型用法：
 * <pre>
 * DefaultEnvironment.initialize()
 *     .setResultSink(resultSink)
 *     .setJobStore(jobStore)
 *     .setOrchestrator(orchestrator)
 *     .addUploadSource(kafkaCollector)
 *     .start();
 * </pre>
 */
public interface Environment {

    /**
     * 配置结果存储。
     *
     * @param resultSink 结果存储
     * @return 当前环境实例，支持链式调用
     */
    Environment setResultSink(ResultSink resultSink);

    /**
     * 配置作业存储。
     *
     * @param jobStore 作业存储
     * @return 当前环境实例，支持链式调用
     */
    Environment setJobStore(JobStore jobStore);

    /**
     * 配置管道编排器。
     *
     * @param orchestrator 管道编排器
     * @return 当前环境实例，支持链式调用
     */
    Environment setOrchestrator(PipelineOrchestrator orchestrator);

    /**
     * 追加一个上传来源，可为零个或多个。
     *
     * @param uploadSource 上传来源
     * @return 当前环境实例，支持链式调用
     */
    Environment addUploadSource(UploadSource uploadSource);

    /**
     * 启动运行时环境。
     * 必要组件就绪后依次启动上传来源，系统开始接收作业。
     *
     * @throws IllegalStateException 必要组件未配置时抛出
     */
    void start();

    /**
     * 优雅关闭：先停止上传来源，再等待执行中的作业结束，最后关闭作业存储。
     */
    void shutdown();
}
