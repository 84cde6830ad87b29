package com.pipeline.healthtrend.core.imp;

import com.pipeline.healthtrend.core.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 运行时环境默认实现。
 * 管理所有核心组件的生命周期，控制系统启停。
 */
public class DefaultEnvironment implements Environment {

    private static final Logger log = LoggerFactory.getLogger(DefaultEnvironment.class);

    private ResultSink resultSink;
    private JobStore jobStore;
    private PipelineOrchestrator orchestrator;
    private final List<UploadSource> uploadSources = new ArrayList<>();

    private final AtomicBoolean running = new AtomicBoolean(false);

    private DefaultEnvironment() {}

    public static DefaultEnvironment initialize() {
        log.info("Initializing health trend pipeline environment...");
        return new DefaultEnvironment();
    }

    @Override
    public Environment setResultSink(ResultSink resultSink) {
        this.resultSink = resultSink;
        return this;
    }

    @Override
    public Environment setJobStore(JobStore jobStore) {
        this.jobStore = jobStore;
        return this;
    }

    @Override
    public Environment setOrchestrator(PipelineOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
        return this;
    }

    @Override
    public Environment addUploadSource(UploadSource uploadSource) {
        if (uploadSource == null) {
            throw new IllegalArgumentException("UploadSource must not be null");
        }
        uploadSources.add(uploadSource);
        return this;
    }

    @Override
    public void start() {
        validateComponents();

        if (!running.compareAndSet(false, true)) {
            log.warn("Environment is already running, ignoring duplicate start.");
            return;
        }

        log.info("Starting health trend pipeline environment...");
        // 存储与作业存储在构造时已就绪，这里只需启动上传来源
        for (UploadSource source : uploadSources) {
            log.info("Starting upload source {}...", source.getClass().getSimpleName());
            source.start();
        }
        log.info("Health trend pipeline environment started with {} upload sources.", uploadSources.size());
    }

    @Override
    public void shutdown() {
        if (!running.compareAndSet(true, false)) {
            log.warn("Environment is not running, ignoring shutdown.");
            return;
        }

        log.info("Shutting down health trend pipeline environment...");

        // 按与启动相反的顺序关闭
        for (int i = uploadSources.size() - 1; i >= 0; i--) {
            UploadSource source = uploadSources.get(i);
            try {
                source.stop();
            } catch (RuntimeException e) {
                log.error("Failed to stop upload source {}: {}", source.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
        orchestrator.shutdown();
        jobStore.close();

        log.info("Health trend pipeline environment shut down successfully.");
    }

    private void validateComponents() {
        if (resultSink == null) throw new IllegalStateException("ResultSink is required");
        if (jobStore == null) throw new IllegalStateException("JobStore is required");
        if (orchestrator == null) throw new IllegalStateException("PipelineOrchestrator is required");
    }

    // ---- Getter methods for inter-component access ----

    public ResultSink getResultSink() { return resultSink; }
    public JobStore getJobStore() { return jobStore; }
    public PipelineOrchestrator getOrchestrator() { return orchestrator; }
    public List<UploadSource> getUploadSources() { return Collections.unmodifiableList(uploadSources); }
    public boolean isRunning() { return running.get(); }
}
