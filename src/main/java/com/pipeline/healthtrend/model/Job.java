package com.pipeline.healthtrend.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 处理作业实体，封装一次上传批次的运行状态。
 * 由作业存储独占维护，阶段变更必须经过 JobStore 的状态转换校验。
 */
public class Job implements Serializable {
    private String jobId;
    private String inputBatchRef;
    private JobStage stage;
    /** 进入 FAILED 前所处的阶段，用于显式重试 */
    private JobStage failedStage;
    private String failureSummary;
    private final List<RecordError> errors = new ArrayList<>();
    private long processedCount;
    private long rejectedCount;
    private volatile boolean cancelRequested;
    /** 聚合提交时记录：指标 -> 本作业触达的最早桶起点 */
    private final Map<String, Instant> touchedBuckets = new TreeMap<>();
    private int retryCount;
    private Instant createdAt;
    private Instant updatedAt;

    public Job() {}

    public Job(String jobId, String inputBatchRef, Instant createdAt) {
        this.jobId = jobId;
        this.inputBatchRef = inputBatchRef;
        this.stage = JobStage.NORMALIZING;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    public String getJobId() { return jobId; }
    public void setJobId(String jobId) { this.jobId = jobId; }
    public String getInputBatchRef() { return inputBatchRef; }
    public void setInputBatchRef(String inputBatchRef) { this.inputBatchRef = inputBatchRef; }
    public synchronized JobStage getStage() { return stage; }
    public synchronized void setStage(JobStage stage) { this.stage = stage; }
    public synchronized JobStage getFailedStage() { return failedStage; }
    public synchronized void setFailedStage(JobStage failedStage) { this.failedStage = failedStage; }
    public synchronized String getFailureSummary() { return failureSummary; }
    public synchronized void setFailureSummary(String failureSummary) { this.failureSummary = failureSummary; }
    public synchronized long getProcessedCount() { return processedCount; }
    public synchronized void setProcessedCount(long processedCount) { this.processedCount = processedCount; }
    public synchronized long getRejectedCount() { return rejectedCount; }
    public synchronized void setRejectedCount(long rejectedCount) { this.rejectedCount = rejectedCount; }
    public boolean isCancelRequested() { return cancelRequested; }
    public void setCancelRequested(boolean cancelRequested) { this.cancelRequested = cancelRequested; }
    public synchronized int getRetryCount() { return retryCount; }
    public synchronized void setRetryCount(int retryCount) { this.retryCount = retryCount; }
    public synchronized Instant getCreatedAt() { return createdAt; }
    public synchronized void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
    public synchronized Instant getUpdatedAt() { return updatedAt; }
    public synchronized void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }

    public synchronized List<RecordError> getErrors() {
        return Collections.unmodifiableList(new ArrayList<>(errors));
    }

    public synchronized void addErrors(List<RecordError> newErrors) {
        errors.addAll(newErrors);
    }

    public synchronized void clearErrors() {
        errors.clear();
    }

    public synchronized Map<String, Instant> getTouchedBuckets() {
        return Collections.unmodifiableMap(new TreeMap<>(touchedBuckets));
    }

    public synchronized void setTouchedBuckets(Map<String, Instant> buckets) {
        touchedBuckets.clear();
        touchedBuckets.putAll(buckets);
    }

    @Override
    public synchronized String toString() {
        return "Job{id='" + jobId + "', batch='" + inputBatchRef + "', stage=" + stage
                + ", processed=" + processedCount + ", rejected=" + rejectedCount + "}";
    }
}
