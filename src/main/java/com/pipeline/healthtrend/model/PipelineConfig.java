package com.pipeline.healthtrend.model;

import java.io.Serializable;
import java.time.Duration;

/**
 * 管道核心的注入式配置。
 * 所有参数均由外部注入，不在组件内部硬编码，便于确定性测试。
 */
public class PipelineConfig implements Serializable {

    // ---- 聚合 ----
    private Duration bucketWidth = Duration.ofHours(1);
    /** 聚合分片数，同一 (指标, 桶) 始终落在同一分片 */
    private int aggregationShards = 8;

    // ---- 检测 ----
    private int detectionWindow = 10;
    private int minimumSampleThreshold = 3;
    private SeverityThresholds severityThresholds = SeverityThresholds.defaults();
    /** 尾随标准差下限，防止近常数序列的除零放大 */
    private double stddevFloor = 1e-6;
    /** 检测时每页向前读取的历史桶数，缺桶时继续翻页；0 表示取 3 * detectionWindow */
    private int historyLookbackBuckets = 0;

    // ---- 归一化 ----
    private Duration retentionMaxAge = Duration.ofDays(365);
    private Duration futureSkew = Duration.ofMinutes(5);
    /** 归一化并行分块大小 */
    private int normalizationChunkSize = 256;

    // ---- 重试 ----
    private int retryMaxAttempts = 3;
    private Duration retryBackoffBase = Duration.ofMillis(200);
    private Duration retryBackoffMax = Duration.ofSeconds(5);
    private Duration sinkCallTimeout = Duration.ofSeconds(5);
    /** 单次受保护调用（含全部重试与退避）的总时限 */
    private Duration retryDeadline = Duration.ofSeconds(30);

    public PipelineConfig() {}

    public RetryPolicy retryPolicy() {
        return new RetryPolicy(retryMaxAttempts, retryBackoffBase, retryBackoffMax, sinkCallTimeout, retryDeadline);
    }

    public int effectiveLookbackBuckets() {
        return historyLookbackBuckets > 0 ? historyLookbackBuckets : 3 * detectionWindow;
    }

    /** 参数合法性校验，非法时抛出 IllegalArgumentException */
    public PipelineConfig validate() {
        if (bucketWidth == null || bucketWidth.isZero() || bucketWidth.isNegative()) {
            throw new IllegalArgumentException("bucketWidth must be positive, got: " + bucketWidth);
        }
        if (bucketWidth.toMillis() < 1) {
            throw new IllegalArgumentException("bucketWidth must be at least 1 ms, got: " + bucketWidth);
        }
        if (detectionWindow < 1) {
            throw new IllegalArgumentException("detectionWindow must be at least 1, got: " + detectionWindow);
        }
        if (minimumSampleThreshold < 1) {
            throw new IllegalArgumentException(
                    "minimumSampleThreshold must be at least 1, got: " + minimumSampleThreshold);
        }
        if (aggregationShards < 1) {
            throw new IllegalArgumentException("aggregationShards must be at least 1, got: " + aggregationShards);
        }
        if (!(stddevFloor > 0)) {
            throw new IllegalArgumentException("stddevFloor must be positive, got: " + stddevFloor);
        }
        if (normalizationChunkSize < 1) {
            throw new IllegalArgumentException(
                    "normalizationChunkSize must be at least 1, got: " + normalizationChunkSize);
        }
        retryPolicy();
        return this;
    }

    public Duration getBucketWidth() { return bucketWidth; }
    public PipelineConfig setBucketWidth(Duration bucketWidth) { this.bucketWidth = bucketWidth; return this; }
    public int getAggregationShards() { return aggregationShards; }
    public PipelineConfig setAggregationShards(int aggregationShards) { this.aggregationShards = aggregationShards; return this; }
    public int getDetectionWindow() { return detectionWindow; }
    public PipelineConfig setDetectionWindow(int detectionWindow) { this.detectionWindow = detectionWindow; return this; }
    public int getMinimumSampleThreshold() { return minimumSampleThreshold; }
    public PipelineConfig setMinimumSampleThreshold(int minimumSampleThreshold) { this.minimumSampleThreshold = minimumSampleThreshold; return this; }
    public SeverityThresholds getSeverityThresholds() { return severityThresholds; }
    public PipelineConfig setSeverityThresholds(SeverityThresholds severityThresholds) { this.severityThresholds = severityThresholds; return this; }
    public double getStddevFloor() { return stddevFloor; }
    public PipelineConfig setStddevFloor(double stddevFloor) { this.stddevFloor = stddevFloor; return this; }
    public int getHistoryLookbackBuckets() { return historyLookbackBuckets; }
    public PipelineConfig setHistoryLookbackBuckets(int historyLookbackBuckets) { this.historyLookbackBuckets = historyLookbackBuckets; return this; }
    public Duration getRetentionMaxAge() { return retentionMaxAge; }
    public PipelineConfig setRetentionMaxAge(Duration retentionMaxAge) { this.retentionMaxAge = retentionMaxAge; return this; }
    public Duration getFutureSkew() { return futureSkew; }
    public PipelineConfig setFutureSkew(Duration futureSkew) { this.futureSkew = futureSkew; return this; }
    public int getNormalizationChunkSize() { return normalizationChunkSize; }
    public PipelineConfig setNormalizationChunkSize(int normalizationChunkSize) { this.normalizationChunkSize = normalizationChunkSize; return this; }
    public int getRetryMaxAttempts() { return retryMaxAttempts; }
    public PipelineConfig setRetryMaxAttempts(int retryMaxAttempts) { this.retryMaxAttempts = retryMaxAttempts; return this; }
    public Duration getRetryBackoffBase() { return retryBackoffBase; }
    public PipelineConfig setRetryBackoffBase(Duration retryBackoffBase) { this.retryBackoffBase = retryBackoffBase; return this; }
    public Duration getRetryBackoffMax() { return retryBackoffMax; }
    public PipelineConfig setRetryBackoffMax(Duration retryBackoffMax) { this.retryBackoffMax = retryBackoffMax; return this; }
    public Duration getRetryDeadline() { return retryDeadline; }
    public PipelineConfig setRetryDeadline(Duration retryDeadline) { this.retryDeadline = retryDeadline; return this; }
    public Duration getSinkCallTimeout() { return sinkCallTimeout; }
    public PipelineConfig setSinkCallTimeout(Duration sinkCallTimeout) { this.sinkCallTimeout = sinkCallTimeout; return this; }

    @Override
    public String toString() {
        return "PipelineConfig{bucketWidth=" + bucketWidth
                + ", window=" + detectionWindow
                + ", minSamples=" + minimumSampleThreshold
                + ", thresholds=" + severityThresholds
                + ", shards=" + aggregationShards
                + ", retry=" + retryMaxAttempts + "x" + retryBackoffBase + "}";
    }
}
