package com.pipeline.healthtrend;

import com.pipeline.healthtrend.model.PipelineConfig;
import com.pipeline.healthtrend.model.SeverityThresholds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Properties;

/**
 * 应用配置类。
 * 对应配置文件中的系统级参数；文件不存在时回退到类路径下的 application.properties，再回退到默认值。
 */
public class AppConfig {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    static final String CLASSPATH_CONFIG = "application.properties";

    // ---- 作业执行 ----
    private int workerParallelism = Math.max(2, Runtime.getRuntime().availableProcessors() / 2);
    private int stageParallelism = Runtime.getRuntime().availableProcessors();

    // ---- 存储 ----
    private String storageType = "sqlite";
    private String storageRoot = "data/storage";

    // ---- 模式 ----
    private String schemaName = "standard";

    // ---- 聚合与检测 ----
    private long bucketWidthMinutes = 60;
    private int aggregationShards = 8;
    private int detectionWindow = 10;
    private int minimumSampleThreshold = 3;
    private double severityLow = 2.0;
    private double severityMedium = 3.0;
    private double severityHigh = 4.0;
    private double stddevFloor = 1e-6;
    private int historyLookbackBuckets = 0;

    // ---- 归一化 ----
    private long retentionMaxAgeDays = 365;
    private long futureSkewMinutes = 5;
    private int normalizationChunkSize = 256;

    // ---- 重试 ----
    private int retryMaxAttempts = 3;
    private long retryBackoffBaseMs = 200;
    private long retryBackoffMaxMs = 5000;
    private long sinkCallTimeoutMs = 5000;
    private long retryDeadlineMs = 30000;

    // ---- Kafka ----
    private boolean kafkaEnabled = false;
    private String kafkaBootstrapServers = "localhost:9092";
    private String kafkaUploadTopic = "health-uploads";
    private String kafkaGroupId = "health-trend-pipeline";

    public static AppConfig load(String configPath) {
        AppConfig config = new AppConfig();
        Properties props = new Properties();
        try (InputStream in = open(configPath)) {
            if (in == null) {
                log.warn("No configuration found at '{}' or on classpath, using defaults.", configPath);
                return config;
            }
            props.load(in);
            config.apply(props);
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Failed to load config from {}, using defaults. Error: {}", configPath, e.getMessage());
            return new AppConfig();
        }
        return config;
    }

    private static InputStream open(String configPath) throws IOException {
        if (configPath != null && new java.io.File(configPath).isFile()) {
            return new FileInputStream(configPath);
        }
        return AppConfig.class.getClassLoader().getResourceAsStream(CLASSPATH_CONFIG);
    }

    private void apply(Properties props) {
        workerParallelism = Integer.parseInt(
                props.getProperty("worker.parallelism", String.valueOf(workerParallelism)));
        stageParallelism = Integer.parseInt(
                props.getProperty("stage.parallelism", String.valueOf(stageParallelism)));
        storageType = props.getProperty("storage.type", storageType).trim();
        storageRoot = props.getProperty("storage.root", storageRoot).trim();
        schemaName = props.getProperty("schema", schemaName).trim();
        bucketWidthMinutes = Long.parseLong(
                props.getProperty("bucket.width.minutes", String.valueOf(bucketWidthMinutes)));
        aggregationShards = Integer.parseInt(
                props.getProperty("aggregation.shards", String.valueOf(aggregationShards)));
        detectionWindow = Integer.parseInt(
                props.getProperty("detection.window", String.valueOf(detectionWindow)));
        minimumSampleThreshold = Integer.parseInt(
                props.getProperty("detection.min.samples", String.valueOf(minimumSampleThreshold)));
        severityLow = Double.parseDouble(
                props.getProperty("severity.low", String.valueOf(severityLow)));
        severityMedium = Double.parseDouble(
                props.getProperty("severity.medium", String.valueOf(severityMedium)));
        severityHigh = Double.parseDouble(
                props.getProperty("severity.high", String.valueOf(severityHigh)));
        stddevFloor = Double.parseDouble(
                props.getProperty("detection.stddev.floor", String.valueOf(stddevFloor)));
        historyLookbackBuckets = Integer.parseInt(
                props.getProperty("detection.lookback.buckets", String.valueOf(historyLookbackBuckets)));
        retentionMaxAgeDays = Long.parseLong(
                props.getProperty("retention.max.age.days", String.valueOf(retentionMaxAgeDays)));
        futureSkewMinutes = Long.parseLong(
                props.getProperty("retention.future.skew.minutes", String.valueOf(futureSkewMinutes)));
        normalizationChunkSize = Integer.parseInt(
                props.getProperty("normalization.chunk.size", String.valueOf(normalizationChunkSize)));
        retryMaxAttempts = Integer.parseInt(
                props.getProperty("retry.max.attempts", String.valueOf(retryMaxAttempts)));
        retryBackoffBaseMs = Long.parseLong(
                props.getProperty("retry.backoff.base.ms", String.valueOf(retryBackoffBaseMs)));
        retryBackoffMaxMs = Long.parseLong(
                props.getProperty("retry.backoff.max.ms", String.valueOf(retryBackoffMaxMs)));
        sinkCallTimeoutMs = Long.parseLong(
                props.getProperty("sink.call.timeout.ms", String.valueOf(sinkCallTimeoutMs)));
        retryDeadlineMs = Long.parseLong(
                props.getProperty("retry.deadline.ms", String.valueOf(retryDeadlineMs)));
        kafkaEnabled = Boolean.parseBoolean(
                props.getProperty("kafka.enabled", String.valueOf(kafkaEnabled)));
        kafkaBootstrapServers = props.getProperty("kafka.bootstrap.servers", kafkaBootstrapServers);
        kafkaUploadTopic = props.getProperty("kafka.upload.topic", kafkaUploadTopic);
        kafkaGroupId = props.getProperty("kafka.group.id", kafkaGroupId);
    }

    /**
     * 派生注入管道核心的配置
     */
    public PipelineConfig toPipelineConfig() {
        return new PipelineConfig()
                .setBucketWidth(Duration.ofMinutes(bucketWidthMinutes))
                .setAggregationShards(aggregationShards)
                .setDetectionWindow(detectionWindow)
                .setMinimumSampleThreshold(minimumSampleThreshold)
                .setSeverityThresholds(new SeverityThresholds(severityLow, severityMedium, severityHigh))
                .setStddevFloor(stddevFloor)
                .setHistoryLookbackBuckets(historyLookbackBuckets)
                .setRetentionMaxAge(Duration.ofDays(retentionMaxAgeDays))
                .setFutureSkew(Duration.ofMinutes(futureSkewMinutes))
                .setNormalizationChunkSize(normalizationChunkSize)
                .setRetryMaxAttempts(retryMaxAttempts)
                .setRetryBackoffBase(Duration.ofMillis(retryBackoffBaseMs))
                .setRetryBackoffMax(Duration.ofMillis(retryBackoffMaxMs))
                .setSinkCallTimeout(Duration.ofMillis(sinkCallTimeoutMs))
                .setRetryDeadline(Duration.ofMillis(retryDeadlineMs))
                .validate();
    }

    // ---- Getters ----
    public int getWorkerParallelism() { return workerParallelism; }
    public int getStageParallelism() { return stageParallelism; }
    public String getStorageType() { return storageType; }
    public String getStorageRoot() { return storageRoot; }
    public String getSchemaName() { return schemaName; }
    public long getBucketWidthMinutes() { return bucketWidthMinutes; }
    public int getDetectionWindow() { return detectionWindow; }
    public int getMinimumSampleThreshold() { return minimumSampleThreshold; }
    public int getRetryMaxAttempts() { return retryMaxAttempts; }
    public boolean isKafkaEnabled() { return kafkaEnabled; }
    public String getKafkaBootstrapServers() { return kafkaBootstrapServers; }
    public String getKafkaUploadTopic() { return kafkaUploadTopic; }
    public String getKafkaGroupId() { return kafkaGroupId; }

    @Override
    public String toString() {
        return "AppConfig{workers=" + workerParallelism
                + ", stageParallelism=" + stageParallelism
                + ", storage=" + storageType + ":'" + storageRoot + "'"
                + ", schema=" + schemaName
                + ", bucket=" + bucketWidthMinutes + "min"
                + ", window=" + detectionWindow
                + ", kafka=" + (kafkaEnabled ? "'" + kafkaBootstrapServers + "'" : "disabled") + "}";
    }
}
