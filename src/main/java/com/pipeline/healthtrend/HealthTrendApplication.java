package com.pipeline.healthtrend;

import com.pipeline.healthtrend.collector.CsvBatchReader;
import com.pipeline.healthtrend.collector.KafkaUploadCollector;
import com.pipeline.healthtrend.core.ResultSink;
import com.pipeline.healthtrend.core.imp.*;
import com.pipeline.healthtrend.model.Job;
import com.pipeline.healthtrend.model.PipelineConfig;
import com.pipeline.healthtrend.model.SchemaDescriptor;
import com.pipeline.healthtrend.query.TrendQueryService;
import com.pipeline.healthtrend.storage.InMemoryResultSink;
import com.pipeline.healthtrend.storage.SQLiteResultSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.*;

/**
 * 系统启动引导类。
 * 一条命令完成全部初始化：创建存储、组装管道、启动上传来源，并可直接提交CSV文件。
 *
 * 用法：java -jar pipeline-healthtrend.jar [配置文件路径] [CSV文件...]
 */
public class HealthTrendApplication {

    private static final Logger log = LoggerFactory.getLogger(HealthTrendApplication.class);

    private DefaultEnvironment environment;
    private DefaultPipelineOrchestrator orchestrator;
    private ResultSink resultSink;
    private TrendQueryService queryService;
    private ForkJoinPool stagePool;
    private ExecutorService sinkCallPool;

    public void start(AppConfig config) {
        log.info("=== Healthcare Trend Anomaly Pipeline ===");
        log.info("Starting with config: {}", config);

        PipelineConfig pipelineConfig = config.toPipelineConfig();
        Clock clock = Clock.systemUTC();

        // 1. 初始化存储层
        resultSink = createResultSink(config);

        // 2. 初始化线程池：阶段并行 + 存储调用超时控制
        stagePool = new ForkJoinPool(
                config.getStageParallelism(),
                ForkJoinPool.defaultForkJoinWorkerThreadFactory,
                (t, e) -> log.error("Uncaught exception in stage thread {}: {}", t.getName(), e.getMessage(), e),
                false
        );
        sinkCallPool = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "sink-call");
            t.setDaemon(true);
            return t;
        });

        // 3. 组装管道组件
        SchemaDescriptor schema = resolveSchema(config.getSchemaName());
        DefaultAggregationEngine aggregationEngine = new DefaultAggregationEngine(pipelineConfig.getBucketWidth());
        InMemoryJobStore jobStore = new InMemoryJobStore(clock);
        orchestrator = new DefaultPipelineOrchestrator(
                new DefaultRecordNormalizer(pipelineConfig, clock, stagePool),
                aggregationEngine,
                new ZScoreAnomalyDetector(pipelineConfig, clock),
                resultSink,
                jobStore,
                schema,
                pipelineConfig,
                new RetryExecutor(pipelineConfig.retryPolicy(), sinkCallPool, RetryExecutor.THREAD_SLEEPER),
                config.getWorkerParallelism(),
                stagePool
        );
        queryService = new TrendQueryService(resultSink, aggregationEngine);

        // 4. 组装并启动运行时环境
        environment = DefaultEnvironment.initialize();
        environment.setResultSink(resultSink)
                .setJobStore(jobStore)
                .setOrchestrator(orchestrator);
        if (config.isKafkaEnabled()) {
            environment.addUploadSource(new KafkaUploadCollector(
                    config.getKafkaBootstrapServers(),
                    config.getKafkaUploadTopic(),
                    config.getKafkaGroupId(),
                    orchestrator));
        }

        // 注册JVM关闭钩子
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown hook triggered, performing graceful shutdown...");
            shutdown();
        }, "shutdown-hook"));

        environment.start();

        log.info("=== Pipeline started successfully ===");
    }

    /**
     * 读取CSV文件并作为一个作业提交
     */
    public Future<Job> submitCsv(Path file) throws IOException {
        List<Map<String, Object>> records = new CsvBatchReader().read(file);
        return orchestrator.submit(file.getFileName().toString(), records);
    }

    public synchronized void shutdown() {
        if (environment != null && environment.isRunning()) {
            environment.shutdown();
        }
        if (stagePool != null) {
            stagePool.shutdown();
            awaitQuietly(stagePool);
        }
        if (sinkCallPool != null) {
            sinkCallPool.shutdownNow();
        }
        if (resultSink instanceof SQLiteResultSink) {
            ((SQLiteResultSink) resultSink).shutdown();
            resultSink = null;
        }
        log.info("=== Pipeline shut down ===");
    }

    public TrendQueryService getQueryService() {
        return queryService;
    }

    private static ResultSink createResultSink(AppConfig config) {
        switch (config.getStorageType().toLowerCase()) {
            case "memory":
                return new InMemoryResultSink();
            case "sqlite":
                return new SQLiteResultSink(config.getStorageRoot());
            default:
                throw new IllegalArgumentException("Unknown storage type: " + config.getStorageType());
        }
    }

    static SchemaDescriptor resolveSchema(String name) {
        switch (name.toLowerCase()) {
            case "standard":
                return SchemaDescriptor.standard();
            case "case_counts":
                return SchemaDescriptor.caseCounts();
            default:
                throw new IllegalArgumentException("Unknown schema: " + name);
        }
    }

    private static void awaitQuietly(ForkJoinPool pool) {
        try {
            if (!pool.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Stage pool did not terminate in 10s.");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * 应用入口
     */
    public static void main(String[] args) {
        String configPath = (args.length > 0) ? args[0] : "config/application.properties";

        AppConfig config = AppConfig.load(configPath);
        HealthTrendApplication app = new HealthTrendApplication();
        app.start(config);

        List<Future<Job>> submitted = new ArrayList<>();
        for (int i = 1; i < args.length; i++) {
            Path csv = Paths.get(args[i]);
            try {
                submitted.add(app.submitCsv(csv));
            } catch (IOException e) {
                log.error("Failed to read upload file {}: {}", csv, e.getMessage(), e);
            }
        }

        // 未启用Kafka时为批处理模式：等待CSV作业结束后退出
        if (!config.isKafkaEnabled()) {
            for (Future<Job> future : submitted) {
                try {
                    Job job = future.get();
                    log.info("Upload '{}' finished: {}", job.getInputBatchRef(), job);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                } catch (ExecutionException e) {
                    log.error("Upload job failed: {}", e.getCause().getMessage(), e.getCause());
                }
            }
            app.shutdown();
        }
    }
}
