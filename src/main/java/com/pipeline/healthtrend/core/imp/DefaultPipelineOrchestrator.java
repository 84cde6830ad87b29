package com.pipeline.healthtrend.core.imp;

import com.pipeline.healthtrend.core.*;
import com.pipeline.healthtrend.exception.JobStateException;
import com.pipeline.healthtrend.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 管道编排器默认实现。
 *
 * 作业线程池中一个作业占用一个工作线程；作业内部的归一化分块、聚合分片
 * 与按指标的检测在阶段线程池（工作窃取）上并行。
 * 聚合写入按 (指标, 桶) 取进程级条带锁，两个并发作业不会同时合并同一个桶。
 */
public class DefaultPipelineOrchestrator implements PipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(DefaultPipelineOrchestrator.class);

    /** 进程级条带锁，所有编排器实例共享 */
    private static final int LOCK_STRIPES = 64;
    private static final ReentrantLock[] BUCKET_LOCKS = new ReentrantLock[LOCK_STRIPES];

    static {
        for (int i = 0; i < LOCK_STRIPES; i++) {
            BUCKET_LOCKS[i] = new ReentrantLock();
        }
    }

    private final RecordNormalizer normalizer;
    private final AggregationEngine aggregationEngine;
    private final AnomalyDetector anomalyDetector;
    private final ResultSink resultSink;
    private final JobStore jobStore;
    private final SchemaDescriptor schema;
    private final PipelineConfig config;
    private final RetryExecutor retryExecutor;

    /** 作业线程池：一个作业一个线程 */
    private final ExecutorService jobPool;
    /** 阶段线程池；为null时阶段内部串行执行 */
    private final ForkJoinPool stagePool;

    private volatile boolean shuttingDown = false;

    public DefaultPipelineOrchestrator(RecordNormalizer normalizer,
                                       AggregationEngine aggregationEngine,
                                       AnomalyDetector anomalyDetector,
                                       ResultSink resultSink,
                                       JobStore jobStore,
                                       SchemaDescriptor schema,
                                       PipelineConfig config,
                                       RetryExecutor retryExecutor,
                                       int workerParallelism,
                                       ForkJoinPool stagePool) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.aggregationEngine = Objects.requireNonNull(aggregationEngine, "aggregationEngine");
        this.anomalyDetector = Objects.requireNonNull(anomalyDetector, "anomalyDetector");
        this.resultSink = Objects.requireNonNull(resultSink, "resultSink");
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore");
        this.schema = Objects.requireNonNull(schema, "schema");
        this.config = Objects.requireNonNull(config, "config").validate();
        this.retryExecutor = Objects.requireNonNull(retryExecutor, "retryExecutor");
        if (workerParallelism < 1) {
            throw new IllegalArgumentException("workerParallelism must be at least 1, got: " + workerParallelism);
        }
        this.stagePool = stagePool;

        AtomicInteger threadIndex = new AtomicInteger();
        this.jobPool = Executors.newFixedThreadPool(workerParallelism, r -> {
            Thread t = new Thread(r, "pipeline-job-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            t.setUncaughtExceptionHandler((thread, e) ->
                    log.error("Uncaught exception in job thread {}: {}", thread.getName(), e.getMessage(), e));
            return t;
        });

        log.info("PipelineOrchestrator initialized. Workers: {}, Stage parallelism: {}, Config: {}",
                workerParallelism, stagePool != null ? stagePool.getParallelism() : 1, config);
    }

    @Override
    public Future<Job> submit(String inputBatchRef, List<Map<String, Object>> rawBatch) {
        if (shuttingDown) {
            throw new IllegalStateException("Orchestrator is shutting down, batch '" + inputBatchRef + "' rejected");
        }
        Job job = jobStore.create(inputBatchRef);
        return jobPool.submit(() -> run(job.getJobId(), rawBatch));
    }

    @Override
    public Job run(String jobId, List<Map<String, Object>> rawBatch) {
        Job job = jobStore.get(jobId);
        if (job.getStage().isTerminal()) {
            log.warn("Job '{}' is already {}, nothing to run.", jobId, job.getStage());
            return job;
        }

        List<Map<String, Object>> batch = rawBatch != null ? rawBatch : List.of();
        long startTime = System.currentTimeMillis();
        NormalizationResult normalized = null;
        JobStage stage = job.getStage();

        try {
            while (!stage.isTerminal()) {
                if (job.isCancelRequested()) {
                    jobStore.advance(jobId, JobStage.CANCELLED);
                    log.info("Job '{}' cancelled before stage {}.", jobId, stage);
                    break;
                }
                switch (stage) {
                    case NORMALIZING:
                        normalized = normalize(job, batch);
                        jobStore.recordNormalization(jobId, normalized.getSamples().size(), normalized.getErrors());
                        jobStore.advance(jobId, JobStage.AGGREGATING);
                        break;
                    case AGGREGATING:
                        if (normalized == null) {
                            // 从 AGGREGATING 恢复：归一化为纯函数，静默重算
                            normalized = normalize(job, batch);
                        }
                        Map<String, Instant> touched = aggregate(job, normalized.getSamples());
                        jobStore.recordTouchedBuckets(jobId, touched);
                        jobStore.advance(jobId, JobStage.DETECTING);
                        break;
                    case DETECTING:
                        detect(job, job.getTouchedBuckets());
                        jobStore.advance(jobId, JobStage.DONE);
                        break;
                    default:
                        throw new JobStateException("Job '" + jobId + "' cannot run from stage " + stage);
                }
                stage = job.getStage();
            }
        } catch (RuntimeException e) {
            String summary = failureSummary(job, e);
            log.error("Job '{}' aborted: {}", jobId, summary, e);
            jobStore.fail(jobId, summary);
            return job;
        }

        log.info("Job '{}' finished as {} in {}ms. Processed: {}, Rejected: {}",
                jobId, job.getStage(), System.currentTimeMillis() - startTime,
                job.getProcessedCount(), job.getRejectedCount());
        return job;
    }

    @Override
    public Job retry(String jobId, List<Map<String, Object>> rawBatch) {
        Job job = jobStore.get(jobId);
        if (job.getStage() != JobStage.FAILED) {
            throw new JobStateException("Job '" + jobId + "' is " + job.getStage() + ", only FAILED jobs can be retried");
        }
        JobStage resumeAt = job.getFailedStage() != null ? job.getFailedStage() : JobStage.NORMALIZING;
        jobStore.retryFromStage(jobId, resumeAt);
        return run(jobId, rawBatch);
    }

    @Override
    public boolean cancel(String jobId) {
        return jobStore.requestCancel(jobId);
    }

    @Override
    public void shutdown() {
        shuttingDown = true;
        jobPool.shutdown();
        try {
            if (!jobPool.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Jobs still running after 30s, forcing shutdown.");
                jobPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            jobPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("PipelineOrchestrator shut down.");
    }

    // ==================== 阶段实现 ====================

    private NormalizationResult normalize(Job job, List<Map<String, Object>> batch) {
        NormalizationResult result = normalizer.normalizeBatch(batch, schema);
        log.info("Job '{}' normalized {} records: {} samples, {} rejected.",
                job.getJobId(), batch.size(), result.getSamples().size(), result.getErrors().size());
        return result;
    }

    /**
     * 按 (指标, 桶) 分组后分片并行提交；返回每个指标触达的最早桶
     */
    private Map<String, Instant> aggregate(Job job, List<MetricSample> samples) {
        Map<BucketKey, List<MetricSample>> grouped = new LinkedHashMap<>();
        for (MetricSample sample : samples) {
            BucketKey key = new BucketKey(sample.getMetricName(), aggregationEngine.bucketStart(sample.getTimestamp()));
            grouped.computeIfAbsent(key, k -> new ArrayList<>()).add(sample);
        }

        int shardCount = config.getAggregationShards();
        List<List<BucketKey>> shards = new ArrayList<>(shardCount);
        for (int i = 0; i < shardCount; i++) {
            shards.add(new ArrayList<>());
        }
        for (BucketKey key : grouped.keySet()) {
            shards.get(Math.floorMod(key.hashCode(), shardCount)).add(key);
        }

        List<Callable<Void>> tasks = new ArrayList<>();
        for (List<BucketKey> shard : shards) {
            if (shard.isEmpty()) {
                continue;
            }
            tasks.add(() -> {
                for (BucketKey key : shard) {
                    commitBucket(key, grouped.get(key));
                }
                return null;
            });
        }
        runAll(tasks);

        Map<String, Instant> touched = new TreeMap<>();
        for (BucketKey key : grouped.keySet()) {
            touched.merge(key.getMetricName(), key.getBucketStart(), (a, b) -> a.isBefore(b) ? a : b);
        }
        log.info("Job '{}' committed {} buckets across {} metrics.", job.getJobId(), grouped.size(), touched.size());
        return touched;
    }

    /**
     * 读取-合并-写回单个桶，持有该桶的条带锁
     */
    private void commitBucket(BucketKey key, List<MetricSample> samples) {
        ReentrantLock lock = BUCKET_LOCKS[Math.floorMod(key.hashCode(), LOCK_STRIPES)];
        lock.lock();
        try {
            Aggregate existing = retryExecutor.call("getAggregate " + key,
                    () -> resultSink.getAggregate(key.getMetricName(), key.getBucketStart()).orElse(null));
            Aggregate merged = aggregationEngine.mergeAll(existing, samples);
            if (merged == null || merged == existing) {
                log.debug("Bucket {} unchanged, all records already applied.", key);
                return;
            }
            retryExecutor.run("putAggregate " + key, () -> resultSink.putAggregate(merged));
        } finally {
            lock.unlock();
        }
    }

    /**
     * 按指标并行检测触达的桶；不再异常的桶删除旧结果
     */
    private void detect(Job job, Map<String, Instant> touched) {
        int window = config.getDetectionWindow();
        AtomicInteger anomalyCount = new AtomicInteger();

        List<Callable<Void>> tasks = new ArrayList<>();
        for (Map.Entry<String, Instant> entry : touched.entrySet()) {
            String metric = entry.getKey();
            Instant from = entry.getValue();
            tasks.add(() -> {
                anomalyCount.addAndGet(detectMetric(metric, from, window));
                return null;
            });
        }
        runAll(tasks);

        log.info("Job '{}' detection finished for {} metrics, {} anomalies.",
                job.getJobId(), touched.size(), anomalyCount.get());
    }

    private int detectMetric(String metric, Instant from, int window) {
        List<Aggregate> series = loadHistory(metric, from, window);
        series.addAll(retryExecutor.call("listSeries " + metric, () -> resultSink.listSeries(metric, from)));

        Set<Instant> previouslyAnomalous = new HashSet<>();
        for (Anomaly existing : retryExecutor.call("listAnomalies " + metric, () -> resultSink.listAnomalies(from))) {
            if (existing.getMetricName().equals(metric)) {
                previouslyAnomalous.add(existing.getBucketStart());
            }
        }

        int found = 0;
        for (BucketAssessment assessment : anomalyDetector.evaluate(series, window, from,
                schema.getObservedStatistic())) {
            Optional<Anomaly> anomaly = assessment.getAnomaly();
            if (anomaly.isPresent()) {
                retryExecutor.run("putAnomaly " + anomaly.get().key(), () -> resultSink.putAnomaly(anomaly.get()));
                found++;
            } else if (previouslyAnomalous.contains(assessment.getBucketStart())) {
                retryExecutor.run("deleteAnomaly " + metric,
                        () -> resultSink.deleteAnomaly(metric, assessment.getBucketStart()));
                log.debug("Bucket {}@{} is now {}, stale anomaly removed.",
                        metric, assessment.getBucketStart(), assessment.getStatus());
            }
        }
        return found;
    }

    /**
     * 按桶数向前分页读取 from 之前的历史，直到凑足 window 个有效桶或序列读尽；
     * 缺失的桶不占用回看额度
     */
    private List<Aggregate> loadHistory(String metric, Instant from, int window) {
        int pageSize = Math.max(window, config.effectiveLookbackBuckets());
        int minSamples = config.getMinimumSampleThreshold();
        LinkedList<Aggregate> history = new LinkedList<>();
        Instant before = from;
        int valid = 0;
        while (valid < window) {
            Instant pageEnd = before;
            List<Aggregate> page = retryExecutor.call("listSeriesBefore " + metric,
                    () -> resultSink.listSeriesBefore(metric, pageEnd, pageSize));
            for (int i = page.size() - 1; i >= 0; i--) {
                Aggregate aggregate = page.get(i);
                history.addFirst(aggregate);
                if (aggregate.getCount() >= minSamples) {
                    valid++;
                }
            }
            if (page.size() < pageSize) {
                break;
            }
            before = page.get(0).getBucketStart();
        }
        log.debug("Loaded {} history buckets ({} valid) of metric '{}' before {}.",
                history.size(), valid, metric, from);
        return new ArrayList<>(history);
    }

    /**
     * 在阶段线程池上执行全部任务并等待；所有任务结束后抛出第一个失败
     */
    private void runAll(List<Callable<Void>> tasks) {
        if (stagePool == null || tasks.size() <= 1) {
            for (Callable<Void> task : tasks) {
                callUnchecked(task);
            }
            return;
        }

        List<Future<Void>> futures = new ArrayList<>(tasks.size());
        for (Callable<Void> task : tasks) {
            futures.add(stagePool.submit(task));
        }
        RuntimeException first = null;
        for (Future<Void> future : futures) {
            try {
                future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while waiting for stage tasks", e);
            } catch (ExecutionException e) {
                RuntimeException failure = e.getCause() instanceof RuntimeException
                        ? (RuntimeException) e.getCause()
                        : new IllegalStateException(e.getCause());
                if (first == null) {
                    first = failure;
                } else {
                    first.addSuppressed(failure);
                }
            }
        }
        if (first != null) {
            throw first;
        }
    }

    private static void callUnchecked(Callable<Void> task) {
        try {
            task.call();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    private static String failureSummary(Job job, RuntimeException e) {
        return "Stage " + job.getStage() + " failed: " + e.getMessage()
                + " (processed " + job.getProcessedCount()
                + ", rejected " + job.getRejectedCount() + ")";
    }
}
