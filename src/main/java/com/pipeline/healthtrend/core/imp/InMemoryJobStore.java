package com.pipeline.healthtrend.core.imp;

import com.pipeline.healthtrend.core.JobStore;
import com.pipeline.healthtrend.exception.JobStateException;
import com.pipeline.healthtrend.model.Job;
import com.pipeline.healthtrend.model.JobStage;
import com.pipeline.healthtrend.model.RecordError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * 作业存储的内存实现。
 * 维护所有作业的注册表，并用转换表约束阶段推进。
 */
public class InMemoryJobStore implements JobStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryJobStore.class);

    /** 作业注册表：jobId -> Job */
    private final ConcurrentHashMap<String, Job> jobRegistry = new ConcurrentHashMap<>();

    /** 合法的阶段转换表（FAILED 的回退只能经由 retryFromStage） */
    private static final Map<JobStage, Set<JobStage>> VALID_TRANSITIONS = new EnumMap<>(JobStage.class);

    static {
        VALID_TRANSITIONS.put(JobStage.NORMALIZING,
                EnumSet.of(JobStage.AGGREGATING, JobStage.FAILED, JobStage.CANCELLED));
        VALID_TRANSITIONS.put(JobStage.AGGREGATING,
                EnumSet.of(JobStage.DETECTING, JobStage.FAILED, JobStage.CANCELLED));
        VALID_TRANSITIONS.put(JobStage.DETECTING,
                EnumSet.of(JobStage.DONE, JobStage.FAILED, JobStage.CANCELLED));
        VALID_TRANSITIONS.put(JobStage.DONE, Collections.emptySet());
        VALID_TRANSITIONS.put(JobStage.FAILED, Collections.emptySet());
        VALID_TRANSITIONS.put(JobStage.CANCELLED, Collections.emptySet());
    }

    private final Clock clock;

    public InMemoryJobStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Job create(String inputBatchRef) {
        if (inputBatchRef == null || inputBatchRef.isBlank()) {
            throw new IllegalArgumentException("Input batch reference must not be null or blank");
        }
        String jobId = UUID.randomUUID().toString();
        Job job = new Job(jobId, inputBatchRef, clock.instant());
        jobRegistry.put(jobId, job);
        log.info("Job '{}' created for batch '{}'.", jobId, inputBatchRef);
        return job;
    }

    @Override
    public Job get(String jobId) {
        Job job = jobRegistry.get(jobId);
        if (job == null) {
            throw new JobStateException("Job '" + jobId + "' not found");
        }
        return job;
    }

    @Override
    public List<Job> list() {
        return jobRegistry.values().stream()
                .sorted(Comparator.comparing(Job::getCreatedAt).thenComparing(Job::getJobId))
                .collect(Collectors.toList());
    }

    @Override
    public void advance(String jobId, JobStage stage) {
        Job job = get(jobId);
        synchronized (job) {
            JobStage current = job.getStage();
            Set<JobStage> allowed = VALID_TRANSITIONS.getOrDefault(current, Collections.emptySet());
            if (!allowed.contains(stage)) {
                log.warn("Invalid stage transition for job '{}': {} -> {}", jobId, current, stage);
                throw new JobStateException("Invalid stage transition for job '" + jobId + "': "
                        + current + " -> " + stage);
            }
            if (stage == JobStage.FAILED) {
                job.setFailedStage(current);
            }
            job.setStage(stage);
            job.setUpdatedAt(clock.instant());
        }
        log.debug("Job '{}' advanced to {}.", jobId, stage);
    }

    @Override
    public void fail(String jobId, String summary) {
        Job job = get(jobId);
        synchronized (job) {
            advance(jobId, JobStage.FAILED);
            job.setFailureSummary(summary);
        }
        log.error("Job '{}' failed at stage {}: {}", jobId, job.getFailedStage(), summary);
    }

    @Override
    public void retryFromStage(String jobId, JobStage stage) {
        Job job = get(jobId);
        synchronized (job) {
            if (job.getStage() != JobStage.FAILED) {
                throw new JobStateException("Job '" + jobId + "' is " + job.getStage() + ", only FAILED jobs can be retried");
            }
            if (stage == null || !stage.isProcessing()) {
                throw new JobStateException("Cannot retry job '" + jobId + "' from non-processing stage " + stage);
            }
            JobStage failedStage = job.getFailedStage();
            if (failedStage != null && stage.ordinal() > failedStage.ordinal()) {
                throw new JobStateException("Cannot retry job '" + jobId + "' from " + stage
                        + ", it failed earlier at " + failedStage);
            }
            job.setStage(stage);
            job.setFailureSummary(null);
            job.setCancelRequested(false);
            job.setRetryCount(job.getRetryCount() + 1);
            job.setUpdatedAt(clock.instant());
        }
        log.info("Job '{}' re-entered at stage {} (retry #{}).", jobId, stage, job.getRetryCount());
    }

    @Override
    public void recordNormalization(String jobId, long processed, List<RecordError> errors) {
        Job job = get(jobId);
        synchronized (job) {
            // 重新归一化时覆盖上一次的结果，避免重复累积
            job.setProcessedCount(processed);
            job.setRejectedCount(errors.size());
            job.clearErrors();
            job.addErrors(errors);
            job.setUpdatedAt(clock.instant());
        }
    }

    @Override
    public void recordTouchedBuckets(String jobId, Map<String, Instant> buckets) {
        Job job = get(jobId);
        job.setTouchedBuckets(buckets);
        job.setUpdatedAt(clock.instant());
    }

    @Override
    public boolean requestCancel(String jobId) {
        Job job = get(jobId);
        synchronized (job) {
            if (job.getStage().isTerminal()) {
                log.warn("Job '{}' is already {}, cancel ignored.", jobId, job.getStage());
                return false;
            }
            job.setCancelRequested(true);
            job.setUpdatedAt(clock.instant());
        }
        log.info("Cancellation requested for job '{}'.", jobId);
        return true;
    }

    @Override
    public void close() {
        log.info("Job store closed with {} jobs.", jobRegistry.size());
        jobRegistry.clear();
    }
}
