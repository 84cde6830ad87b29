package com.pipeline.healthtrend.model;

import java.util.Collections;
import java.util.List;

/**
 * 批量归一化结果：合规样本 + 被拒记录，二者均保持输入顺序
 */
public final class NormalizationResult {
    private final List<MetricSample> samples;
    private final List<RecordError> errors;

    public NormalizationResult(List<MetricSample> samples, List<RecordError> errors) {
        this.samples = Collections.unmodifiableList(samples);
        this.errors = Collections.unmodifiableList(errors);
    }

    public List<MetricSample> getSamples() { return samples; }
    public List<RecordError> getErrors() { return errors; }

    @Override
    public String toString() {
        return "NormalizationResult{samples=" + samples.size() + ", errors=" + errors.size() + "}";
    }
}
