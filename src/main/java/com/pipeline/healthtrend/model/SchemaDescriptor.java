package com.pipeline.healthtrend.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 上传记录的模式描述。
 *
 * 指明三个规范字段（metric_name、timestamp、value）分别取自原始记录的哪个字段，
 * 来源记录标识取自哪个字段，以及需要做类型/范围校验的可选字段。
 * 未在此声明的字段一律视为 IGNORED。
 *
 * 当 valueField 为 null 时，每条记录贡献常量值 constantValue，
 * 用于构建"计数型"趋势（如按疾病统计病例数）；此时检测应取桶内样本数作为观测值。
 */
public class SchemaDescriptor implements Serializable {

    public static final String METRIC_NAME = "metric_name";
    public static final String TIMESTAMP = "timestamp";
    public static final String VALUE = "value";
    public static final String SOURCE_RECORD_ID = "source_record_id";

    private String metricNameField = METRIC_NAME;
    private String timestampField = TIMESTAMP;
    private String valueField = VALUE;
    private String recordIdField = SOURCE_RECORD_ID;
    private double constantValue = 1.0;
    /** 检测时代表桶的统计量 */
    private ObservedStatistic observedStatistic = ObservedStatistic.MEAN;
    /** 可选字段定义，按声明顺序参与内容指纹 */
    private final Map<String, FieldSpec> optionalFields = new LinkedHashMap<>();

    public SchemaDescriptor() {}

    /** 标准指标模式：metric_name / timestamp / value / source_record_id */
    public static SchemaDescriptor standard() {
        return new SchemaDescriptor();
    }

    /**
     * 病例记录模式：以疾病名作为指标，每条记录计数 1，按桶内病例数检测。
     * 年龄字段限定在 [0, 120]。
     */
    public static SchemaDescriptor caseCounts() {
        SchemaDescriptor schema = new SchemaDescriptor();
        schema.setMetricNameField("disease");
        schema.setValueField(null);
        schema.setConstantValue(1.0);
        schema.setObservedStatistic(ObservedStatistic.COUNT);
        schema.setRecordIdField("record_id");
        schema.addOptionalField(FieldSpec.optional("patient_id", FieldType.TEXT));
        schema.addOptionalField(FieldSpec.optional("age", FieldType.INTEGER).withRange(0.0, 120.0));
        return schema;
    }

    public SchemaDescriptor addOptionalField(FieldSpec spec) {
        optionalFields.put(spec.getName(), spec);
        return this;
    }

    /** 原始字段是否被模式识别（规范字段、标识字段或可选字段） */
    public boolean isRecognized(String rawField) {
        return rawField.equals(metricNameField)
                || rawField.equals(timestampField)
                || (valueField != null && rawField.equals(valueField))
                || (recordIdField != null && rawField.equals(recordIdField))
                || optionalFields.containsKey(rawField);
    }

    public List<String> requiredFields() {
        List<String> required = new ArrayList<>();
        required.add(metricNameField);
        required.add(timestampField);
        if (valueField != null) {
            required.add(valueField);
        }
        return required;
    }

    public String getMetricNameField() { return metricNameField; }
    public void setMetricNameField(String metricNameField) { this.metricNameField = metricNameField; }
    public String getTimestampField() { return timestampField; }
    public void setTimestampField(String timestampField) { this.timestampField = timestampField; }
    public String getValueField() { return valueField; }
    public void setValueField(String valueField) { this.valueField = valueField; }
    public String getRecordIdField() { return recordIdField; }
    public void setRecordIdField(String recordIdField) { this.recordIdField = recordIdField; }
    public double getConstantValue() { return constantValue; }
    public void setConstantValue(double constantValue) { this.constantValue = constantValue; }
    public ObservedStatistic getObservedStatistic() { return observedStatistic; }
    public void setObservedStatistic(ObservedStatistic observedStatistic) {
        this.observedStatistic = observedStatistic != null ? observedStatistic : ObservedStatistic.MEAN;
    }

    public Map<String, FieldSpec> getOptionalFields() {
        return Collections.unmodifiableMap(optionalFields);
    }
}
