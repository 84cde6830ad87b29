package com.pipeline.healthtrend.model;

import java.io.Serializable;

/**
 * 记录字段定义：名称、类型、是否必选以及数值范围约束
 */
public class FieldSpec implements Serializable {
    private String name;
    private String description;
    private FieldType type;
    private boolean required;
    /** 数值型字段的取值范围下限 */
    private Double minValue;
    /** 数值型字段的取值范围上限 */
    private Double maxValue;

    public FieldSpec() {}

    public FieldSpec(String name, FieldType type, boolean required) {
        this.name = name;
        this.type = type;
        this.required = required;
    }

    public static FieldSpec optional(String name, FieldType type) {
        return new FieldSpec(name, type, false);
    }

    public FieldSpec withRange(Double minValue, Double maxValue) {
        this.minValue = minValue;
        this.maxValue = maxValue;
        return this;
    }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
    public FieldType getType() { return type; }
    public void setType(FieldType type) { this.type = type; }
    public boolean isRequired() { return required; }
    public void setRequired(boolean required) { this.required = required; }
    public Double getMinValue() { return minValue; }
    public void setMinValue(Double minValue) { this.minValue = minValue; }
    public Double getMaxValue() { return maxValue; }
    public void setMaxValue(Double maxValue) { this.maxValue = maxValue; }
}
