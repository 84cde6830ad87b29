package com.pipeline.healthtrend.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * 归一化边界上的带标签字段值。
 *
 * 原始记录中的每个字段在进入归一化器时被归为以下变体之一：
 * <ul>
 *   <li>TEXT / NUMBER / TIMESTAMP：模式中声明的字段，已完成类型转换；</li>
 *   <li>IGNORED：模式未声明的字段，保留原始名称但不参与任何计算。</li>
 * </ul>
 */
public final class FieldValue implements Serializable {

    public enum Variant {
        TEXT,
        NUMBER,
        TIMESTAMP,
        IGNORED
    }

    private final Variant variant;
    private final String text;
    private final double number;
    private final Instant timestamp;

    private FieldValue(Variant variant, String text, double number, Instant timestamp) {
        this.variant = variant;
        this.text = text;
        this.number = number;
        this.timestamp = timestamp;
    }

    public static FieldValue text(String text) {
        return new FieldValue(Variant.TEXT, Objects.requireNonNull(text), Double.NaN, null);
    }

    public static FieldValue number(double number) {
        return new FieldValue(Variant.NUMBER, null, number, null);
    }

    public static FieldValue timestamp(Instant timestamp) {
        return new FieldValue(Variant.TIMESTAMP, null, Double.NaN, Objects.requireNonNull(timestamp));
    }

    public static FieldValue ignored() {
        return new FieldValue(Variant.IGNORED, null, Double.NaN, null);
    }

    public Variant getVariant() { return variant; }

    public boolean isIgnored() {
        return variant == Variant.IGNORED;
    }

    public String asText() {
        requireVariant(Variant.TEXT);
        return text;
    }

    public double asNumber() {
        requireVariant(Variant.NUMBER);
        return number;
    }

    public Instant asTimestamp() {
        requireVariant(Variant.TIMESTAMP);
        return timestamp;
    }

    /** 用于内容指纹计算的规范文本 */
    public String canonical() {
        switch (variant) {
            case TEXT:
                return text;
            case NUMBER:
                return Double.toString(number);
            case TIMESTAMP:
                return timestamp.toString();
            default:
                return "";
        }
    }

    private void requireVariant(Variant expected) {
        if (variant != expected) {
            throw new IllegalStateException("Field value is " + variant + ", not " + expected);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldValue)) return false;
        FieldValue that = (FieldValue) o;
        return variant == that.variant && Double.compare(that.number, number) == 0
                && Objects.equals(text, that.text) && Objects.equals(timestamp, that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(variant, text, number, timestamp);
    }

    @Override
    public String toString() {
        return variant + "(" + canonical() + ")";
    }
}
