package com.pipeline.healthtrend.model;

import java.io.Serializable;

/**
 * 偏离分数分级阈值，区间语义为左闭右开：
 * |z| &lt; low 不报异常；[low, medium) 为 LOW；[medium, high) 为 MEDIUM；&ge; high 为 HIGH。
 */
public final class SeverityThresholds implements Serializable {
    private final double low;
    private final double medium;
    private final double high;

    public SeverityThresholds(double low, double medium, double high) {
        if (!(low > 0 && low < medium && medium < high)) {
            throw new IllegalArgumentException(
                    "Severity thresholds must satisfy 0 < low < medium < high, got: "
                            + low + ", " + medium + ", " + high);
        }
        this.low = low;
        this.medium = medium;
        this.high = high;
    }

    public static SeverityThresholds defaults() {
        return new SeverityThresholds(2.0, 3.0, 4.0);
    }

    /**
     * @return 对应等级；低于最低阈值时返回 null
     */
    public Severity classify(double deviationScore) {
        double magnitude = Math.abs(deviationScore);
        if (magnitude >= high) return Severity.HIGH;
        if (magnitude >= medium) return Severity.MEDIUM;
        if (magnitude >= low) return Severity.LOW;
        return null;
    }

    public double getLow() { return low; }
    public double getMedium() { return medium; }
    public double getHigh() { return high; }

    @Override
    public String toString() {
        return "{low=" + low + ", medium=" + medium + ", high=" + high + "}";
    }
}
