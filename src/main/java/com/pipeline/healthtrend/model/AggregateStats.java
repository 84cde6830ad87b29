package com.pipeline.healthtrend.model;

import java.io.Serializable;

/**
 * 聚合值的派生视图：均值、方差、标准差
 */
public final class AggregateStats implements Serializable {
    private final long count;
    private final double mean;
    private final double variance;
    private final double stddev;

    public AggregateStats(long count, double mean, double variance) {
        this.count = count;
        this.mean = mean;
        this.variance = variance;
        this.stddev = Math.sqrt(variance);
    }

    public long getCount() { return count; }
    public double getMean() { return mean; }
    public double getVariance() { return variance; }
    public double getStddev() { return stddev; }

    @Override
    public String toString() {
        return "AggregateStats{count=" + count + ", mean=" + mean + ", stddev=" + stddev + "}";
    }
}
