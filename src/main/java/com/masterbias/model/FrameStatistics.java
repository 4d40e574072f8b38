package com.masterbias.model;

public class FrameStatistics {
    public final double mean;
    public final double stdDev;
    public final double min;
    public final double max;

    public FrameStatistics(double mean, double stdDev, double min, double max) {
        this.mean = mean;
        this.stdDev = stdDev;
        this.min = min;
        this.max = max;
    }
}
