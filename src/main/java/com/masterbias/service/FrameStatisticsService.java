package com.masterbias.service;

import com.masterbias.model.FrameStatistics;
import com.masterbias.model.PixelPlane;
import ij.process.FloatProcessor;
import ij.process.ImageStatistics;

public class FrameStatisticsService {

    public FrameStatistics summarize(PixelPlane plane) {
        if (plane.pixels().length == 0) return new FrameStatistics(0, 0, 0, 0);

        float[] px = new float[plane.pixels().length];
        int[] src = plane.pixels();
        for (int k = 0; k < src.length; k++) px[k] = src[k];
        FloatProcessor ip = new FloatProcessor(plane.width(), plane.height(), px);

        ImageStatistics stats = ip.getStatistics();
        return new FrameStatistics(stats.mean, stats.stdDev, stats.min, stats.max);
    }
}
