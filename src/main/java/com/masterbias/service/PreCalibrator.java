package com.masterbias.service;

import com.masterbias.model.PixelPlane;
import com.masterbias.model.PixelStack;
import com.masterbias.model.Precalibration;

import java.util.function.IntToDoubleFunction;

/**
 * Subtracts a pedestal or a fixed reference frame from every layer, clamping to the 16-bit range.
 * Returns a new stack; the input is not modified.
 */
public class PreCalibrator {

    static final double MAX_PIXEL = 0xFFFF;

    public PixelStack apply(PixelStack stack, Precalibration precalibration) throws CalibrationDimensionMismatchException {
        return precalibration.accept(new Precalibration.Visitor<PixelStack, CalibrationDimensionMismatchException>() {
            @Override
            public PixelStack none() {
                return stack;
            }

            @Override
            public PixelStack pedestal(int value) {
                return subtract(stack, k -> value);
            }

            @Override
            public PixelStack fixedFrame(PixelPlane plane) throws CalibrationDimensionMismatchException {
                // Validar antes de tocar ningun pixel
                if (!plane.sameDimensions(stack.width(), stack.height())) {
                    throw new CalibrationDimensionMismatchException(
                            stack.width(), stack.height(), plane.width(), plane.height());
                }
                int[] cal = plane.pixels();
                return subtract(stack, k -> cal[k]);
            }
        });
    }

    private static PixelStack subtract(PixelStack stack, IntToDoubleFunction offset) {
        double[][] out = new double[stack.layerCount()][];
        for (int i = 0; i < out.length; i++) {
            double[] src = stack.layer(i);
            double[] dst = new double[src.length];
            for (int k = 0; k < src.length; k++) dst[k] = clamp(src[k] - offset.applyAsDouble(k));
            out[i] = dst;
        }
        return new PixelStack(stack.width(), stack.height(), out);
    }

    static double clamp(double v) {
        if (v < 0) return 0;
        return Math.min(v, MAX_PIXEL);
    }
}
