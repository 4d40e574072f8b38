package com.masterbias.service;

import com.masterbias.model.CombineMethod;
import com.masterbias.model.PixelStack;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reduces a stack of layers to one plane. Each output pixel depends only on its "column", the
 * values at a fixed x,y across all layers.
 * <p>
 * The clipping methods work on the whole stack at once with a boolean mask of the same shape
 * as the data, then repair only the columns whose every value got masked. The repair uses the
 * straightforward sorted-column algorithm so the output is identical to computing every column
 * independently. Memory: the stack plus one mask (layers * width * height booleans).
 * <p>
 * Output values are rounded half-to-even and clamped to [0, 65535].
 */
public class FrameReducer {
    private static final Logger logger = LoggerFactory.getLogger(FrameReducer.class);

    // Columna vaciada por sigma-clip: se rehace con min-max de 2
    static final int SIGMA_FALLBACK_DROP = 2;

    public int[] combine(PixelStack stack, CombineMethod method) throws EmptyInputException {
        if (stack == null || stack.isEmpty()) {
            throw new EmptyInputException("No frames to combine");
        }
        double[] combined = method.accept(new CombineMethod.Visitor<double[]>() {
            @Override
            public double[] mean() {
                return combineMean(stack);
            }

            @Override
            public double[] median() {
                return combineMedian(stack);
            }

            @Override
            public double[] minMaxClip(int drop) {
                return combineMinMaxClip(stack, drop);
            }

            @Override
            public double[] sigmaClip(double threshold) {
                return combineSigmaClip(stack, threshold);
            }
        });
        return toPixels(combined);
    }

    double[] combineMean(PixelStack stack) {
        int n = stack.layerCount();
        double[] sum = new double[stack.pixelCount()];
        for (int i = 0; i < n; i++) {
            double[] layer = stack.layer(i);
            for (int k = 0; k < sum.length; k++) sum[k] += layer[k];
        }
        for (int k = 0; k < sum.length; k++) sum[k] /= n;
        return sum;
    }

    double[] combineMedian(PixelStack stack) {
        int n = stack.layerCount();
        double[] result = new double[stack.pixelCount()];
        double[] col = new double[n];
        for (int k = 0; k < result.length; k++) {
            for (int i = 0; i < n; i++) col[i] = stack.layer(i)[k];
            Arrays.sort(col);
            int mid = n / 2;
            result[k] = (n % 2 == 0) ? (col[mid - 1] + col[mid]) / 2.0 : col[mid];
        }
        return result;
    }

    double[] combineMinMaxClip(PixelStack stack, int drop) {
        int n = stack.layerCount();
        int size = stack.pixelCount();
        boolean[][] masked = new boolean[n][size];

        // Fase 1: quitar 'drop' veces el grupo de valores minimos de cada columna
        for (int iteration = 1; iteration <= drop; iteration++) {
            logger.debug("Min-max clip: masking minimums, iteration {} of {}", iteration, drop);
            maskExtremes(stack, masked, true);
        }
        // Fase 2: lo mismo con los maximos
        for (int iteration = 1; iteration <= drop; iteration++) {
            logger.debug("Min-max clip: masking maximums, iteration {} of {}", iteration, drop);
            maskExtremes(stack, masked, false);
        }

        double[] result = new double[size];
        List<Integer> emptied = maskedMeans(stack, masked, result);
        if (!emptied.isEmpty()) {
            logger.debug("Min-max clip emptied {} column(s); repairing with drop {}", emptied.size(), drop - 1);
            for (int k : emptied) {
                result[k] = minMaxClippedMean(stack.column(k), drop - 1);
            }
        }
        return result;
    }

    double[] combineSigmaClip(PixelStack stack, double threshold) {
        int n = stack.layerCount();
        int size = stack.pixelCount();
        double[] means = combineMean(stack);

        // Desviacion estandar poblacional (divide por N)
        double[] stdevs = new double[size];
        for (int i = 0; i < n; i++) {
            double[] layer = stack.layer(i);
            for (int k = 0; k < size; k++) {
                double d = layer[k] - means[k];
                stdevs[k] += d * d;
            }
        }
        for (int k = 0; k < size; k++) {
            stdevs[k] = Math.sqrt(stdevs[k] / n);
            // Columna constante: ningun valor es atipico
            if (stdevs[k] == 0.0) stdevs[k] = Double.MAX_VALUE;
        }

        boolean[][] masked = new boolean[n][size];
        for (int i = 0; i < n; i++) {
            double[] layer = stack.layer(i);
            for (int k = 0; k < size; k++) {
                double z = Math.abs(layer[k] - means[k]) / stdevs[k];
                masked[i][k] = z > threshold;
            }
        }

        double[] result = new double[size];
        List<Integer> emptied = maskedMeans(stack, masked, result);
        if (!emptied.isEmpty()) {
            logger.debug("Sigma clip emptied {} column(s); min-max clipping those", emptied.size());
            for (int k : emptied) {
                result[k] = minMaxClippedMean(stack.column(k), SIGMA_FALLBACK_DROP);
            }
        }
        return result;
    }

    /**
     * Reference algorithm for one column: sort, strip the lowest value-group {@code drop}
     * times, then the highest value-group {@code drop} times, and average what is left.
     * If nothing is left the column is redone with {@code drop - 1}; at 0 it is a plain mean.
     */
    public static double minMaxClippedMean(double[] column, int drop) {
        double[] sorted = column.clone();
        Arrays.sort(sorted);
        int from = 0, to = sorted.length;   // [from, to) sobrevive

        for (int d = 0; d < drop && from < to; d++) {
            double min = sorted[from];
            while (from < to && sorted[from] == min) from++;
        }
        for (int d = 0; d < drop && from < to; d++) {
            double max = sorted[to - 1];
            while (to > from && sorted[to - 1] == max) to--;
        }

        if (from == to) {
            if (drop > 0) return minMaxClippedMean(column, drop - 1);
            return mean(column, 0, column.length);
        }
        return mean(sorted, from, to);
    }

    // Marca en cada columna todas las apariciones del minimo (o maximo) entre los no marcados
    private static void maskExtremes(PixelStack stack, boolean[][] masked, boolean minimum) {
        int n = stack.layerCount();
        int size = stack.pixelCount();
        double[] extreme = new double[size];
        boolean[] found = new boolean[size];
        for (int i = 0; i < n; i++) {
            double[] layer = stack.layer(i);
            boolean[] m = masked[i];
            for (int k = 0; k < size; k++) {
                if (m[k]) continue;
                double v = layer[k];
                if (!found[k] || (minimum ? v < extreme[k] : v > extreme[k])) {
                    extreme[k] = v;
                    found[k] = true;
                }
            }
        }
        for (int i = 0; i < n; i++) {
            double[] layer = stack.layer(i);
            boolean[] m = masked[i];
            for (int k = 0; k < size; k++) {
                if (found[k] && !m[k] && layer[k] == extreme[k]) m[k] = true;
            }
        }
    }

    /** Mean of the unmasked values per column; returns the indices of columns with none left. */
    private static List<Integer> maskedMeans(PixelStack stack, boolean[][] masked, double[] result) {
        int n = stack.layerCount();
        int size = stack.pixelCount();
        int[] counts = new int[size];
        for (int i = 0; i < n; i++) {
            double[] layer = stack.layer(i);
            boolean[] m = masked[i];
            for (int k = 0; k < size; k++) {
                if (!m[k]) {
                    result[k] += layer[k];
                    counts[k]++;
                }
            }
        }
        List<Integer> emptied = new ArrayList<>();
        for (int k = 0; k < size; k++) {
            if (counts[k] == 0) emptied.add(k);
            else result[k] /= counts[k];
        }
        return emptied;
    }

    private static double mean(double[] values, int from, int to) {
        double sum = 0;
        for (int i = from; i < to; i++) sum += values[i];
        return sum / (to - from);
    }

    static int[] toPixels(double[] values) {
        int[] out = new int[values.length];
        for (int k = 0; k < values.length; k++) {
            out[k] = (int) PreCalibrator.clamp(Math.rint(values[k]));
        }
        return out;
    }
}
