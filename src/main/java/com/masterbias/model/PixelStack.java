package com.masterbias.model;

import java.util.List;

/**
 * All layers of one group held in memory at once: layers[layer][y * width + x].
 * <p>
 * Memory bound: width * height * layers doubles, plus whatever mask the reducer allocates
 * on top (one boolean per element for the clipping methods). A group that does not fit is
 * not streamed; the caller must split it.
 */
public final class PixelStack {

    private final int width;
    private final int height;
    private final double[][] layers;

    public PixelStack(int width, int height, double[][] layers) {
        this.width = width;
        this.height = height;
        this.layers = layers;
        for (double[] layer : layers) {
            if (layer.length != width * height) {
                throw new IllegalArgumentException("Layer of " + layer.length
                        + " values does not match " + width + "x" + height);
            }
        }
    }

    public static PixelStack fromPlanes(List<PixelPlane> planes) {
        if (planes.isEmpty()) return new PixelStack(0, 0, new double[0][]);
        int w = planes.get(0).width();
        int h = planes.get(0).height();
        double[][] data = new double[planes.size()][];
        for (int i = 0; i < planes.size(); i++) {
            PixelPlane p = planes.get(i);
            if (!p.sameDimensions(w, h)) {
                throw new IllegalArgumentException(String.format(
                        "Plane %d is %dx%d, expected %dx%d", i, p.width(), p.height(), w, h));
            }
            double[] layer = new double[w * h];
            int[] src = p.pixels();
            for (int k = 0; k < layer.length; k++) layer[k] = src[k];
            data[i] = layer;
        }
        return new PixelStack(w, h, data);
    }

    public int width() { return width; }

    public int height() { return height; }

    public int layerCount() { return layers.length; }

    public int pixelCount() { return width * height; }

    public boolean isEmpty() { return layers.length == 0; }

    public double[] layer(int index) { return layers[index]; }

    // Valores de una columna (x,y fijos) a traves de todas las capas
    public double[] column(int pixelIndex) {
        double[] col = new double[layers.length];
        for (int i = 0; i < layers.length; i++) col[i] = layers[i][pixelIndex];
        return col;
    }
}
