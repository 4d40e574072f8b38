package com.masterbias.model;

import java.util.Objects;

/**
 * Rectangular plane of 16-bit pixel values, stored row-major: index = y * width + x.
 */
public record PixelPlane(int width, int height, int[] pixels) {

    public PixelPlane {
        Objects.requireNonNull(pixels, "pixels");
        if (width < 0 || height < 0 || pixels.length != width * height) {
            throw new IllegalArgumentException(String.format(
                    "Plane %dx%d does not match %d pixels", width, height, pixels.length));
        }
    }

    public int get(int x, int y) {
        return pixels[y * width + x];
    }

    public boolean sameDimensions(int otherWidth, int otherHeight) {
        return width == otherWidth && height == otherHeight;
    }
}
