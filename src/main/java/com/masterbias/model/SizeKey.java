package com.masterbias.model;

import java.util.Comparator;

/** Dimensiones + binning: dos frames solo se combinan si su SizeKey es identica. */
public record SizeKey(int width, int height, int binning) implements Comparable<SizeKey> {

    private static final Comparator<SizeKey> ORDER = Comparator.comparingInt(SizeKey::width)
            .thenComparingInt(SizeKey::height)
            .thenComparingInt(SizeKey::binning);

    @Override
    public int compareTo(SizeKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return width + "x" + height + " bin " + binning;
    }
}
