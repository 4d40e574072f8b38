package com.masterbias.model;

import java.util.Objects;

/**
 * Optional step applied to every layer before reduction: subtract a constant pedestal or a
 * fixed reference frame.
 */
public interface Precalibration {

    <R, X extends Exception> R accept(Visitor<R, X> visitor) throws X;

    /** Visitor whose steps may fail with {@code X}. */
    interface Visitor<R, X extends Exception> {
        R none() throws X;

        R pedestal(int value) throws X;

        R fixedFrame(PixelPlane plane) throws X;
    }

    /** Label used in progress messages. */
    default String describe() {
        return accept(new Visitor<String, RuntimeException>() {
            @Override
            public String none() { return "no precalibration"; }

            @Override
            public String pedestal(int value) { return "pedestal " + value; }

            @Override
            public String fixedFrame(PixelPlane plane) {
                return "fixed frame " + plane.width() + "x" + plane.height();
            }
        });
    }

    static Precalibration none() {
        return new None();
    }

    static Precalibration pedestal(int value) {
        return new Pedestal(value);
    }

    static Precalibration fixedFrame(PixelPlane plane) {
        return new FixedFrame(plane);
    }

    record None() implements Precalibration {
        @Override
        public <R, X extends Exception> R accept(Visitor<R, X> visitor) throws X { return visitor.none(); }
    }

    record Pedestal(int value) implements Precalibration {
        public Pedestal {
            if (value < 0) throw new IllegalArgumentException("Pedestal must be >= 0, not " + value);
        }

        @Override
        public <R, X extends Exception> R accept(Visitor<R, X> visitor) throws X { return visitor.pedestal(value); }
    }

    record FixedFrame(PixelPlane plane) implements Precalibration {
        public FixedFrame {
            Objects.requireNonNull(plane, "plane");
        }

        @Override
        public <R, X extends Exception> R accept(Visitor<R, X> visitor) throws X { return visitor.fixedFrame(plane); }
    }
}
