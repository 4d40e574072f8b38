package com.masterbias.model;

import java.util.Locale;

/**
 * How a stack of frames is reduced to one master frame. Each variant carries its own
 * parameters; the reducer dispatches through {@link Visitor}.
 */
public interface CombineMethod {

    <R> R accept(Visitor<R> visitor);

    /** Short name used in generated file names, e.g. "Min-Max Clip". */
    String displayName();

    /** Free-text provenance written to the COMMENT of the master frame. */
    String provenance();

    interface Visitor<R> {
        R mean();

        R median();

        R minMaxClip(int drop);

        R sigmaClip(double threshold);
    }

    static CombineMethod mean() {
        return new Mean();
    }

    static CombineMethod median() {
        return new Median();
    }

    static CombineMethod minMaxClip(int drop) {
        return new MinMaxClip(drop);
    }

    static CombineMethod sigmaClip(double threshold) {
        return new SigmaClip(threshold);
    }

    record Mean() implements CombineMethod {
        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.mean(); }

        @Override
        public String displayName() { return "Mean"; }

        @Override
        public String provenance() { return "Master Bias MEAN combined"; }
    }

    record Median() implements CombineMethod {
        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.median(); }

        @Override
        public String displayName() { return "Median"; }

        @Override
        public String provenance() { return "Master Bias MEDIAN combined"; }
    }

    record MinMaxClip(int drop) implements CombineMethod {
        public MinMaxClip {
            if (drop < 0) throw new IllegalArgumentException("Min-max drop must be >= 0, not " + drop);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.minMaxClip(drop); }

        @Override
        public String displayName() { return "Min-Max Clip"; }

        @Override
        public String provenance() {
            return "Master Bias Min/Max Clipped (drop " + drop + ") Mean combined";
        }
    }

    record SigmaClip(double threshold) implements CombineMethod {
        public SigmaClip {
            // NaN tambien queda fuera
            if (!(threshold > 0)) {
                throw new IllegalArgumentException("Sigma threshold must be > 0, not " + threshold);
            }
        }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.sigmaClip(threshold); }

        @Override
        public String displayName() { return "Sigma Clip"; }

        @Override
        public String provenance() {
            return String.format(Locale.US, "Master Bias Sigma Clipped (threshold %s) Mean combined", threshold);
        }
    }
}
