package com.masterbias.service;

/**
 * Decides whether two values are "the same" for temperature grouping.
 */
@FunctionalInterface
public interface ToleranceComparator {

    boolean same(double a, double b, double tolerance);

    /** Relative difference against the larger magnitude: |a-b| <= tolerance * max(|a|,|b|). */
    ToleranceComparator RELATIVE = (a, b, tolerance) ->
            Math.abs(a - b) <= tolerance * Math.max(Math.abs(a), Math.abs(b));
}
