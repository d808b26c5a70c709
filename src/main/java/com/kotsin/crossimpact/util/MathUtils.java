package com.kotsin.crossimpact.util;

/**
 * MathUtils - Safe mathematical operations with NaN/Infinity/Division-by-zero protection
 *
 * USAGE:
 * Instead of: double result = a / b;
 * Use: double result = MathUtils.safeDivide(a, b, 0.0);
 */
public final class MathUtils {

    private MathUtils() {} // Prevent instantiation

    // Epsilon for floating point comparisons
    private static final double EPSILON = 1e-10;

    // ======================== SAFE DIVISION ========================

    /**
     * Safe division that returns defaultValue if denominator is 0, NaN, or Infinity
     */
    public static double safeDivide(double numerator, double denominator, double defaultValue) {
        if (!isValidDenominator(denominator)) {
            return defaultValue;
        }
        double result = numerator / denominator;
        if (!isValidNumber(result)) {
            return defaultValue;
        }
        return result;
    }

    public static boolean isValidDenominator(double value) {
        return value != 0 && !Double.isNaN(value) && !Double.isInfinite(value);
    }

    // ======================== NUMBER VALIDATION ========================

    public static boolean isValidNumber(double value) {
        return !Double.isNaN(value) && !Double.isInfinite(value);
    }

    public static boolean isValidPositive(double value) {
        return isValidNumber(value) && value > 0;
    }

    /**
     * Wraps a computed value as a nullable Double: NaN and Infinity become null ("undefined").
     */
    public static Double definedOrNull(double value) {
        return isValidNumber(value) ? value : null;
    }

    // ======================== SERIES STATISTICS ========================

    public static double mean(double[] values) {
        if (values.length == 0) {
            return Double.NaN;
        }
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    /**
     * Population standard deviation (denominator n).
     */
    public static double populationStdDev(double[] values, double mean) {
        if (values.length == 0) {
            return Double.NaN;
        }
        double sumSq = 0.0;
        for (double v : values) {
            double d = v - mean;
            sumSq += d * d;
        }
        return Math.sqrt(sumSq / values.length);
    }

    /**
     * Pearson correlation. 0 when either series has no variance.
     */
    public static double correlation(double[] x, double[] y) {
        if (x.length != y.length || x.length == 0) {
            throw new IllegalArgumentException("Series lengths differ or are empty: " + x.length + " vs " + y.length);
        }
        double mx = mean(x);
        double my = mean(y);
        double sxy = 0.0, sxx = 0.0, syy = 0.0;
        for (int i = 0; i < x.length; i++) {
            double dx = x[i] - mx;
            double dy = y[i] - my;
            sxy += dx * dy;
            sxx += dx * dx;
            syy += dy * dy;
        }
        return safeDivide(sxy, Math.sqrt(sxx * syy), 0.0);
    }

    // ======================== FLOATING POINT COMPARISON ========================

    public static boolean isZero(double value) {
        return Math.abs(value) < EPSILON;
    }
}
