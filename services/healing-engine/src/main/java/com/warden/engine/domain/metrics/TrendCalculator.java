package com.warden.engine.domain.metrics;

/**
 * Percentage change of a current value against a window average.
 */
public final class TrendCalculator {

    /** Averages whose magnitude is below this produce a trend of 0. */
    public static final double EPSILON = 1e-4;

    private TrendCalculator() {
    }

    /**
     * Returns {@code round(((current - average) / average) * 100, 1)}, or 0 when
     * {@code |average| < 1e-4}. Rounds half up to one decimal.
     */
    public static double trend(double current, double average) {
        if (Math.abs(average) < EPSILON) {
            return 0;
        }
        double pct = ((current - average) / average) * 100;
        return Math.round(pct * 10) / 10.0;
    }
}
