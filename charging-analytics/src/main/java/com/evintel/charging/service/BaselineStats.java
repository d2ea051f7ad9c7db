package com.evintel.charging.service;

import java.util.List;

/**
 * Mean and sample standard deviation of a baseline window.
 */
record BaselineStats(int n, double mean, double stddev) {

    static BaselineStats of(List<Double> values) {
        int n = values.size();
        if (n == 0) return new BaselineStats(0, 0.0, 0.0);
        double sum = 0.0;
        for (double v : values) sum += v;
        double mean = sum / n;
        if (n == 1) return new BaselineStats(1, mean, 0.0);
        double var = 0.0;
        for (double v : values) {
            double d = v - mean;
            var += d * d;
        }
        return new BaselineStats(n, mean, Math.sqrt(var / (n - 1)));
    }

    /**
     * How far {@code value} sits above the mean, in stddevs floored at {@code epsilon}, clamped to [0,1].
     */
    double severity(double value, double epsilon) {
        double z = (value - mean) / Math.max(stddev, epsilon);
        return clamp(z);
    }

    /**
     * Pearson correlation of paired samples; null when either side has no variance.
     */
    static Double pearson(double[] x, double[] y) {
        int n = x.length;
        if (n == 0 || n != y.length) return null;
        double mx = 0, my = 0;
        for (int i = 0; i < n; i++) {
            mx += x[i];
            my += y[i];
        }
        mx /= n;
        my /= n;
        double sxy = 0, sxx = 0, syy = 0;
        for (int i = 0; i < n; i++) {
            double dx = x[i] - mx;
            double dy = y[i] - my;
            sxy += dx * dy;
            sxx += dx * dx;
            syy += dy * dy;
        }
        if (sxx == 0 || syy == 0) return null;
        return sxy / Math.sqrt(sxx * syy);
    }

    static double clamp(double v) {
        if (Double.isNaN(v)) return 0.0;
        return Math.max(0.0, Math.min(1.0, v));
    }
}
