package com.edabot.stats;

import org.apache.commons.math3.distribution.ChiSquaredDistribution;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

/**
 * Small numeric helpers shared by the analyzers and the plot writer.
 */
public final class SeriesMath {

    private SeriesMath() {
    }

    public static double mean(double[] x) {
        if (x.length == 0) {
            return Double.NaN;
        }
        double sum = 0.0;
        for (double v : x) {
            sum += v;
        }
        return sum / x.length;
    }

    public static boolean isConstant(double[] x) {
        for (int i = 1; i < x.length; i++) {
            if (x[i] != x[0]) {
                return false;
            }
        }
        return true;
    }

    /**
     * Quantile by linear interpolation between order statistics (R type 7).
     *
     * @param q probability in (0, 1]
     */
    public static double quantile(double[] x, double q) {
        if (x.length == 0) {
            return Double.NaN;
        }
        return new Percentile()
                .withEstimationType(Percentile.EstimationType.R_7)
                .evaluate(x, q * 100.0);
    }

    /**
     * Upper tail probability of a chi-squared variable.
     */
    public static double chiSquareSurvival(double statistic, int degreesOfFreedom) {
        if (!Double.isFinite(statistic) || degreesOfFreedom <= 0) {
            return Double.NaN;
        }
        if (statistic <= 0.0) {
            return 1.0;
        }
        ChiSquaredDistribution chi2 = new ChiSquaredDistribution(degreesOfFreedom);
        return Math.max(0.0, 1.0 - chi2.cumulativeProbability(statistic));
    }

    /**
     * Sample autocorrelations for lags 0..maxLag about the overall mean, each
     * normalised by the full-sample sum of squares. Returns {@code null} for a
     * constant series.
     */
    public static double[] acf(double[] x, int maxLag) {
        int n = x.length;
        double m = mean(x);
        double denominator = 0.0;
        for (double v : x) {
            denominator += (v - m) * (v - m);
        }
        if (denominator == 0.0) {
            return null;
        }
        int lags = Math.min(maxLag, n - 1);
        double[] out = new double[lags + 1];
        for (int k = 0; k <= lags; k++) {
            double s = 0.0;
            for (int t = k; t < n; t++) {
                s += (x[t] - m) * (x[t - k] - m);
            }
            out[k] = s / denominator;
        }
        return out;
    }

    /**
     * Partial autocorrelations from an autocorrelation sequence by the
     * Durbin-Levinson recursion. Element 0 is 1.
     */
    public static double[] pacf(double[] acf) {
        int lags = acf.length - 1;
        double[] out = new double[lags + 1];
        out[0] = 1.0;
        if (lags == 0) {
            return out;
        }
        double[] phi = new double[lags + 1];
        double[] previous = new double[lags + 1];
        double v = 1.0;
        for (int k = 1; k <= lags; k++) {
            double num = acf[k];
            for (int j = 1; j < k; j++) {
                num -= previous[j] * acf[k - j];
            }
            double pkk = v == 0.0 ? 0.0 : num / v;
            phi[k] = pkk;
            for (int j = 1; j < k; j++) {
                phi[j] = previous[j] - pkk * previous[k - j];
            }
            v *= (1.0 - pkk * pkk);
            out[k] = pkk;
            System.arraycopy(phi, 0, previous, 0, k + 1);
        }
        return out;
    }
}
