package com.edabot.stats;

import org.apache.commons.math3.distribution.NormalDistribution;

/**
 * MacKinnon (1994, 2010) response-surface p-values for the Dickey-Fuller tau
 * statistic with constant and linear trend, single series.
 */
final class MacKinnonPValues {
    private static final double TAU_MAX = 0.7;
    private static final double TAU_MIN = -16.18;
    private static final double TAU_STAR = -2.89;
    private static final double[] SMALL_P = {3.2512, 1.6047, 0.049588};
    private static final double[] LARGE_P = {2.5261, 0.61654, -0.37956, -0.060285};

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(0.0, 1.0);

    private MacKinnonPValues() {
    }

    static double trendPValue(double tau) {
        if (Double.isNaN(tau)) {
            return Double.NaN;
        }
        if (tau > TAU_MAX) {
            return 1.0;
        }
        if (tau < TAU_MIN) {
            return 0.0;
        }
        double[] coefficients = tau <= TAU_STAR ? SMALL_P : LARGE_P;
        double z = 0.0;
        for (int i = coefficients.length - 1; i >= 0; i--) {
            z = z * tau + coefficients[i];
        }
        return STANDARD_NORMAL.cumulativeProbability(z);
    }
}
