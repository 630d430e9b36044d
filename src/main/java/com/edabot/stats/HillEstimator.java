package com.edabot.stats;

import com.edabot.core.diagnostics.CauseCode;
import com.edabot.core.diagnostics.Outcome;

import java.util.Map;

/**
 * Hill estimator of the upper-tail index.
 *
 * <p>The threshold is the R-7 sample quantile at {@code q}; only observations
 * strictly above it count. Fewer than {@link #MIN_EXCEEDANCES} of them, or a
 * non-positive threshold, gives no estimate.
 */
public final class HillEstimator {
    public static final String TEST_NAME = "hill";
    public static final int MIN_EXCEEDANCES = 10;

    private HillEstimator() {
    }

    public static double hillIndex(double[] x, double q) {
        return estimate(x, q).orElse(Double.NaN);
    }

    public static Outcome<Double> estimate(double[] x, double q) {
        if (!(q > 0.0 && q < 1.0)) {
            throw new IllegalArgumentException("threshold quantile must be in (0, 1), got " + q);
        }
        if (x.length == 0) {
            return Outcome.failure(CauseCode.INSUFFICIENT_DATA, TEST_NAME, Map.of("n", 0));
        }
        double u = SeriesMath.quantile(x, q);
        int exceedances = 0;
        double logSum = 0.0;
        for (double v : x) {
            if (v > u) {
                exceedances++;
                logSum += Math.log(v / u);
            }
        }
        if (exceedances < MIN_EXCEEDANCES) {
            return Outcome.failure(CauseCode.INSUFFICIENT_TAIL_MASS, TEST_NAME,
                    Map.of("exceedances", exceedances, "threshold", u));
        }
        if (u <= 0.0) {
            return Outcome.failure(CauseCode.NON_POSITIVE_THRESHOLD, TEST_NAME, Map.of("threshold", u));
        }
        double index = exceedances / logSum;
        if (!Double.isFinite(index)) {
            return Outcome.failure(CauseCode.NON_FINITE_RESULT, TEST_NAME, Map.of("threshold", u));
        }
        return Outcome.success(index, TEST_NAME, Map.of("exceedances", exceedances, "threshold", u));
    }
}
