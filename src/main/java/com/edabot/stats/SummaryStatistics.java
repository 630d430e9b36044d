package com.edabot.stats;

import com.edabot.model.Panel;
import com.edabot.model.SummaryRow;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-series descriptive statistics of a return panel.
 *
 * <p>Skewness and kurtosis are the bias-adjusted sample estimators; the
 * Jarque-Bera statistic uses the population moments instead, as the test is
 * defined on them.
 */
public final class SummaryStatistics {

    private SummaryStatistics() {
    }

    public static List<SummaryRow> compute(Panel returns) {
        List<SummaryRow> rows = new ArrayList<>(returns.columnCount());
        for (int c = 0; c < returns.columnCount(); c++) {
            rows.add(describe(returns.columns().get(c), returns.column(c)));
        }
        return rows;
    }

    public static SummaryRow describe(String series, double[] x) {
        DescriptiveStatistics stats = new DescriptiveStatistics(x);
        int n = x.length;
        double[] jb = jarqueBera(x);
        return new SummaryRow(
                series,
                n == 0 ? Double.NaN : stats.getMean(),
                n < 2 ? Double.NaN : stats.getStandardDeviation(),
                n < 3 ? Double.NaN : stats.getSkewness(),
                excessKurtosis(x),
                jb[0],
                jb[1],
                n == 0 ? Double.NaN : stats.getMin(),
                n == 0 ? Double.NaN : stats.getMax(),
                SeriesMath.quantile(x, 0.25),
                SeriesMath.quantile(x, 0.75),
                n
        );
    }

    /**
     * Unbiased sample excess kurtosis; {@code NaN} below four observations.
     */
    public static double excessKurtosis(double[] x) {
        if (x.length < 4) {
            return Double.NaN;
        }
        return new DescriptiveStatistics(x).getKurtosis();
    }

    /**
     * Jarque-Bera statistic and its chi-squared(2) p-value.
     */
    static double[] jarqueBera(double[] x) {
        int n = x.length;
        if (n == 0) {
            return new double[]{Double.NaN, Double.NaN};
        }
        double m = SeriesMath.mean(x);
        double m2 = 0.0;
        double m3 = 0.0;
        double m4 = 0.0;
        for (double v : x) {
            double d = v - m;
            double d2 = d * d;
            m2 += d2;
            m3 += d2 * d;
            m4 += d2 * d2;
        }
        m2 /= n;
        m3 /= n;
        m4 /= n;
        if (m2 == 0.0) {
            return new double[]{Double.NaN, Double.NaN};
        }
        double skew = m3 / Math.pow(m2, 1.5);
        double kurt = m4 / (m2 * m2) - 3.0;
        double statistic = n / 6.0 * (skew * skew + kurt * kurt / 4.0);
        return new double[]{statistic, SeriesMath.chiSquareSurvival(statistic, 2)};
    }
}
