package com.edabot.model;

/**
 * Descriptive statistics of one return series. Values that are undefined for
 * the sample size are {@code NaN}.
 */
public final class SummaryRow {
    public final String series;
    public final double mean;
    public final double std;
    public final double skewness;
    public final double excessKurtosis;
    public final double jbStatistic;
    public final double jbPValue;
    public final double min;
    public final double max;
    public final double q25;
    public final double q75;
    public final int observations;

    public SummaryRow(
            String series,
            double mean,
            double std,
            double skewness,
            double excessKurtosis,
            double jbStatistic,
            double jbPValue,
            double min,
            double max,
            double q25,
            double q75,
            int observations
    ) {
        this.series = series;
        this.mean = mean;
        this.std = std;
        this.skewness = skewness;
        this.excessKurtosis = excessKurtosis;
        this.jbStatistic = jbStatistic;
        this.jbPValue = jbPValue;
        this.min = min;
        this.max = max;
        this.q25 = q25;
        this.q75 = q75;
        this.observations = observations;
    }
}
