package com.edabot.model;

/**
 * Statistic and p-value of one hypothesis test.
 */
public final class TestStatistic {
    public final double statistic;
    public final double pValue;

    public TestStatistic(double statistic, double pValue) {
        this.statistic = statistic;
        this.pValue = pValue;
    }

    public boolean isFinite() {
        return Double.isFinite(statistic) && Double.isFinite(pValue);
    }

    @Override
    public String toString() {
        return "TestStatistic{statistic=" + statistic + ", pValue=" + pValue + "}";
    }
}
