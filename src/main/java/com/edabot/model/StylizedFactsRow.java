package com.edabot.model;

import com.edabot.core.diagnostics.Outcome;

public final class StylizedFactsRow {
    public final String series;
    public final Outcome<TestStatistic> ljungBox;
    public final Outcome<TestStatistic> archLm;
    public final Outcome<Double> hillTailIndex;
    public final double excessKurtosis;

    public StylizedFactsRow(
            String series,
            Outcome<TestStatistic> ljungBox,
            Outcome<TestStatistic> archLm,
            Outcome<Double> hillTailIndex,
            double excessKurtosis
    ) {
        this.series = series;
        this.ljungBox = ljungBox;
        this.archLm = archLm;
        this.hillTailIndex = hillTailIndex;
        this.excessKurtosis = excessKurtosis;
    }

    public double ljungBoxStatistic() {
        return ljungBox.success ? ljungBox.value.statistic : Double.NaN;
    }

    public double ljungBoxPValue() {
        return ljungBox.success ? ljungBox.value.pValue : Double.NaN;
    }

    public double archLmStatistic() {
        return archLm.success ? archLm.value.statistic : Double.NaN;
    }

    public double archLmPValue() {
        return archLm.success ? archLm.value.pValue : Double.NaN;
    }

    public double hill() {
        return hillTailIndex.success ? hillTailIndex.value : Double.NaN;
    }
}
