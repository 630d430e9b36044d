package com.edabot.model;

import com.edabot.core.diagnostics.Outcome;

/**
 * ADF and KPSS results for one series. A failed test flattens to
 * {@code NaN}, {@code NaN}, {@link Verdict#ERROR}.
 */
public final class StationarityRow {
    public final String series;
    public final Outcome<TestStatistic> adf;
    public final Verdict adfVerdict;
    public final Outcome<TestStatistic> kpss;
    public final Verdict kpssVerdict;

    public StationarityRow(
            String series,
            Outcome<TestStatistic> adf,
            Verdict adfVerdict,
            Outcome<TestStatistic> kpss,
            Verdict kpssVerdict
    ) {
        this.series = series;
        this.adf = adf;
        this.adfVerdict = adfVerdict;
        this.kpss = kpss;
        this.kpssVerdict = kpssVerdict;
    }

    public double adfStatistic() {
        return adf.success ? adf.value.statistic : Double.NaN;
    }

    public double adfPValue() {
        return adf.success ? adf.value.pValue : Double.NaN;
    }

    public double kpssStatistic() {
        return kpss.success ? kpss.value.statistic : Double.NaN;
    }

    public double kpssPValue() {
        return kpss.success ? kpss.value.pValue : Double.NaN;
    }
}
