package com.edabot.stats;

import com.edabot.config.EdaConfig;
import com.edabot.core.diagnostics.Outcome;
import com.edabot.core.diagnostics.RunDiagnostics;
import com.edabot.model.Panel;
import com.edabot.model.StylizedFactsRow;
import com.edabot.model.TestStatistic;

import java.util.ArrayList;
import java.util.List;

/**
 * Stylized-fact diagnostics of a return panel: serial correlation
 * (Ljung-Box), volatility clustering (ARCH-LM), tail heaviness (Hill) and
 * excess kurtosis.
 */
public final class StylizedFacts {
    private final int ljungBoxLags;
    private final int archLmLags;
    private final double hillQuantile;

    public StylizedFacts(int ljungBoxLags, int archLmLags, double hillQuantile) {
        this.ljungBoxLags = ljungBoxLags;
        this.archLmLags = archLmLags;
        this.hillQuantile = hillQuantile;
    }

    public static StylizedFacts fromConfig(EdaConfig config) {
        return new StylizedFacts(config.tests.ljungBoxLags, config.tests.archLmLags,
                config.tails.hillThresholdQuantile);
    }

    public List<StylizedFactsRow> run(Panel returns, RunDiagnostics diagnostics) {
        List<StylizedFactsRow> rows = new ArrayList<>(returns.columnCount());
        for (int c = 0; c < returns.columnCount(); c++) {
            String series = returns.columns().get(c);
            double[] x = returns.column(c);

            Outcome<TestStatistic> ljungBox = StationarityTests.guarded(series, LjungBoxTest.TEST_NAME, x,
                    v -> LjungBoxTest.run(v, ljungBoxLags));
            Outcome<TestStatistic> archLm = StationarityTests.guarded(series, ArchLmTest.TEST_NAME, x,
                    v -> ArchLmTest.run(v, archLmLags));
            Outcome<Double> hill = StationarityTests.guarded(series, HillEstimator.TEST_NAME, x,
                    v -> HillEstimator.estimate(v, hillQuantile));
            diagnostics.recordFailure(series, ljungBox);
            diagnostics.recordFailure(series, archLm);
            diagnostics.recordFailure(series, hill);

            rows.add(new StylizedFactsRow(series, ljungBox, archLm, hill, SummaryStatistics.excessKurtosis(x)));
        }
        return rows;
    }
}
