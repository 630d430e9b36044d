package com.edabot.stats;

import com.edabot.core.diagnostics.CauseCode;
import com.edabot.core.diagnostics.Outcome;
import com.edabot.core.diagnostics.RunDiagnostics;
import com.edabot.model.Panel;
import com.edabot.model.StationarityRow;
import com.edabot.model.TestStatistic;
import com.edabot.model.Verdict;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Runs ADF and KPSS on every column of a panel. A test that cannot be
 * computed for one series is reported as {@link Verdict#ERROR} for that
 * series only.
 */
public final class StationarityTests {
    private static final Logger log = LogManager.getLogger(StationarityTests.class);

    private final double alpha;

    public StationarityTests(double alpha) {
        if (!(alpha > 0.0 && alpha < 1.0)) {
            throw new IllegalArgumentException("alpha must be in (0, 1), got " + alpha);
        }
        this.alpha = alpha;
    }

    public List<StationarityRow> run(Panel panel, RunDiagnostics diagnostics) {
        return run(panel, diagnostics, "");
    }

    /**
     * Missing values are skipped per series, so price levels kept without
     * {@code dropna} can be tested too. Failures are recorded under
     * {@code failurePrefix + series}.
     */
    public List<StationarityRow> run(Panel panel, RunDiagnostics diagnostics, String failurePrefix) {
        List<StationarityRow> rows = new ArrayList<>(panel.columnCount());
        for (int c = 0; c < panel.columnCount(); c++) {
            String series = panel.columns().get(c);
            double[] x = finiteValues(panel.column(c));

            Outcome<TestStatistic> adf = guarded(series, AdfTest.TEST_NAME, x, AdfTest::run);
            Outcome<TestStatistic> kpss = guarded(series, KpssTest.TEST_NAME, x, KpssTest::run);
            diagnostics.recordFailure(failurePrefix + series, adf);
            diagnostics.recordFailure(failurePrefix + series, kpss);

            rows.add(new StationarityRow(series, adf, adfVerdict(adf), kpss, kpssVerdict(kpss)));
        }
        return rows;
    }

    /**
     * ADF rejects a unit root when p < alpha.
     */
    Verdict adfVerdict(Outcome<TestStatistic> adf) {
        if (!adf.success || !adf.value.isFinite()) {
            return Verdict.ERROR;
        }
        return adf.value.pValue < alpha ? Verdict.STATIONARY : Verdict.NON_STATIONARY;
    }

    /**
     * KPSS keeps its stationarity null when p > alpha.
     */
    Verdict kpssVerdict(Outcome<TestStatistic> kpss) {
        if (!kpss.success || !kpss.value.isFinite()) {
            return Verdict.ERROR;
        }
        return kpss.value.pValue > alpha ? Verdict.STATIONARY : Verdict.NON_STATIONARY;
    }

    private static double[] finiteValues(double[] x) {
        int count = 0;
        for (double v : x) {
            if (Double.isFinite(v)) {
                count++;
            }
        }
        if (count == x.length) {
            return x;
        }
        double[] out = new double[count];
        int i = 0;
        for (double v : x) {
            if (Double.isFinite(v)) {
                out[i++] = v;
            }
        }
        return out;
    }

    static <T> Outcome<T> guarded(String series, String test, double[] x, Function<double[], Outcome<T>> body) {
        try {
            Outcome<T> outcome = body.apply(x);
            if (!outcome.success) {
                log.warn("{} failed for {}: {} {}", test, series, outcome.causeCode, outcome.details);
            }
            return outcome;
        } catch (RuntimeException e) {
            log.warn("{} failed for {}: {}", test, series, e.toString());
            return Outcome.failure(CauseCode.RUNTIME_ERROR, test, Map.of("error", e.toString()));
        }
    }
}
