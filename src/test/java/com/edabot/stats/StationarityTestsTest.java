package com.edabot.stats;

import com.edabot.core.diagnostics.CauseCode;
import com.edabot.core.diagnostics.Outcome;
import com.edabot.core.diagnostics.RunDiagnostics;
import com.edabot.model.Panel;
import com.edabot.model.StationarityRow;
import com.edabot.model.TestStatistic;
import com.edabot.model.TimeIndex;
import com.edabot.model.Verdict;
import com.edabot.support.PriceFixtures;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StationarityTestsTest {

    // AR(1) around a drift, phi 0.95; statsmodels 'ct' selects 7 lagged differences.
    private static final double[] PERSISTENT = {
            98.36, 100.09, 100.52, 99.98, 101.02, 100.00, 102.45, 103.04, 102.93, 103.71,
            102.41, 102.98, 103.99, 104.94, 105.37, 104.14, 104.41, 102.93, 103.16, 102.54,
            101.80, 102.68, 104.78, 106.28, 105.78, 105.26, 104.21, 103.60, 103.76, 104.24,
            103.78, 103.81, 102.64, 102.17, 103.62, 105.03, 105.51, 105.53, 105.69, 104.90,
            103.67, 104.22, 103.09, 103.55, 102.38, 102.39, 104.15, 104.76, 104.63, 104.87
    };

    // AR(1) around a drift, phi 0.85; tau lies above the MacKinnon switch point.
    private static final double[] MEAN_REVERTING = {
            99.06, 99.47, 100.90, 102.37, 103.27, 102.90, 102.89, 102.30, 100.75, 100.29,
            101.31, 101.48, 101.08, 100.01, 100.06, 99.63, 99.88, 100.55, 98.38, 98.72,
            97.65, 97.27, 96.66, 98.48, 99.60, 100.38, 99.82, 98.67, 98.74, 99.39,
            99.68, 100.68, 100.51, 102.51, 103.08, 104.91, 104.73, 104.11, 102.98, 103.67,
            104.50, 104.33, 104.44, 103.87, 103.25, 102.85, 100.94, 100.18, 100.60, 101.04
    };

    private static double[] randomWalk(long seed, int n) {
        double[] shocks = PriceFixtures.normals(seed, n);
        double[] walk = new double[n];
        double level = 0.0;
        for (int i = 0; i < n; i++) {
            level += shocks[i];
            walk[i] = level;
        }
        return walk;
    }

    @Test
    void maxLag_shouldFollowSchwertRuleCappedBySampleSize() {
        assertEquals(12, AdfTest.maxLag(100));
        assertEquals(2, AdfTest.maxLag(10));
        assertTrue(AdfTest.maxLag(5) < 0);
    }

    @Test
    void adf_shouldReportInsufficientDataForVeryShortSeries() {
        Outcome<TestStatistic> outcome = AdfTest.run(new double[]{1, 3, 2, 5, 4});

        assertFalse(outcome.success);
        assertEquals(CauseCode.INSUFFICIENT_DATA, outcome.causeCode);
    }

    @Test
    void adf_shouldRejectUnitRootForWhiteNoiseOnly() {
        Outcome<TestStatistic> noise = AdfTest.run(PriceFixtures.normals(3L, 500));
        Outcome<TestStatistic> walk = AdfTest.run(randomWalk(3L, 500));

        assertTrue(noise.success);
        assertTrue(walk.success);
        assertTrue(noise.value.pValue < 0.01, "white noise p=" + noise.value.pValue);
        assertTrue(walk.value.pValue > noise.value.pValue);
        assertTrue(noise.value.statistic < walk.value.statistic);
    }

    @Test
    void adf_shouldMatchStatsmodelsReferenceValues() {
        Outcome<TestStatistic> persistent = AdfTest.run(PERSISTENT);
        Outcome<TestStatistic> reverting = AdfTest.run(MEAN_REVERTING);

        assertTrue(persistent.success);
        assertEquals(-2.9480454342289217, persistent.value.statistic, 1e-6);
        assertEquals(0.14719020003244, persistent.value.pValue, 1e-6);
        assertEquals(7, persistent.details.get("lag"));
        assertEquals(42, persistent.details.get("nobs"));

        assertTrue(reverting.success);
        assertEquals(-2.31977967112145, reverting.value.statistic, 1e-6);
        assertEquals(0.4230416580663283, reverting.value.pValue, 1e-6);
        assertEquals(2, reverting.details.get("lag"));
        assertEquals(47, reverting.details.get("nobs"));
    }

    @Test
    void kpss_shouldMatchStatsmodelsReferenceValues() {
        Outcome<TestStatistic> persistent = KpssTest.run(PERSISTENT);
        Outcome<TestStatistic> reverting = KpssTest.run(MEAN_REVERTING);

        assertTrue(persistent.success);
        assertEquals(0.15493470094912626, persistent.value.statistic, 1e-6);
        assertEquals(0.04255441587572811, persistent.value.pValue, 1e-6);
        assertEquals(4, persistent.details.get("lags"));

        assertTrue(reverting.success);
        assertEquals(0.1506482669893585, reverting.value.statistic, 1e-6);
        assertEquals(0.04612644417553459, reverting.value.pValue, 1e-6);
        assertEquals(4, reverting.details.get("lags"));
    }

    @Test
    void mackinnon_shouldHitFivePercentCriticalValue() {
        assertEquals(0.05, MacKinnonPValues.trendPValue(-3.41), 0.005);
        assertEquals(1.0, MacKinnonPValues.trendPValue(1.0), 0.0);
        assertEquals(0.0, MacKinnonPValues.trendPValue(-20.0), 0.0);
        assertTrue(MacKinnonPValues.trendPValue(-2.0) > MacKinnonPValues.trendPValue(-3.0));
    }

    @Test
    void kpssPValue_shouldInterpolateAndClamp() {
        assertEquals(0.05, KpssTest.pValue(0.146), 1e-12);
        assertEquals(0.10, KpssTest.pValue(0.01), 0.0);
        assertEquals(0.01, KpssTest.pValue(5.0), 0.0);
        assertEquals(0.0375, KpssTest.pValue(0.161), 1e-12);
    }

    @Test
    void kpss_shouldFlagDeterministicCurvature() {
        int n = 500;
        double[] noise = PriceFixtures.normals(5L, n);
        double[] x = new double[n];
        for (int t = 0; t < n; t++) {
            double s = (double) t / n;
            x[t] = 100.0 * s * s + noise[t];
        }

        Outcome<TestStatistic> outcome = KpssTest.run(x);

        assertTrue(outcome.success);
        assertEquals(0.01, outcome.value.pValue, 0.0);
    }

    @Test
    void run_shouldGiveVerdictsPerSeriesAndIsolateFailures() {
        int n = 300;
        double[] constant = new double[n];
        Arrays.fill(constant, 1.5);
        Panel panel = new Panel(TimeIndex.ordinal(n), List.of("NOISE", "FLAT"),
                new double[][]{PriceFixtures.normals(9L, n), constant});
        RunDiagnostics diagnostics = new RunDiagnostics();

        List<StationarityRow> rows = new StationarityTests(0.05).run(panel, diagnostics);

        assertEquals(Verdict.STATIONARY, rows.get(0).adfVerdict);
        assertTrue(Double.isFinite(rows.get(0).kpssStatistic()));
        assertEquals(Verdict.ERROR, rows.get(1).adfVerdict);
        assertEquals(Verdict.ERROR, rows.get(1).kpssVerdict);
        assertTrue(Double.isNaN(rows.get(1).adfPValue()));
        assertEquals(2, diagnostics.failures.size());
        assertEquals("FLAT", diagnostics.failures.get(0).series);
        assertEquals(CauseCode.DEGENERATE_SERIES, diagnostics.failures.get(0).causeCode);
    }

    @Test
    void run_shouldPrefixFailuresAndSkipMissingValues() {
        double[] withGap = randomWalk(4L, 200);
        withGap[10] = Double.NaN;
        double[] constant = new double[200];
        Arrays.fill(constant, 3.0);
        Panel panel = new Panel(TimeIndex.ordinal(200), List.of("A", "B"), new double[][]{withGap, constant});
        RunDiagnostics diagnostics = new RunDiagnostics();

        List<StationarityRow> rows = new StationarityTests(0.05).run(panel, diagnostics, "levels:");

        assertTrue(rows.get(0).adf.success);
        assertTrue(rows.get(0).kpss.success);
        assertEquals("levels:B", diagnostics.failures.get(0).series);
    }

    @Test
    void verdicts_shouldApplyOppositeNullHypotheses() {
        StationarityTests tests = new StationarityTests(0.05);
        Outcome<TestStatistic> low = Outcome.success(new TestStatistic(1.0, 0.01), "t");
        Outcome<TestStatistic> high = Outcome.success(new TestStatistic(1.0, 0.20), "t");
        Outcome<TestStatistic> nan = Outcome.success(new TestStatistic(Double.NaN, 0.20), "t");

        assertEquals(Verdict.STATIONARY, tests.adfVerdict(low));
        assertEquals(Verdict.NON_STATIONARY, tests.adfVerdict(high));
        assertEquals(Verdict.NON_STATIONARY, tests.kpssVerdict(low));
        assertEquals(Verdict.STATIONARY, tests.kpssVerdict(high));
        assertEquals(Verdict.ERROR, tests.kpssVerdict(nan));
    }

    @Test
    void guarded_shouldTurnExceptionsIntoRuntimeErrors() {
        Outcome<TestStatistic> outcome = StationarityTests.guarded("A", "adf", new double[]{1, 2},
                x -> {
                    throw new IllegalStateException("boom");
                });

        assertFalse(outcome.success);
        assertEquals(CauseCode.RUNTIME_ERROR, outcome.causeCode);
        assertEquals("adf", outcome.test);
    }

    @Test
    void constructor_shouldRejectAlphaOutsideUnitInterval() {
        assertThrows(IllegalArgumentException.class, () -> new StationarityTests(0.0));
        assertThrows(IllegalArgumentException.class, () -> new StationarityTests(1.0));
    }
}
