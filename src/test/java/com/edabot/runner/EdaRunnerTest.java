package com.edabot.runner;

import com.edabot.config.ConfigLoader;
import com.edabot.config.ConfigurationException;
import com.edabot.config.EdaConfig;
import com.edabot.model.Verdict;
import com.edabot.output.CsvTableWriter;
import com.edabot.output.ReportBuilder;
import com.edabot.output.RunManifestWriter;
import com.edabot.support.PriceFixtures;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EdaRunnerTest {

    @TempDir
    Path dir;

    private EdaConfig writeConfig(String csv) throws Exception {
        return writeConfig(csv, PriceFixtures.configMap("prices.csv"));
    }

    private EdaConfig writeConfig(String csv, Map<String, Object> raw) throws Exception {
        PriceFixtures.write(dir, "prices.csv", csv);
        Path config = PriceFixtures.write(dir, "eda.yaml", PriceFixtures.yaml(raw));
        return ConfigLoader.load(config, dir);
    }

    private static String twoSeriesCsv(int rows) {
        return PriceFixtures.csv(List.of("Date", "SPY", "TLT"),
                PriceFixtures.businessDates(LocalDate.of(2023, 1, 2), rows),
                PriceFixtures.geometricWalk(1L, rows, 400.0, 0.012),
                PriceFixtures.geometricWalk(2L, rows, 100.0, 0.008));
    }

    @Test
    void run_shouldWriteAllTablesReportAndManifest() throws Exception {
        EdaConfig config = writeConfig(twoSeriesCsv(252));

        RunOutcome outcome = new EdaRunner().run(config);

        assertEquals(252, outcome.priceRows);
        assertEquals(251, outcome.returnRows);
        assertEquals(List.of("SPY", "TLT"), outcome.columns);
        assertEquals(251, outcome.summary.get(0).observations);
        assertTrue(outcome.levelsStationarity.isEmpty());
        assertTrue(outcome.plots.isEmpty());
        Path artifacts = dir.resolve("out/artifacts");
        assertTrue(Files.isRegularFile(artifacts.resolve(CsvTableWriter.SUMMARY_FILE)));
        assertTrue(Files.isRegularFile(artifacts.resolve(CsvTableWriter.STATIONARITY_FILE)));
        assertTrue(Files.isRegularFile(artifacts.resolve(CsvTableWriter.STYLIZED_FACTS_FILE)));
        assertFalse(Files.exists(artifacts.resolve(CsvTableWriter.STATIONARITY_LEVELS_FILE)));
        assertEquals(dir.resolve("out/reports").resolve(ReportBuilder.REPORT_FILE), outcome.reportPath);
        String report = Files.readString(outcome.reportPath);
        assertTrue(report.contains("No plots were enabled for this run."));
        assertTrue(report.contains("| SPY |"));

        JSONObject manifest = new JSONObject(Files.readString(artifacts.resolve(RunManifestWriter.MANIFEST_FILE)));
        assertEquals(252, manifest.getJSONObject("row_counts").getInt("rows_read"));
        assertEquals(251, manifest.getJSONObject("row_counts").getInt("return_rows"));
        assertEquals(0, manifest.getJSONArray("test_failures").length());
    }

    @Test
    void run_shouldProduceIdenticalTablesOnRepeat() throws Exception {
        EdaConfig config = writeConfig(twoSeriesCsv(120));
        Path summary = dir.resolve("out/artifacts").resolve(CsvTableWriter.SUMMARY_FILE);
        Path facts = dir.resolve("out/artifacts").resolve(CsvTableWriter.STYLIZED_FACTS_FILE);

        new EdaRunner().run(config);
        byte[] firstSummary = Files.readAllBytes(summary);
        byte[] firstFacts = Files.readAllBytes(facts);
        new EdaRunner().run(config);

        assertArrayEquals(firstSummary, Files.readAllBytes(summary));
        assertArrayEquals(firstFacts, Files.readAllBytes(facts));
    }

    @Test
    void run_shouldIsolateConstantSeriesFailures() throws Exception {
        int rows = 200;
        double[] flat = new double[rows];
        Arrays.fill(flat, 50.0);
        String csv = PriceFixtures.csv(List.of("Date", "A", "C"),
                PriceFixtures.businessDates(LocalDate.of(2023, 1, 2), rows),
                PriceFixtures.geometricWalk(5L, rows, 20.0, 0.01), flat);
        Map<String, Object> raw = PriceFixtures.configMap("prices.csv");
        PriceFixtures.section(raw, "tests").put("stationarity_on_levels", true);
        EdaConfig config = writeConfig(csv, raw);

        RunOutcome outcome = new EdaRunner().run(config);

        assertEquals(Verdict.ERROR, outcome.stationarity.get(1).adfVerdict);
        assertEquals(Verdict.STATIONARY, outcome.stationarity.get(0).adfVerdict);
        List<String> lines = Files.readAllLines(dir.resolve("out/artifacts").resolve(CsvTableWriter.STATIONARITY_FILE));
        assertEquals("C,,,Error,,,Error", lines.get(2));
        assertTrue(Files.isRegularFile(dir.resolve("out/artifacts").resolve(CsvTableWriter.STATIONARITY_LEVELS_FILE)));
        assertEquals(2, outcome.levelsStationarity.size());
        assertTrue(outcome.diagnostics.failures.stream().anyMatch(f -> f.series.equals("levels:C")));
        assertTrue(Files.readString(outcome.reportPath).contains("## Stationarity Tests (Price Levels)"));
    }

    @Test
    void run_shouldFailBeforeWritingWhenNoPriceColumns() throws Exception {
        EdaConfig config = writeConfig("date,id\n2024-01-02,1\n2024-01-03,2\n");

        assertThrows(ConfigurationException.class, () -> new EdaRunner().run(config));
        assertFalse(Files.exists(dir.resolve("out/artifacts")));
        assertFalse(Files.exists(dir.resolve("out/reports")));
    }
}
