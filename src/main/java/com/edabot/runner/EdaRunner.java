package com.edabot.runner;

import com.edabot.config.EdaConfig;
import com.edabot.core.PipelineException;
import com.edabot.core.diagnostics.RunDiagnostics;
import com.edabot.data.PanelLoader;
import com.edabot.data.ReturnTransform;
import com.edabot.model.Panel;
import com.edabot.model.StationarityRow;
import com.edabot.model.StylizedFactsRow;
import com.edabot.model.SummaryRow;
import com.edabot.output.CsvTableWriter;
import com.edabot.output.PlotWriter;
import com.edabot.output.ReportBuilder;
import com.edabot.output.RunManifestWriter;
import com.edabot.stats.StationarityTests;
import com.edabot.stats.StylizedFacts;
import com.edabot.stats.SummaryStatistics;
import com.edabot.utils.StepTimer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs one analysis end to end. All inputs are loaded and analysed before the
 * first file is written, so a configuration or data error leaves the output
 * directories untouched.
 */
public final class EdaRunner {
    private static final Logger log = LogManager.getLogger(EdaRunner.class);

    static final String LEVELS_PREFIX = "levels:";

    private final PanelLoader panelLoader;
    private final PlotWriter plotWriter;
    private final ReportBuilder reportBuilder;

    public EdaRunner() {
        this(new PanelLoader(), new PlotWriter(), new ReportBuilder());
    }

    public EdaRunner(PanelLoader panelLoader, PlotWriter plotWriter, ReportBuilder reportBuilder) {
        this.panelLoader = panelLoader;
        this.plotWriter = plotWriter;
        this.reportBuilder = reportBuilder;
    }

    public RunOutcome run(EdaConfig config) {
        return run(config, new StepTimer());
    }

    public RunOutcome run(EdaConfig config, StepTimer timer) {
        RunDiagnostics diagnostics = new RunDiagnostics();
        diagnostics.addConfig("input_csv", config.inputCsv);
        diagnostics.addConfig("return_type", config.returnType.code());
        diagnostics.addConfig("resample", config.resample == null ? "" : config.resample.code);
        diagnostics.addConfig("seed", config.seed);
        timer.start(StepTimer.TOTAL);

        timer.start(StepTimer.LOAD);
        Panel prices = panelLoader.load(config, diagnostics);
        timer.end(StepTimer.LOAD);

        timer.start(StepTimer.RETURNS);
        ReturnTransform.Result transformed = ReturnTransform.apply(prices, config.returnType);
        Panel returns = transformed.returns;
        diagnostics.addStageCount("return_rows", returns.rowCount());
        timer.end(StepTimer.RETURNS);

        timer.start(StepTimer.ANALYZE);
        log.info("Computing summary statistics...");
        List<SummaryRow> summary = SummaryStatistics.compute(returns);
        log.info("Running stationarity tests...");
        StationarityTests stationarityTests = new StationarityTests(config.tests.adfAlpha);
        List<StationarityRow> stationarity = stationarityTests.run(returns, diagnostics);
        List<StationarityRow> levels = null;
        if (config.tests.levelsStationarity) {
            log.info("Running stationarity tests on price levels...");
            levels = stationarityTests.run(prices, diagnostics, LEVELS_PREFIX);
        }
        log.info("Analyzing stylized facts...");
        List<StylizedFactsRow> facts = StylizedFacts.fromConfig(config).run(returns, diagnostics);
        timer.end(StepTimer.ANALYZE);

        timer.start(StepTimer.OUTPUT);
        Path artifactsDir = config.outputDirs.artifacts;
        Path reportsDir = config.outputDirs.reports;
        List<Path> artifacts = new ArrayList<>();
        try {
            Files.createDirectories(artifactsDir);
            Files.createDirectories(reportsDir);
            artifacts.add(CsvTableWriter.writeSummary(artifactsDir, summary));
            artifacts.add(CsvTableWriter.writeStationarity(
                    artifactsDir.resolve(CsvTableWriter.STATIONARITY_FILE), stationarity));
            if (levels != null) {
                artifacts.add(CsvTableWriter.writeStationarity(
                        artifactsDir.resolve(CsvTableWriter.STATIONARITY_LEVELS_FILE), levels));
            }
            artifacts.add(CsvTableWriter.writeStylizedFacts(artifactsDir, facts));
        } catch (IOException e) {
            throw new PipelineException("output", "Failed to write result tables to " + artifactsDir + ": "
                    + e.getMessage(), e);
        }
        timer.end(StepTimer.OUTPUT);

        List<String> plots = List.of();
        if (config.anyPlotEnabled()) {
            timer.start(StepTimer.PLOTS);
            log.info("Creating visualizations...");
            try {
                plots = plotWriter.writeAll(config, prices, returns);
            } catch (IOException e) {
                throw new PipelineException("output", "Failed to prepare plot directory " + reportsDir + ": "
                        + e.getMessage(), e);
            }
            timer.end(StepTimer.PLOTS);
        }

        Path manifestPath = artifactsDir.resolve(RunManifestWriter.MANIFEST_FILE);
        List<String> artifactNames = new ArrayList<>();
        for (Path p : artifacts) {
            artifactNames.add(p.toString());
        }
        artifactNames.add(manifestPath.toString());

        Path reportPath;
        try {
            log.info("Generating EDA report...");
            reportPath = reportBuilder.writeReport(reportsDir, config.inputCsv.toString(), config.returnType.code(),
                    returns, summary, stationarity, levels, facts, plots, artifactNames);
        } catch (IOException e) {
            throw new PipelineException("output", "Failed to write report to " + reportsDir + ": "
                    + e.getMessage(), e);
        }
        timer.end(StepTimer.TOTAL);

        List<String> manifestArtifacts = new ArrayList<>();
        for (Path p : artifacts) {
            manifestArtifacts.add(p.getFileName().toString());
        }
        manifestArtifacts.add(reportPath.getFileName().toString());
        try {
            RunManifestWriter.write(artifactsDir, config, returns.columns(), transformed.droppedNonFiniteRows,
                    diagnostics, manifestArtifacts, plots, timer.snapshot());
        } catch (IOException e) {
            throw new PipelineException("output", "Failed to write run manifest to " + artifactsDir + ": "
                    + e.getMessage(), e);
        }

        if (!diagnostics.failures.isEmpty()) {
            log.warn("{} local test failures recorded; see {}", diagnostics.failures.size(), manifestPath);
        }
        log.info("EDA analysis complete. Artifacts: {} Reports: {}", artifactsDir, reportsDir);
        log.info(timer.summaryText());

        return new RunOutcome(prices.rowCount(), returns.rowCount(), transformed.droppedNonFiniteRows,
                returns.columns(), summary, stationarity, levels, facts, artifacts, plots, reportPath,
                manifestPath, diagnostics, timer.snapshot());
    }
}
