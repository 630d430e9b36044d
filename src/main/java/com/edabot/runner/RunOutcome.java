package com.edabot.runner;

import com.edabot.core.diagnostics.RunDiagnostics;
import com.edabot.model.StationarityRow;
import com.edabot.model.StylizedFactsRow;
import com.edabot.model.SummaryRow;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class RunOutcome {
    public final int priceRows;
    public final int returnRows;
    public final int droppedNonFiniteRows;
    public final List<String> columns;
    public final List<SummaryRow> summary;
    public final List<StationarityRow> stationarity;
    public final List<StationarityRow> levelsStationarity;
    public final List<StylizedFactsRow> stylizedFacts;
    public final List<Path> artifacts;
    public final List<String> plots;
    public final Path reportPath;
    public final Path manifestPath;
    public final RunDiagnostics diagnostics;
    public final Map<String, Long> timings;

    public RunOutcome(
            int priceRows,
            int returnRows,
            int droppedNonFiniteRows,
            List<String> columns,
            List<SummaryRow> summary,
            List<StationarityRow> stationarity,
            List<StationarityRow> levelsStationarity,
            List<StylizedFactsRow> stylizedFacts,
            List<Path> artifacts,
            List<String> plots,
            Path reportPath,
            Path manifestPath,
            RunDiagnostics diagnostics,
            Map<String, Long> timings
    ) {
        this.priceRows = priceRows;
        this.returnRows = returnRows;
        this.droppedNonFiniteRows = droppedNonFiniteRows;
        this.columns = List.copyOf(columns);
        this.summary = List.copyOf(summary);
        this.stationarity = List.copyOf(stationarity);
        this.levelsStationarity = levelsStationarity == null ? List.of() : List.copyOf(levelsStationarity);
        this.stylizedFacts = List.copyOf(stylizedFacts);
        this.artifacts = List.copyOf(artifacts);
        this.plots = List.copyOf(plots);
        this.reportPath = reportPath;
        this.manifestPath = manifestPath;
        this.diagnostics = diagnostics;
        this.timings = timings == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(timings));
    }
}
