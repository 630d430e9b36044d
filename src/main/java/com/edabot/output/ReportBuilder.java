package com.edabot.output;

import com.edabot.model.Panel;
import com.edabot.model.StationarityRow;
import com.edabot.model.StylizedFactsRow;
import com.edabot.model.SummaryRow;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Assembles the view model for {@code EDA_Report.md} and writes it.
 */
public final class ReportBuilder {
    public static final String REPORT_FILE = "EDA_Report.md";

    private static final DateTimeFormatter DISPLAY_TS = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final ThymeleafReportRenderer renderer;
    private final Clock clock;

    public ReportBuilder() {
        this(Clock.systemDefaultZone());
    }

    public ReportBuilder(Clock clock) {
        this.renderer = new ThymeleafReportRenderer();
        this.clock = clock;
    }

    public Path writeReport(
            Path reportsDir,
            String dataSource,
            String returnType,
            Panel returns,
            List<SummaryRow> summary,
            List<StationarityRow> stationarity,
            List<StationarityRow> levelsStationarity,
            List<StylizedFactsRow> stylizedFacts,
            List<String> plotFiles,
            List<String> artifactFiles
    ) throws IOException {
        Files.createDirectories(reportsDir);
        Path report = reportsDir.resolve(REPORT_FILE);
        String markdown = buildMarkdown(dataSource, returnType, returns, summary, stationarity, levelsStationarity,
                stylizedFacts, plotFiles, artifactFiles);
        Files.writeString(report, markdown, StandardCharsets.UTF_8);
        return report;
    }

    public String buildMarkdown(
            String dataSource,
            String returnType,
            Panel returns,
            List<SummaryRow> summary,
            List<StationarityRow> stationarity,
            List<StationarityRow> levelsStationarity,
            List<StylizedFactsRow> stylizedFacts,
            List<String> plotFiles,
            List<String> artifactFiles
    ) {
        Map<String, Object> view = new HashMap<>();
        view.put("generatedAt", DISPLAY_TS.format(LocalDateTime.now(clock)));
        view.put("dataSource", ReportFormat.text(dataSource));
        view.put("returnType", ReportFormat.text(returnType));
        view.put("seriesCount", summary.size());
        view.put("observations", returns == null ? 0 : returns.rowCount());
        view.put("dateRange", dateRange(returns));

        List<Map<String, String>> summaryRows = new ArrayList<>();
        for (SummaryRow r : summary) {
            summaryRows.add(kv(
                    "series", ReportFormat.text(r.series),
                    "mean", ReportFormat.fixed(r.mean, 6),
                    "std", ReportFormat.fixed(r.std, 6),
                    "skewness", ReportFormat.fixed(r.skewness, 3),
                    "kurtosis", ReportFormat.fixed(r.excessKurtosis, 3),
                    "jbPValue", ReportFormat.fixed(r.jbPValue, 3)
            ));
        }
        view.put("summaryRows", summaryRows);
        view.put("stationarityRows", stationarityRows(stationarity));
        boolean hasLevels = levelsStationarity != null && !levelsStationarity.isEmpty();
        view.put("hasLevels", hasLevels);
        view.put("levelRows", hasLevels ? stationarityRows(levelsStationarity) : List.of());

        List<Map<String, String>> factRows = new ArrayList<>();
        for (StylizedFactsRow r : stylizedFacts) {
            factRows.add(kv(
                    "series", ReportFormat.text(r.series),
                    "ljungBoxPValue", ReportFormat.fixed(r.ljungBoxPValue(), 3),
                    "archLmPValue", ReportFormat.fixed(r.archLmPValue(), 3),
                    "hill", ReportFormat.fixed(r.hill(), 3),
                    "kurtosis", ReportFormat.fixed(r.excessKurtosis, 3)
            ));
        }
        view.put("factRows", factRows);
        view.put("plotFiles", plotFiles == null ? List.of() : plotFiles);
        view.put("artifactFiles", artifactFiles == null ? List.of() : artifactFiles);

        return renderer.renderReport(view);
    }

    private static List<Map<String, String>> stationarityRows(List<StationarityRow> rows) {
        List<Map<String, String>> out = new ArrayList<>();
        for (StationarityRow r : rows) {
            out.add(kv(
                    "series", ReportFormat.text(r.series),
                    "adfStatistic", ReportFormat.fixed(r.adfStatistic(), 3),
                    "adfPValue", ReportFormat.fixed(r.adfPValue(), 3),
                    "adfResult", r.adfVerdict.label(),
                    "kpssStatistic", ReportFormat.fixed(r.kpssStatistic(), 3),
                    "kpssPValue", ReportFormat.fixed(r.kpssPValue(), 3),
                    "kpssResult", r.kpssVerdict.label()
            ));
        }
        return out;
    }

    private static String dateRange(Panel returns) {
        if (returns == null || returns.rowCount() == 0 || !returns.index().isTemporal()) {
            return ReportFormat.NOT_AVAILABLE;
        }
        return returns.index().label(0) + " to " + returns.index().label(returns.rowCount() - 1);
    }

    private static Map<String, String> kv(String... values) {
        Map<String, String> out = new LinkedHashMap<>();
        for (int i = 0; i + 1 < values.length; i += 2) {
            out.put(values[i], values[i + 1]);
        }
        return out;
    }
}
