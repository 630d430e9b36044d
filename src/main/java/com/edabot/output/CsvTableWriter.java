package com.edabot.output;

import com.edabot.model.StationarityRow;
import com.edabot.model.StylizedFactsRow;
import com.edabot.model.SummaryRow;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes the result tables as comma-separated files. Doubles use their
 * shortest round-trip text, {@code NaN} becomes an empty cell, and the output
 * depends only on the rows given.
 */
public final class CsvTableWriter {
    public static final String SUMMARY_FILE = "summary_stats.csv";
    public static final String STATIONARITY_FILE = "stationarity.csv";
    public static final String STATIONARITY_LEVELS_FILE = "stationarity_levels.csv";
    public static final String STYLIZED_FACTS_FILE = "stylized_facts.csv";

    static final List<String> SUMMARY_HEADER = List.of(
            "Series", "Mean", "Std", "Skewness", "Excess_Kurtosis", "JB_Statistic", "JB_p_value",
            "Min", "Max", "Q25", "Q75", "Observations");
    static final List<String> STATIONARITY_HEADER = List.of(
            "Series", "ADF_Statistic", "ADF_p_value", "ADF_Result", "KPSS_Statistic", "KPSS_p_value", "KPSS_Result");
    static final List<String> STYLIZED_FACTS_HEADER = List.of(
            "Series", "Ljung_Box_Stat", "Ljung_Box_p_value", "ARCH_LM_Stat", "ARCH_LM_p_value",
            "Hill_Tail_Index", "Excess_Kurtosis");

    private CsvTableWriter() {
    }

    public static Path writeSummary(Path dir, List<SummaryRow> rows) throws IOException {
        List<List<String>> cells = new ArrayList<>(rows.size());
        for (SummaryRow r : rows) {
            cells.add(List.of(r.series, num(r.mean), num(r.std), num(r.skewness), num(r.excessKurtosis),
                    num(r.jbStatistic), num(r.jbPValue), num(r.min), num(r.max), num(r.q25), num(r.q75),
                    Integer.toString(r.observations)));
        }
        return write(dir.resolve(SUMMARY_FILE), SUMMARY_HEADER, cells);
    }

    public static Path writeStationarity(Path file, List<StationarityRow> rows) throws IOException {
        List<List<String>> cells = new ArrayList<>(rows.size());
        for (StationarityRow r : rows) {
            cells.add(List.of(r.series, num(r.adfStatistic()), num(r.adfPValue()), r.adfVerdict.label(),
                    num(r.kpssStatistic()), num(r.kpssPValue()), r.kpssVerdict.label()));
        }
        return write(file, STATIONARITY_HEADER, cells);
    }

    public static Path writeStylizedFacts(Path dir, List<StylizedFactsRow> rows) throws IOException {
        List<List<String>> cells = new ArrayList<>(rows.size());
        for (StylizedFactsRow r : rows) {
            cells.add(List.of(r.series, num(r.ljungBoxStatistic()), num(r.ljungBoxPValue()),
                    num(r.archLmStatistic()), num(r.archLmPValue()), num(r.hill()), num(r.excessKurtosis)));
        }
        return write(dir.resolve(STYLIZED_FACTS_FILE), STYLIZED_FACTS_HEADER, cells);
    }

    static Path write(Path file, List<String> header, List<List<String>> rows) throws IOException {
        Path parent = file.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            writeLine(out, header);
            for (List<String> row : rows) {
                writeLine(out, row);
            }
        }
        return file;
    }

    static String num(double value) {
        if (Double.isNaN(value)) {
            return "";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "inf" : "-inf";
        }
        return Double.toString(value);
    }

    static String quote(String cell) {
        if (cell.indexOf(',') < 0 && cell.indexOf('"') < 0 && cell.indexOf('\n') < 0 && cell.indexOf('\r') < 0) {
            return cell;
        }
        return '"' + cell.replace("\"", "\"\"") + '"';
    }

    private static void writeLine(Writer out, List<String> cells) throws IOException {
        for (int i = 0; i < cells.size(); i++) {
            if (i > 0) {
                out.write(',');
            }
            out.write(quote(cells.get(i)));
        }
        out.write('\n');
    }
}
