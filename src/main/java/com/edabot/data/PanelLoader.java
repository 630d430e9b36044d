package com.edabot.data;

import com.edabot.config.EdaConfig;
import com.edabot.core.diagnostics.RunDiagnostics;
import com.edabot.model.Panel;
import com.edabot.model.TimeIndex;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Builds the cleaned price panel described by an {@link EdaConfig}: reads the
 * file, resolves the time index and price columns, then applies the
 * missing-data policy and optional resampling.
 */
public final class PanelLoader {
    private static final Logger log = LogManager.getLogger(PanelLoader.class);

    public static final String ROWS_READ = "rows_read";
    public static final String ROWS_AFTER_DROPNA = "rows_after_dropna";
    public static final String ROWS_AFTER_RESAMPLE = "rows_after_resample";
    public static final String PRICE_ROWS = "price_rows";

    public Panel load(EdaConfig config) {
        return load(config, new RunDiagnostics());
    }

    public Panel load(EdaConfig config, RunDiagnostics diagnostics) {
        log.info("Loading data from {}", config.inputCsv);
        CsvTable table = CsvTable.read(config.inputCsv);
        diagnostics.addStageCount(ROWS_READ, table.rowCount());

        TimeIndexResolver.Resolution time = TimeIndexResolver.resolve(table, config.dateColumn, config.parseDates);
        if (time.isTemporal()) {
            log.info("Time index: column '{}' ({})", table.header().get(time.column), time.source);
        } else {
            diagnostics.addNote("ordinal index: no date column could be resolved");
        }

        List<String> columns = ColumnSelector.select(table, time.column, config.includeColumns, config.excludeColumns);
        log.info("Found {} price columns: {}", columns.size(), columns);

        double[][] values = new double[columns.size()][];
        for (int c = 0; c < columns.size(); c++) {
            values[c] = table.numericColumn(table.columnIndex(columns.get(c)));
        }

        Panel panel = orderRows(table, time, columns, values, diagnostics);
        if (panel.rowCount() == 0) {
            throw new DataException("No data found after selecting price columns");
        }

        if (config.dropNa) {
            panel = dropMissingRows(panel);
            log.info("Data shape after dropping NA: ({}, {})", panel.rowCount(), panel.columnCount());
            diagnostics.addStageCount(ROWS_AFTER_DROPNA, panel.rowCount());
            if (panel.rowCount() == 0) {
                throw new DataException("No data remaining after dropping NA values");
            }
        }

        if (config.resample != null) {
            panel = Resampler.lastPerPeriod(panel, config.resample);
            log.info("Resampled to {} frequency: ({}, {})", config.resample, panel.rowCount(), panel.columnCount());
            diagnostics.addStageCount(ROWS_AFTER_RESAMPLE, panel.rowCount());
            if (panel.rowCount() == 0) {
                throw new DataException("No data remaining after resampling to " + config.resample);
            }
        }

        diagnostics.addStageCount(PRICE_ROWS, panel.rowCount());
        return panel;
    }

    public static Panel dropMissingRows(Panel panel) {
        List<Integer> kept = new ArrayList<>(panel.rowCount());
        for (int r = 0; r < panel.rowCount(); r++) {
            if (!panel.rowHasMissing(r)) {
                kept.add(r);
            }
        }
        return panel.selectRows(toArray(kept));
    }

    private static Panel orderRows(
            CsvTable table,
            TimeIndexResolver.Resolution time,
            List<String> columns,
            double[][] values,
            RunDiagnostics diagnostics
    ) {
        int n = table.rowCount();
        if (!time.isTemporal()) {
            return new Panel(TimeIndex.ordinal(n), columns, values);
        }

        List<Integer> order = new ArrayList<>(n);
        for (int r = 0; r < n; r++) {
            order.add(r);
        }
        // stable sort keeps file order among equal timestamps, so "last" below means last in the file
        order.sort(Comparator.comparing(time.timestamps::get));

        List<Integer> kept = new ArrayList<>(n);
        List<LocalDateTime> stamps = new ArrayList<>(n);
        int duplicates = 0;
        for (int row : order) {
            LocalDateTime ts = time.timestamps.get(row);
            if (!stamps.isEmpty() && stamps.get(stamps.size() - 1).equals(ts)) {
                kept.set(kept.size() - 1, row);
                duplicates++;
                continue;
            }
            kept.add(row);
            stamps.add(ts);
        }
        if (duplicates > 0) {
            log.warn("Dropped {} rows with duplicate timestamps (kept the last occurrence)", duplicates);
            diagnostics.addNote("duplicate timestamps dropped: " + duplicates);
        }

        double[][] ordered = new double[values.length][kept.size()];
        for (int c = 0; c < values.length; c++) {
            for (int i = 0; i < kept.size(); i++) {
                ordered[c][i] = values[c][kept.get(i)];
            }
        }
        String indexName = table.header().get(time.column);
        return new Panel(TimeIndex.temporal(indexName, stamps), columns, ordered);
    }

    private static int[] toArray(List<Integer> rows) {
        int[] out = new int[rows.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = rows.get(i);
        }
        return out;
    }
}
