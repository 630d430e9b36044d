package com.edabot.data;

import com.edabot.model.Panel;
import com.edabot.model.ResampleRule;
import com.edabot.model.TimeIndex;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Downsamples a temporal panel: one row per period holding the last
 * non-missing value of each column. Periods where any column has no value
 * are dropped.
 */
public final class Resampler {

    private Resampler() {
    }

    public static Panel lastPerPeriod(Panel panel, ResampleRule rule) {
        if (!panel.index().isTemporal()) {
            throw new DataException("Resampling to '" + rule + "' requires a temporal index");
        }
        int columns = panel.columnCount();
        List<LocalDateTime> labels = new ArrayList<>();
        List<double[]> rows = new ArrayList<>();

        LocalDate currentPeriod = null;
        double[] current = null;
        for (int r = 0; r < panel.rowCount(); r++) {
            LocalDate period = rule.periodEnd(panel.index().timestamp(r).toLocalDate());
            if (!period.equals(currentPeriod)) {
                if (current != null) {
                    flush(labels, rows, currentPeriod, current);
                }
                currentPeriod = period;
                current = new double[columns];
                Arrays.fill(current, Double.NaN);
            }
            for (int c = 0; c < columns; c++) {
                double v = panel.value(c, r);
                if (!Double.isNaN(v)) {
                    current[c] = v;
                }
            }
        }
        if (current != null) {
            flush(labels, rows, currentPeriod, current);
        }

        double[][] values = new double[columns][rows.size()];
        for (int i = 0; i < rows.size(); i++) {
            for (int c = 0; c < columns; c++) {
                values[c][i] = rows.get(i)[c];
            }
        }
        return new Panel(TimeIndex.temporal(panel.index().name(), labels), panel.columns(), values);
    }

    private static void flush(List<LocalDateTime> labels, List<double[]> rows, LocalDate period, double[] row) {
        for (double v : row) {
            if (Double.isNaN(v)) {
                return;
            }
        }
        labels.add(period.atStartOfDay());
        rows.add(row);
    }
}
