package com.edabot.data;

import com.edabot.model.Panel;
import com.edabot.model.ReturnType;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a price panel into a return panel one row shorter. Rows holding any
 * non-finite return are dropped and counted.
 */
public final class ReturnTransform {
    private static final Logger log = LogManager.getLogger(ReturnTransform.class);

    public static final class Result {
        public final Panel returns;
        public final int droppedNonFiniteRows;

        Result(Panel returns, int droppedNonFiniteRows) {
            this.returns = returns;
            this.droppedNonFiniteRows = droppedNonFiniteRows;
        }
    }

    private ReturnTransform() {
    }

    public static Result apply(Panel prices, ReturnType type) {
        if (prices.rowCount() < 2) {
            throw new DataException("returns", "At least two price rows are needed to compute returns, got "
                    + prices.rowCount());
        }
        int columns = prices.columnCount();
        int n = prices.rowCount() - 1;
        double[][] raw = new double[columns][n];
        for (int c = 0; c < columns; c++) {
            for (int t = 1; t <= n; t++) {
                raw[c][t - 1] = compute(prices.value(c, t - 1), prices.value(c, t), type);
            }
        }

        List<Integer> kept = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            boolean finite = true;
            for (int c = 0; c < columns && finite; c++) {
                finite = Double.isFinite(raw[c][i]);
            }
            if (finite) {
                kept.add(i);
            }
        }
        int dropped = n - kept.size();
        if (dropped > 0) {
            log.warn("Dropped {} return rows with non-finite values", dropped);
        }
        if (kept.isEmpty()) {
            throw new DataException("returns", "No finite returns remain after the " + type.code() + " transform");
        }

        // row i of the returns belongs to price row i + 1
        int[] priceRows = new int[kept.size()];
        double[][] values = new double[columns][kept.size()];
        for (int k = 0; k < kept.size(); k++) {
            int i = kept.get(k);
            priceRows[k] = i + 1;
            for (int c = 0; c < columns; c++) {
                values[c][k] = raw[c][i];
            }
        }
        Panel returns = new Panel(prices.index().select(priceRows), prices.columns(), values);
        log.info("Computed {} returns: ({}, {})", type.code(), returns.rowCount(), returns.columnCount());
        return new Result(returns, dropped);
    }

    static double compute(double previous, double current, ReturnType type) {
        if (type == ReturnType.LOG) {
            return Math.log(current / previous);
        }
        return (current - previous) / previous;
    }
}
