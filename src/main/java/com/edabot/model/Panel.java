package com.edabot.model;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable table of named numeric series sharing one {@link TimeIndex}.
 * Used for both price and return panels. Missing values are {@code NaN}.
 */
public final class Panel {
    private final TimeIndex index;
    private final List<String> columns;
    private final double[][] values;

    public Panel(TimeIndex index, List<String> columns, double[][] values) {
        if (index == null || columns == null || values == null) {
            throw new IllegalArgumentException("index, columns and values are required");
        }
        if (columns.size() != values.length) {
            throw new IllegalArgumentException("column count " + columns.size() + " != value arrays " + values.length);
        }
        Set<String> seen = new HashSet<>();
        for (String column : columns) {
            if (!seen.add(column)) {
                throw new IllegalArgumentException("duplicate column name: " + column);
            }
        }
        double[][] copy = new double[values.length][];
        for (int c = 0; c < values.length; c++) {
            if (values[c].length != index.size()) {
                throw new IllegalArgumentException("column " + columns.get(c) + " has " + values[c].length
                        + " rows, index has " + index.size());
            }
            copy[c] = values[c].clone();
        }
        this.index = index;
        this.columns = List.copyOf(columns);
        this.values = copy;
    }

    public TimeIndex index() {
        return index;
    }

    public List<String> columns() {
        return columns;
    }

    public int rowCount() {
        return index.size();
    }

    public int columnCount() {
        return columns.size();
    }

    public boolean isEmpty() {
        return rowCount() == 0 || columnCount() == 0;
    }

    /**
     * Copy of one series; callers may modify the returned array.
     */
    public double[] column(int c) {
        return values[c].clone();
    }

    public double[] column(String name) {
        int c = columns.indexOf(name);
        if (c < 0) {
            throw new IllegalArgumentException("unknown column: " + name);
        }
        return column(c);
    }

    public double value(int c, int row) {
        return values[c][row];
    }

    public boolean rowHasMissing(int row) {
        for (double[] column : values) {
            if (Double.isNaN(column[row])) {
                return true;
            }
        }
        return false;
    }

    public int missingCount() {
        int count = 0;
        for (double[] column : values) {
            for (double v : column) {
                if (Double.isNaN(v)) {
                    count++;
                }
            }
        }
        return count;
    }

    public Panel selectRows(int[] rows) {
        double[][] out = new double[values.length][rows.length];
        for (int c = 0; c < values.length; c++) {
            for (int i = 0; i < rows.length; i++) {
                out[c][i] = values[c][rows[i]];
            }
        }
        return new Panel(index.select(rows), columns, out);
    }

    @Override
    public String toString() {
        return "Panel{rows=" + rowCount() + ", columns=" + columns + "}";
    }
}
