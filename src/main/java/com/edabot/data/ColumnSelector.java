package com.edabot.data;

import com.edabot.config.ConfigurationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Picks the price series out of a raw table.
 *
 * <p>With an include list, exactly those columns are used (minus the exclude
 * list). Without one, every numeric column is used unless its lowercased name
 * contains one of {@code date}, {@code time}, {@code index} or {@code id}.
 * Matching is by substring, so a column such as {@code MIDCAP} is also
 * treated as an identifier.
 */
public final class ColumnSelector {
    private static final Logger log = LogManager.getLogger(ColumnSelector.class);

    static final List<String> TEMPORAL_PATTERNS = List.of("date", "time");
    static final List<String> NON_PRICE_PATTERNS = List.of("date", "time", "index", "id");

    private ColumnSelector() {
    }

    public static List<String> select(CsvTable table, int indexColumn, List<String> include, List<String> exclude) {
        List<String> header = table.header();
        List<String> selected = new ArrayList<>();

        if (include != null && !include.isEmpty()) {
            List<String> unknown = new ArrayList<>();
            for (String name : include) {
                int c = table.columnIndex(name);
                if (c < 0 || c == indexColumn) {
                    unknown.add(name);
                } else {
                    selected.add(name);
                }
            }
            if (!unknown.isEmpty()) {
                throw new ConfigurationException("columns",
                        "price_columns_include names columns that are not price columns in the input: " + unknown);
            }
        } else {
            for (int c = 0; c < header.size(); c++) {
                String name = header.get(c);
                if (c == indexColumn || looksNonPrice(name)) {
                    continue;
                }
                if (table.isNumericColumn(c)) {
                    selected.add(name);
                } else {
                    log.debug("Skipping non-numeric column '{}'", name);
                }
            }
        }

        if (exclude != null && !exclude.isEmpty()) {
            selected.removeIf(exclude::contains);
        }
        if (selected.isEmpty()) {
            throw new ConfigurationException("columns", "No price columns found!");
        }
        if (include != null && !include.isEmpty()) {
            for (String name : selected) {
                if (!table.isNumericColumn(table.columnIndex(name))) {
                    throw new DataException("Included price column '" + name + "' is not numeric");
                }
            }
        }
        return selected;
    }

    static boolean looksTemporal(String name) {
        return containsAny(name, TEMPORAL_PATTERNS);
    }

    static boolean looksNonPrice(String name) {
        return containsAny(name, NON_PRICE_PATTERNS);
    }

    private static boolean containsAny(String name, List<String> patterns) {
        String lower = name == null ? "" : name.toLowerCase(Locale.ROOT);
        for (String pattern : patterns) {
            if (lower.contains(pattern)) {
                return true;
            }
        }
        return false;
    }
}
