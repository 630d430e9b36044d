package com.edabot.data;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Raw delimited table: a header row plus string cells. Quoted fields follow
 * RFC 4180 (double quotes, doubled quote as escape); quoted fields may not
 * span lines.
 */
public final class CsvTable {
    private static final Set<String> MISSING_TOKENS = Set.of(
            "", "na", "n/a", "nan", "-nan", "null", "none", "#n/a", "#na", "<na>", "#n/a n/a"
    );

    private final List<String> header;
    private final List<String[]> rows;

    CsvTable(List<String> header, List<String[]> rows) {
        this.header = List.copyOf(header);
        this.rows = rows;
    }

    public static CsvTable read(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new DataException("Data file not found: " + path);
        }
        List<String> lines;
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            lines = new ArrayList<>();
            String line;
            while ((line = reader.readLine()) != null) {
                lines.add(line);
            }
        } catch (IOException e) {
            throw new DataException("Failed to load data from " + path + ": " + e.getMessage(), e);
        }
        return parse(lines, path.toString());
    }

    static CsvTable parse(List<String> lines, String source) {
        int first = 0;
        while (first < lines.size() && lines.get(first).trim().isEmpty()) {
            first++;
        }
        if (first >= lines.size()) {
            throw new DataException("No header row in " + source);
        }
        String headerLine = lines.get(first);
        if (headerLine.startsWith("\uFEFF")) {
            headerLine = headerLine.substring(1);
        }
        List<String> header = dedupe(splitLine(headerLine, first + 1, source));

        List<String[]> rows = new ArrayList<>(Math.max(16, lines.size() - first));
        for (int i = first + 1; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.trim().isEmpty()) {
                continue;
            }
            List<String> cells = splitLine(line, i + 1, source);
            if (cells.size() > header.size()) {
                throw new DataException("Line " + (i + 1) + " of " + source + " has " + cells.size()
                        + " fields, header has " + header.size());
            }
            String[] row = new String[header.size()];
            for (int c = 0; c < row.length; c++) {
                row[c] = c < cells.size() ? cells.get(c) : "";
            }
            rows.add(row);
        }
        return new CsvTable(header, rows);
    }

    public List<String> header() {
        return header;
    }

    public int rowCount() {
        return rows.size();
    }

    public int columnIndex(String name) {
        return header.indexOf(name);
    }

    public String cell(int row, int column) {
        return rows.get(row)[column];
    }

    public boolean isNumericColumn(int column) {
        for (String[] row : rows) {
            String cell = row[column];
            if (isMissing(cell)) {
                continue;
            }
            try {
                Double.parseDouble(cell);
            } catch (NumberFormatException e) {
                return false;
            }
        }
        return true;
    }

    public double[] numericColumn(int column) {
        double[] out = new double[rows.size()];
        for (int r = 0; r < rows.size(); r++) {
            String cell = rows.get(r)[column];
            if (isMissing(cell)) {
                out[r] = Double.NaN;
                continue;
            }
            try {
                out[r] = Double.parseDouble(cell);
            } catch (NumberFormatException e) {
                throw new DataException("Column '" + header.get(column) + "' is not numeric: '" + cell
                        + "' at data row " + (r + 1));
            }
        }
        return out;
    }

    static boolean isMissing(String cell) {
        return cell == null || MISSING_TOKENS.contains(cell.trim().toLowerCase(Locale.ROOT));
    }

    static List<String> splitLine(String line, int lineNo, String source) {
        List<String> cells = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        boolean wasQuoted = false;
        for (int i = 0; i < line.length(); i++) {
            char ch = line.charAt(i);
            if (quoted) {
                if (ch == '"') {
                    if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                        current.append('"');
                        i++;
                    } else {
                        quoted = false;
                    }
                } else {
                    current.append(ch);
                }
            } else if (ch == '"') {
                quoted = true;
                wasQuoted = true;
            } else if (ch == ',') {
                cells.add(wasQuoted ? current.toString() : current.toString().trim());
                current.setLength(0);
                wasQuoted = false;
            } else {
                current.append(ch);
            }
        }
        if (quoted) {
            throw new DataException("Unterminated quoted field on line " + lineNo + " of " + source);
        }
        cells.add(wasQuoted ? current.toString() : current.toString().trim());
        return cells;
    }

    // Repeated header names get ".1", ".2" suffixes so every column stays addressable.
    private static List<String> dedupe(List<String> raw) {
        List<String> out = new ArrayList<>(raw.size());
        Map<String, Integer> seen = new HashMap<>();
        for (String name : raw) {
            String candidate = name;
            int n = seen.getOrDefault(name, 0);
            while (n > 0 && (out.contains(candidate) || raw.contains(candidate))) {
                candidate = name + "." + n;
                n++;
            }
            if (n == 0) {
                n = 1;
            }
            seen.put(name, n);
            out.add(candidate);
        }
        return out;
    }
}
