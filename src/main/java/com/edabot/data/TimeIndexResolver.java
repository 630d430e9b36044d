package com.edabot.data;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Decides which column, if any, becomes the temporal index. Precedence is
 * fixed:
 * <ol>
 *     <li>the configured {@code date_column}, when it names a header column;</li>
 *     <li>the first column whose name contains "date" or "time";</li>
 *     <li>when {@code parse_dates} is on, the first column if all of it parses;</li>
 *     <li>otherwise no column, and the panel keeps an ordinal index.</li>
 * </ol>
 * A column picked by rule 1 or 2 that does not parse is a data error; rule 3
 * falls back to rule 4 with a warning.
 */
public final class TimeIndexResolver {
    private static final Logger log = LogManager.getLogger(TimeIndexResolver.class);

    private static final DateTimeFormatter SPACE_DATE_TIME = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .appendLiteral(' ')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .toFormatter(Locale.ROOT);
    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("uuuu/MM/dd", Locale.ROOT).withResolverStyle(ResolverStyle.STRICT),
            DateTimeFormatter.ofPattern("dd.MM.uuuu", Locale.ROOT).withResolverStyle(ResolverStyle.STRICT),
            DateTimeFormatter.ofPattern("MM/dd/uuuu", Locale.ROOT).withResolverStyle(ResolverStyle.STRICT)
    );

    public enum Source {
        CONFIGURED,
        NAME_PATTERN,
        FIRST_COLUMN,
        NONE
    }

    public static final class Resolution {
        public final int column;
        public final Source source;
        public final List<LocalDateTime> timestamps;

        private Resolution(int column, Source source, List<LocalDateTime> timestamps) {
            this.column = column;
            this.source = source;
            this.timestamps = timestamps;
        }

        public boolean isTemporal() {
            return timestamps != null;
        }
    }

    private TimeIndexResolver() {
    }

    public static Resolution resolve(CsvTable table, String dateColumn, boolean parseDates) {
        List<String> header = table.header();

        if (dateColumn != null && !dateColumn.isEmpty()) {
            int configured = table.columnIndex(dateColumn);
            if (configured >= 0) {
                return new Resolution(configured, Source.CONFIGURED, parseStrict(table, configured));
            }
            log.warn("Configured date_column '{}' is not in the header; inferring the time index", dateColumn);
        }

        for (int c = 0; c < header.size(); c++) {
            if (ColumnSelector.looksTemporal(header.get(c))) {
                return new Resolution(c, Source.NAME_PATTERN, parseStrict(table, c));
            }
        }

        if (parseDates && !header.isEmpty()) {
            List<LocalDateTime> parsed = tryParse(table, 0);
            if (parsed != null) {
                return new Resolution(0, Source.FIRST_COLUMN, parsed);
            }
            log.warn("Could not parse dates automatically from column '{}'. Using an ordinal index.", header.get(0));
            return new Resolution(-1, Source.NONE, null);
        }

        log.warn("No date column resolved. Using an ordinal index.");
        return new Resolution(-1, Source.NONE, null);
    }

    private static List<LocalDateTime> parseStrict(CsvTable table, int column) {
        List<LocalDateTime> out = new ArrayList<>(table.rowCount());
        for (int r = 0; r < table.rowCount(); r++) {
            String cell = table.cell(r, column);
            LocalDateTime ts = parseTimestamp(cell);
            if (ts == null) {
                throw new DataException("Cannot parse '" + cell + "' in date column '"
                        + table.header().get(column) + "' at data row " + (r + 1));
            }
            out.add(ts);
        }
        return out;
    }

    private static List<LocalDateTime> tryParse(CsvTable table, int column) {
        List<LocalDateTime> out = new ArrayList<>(table.rowCount());
        for (int r = 0; r < table.rowCount(); r++) {
            LocalDateTime ts = parseTimestamp(table.cell(r, column));
            if (ts == null) {
                return null;
            }
            out.add(ts);
        }
        return out;
    }

    static LocalDateTime parseTimestamp(String raw) {
        if (raw == null || CsvTable.isMissing(raw)) {
            return null;
        }
        String text = raw.trim();
        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                return LocalDate.parse(text, format).atStartOfDay();
            } catch (DateTimeParseException ignored) {
                // try the next layout
            }
        }
        try {
            return LocalDateTime.parse(text, DateTimeFormatter.ISO_LOCAL_DATE_TIME);
        } catch (DateTimeParseException ignored) {
            // not ISO with 'T'
        }
        try {
            return LocalDateTime.parse(text, SPACE_DATE_TIME);
        } catch (DateTimeParseException ignored) {
            // not ISO with a space
        }
        try {
            return OffsetDateTime.parse(text, DateTimeFormatter.ISO_OFFSET_DATE_TIME)
                    .withOffsetSameInstant(ZoneOffset.UTC)
                    .toLocalDateTime();
        } catch (DateTimeParseException ignored) {
            return null;
        }
    }
}
