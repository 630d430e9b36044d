package com.edabot.data;

import com.edabot.config.ConfigLoader;
import com.edabot.config.ConfigurationException;
import com.edabot.config.EdaConfig;
import com.edabot.core.diagnostics.RunDiagnostics;
import com.edabot.model.Panel;
import com.edabot.support.PriceFixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PanelLoaderTest {

    private static final String UNSORTED = "Date,A,B\n"
            + "2024-01-03,3,30\n"
            + "2024-01-02,2,20\n"
            + "2024-01-03,4,40\n"
            + "2024-01-04,NA,50\n"
            + "2024-01-05,5,60\n";

    @TempDir
    Path dir;

    private EdaConfig config(String csvName, Map<String, Object> overrides) {
        Map<String, Object> raw = PriceFixtures.configMap(csvName);
        raw.putAll(overrides);
        return ConfigLoader.fromMap(dir, raw);
    }

    @Test
    void load_shouldSortKeepLastDuplicateAndDropMissingRows() throws Exception {
        PriceFixtures.write(dir, "prices.csv", UNSORTED);
        RunDiagnostics diagnostics = new RunDiagnostics();

        Panel panel = new PanelLoader().load(config("prices.csv", Map.of()), diagnostics);

        assertEquals(3, panel.rowCount());
        assertEquals(LocalDateTime.of(2024, 1, 2, 0, 0), panel.index().timestamp(0));
        assertEquals(LocalDateTime.of(2024, 1, 5, 0, 0), panel.index().timestamp(2));
        assertArrayEquals(new double[]{2, 4, 5}, panel.column("A"), 0.0);
        assertArrayEquals(new double[]{20, 40, 60}, panel.column("B"), 0.0);
        assertEquals(5, diagnostics.stageCounts.get(PanelLoader.ROWS_READ));
        assertEquals(3, diagnostics.stageCounts.get(PanelLoader.ROWS_AFTER_DROPNA));
    }

    @Test
    void load_shouldKeepMissingValuesWhenDropNaIsOff() throws Exception {
        PriceFixtures.write(dir, "prices.csv", UNSORTED);

        Panel panel = new PanelLoader().load(config("prices.csv", Map.of("dropna", false)));

        assertEquals(4, panel.rowCount());
        assertEquals(1, panel.missingCount());
        assertTrue(panel.rowHasMissing(2));
    }

    @Test
    void load_shouldFailWhenDropNaRemovesEverything() throws Exception {
        PriceFixtures.write(dir, "prices.csv", "Date,A,B\n2024-01-02,1,NA\n2024-01-03,NA,2\n");

        DataException e = assertThrows(DataException.class,
                () -> new PanelLoader().load(config("prices.csv", Map.of())));

        assertTrue(e.getMessage().contains("No data remaining"));
    }

    @Test
    void load_shouldResampleWhenConfigured() throws Exception {
        PriceFixtures.write(dir, "prices.csv", "Date,A\n"
                + "2024-01-30,1\n2024-01-31,2\n2024-02-01,3\n2024-02-29,4\n");

        Panel panel = new PanelLoader().load(config("prices.csv", Map.of("resample", "M")));

        assertEquals(2, panel.rowCount());
        assertArrayEquals(new double[]{2, 4}, panel.column("A"), 0.0);
    }

    @Test
    void load_shouldUseOrdinalIndexWithoutDateColumn() throws Exception {
        PriceFixtures.write(dir, "prices.csv", "A,B\n1,2\n3,4\n");

        Panel panel = new PanelLoader().load(config("prices.csv", Map.of("parse_dates", false)));

        assertFalse(panel.index().isTemporal());
        assertEquals(2, panel.rowCount());
    }

    @Test
    void load_shouldRejectTableWithOnlyDateAndIdColumns() throws Exception {
        PriceFixtures.write(dir, "prices.csv", "date,id\n2024-01-02,1\n2024-01-03,2\n");

        assertThrows(ConfigurationException.class, () -> new PanelLoader().load(config("prices.csv", Map.of())));
    }

    @Test
    void load_shouldReportMissingInputFile() {
        DataException e = assertThrows(DataException.class,
                () -> new PanelLoader().load(config("absent.csv", Map.of())));
        assertEquals("data", e.stage());
    }
}
