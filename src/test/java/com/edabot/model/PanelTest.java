package com.edabot.model;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PanelTest {

    private static List<LocalDateTime> days(int n) {
        LocalDate start = LocalDate.of(2024, 3, 1);
        LocalDateTime[] out = new LocalDateTime[n];
        for (int i = 0; i < n; i++) {
            out[i] = start.plusDays(i).atStartOfDay();
        }
        return List.of(out);
    }

    @Test
    void constructor_shouldValidateShape() {
        TimeIndex index = TimeIndex.ordinal(2);

        assertThrows(IllegalArgumentException.class,
                () -> new Panel(index, List.of("A", "B"), new double[][]{{1, 2}}));
        assertThrows(IllegalArgumentException.class,
                () -> new Panel(index, List.of("A"), new double[][]{{1, 2, 3}}));
        assertThrows(IllegalArgumentException.class,
                () -> new Panel(index, List.of("A", "A"), new double[][]{{1, 2}, {3, 4}}));
    }

    @Test
    void constructor_shouldCopyValues() {
        double[] source = {1, 2, 3};
        Panel panel = new Panel(TimeIndex.ordinal(3), List.of("A"), new double[][]{source});

        source[0] = 99;
        double[] copy = panel.column("A");
        copy[1] = 99;

        assertArrayEquals(new double[]{1, 2, 3}, panel.column(0), 0.0);
    }

    @Test
    void selectRows_shouldCarryTimestampsAndValues() {
        Panel panel = new Panel(TimeIndex.temporal("Date", days(4)), List.of("A", "B"),
                new double[][]{{1, 2, 3, 4}, {10, Double.NaN, 30, 40}});

        Panel selected = panel.selectRows(new int[]{0, 2, 3});

        assertEquals(3, selected.rowCount());
        assertEquals(days(4).get(2), selected.index().timestamp(1));
        assertArrayEquals(new double[]{10, 30, 40}, selected.column("B"), 0.0);
        assertEquals("Date", selected.index().name());
        assertEquals(1, panel.missingCount());
        assertTrue(panel.rowHasMissing(1));
        assertFalse(selected.rowHasMissing(1));
    }

    @Test
    void temporal_shouldRejectNonIncreasingTimestamps() {
        List<LocalDateTime> stamps = List.of(days(2).get(1), days(2).get(0));

        assertThrows(IllegalArgumentException.class, () -> TimeIndex.temporal("Date", stamps));
    }

    @Test
    void ordinal_shouldHaveNoTimestamps() {
        TimeIndex index = TimeIndex.ordinal(3);

        assertFalse(index.isTemporal());
        assertEquals("2", index.label(2));
        assertThrows(IllegalStateException.class, () -> index.timestamp(0));
        assertEquals(2, index.select(new int[]{0, 2}).size());
    }
}
