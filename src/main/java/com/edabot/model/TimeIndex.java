package com.edabot.model;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Row keys of a {@link Panel}: strictly increasing timestamps, or plain
 * ordinals when no temporal column could be resolved.
 */
public final class TimeIndex {
    private final String name;
    private final List<LocalDateTime> timestamps;
    private final int size;

    private TimeIndex(String name, List<LocalDateTime> timestamps, int size) {
        this.name = name == null ? "" : name;
        this.timestamps = timestamps;
        this.size = size;
    }

    public static TimeIndex temporal(String name, List<LocalDateTime> timestamps) {
        for (int i = 1; i < timestamps.size(); i++) {
            if (!timestamps.get(i).isAfter(timestamps.get(i - 1))) {
                throw new IllegalArgumentException("temporal index must be strictly increasing at row " + i);
            }
        }
        return new TimeIndex(name, List.copyOf(timestamps), timestamps.size());
    }

    public static TimeIndex ordinal(int size) {
        return new TimeIndex("", null, size);
    }

    public boolean isTemporal() {
        return timestamps != null;
    }

    public String name() {
        return name;
    }

    public int size() {
        return size;
    }

    public LocalDateTime timestamp(int row) {
        if (timestamps == null) {
            throw new IllegalStateException("ordinal index has no timestamps");
        }
        return timestamps.get(row);
    }

    public String label(int row) {
        return timestamps == null ? String.valueOf(row) : timestamps.get(row).toString();
    }

    /**
     * Index restricted to the given rows, in the given order.
     */
    public TimeIndex select(int[] rows) {
        if (timestamps == null) {
            return ordinal(rows.length);
        }
        List<LocalDateTime> kept = new ArrayList<>(rows.length);
        for (int row : rows) {
            kept.add(timestamps.get(row));
        }
        return new TimeIndex(name, List.copyOf(kept), kept.size());
    }
}
