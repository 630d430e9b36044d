package com.edabot.config;

import java.util.Locale;

/**
 * Companion plots the report can reference. The key is the name used under
 * {@code plots:} in the YAML configuration.
 */
public enum PlotKind {
    TIMESERIES("timeseries"),
    RETURNS("returns"),
    HEATMAP("heatmap"),
    ACF_PACF("acf_pacf"),
    QQ("qq");

    public final String key;

    PlotKind(String key) {
        this.key = key;
    }

    public static PlotKind fromKey(String key) {
        String normalized = key == null ? "" : key.trim().toLowerCase(Locale.ROOT);
        for (PlotKind kind : values()) {
            if (kind.key.equals(normalized)) {
                return kind;
            }
        }
        return null;
    }
}
