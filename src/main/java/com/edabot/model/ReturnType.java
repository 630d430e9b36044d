package com.edabot.model;

import java.util.Locale;

public enum ReturnType {
    LOG,
    SIMPLE;

    public static ReturnType parse(String raw) {
        String value = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        switch (value) {
            case "log":
                return LOG;
            case "simple":
                return SIMPLE;
            default:
                throw new IllegalArgumentException("return_type must be one of {log, simple}, got '" + raw + "'");
        }
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
