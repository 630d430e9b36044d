package com.edabot.core.diagnostics;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Value of one (series, test) computation, or the typed reason it failed.
 * Details are kept in insertion order; null keys and values are dropped.
 */
public final class Outcome<T> {
    public final boolean success;
    public final T value;
    public final CauseCode causeCode;
    public final String test;
    public final Map<String, Object> details;

    private Outcome(boolean success, T value, CauseCode causeCode, String test, Map<String, Object> details) {
        this.success = success;
        this.value = value;
        this.causeCode = success ? CauseCode.NONE : (causeCode == null ? CauseCode.RUNTIME_ERROR : causeCode);
        this.test = test == null ? "" : test;
        this.details = sanitize(details);
    }

    public static <T> Outcome<T> success(T value, String test) {
        return new Outcome<>(true, value, CauseCode.NONE, test, null);
    }

    public static <T> Outcome<T> success(T value, String test, Map<String, Object> details) {
        return new Outcome<>(true, value, CauseCode.NONE, test, details);
    }

    public static <T> Outcome<T> failure(CauseCode causeCode, String test) {
        return new Outcome<>(false, null, causeCode, test, null);
    }

    public static <T> Outcome<T> failure(CauseCode causeCode, String test, Map<String, Object> details) {
        return new Outcome<>(false, null, causeCode, test, details);
    }

    public T orElse(T fallback) {
        return success ? value : fallback;
    }

    private static Map<String, Object> sanitize(Map<String, Object> in) {
        if (in == null || in.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : in.entrySet()) {
            if (e.getKey() != null && e.getValue() != null) {
                out.put(e.getKey(), e.getValue());
            }
        }
        return Collections.unmodifiableMap(out);
    }

    @Override
    public String toString() {
        return success
                ? test + "=" + value
                : test + " failed: " + causeCode + (details.isEmpty() ? "" : " " + details);
    }
}
