package com.edabot.utils;

import java.util.LinkedHashMap;
import java.util.Map;

public class StepTimer {
    public static final String CONFIG = "CONFIG";
    public static final String LOAD = "LOAD";
    public static final String RETURNS = "RETURNS";
    public static final String ANALYZE = "ANALYZE";
    public static final String OUTPUT = "OUTPUT";
    public static final String PLOTS = "PLOTS";
    public static final String TOTAL = "TOTAL";

    private final Map<String, Long> start = new LinkedHashMap<>();
    private final Map<String, Long> durMs = new LinkedHashMap<>();

    public void start(String step) {
        start.put(step, System.currentTimeMillis());
    }

    public void end(String step) {
        Long s = start.get(step);
        if (s != null) {
            durMs.put(step, System.currentTimeMillis() - s);
        }
    }

    public Map<String, Long> snapshot() { return new LinkedHashMap<>(durMs); }

    public String summaryText() {
        StringBuilder sb = new StringBuilder();
        sb.append("Stage timings\n");
        for (Map.Entry<String, Long> e : durMs.entrySet()) {
            sb.append(" - ").append(stepLabel(e.getKey())).append(" = ").append(e.getValue()).append(" ms\n");
        }
        return sb.toString();
    }

    private static String stepLabel(String step) {
        if (step == null) return "";
        switch (step) {
            case TOTAL:
                return "total";
            case CONFIG:
                return "configuration";
            case LOAD:
                return "panel load";
            case RETURNS:
                return "return transform";
            case ANALYZE:
                return "diagnostics";
            case OUTPUT:
                return "artifacts";
            case PLOTS:
                return "plots";
            default:
                return step;
        }
    }
}
