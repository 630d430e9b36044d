package com.edabot.model;

public enum Verdict {
    STATIONARY("Stationary"),
    NON_STATIONARY("Non-stationary"),
    ERROR("Error");

    private final String label;

    Verdict(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
