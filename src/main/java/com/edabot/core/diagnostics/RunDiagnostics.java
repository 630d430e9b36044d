package com.edabot.core.diagnostics;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects what happened during one run: row counts per stage, local test
 * failures and free-form notes. Written to the run manifest at the end.
 */
public final class RunDiagnostics {
    public final Map<String, String> configSnapshot = new LinkedHashMap<>();
    public final Map<String, Integer> stageCounts = new LinkedHashMap<>();
    public final List<TestFailure> failures = new ArrayList<>();
    public final List<String> notes = new ArrayList<>();

    public void addConfig(String key, Object value) {
        if (key == null || key.trim().isEmpty()) {
            return;
        }
        configSnapshot.put(key, value == null ? "" : String.valueOf(value));
    }

    public void addStageCount(String key, int count) {
        if (key == null || key.trim().isEmpty()) {
            return;
        }
        stageCounts.put(key, Math.max(0, count));
    }

    public void recordFailure(String series, Outcome<?> outcome) {
        if (outcome == null || outcome.success) {
            return;
        }
        failures.add(new TestFailure(series, outcome.test, outcome.causeCode, outcome.details));
    }

    public void addNote(String note) {
        if (note == null || note.trim().isEmpty()) {
            return;
        }
        notes.add(note.trim());
    }

    public int failureCount(String test) {
        int count = 0;
        for (TestFailure f : failures) {
            if (f.test.equals(test)) {
                count++;
            }
        }
        return count;
    }

    public static final class TestFailure {
        public final String series;
        public final String test;
        public final CauseCode causeCode;
        public final Map<String, Object> details;

        private TestFailure(String series, String test, CauseCode causeCode, Map<String, Object> details) {
            this.series = series == null ? "" : series;
            this.test = test == null ? "" : test;
            this.causeCode = causeCode == null ? CauseCode.NONE : causeCode;
            this.details = details == null ? Map.of() : details;
        }
    }
}
