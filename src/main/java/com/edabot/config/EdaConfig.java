package com.edabot.config;

import com.edabot.model.ResampleRule;
import com.edabot.model.ReturnType;

import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Validated configuration for one analysis run. Instances come from
 * {@link ConfigLoader}; every field is checked there, so consumers never see
 * a half-populated config.
 */
public final class EdaConfig {
    public final Path inputCsv;
    public final String dateColumn;
    public final boolean parseDates;
    public final boolean dropNa;
    public final List<String> includeColumns;
    public final List<String> excludeColumns;
    public final ResampleRule resample;
    public final ReturnType returnType;
    public final Map<PlotKind, Boolean> plots;
    public final TestParameters tests;
    public final TailParameters tails;
    public final OutputDirs outputDirs;
    public final long seed;

    EdaConfig(
            Path inputCsv,
            String dateColumn,
            boolean parseDates,
            boolean dropNa,
            List<String> includeColumns,
            List<String> excludeColumns,
            ResampleRule resample,
            ReturnType returnType,
            Map<PlotKind, Boolean> plots,
            TestParameters tests,
            TailParameters tails,
            OutputDirs outputDirs,
            long seed
    ) {
        this.inputCsv = inputCsv;
        this.dateColumn = dateColumn == null ? "" : dateColumn;
        this.parseDates = parseDates;
        this.dropNa = dropNa;
        this.includeColumns = List.copyOf(includeColumns);
        this.excludeColumns = List.copyOf(excludeColumns);
        this.resample = resample;
        this.returnType = returnType;
        this.plots = Collections.unmodifiableMap(new EnumMap<>(plots));
        this.tests = tests;
        this.tails = tails;
        this.outputDirs = outputDirs;
        this.seed = seed;
    }

    public boolean plotEnabled(PlotKind kind) {
        return Boolean.TRUE.equals(plots.get(kind));
    }

    public boolean anyPlotEnabled() {
        return plots.containsValue(Boolean.TRUE);
    }

    public static final class TestParameters {
        public final double adfAlpha;
        public final int ljungBoxLags;
        public final int archLmLags;
        public final boolean levelsStationarity;

        public TestParameters(double adfAlpha, int ljungBoxLags, int archLmLags, boolean levelsStationarity) {
            this.adfAlpha = adfAlpha;
            this.ljungBoxLags = ljungBoxLags;
            this.archLmLags = archLmLags;
            this.levelsStationarity = levelsStationarity;
        }
    }

    public static final class TailParameters {
        public final double hillThresholdQuantile;

        public TailParameters(double hillThresholdQuantile) {
            this.hillThresholdQuantile = hillThresholdQuantile;
        }
    }

    public static final class OutputDirs {
        public final Path artifacts;
        public final Path reports;

        public OutputDirs(Path artifacts, Path reports) {
            this.artifacts = artifacts;
            this.reports = reports;
        }
    }
}
