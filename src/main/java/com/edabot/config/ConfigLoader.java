package com.edabot.config;

import com.edabot.model.ResampleRule;
import com.edabot.model.ReturnType;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;
import org.snakeyaml.engine.v2.exceptions.YamlEngineException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Reads the YAML run configuration and binds it into an {@link EdaConfig}.
 * Unknown keys, missing required keys and out-of-range values are rejected
 * here rather than at first use.
 */
public final class ConfigLoader {
    private static final Logger log = LogManager.getLogger(ConfigLoader.class);

    public static final Path DEFAULT_CONFIG_PATH = Path.of("configs", "eda.yaml");

    private static final Set<String> TOP_LEVEL_KEYS = Set.of(
            "input_csv", "date_column", "parse_dates", "dropna",
            "price_columns_include", "price_columns_exclude",
            "resample", "return_type", "plots", "tests", "tails",
            "output_dirs", "seed"
    );
    private static final Set<String> TEST_KEYS = Set.of("adf_alpha", "lb_lags", "arch_lm_lags", "stationarity_on_levels");
    private static final Set<String> TAIL_KEYS = Set.of("hill_threshold_quantile");
    private static final Set<String> OUTPUT_KEYS = Set.of("artifacts", "reports");
    private static final List<String> REQUIRED_KEYS = List.of(
            "input_csv", "date_column", "parse_dates", "dropna",
            "price_columns_include", "price_columns_exclude",
            "resample", "return_type", "plots", "tests", "tails",
            "output_dirs", "seed"
    );
    private static final List<String> REQUIRED_TEST_KEYS = List.of("adf_alpha", "lb_lags", "arch_lm_lags");
    private static final List<String> REQUIRED_OUTPUT_KEYS = List.of("artifacts", "reports");

    private static final LoadSettings LOAD_SETTINGS = LoadSettings.builder().setLabel("edabot config").build();

    private ConfigLoader() {
    }

    public static EdaConfig load(Path configPath, Path workingDir) {
        if (configPath == null || !Files.isRegularFile(configPath)) {
            throw new ConfigurationException("Configuration file not found: " + configPath);
        }
        Object document;
        try (InputStream in = Files.newInputStream(configPath)) {
            document = new Load(LOAD_SETTINGS).loadFromInputStream(in);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read configuration " + configPath + ": " + e.getMessage(), e);
        } catch (YamlEngineException e) {
            throw new ConfigurationException("Invalid YAML in configuration file " + configPath + ": " + e.getMessage(), e);
        }
        if (document == null) {
            throw new ConfigurationException("Configuration file is empty: " + configPath);
        }
        if (!(document instanceof Map<?, ?>)) {
            throw new ConfigurationException("Configuration root must be a mapping: " + configPath);
        }
        EdaConfig config = fromMap(workingDir, (Map<?, ?>) document);
        log.info("Loaded configuration {} (input={}, return_type={})",
                configPath, config.inputCsv, config.returnType.code());
        return config;
    }

    public static EdaConfig fromMap(Path workingDir, Map<?, ?> raw) {
        if (raw == null) {
            throw new ConfigurationException("Configuration is empty");
        }
        Path base = workingDir == null ? Path.of(".").toAbsolutePath().normalize() : workingDir;
        rejectUnknown("", raw, TOP_LEVEL_KEYS);
        requirePresent("", raw, REQUIRED_KEYS);

        Path inputCsv = base.resolve(requireString(raw, "", "input_csv")).normalize();
        String dateColumn = scalarOrEmpty(raw, "date_column");
        boolean parseDates = requireBoolean(raw, "", "parse_dates");
        boolean dropNa = requireBoolean(raw, "", "dropna");
        List<String> include = stringList(raw, "price_columns_include");
        List<String> exclude = stringList(raw, "price_columns_exclude");

        // present but null means no resampling
        ResampleRule resample = null;
        String resampleCode = scalarOrEmpty(raw, "resample");
        if (!resampleCode.isEmpty()) {
            try {
                resample = ResampleRule.parse(resampleCode);
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("resample: " + e.getMessage());
            }
        }

        ReturnType returnType;
        try {
            returnType = ReturnType.parse(requireString(raw, "", "return_type"));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage());
        }

        Map<PlotKind, Boolean> plots = bindPlots(requireMap(raw, "plots"));

        Map<?, ?> tests = requireMap(raw, "tests");
        rejectUnknown("tests.", tests, TEST_KEYS);
        requirePresent("tests.", tests, REQUIRED_TEST_KEYS);
        double adfAlpha = requireDouble(tests, "tests.", "adf_alpha");
        requireOpenUnit("tests.adf_alpha", adfAlpha);
        int lbLags = requireInt(tests, "tests.", "lb_lags");
        requirePositive("tests.lb_lags", lbLags);
        int archLags = requireInt(tests, "tests.", "arch_lm_lags");
        requirePositive("tests.arch_lm_lags", archLags);
        boolean levels = tests.get("stationarity_on_levels") != null
                && toBoolean("tests.stationarity_on_levels", tests.get("stationarity_on_levels"));

        Map<?, ?> tails = requireMap(raw, "tails");
        rejectUnknown("tails.", tails, TAIL_KEYS);
        requirePresent("tails.", tails, TAIL_KEYS);
        double hillQuantile = requireDouble(tails, "tails.", "hill_threshold_quantile");
        requireOpenUnit("tails.hill_threshold_quantile", hillQuantile);

        Map<?, ?> outputs = requireMap(raw, "output_dirs");
        rejectUnknown("output_dirs.", outputs, OUTPUT_KEYS);
        requirePresent("output_dirs.", outputs, REQUIRED_OUTPUT_KEYS);
        Path artifacts = base.resolve(requireString(outputs, "output_dirs.", "artifacts")).normalize();
        Path reports = base.resolve(requireString(outputs, "output_dirs.", "reports")).normalize();

        long seed = requireLong(raw, "", "seed");

        return new EdaConfig(
                inputCsv,
                dateColumn,
                parseDates,
                dropNa,
                include,
                exclude,
                resample,
                returnType,
                plots,
                new EdaConfig.TestParameters(adfAlpha, lbLags, archLags, levels),
                new EdaConfig.TailParameters(hillQuantile),
                new EdaConfig.OutputDirs(artifacts, reports),
                seed
        );
    }

    private static Map<PlotKind, Boolean> bindPlots(Map<?, ?> raw) {
        Set<String> known = new LinkedHashSet<>();
        for (PlotKind kind : PlotKind.values()) {
            known.add(kind.key);
        }
        rejectUnknown("plots.", raw, known);
        requirePresent("plots.", raw, known);
        Map<PlotKind, Boolean> plots = new EnumMap<>(PlotKind.class);
        for (PlotKind kind : PlotKind.values()) {
            plots.put(kind, requireBoolean(raw, "plots.", kind.key));
        }
        return plots;
    }

    private static void rejectUnknown(String prefix, Map<?, ?> map, Set<String> allowed) {
        if (map == null) {
            return;
        }
        Set<String> unknown = new LinkedHashSet<>();
        for (Object key : map.keySet()) {
            String name = String.valueOf(key);
            if (!allowed.contains(name)) {
                unknown.add(prefix + name);
            }
        }
        if (!unknown.isEmpty()) {
            throw new ConfigurationException("unknown config key(s): " + String.join(", ", unknown));
        }
    }

    private static void requirePresent(String prefix, Map<?, ?> map, Collection<String> required) {
        List<String> missing = new ArrayList<>();
        for (String key : required) {
            if (!map.containsKey(key)) {
                missing.add(prefix + key);
            }
        }
        if (!missing.isEmpty()) {
            throw new ConfigurationException("missing required config: " + String.join(", ", missing));
        }
    }

    private static Object requireValue(Map<?, ?> map, String prefix, String key) {
        Object value = map.get(key);
        if (value == null) {
            throw new ConfigurationException("missing required config: " + prefix + key);
        }
        return value;
    }

    private static String requireString(Map<?, ?> map, String prefix, String key) {
        Object value = requireValue(map, prefix, key);
        if (value instanceof Map<?, ?> || value instanceof List<?>) {
            throw new ConfigurationException(prefix + key + " must be a scalar value");
        }
        String text = String.valueOf(value).trim();
        if (text.isEmpty()) {
            throw new ConfigurationException("missing required config: " + prefix + key);
        }
        return text;
    }

    private static String scalarOrEmpty(Map<?, ?> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return "";
        }
        if (value instanceof Map<?, ?> || value instanceof List<?>) {
            throw new ConfigurationException(key + " must be a scalar value");
        }
        return String.valueOf(value).trim();
    }

    private static Map<?, ?> requireMap(Map<?, ?> map, String key) {
        Object value = requireValue(map, "", key);
        if (!(value instanceof Map<?, ?>)) {
            throw new ConfigurationException(key + " must be a mapping");
        }
        return (Map<?, ?>) value;
    }

    private static boolean requireBoolean(Map<?, ?> map, String prefix, String key) {
        return toBoolean(prefix + key, requireValue(map, prefix, key));
    }

    private static boolean toBoolean(String key, Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        String text = String.valueOf(value).trim().toLowerCase(Locale.ROOT);
        switch (text) {
            case "true":
            case "yes":
            case "on":
            case "1":
                return true;
            case "false":
            case "no":
            case "off":
            case "0":
                return false;
            default:
                throw new ConfigurationException(key + " must be a boolean, got '" + value + "'");
        }
    }

    // An explicit null is an empty list; the key itself must still be present.
    private static List<String> stringList(Map<?, ?> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?>)) {
            throw new ConfigurationException(key + " must be a list of column names");
        }
        List<String> out = new ArrayList<>();
        for (Object item : (List<?>) value) {
            if (item == null) {
                continue;
            }
            String name = String.valueOf(item).trim();
            if (!name.isEmpty() && !out.contains(name)) {
                out.add(name);
            }
        }
        return out;
    }

    private static double requireDouble(Map<?, ?> map, String prefix, String key) {
        Object value = requireValue(map, prefix, key);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        try {
            return Double.parseDouble(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(prefix + key + " must be a number, got '" + value + "'");
        }
    }

    private static int requireInt(Map<?, ?> map, String prefix, String key) {
        long value = requireLong(map, prefix, key);
        if (value > Integer.MAX_VALUE || value < Integer.MIN_VALUE) {
            throw new ConfigurationException(prefix + key + " is out of range: " + value);
        }
        return (int) value;
    }

    private static long requireLong(Map<?, ?> map, String prefix, String key) {
        Object value = requireValue(map, prefix, key);
        if (value instanceof Integer || value instanceof Long) {
            return ((Number) value).longValue();
        }
        try {
            return Long.parseLong(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(prefix + key + " must be an integer, got '" + value + "'");
        }
    }

    private static void requireOpenUnit(String key, double value) {
        if (!(value > 0.0 && value < 1.0)) {
            throw new ConfigurationException(key + " must lie strictly between 0 and 1, got " + value);
        }
    }

    private static void requirePositive(String key, int value) {
        if (value < 1) {
            throw new ConfigurationException(key + " must be at least 1, got " + value);
        }
    }
}
