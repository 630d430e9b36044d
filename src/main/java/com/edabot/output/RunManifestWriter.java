package com.edabot.output;

import com.edabot.config.EdaConfig;
import com.edabot.core.diagnostics.RunDiagnostics;
import org.json.JSONArray;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Machine-readable record of a run: inputs, row counts per stage, local test
 * failures, written files and stage timings.
 */
public final class RunManifestWriter {
    public static final String MANIFEST_FILE = "run_manifest.json";

    private RunManifestWriter() {
    }

    public static Path write(
            Path artifactsDir,
            EdaConfig config,
            List<String> columns,
            int droppedNonFiniteRows,
            RunDiagnostics diagnostics,
            List<String> artifacts,
            List<String> plots,
            Map<String, Long> timings
    ) throws IOException {
        Files.createDirectories(artifactsDir);
        Path out = artifactsDir.resolve(MANIFEST_FILE);
        JSONObject root = build(config, columns, droppedNonFiniteRows, diagnostics, artifacts, plots, timings);
        Files.writeString(out, root.toString(2), StandardCharsets.UTF_8);
        return out;
    }

    static JSONObject build(
            EdaConfig config,
            List<String> columns,
            int droppedNonFiniteRows,
            RunDiagnostics diagnostics,
            List<String> artifacts,
            List<String> plots,
            Map<String, Long> timings
    ) {
        JSONObject root = new JSONObject();
        root.put("source", config.inputCsv.toString());
        root.put("return_type", config.returnType.code());
        root.put("resample", config.resample == null ? JSONObject.NULL : config.resample.code);
        root.put("seed", config.seed);
        root.put("columns", new JSONArray(columns));

        JSONObject counts = new JSONObject();
        diagnostics.stageCounts.forEach(counts::put);
        root.put("row_counts", counts);
        root.put("dropped_non_finite_rows", droppedNonFiniteRows);

        JSONArray failures = new JSONArray();
        for (RunDiagnostics.TestFailure f : diagnostics.failures) {
            JSONObject item = new JSONObject();
            item.put("series", f.series);
            item.put("test", f.test);
            item.put("cause", f.causeCode.name());
            item.put("details", details(f.details));
            failures.put(item);
        }
        root.put("test_failures", failures);
        root.put("notes", new JSONArray(diagnostics.notes));
        root.put("artifacts", new JSONArray(artifacts));
        root.put("plots", new JSONArray(plots));

        JSONObject timing = new JSONObject();
        if (timings != null) {
            timings.forEach(timing::put);
        }
        root.put("timings_ms", timing);
        return root;
    }

    // JSON has no NaN or infinity literals
    private static JSONObject details(Map<String, Object> details) {
        JSONObject out = new JSONObject();
        for (Map.Entry<String, Object> e : details.entrySet()) {
            Object v = e.getValue();
            if (v instanceof Double && !Double.isFinite((Double) v)) {
                out.put(e.getKey(), String.valueOf(v));
            } else {
                out.put(e.getKey(), v);
            }
        }
        return out;
    }
}
