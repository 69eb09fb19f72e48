package com.netmeasure.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable configuration of a single run, built once and handed to every worker at spawn time.
 */
@Value
@Builder(toBuilder = true)
public class RunSettings {
    String name;
    String title;
    String note;
    @Singular
    List<String> hosts;
    @Builder.Default
    Instant time = Instant.now();
    @Builder.Default
    double length = 60.0;
    Double totalLength;
    @Builder.Default
    double stepSize = 0.2;
    @Builder.Default
    int iterations = 1;
    @Builder.Default
    String aggregator = "timeseries";
    String toolVersion;
    String dataFilename;

    public String getHost() {
        return hosts.isEmpty() ? null : hosts.get(0);
    }

    /**
     * Returns the settings that are recorded into a result set's metadata.
     *
     * @return ordered metadata map
     */
    public Map<String, Object> toRecordedMetadata() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("NAME", name);
        out.put("TITLE", title);
        out.put("NOTE", note);
        out.put("HOST", getHost());
        out.put("HOSTS", List.copyOf(hosts));
        out.put("TIME", time);
        out.put("LENGTH", length);
        out.put("TOTAL_LENGTH", totalLength);
        out.put("STEP_SIZE", stepSize);
        out.put("ITERATIONS", iterations);
        out.put("TOOL_VERSION", toolVersion);
        out.put("DATA_FILENAME", dataFilename);
        return out;
    }

    /**
     * Values that may be referenced as {@code ${key}} in worker commands.
     *
     * @return placeholder values
     */
    public Map<String, String> placeholders() {
        Map<String, String> out = new LinkedHashMap<>();
        out.put("host", getHost() != null ? getHost() : "localhost");
        out.put("length", formatNumber(length));
        out.put("step_size", formatNumber(stepSize));
        out.put("interval", formatNumber(stepSize));
        out.put("iterations", Integer.toString(iterations));
        for (int i = 0; i < hosts.size(); i++) {
            out.put("host" + i, hosts.get(i));
        }
        return out;
    }

    private static String formatNumber(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }
}
