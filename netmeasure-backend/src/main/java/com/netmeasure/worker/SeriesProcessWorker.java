package com.netmeasure.worker;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Runs a command that prints one timestamped value per line and turns the output into a series.
 *
 * <p>Each line is matched against a pattern with named groups {@code t} (absolute time in seconds)
 * and {@code val}. If the pattern also has a {@code key} group, samples are split by key into a
 * named result.
 */
public class SeriesProcessWorker extends ProcessWorker {

    public static final String DEFAULT_PATTERN = "^\\[?(?<t>-?[0-9.]+)\\]?\\s+(?<val>-?[0-9.eE+-]+)";

    private static final List<String> TRANSFORMED_METADATA = List.of("MEAN_VALUE", "MIN_VALUE", "MAX_VALUE");

    private final Pattern pattern;
    private final boolean keyed;

    public SeriesProcessWorker(WorkerContext context) {
        super(context);
        String p = context.getSpec() != null ? context.getSpec().getPattern() : null;
        String regex = p == null || p.isBlank() ? DEFAULT_PATTERN : p;
        this.pattern = Pattern.compile(regex);
        this.keyed = regex.contains("(?<key>");
    }

    @Override
    public List<String> getTransformedMetadata() {
        return TRANSFORMED_METADATA;
    }

    @Override
    protected WorkerResult parse(String output, String error) {
        Map<String, List<Sample>> byKey = new LinkedHashMap<>();
        List<Map<String, Object>> raw = new ArrayList<>();

        for (String line : output.split("\\R")) {
            Matcher m = pattern.matcher(line);
            if (!m.find()) {
                continue;
            }
            double t;
            double val;
            try {
                t = Double.parseDouble(m.group("t"));
                val = Double.parseDouble(m.group("val"));
            } catch (NumberFormatException e) {
                continue;
            }
            String key = keyed ? m.group("key") : "";
            byKey.computeIfAbsent(key, k -> new ArrayList<>()).add(Sample.of(t, val));

            Map<String, Object> record = new LinkedHashMap<>();
            record.put("t", t);
            record.put("val", val);
            if (keyed) {
                record.put("key", key);
            }
            raw.add(record);
        }

        if (byKey.isEmpty()) {
            return WorkerResult.empty();
        }
        setRawValues(raw);

        if (!keyed) {
            List<Sample> samples = byKey.get("");
            recordStatistics(samples);
            return WorkerResult.series(samples);
        }
        Map<String, WorkerResult> parts = new LinkedHashMap<>();
        for (Map.Entry<String, List<Sample>> e : byKey.entrySet()) {
            parts.put(e.getKey(), WorkerResult.series(e.getValue()));
        }
        return WorkerResult.named(parts);
    }

    private void recordStatistics(List<Sample> samples) {
        double sum = 0.0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (Sample s : samples) {
            double v = s.getValue();
            sum += v;
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        metadata.put("MEAN_VALUE", sum / samples.size());
        metadata.put("MIN_VALUE", min);
        metadata.put("MAX_VALUE", max);
    }
}
