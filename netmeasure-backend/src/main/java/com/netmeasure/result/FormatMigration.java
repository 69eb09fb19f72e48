package com.netmeasure.result;

import com.netmeasure.model.ConfigurationException;
import com.netmeasure.transform.Transformers;
import com.netmeasure.transform.ValueTransformer;
import com.netmeasure.util.TimeFormats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Upgrades a parsed result document, one version at a time, to the current format.
 *
 * <p>Version 2 moved raw samples out of the series metadata into {@code raw_values}. Version 3
 * stores raw samples in the same units as the aligned series, so older raw values get their
 * series' transforms applied.
 */
final class FormatMigration {
    private static final Logger log = LoggerFactory.getLogger(FormatMigration.class);

    static final String FAKE_RAW_VALUES = "FAKE_RAW_VALUES";
    static final String RAW_VALUES_TRANSFORMED = "RAW_VALUES_TRANSFORMED";

    private FormatMigration() {
    }

    /**
     * Migrates {@code doc} in place from {@code version} to {@link ResultStore#FORMAT_VERSION}.
     * The document structure must already have been checked.
     */
    static void migrate(int version, Map<String, Object> doc, String source) {
        Map<String, Object> metadata = ResultSet.copyOf((Map<?, ?>) doc.get("metadata"));
        doc.put("metadata", metadata);
        if (version < 2) {
            toVersion2(doc, metadata, source);
        }
        if (version < 3) {
            toVersion3(doc, metadata, source);
        }
        doc.put("version", ResultStore.FORMAT_VERSION);
        log.debug("Migrated result document from version {}: source={}", version, source);
    }

    private static void toVersion2(Map<String, Object> doc, Map<String, Object> metadata, String source) {
        Map<String, Object> rawValues = new LinkedHashMap<>();

        if (metadata.get(ResultSet.SERIES_META) instanceof Map<?, ?> seriesMeta) {
            Map<String, Object> stripped = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : seriesMeta.entrySet()) {
                String name = String.valueOf(e.getKey());
                if (e.getValue() instanceof Map<?, ?> meta && meta.containsKey("RAW_VALUES")) {
                    Map<String, Object> copy = ResultSet.copyOf(meta);
                    rawValues.put(name, copy.remove("RAW_VALUES"));
                    stripped.put(name, copy);
                } else {
                    stripped.put(name, e.getValue());
                }
            }
            metadata.put(ResultSet.SERIES_META, stripped);
        }

        if (rawValues.isEmpty()) {
            double x0 = startSeconds(metadata, source);
            List<?> xValues = (List<?>) doc.get("x_values");
            for (Map.Entry<?, ?> e : ((Map<?, ?>) doc.get("results")).entrySet()) {
                List<?> values = (List<?>) e.getValue();
                List<Map<String, Object>> records = new ArrayList<>();
                for (int i = 0; i < Math.min(xValues.size(), values.size()); i++) {
                    Map<String, Object> record = new LinkedHashMap<>();
                    record.put("t", x0 + ((Number) xValues.get(i)).doubleValue());
                    record.put("val", values.get(i));
                    records.add(record);
                }
                rawValues.put(String.valueOf(e.getKey()), records);
            }
            metadata.put(FAKE_RAW_VALUES, true);
        }
        doc.put("raw_values", rawValues);

        if (metadata.containsKey("WRAPPER_VERSION")) {
            metadata.put("TOOL_VERSION", metadata.remove("WRAPPER_VERSION"));
        }
    }

    private static void toVersion3(Map<String, Object> doc, Map<String, Object> metadata, String source) {
        if (!(metadata.get(ResultSet.SERIES_META) instanceof Map<?, ?> seriesMeta)
                || !(doc.get("raw_values") instanceof Map<?, ?> raw)) {
            return;
        }
        Map<String, Object> rawValues = ResultSet.copyOf(raw);
        doc.put("raw_values", rawValues);
        boolean transformed = false;

        for (Map.Entry<?, ?> e : seriesMeta.entrySet()) {
            String name = String.valueOf(e.getKey());
            if (!(e.getValue() instanceof Map<?, ?> meta) || !(rawValues.get(name) instanceof List<?> records)) {
                continue;
            }
            if (!(meta.get("TRANSFORMS") instanceof List<?> names) || names.isEmpty()) {
                continue;
            }
            List<ValueTransformer> chain;
            try {
                chain = Transformers.resolve(toStrings(names));
            } catch (ConfigurationException ex) {
                throw new ResultFormatException("Cannot migrate raw values of series '" + name + "' in "
                        + source + ": " + ex.getMessage(), ex);
            }
            rawValues.put(name, Transformers.applyToRecords(chain, ResultSet.recordsOf(records)));
            transformed = true;
        }
        if (transformed) {
            metadata.put(RAW_VALUES_TRANSFORMED, true);
        }
    }

    private static double startSeconds(Map<String, Object> metadata, String source) {
        Object t0 = metadata.get(ResultSet.T0) != null ? metadata.get(ResultSet.T0) : metadata.get(ResultSet.TIME);
        if (t0 == null) {
            throw new ResultFormatException("Cannot synthesize raw values without T0 or TIME in " + source);
        }
        try {
            Instant start = t0 instanceof Instant instant ? instant : TimeFormats.parse(t0.toString());
            return TimeFormats.toEpochSeconds(start);
        } catch (DateTimeParseException e) {
            throw new ResultFormatException("Invalid start time '" + t0 + "' in " + source, e);
        }
    }

    private static List<String> toStrings(List<?> values) {
        List<String> out = new ArrayList<>(values.size());
        for (Object v : values) {
            out.add(String.valueOf(v));
        }
        return out;
    }
}
