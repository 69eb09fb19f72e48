package com.netmeasure.result;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.core.json.JsonWriteFeature;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.netmeasure.model.ConfigurationException;
import com.netmeasure.util.TimeFormats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes result sets as versioned JSON documents, compressed according to the file
 * extension.
 */
@Component
public class ResultStore {
    private static final Logger log = LoggerFactory.getLogger(ResultStore.class);

    public static final int FORMAT_VERSION = 3;

    private static final TypeReference<LinkedHashMap<String, Object>> DOCUMENT = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public ResultStore(ObjectMapper objectMapper) {
        // NaN and Infinity are written as bare tokens and accepted on load.
        this.objectMapper = objectMapper.copy()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .configure(JsonWriteFeature.WRITE_NAN_AS_STRINGS.mappedFeature(), false)
                .configure(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS.mappedFeature(), true);
    }

    /**
     * Builds the document tree for a result set. Time-valued metadata is rendered as UTC strings.
     *
     * @param results result set
     * @return document with {@code version}, {@code metadata}, {@code x_values},
     *         {@code results} and {@code raw_values}
     */
    public Map<String, Object> serialize(ResultSet results) {
        Map<String, Object> metadata = new LinkedHashMap<>(results.getMetadata());
        for (String key : ResultSet.TIME_SETTINGS) {
            Object value = metadata.get(key);
            if (value instanceof Instant) {
                metadata.put(key, TimeFormats.format((Instant) value));
            }
        }
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("version", FORMAT_VERSION);
        doc.put("metadata", metadata);
        doc.put("x_values", results.getXValues());
        doc.put("results", results.getResults());
        doc.put("raw_values", results.getRawValues());
        return doc;
    }

    public String dumps(ResultSet results) {
        try {
            return objectMapper.writeValueAsString(serialize(results));
        } catch (JsonProcessingException e) {
            throw new ResultFormatException("Unable to serialize result set " + results.getName() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Writes a result set to a file.
     *
     * @param results result set
     * @param file target file; {@code .gz} and {@code .bz2} are compressed
     * @throws IOException if the file cannot be written
     */
    public void dump(ResultSet results, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        byte[] data = dumps(results).getBytes(StandardCharsets.UTF_8);
        try (OutputStream out = Compression.forFilename(file.getFileName().toString())
                .wrap(Files.newOutputStream(file))) {
            out.write(data);
        }
        log.info("Wrote results: file={}, points={}, series={}", file, results.size(), results.getSeriesNames().size());
    }

    /**
     * Writes a result set into a directory under its default file name.
     *
     * @return path of the written file
     */
    public Path dumpDir(ResultSet results, Path dir, String suffix) throws IOException {
        Path file = dir.resolve(results.defaultFilename(suffix));
        dump(results, file);
        return file;
    }

    /**
     * Loads a result file, migrating older format versions.
     *
     * @throws ResultFormatException if the file is unreadable, corrupt or of an unsupported version
     */
    public ResultSet load(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new ResultFormatException("Unable to read input file: '" + file + "'");
        }
        Map<String, Object> doc;
        try (InputStream in = Compression.forFilename(file.getFileName().toString()).wrap(Files.newInputStream(file))) {
            doc = objectMapper.readValue(in, DOCUMENT);
        } catch (IOException e) {
            throw new ResultFormatException("Unable to load JSON from '" + file + "': " + e.getMessage(), e);
        }
        return unserialize(doc, file.toString());
    }

    public ResultSet loads(String json) {
        Map<String, Object> doc;
        try {
            doc = objectMapper.readValue(json, DOCUMENT);
        } catch (JsonProcessingException e) {
            throw new ResultFormatException("Unable to load JSON data: " + e.getOriginalMessage(), e);
        }
        return unserialize(doc, "<string>");
    }

    /**
     * Builds a result set from a parsed document.
     *
     * @param doc parsed document; migrated in place when older than {@link #FORMAT_VERSION}
     * @param source file name or description used in error messages
     */
    public ResultSet unserialize(Map<String, Object> doc, String source) {
        if (doc == null) {
            throw new ResultFormatException("Empty result document: " + source);
        }
        int version = versionOf(doc);
        if (version > FORMAT_VERSION) {
            throw new ResultFormatException("File format version " + version + " of " + source
                    + " is too new; the highest supported version is " + FORMAT_VERSION);
        }
        checkStructure(doc, source);
        if (version < FORMAT_VERSION) {
            FormatMigration.migrate(version, doc, source);
        }

        Map<String, Object> metadata = ResultSet.copyOf((Map<?, ?>) doc.get("metadata"));
        List<Double> xValues = toDoubles((List<?>) doc.get("x_values"), source);
        if (metadata.get("TOTAL_LENGTH") == null && !xValues.isEmpty()) {
            metadata.put("TOTAL_LENGTH", xValues.stream().mapToDouble(Double::doubleValue).max().orElse(0.0));
        }
        for (String key : ResultSet.TIME_SETTINGS) {
            if (metadata.get(key) instanceof String value) {
                try {
                    metadata.put(key, TimeFormats.parse(value));
                } catch (DateTimeParseException e) {
                    throw new ResultFormatException("Invalid " + key + " timestamp '" + value + "' in " + source, e);
                }
            }
        }

        ResultSet results;
        try {
            results = new ResultSet(metadata);
        } catch (ConfigurationException e) {
            throw new ResultFormatException(e.getMessage() + " in " + source, e);
        }
        results.setXValues(xValues);
        for (Map.Entry<?, ?> e : ((Map<?, ?>) doc.get("results")).entrySet()) {
            try {
                results.addSeries(String.valueOf(e.getKey()), toDoubles((List<?>) e.getValue(), source));
            } catch (IllegalArgumentException ex) {
                throw new ResultFormatException(ex.getMessage() + " in " + source, ex);
            }
        }

        if (doc.get("raw_values") instanceof Map<?, ?> raw) {
            Map<String, List<Map<String, Object>>> rawValues = new LinkedHashMap<>();
            raw.forEach((k, v) -> {
                if (v instanceof List<?> records) {
                    rawValues.put(String.valueOf(k), ResultSet.recordsOf(records));
                }
            });
            results.setRawValues(rawValues);
        }
        return results;
    }

    /**
     * Checks the parts of a document that loading and migration rely on: metadata and results
     * are objects, every series is an array and every x value is a number.
     */
    private static void checkStructure(Map<String, Object> doc, String source) {
        if (!(doc.get("metadata") instanceof Map) || !(doc.get("x_values") instanceof List<?> xValues)
                || !(doc.get("results") instanceof Map<?, ?> series)) {
            throw new ResultFormatException("Malformed result document " + source
                    + ": metadata, x_values and results are required");
        }
        for (Object x : xValues) {
            if (!(x instanceof Number)) {
                throw new ResultFormatException("Invalid x value '" + x + "' in " + source);
            }
        }
        for (Map.Entry<?, ?> e : series.entrySet()) {
            if (!(e.getValue() instanceof List)) {
                throw new ResultFormatException("Series '" + e.getKey() + "' in " + source + " is not a list");
            }
        }
    }

    private static int versionOf(Map<String, Object> doc) {
        Object v = doc.get("version");
        if (v instanceof Number) {
            return ((Number) v).intValue();
        }
        if (v != null) {
            try {
                return Integer.parseInt(v.toString().trim());
            } catch (NumberFormatException e) {
                log.debug("Unparsable version field '{}', assuming version 1", v);
            }
        }
        return 1;
    }

    private static List<Double> toDoubles(List<?> values, String source) {
        List<Double> out = new ArrayList<>(values.size());
        for (Object v : values) {
            if (v == null) {
                out.add(null);
            } else if (v instanceof Number number) {
                out.add(number.doubleValue());
            } else {
                throw new ResultFormatException("Non-numeric value '" + v + "' in " + source);
            }
        }
        return out;
    }
}
