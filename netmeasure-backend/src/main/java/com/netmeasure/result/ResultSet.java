package com.netmeasure.result;

import com.netmeasure.model.ConfigurationException;
import com.netmeasure.model.RunSettings;
import com.netmeasure.util.TimeFormats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * Aligned data set produced by a run: x values, named series, raw samples and metadata.
 *
 * <p>Every series is exactly as long as the x values at all times. Datapoints are appended for
 * all series at once; a series missing from a datapoint gets a null entry.
 */
public class ResultSet {
    private static final Logger log = LoggerFactory.getLogger(ResultSet.class);

    public static final String SERIES_META = "SERIES_META";
    public static final String TEST_PARAMETERS = "TEST_PARAMETERS";
    public static final String FAILED_WORKERS = "FAILED_WORKERS";
    public static final String T0 = "T0";
    public static final String NAME = "NAME";
    public static final String TIME = "TIME";
    public static final String TITLE = "TITLE";
    public static final String DATA_FILENAME = "DATA_FILENAME";

    /** Metadata fields held as {@link Instant} and persisted as UTC timestamps. */
    public static final List<String> TIME_SETTINGS = List.of("TIME", "BATCH_TIME", "T0");

    static final int MAX_FILENAME_LENGTH = 250;

    private final Map<String, Object> metadata;
    private final List<Double> xValues = new ArrayList<>();
    private final Map<String, List<Double>> results = new LinkedHashMap<>();
    private Map<String, List<Map<String, Object>>> rawValues = new LinkedHashMap<>();
    private Map<String, Object> seriesMeta;

    /**
     * Creates an empty result set.
     *
     * @param metadata initial metadata; must contain {@code NAME}
     * @throws ConfigurationException if the name is missing
     */
    public ResultSet(Map<String, Object> metadata) {
        this.metadata = new LinkedHashMap<>(metadata == null ? Map.of() : metadata);
        Object name = this.metadata.get(NAME);
        if (name == null || name.toString().isBlank()) {
            throw new ConfigurationException("Missing name for result set");
        }
        if (this.metadata.get(TIME) == null) {
            this.metadata.put(TIME, Instant.now());
        }
        if (!this.metadata.containsKey(SERIES_META)) {
            this.metadata.put(SERIES_META, new LinkedHashMap<String, Object>());
        }
        if (!this.metadata.containsKey(TEST_PARAMETERS)) {
            this.metadata.put(TEST_PARAMETERS, new LinkedHashMap<String, Object>());
        }
    }

    public static ResultSet fromSettings(RunSettings settings) {
        return new ResultSet(settings.toRecordedMetadata());
    }

    /**
     * Looks up a metadata value. Keys that are not present verbatim are walked as a
     * {@code :}-separated path, where numeric parts index into lists.
     *
     * @param path key or path such as {@code SERIES_META:ping:UNITS}
     * @return the value, possibly null
     * @throws NoSuchElementException if the path does not resolve
     */
    public Object meta(String path) {
        if (metadata.containsKey(path)) {
            return metadata.get(path);
        }
        String[] parts = path.split(":");
        Object data = metadata.get(parts[0]);
        if (data == null && !metadata.containsKey(parts[0])) {
            throw new NoSuchElementException("No metadata for '" + path + "'");
        }
        for (int i = 1; i < parts.length; i++) {
            String part = parts[i];
            if (data instanceof Map) {
                Map<?, ?> map = (Map<?, ?>) data;
                if (!map.containsKey(part)) {
                    throw new NoSuchElementException("No metadata for '" + path + "'");
                }
                data = map.get(part);
            } else if (data instanceof List) {
                List<?> list = (List<?>) data;
                try {
                    data = list.get(Integer.parseInt(part));
                } catch (NumberFormatException | IndexOutOfBoundsException e) {
                    throw new NoSuchElementException("No metadata for '" + path + "'");
                }
            } else {
                throw new NoSuchElementException("No metadata for '" + path + "'");
            }
        }
        return data;
    }

    public void meta(String key, Object value) {
        metadata.put(key, value);
    }

    public boolean hasMeta(String path) {
        try {
            meta(path);
            return true;
        } catch (NoSuchElementException e) {
            return false;
        }
    }

    /**
     * Returns the live metadata map.
     */
    public Map<String, Object> getMetadata() {
        return metadata;
    }

    /**
     * Returns per-series metadata, creating the nested map if needed.
     */
    public Map<String, Object> getSeriesMeta() {
        Object value = metadata.get(SERIES_META);
        if (value != seriesMeta) {
            seriesMeta = value instanceof Map<?, ?> map ? copyOf(map) : new LinkedHashMap<>();
            metadata.put(SERIES_META, seriesMeta);
        }
        return seriesMeta;
    }

    public List<Double> getXValues() {
        return Collections.unmodifiableList(xValues);
    }

    /**
     * Sets the x values of an empty result set.
     *
     * @throws IllegalStateException if x values were already set
     */
    public void setXValues(List<Double> values) {
        if (!xValues.isEmpty() || !results.isEmpty()) {
            throw new IllegalStateException("x values can only be set on an empty result set");
        }
        xValues.addAll(values);
    }

    /**
     * Declares series. Series that already exist are kept; new ones are padded with nulls up to
     * the current length.
     */
    public void createSeries(Collection<String> names) {
        for (String name : names) {
            if (!results.containsKey(name)) {
                results.put(name, new ArrayList<>(Collections.nCopies(xValues.size(), null)));
            }
        }
    }

    /**
     * Appends one datapoint across all declared series.
     *
     * @param x x position of the datapoint
     * @param data values by series name; series absent from the map get null
     * @throws ConfigurationException if the datapoint names an undeclared series
     */
    public void appendDatapoint(double x, Map<String, Double> data) {
        Set<String> unknown = new LinkedHashSet<>(data.keySet());
        unknown.removeAll(results.keySet());
        if (!unknown.isEmpty()) {
            throw new ConfigurationException("Unexpected data point(s): " + unknown);
        }
        xValues.add(x);
        for (Map.Entry<String, List<Double>> e : results.entrySet()) {
            e.getValue().add(data.get(e.getKey()));
        }
    }

    /**
     * Adds or replaces a complete series.
     *
     * @throws IllegalArgumentException if the length does not match the x values
     */
    public void addSeries(String name, List<Double> values) {
        if (values.size() != xValues.size()) {
            throw new IllegalArgumentException("Series '" + name + "' has " + values.size()
                    + " values, expected " + xValues.size());
        }
        results.put(name, new ArrayList<>(values));
    }

    public boolean hasSeries(String name) {
        return results.containsKey(name);
    }

    /**
     * Returns a series; an unknown series reads as all nulls.
     */
    public List<Double> series(String name) {
        List<Double> data = results.get(name);
        if (data == null) {
            log.warn("Missing data points for series '{}'", name);
            return Collections.nCopies(xValues.size(), null);
        }
        return Collections.unmodifiableList(data);
    }

    /**
     * @return the most recent value of a series, or null if there is none
     */
    public Double lastDatapoint(String name) {
        List<Double> data = results.get(name);
        if (data == null || data.isEmpty()) {
            return null;
        }
        return data.get(data.size() - 1);
    }

    public List<String> getSeriesNames() {
        return List.copyOf(results.keySet());
    }

    public Map<String, List<Double>> getResults() {
        Map<String, List<Double>> out = new LinkedHashMap<>();
        results.forEach((k, v) -> out.put(k, Collections.unmodifiableList(v)));
        return Collections.unmodifiableMap(out);
    }

    public Map<String, List<Map<String, Object>>> getRawValues() {
        return rawValues;
    }

    public void setRawValues(Map<String, List<Map<String, Object>>> rawValues) {
        this.rawValues = new LinkedHashMap<>(rawValues == null ? Map.of() : rawValues);
    }

    public int size() {
        return xValues.size();
    }

    public boolean isEmpty() {
        return xValues.isEmpty();
    }

    public String getName() {
        return String.valueOf(metadata.get(NAME));
    }

    /**
     * Builds the default data file name: {@code NAME-TIME[.TITLE]suffix}.
     *
     * @param suffix file suffix including the compression extension
     * @return file name
     */
    public String defaultFilename(String suffix) {
        Object configured = metadata.get(DATA_FILENAME);
        if (configured != null && !configured.toString().isBlank()) {
            String name = configured.toString();
            return name.endsWith(suffix) ? name : name + suffix;
        }
        Object time = metadata.get(TIME);
        String stamp = time instanceof Instant ? TimeFormats.formatForFilename((Instant) time)
                : String.valueOf(time).replace(":", "");
        String base = getName() + "-" + stamp;
        Object title = metadata.get(TITLE);
        if (title != null && !title.toString().isBlank()) {
            int room = MAX_FILENAME_LENGTH - base.length() - suffix.length() - 1;
            String clean = title.toString().replaceAll("[^A-Za-z0-9]", "_");
            if (room > 0) {
                return base + "." + clean.substring(0, Math.min(room, clean.length())) + suffix;
            }
        }
        return base + suffix;
    }

    /**
     * Copies a parsed JSON object into a string-keyed map.
     */
    static Map<String, Object> copyOf(Map<?, ?> map) {
        Map<String, Object> out = new LinkedHashMap<>();
        map.forEach((k, v) -> out.put(String.valueOf(k), v));
        return out;
    }

    /**
     * Copies the object entries of a parsed JSON array of raw records; other entries are dropped.
     */
    static List<Map<String, Object>> recordsOf(List<?> values) {
        List<Map<String, Object>> out = new ArrayList<>(values.size());
        for (Object v : values) {
            if (v instanceof Map<?, ?> record) {
                out.add(copyOf(record));
            }
        }
        return out;
    }

    @Override
    public String toString() {
        return "ResultSet(" + getName() + ", " + xValues.size() + " points, series=" + results.keySet() + ")";
    }
}
