package com.netmeasure.result;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ResultStoreTest {

    private final ResultStore store = new ResultStore(new ObjectMapper());

    @TempDir
    Path tempDir;

    @ParameterizedTest
    @CsvSource({
            "run.netmeasure.gz, 1f8b",
            "run.netmeasure.bz2, 425a68",
            "run.json, 7b"
    })
    void dumpAndLoadPreserveData(String fileName, String magic) throws Exception {
        ResultSet original = sample();
        Path file = tempDir.resolve(fileName);

        store.dump(original, file);
        ResultSet loaded = store.load(file);

        assertThat(hex(Files.readAllBytes(file), magic.length() / 2)).isEqualTo(magic);
        assertThat(loaded.getXValues()).isEqualTo(original.getXValues());
        assertThat(loaded.getResults()).isEqualTo(original.getResults());
        assertThat(loaded.getRawValues()).isEqualTo(original.getRawValues());
        assertThat(loaded.meta(ResultSet.TIME)).isEqualTo(original.meta(ResultSet.TIME));
        assertThat(loaded.meta("SERIES_META:Ping:UNITS")).isEqualTo("ms");
    }

    @Test
    void writesSortedIndentedJsonWithUtcTimestamps() {
        String json = store.dumps(sample());

        assertThat(json).contains("\"TIME\" : \"2024-05-01T12:30:00.123456Z\"");
        assertThat(json).contains("\"version\" : 3");
        assertThat(json.indexOf("\"metadata\"")).isLessThan(json.indexOf("\"raw_values\""));
        assertThat(json.indexOf("\"raw_values\"")).isLessThan(json.indexOf("\"results\""));
        assertThat(json.indexOf("\"results\"")).isLessThan(json.indexOf("\"version\""));
        assertThat(json).contains("\n  \"metadata\"");
    }

    @Test
    void dumpDirUsesDefaultFileName() throws Exception {
        Path file = store.dumpDir(sample(), tempDir.resolve("out"), ".netmeasure.gz");

        assertThat(file.getFileName().toString()).isEqualTo("ping-2024-05-01T123000.123456.netmeasure.gz");
        assertThat(store.load(file).getName()).isEqualTo("ping");
    }

    @Test
    void newerVersionIsRejected() throws Exception {
        Path file = tempDir.resolve("future.json");
        Files.writeString(file, """
                {"version": 4, "metadata": {"NAME": "x"}, "x_values": [], "results": {}, "raw_values": {}}
                """);

        assertThatThrownBy(() -> store.load(file))
                .isInstanceOf(ResultFormatException.class)
                .hasMessageContaining("version 4")
                .hasMessageContaining("future.json");
    }

    @Test
    void corruptFileIsAFormatError() throws Exception {
        Path file = tempDir.resolve("broken.json.gz");
        Files.write(file, "not gzip".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> store.load(file))
                .isInstanceOf(ResultFormatException.class)
                .hasMessageContaining("broken.json.gz");
        assertThatThrownBy(() -> store.load(tempDir.resolve("missing.json")))
                .isInstanceOf(ResultFormatException.class);
    }

    @Test
    void seriesLengthMismatchIsAFormatError() {
        String json = """
                {"version": 3, "metadata": {"NAME": "x", "TIME": "2024-05-01T12:00:00.000000Z"},
                 "x_values": [0, 1], "results": {"a": [1]}, "raw_values": {}}
                """;

        assertThatThrownBy(() -> store.loads(json))
                .isInstanceOf(ResultFormatException.class)
                .hasMessageContaining("'a'");
    }

    @Test
    void nonFiniteValuesSurviveDumpAndLoad() {
        ResultSet rs = sample();
        rs.appendDatapoint(1.0, Map.of("Ping", Double.NaN, "Upload", Double.POSITIVE_INFINITY));
        rs.setRawValues(Map.of("Ping", List.of(Map.of("t", 1714566601.1, "val", Double.NaN))));

        String json = store.dumps(rs);
        ResultSet loaded = store.loads(json);

        assertThat(json).contains("NaN").doesNotContain("\"NaN\"");
        assertThat(loaded.series("Ping")).containsExactly(20.5, 21.0, Double.NaN);
        assertThat(loaded.series("Upload")).containsExactly(null, 93.25, Double.POSITIVE_INFINITY);
        assertThat(loaded.getRawValues().get("Ping").get(0).get("val")).isEqualTo(Double.NaN);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "{\"metadata\": {\"NAME\": \"x\", \"TIME\": \"2014-03-01T10:00:00\"}, \"x_values\": [0.0], \"results\": {\"a\": 5}}",
            "{\"metadata\": {\"NAME\": \"x\", \"TIME\": \"2014-03-01T10:00:00\"}, \"x_values\": [0.0, null], \"results\": {\"a\": [1, 2]}}",
            "{\"metadata\": {\"NAME\": \"x\", \"TIME\": \"2014-03-01T10:00:00\"}, \"x_values\": [\"0\"], \"results\": {\"a\": [1]}}",
            "{\"version\": 2, \"metadata\": {\"NAME\": \"x\"}, \"x_values\": [0.0], \"results\": {\"a\": {\"b\": 1}}}"
    })
    void corruptOlderDocumentIsAFormatError(String json) {
        assertThatThrownBy(() -> store.loads(json))
                .isInstanceOf(ResultFormatException.class)
                .hasMessageContaining("<string>");
    }

    @Test
    void versionOneWithoutRawValuesGetsSynthesizedOnes() {
        String json = """
                {"metadata": {"NAME": "tcp_upload", "TIME": "2014-03-01T10:00:00.000000",
                              "NETPERF_WRAPPER_VERSION": "0.5", "WRAPPER_VERSION": "0.5"},
                 "x_values": [0.0, 0.5, 1.0],
                 "results": {"Upload": [10.0, null, 12.0]}}
                """;

        ResultSet rs = store.loads(json);

        double x0 = Instant.parse("2014-03-01T10:00:00Z").getEpochSecond();
        List<Map<String, Object>> raw = rs.getRawValues().get("Upload");
        assertThat(raw).hasSize(3);
        assertThat(raw.get(1)).containsEntry("t", x0 + 0.5);
        assertThat(raw.get(1).get("val")).isNull();
        assertThat(rs.meta("FAKE_RAW_VALUES")).isEqualTo(true);
        assertThat(rs.meta("TOOL_VERSION")).isEqualTo("0.5");
        assertThat(rs.hasMeta("WRAPPER_VERSION")).isFalse();
        assertThat(rs.meta("TOTAL_LENGTH")).isEqualTo(1.0);
        assertThat(rs.meta(ResultSet.TIME)).isEqualTo(Instant.parse("2014-03-01T10:00:00Z"));
    }

    @Test
    void versionOneRawValuesMoveOutOfSeriesMetadata() {
        String json = """
                {"version": 1,
                 "metadata": {"NAME": "ping", "TIME": "2014-03-01T10:00:00Z",
                              "SERIES_META": {"Ping": {"UNITS": "ms", "RAW_VALUES": [{"t": 1.5, "val": 20.0}]}}},
                 "x_values": [0.0], "results": {"Ping": [20.0]}}
                """;

        ResultSet rs = store.loads(json);

        assertThat(rs.getRawValues().get("Ping")).containsExactly(Map.of("t", 1.5, "val", 20.0));
        assertThat(rs.hasMeta("SERIES_META:Ping:RAW_VALUES")).isFalse();
        assertThat(rs.hasMeta("FAKE_RAW_VALUES")).isFalse();
    }

    @Test
    void versionTwoRawValuesGetSeriesTransformsApplied() {
        String json = """
                {"version": 2,
                 "metadata": {"NAME": "rrul", "TIME": "2020-01-01T00:00:00.000000Z",
                              "SERIES_META": {"Ping": {"TRANSFORMS": ["s_to_ms"]}, "Upload": {}}},
                 "x_values": [0.0],
                 "results": {"Ping": [20.0], "Upload": [5.0]},
                 "raw_values": {"Ping": [{"t": 1.0, "val": 0.02}], "Upload": [{"t": 1.0, "val": 5.0}]}}
                """;

        ResultSet rs = store.loads(json);

        assertThat((Double) rs.getRawValues().get("Ping").get(0).get("val")).isCloseTo(20.0, within(1e-9));
        assertThat(rs.getRawValues().get("Upload").get(0)).containsEntry("val", 5.0);
        assertThat(rs.meta("RAW_VALUES_TRANSFORMED")).isEqualTo(true);
    }

    private static ResultSet sample() {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put(ResultSet.NAME, "ping");
        meta.put(ResultSet.TIME, Instant.parse("2024-05-01T12:30:00.123456Z"));
        meta.put("STEP_SIZE", 0.5);
        ResultSet rs = new ResultSet(meta);
        rs.getSeriesMeta().put("Ping", new LinkedHashMap<>(Map.of("UNITS", "ms")));
        rs.createSeries(List.of("Ping", "Upload"));
        rs.appendDatapoint(0.0, Map.of("Ping", 20.5));
        rs.appendDatapoint(0.5, Map.of("Ping", 21.0, "Upload", 93.25));
        rs.setRawValues(Map.of("Ping", List.of(
                Map.of("t", 1714566600.1, "val", 20.5),
                Map.of("t", 1714566600.6, "val", 21.0))));
        rs.addSeries("Computed", Arrays.asList(null, 1.0));
        return rs;
    }

    private static String hex(byte[] data, int length) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < length; i++) {
            sb.append(String.format("%02x", data[i]));
        }
        return sb.toString();
    }
}
