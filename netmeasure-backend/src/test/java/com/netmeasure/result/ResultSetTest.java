package com.netmeasure.result;

import com.netmeasure.model.ConfigurationException;
import com.netmeasure.model.RunSettings;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResultSetTest {

    @Test
    void requiresName() {
        assertThatThrownBy(() -> new ResultSet(Map.of("TITLE", "x")))
                .isInstanceOf(ConfigurationException.class)
                .hasMessage("Missing name for result set");
    }

    @Test
    void appendKeepsEverySeriesAsLongAsXValues() {
        ResultSet rs = new ResultSet(Map.of(ResultSet.NAME, "rrul"));
        rs.createSeries(List.of("a", "b"));

        rs.appendDatapoint(0.0, Map.of("a", 1.0));
        rs.appendDatapoint(0.2, Map.of("a", 2.0, "b", 3.0));
        rs.createSeries(List.of("c"));
        rs.appendDatapoint(0.4, Map.of());

        assertThat(rs.size()).isEqualTo(3);
        assertThat(rs.series("a")).containsExactly(1.0, 2.0, null);
        assertThat(rs.series("b")).containsExactly(null, 3.0, null);
        assertThat(rs.series("c")).containsExactly(null, null, null);
        assertThat(rs.lastDatapoint("a")).isNull();
        assertThat(rs.lastDatapoint("b")).isNull();
    }

    @Test
    void unknownSeriesInDatapointIsRejectedWithoutSideEffects() {
        ResultSet rs = new ResultSet(Map.of(ResultSet.NAME, "rrul"));
        rs.createSeries(List.of("a"));
        rs.appendDatapoint(0.0, Map.of("a", 1.0));

        assertThatThrownBy(() -> rs.appendDatapoint(1.0, Map.of("a", 2.0, "zzz", 3.0)))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("zzz");
        assertThat(rs.getXValues()).containsExactly(0.0);
        assertThat(rs.series("a")).containsExactly(1.0);
    }

    @Test
    void missingSeriesReadsAsNulls() {
        ResultSet rs = new ResultSet(Map.of(ResultSet.NAME, "rrul"));
        rs.createSeries(List.of("a"));
        rs.appendDatapoint(0.0, Map.of("a", 1.0));
        rs.appendDatapoint(1.0, Map.of("a", 1.0));

        assertThat(rs.series("nope")).containsExactly(null, null);
        assertThat(rs.hasSeries("nope")).isFalse();
    }

    @Test
    void addSeriesMustMatchLength() {
        ResultSet rs = new ResultSet(Map.of(ResultSet.NAME, "rrul"));
        rs.setXValues(List.of(0.0, 1.0));

        rs.addSeries("ok", Arrays.asList(1.0, null));

        assertThat(rs.series("ok")).containsExactly(1.0, null);
        assertThatThrownBy(() -> rs.addSeries("short", List.of(1.0)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> rs.setXValues(List.of(3.0)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void seriesMetaIsAWritableCopyOfWhateverMetadataHolds() {
        ResultSet rs = new ResultSet(Map.of(ResultSet.NAME, "test"));
        rs.meta(ResultSet.SERIES_META, Map.of("a", Map.of("UNITS", "ms")));

        rs.getSeriesMeta().put("b", Map.of("UNITS", "Mbits/s"));

        assertThat(rs.meta("SERIES_META:a:UNITS")).isEqualTo("ms");
        assertThat(rs.meta("SERIES_META:b:UNITS")).isEqualTo("Mbits/s");
        assertThat(rs.getSeriesMeta()).isSameAs(rs.getMetadata().get(ResultSet.SERIES_META));

        rs.meta(ResultSet.SERIES_META, "not a map");

        assertThat(rs.getSeriesMeta()).isEmpty();
    }

    @Test
    void metaPathWalksNestedMapsAndLists() {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put(ResultSet.NAME, "rrul");
        meta.put("HOSTS", List.of("a.example", "b.example"));
        meta.put(ResultSet.SERIES_META, Map.of("Ping (ms)", Map.of("UNITS", "ms")));
        ResultSet rs = new ResultSet(meta);

        assertThat(rs.meta("SERIES_META:Ping (ms):UNITS")).isEqualTo("ms");
        assertThat(rs.meta("HOSTS:1")).isEqualTo("b.example");
        assertThat(rs.hasMeta("HOSTS:5")).isFalse();
        assertThatThrownBy(() -> rs.meta("SERIES_META:Other:UNITS")).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void seededFromRunSettings() {
        Instant time = Instant.parse("2024-05-01T12:30:00Z");
        RunSettings settings = RunSettings.builder().name("rrul").host("server.example").time(time).stepSize(0.5).build();

        ResultSet rs = ResultSet.fromSettings(settings);

        assertThat(rs.getName()).isEqualTo("rrul");
        assertThat(rs.meta("HOST")).isEqualTo("server.example");
        assertThat(rs.meta("STEP_SIZE")).isEqualTo(0.5);
        assertThat(rs.meta(ResultSet.TIME)).isEqualTo(time);
        assertThat(rs.getSeriesMeta()).isEmpty();
    }

    @Test
    void defaultFilenameIncludesTimeAndSanitizedTitle() {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put(ResultSet.NAME, "rrul");
        meta.put(ResultSet.TIME, Instant.parse("2024-05-01T12:30:00Z"));
        meta.put(ResultSet.TITLE, "cable modem/test 1");
        ResultSet rs = new ResultSet(meta);

        assertThat(rs.defaultFilename(".netmeasure.gz"))
                .isEqualTo("rrul-2024-05-01T123000.000000.cable_modem_test_1.netmeasure.gz");

        rs.meta(ResultSet.TITLE, null);
        assertThat(rs.defaultFilename(".netmeasure.gz")).isEqualTo("rrul-2024-05-01T123000.000000.netmeasure.gz");
    }
}
