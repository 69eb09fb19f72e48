package com.netmeasure.util;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.format.DateTimeParseException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TimeFormatsTest {

    @Test
    void formatsWithMicrosecondsAndZ() {
        assertThat(TimeFormats.format(Instant.parse("2024-05-01T12:30:00.1234567Z")))
                .isEqualTo("2024-05-01T12:30:00.123456Z");
    }

    @Test
    void parsesWithOrWithoutZoneSuffixAsUtc() {
        Instant expected = Instant.parse("2024-05-01T12:30:00.5Z");

        assertThat(TimeFormats.parse("2024-05-01T12:30:00.500000Z")).isEqualTo(expected);
        assertThat(TimeFormats.parse("2024-05-01T12:30:00.5")).isEqualTo(expected);
        assertThat(TimeFormats.parse("2024-05-01T12:30:00")).isEqualTo(Instant.parse("2024-05-01T12:30:00Z"));
        assertThatThrownBy(() -> TimeFormats.parse("yesterday")).isInstanceOf(DateTimeParseException.class);
    }

    @Test
    void convertsEpochSeconds() {
        Instant instant = TimeFormats.fromEpochSeconds(1714566600.25);

        assertThat(instant).isEqualTo(Instant.parse("2024-05-01T12:30:00.250Z"));
        assertThat(TimeFormats.toEpochSeconds(instant)).isEqualTo(1714566600.25);
    }
}
