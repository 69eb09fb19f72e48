package com.netmeasure.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class GlobsTest {

    @Test
    void expandsPatternsInOrderWithoutDuplicates() {
        List<String> names = List.of("TCP upload::1", "TCP upload::2", "TCP download", "Ping (ms)", "avg");

        assertThat(Globs.expand(List.of("TCP upload*", "Ping (ms)", "TCP*"), names, List.of("avg")))
                .containsExactly("TCP upload::1", "TCP upload::2", "Ping (ms)", "TCP download");
        assertThat(Globs.expand(List.of("*"), names, List.of("avg"))).doesNotContain("avg").hasSize(4);
        assertThat(Globs.expand(List.of("missing"), names, List.of())).isEmpty();
    }
}
