package com.example.memocache.loadgen;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class LoadGeneratorTest {

    @Test
    @DisplayName("summary reports count, mean and max")
    void summarizesLatencies() {
        String summary = LoadGenerator.summarize(List.of(10.0, 20.0, 30.0, 40.0));

        assertThat(summary).startsWith("Stats: N=4, Avg=25.00ms").endsWith("Max=40.00ms");
    }

    @Test
    @DisplayName("summary of an empty run says so")
    void emptyRun() {
        assertThat(LoadGenerator.summarize(List.of())).isEqualTo("Stats: no successful requests");
    }
}
