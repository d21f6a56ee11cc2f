package com.openforge.plantmate.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StartupInfoRunnerTest {

    @Test
    void longKeysKeepOnlyTheEnds() {
        assertThat(StartupInfoRunner.maskKey("sk-1234567890abcdef")).isEqualTo("sk-123...cdef");
    }

    @Test
    void shortOrMissingKeysAreHidden() {
        assertThat(StartupInfoRunner.maskKey("ollama")).isEqualTo("***");
        assertThat(StartupInfoRunner.maskKey(null)).isEqualTo("(not set)");
        assertThat(StartupInfoRunner.maskKey(" ")).isEqualTo("(not set)");
    }
}
