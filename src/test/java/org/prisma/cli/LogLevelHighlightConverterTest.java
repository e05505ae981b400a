package org.prisma.cli;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import ch.qos.logback.classic.Level;

@Tag("unit")
class LogLevelHighlightConverterTest {

    @Test
    void everyLevelGetsItsOwnColour() {
        assertThat(LogLevelHighlightConverter.colorFor(Level.ERROR)).isEqualTo("\u001B[31m");
        assertThat(LogLevelHighlightConverter.colorFor(Level.WARN)).isEqualTo("\u001B[33m");
        assertThat(LogLevelHighlightConverter.colorFor(Level.INFO)).isEqualTo("\u001B[32m");
        assertThat(LogLevelHighlightConverter.colorFor(Level.DEBUG))
            .isEqualTo(LogLevelHighlightConverter.colorFor(Level.TRACE))
            .isEqualTo("\u001B[2m");
    }
}
