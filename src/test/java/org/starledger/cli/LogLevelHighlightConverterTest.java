package org.starledger.cli;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class LogLevelHighlightConverterTest {

    @Test
    void importantLevelsAreColored() {
        assertThat(LogLevelHighlightConverter.highlight(Level.ERROR, "ERROR"))
                .isEqualTo("\u001B[31mERROR\u001B[0m");
        assertThat(LogLevelHighlightConverter.highlight(Level.WARN, "WARN"))
                .isEqualTo("\u001B[33mWARN\u001B[0m");
        assertThat(LogLevelHighlightConverter.highlight(Level.INFO, "INFO"))
                .isEqualTo("\u001B[34mINFO\u001B[0m");
    }

    @Test
    void debugOutputIsDimmed() {
        assertThat(LogLevelHighlightConverter.highlight(Level.DEBUG, "DEBUG"))
                .startsWith(LogLevelHighlightConverter.ANSI_DIM)
                .endsWith(LogLevelHighlightConverter.ANSI_RESET);
        assertThat(LogLevelHighlightConverter.highlight(Level.TRACE, "TRACE")).contains("TRACE");
    }

    @Test
    void unknownLevelsStayPlain() {
        assertThat(LogLevelHighlightConverter.highlight(Level.OFF, "OFF")).isEqualTo("OFF");
    }
}
