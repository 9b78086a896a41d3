package org.starledger.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

/**
 * Colors the level column of the {@code STDOUT} appender, registered as {@code %levelColor} in
 * {@code logback.xml}.
 * <p>
 * Import progress is logged at INFO, skipped processors and dropped facts at WARN and failed snapshots at
 * ERROR, so those three stand out; store internals at DEBUG are dimmed. The {@code STDOUT_PLAIN} appender
 * (logging format {@code PLAIN}) does not use this converter.
 */
public class LogLevelHighlightConverter extends CompositeConverter<ILoggingEvent> {

    static final String ANSI_RESET = "\u001B[0m";
    static final String ANSI_RED = "\u001B[31m";
    static final String ANSI_YELLOW = "\u001B[33m";
    static final String ANSI_BLUE = "\u001B[34m";
    static final String ANSI_DIM = "\u001B[2m";

    @Override
    protected String transform(ILoggingEvent event, String in) {
        return highlight(event.getLevel(), in);
    }

    static String highlight(Level level, String text) {
        String color = switch (level.toInt()) {
            case Level.ERROR_INT -> ANSI_RED;
            case Level.WARN_INT -> ANSI_YELLOW;
            case Level.INFO_INT -> ANSI_BLUE;
            case Level.DEBUG_INT, Level.TRACE_INT -> ANSI_DIM;
            default -> null;
        };
        return color == null ? text : color + text + ANSI_RESET;
    }
}
