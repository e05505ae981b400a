package org.prisma.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

/**
 * Colours the level column of the COLOR console appender: ERROR red, WARN yellow, INFO green,
 * DEBUG and TRACE faint.
 */
public class LogLevelHighlightConverter extends CompositeConverter<ILoggingEvent> {

    static final String RESET = "\u001B[0m";

    @Override
    protected String transform(ILoggingEvent event, String in) {
        return colorFor(event.getLevel()) + in + RESET;
    }

    static String colorFor(Level level) {
        if (level.isGreaterOrEqual(Level.ERROR)) {
            return "\u001B[31m";
        }
        if (level.isGreaterOrEqual(Level.WARN)) {
            return "\u001B[33m";
        }
        if (level.isGreaterOrEqual(Level.INFO)) {
            return "\u001B[32m";
        }
        return "\u001B[2m";
    }
}
