package org.transitlog.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

/**
 * Logback converter that colors the level column of console output.
 * <p>
 * ERROR is bold red, WARN yellow, INFO green, DEBUG cyan; TRACE is left uncolored.
 * Registered in {@code logback.xml} as {@code %levelColor}.
 */
public class LogLevelHighlightConverter extends CompositeConverter<ILoggingEvent> {

    private static final String RESET = "\u001B[0m";
    private static final String BOLD_RED = "\u001B[1;31m";
    private static final String YELLOW = "\u001B[33m";
    private static final String GREEN = "\u001B[32m";
    private static final String CYAN = "\u001B[36m";

    @Override
    protected String transform(ILoggingEvent event, String in) {
        String color = colorFor(event.getLevel());
        return color == null ? in : color + in + RESET;
    }

    static String colorFor(Level level) {
        return switch (level.toInt()) {
            case Level.ERROR_INT -> BOLD_RED;
            case Level.WARN_INT -> YELLOW;
            case Level.INFO_INT -> GREEN;
            case Level.DEBUG_INT -> CYAN;
            default -> null;
        };
    }
}
