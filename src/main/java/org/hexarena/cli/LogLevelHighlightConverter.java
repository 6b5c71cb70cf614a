package org.hexarena.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

/**
 * Logback converter that colors the level column of console output: errors bold red, warnings
 * yellow, debug and trace dimmed. Info stays uncolored so command output remains readable.
 */
public class LogLevelHighlightConverter extends CompositeConverter<ILoggingEvent> {

    private static final String RESET = "\u001B[0m";
    private static final String BOLD_RED = "\u001B[1;31m";
    private static final String YELLOW = "\u001B[33m";
    private static final String DIM = "\u001B[2m";

    @Override
    protected String transform(ILoggingEvent event, String in) {
        int level = event.getLevel().toInt();
        if (level >= Level.ERROR_INT) {
            return BOLD_RED + in + RESET;
        }
        if (level >= Level.WARN_INT) {
            return YELLOW + in + RESET;
        }
        return level < Level.INFO_INT ? DIM + in + RESET : in;
    }
}
