package com.panorama.converter.cli.output;

import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;

/**
 * Runtime log level switch behind {@code --verbose}.
 */
public final class LogLevels {

    static final String BASE_LOGGER = "com.panorama.converter";

    private LogLevels() {
        // Utility class
    }

    public static void applyVerbose(boolean verbose) {
        if (!verbose) {
            return;
        }
        if (LoggerFactory.getLogger(BASE_LOGGER) instanceof Logger logger) {
            logger.setLevel(Level.DEBUG);
        }
    }
}
