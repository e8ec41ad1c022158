/*
 * Copyright © 2025 Door 10. All Rights Reserved.
 */
package com.door10.cvparser;

import org.slf4j.Logger;

import java.util.Locale;

/**
 * Verbosity threshold for the pipeline's diagnostic logging. Applied on top of whatever level the SLF4J backend
 * has configured, so a message is only written when both allow it.
 */
public enum LogLevel {

    ERROR, WARN, INFO, DEBUG;

    public static LogLevel fromOption(String value) {
        if (value == null || value.trim().isEmpty()) {
            return INFO;
        }
        try {
            return LogLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new ParserException(String.format("The value of '%s' must be one of: error, warn, info, debug; was: %s",
                Options.LOG_LEVEL, value), ex);
        }
    }

    public boolean allows(LogLevel level) {
        return level.ordinal() <= this.ordinal();
    }

    public boolean isDebugEnabled(Logger logger) {
        return allows(DEBUG) && logger.isDebugEnabled();
    }

    public boolean isInfoEnabled(Logger logger) {
        return allows(INFO) && logger.isInfoEnabled();
    }

    public boolean isWarnEnabled(Logger logger) {
        return allows(WARN) && logger.isWarnEnabled();
    }
}
