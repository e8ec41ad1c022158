/*
 * Copyright © 2025 Door 10. All Rights Reserved.
 */
package com.door10.cvparser;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Read-only view of the parser options. Built once at startup and handed to
 * {@link com.door10.cvparser.core.CvParsePipelineFactory}; nothing reads process-wide state instead.
 */
public class Context {

    private final Map<String, String> properties;

    public Context(Map<String, String> properties) {
        this.properties = properties != null ? new HashMap<>(properties) : new HashMap<>();
    }

    public final boolean hasOption(String... options) {
        return Stream.of(options)
            .anyMatch(option -> Util.hasText(properties.get(option)));
    }

    public final String getStringOption(String option) {
        return getStringOption(option, null);
    }

    public final String getStringOption(String option, String defaultValue) {
        return hasOption(option) ? properties.get(option).trim() : defaultValue;
    }

    public final long getNumericOption(String optionName, long defaultValue, long minimumValue) {
        try {
            long value = hasOption(optionName) ?
                Long.parseLong(getStringOption(optionName)) :
                defaultValue;
            if (value != defaultValue && value < minimumValue) {
                throw new ParserException(String.format("The value of '%s' must be %d or greater.", optionName, minimumValue));
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new ParserException(String.format("The value of '%s' must be numeric.", optionName), ex);
        }
    }

    public final boolean getBooleanOption(String option, boolean defaultValue) {
        if (hasOption(option)) {
            String value = getStringOption(option);
            Objects.requireNonNull(value);
            return Boolean.parseBoolean(value);
        }
        return defaultValue;
    }

    public final LogLevel getLogLevel() {
        return LogLevel.fromOption(getStringOption(Options.LOG_LEVEL));
    }
}
