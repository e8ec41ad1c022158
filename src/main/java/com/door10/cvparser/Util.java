/*
 * Copyright © 2025 Door 10. All Rights Reserved.
 */
package com.door10.cvparser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public interface Util {

    /**
     * Intended for all non-debug logging where the class name doesn't matter and only adds complexity to the log
     * messages.
     */
    Logger MAIN_LOGGER = LoggerFactory.getLogger("com.door10.cvparser");

    static boolean hasText(String value) {
        return value != null && !value.trim().isEmpty();
    }
}
