/*
 * Copyright © 2025 Door 10. All Rights Reserved.
 */
package com.door10.cvparser;

/**
 * Base class for every exception raised by the parser. Unchecked, so that callers only handle what they care
 * about; the pipeline itself recovers from adapter-level subclasses.
 */
public class ParserException extends RuntimeException {

    public ParserException(String message) {
        super(message);
    }

    public ParserException(String message, Throwable cause) {
        super(message, cause);
    }

}
