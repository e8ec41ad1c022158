/*
 * Copyright © 2025 Door 10. All Rights Reserved.
 */
package com.door10.cvparser.core;

import com.door10.cvparser.ParserException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when no adapter, and no remote delegation, produced a result. Carries one entry per failed attempt so
 * that a caller can report which methods were tried and why each failed.
 */
public class AllAdaptersFailedException extends ParserException {

    private final transient List<AdapterAttemptError> errors;

    public AllAdaptersFailedException(List<AdapterAttemptError> errors) {
        super(buildMessage(errors));
        this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
    }

    public List<AdapterAttemptError> getErrors() {
        return errors;
    }

    private static String buildMessage(List<AdapterAttemptError> errors) {
        return "All parsing methods failed. Errors: " + errors.stream()
            .map(AdapterAttemptError::toString)
            .collect(Collectors.joining(", "));
    }
}
