/*
 * Copyright © 2025 Door 10. All Rights Reserved.
 */
package com.door10.cvparser.core.extraction;

/**
 * Coarse quality score for extracted text, based only on how much text came out. Not a calibrated probability.
 */
public abstract class ConfidenceScorer {

    public static double score(String text) {
        final int length = text != null ? text.length() : 0;
        if (length < 100) {
            return 0.1;
        }
        if (length < 500) {
            return 0.3;
        }
        if (length < 1000) {
            return 0.6;
        }
        if (length < 2000) {
            return 0.8;
        }
        return 0.9;
    }

    private ConfidenceScorer() {
    }
}
