/*
 * Copyright © 2025 Door 10. All Rights Reserved.
 */
package com.door10.cvparser.core.extraction;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Picks the best of several extraction results by sequential tie-break rather than a weighted score, so that a
 * long but garbled result cannot outrank a short clean one on length alone.
 * <ol>
 *     <li>Higher confidence wins, unless the two differ by 0.1 or less.</li>
 *     <li>Longer text wins, unless the two differ by 100 characters or less.</li>
 *     <li>Otherwise the faster attempt wins.</li>
 * </ol>
 * The sort is stable, so fully tied results keep their attempt order.
 */
public abstract class BestResultSelector {

    static final double CONFIDENCE_TOLERANCE = 0.1;

    // Absorbs rounding, so that e.g. 0.8 - 0.7 counts as a difference of exactly 0.1.
    private static final double EPSILON = 1e-9;
    static final int LENGTH_TOLERANCE = 100;

    static final Comparator<ExtractionResult> COMPARATOR = (a, b) -> {
        double confidenceDifference = a.getConfidence() - b.getConfidence();
        if (Math.abs(confidenceDifference) > CONFIDENCE_TOLERANCE + EPSILON) {
            return Double.compare(b.getConfidence(), a.getConfidence());
        }
        int lengthDifference = a.getTextLength() - b.getTextLength();
        if (Math.abs(lengthDifference) > LENGTH_TOLERANCE) {
            return Integer.compare(b.getTextLength(), a.getTextLength());
        }
        return Long.compare(a.getDurationMs(), b.getDurationMs());
    };

    public static ExtractionResult selectBest(List<ExtractionResult> results) {
        if (results == null || results.isEmpty()) {
            throw new IllegalArgumentException("At least one extraction result is required to select the best one.");
        }
        List<ExtractionResult> sorted = new ArrayList<>(results);
        sorted.sort(COMPARATOR);
        return sorted.get(0);
    }

    private BestResultSelector() {
    }
}
