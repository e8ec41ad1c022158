/*
 * Copyright © 2025 Door 10. All Rights Reserved.
 */
package com.door10.cvparser.core.extraction;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a single extraction attempt. Immutable; the pipeline stamps the duration of the attempt via
 * {@link #withDuration(long)}, which returns a copy.
 */
public class ExtractionResult {

    private final String text;
    private final double confidence;
    private final Map<String, Object> metadata;
    private final String adapterName;
    private final long durationMs;

    public ExtractionResult(String text, double confidence, Map<String, Object> metadata, String adapterName) {
        this(text, confidence, metadata, adapterName, 0);
    }

    public ExtractionResult(String text, double confidence, Map<String, Object> metadata, String adapterName,
                            long durationMs) {
        if (confidence < 0 || confidence > 1) {
            throw new IllegalArgumentException("Confidence must be between 0 and 1; was: " + confidence);
        }
        this.text = text != null ? text : "";
        this.confidence = confidence;
        this.metadata = metadata != null ?
            Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) :
            Collections.emptyMap();
        this.adapterName = adapterName;
        this.durationMs = durationMs;
    }

    public ExtractionResult withDuration(long durationMs) {
        return new ExtractionResult(text, confidence, metadata, adapterName, durationMs);
    }

    public String getText() {
        return text;
    }

    public int getTextLength() {
        return text.length();
    }

    public double getConfidence() {
        return confidence;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public String getAdapterName() {
        return adapterName;
    }

    public long getDurationMs() {
        return durationMs;
    }

    @Override
    public String toString() {
        return String.format("%s[length=%d, confidence=%.2f, duration=%dms]", adapterName, text.length(), confidence, durationMs);
    }
}
