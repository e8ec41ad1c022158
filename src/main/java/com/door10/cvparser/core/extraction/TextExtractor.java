/*
 * Copyright © 2025 Door 10. All Rights Reserved.
 */
package com.door10.cvparser.core.extraction;

import com.door10.cvparser.core.DocumentInputs;

/**
 * One strategy for turning a file into text, typically wrapping a single document-decoding library. The pipeline
 * tries implementations in ascending {@link #getPriority()} order.
 */
public interface TextExtractor {

    /**
     * @return the name recorded on results and errors produced by this extractor
     */
    String getName();

    /**
     * @return lower values are tried first
     */
    int getPriority();

    /**
     * Cheap check based on the declared MIME type, the filename, and configuration. Must not decode the content.
     *
     * @param inputs
     * @return true if {@link #extract(DocumentInputs)} should be attempted
     */
    boolean canHandle(DocumentInputs inputs);

    /**
     * @param inputs
     * @return normalized text with a confidence derived from its length
     * @throws ExtractionException if the content cannot be decoded; a result of poor quality is instead returned
     *                             with a low confidence
     */
    ExtractionResult extract(DocumentInputs inputs);
}
