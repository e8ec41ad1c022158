/*
 * Copyright © 2025 Door 10. All Rights Reserved.
 */
package com.door10.cvparser.core.extraction;

import com.door10.cvparser.Util;
import com.door10.cvparser.core.DocumentInputs;

import java.util.Map;

public abstract class ExtractionUtil {

    public static final String MIME_PDF = "application/pdf";
    public static final String MIME_DOCX = "application/vnd.openxmlformats-officedocument.wordprocessingml.document";
    public static final String MIME_DOC = "application/msword";
    public static final String MIME_TEXT = "text/plain";

    /**
     * Every extractor funnels its raw output through here so that all results are normalized and scored the
     * same way.
     */
    public static ExtractionResult newResult(String adapterName, String rawText, Map<String, Object> metadata) {
        String text = TextNormalizer.normalize(rawText);
        return new ExtractionResult(text, ConfidenceScorer.score(text), metadata, adapterName);
    }

    public static byte[] requireContent(String adapterName, DocumentInputs inputs) {
        if (!inputs.hasContent()) {
            throw new ExtractionException(adapterName, String.format("Unable to extract text; file: %s; cause: content is empty",
                inputs.getDisplayName()));
        }
        return inputs.getContent();
    }

    public static boolean isPdf(DocumentInputs inputs) {
        return inputs.isMimeType(MIME_PDF) || inputs.hasExtension("pdf");
    }

    static void putIfPresent(Map<String, Object> metadata, String key, String value) {
        if (Util.hasText(value)) {
            metadata.put(key, value.trim());
        }
    }

    private ExtractionUtil() {
    }
}
